package work.lcod.crosscheck.mapping;

import java.util.Locale;
import java.util.Optional;

/**
 * Named node types of tree-sitter-kotlin with their canonical counterpart. A kind
 * without a target is transparent: its children are spliced into the parent.
 * The grammar name is the lower-cased constant name.
 */
public enum CandidateKind {
    // Top level
    SOURCE_FILE(Canonical.KT_FILE),
    SHEBANG_LINE,
    FILE_ANNOTATION(Canonical.FILE_ANNOTATION_LIST),
    PACKAGE_HEADER(Canonical.PACKAGE_DIRECTIVE),
    IMPORT_LIST(Canonical.IMPORT_LIST),
    IMPORT_HEADER(Canonical.IMPORT_DIRECTIVE),
    IMPORT_ALIAS(Canonical.IMPORT_ALIAS),
    WILDCARD_IMPORT,
    POINT_STAR,

    // Declarations
    CLASS_DECLARATION(Canonical.CLASS),
    INTERFACE_DECLARATION(Canonical.CLASS),
    ENUM_CLASS_DECLARATION(Canonical.CLASS),
    CLASS_BODY(Canonical.CLASS_BODY),
    ENUM_CLASS_BODY(Canonical.CLASS_BODY),
    ENUM_ENTRY(Canonical.ENUM_ENTRY),
    CLASS_PARAMETER(Canonical.VALUE_PARAMETER),
    COMPANION_OBJECT(Canonical.OBJECT_DECLARATION),
    OBJECT_DECLARATION(Canonical.OBJECT_DECLARATION),
    OBJECT_LITERAL(Canonical.OBJECT_LITERAL),
    TYPE_ALIAS(Canonical.TYPEALIAS),
    ANONYMOUS_INITIALIZER(Canonical.CLASS_INITIALIZER),
    PRIMARY_CONSTRUCTOR(Canonical.PRIMARY_CONSTRUCTOR),
    SECONDARY_CONSTRUCTOR(Canonical.SECONDARY_CONSTRUCTOR),
    CONSTRUCTOR_DELEGATION_CALL(Canonical.CONSTRUCTOR_DELEGATION_CALL),
    CONSTRUCTOR_INVOCATION,
    DELEGATION_SPECIFIER,
    EXPLICIT_DELEGATION(Canonical.DELEGATED_SUPER_TYPE_ENTRY),

    // Functions and properties
    FUNCTION_DECLARATION(Canonical.FUN),
    ANONYMOUS_FUNCTION(Canonical.FUN),
    FUNCTION_BODY(Canonical.BLOCK),
    FUNCTION_VALUE_PARAMETERS(Canonical.VALUE_PARAMETER_LIST),
    FUNCTION_VALUE_PARAMETER,
    PARAMETER(Canonical.VALUE_PARAMETER),
    PARAMETER_WITH_OPTIONAL_TYPE(Canonical.VALUE_PARAMETER),
    PARAMETERS_WITH_OPTIONAL_TYPE(Canonical.VALUE_PARAMETER_LIST),
    PROPERTY_DECLARATION(Canonical.PROPERTY),
    PROPERTY_DELEGATE(Canonical.PROPERTY_DELEGATE),
    GETTER(Canonical.PROPERTY_ACCESSOR),
    SETTER(Canonical.PROPERTY_ACCESSOR),

    // Types
    TYPE_PARAMETERS(Canonical.TYPE_PARAMETER_LIST),
    TYPE_PARAMETER(Canonical.TYPE_PARAMETER),
    TYPE_CONSTRAINTS(Canonical.TYPE_CONSTRAINT_LIST),
    TYPE_CONSTRAINT(Canonical.TYPE_CONSTRAINT),
    TYPE_ARGUMENTS(Canonical.TYPE_ARGUMENT_LIST),
    TYPE_PROJECTION(Canonical.TYPE_PROJECTION),
    USER_TYPE(Canonical.USER_TYPE),
    NULLABLE_TYPE(Canonical.NULLABLE_TYPE),
    NOT_NULLABLE_TYPE,
    FUNCTION_TYPE(Canonical.FUNCTION_TYPE),
    FUNCTION_TYPE_PARAMETERS(Canonical.VALUE_PARAMETER_LIST),
    RECEIVER_TYPE(Canonical.FUNCTION_TYPE_RECEIVER),
    PARENTHESIZED_TYPE(Canonical.PARENTHESIZED),
    PARENTHESIZED_USER_TYPE,

    // Identifiers
    TYPE_IDENTIFIER,
    SIMPLE_IDENTIFIER,
    IDENTIFIER,

    // Modifiers and annotations
    MODIFIERS(Canonical.MODIFIER_LIST),
    PARAMETER_MODIFIERS(Canonical.MODIFIER_LIST),
    CLASS_MODIFIER,
    MEMBER_MODIFIER,
    VISIBILITY_MODIFIER,
    FUNCTION_MODIFIER,
    PROPERTY_MODIFIER,
    INHERITANCE_MODIFIER,
    PARAMETER_MODIFIER,
    PLATFORM_MODIFIER,
    REIFICATION_MODIFIER,
    VARIANCE_MODIFIER,
    TYPE_MODIFIERS,
    TYPE_PARAMETER_MODIFIERS,
    TYPE_PROJECTION_MODIFIERS,
    ANNOTATION(Canonical.ANNOTATION_ENTRY),
    USE_SITE_TARGET(Canonical.ANNOTATION_TARGET),

    // Expressions
    CALL_EXPRESSION(Canonical.CALL_EXPRESSION),
    CALL_SUFFIX,
    ANNOTATED_LAMBDA,
    NAVIGATION_EXPRESSION(Canonical.DOT_QUALIFIED_EXPRESSION),
    NAVIGATION_SUFFIX,
    SAFE_NAV,
    INDEXING_EXPRESSION(Canonical.ARRAY_ACCESS_EXPRESSION),
    INDEXING_SUFFIX(Canonical.INDICES),
    VALUE_ARGUMENTS(Canonical.VALUE_ARGUMENT_LIST),
    VALUE_ARGUMENT(Canonical.VALUE_ARGUMENT),
    SPREAD_EXPRESSION,
    PARENTHESIZED_EXPRESSION(Canonical.PARENTHESIZED),
    CALLABLE_REFERENCE(Canonical.CALLABLE_REFERENCE_EXPRESSION),
    COLLECTION_LITERAL(Canonical.COLLECTION_LITERAL_EXPRESSION),
    THIS_EXPRESSION(Canonical.THIS_EXPRESSION),
    SUPER_EXPRESSION(Canonical.SUPER_EXPRESSION),
    JUMP_EXPRESSION,
    DIRECTLY_ASSIGNABLE_EXPRESSION,
    ASSIGNMENT(Canonical.BINARY_EXPRESSION),
    ADDITIVE_EXPRESSION(Canonical.BINARY_EXPRESSION),
    MULTIPLICATIVE_EXPRESSION(Canonical.BINARY_EXPRESSION),
    COMPARISON_EXPRESSION(Canonical.BINARY_EXPRESSION),
    EQUALITY_EXPRESSION(Canonical.BINARY_EXPRESSION),
    CONJUNCTION_EXPRESSION(Canonical.BINARY_EXPRESSION),
    DISJUNCTION_EXPRESSION(Canonical.BINARY_EXPRESSION),
    ELVIS_EXPRESSION(Canonical.BINARY_EXPRESSION),
    RANGE_EXPRESSION(Canonical.BINARY_EXPRESSION),
    INFIX_EXPRESSION(Canonical.BINARY_EXPRESSION),
    AS_EXPRESSION(Canonical.BINARY_WITH_TYPE),
    CHECK_EXPRESSION(Canonical.IS_EXPRESSION),
    PREFIX_EXPRESSION(Canonical.PREFIX_EXPRESSION),
    POSTFIX_EXPRESSION(Canonical.POSTFIX_EXPRESSION),
    LAMBDA_LITERAL(Canonical.FUNCTION_LITERAL),
    LAMBDA_PARAMETERS(Canonical.VALUE_PARAMETER_LIST),
    LABEL(Canonical.LABEL),

    // Control flow
    IF_EXPRESSION(Canonical.IF),
    WHEN_EXPRESSION(Canonical.WHEN),
    WHEN_SUBJECT,
    WHEN_ENTRY(Canonical.WHEN_ENTRY),
    WHEN_CONDITION,
    WHEN_ENTRY_ELSE,
    RANGE_TEST(Canonical.WHEN_CONDITION_IN_RANGE),
    TYPE_TEST(Canonical.WHEN_CONDITION_IS_PATTERN),
    TRY_EXPRESSION(Canonical.TRY),
    TRY_CATCH_EXPRESSION(Canonical.TRY),
    CATCH_BLOCK(Canonical.CATCH),
    FINALLY_BLOCK(Canonical.FINALLY),
    FOR_STATEMENT(Canonical.FOR),
    WHILE_STATEMENT(Canonical.WHILE),
    DO_WHILE_STATEMENT(Canonical.DO_WHILE),
    CONTROL_STRUCTURE_BODY(Canonical.BLOCK),

    // Statements
    STATEMENTS,
    VARIABLE_DECLARATION,
    MULTI_VARIABLE_DECLARATION(Canonical.DESTRUCTURING_DECLARATION),
    BINDING_PATTERN_KIND,

    // Literals
    STRING_LITERAL(Canonical.STRING_TEMPLATE),
    LINE_STRING_LITERAL(Canonical.STRING_TEMPLATE),
    MULTI_LINE_STRING_LITERAL(Canonical.STRING_TEMPLATE),
    STRING_CONTENT(Canonical.LITERAL_STRING_TEMPLATE_ENTRY),
    INTERPOLATED_EXPRESSION(Canonical.LONG_STRING_TEMPLATE_ENTRY),
    LINE_STRING_EXPRESSION(Canonical.LONG_STRING_TEMPLATE_ENTRY),
    INTERPOLATED_IDENTIFIER(Canonical.SHORT_STRING_TEMPLATE_ENTRY),
    CHARACTER_ESCAPE_SEQ(Canonical.ESCAPE_STRING_TEMPLATE_ENTRY),
    CHARACTER_LITERAL(Canonical.CHARACTER_CONSTANT),
    INTEGER_LITERAL(Canonical.INTEGER_CONSTANT),
    HEX_LITERAL(Canonical.INTEGER_CONSTANT),
    BIN_LITERAL(Canonical.INTEGER_CONSTANT),
    UNSIGNED_LITERAL(Canonical.INTEGER_CONSTANT),
    LONG_LITERAL,
    REAL_LITERAL(Canonical.FLOAT_CONSTANT),
    BOOLEAN_LITERAL(Canonical.BOOLEAN_CONSTANT),
    NULL_LITERAL(Canonical.NULL),

    // Comments
    COMMENT,
    LINE_COMMENT,
    MULTILINE_COMMENT;

    private final Canonical target;

    CandidateKind() {
        this.target = null;
    }

    CandidateKind(Canonical target) {
        this.target = target;
    }

    public String grammarName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public Optional<Canonical> target() {
        return Optional.ofNullable(target);
    }

    public boolean is(String nodeName) {
        return grammarName().equals(nodeName);
    }
}
