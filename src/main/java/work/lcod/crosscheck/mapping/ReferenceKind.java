package work.lcod.crosscheck.mapping;

import java.util.Optional;

/**
 * Composite element types found in PSI dumps. Most of them are already canonical;
 * a few are renamed and the rest are transparent wrappers.
 */
public enum ReferenceKind {
    KT_FILE("KtFile", Canonical.KT_FILE),

    PACKAGE_DIRECTIVE(Canonical.PACKAGE_DIRECTIVE),
    IMPORT_LIST(Canonical.IMPORT_LIST),
    IMPORT_DIRECTIVE(Canonical.IMPORT_DIRECTIVE),
    IMPORT_ALIAS(Canonical.IMPORT_ALIAS),
    FILE_ANNOTATION_LIST(Canonical.FILE_ANNOTATION_LIST),

    CLASS(Canonical.CLASS),
    CLASS_BODY(Canonical.CLASS_BODY),
    CLASS_INITIALIZER(Canonical.CLASS_INITIALIZER),
    OBJECT_DECLARATION(Canonical.OBJECT_DECLARATION),
    OBJECT_LITERAL(Canonical.OBJECT_LITERAL),
    ENUM_ENTRY(Canonical.ENUM_ENTRY),
    TYPEALIAS(Canonical.TYPEALIAS),
    PRIMARY_CONSTRUCTOR(Canonical.PRIMARY_CONSTRUCTOR),
    SECONDARY_CONSTRUCTOR(Canonical.SECONDARY_CONSTRUCTOR),
    CONSTRUCTOR_DELEGATION_CALL(Canonical.CONSTRUCTOR_DELEGATION_CALL),
    DELEGATED_SUPER_TYPE_ENTRY(Canonical.DELEGATED_SUPER_TYPE_ENTRY),

    FUN(Canonical.FUN),
    PROPERTY(Canonical.PROPERTY),
    PROPERTY_ACCESSOR(Canonical.PROPERTY_ACCESSOR),
    PROPERTY_DELEGATE(Canonical.PROPERTY_DELEGATE),
    VALUE_PARAMETER_LIST(Canonical.VALUE_PARAMETER_LIST),
    VALUE_PARAMETER(Canonical.VALUE_PARAMETER),
    MODIFIER_LIST(Canonical.MODIFIER_LIST),
    ANNOTATION_ENTRY(Canonical.ANNOTATION_ENTRY),
    ANNOTATION_TARGET(Canonical.ANNOTATION_TARGET),
    BLOCK(Canonical.BLOCK),

    TYPE_PARAMETER_LIST(Canonical.TYPE_PARAMETER_LIST),
    TYPE_PARAMETER(Canonical.TYPE_PARAMETER),
    TYPE_CONSTRAINT_LIST(Canonical.TYPE_CONSTRAINT_LIST),
    TYPE_CONSTRAINT(Canonical.TYPE_CONSTRAINT),
    TYPE_ARGUMENT_LIST(Canonical.TYPE_ARGUMENT_LIST),
    TYPE_PROJECTION(Canonical.TYPE_PROJECTION),
    USER_TYPE(Canonical.USER_TYPE),
    NULLABLE_TYPE(Canonical.NULLABLE_TYPE),
    FUNCTION_TYPE(Canonical.FUNCTION_TYPE),
    FUNCTION_TYPE_RECEIVER(Canonical.FUNCTION_TYPE_RECEIVER),
    PARENTHESIZED(Canonical.PARENTHESIZED),

    CALL_EXPRESSION(Canonical.CALL_EXPRESSION),
    DOT_QUALIFIED_EXPRESSION(Canonical.DOT_QUALIFIED_EXPRESSION),
    SAFE_ACCESS_EXPRESSION(Canonical.DOT_QUALIFIED_EXPRESSION),
    ARRAY_ACCESS_EXPRESSION(Canonical.ARRAY_ACCESS_EXPRESSION),
    INDICES(Canonical.INDICES),
    VALUE_ARGUMENT_LIST(Canonical.VALUE_ARGUMENT_LIST),
    VALUE_ARGUMENT(Canonical.VALUE_ARGUMENT),
    CALLABLE_REFERENCE_EXPRESSION(Canonical.CALLABLE_REFERENCE_EXPRESSION),
    COLLECTION_LITERAL_EXPRESSION(Canonical.COLLECTION_LITERAL_EXPRESSION),
    THIS_EXPRESSION(Canonical.THIS_EXPRESSION),
    SUPER_EXPRESSION(Canonical.SUPER_EXPRESSION),
    BINARY_EXPRESSION(Canonical.BINARY_EXPRESSION),
    BINARY_WITH_TYPE(Canonical.BINARY_WITH_TYPE),
    IS_EXPRESSION(Canonical.IS_EXPRESSION),
    PREFIX_EXPRESSION(Canonical.PREFIX_EXPRESSION),
    POSTFIX_EXPRESSION(Canonical.POSTFIX_EXPRESSION),
    FUNCTION_LITERAL(Canonical.FUNCTION_LITERAL),
    LABEL(Canonical.LABEL),

    IF(Canonical.IF),
    WHEN(Canonical.WHEN),
    WHEN_ENTRY(Canonical.WHEN_ENTRY),
    WHEN_CONDITION_IN_RANGE(Canonical.WHEN_CONDITION_IN_RANGE),
    WHEN_CONDITION_IS_PATTERN(Canonical.WHEN_CONDITION_IS_PATTERN),
    TRY(Canonical.TRY),
    CATCH(Canonical.CATCH),
    FINALLY(Canonical.FINALLY),
    FOR(Canonical.FOR),
    WHILE(Canonical.WHILE),
    DO_WHILE(Canonical.DO_WHILE),
    DESTRUCTURING_DECLARATION(Canonical.DESTRUCTURING_DECLARATION),
    DESTRUCTURING_DECLARATION_ENTRY(Canonical.DESTRUCTURING_DECLARATION_ENTRY),

    STRING_TEMPLATE(Canonical.STRING_TEMPLATE),
    LITERAL_STRING_TEMPLATE_ENTRY(Canonical.LITERAL_STRING_TEMPLATE_ENTRY),
    LONG_STRING_TEMPLATE_ENTRY(Canonical.LONG_STRING_TEMPLATE_ENTRY),
    SHORT_STRING_TEMPLATE_ENTRY(Canonical.SHORT_STRING_TEMPLATE_ENTRY),
    ESCAPE_STRING_TEMPLATE_ENTRY(Canonical.ESCAPE_STRING_TEMPLATE_ENTRY),
    CHARACTER_CONSTANT(Canonical.CHARACTER_CONSTANT),
    INTEGER_CONSTANT(Canonical.INTEGER_CONSTANT),
    FLOAT_CONSTANT(Canonical.FLOAT_CONSTANT),
    BOOLEAN_CONSTANT(Canonical.BOOLEAN_CONSTANT),
    NULL(Canonical.NULL),

    // Wrappers with no tree-sitter counterpart
    TYPE_REFERENCE,
    OPERATION_REFERENCE,
    REFERENCE_EXPRESSION,
    SUPER_TYPE_LIST,
    SUPER_TYPE_CALL_ENTRY,
    SUPER_TYPE_ENTRY,
    CONSTRUCTOR_CALLEE,
    CONSTRUCTOR_DELEGATION_REFERENCE,
    THEN,
    ELSE,
    LOOP_RANGE,
    CONDITION,
    BODY,
    RETURN,
    THROW,
    BREAK,
    CONTINUE,
    LAMBDA_EXPRESSION,
    LAMBDA_ARGUMENT,
    LABELED_EXPRESSION,
    LABEL_QUALIFIER,
    VALUE_ARGUMENT_NAME,
    ANNOTATED_EXPRESSION,
    ANNOTATION,
    ENUM_ENTRY_SUPERCLASS_REFERENCE_EXPRESSION,
    INITIALIZER_LIST,
    WHEN_CONDITION_WITH_EXPRESSION,
    CLASS_LITERAL_EXPRESSION,
    KDOC_SECTION,
    CONTEXT_RECEIVER,
    CONTEXT_PARAMETER_LIST,
    INTERSECTION_TYPE,
    DYNAMIC_TYPE;

    private final String dumpName;
    private final Canonical target;

    ReferenceKind() {
        this(null, null);
    }

    ReferenceKind(Canonical target) {
        this(null, target);
    }

    ReferenceKind(String dumpName, Canonical target) {
        this.dumpName = dumpName == null ? name() : dumpName;
        this.target = target;
    }

    public String dumpName() {
        return dumpName;
    }

    public Optional<Canonical> target() {
        return Optional.ofNullable(target);
    }
}
