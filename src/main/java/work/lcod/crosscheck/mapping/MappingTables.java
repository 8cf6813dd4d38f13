package work.lcod.crosscheck.mapping;

import java.util.EnumSet;
import work.lcod.crosscheck.model.Dialect;

/**
 * Process-wide mapping tables. Both are built once, here, and never change afterwards.
 */
public final class MappingTables {
    /** Tree-sitter kinds that dissolve into their parent. */
    private static final EnumSet<CandidateKind> CANDIDATE_TRANSPARENT = EnumSet.of(
        CandidateKind.SHEBANG_LINE, CandidateKind.WILDCARD_IMPORT, CandidateKind.POINT_STAR,
        CandidateKind.CONSTRUCTOR_INVOCATION, CandidateKind.DELEGATION_SPECIFIER,
        CandidateKind.FUNCTION_VALUE_PARAMETER,
        CandidateKind.NOT_NULLABLE_TYPE, CandidateKind.PARENTHESIZED_USER_TYPE,
        CandidateKind.TYPE_IDENTIFIER, CandidateKind.SIMPLE_IDENTIFIER, CandidateKind.IDENTIFIER,
        CandidateKind.CLASS_MODIFIER, CandidateKind.MEMBER_MODIFIER, CandidateKind.VISIBILITY_MODIFIER,
        CandidateKind.FUNCTION_MODIFIER, CandidateKind.PROPERTY_MODIFIER, CandidateKind.INHERITANCE_MODIFIER,
        CandidateKind.PARAMETER_MODIFIER, CandidateKind.PLATFORM_MODIFIER, CandidateKind.REIFICATION_MODIFIER,
        CandidateKind.VARIANCE_MODIFIER,
        CandidateKind.TYPE_MODIFIERS, CandidateKind.TYPE_PARAMETER_MODIFIERS, CandidateKind.TYPE_PROJECTION_MODIFIERS,
        CandidateKind.CALL_SUFFIX, CandidateKind.ANNOTATED_LAMBDA, CandidateKind.NAVIGATION_SUFFIX,
        CandidateKind.SAFE_NAV, CandidateKind.SPREAD_EXPRESSION,
        CandidateKind.JUMP_EXPRESSION, CandidateKind.DIRECTLY_ASSIGNABLE_EXPRESSION,
        CandidateKind.WHEN_SUBJECT, CandidateKind.WHEN_CONDITION, CandidateKind.WHEN_ENTRY_ELSE,
        CandidateKind.STATEMENTS, CandidateKind.VARIABLE_DECLARATION, CandidateKind.BINDING_PATTERN_KIND,
        CandidateKind.LONG_LITERAL,
        CandidateKind.COMMENT, CandidateKind.LINE_COMMENT, CandidateKind.MULTILINE_COMMENT
    );

    /** PSI kinds that dissolve into their parent. */
    private static final EnumSet<ReferenceKind> REFERENCE_TRANSPARENT = EnumSet.of(
        ReferenceKind.TYPE_REFERENCE,
        ReferenceKind.OPERATION_REFERENCE,
        ReferenceKind.REFERENCE_EXPRESSION,
        ReferenceKind.SUPER_TYPE_LIST,
        ReferenceKind.SUPER_TYPE_CALL_ENTRY,
        ReferenceKind.SUPER_TYPE_ENTRY,
        ReferenceKind.CONSTRUCTOR_CALLEE,
        ReferenceKind.CONSTRUCTOR_DELEGATION_REFERENCE,
        ReferenceKind.THEN,
        ReferenceKind.ELSE,
        ReferenceKind.LOOP_RANGE,
        ReferenceKind.CONDITION,
        ReferenceKind.BODY,
        ReferenceKind.RETURN,
        ReferenceKind.THROW,
        ReferenceKind.BREAK,
        ReferenceKind.CONTINUE,
        ReferenceKind.LAMBDA_EXPRESSION,
        ReferenceKind.LAMBDA_ARGUMENT,
        ReferenceKind.LABELED_EXPRESSION,
        ReferenceKind.LABEL_QUALIFIER,
        ReferenceKind.VALUE_ARGUMENT_NAME,
        ReferenceKind.ANNOTATED_EXPRESSION,
        ReferenceKind.ANNOTATION,
        ReferenceKind.ENUM_ENTRY_SUPERCLASS_REFERENCE_EXPRESSION,
        ReferenceKind.INITIALIZER_LIST,
        ReferenceKind.WHEN_CONDITION_WITH_EXPRESSION,
        ReferenceKind.CLASS_LITERAL_EXPRESSION,
        ReferenceKind.KDOC_SECTION,
        ReferenceKind.CONTEXT_RECEIVER,
        ReferenceKind.CONTEXT_PARAMETER_LIST,
        ReferenceKind.INTERSECTION_TYPE,
        ReferenceKind.DYNAMIC_TYPE
    );

    public static final DialectTable<CandidateKind> CANDIDATE;
    public static final DialectTable<ReferenceKind> REFERENCE;

    static {
        CANDIDATE = DialectTable.of(
            Dialect.CANDIDATE, CandidateKind.class, CandidateKind::grammarName, CandidateKind::target, CANDIDATE_TRANSPARENT);
        REFERENCE = DialectTable.of(
            Dialect.REFERENCE, ReferenceKind.class, ReferenceKind::dumpName, ReferenceKind::target, REFERENCE_TRANSPARENT);
    }

    private MappingTables() {
    }
}
