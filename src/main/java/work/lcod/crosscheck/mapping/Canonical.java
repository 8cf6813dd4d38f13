package work.lcod.crosscheck.mapping;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Canonical node vocabulary shared by both normalizers. Labels use the PSI spelling,
 * which makes the reference dialect the naming baseline.
 */
public enum Canonical {
    KT_FILE("KtFile"),
    PACKAGE_DIRECTIVE,
    IMPORT_LIST,
    IMPORT_DIRECTIVE,
    IMPORT_ALIAS,
    FILE_ANNOTATION_LIST,

    CLASS,
    CLASS_BODY,
    CLASS_INITIALIZER,
    OBJECT_DECLARATION,
    OBJECT_LITERAL,
    ENUM_ENTRY,
    TYPEALIAS,
    PRIMARY_CONSTRUCTOR,
    SECONDARY_CONSTRUCTOR,
    CONSTRUCTOR_DELEGATION_CALL,
    DELEGATED_SUPER_TYPE_ENTRY,

    FUN,
    PROPERTY,
    PROPERTY_ACCESSOR,
    PROPERTY_DELEGATE,
    VALUE_PARAMETER_LIST,
    VALUE_PARAMETER,
    MODIFIER_LIST,
    ANNOTATION_ENTRY,
    ANNOTATION_TARGET,
    BLOCK,

    TYPE_PARAMETER_LIST,
    TYPE_PARAMETER,
    TYPE_CONSTRAINT_LIST,
    TYPE_CONSTRAINT,
    TYPE_ARGUMENT_LIST,
    TYPE_PROJECTION,
    USER_TYPE,
    NULLABLE_TYPE,
    FUNCTION_TYPE,
    FUNCTION_TYPE_RECEIVER,
    PARENTHESIZED,

    CALL_EXPRESSION,
    DOT_QUALIFIED_EXPRESSION,
    ARRAY_ACCESS_EXPRESSION,
    INDICES,
    VALUE_ARGUMENT_LIST,
    VALUE_ARGUMENT,
    CALLABLE_REFERENCE_EXPRESSION,
    COLLECTION_LITERAL_EXPRESSION,
    THIS_EXPRESSION,
    SUPER_EXPRESSION,
    BINARY_EXPRESSION,
    BINARY_WITH_TYPE,
    IS_EXPRESSION,
    PREFIX_EXPRESSION,
    POSTFIX_EXPRESSION,
    FUNCTION_LITERAL,
    LABEL,

    IF,
    WHEN,
    WHEN_ENTRY,
    WHEN_CONDITION_IN_RANGE,
    WHEN_CONDITION_IS_PATTERN,
    TRY,
    CATCH,
    FINALLY,
    FOR,
    WHILE,
    DO_WHILE,
    DESTRUCTURING_DECLARATION,
    DESTRUCTURING_DECLARATION_ENTRY,

    STRING_TEMPLATE,
    LITERAL_STRING_TEMPLATE_ENTRY,
    LONG_STRING_TEMPLATE_ENTRY,
    SHORT_STRING_TEMPLATE_ENTRY,
    ESCAPE_STRING_TEMPLATE_ENTRY,
    CHARACTER_CONSTANT,
    INTEGER_CONSTANT,
    FLOAT_CONSTANT,
    BOOLEAN_CONSTANT,
    NULL;

    private static final Map<String, Canonical> BY_LABEL = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(Canonical::label, Function.identity()));

    private final String label;

    Canonical() {
        this.label = name();
    }

    Canonical(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean is(String nodeName) {
        return label.equals(nodeName);
    }

    public static Optional<Canonical> fromLabel(String label) {
        return Optional.ofNullable(BY_LABEL.get(label));
    }
}
