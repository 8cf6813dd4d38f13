package work.lcod.crosscheck.normalize;

import static work.lcod.crosscheck.mapping.CandidateKind.CALL_EXPRESSION;
import static work.lcod.crosscheck.mapping.CandidateKind.COMMENT;
import static work.lcod.crosscheck.mapping.CandidateKind.CONSTRUCTOR_INVOCATION;
import static work.lcod.crosscheck.mapping.CandidateKind.FOR_STATEMENT;
import static work.lcod.crosscheck.mapping.CandidateKind.FUNCTION_TYPE;
import static work.lcod.crosscheck.mapping.CandidateKind.FUNCTION_VALUE_PARAMETER;
import static work.lcod.crosscheck.mapping.CandidateKind.LAMBDA_PARAMETERS;
import static work.lcod.crosscheck.mapping.CandidateKind.LINE_COMMENT;
import static work.lcod.crosscheck.mapping.CandidateKind.MULTILINE_COMMENT;
import static work.lcod.crosscheck.mapping.CandidateKind.MULTI_VARIABLE_DECLARATION;
import static work.lcod.crosscheck.mapping.CandidateKind.NAVIGATION_EXPRESSION;
import static work.lcod.crosscheck.mapping.CandidateKind.NOT_NULLABLE_TYPE;
import static work.lcod.crosscheck.mapping.CandidateKind.NULLABLE_TYPE;
import static work.lcod.crosscheck.mapping.CandidateKind.PARENTHESIZED_TYPE;
import static work.lcod.crosscheck.mapping.CandidateKind.STATEMENTS;
import static work.lcod.crosscheck.mapping.CandidateKind.TYPE_TEST;
import static work.lcod.crosscheck.mapping.CandidateKind.USER_TYPE;
import static work.lcod.crosscheck.mapping.CandidateKind.VALUE_ARGUMENTS;
import static work.lcod.crosscheck.mapping.CandidateKind.VARIABLE_DECLARATION;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import work.lcod.crosscheck.mapping.CandidateKind;
import work.lcod.crosscheck.mapping.Canonical;
import work.lcod.crosscheck.mapping.DialectTable;
import work.lcod.crosscheck.mapping.MappingTables;
import work.lcod.crosscheck.model.Dialect;
import work.lcod.crosscheck.model.Node;

/**
 * Normalizer for tree-sitter-kotlin trees. Besides the table renames it repairs the places
 * where the grammar nests differently from PSI: expression bodies, call chains, implicit
 * parameter and import lists, accessors, and the blocks the grammar hides.
 */
public final class CandidateNormalizer implements TreeNormalizer {
    public static final Set<Canonical> SYNTHESIZED = Collections.unmodifiableSet(EnumSet.of(
        Canonical.BLOCK,
        Canonical.BINARY_EXPRESSION,
        Canonical.CALL_EXPRESSION,
        Canonical.DOT_QUALIFIED_EXPRESSION,
        Canonical.VALUE_PARAMETER,
        Canonical.VALUE_PARAMETER_LIST,
        Canonical.IMPORT_LIST,
        Canonical.MODIFIER_LIST,
        Canonical.OBJECT_DECLARATION,
        Canonical.ANNOTATION_ENTRY,
        Canonical.DESTRUCTURING_DECLARATION_ENTRY
    ));

    private static final Set<CandidateKind> TYPE_OPERANDS = EnumSet.of(
        TYPE_TEST, USER_TYPE, NULLABLE_TYPE, NOT_NULLABLE_TYPE, PARENTHESIZED_TYPE, FUNCTION_TYPE);
    private static final Set<CandidateKind> ANNOTATION_MEMBERS = EnumSet.of(USER_TYPE, CONSTRUCTOR_INVOCATION);
    private static final Set<CandidateKind> COMMENTS = EnumSet.of(COMMENT, LINE_COMMENT, MULTILINE_COMMENT);
    private static final Set<Canonical> MERGED_LISTS = EnumSet.of(Canonical.IMPORT_LIST, Canonical.FILE_ANNOTATION_LIST);

    private final DialectTable<CandidateKind> table;

    public CandidateNormalizer() {
        this(MappingTables.CANDIDATE);
    }

    CandidateNormalizer(DialectTable<CandidateKind> table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    @Override
    public Dialect dialect() {
        return Dialect.CANDIDATE;
    }

    @Override
    public Set<Canonical> synthesizedKinds() {
        return SYNTHESIZED;
    }

    @Override
    public List<Node> normalizeAll(Node raw) {
        Objects.requireNonNull(raw, "raw");
        return expand(raw);
    }

    /** A raw child next to what it normalized to. */
    private record Segment(Node raw, CandidateKind kind, List<Node> nodes) {
        boolean is(CandidateKind other) {
            return kind == other;
        }
    }

    private List<Node> expand(Node raw) {
        var kind = table.kindOf(raw.name()).orElse(null);
        var segments = segments(raw, kind);
        var target = table.canonicalFor(raw.name());
        if (target.isEmpty()) {
            return flatten(segments);
        }
        return repair(raw, kind, target.get(), segments);
    }

    private List<Node> expandAll(List<Node> raws) {
        var result = new ArrayList<Node>();
        for (var raw : raws) {
            result.addAll(expand(raw));
        }
        return result;
    }

    private List<Segment> segments(Node raw, CandidateKind parent) {
        var result = new ArrayList<Segment>(raw.children().size());
        for (var child : raw.children()) {
            var kind = table.kindOf(child.name()).orElse(null);
            result.add(new Segment(child, kind, reshape(parent, kind, expand(child))));
        }
        return result;
    }

    // Reshapes one child's nodes when the meaning depends on the raw parent.
    private static List<Node> reshape(CandidateKind parent, CandidateKind kind, List<Node> nodes) {
        if (kind == FUNCTION_VALUE_PARAMETER) {
            return RepairRules.nestModifiers(nodes);
        }
        if (kind == VARIABLE_DECLARATION || kind == MULTI_VARIABLE_DECLARATION) {
            if (parent == LAMBDA_PARAMETERS || parent == FOR_STATEMENT) {
                return List.of(new Node(Canonical.VALUE_PARAMETER.label(), nodes));
            }
            if (parent == MULTI_VARIABLE_DECLARATION && kind == VARIABLE_DECLARATION) {
                return List.of(new Node(Canonical.DESTRUCTURING_DECLARATION_ENTRY.label(), nodes));
            }
        }
        return nodes;
    }

    private List<Node> repair(Node raw, CandidateKind kind, Canonical target, List<Segment> segments) {
        return switch (kind) {
            case FUNCTION_BODY, CONTROL_STRUCTURE_BODY -> body(segments);
            case CALL_EXPRESSION -> callExpression(raw);
            case CHECK_EXPRESSION -> RepairRules.emit(
                hasChild(segments, TYPE_OPERANDS) ? Canonical.IS_EXPRESSION : Canonical.BINARY_EXPRESSION,
                finish(flatten(segments)));
            case LAMBDA_LITERAL -> functionLiteral(target, segments);
            case FILE_ANNOTATION -> RepairRules.emit(target, annotationEntries(segments));
            case ANNOTATION -> annotation(target, segments);
            case TRY_EXPRESSION, TRY_CATCH_EXPRESSION -> RepairRules.emit(target, finish(withBlock(segments, true, true)));
            case FINALLY_BLOCK, ANONYMOUS_INITIALIZER -> RepairRules.emit(target, finish(withBlock(segments, true, false)));
            case SECONDARY_CONSTRUCTOR -> RepairRules.emit(target, finish(withBlock(segments, false, false)));
            case CATCH_BLOCK -> catchBlock(target, segments);
            case OBJECT_LITERAL -> RepairRules.emit(target, objectDeclaration(finish(flatten(segments))));
            case PROPERTY_DECLARATION -> property(target, finish(flatten(segments)));
            default -> RepairRules.emit(target, regroup(kind, finish(flatten(segments))));
        };
    }

    private static List<Node> regroup(CandidateKind kind, List<Node> children) {
        return switch (kind) {
            case SOURCE_FILE -> RepairRules.mergeLists(
                RepairRules.groupRuns(children, Canonical.IMPORT_DIRECTIVE, Canonical.IMPORT_LIST), MERGED_LISTS);
            case PRIMARY_CONSTRUCTOR, GETTER, SETTER ->
                RepairRules.groupRuns(children, Canonical.VALUE_PARAMETER, Canonical.VALUE_PARAMETER_LIST);
            case FUNCTION_TYPE_PARAMETERS -> RepairRules.wrapBareTypes(children);
            case FUNCTION_DECLARATION, ANONYMOUS_FUNCTION -> RepairRules.unwrap(children, Canonical.FUNCTION_TYPE_RECEIVER);
            default -> children;
        };
    }

    private static List<Node> finish(List<Node> children) {
        return RepairRules.nestAccessors(children);
    }

    private static List<Node> flatten(List<Segment> segments) {
        var result = new ArrayList<Node>();
        for (var segment : segments) {
            result.addAll(segment.nodes());
        }
        return result;
    }

    private static boolean hasChild(List<Segment> segments, Set<CandidateKind> kinds) {
        return segments.stream().anyMatch(segment -> segment.kind() != null && kinds.contains(segment.kind()));
    }

    /** Statement sequences and empty bodies become a block, a bare expression body splices. */
    private static List<Node> body(List<Segment> segments) {
        boolean statements = segments.stream().anyMatch(segment -> segment.is(STATEMENTS));
        boolean expression = segments.stream()
            .anyMatch(segment -> !segment.is(STATEMENTS) && !COMMENTS.contains(segment.kind()));
        var children = finish(flatten(segments));
        if (!statements && expression) {
            return children;
        }
        return List.of(new Node(Canonical.BLOCK.label(), children));
    }

    /**
     * Rebuilds a call from its raw shape. Trailing-lambda nesting (an outer suffix without
     * value arguments around an inner call) is merged into one call, and a member callee
     * becomes {@code DOT_QUALIFIED_EXPRESSION(receiver, CALL_EXPRESSION(member, arguments))}.
     */
    private List<Node> callExpression(Node raw) {
        if (raw.isLeaf()) {
            return RepairRules.emit(Canonical.CALL_EXPRESSION, List.of());
        }
        var callee = raw.children().get(0);
        var suffixes = new ArrayList<>(raw.children().subList(1, raw.children().size()));
        while (CALL_EXPRESSION.is(callee.name()) && !callee.isLeaf() && !hasValueArguments(suffixes)) {
            suffixes.addAll(0, callee.children().subList(1, callee.children().size()));
            callee = callee.children().get(0);
        }
        var arguments = finish(expandAll(suffixes));
        var parts = callee.children();
        if (NAVIGATION_EXPRESSION.is(callee.name()) && parts.size() > 1) {
            var call = new ArrayList<>(expand(parts.get(parts.size() - 1)));
            call.addAll(arguments);
            var qualified = new ArrayList<>(expandAll(parts.subList(0, parts.size() - 1)));
            qualified.addAll(RepairRules.emit(Canonical.CALL_EXPRESSION, call));
            return RepairRules.emit(Canonical.DOT_QUALIFIED_EXPRESSION, qualified);
        }
        var children = new ArrayList<>(expand(callee));
        children.addAll(arguments);
        return RepairRules.emit(Canonical.CALL_EXPRESSION, children);
    }

    private static boolean hasValueArguments(List<Node> suffixes) {
        for (var suffix : suffixes) {
            if (VALUE_ARGUMENTS.is(suffix.name())
                || suffix.children().stream().anyMatch(child -> VALUE_ARGUMENTS.is(child.name()))) {
                return true;
            }
        }
        return false;
    }

    private static List<Node> functionLiteral(Canonical target, List<Segment> segments) {
        var children = new ArrayList<Node>();
        var statements = new ArrayList<Node>();
        for (var segment : segments) {
            if (segment.is(LAMBDA_PARAMETERS)) {
                children.addAll(segment.nodes());
            } else {
                statements.addAll(segment.nodes());
            }
        }
        children.add(new Node(Canonical.BLOCK.label(), finish(statements)));
        return RepairRules.emit(target, children);
    }

    /**
     * Puts the nodes of the hidden block's statements into a {@code BLOCK}. When there are no
     * statements an empty block is injected, first or last, unless {@code injectMissing} is off.
     */
    private static List<Node> withBlock(List<Segment> segments, boolean injectMissing, boolean blockFirst) {
        var others = new ArrayList<Node>();
        var statements = new ArrayList<Node>();
        int position = -1;
        for (var segment : segments) {
            if (segment.is(STATEMENTS)) {
                if (position < 0) {
                    position = others.size();
                }
                statements.addAll(segment.nodes());
            } else {
                others.addAll(segment.nodes());
            }
        }
        if (position < 0) {
            if (!injectMissing || RepairRules.contains(others, Canonical.BLOCK)) {
                return others;
            }
            position = blockFirst ? 0 : others.size();
        }
        others.add(position, new Node(Canonical.BLOCK.label(), finish(statements)));
        return others;
    }

    /** {@code catch (e: T) { ... }} becomes {@code CATCH(VALUE_PARAMETER_LIST(VALUE_PARAMETER(T)), BLOCK)}. */
    private static List<Node> catchBlock(Canonical target, List<Segment> segments) {
        var parameter = new ArrayList<Node>();
        var statements = new ArrayList<Node>();
        for (var segment : segments) {
            if (segment.is(STATEMENTS)) {
                statements.addAll(segment.nodes());
            } else {
                parameter.addAll(segment.nodes());
            }
        }
        var annotated = RepairRules.groupRuns(parameter, Canonical.ANNOTATION_ENTRY, Canonical.MODIFIER_LIST);
        var children = List.of(
            Node.of(Canonical.VALUE_PARAMETER_LIST.label(), new Node(Canonical.VALUE_PARAMETER.label(), annotated)),
            new Node(Canonical.BLOCK.label(), finish(statements)));
        return RepairRules.emit(target, children);
    }

    private static List<Node> objectDeclaration(List<Node> children) {
        if (RepairRules.contains(children, Canonical.OBJECT_DECLARATION)) {
            return children;
        }
        return List.of(new Node(Canonical.OBJECT_DECLARATION.label(), children));
    }

    /** A destructuring {@code val (a, b) = x} is a declaration of its own, not a property. */
    private static List<Node> property(Canonical target, List<Node> children) {
        var unwrapped = RepairRules.unwrap(children, Canonical.FUNCTION_TYPE_RECEIVER);
        var destructuring = unwrapped.stream()
            .filter(child -> Canonical.DESTRUCTURING_DECLARATION.is(child.name()))
            .findFirst();
        if (destructuring.isEmpty()) {
            return RepairRules.emit(target, unwrapped);
        }
        var merged = new ArrayList<Node>();
        for (var child : unwrapped) {
            if (child == destructuring.get()) {
                merged.addAll(child.children());
            } else {
                merged.add(child);
            }
        }
        return RepairRules.emit(Canonical.DESTRUCTURING_DECLARATION, merged);
    }

    /** {@code @[A B]} holds one entry per member; a single annotation keeps its own entry. */
    private static List<Node> annotation(Canonical target, List<Segment> segments) {
        long members = segments.stream().filter(segment -> ANNOTATION_MEMBERS.contains(segment.kind())).count();
        if (members <= 1) {
            return RepairRules.emit(target, finish(flatten(segments)));
        }
        return annotationEntries(segments);
    }

    private static List<Node> annotationEntries(List<Segment> segments) {
        var result = new ArrayList<Node>();
        for (var segment : segments) {
            if (ANNOTATION_MEMBERS.contains(segment.kind())) {
                result.add(new Node(Canonical.ANNOTATION_ENTRY.label(), segment.nodes()));
            } else {
                result.addAll(segment.nodes());
            }
        }
        return result;
    }
}
