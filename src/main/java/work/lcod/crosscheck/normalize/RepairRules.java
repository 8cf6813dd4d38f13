package work.lcod.crosscheck.normalize;

import static work.lcod.crosscheck.mapping.Canonical.ANNOTATION_TARGET;
import static work.lcod.crosscheck.mapping.Canonical.DOT_QUALIFIED_EXPRESSION;
import static work.lcod.crosscheck.mapping.Canonical.FUNCTION_TYPE;
import static work.lcod.crosscheck.mapping.Canonical.IMPORT_LIST;
import static work.lcod.crosscheck.mapping.Canonical.MODIFIER_LIST;
import static work.lcod.crosscheck.mapping.Canonical.NULLABLE_TYPE;
import static work.lcod.crosscheck.mapping.Canonical.PACKAGE_DIRECTIVE;
import static work.lcod.crosscheck.mapping.Canonical.PARENTHESIZED;
import static work.lcod.crosscheck.mapping.Canonical.PROPERTY;
import static work.lcod.crosscheck.mapping.Canonical.PROPERTY_ACCESSOR;
import static work.lcod.crosscheck.mapping.Canonical.USER_TYPE;
import static work.lcod.crosscheck.mapping.Canonical.VALUE_PARAMETER;
import static work.lcod.crosscheck.mapping.Canonical.VALUE_PARAMETER_LIST;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import work.lcod.crosscheck.mapping.Canonical;
import work.lcod.crosscheck.model.Node;

/**
 * Structural repairs over already-normalized sibling lists. Every rule returns a new list
 * and leaves lists that are already in canonical shape untouched.
 */
final class RepairRules {
    /** Wrappers that are always present on one side and vanish once they hold nothing. */
    static final Set<Canonical> DROP_WHEN_EMPTY = EnumSet.of(
        PACKAGE_DIRECTIVE, IMPORT_LIST, MODIFIER_LIST, VALUE_PARAMETER_LIST, ANNOTATION_TARGET);

    /** Canonical types that can stand alone as a function-type parameter. */
    static final Set<Canonical> BARE_TYPES = EnumSet.of(USER_TYPE, NULLABLE_TYPE, FUNCTION_TYPE, PARENTHESIZED);

    private RepairRules() {
    }

    /**
     * Wraps children into one canonical node, unless the wrapper has to disappear: empty
     * droppable wrappers emit nothing, qualifier chains made only of other chains dissolve.
     */
    static List<Node> emit(Canonical kind, List<Node> children) {
        if (children.isEmpty() && DROP_WHEN_EMPTY.contains(kind)) {
            return List.of();
        }
        if (kind == DOT_QUALIFIED_EXPRESSION && children.stream().allMatch(child -> DOT_QUALIFIED_EXPRESSION.is(child.name()))) {
            return children;
        }
        return List.of(new Node(kind.label(), children));
    }

    static boolean contains(List<Node> nodes, Canonical kind) {
        return nodes.stream().anyMatch(node -> kind.is(node.name()));
    }

    /** Moves each accessor into the property it follows. */
    static List<Node> nestAccessors(List<Node> nodes) {
        if (!contains(nodes, PROPERTY_ACCESSOR)) {
            return nodes;
        }
        var result = new ArrayList<Node>(nodes.size());
        for (var node : nodes) {
            var last = result.isEmpty() ? null : result.get(result.size() - 1);
            if (PROPERTY_ACCESSOR.is(node.name()) && last != null && PROPERTY.is(last.name())) {
                result.set(result.size() - 1, last.withAppended(node));
            } else {
                result.add(node);
            }
        }
        return result;
    }

    /** Merges consecutive siblings of the same list kind into the first one. */
    static List<Node> mergeLists(List<Node> nodes, Set<Canonical> listKinds) {
        var result = new ArrayList<Node>(nodes.size());
        for (var node : nodes) {
            var last = result.isEmpty() ? null : result.get(result.size() - 1);
            if (last != null && last.name().equals(node.name()) && Canonical.fromLabel(node.name()).filter(listKinds::contains).isPresent()) {
                var merged = new ArrayList<>(last.children());
                merged.addAll(node.children());
                result.set(result.size() - 1, last.withChildren(merged));
            } else {
                result.add(node);
            }
        }
        return result;
    }

    /**
     * Wraps every maximal run of {@code item} siblings into a synthetic {@code list} node.
     * Lists that already contain a {@code list} node are left alone.
     */
    static List<Node> groupRuns(List<Node> nodes, Canonical item, Canonical list) {
        if (!contains(nodes, item) || contains(nodes, list)) {
            return nodes;
        }
        var result = new ArrayList<Node>(nodes.size());
        var run = new ArrayList<Node>();
        for (var node : nodes) {
            if (item.is(node.name())) {
                run.add(node);
                continue;
            }
            flushRun(result, run, list);
            result.add(node);
        }
        flushRun(result, run, list);
        return result;
    }

    private static void flushRun(List<Node> result, List<Node> run, Canonical list) {
        if (!run.isEmpty()) {
            result.add(new Node(list.label(), run));
            run.clear();
        }
    }

    /** Wraps bare types in VALUE_PARAMETER when no sibling is a VALUE_PARAMETER yet. */
    static List<Node> wrapBareTypes(List<Node> nodes) {
        if (contains(nodes, VALUE_PARAMETER)) {
            return nodes;
        }
        var result = new ArrayList<Node>(nodes.size());
        for (var node : nodes) {
            var bare = Canonical.fromLabel(node.name()).filter(BARE_TYPES::contains).isPresent();
            result.add(bare ? Node.of(VALUE_PARAMETER.label(), node) : node);
        }
        return result;
    }

    /** Moves a modifier list into the value parameter directly after it. */
    static List<Node> nestModifiers(List<Node> nodes) {
        var result = new ArrayList<Node>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            var node = nodes.get(i);
            var next = i + 1 < nodes.size() ? nodes.get(i + 1) : null;
            if (MODIFIER_LIST.is(node.name()) && next != null && VALUE_PARAMETER.is(next.name())) {
                result.add(next.withPrepended(node));
                i++;
            } else {
                result.add(node);
            }
        }
        return result;
    }

    /** Splices the children of every {@code kind} node into the list. */
    static List<Node> unwrap(List<Node> nodes, Canonical kind) {
        if (!contains(nodes, kind)) {
            return nodes;
        }
        var result = new ArrayList<Node>(nodes.size());
        for (var node : nodes) {
            if (kind.is(node.name())) {
                result.addAll(node.children());
            } else {
                result.add(node);
            }
        }
        return result;
    }
}
