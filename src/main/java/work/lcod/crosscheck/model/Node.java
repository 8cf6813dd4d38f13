package work.lcod.crosscheck.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable syntax tree node: a syntactic category name and its ordered children.
 * Raw nodes carry dialect names, canonical nodes carry {@code Canonical} labels.
 */
public record Node(String name, List<Node> children) {
    public Node {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Node name must not be blank.");
        }
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static Node leaf(String name) {
        return new Node(name, List.of());
    }

    public static Node of(String name, Node... children) {
        return new Node(name, Arrays.asList(children));
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public Node withChildren(List<Node> newChildren) {
        return new Node(name, newChildren);
    }

    public Node withAppended(Node child) {
        var combined = new ArrayList<Node>(children.size() + 1);
        combined.addAll(children);
        combined.add(child);
        return new Node(name, combined);
    }

    public Node withPrepended(Node child) {
        var combined = new ArrayList<Node>(children.size() + 1);
        combined.add(child);
        combined.addAll(children);
        return new Node(name, combined);
    }

    /**
     * Indented rendering, two spaces per level.
     */
    public String render() {
        var builder = new StringBuilder();
        render(builder, 0);
        return builder.toString();
    }

    private void render(StringBuilder builder, int depth) {
        if (depth > 0) {
            builder.append('\n');
        }
        builder.append("  ".repeat(depth)).append(name);
        for (Node child : children) {
            child.render(builder, depth + 1);
        }
    }

    @Override
    public String toString() {
        if (isLeaf()) {
            return name;
        }
        var builder = new StringBuilder(name).append('(');
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                builder.append(", ");
            }
            builder.append(children.get(i));
        }
        return builder.append(')').toString();
    }
}
