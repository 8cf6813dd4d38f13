package work.lcod.crosscheck.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import work.lcod.crosscheck.mapping.Canonical;
import work.lcod.crosscheck.mapping.DialectTable;
import work.lcod.crosscheck.mapping.MappingTables;
import work.lcod.crosscheck.mapping.ReferenceKind;
import work.lcod.crosscheck.model.Dialect;
import work.lcod.crosscheck.model.Node;

/**
 * Normalizer for PSI trees. PSI already uses the canonical vocabulary, so this side only
 * renames, dissolves wrappers, flattens qualified type names and prunes empty lists.
 * Applied to a canonical tree it changes nothing.
 */
public final class ReferenceNormalizer implements TreeNormalizer {
    private final DialectTable<ReferenceKind> table;

    public ReferenceNormalizer() {
        this(MappingTables.REFERENCE);
    }

    ReferenceNormalizer(DialectTable<ReferenceKind> table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    @Override
    public Dialect dialect() {
        return Dialect.REFERENCE;
    }

    @Override
    public Set<Canonical> synthesizedKinds() {
        return Set.of();
    }

    @Override
    public List<Node> normalizeAll(Node raw) {
        Objects.requireNonNull(raw, "raw");
        return expand(raw);
    }

    private List<Node> expand(Node raw) {
        var children = new ArrayList<Node>();
        for (var child : raw.children()) {
            children.addAll(expand(child));
        }
        var target = table.canonicalFor(raw.name());
        if (target.isEmpty()) {
            return children;
        }
        if (target.get() == Canonical.USER_TYPE) {
            return RepairRules.emit(Canonical.USER_TYPE, flattenQualifier(children));
        }
        return RepairRules.emit(target.get(), children);
    }

    // a.b.C nests as USER_TYPE(USER_TYPE(USER_TYPE(a), b), C); the inner levels were flattened already.
    private static List<Node> flattenQualifier(List<Node> children) {
        if (children.isEmpty() || !Canonical.USER_TYPE.is(children.get(0).name())) {
            return children;
        }
        var result = new ArrayList<>(children.get(0).children());
        result.addAll(children.subList(1, children.size()));
        return result;
    }
}
