package work.lcod.crosscheck.normalize;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import work.lcod.crosscheck.mapping.Canonical;
import work.lcod.crosscheck.model.Dialect;
import work.lcod.crosscheck.model.Node;

/**
 * Reduces a raw dialect tree to canonical form.
 */
public interface TreeNormalizer {
    Dialect dialect();

    /**
     * Normalizes a raw tree into zero or more canonical nodes. A transparent root yields its
     * normalized children, so the result can hold several siblings.
     */
    List<Node> normalizeAll(Node raw);

    /** First node of {@link #normalizeAll(Node)}, empty when the whole tree dissolved. */
    default Optional<Node> normalize(Node raw) {
        var all = normalizeAll(raw);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    /** Canonical names produced by repair rules rather than by the mapping table. */
    Set<Canonical> synthesizedKinds();
}
