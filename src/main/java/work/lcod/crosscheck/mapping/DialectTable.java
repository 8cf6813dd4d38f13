package work.lcod.crosscheck.mapping;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import work.lcod.crosscheck.model.Dialect;

/**
 * Name lookup for one dialect: raw node name to kind, kind to canonical target, plus the
 * explicit set of kinds that always dissolve. Names that are not in the table are transparent.
 */
public final class DialectTable<K extends Enum<K>> {
    private final Dialect dialect;
    private final Class<K> kindType;
    private final Map<String, K> byName;
    private final Map<K, Canonical> targets;
    private final Set<K> transparent;

    private DialectTable(Dialect dialect, Class<K> kindType, Map<String, K> byName, Map<K, Canonical> targets, Set<K> transparent) {
        this.dialect = dialect;
        this.kindType = kindType;
        this.byName = byName;
        this.targets = targets;
        this.transparent = transparent;
    }

    static <K extends Enum<K>> DialectTable<K> of(
        Dialect dialect,
        Class<K> kindType,
        Function<K, String> rawName,
        Function<K, Optional<Canonical>> target,
        Set<K> transparent
    ) {
        Objects.requireNonNull(dialect, "dialect");
        var byName = new LinkedHashMap<String, K>();
        var targets = new EnumMap<K, Canonical>(kindType);
        for (K kind : kindType.getEnumConstants()) {
            var previous = byName.put(rawName.apply(kind), kind);
            if (previous != null) {
                throw new IllegalStateException("Duplicate " + dialect.label() + " node name: " + rawName.apply(kind));
            }
            target.apply(kind).ifPresent(canonical -> targets.put(kind, canonical));
        }
        var transparentCopy = transparent.isEmpty() ? EnumSet.noneOf(kindType) : EnumSet.copyOf(transparent);
        return new DialectTable<>(
            dialect,
            kindType,
            Collections.unmodifiableMap(byName),
            Collections.unmodifiableMap(targets),
            Collections.unmodifiableSet(transparentCopy)
        );
    }

    public Dialect dialect() {
        return dialect;
    }

    public Optional<K> kindOf(String rawName) {
        return Optional.ofNullable(byName.get(rawName));
    }

    /** Canonical name for a raw node, empty when the node is transparent or unknown. */
    public Optional<Canonical> canonicalFor(String rawName) {
        var kind = byName.get(rawName);
        if (kind == null || transparent.contains(kind)) {
            return Optional.empty();
        }
        return Optional.ofNullable(targets.get(kind));
    }

    public Optional<Canonical> target(K kind) {
        return Optional.ofNullable(targets.get(kind));
    }

    public Set<K> kinds() {
        return Collections.unmodifiableSet(EnumSet.allOf(kindType));
    }

    public Set<K> transparentKinds() {
        return transparent;
    }

    public Set<String> rawNames() {
        return byName.keySet();
    }

    /** Every canonical name a table entry can produce. */
    public Set<Canonical> emittedTargets() {
        var result = EnumSet.noneOf(Canonical.class);
        result.addAll(targets.values());
        return result;
    }

    @Override
    public String toString() {
        return kindType.getSimpleName() + "[" + byName.size() + " names, " + transparent.size() + " transparent]";
    }
}
