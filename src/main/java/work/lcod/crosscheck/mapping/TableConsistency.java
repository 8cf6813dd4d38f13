package work.lcod.crosscheck.mapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Automated staleness check for the mapping tables. Each method returns the list of problems
 * found, empty when the tables are consistent.
 */
public final class TableConsistency {
    private static final ObjectMapper JSON = new ObjectMapper();

    private TableConsistency() {
    }

    /**
     * Checks both tables and that every canonical name the candidate side can produce is
     * also produced by the reference side.
     *
     * @param candidateSynthesized canonical names created by candidate repair rules
     * @param referenceSynthesized canonical names created by reference repair rules
     */
    public static List<String> verify(Set<Canonical> candidateSynthesized, Set<Canonical> referenceSynthesized) {
        var problems = new ArrayList<String>();
        problems.addAll(checkTransparentSet(MappingTables.CANDIDATE));
        problems.addAll(checkTransparentSet(MappingTables.REFERENCE));

        var candidate = EnumSet.noneOf(Canonical.class);
        candidate.addAll(MappingTables.CANDIDATE.emittedTargets());
        candidate.addAll(candidateSynthesized);
        var reference = EnumSet.noneOf(Canonical.class);
        reference.addAll(MappingTables.REFERENCE.emittedTargets());
        reference.addAll(referenceSynthesized);
        candidate.removeAll(reference);
        for (var orphan : candidate) {
            problems.add("Canonical " + orphan.label() + " can be emitted by the candidate side but never by the reference side");
        }
        return problems;
    }

    static <K extends Enum<K>> List<String> checkTransparentSet(DialectTable<K> table) {
        var problems = new ArrayList<String>();
        for (var kind : table.kinds()) {
            boolean listed = table.transparentKinds().contains(kind);
            boolean mapped = table.target(kind).isPresent();
            if (listed && mapped) {
                problems.add(table.dialect().label() + " kind " + kind + " is transparent but maps to " + table.target(kind).get().label());
            } else if (!listed && !mapped) {
                problems.add(table.dialect().label() + " kind " + kind + " has no target and is not listed as transparent");
            }
        }
        return problems;
    }

    /**
     * Checks that every named node type of a tree-sitter {@code node-types.json} has a
     * candidate table entry. Hidden supertypes (leading underscore) are skipped.
     */
    public static List<String> verifyNodeTypes(Path nodeTypes) {
        try (var in = Files.newInputStream(nodeTypes)) {
            return verifyNodeTypes(in);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read node types: " + nodeTypes, ex);
        }
    }

    static List<String> verifyNodeTypes(InputStream in) throws IOException {
        var root = JSON.readTree(in);
        if (root == null || !root.isArray()) {
            throw new IOException("node-types.json must hold a JSON array");
        }
        var missing = new TreeSet<String>();
        for (var entry : root) {
            var type = entry.path("type").asText("");
            if (!entry.path("named").asBoolean(false) || type.isEmpty() || type.startsWith("_")) {
                continue;
            }
            if (!MappingTables.CANDIDATE.rawNames().contains(type)) {
                missing.add(type);
            }
        }
        var problems = new ArrayList<String>();
        for (var type : missing) {
            problems.add("Grammar node type " + type + " has no candidate table entry");
        }
        return problems;
    }
}
