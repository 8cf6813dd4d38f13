package work.lcod.crosscheck.compare;

import java.util.ArrayList;
import java.util.List;
import work.lcod.crosscheck.model.Node;

/**
 * Exact structural diff of two canonical trees. The walk does not stop at the first
 * deviation, so one pass reports every independent difference.
 */
public final class TreeComparator {
    private TreeComparator() {
    }

    /**
     * Compares a candidate tree against the reference tree. A {@code null} tree stands for a
     * dump that could not be produced; a missing candidate wins over a missing reference.
     */
    public static CompareResult compare(Node candidate, Node reference) {
        if (candidate == null) {
            return CompareResult.of(CompareStatus.CANDIDATE_PARSE_ERROR);
        }
        if (reference == null) {
            return CompareResult.of(CompareStatus.REFERENCE_PARSE_ERROR);
        }
        var differences = new ArrayList<Difference>();
        walk(candidate, reference, candidate.name(), differences);
        return differences.isEmpty()
            ? CompareResult.of(CompareStatus.MATCH)
            : new CompareResult(CompareStatus.MISMATCH, differences);
    }

    private static void walk(Node candidate, Node reference, String path, List<Difference> out) {
        if (!candidate.name().equals(reference.name())) {
            out.add(new Difference(path, DiffKind.NAME_MISMATCH, reference.name(), candidate.name()));
            return;
        }
        var candidateChildren = candidate.children();
        var referenceChildren = reference.children();
        int shared = Math.min(candidateChildren.size(), referenceChildren.size());
        if (candidateChildren.size() != referenceChildren.size()) {
            out.add(new Difference(path, DiffKind.CHILD_COUNT_MISMATCH,
                String.valueOf(referenceChildren.size()), String.valueOf(candidateChildren.size())));
            for (int i = shared; i < candidateChildren.size(); i++) {
                out.add(new Difference(path, DiffKind.EXTRA_CHILD, Difference.NONE, candidateChildren.get(i).name()));
            }
            for (int i = shared; i < referenceChildren.size(); i++) {
                out.add(new Difference(path, DiffKind.MISSING_CHILD, referenceChildren.get(i).name(), Difference.NONE));
            }
        }
        for (int i = 0; i < shared; i++) {
            var child = candidateChildren.get(i);
            walk(child, referenceChildren.get(i), path + Difference.SEPARATOR + child.name(), out);
        }
    }
}
