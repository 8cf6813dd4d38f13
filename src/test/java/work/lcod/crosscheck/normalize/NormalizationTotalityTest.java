package work.lcod.crosscheck.normalize;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import work.lcod.crosscheck.compare.CompareStatus;
import work.lcod.crosscheck.compare.TreeComparator;
import work.lcod.crosscheck.mapping.CandidateKind;
import work.lcod.crosscheck.mapping.Canonical;
import work.lcod.crosscheck.mapping.ReferenceKind;
import work.lcod.crosscheck.model.Node;

/**
 * Every known node name, bare or with odd children, normalizes without failing, and every
 * pair of resulting canonical trees compares to a structural verdict.
 */
class NormalizationTotalityTest {
    private static final List<String> CANDIDATE_NAMES = Arrays.stream(CandidateKind.values())
        .map(CandidateKind::grammarName)
        .collect(Collectors.toList());
    private static final List<String> REFERENCE_NAMES = Arrays.stream(ReferenceKind.values())
        .map(ReferenceKind::dumpName)
        .collect(Collectors.toList());
    private static final Set<String> CANONICAL_LABELS = Arrays.stream(Canonical.values())
        .map(Canonical::label)
        .collect(Collectors.toSet());

    private final CandidateNormalizer candidateNormalizer = new CandidateNormalizer();
    private final ReferenceNormalizer referenceNormalizer = new ReferenceNormalizer();

    /** Raw shapes around one name: bare, unknown children, self-nesting, a call chain, every sibling name. */
    private static List<Node> shapes(String name, List<String> vocabulary, List<String> foreign) {
        var shapes = new ArrayList<Node>();
        shapes.add(Node.leaf(name));
        shapes.add(Node.of(name, Node.leaf("mystery_node"), Node.of("MYSTERY", Node.leaf(name))));
        shapes.add(Node.of(name, Node.leaf(name), Node.of(name, Node.leaf(name))));
        shapes.add(Node.of(name,
            Node.of("navigation_expression", Node.leaf("simple_identifier"), Node.of("navigation_suffix", Node.leaf("simple_identifier"))),
            Node.of("call_suffix", Node.leaf("value_arguments"), Node.leaf("annotated_lambda")),
            Node.of("statements", Node.leaf("simple_identifier")),
            Node.of("call_expression")));
        shapes.add(new Node(name, vocabulary.stream().map(Node::leaf).collect(Collectors.toList())));
        shapes.add(new Node(name, foreign.stream().limit(10).map(Node::leaf).collect(Collectors.toList())));
        return shapes;
    }

    private static List<Node> normalizeEverything(TreeNormalizer normalizer, List<String> names, List<String> foreign) {
        var trees = new LinkedHashSet<Node>();
        for (var name : names) {
            for (var raw : shapes(name, names, foreign)) {
                var forest = assertDoesNotThrow(() -> normalizer.normalizeAll(raw), raw.toString());
                trees.addAll(forest);
            }
        }
        return new ArrayList<>(trees);
    }

    private static void assertCanonical(Node node) {
        assertTrue(CANONICAL_LABELS.contains(node.name()), node.name());
        node.children().forEach(NormalizationTotalityTest::assertCanonical);
    }

    @Test
    void everyCandidateShapeNormalizesToCanonicalNames() {
        var trees = normalizeEverything(candidateNormalizer, CANDIDATE_NAMES, REFERENCE_NAMES);
        assertFalse(trees.isEmpty());
        trees.forEach(NormalizationTotalityTest::assertCanonical);
    }

    @Test
    void everyReferenceShapeNormalizesToCanonicalNames() {
        var trees = normalizeEverything(referenceNormalizer, REFERENCE_NAMES, CANDIDATE_NAMES);
        assertFalse(trees.isEmpty());
        trees.forEach(NormalizationTotalityTest::assertCanonical);
    }

    @Test
    void callTryAndCatchShapesSurviveOddChildren() {
        for (var name : List.of("call_expression", "catch_block", "try_expression", "finally_block",
            "secondary_constructor", "anonymous_initializer", "lambda_literal", "annotation")) {
            for (var raw : shapes(name, List.of("call_expression", "statements", "value_arguments"), List.of("CLASS"))) {
                var forest = assertDoesNotThrow(() -> candidateNormalizer.normalizeAll(raw), raw.toString());
                assertEquals(1, forest.size(), raw.toString());
            }
        }
    }

    @Test
    void everyPairOfNormalizedTreesComparesStructurally() {
        var trees = new ArrayList<Node>();
        trees.addAll(normalizeEverything(candidateNormalizer, CANDIDATE_NAMES, REFERENCE_NAMES));
        trees.addAll(normalizeEverything(referenceNormalizer, REFERENCE_NAMES, CANDIDATE_NAMES));
        for (var candidate : trees) {
            assertEquals(CompareStatus.MATCH, TreeComparator.compare(candidate, candidate).status(), candidate.toString());
            for (var reference : trees) {
                var result = assertDoesNotThrow(() -> TreeComparator.compare(candidate, reference));
                var expected = candidate.equals(reference) ? CompareStatus.MATCH : CompareStatus.MISMATCH;
                assertEquals(expected, result.status(), candidate + " vs " + reference);
            }
        }
    }
}
