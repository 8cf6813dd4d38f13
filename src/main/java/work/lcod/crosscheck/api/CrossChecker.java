package work.lcod.crosscheck.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import work.lcod.crosscheck.compare.CompareResult;
import work.lcod.crosscheck.compare.CompareStatus;
import work.lcod.crosscheck.compare.TreeComparator;
import work.lcod.crosscheck.dump.DumpParser;
import work.lcod.crosscheck.dump.IndentedDumpParser;
import work.lcod.crosscheck.dump.SExpressionDumpParser;
import work.lcod.crosscheck.model.Dialect;
import work.lcod.crosscheck.model.Node;
import work.lcod.crosscheck.normalize.CandidateNormalizer;
import work.lcod.crosscheck.normalize.ReferenceNormalizer;
import work.lcod.crosscheck.normalize.TreeNormalizer;

/**
 * Parse, normalize and compare one pair of dumps. Stateless; safe to share between threads.
 */
public final class CrossChecker {
    static final int DETAIL_LIMIT = 500;
    private static final Pattern ERROR_NODE = Pattern.compile("\\((ERROR|MISSING)\\b");

    private final DumpParser candidateParser;
    private final DumpParser referenceParser;
    private final TreeNormalizer candidateNormalizer;
    private final TreeNormalizer referenceNormalizer;

    public CrossChecker() {
        this(new SExpressionDumpParser(), new IndentedDumpParser(), new CandidateNormalizer(), new ReferenceNormalizer());
    }

    public CrossChecker(
        DumpParser candidateParser,
        DumpParser referenceParser,
        TreeNormalizer candidateNormalizer,
        TreeNormalizer referenceNormalizer
    ) {
        this.candidateParser = requireDialect(candidateParser, Dialect.CANDIDATE);
        this.referenceParser = requireDialect(referenceParser, Dialect.REFERENCE);
        this.candidateNormalizer = Objects.requireNonNull(candidateNormalizer, "candidateNormalizer");
        this.referenceNormalizer = Objects.requireNonNull(referenceNormalizer, "referenceNormalizer");
    }

    private static DumpParser requireDialect(DumpParser parser, Dialect dialect) {
        Objects.requireNonNull(parser, dialect.label() + " parser");
        if (parser.dialect() != dialect) {
            throw new IllegalArgumentException("Expected a " + dialect.label() + " parser, got " + parser.dialect().label());
        }
        return parser;
    }

    /**
     * Every intermediate tree of one check. Raw trees are {@code null} when the dump was absent
     * or when tree-sitter reported errors; {@code candidateErrors} then holds the start of the dump.
     */
    public record Trace(
        Node candidateRaw,
        Node referenceRaw,
        List<Node> candidateForest,
        List<Node> referenceForest,
        CompareResult result,
        Optional<String> candidateErrors
    ) {
        public Trace {
            candidateForest = List.copyOf(candidateForest);
            referenceForest = List.copyOf(referenceForest);
            Objects.requireNonNull(result, "result");
            candidateErrors = candidateErrors == null ? Optional.empty() : candidateErrors;
        }

        public Optional<Node> candidate() {
            return candidateForest.stream().findFirst();
        }

        public Optional<Node> reference() {
            return referenceForest.stream().findFirst();
        }

        /** Normalized root siblings left out of the comparison, both sides together. */
        public int droppedRoots() {
            return Math.max(0, candidateForest.size() - 1) + Math.max(0, referenceForest.size() - 1);
        }
    }

    /**
     * Checks two dumps; a {@code null} text is an absent dump. A candidate dump holding
     * {@code ERROR} or {@code MISSING} nodes is a candidate parse error and is not compared.
     *
     * @throws work.lcod.crosscheck.dump.MalformedDumpException when a dump violates its format
     */
    public Trace trace(String candidateDump, String referenceDump) {
        if (candidateDump != null && errorNodeCount(candidateDump) > 0) {
            return new Trace(null, null, List.of(), List.of(),
                CompareResult.of(CompareStatus.CANDIDATE_PARSE_ERROR), Optional.of(truncate(candidateDump)));
        }
        var candidateRaw = candidateDump == null ? null : candidateParser.parse(candidateDump);
        var referenceRaw = referenceDump == null ? null : referenceParser.parse(referenceDump);
        List<Node> candidateForest = candidateRaw == null ? List.of() : candidateNormalizer.normalizeAll(candidateRaw);
        List<Node> referenceForest = referenceRaw == null ? List.of() : referenceNormalizer.normalizeAll(referenceRaw);
        var result = TreeComparator.compare(
            candidateForest.isEmpty() ? null : candidateForest.get(0),
            referenceForest.isEmpty() ? null : referenceForest.get(0));
        return new Trace(candidateRaw, referenceRaw, candidateForest, referenceForest, result, Optional.empty());
    }

    public CompareResult check(String candidateDump, String referenceDump) {
        return trace(candidateDump, referenceDump).result();
    }

    /** Number of {@code (ERROR} and {@code (MISSING} nodes in a tree-sitter dump. */
    public static long errorNodeCount(String candidateDump) {
        return ERROR_NODE.matcher(candidateDump).results().count();
    }

    static String truncate(String text) {
        return text.length() <= DETAIL_LIMIT ? text : text.substring(0, DETAIL_LIMIT);
    }
}
