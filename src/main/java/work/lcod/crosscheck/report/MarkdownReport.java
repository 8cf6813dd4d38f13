package work.lcod.crosscheck.report;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import work.lcod.crosscheck.api.CrossChecker;
import work.lcod.crosscheck.api.FixtureResult;
import work.lcod.crosscheck.api.RunSummary;
import work.lcod.crosscheck.compare.CompareStatus;

/**
 * Human-readable run report.
 */
public final class MarkdownReport {
    static final int DETAIL_LIMIT = 20;

    private MarkdownReport() {
    }

    public static String render(RunSummary summary) {
        var lines = new ArrayList<String>();
        summary(lines, summary);
        methodology(lines);
        perFile(lines, summary.results());
        categories(lines, DifferenceTally.of(summary));
        mismatchDetails(lines, summary.results());
        candidateErrors(lines, summary.results());
        return String.join("\n", lines) + "\n";
    }

    public static void write(RunSummary summary, Path file) {
        try {
            var parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, render(summary), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to write report: " + file, ex);
        }
    }

    private static void summary(List<String> lines, RunSummary summary) {
        lines.add("# Tree-sitter Kotlin vs JetBrains PSI: Cross-Validation Report");
        lines.add("");
        lines.add("Structural comparison of tree-sitter-kotlin parse trees against JetBrains PSI");
        lines.add("reference trees for " + summary.total() + " fixture file(s).");
        lines.add("");
        lines.add("## Summary");
        lines.add("");
        lines.add("| Metric | Count |");
        lines.add("|--------|-------|");
        lines.add("| Total fixture files | " + summary.total() + " |");
        lines.add("| Tree-sitter clean parses | " + summary.cleanParses() + " |");
        lines.add("| Tree-sitter parse errors | " + summary.count(CompareStatus.CANDIDATE_PARSE_ERROR) + " |");
        lines.add("| **Structural matches** | **" + summary.count(CompareStatus.MATCH) + "** |");
        lines.add("| Structural mismatches | " + summary.count(CompareStatus.MISMATCH) + " |");
        lines.add("| PSI parse errors | " + summary.count(CompareStatus.REFERENCE_PARSE_ERROR) + " |");
        lines.add("");
        lines.add("**Match rate (among clean parses): " + summary.formattedMatchRate() + "**");
        lines.add("");
    }

    private static void methodology(List<String> lines) {
        lines.add("## Methodology");
        lines.add("");
        lines.add("1. **Parse** each fixture with both parsers and read the two dumps into plain trees.");
        lines.add("2. **Normalize** each tree: dissolve wrapper nodes, rename node types to the PSI");
        lines.add("   vocabulary, and repair the known nesting differences between the two parsers.");
        lines.add("3. **Compare** the normalized trees exactly, recording every name mismatch and");
        lines.add("   child count mismatch with the path where it occurs.");
        lines.add("");
    }

    private static void perFile(List<String> lines, List<FixtureResult> results) {
        lines.add("## Per-File Results");
        lines.add("");
        lines.add("| # | File | Status | Details |");
        lines.add("|---|------|--------|---------|");
        for (int i = 0; i < results.size(); i++) {
            var result = results.get(i);
            lines.add("| " + (i + 1) + " | " + result.name() + " | " + result.status() + " | " + escape(details(result)) + " |");
        }
        lines.add("");
    }

    static String details(FixtureResult result) {
        return switch (result.status()) {
            case MATCH -> result.droppedRoots() > 0
                ? "Structurally identical (" + result.droppedRoots() + " extra root(s) ignored)"
                : "Structurally identical";
            case MISMATCH -> result.differences().size() + " difference(s)";
            case CANDIDATE_PARSE_ERROR -> result.candidateErrorDetail()
                .map(detail -> CrossChecker.errorNodeCount(detail) + " ERROR/MISSING node(s) in tree-sitter output")
                .or(result::errorMessage)
                .orElse("tree-sitter parse error");
            case REFERENCE_PARSE_ERROR -> result.errorMessage().orElse("PSI parse error");
        };
    }

    private static void categories(List<String> lines, DifferenceTally tally) {
        if (tally.isEmpty()) {
            return;
        }
        lines.add("## Mismatch Categories");
        lines.add("");
        lines.add("| Kind | Expected (PSI) | Actual (tree-sitter) | Count | Fixtures |");
        lines.add("|------|----------------|----------------------|-------|----------|");
        for (var category : tally.categories()) {
            lines.add("| " + category.kind() + " | " + escape(category.expected()) + " | " + escape(category.actual())
                + " | " + category.count() + " | " + category.fixtures().size() + " |");
        }
        lines.add("");
    }

    private static void mismatchDetails(List<String> lines, List<FixtureResult> results) {
        var mismatches = results.stream().filter(result -> result.status() == CompareStatus.MISMATCH).toList();
        if (mismatches.isEmpty()) {
            return;
        }
        lines.add("## Detailed Mismatches");
        lines.add("");
        for (var result : mismatches) {
            var differences = result.differences();
            lines.add("### " + result.name());
            lines.add("");
            for (var difference : differences.subList(0, Math.min(DETAIL_LIMIT, differences.size()))) {
                lines.add("- **" + difference.kind() + "** at `" + difference.path() + "`");
                lines.add("  - Expected: `" + difference.expected() + "`");
                lines.add("  - Actual: `" + difference.actual() + "`");
            }
            if (differences.size() > DETAIL_LIMIT) {
                lines.add("- ... and " + (differences.size() - DETAIL_LIMIT) + " more");
            }
            lines.add("");
        }
    }

    private static void candidateErrors(List<String> lines, List<FixtureResult> results) {
        var failed = results.stream().filter(result -> result.status() == CompareStatus.CANDIDATE_PARSE_ERROR).toList();
        if (failed.isEmpty()) {
            return;
        }
        lines.add("## Tree-sitter Parse Errors");
        lines.add("");
        lines.add(failed.size() + " file(s) failed to parse cleanly with tree-sitter.");
        lines.add("");
        for (var result : failed) {
            lines.add("- **" + result.name() + "**");
        }
        lines.add("");
    }

    private static String escape(String cell) {
        return cell.replace("|", "\\|").replace("\n", " ");
    }
}
