package work.lcod.crosscheck.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.crosscheck.api.FixtureResult;
import work.lcod.crosscheck.api.RunSummary;
import work.lcod.crosscheck.compare.CompareResult;
import work.lcod.crosscheck.compare.CompareStatus;
import work.lcod.crosscheck.compare.DiffKind;
import work.lcod.crosscheck.compare.Difference;

class ReportsTest {
    @TempDir
    Path workDir;

    private static CompareResult mismatch(Difference... differences) {
        return new CompareResult(CompareStatus.MISMATCH, List.of(differences));
    }

    private static RunSummary summary() {
        var missingList = new Difference("KtFile > CLASS", DiffKind.MISSING_CHILD, "TYPE_PARAMETER_LIST", Difference.NONE);
        var count = new Difference("KtFile > CLASS", DiffKind.CHILD_COUNT_MISMATCH, "1", "0");
        var name = new Difference("KtFile > FUN", DiffKind.NAME_MISMATCH, "PROPERTY", "FUN");
        return new RunSummary(List.of(
            FixtureResult.compared("Alpha", CompareResult.of(CompareStatus.MATCH), 0),
            FixtureResult.compared("Beta", mismatch(count, missingList), 0),
            FixtureResult.compared("Gamma", mismatch(count, missingList, name), 0),
            FixtureResult.candidateErrors("Delta", "(source_file (ERROR) (MISSING \"}\"))")));
    }

    @Test
    void tallyGroupsByKindAndNames() {
        var categories = DifferenceTally.of(summary()).categories();
        assertEquals(3, categories.size());
        assertEquals(DiffKind.CHILD_COUNT_MISMATCH, categories.get(0).kind());
        assertEquals(2, categories.get(0).count());
        assertEquals(List.of("Beta", "Gamma"), categories.get(0).fixtures());
        assertEquals(DiffKind.MISSING_CHILD, categories.get(1).kind());
        assertEquals(1, categories.get(2).count());
    }

    @Test
    void csvHasHeaderAndOneRowPerCategory() throws IOException {
        var out = new StringWriter();
        DifferenceTally.of(summary()).writeCsv(out);
        var lines = out.toString().split("\r\n");
        assertEquals("kind,expected,actual,count,fixtures", lines[0]);
        assertEquals("CHILD_COUNT_MISMATCH,1,0,2,Beta Gamma", lines[1]);
        assertEquals(4, lines.length);
    }

    @Test
    void markdownHasEverySection() {
        var markdown = MarkdownReport.render(summary());
        assertTrue(markdown.startsWith("# Tree-sitter Kotlin vs JetBrains PSI: Cross-Validation Report"));
        assertTrue(markdown.contains("| **Structural matches** | **1** |"));
        assertTrue(markdown.contains("**Match rate (among clean parses): 1/3 (33.3%)**"));
        assertTrue(markdown.contains("| 2 | Beta | MISMATCH | 2 difference(s) |"));
        assertTrue(markdown.contains("| 4 | Delta | CANDIDATE_PARSE_ERROR | 2 ERROR/MISSING node(s) in tree-sitter output |"));
        assertTrue(markdown.contains("## Mismatch Categories"));
        assertTrue(markdown.contains("- **NAME_MISMATCH** at `KtFile > FUN`"));
        assertTrue(markdown.contains("## Tree-sitter Parse Errors"));
    }

    @Test
    void longMismatchListsAreCut() {
        var differences = new ArrayList<Difference>();
        for (int i = 0; i < MarkdownReport.DETAIL_LIMIT + 5; i++) {
            differences.add(new Difference("X", DiffKind.EXTRA_CHILD, Difference.NONE, "N" + i));
        }
        var summary = new RunSummary(List.of(FixtureResult.compared("Big", new CompareResult(CompareStatus.MISMATCH, differences), 0)));
        var markdown = MarkdownReport.render(summary);
        assertTrue(markdown.contains("- ... and 5 more"));
        assertFalse(markdown.contains("`N" + MarkdownReport.DETAIL_LIMIT + "`"));
    }

    @Test
    void matchDetailsMentionIgnoredRoots() {
        var result = FixtureResult.compared("Roots", CompareResult.of(CompareStatus.MATCH), 2);
        assertEquals("Structurally identical (2 extra root(s) ignored)", MarkdownReport.details(result));
    }

    @Test
    void jsonReportRoundTripsThroughJackson() throws IOException {
        var file = workDir.resolve("report.json");
        JsonReport.write(summary(), file);
        var root = new ObjectMapper().readTree(Files.readString(file));
        assertEquals("mismatch", root.path("status").asText());
        assertEquals(4, root.path("summary").path("total").asInt());
        assertEquals(3, root.path("categories").size());
        assertEquals("candidate_parse_error", root.path("results").get(3).path("status").asText());
        assertEquals(3, root.path("results").get(2).path("differences").size());
    }

    @Test
    void markdownWriteCreatesParentDirectories() throws IOException {
        var file = workDir.resolve("out").resolve("report.md");
        MarkdownReport.write(summary(), file);
        assertTrue(Files.readString(file).contains("## Per-File Results"));
    }
}
