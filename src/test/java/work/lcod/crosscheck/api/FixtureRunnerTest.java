package work.lcod.crosscheck.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.crosscheck.compare.CompareStatus;

class FixtureRunnerTest {
    private static final Path FIXTURES = Path.of("src", "test", "resources", "fixtures");

    @TempDir
    Path workDir;

    private FixtureRunner runner;

    @BeforeEach
    void setUp() throws IOException {
        for (var name : List.of("BabySteps", "Greeter")) {
            for (var extension : List.of(".kt", ".txt", ".ts")) {
                Files.copy(FIXTURES.resolve(name + extension), workDir.resolve(name + extension));
            }
        }
        write("Broken.kt", "class {");
        write("Broken.ts", "(source_file (ERROR (class_declaration)))");
        write("Broken.txt", "KtFile: Broken.kt\n  CLASS\n");
        write("Lonely.kt", "class Lonely");
        write("Lonely.ts", "(source_file (class_declaration (type_identifier)))");
        write("NoDump.kt", "class NoDump");
        write("NoDump.txt", "KtFile: NoDump.kt\n  CLASS\n");
        write("Shifted.kt", "class Shifted");
        write("Shifted.ts", "(source_file (class_declaration (type_identifier)))");
        write("Shifted.txt", "KtFile: Shifted.kt\n  CLASS\nFUN\n");
        write("Wrong.kt", "fun wrong() {}");
        write("Wrong.ts", "(source_file (function_declaration (simple_identifier) (function_value_parameters) (function_body)))");
        write("Wrong.txt", "KtFile: Wrong.kt\n  CLASS\n");
        write("notes.md", "not a fixture");
        runner = new FixtureRunner(workDir, new PregeneratedDumpSource(), new CrossChecker());
    }

    private void write(String fileName, String content) throws IOException {
        Files.writeString(workDir.resolve(fileName), content);
    }

    @Test
    void listsSourcesInNameOrder() {
        var names = runner.fixtures().stream().map(FixtureRunner::baseName).toList();
        assertEquals(List.of("BabySteps", "Broken", "Greeter", "Lonely", "NoDump", "Shifted", "Wrong"), names);
    }

    @Test
    void classifiesEveryFixture() {
        var seen = new ArrayList<String>();
        var summary = runner.runAll(result -> seen.add(result.name()));
        assertEquals(7, seen.size());

        var statuses = summary.results().stream().map(FixtureResult::status).toList();
        assertEquals(List.of(
            CompareStatus.MATCH,
            CompareStatus.CANDIDATE_PARSE_ERROR,
            CompareStatus.MATCH,
            CompareStatus.REFERENCE_PARSE_ERROR,
            CompareStatus.CANDIDATE_PARSE_ERROR,
            CompareStatus.REFERENCE_PARSE_ERROR,
            CompareStatus.MISMATCH
        ), statuses);
        assertEquals("2/5 (40.0%)", summary.formattedMatchRate());
    }

    @Test
    void candidateErrorsKeepTheDump() {
        var result = runner.check(workDir.resolve("Broken.kt"));
        assertEquals(CompareStatus.CANDIDATE_PARSE_ERROR, result.status());
        assertTrue(result.candidateErrorDetail().orElseThrow().contains("(ERROR"));
        assertTrue(result.compareResult().isEmpty());
    }

    @Test
    void missingReferenceAndCandidateAreExplained() {
        assertTrue(runner.check(workDir.resolve("Lonely.kt")).errorMessage().orElseThrow().contains(".txt"));
        assertTrue(runner.check(workDir.resolve("NoDump.kt")).errorMessage().orElseThrow().contains("NoDump.ts"));
    }

    @Test
    void malformedReferenceIsAReferenceError() {
        var result = runner.check(workDir.resolve("Shifted.kt"));
        assertEquals(CompareStatus.REFERENCE_PARSE_ERROR, result.status());
        assertTrue(result.errorMessage().orElseThrow().contains("indentation"));
    }

    @Test
    void debugRunExposesBothTrees() {
        var run = runner.debug("Wrong");
        assertEquals("Wrong", run.name());
        assertEquals("KtFile(FUN(BLOCK))", run.trace().candidate().orElseThrow().toString());
        assertEquals("KtFile(CLASS)", run.trace().reference().orElseThrow().toString());
        assertFalse(run.trace().result().isMatch());
        assertThrows(IllegalArgumentException.class, () -> runner.debug("Missing"));
    }

    @Test
    void debugRunReportsTreeSitterErrors() {
        var trace = runner.debug("Broken").trace();
        assertEquals(CompareStatus.CANDIDATE_PARSE_ERROR, trace.result().status());
        assertTrue(trace.candidateErrors().orElseThrow().contains("(ERROR"));
        assertTrue(trace.candidate().isEmpty());
    }

    @Test
    void missingDirectoryFails() {
        var missing = new FixtureRunner(workDir.resolve("absent"), new PregeneratedDumpSource(), new CrossChecker());
        assertThrows(IllegalStateException.class, missing::fixtures);
    }
}
