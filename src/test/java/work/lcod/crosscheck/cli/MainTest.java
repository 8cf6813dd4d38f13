package work.lcod.crosscheck.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class MainTest {
    private static final String FIXTURES = Path.of("src", "test", "resources", "fixtures").toString();

    @TempDir
    Path workDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        return new CommandLine(new CrossCheckCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler())
            .setOut(new PrintWriter(out, true))
            .setErr(new PrintWriter(err, true))
            .execute(args);
    }

    private String noConfig() {
        return workDir.resolve("none.toml").toString();
    }

    @Test
    void runWritesAllReports() {
        var report = workDir.resolve("reports").resolve("cross.md");
        int exit = run("run", "--config", noConfig(), "--dumps", "-f", FIXTURES, "-r", report.toString());
        assertEquals(0, exit, err.toString());
        assertTrue(Files.isRegularFile(report));
        assertTrue(Files.isRegularFile(report.resolveSibling("cross.json")));
        assertTrue(Files.isRegularFile(report.resolveSibling("cross.csv")));
        assertTrue(err.toString().contains("[1/2] BabySteps MATCH"));
        assertTrue(err.toString().contains("Match rate (clean parses): 2/2 (100.0%)"));
    }

    @Test
    void runPrintsJsonOnRequest() {
        var report = workDir.resolve("report.md");
        int exit = run("run", "--config", noConfig(), "--dumps", "-f", FIXTURES, "-r", report.toString(), "--json");
        assertEquals(0, exit);
        assertTrue(out.toString().contains("\"status\" : \"ok\""));
    }

    @Test
    void failOnMismatchSetsExitCode() throws IOException {
        var fixtures = Files.createDirectories(workDir.resolve("fixtures"));
        Files.writeString(fixtures.resolve("Wrong.kt"), "fun wrong() {}");
        Files.writeString(fixtures.resolve("Wrong.ts"), "(source_file (function_declaration (simple_identifier) (function_body)))");
        Files.writeString(fixtures.resolve("Wrong.txt"), "KtFile: Wrong.kt\n  CLASS\n");
        var report = workDir.resolve("report.md").toString();

        assertEquals(0, run("run", "--config", noConfig(), "--dumps", "-f", fixtures.toString(), "-r", report));
        assertEquals(1, run("run", "--config", noConfig(), "--dumps", "-f", fixtures.toString(), "-r", report, "--fail-on-mismatch"));
    }

    @Test
    void settingsFileSuppliesDefaults() throws IOException {
        var config = workDir.resolve("crosscheck.toml");
        var fixtures = Path.of(FIXTURES).toAbsolutePath().toString().replace("\\", "/");
        Files.writeString(config, "fixtures = \"" + fixtures + "\"\nreport = \"out/report.md\"\n\n[candidate]\ndumps = true\n");
        assertEquals(0, run("run", "--config", config.toString()), err.toString());
        assertTrue(Files.isRegularFile(workDir.resolve("out").resolve("report.md")));
    }

    @Test
    void debugPrintsBothSides() {
        int exit = run("debug", "--config", noConfig(), "--dumps", "-f", FIXTURES, "Greeter");
        assertEquals(0, exit, err.toString());
        var text = out.toString();
        assertTrue(text.contains("--- Raw tree-sitter tree ---"));
        assertTrue(text.contains("--- Normalized PSI tree ---"));
        assertTrue(text.contains("Status: MATCH"));
    }

    @Test
    void compareReportsDifferences() throws IOException {
        var candidate = Files.writeString(workDir.resolve("a.ts"), "(source_file (class_declaration))");
        var reference = Files.writeString(workDir.resolve("a.txt"), "KtFile: a.kt\n  FUN\n");
        assertEquals(1, run("compare", candidate.toString(), reference.toString()));
        assertTrue(out.toString().contains("NAME_MISMATCH at KtFile > CLASS"));

        var fixtures = Path.of(FIXTURES);
        assertEquals(0, run("compare", fixtures.resolve("BabySteps.ts").toString(), fixtures.resolve("BabySteps.txt").toString()));
    }

    @Test
    void compareFlagsTreeSitterErrors() throws IOException {
        var candidate = Files.writeString(workDir.resolve("a.ts"), "(source_file (ERROR (class_declaration (type_identifier))))");
        var reference = Files.writeString(workDir.resolve("a.txt"), "KtFile: a.kt\n  CLASS\n  PsiErrorElement:Expecting '{'\n");
        assertEquals(1, run("compare", candidate.toString(), reference.toString()));
        var text = out.toString();
        assertTrue(text.startsWith("CANDIDATE_PARSE_ERROR"), text);
        assertTrue(text.contains("1 ERROR/MISSING node(s)"), text);
    }

    @Test
    void checkTablesPasses() {
        var nodeTypes = Path.of("src", "test", "resources", "grammar", "node-types.json").toString();
        assertEquals(0, run("check-tables", "--node-types", nodeTypes), err.toString());
        assertTrue(err.toString().contains("consistent"));
    }

    @Test
    void failuresAreOneLine() {
        int exit = run("run", "--config", noConfig(), "--dumps", "-f", workDir.resolve("absent").toString());
        assertEquals(1, exit);
        assertTrue(err.toString().contains("Fixtures directory not found"));
        assertTrue(!err.toString().contains("\tat "));
    }

    @Test
    void noSubcommandPrintsUsage() {
        assertEquals(CommandLine.ExitCode.USAGE, run());
        assertTrue(err.toString().contains("Usage: crosscheck"));
    }

    @Test
    void versionIsPrinted() {
        assertEquals(0, run("--version"));
        assertTrue(out.toString().startsWith("crosscheck "));
    }
}
