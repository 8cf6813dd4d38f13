package work.lcod.crosscheck.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.crosscheck.api.FixtureResult;
import work.lcod.crosscheck.api.FixtureRunner;
import work.lcod.crosscheck.api.RunSummary;
import work.lcod.crosscheck.compare.CompareStatus;
import work.lcod.crosscheck.report.DifferenceTally;
import work.lcod.crosscheck.report.JsonReport;
import work.lcod.crosscheck.report.MarkdownReport;

@CommandLine.Command(
    name = "run",
    description = "Check every fixture and write the Markdown, JSON and CSV reports.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class RunCommand implements Callable<Integer> {
    @CommandLine.Mixin
    private FixtureOptions options = new FixtureOptions();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-r", "--report"},
        description = "Markdown report path; report.json and report.csv are written next to it.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path report;

    @CommandLine.Option(
        names = "--json",
        description = "Also print the JSON report to stdout."
    )
    private boolean json;

    @CommandLine.Option(
        names = "--fail-on-mismatch",
        description = "Exit with code 1 unless every clean parse matches."
    )
    private boolean failOnMismatch;

    @Override
    public Integer call() {
        var builder = options.builder();
        if (report != null) {
            builder.reportFile(report.toAbsolutePath().normalize());
        }
        var configuration = builder.build();
        var err = spec.commandLine().getErr();
        var runner = new FixtureRunner(configuration);
        var fixtures = runner.fixtures().size();

        err.println("Running cross-validation on " + fixtures + " fixture(s) in " + configuration.fixturesDirectory());
        var progress = new int[] {0};
        var summary = runner.runAll(result -> {
            progress[0]++;
            err.printf("[%d/%d] %s %s%n", progress[0], fixtures, result.name(), result.status());
            warnDroppedRoots(err, result);
        });

        MarkdownReport.write(summary, configuration.reportFile());
        JsonReport.write(summary, configuration.reportSibling("json"));
        DifferenceTally.of(summary).writeCsv(configuration.reportSibling("csv"));

        printSummary(err, summary);
        err.println();
        err.println("Report saved to: " + configuration.reportFile());
        if (json) {
            spec.commandLine().getOut().println(JsonReport.render(summary));
        }
        boolean mismatched = summary.count(CompareStatus.MISMATCH) > 0;
        return failOnMismatch && mismatched ? 1 : 0;
    }

    private static void warnDroppedRoots(PrintWriter err, FixtureResult result) {
        if (result.droppedRoots() > 0) {
            err.println("  Warning: " + result.droppedRoots() + " normalized root sibling(s) were not compared");
        }
    }

    static void printSummary(PrintWriter err, RunSummary summary) {
        err.println();
        err.println("Results: " + summary.total() + " files");
        for (var status : CompareStatus.values()) {
            err.printf("  %-22s %d%n", status + ":", summary.count(status));
        }
        if (summary.cleanParses() > 0) {
            err.println();
            err.println("  Match rate (clean parses): " + summary.formattedMatchRate());
        }
    }
}
