package work.lcod.crosscheck.cli;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.crosscheck.api.CrossChecker;
import work.lcod.crosscheck.api.FixtureRunner;
import work.lcod.crosscheck.compare.Difference;
import work.lcod.crosscheck.model.Node;

@CommandLine.Command(
    name = "debug",
    description = "Show raw and normalized trees of one fixture with its differences.",
    mixinStandardHelpOptions = true
)
final class DebugCommand implements Callable<Integer> {
    @CommandLine.Mixin
    private FixtureOptions options = new FixtureOptions();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "NAME", description = "Fixture name without extension.")
    private String name;

    @Override
    public Integer call() {
        var runner = new FixtureRunner(options.builder().build());
        var run = runner.debug(name);
        var trace = run.trace();
        var out = spec.commandLine().getOut();

        out.println("=== Debug: " + name + " ===");
        out.println();
        out.println("Status: " + trace.result().status());
        out.println();
        printCandidateErrors(out, trace);
        section(out, "Raw tree-sitter tree", trace.candidateRaw() == null ? "(absent)" : trace.candidateRaw().render());
        section(out, "Raw PSI tree", trace.referenceRaw() == null ? "(absent)" : trace.referenceRaw().render());
        section(out, "Normalized tree-sitter tree", render(trace.candidateForest()));
        section(out, "Normalized PSI tree", render(trace.referenceForest()));
        printDifferences(out, trace.result().differences());
        return trace.result().isMatch() ? 0 : 1;
    }

    private static void section(PrintWriter out, String title, String body) {
        out.println("--- " + title + " ---");
        out.println(body);
        out.println();
    }

    private static String render(List<Node> forest) {
        if (forest.isEmpty()) {
            return "(empty)";
        }
        var builder = new StringBuilder();
        for (int i = 0; i < forest.size(); i++) {
            if (i > 0) {
                builder.append("\n(ignored root sibling)\n");
            }
            builder.append(forest.get(i).render());
        }
        return builder.toString();
    }

    static void printCandidateErrors(PrintWriter out, CrossChecker.Trace trace) {
        trace.candidateErrors().ifPresent(detail -> {
            out.println("--- tree-sitter errors (" + CrossChecker.errorNodeCount(detail) + " ERROR/MISSING node(s)) ---");
            out.println(detail);
            out.println();
        });
    }

    static void printDifferences(PrintWriter out, List<Difference> differences) {
        if (differences.isEmpty()) {
            return;
        }
        out.println("--- Differences ---");
        for (var difference : differences) {
            out.println("  " + difference.kind() + " at " + difference.path());
            out.println("    expected: " + difference.expected());
            out.println("    actual:   " + difference.actual());
        }
        out.println();
    }
}
