package work.lcod.crosscheck.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.crosscheck.api.CrossChecker;

@CommandLine.Command(
    name = "compare",
    description = "Compare a tree-sitter dump file with a PSI dump file.",
    mixinStandardHelpOptions = true
)
final class CompareCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "CANDIDATE", description = "tree-sitter S-expression dump.")
    private Path candidate;

    @CommandLine.Parameters(index = "1", paramLabel = "REFERENCE", description = "PSI text dump.")
    private Path reference;

    @Override
    public Integer call() {
        var trace = new CrossChecker().trace(read(candidate), read(reference));
        var result = trace.result();
        var out = spec.commandLine().getOut();
        out.println(result.status());
        DebugCommand.printCandidateErrors(out, trace);
        DebugCommand.printDifferences(out, result.differences());
        return result.isMatch() ? 0 : 1;
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read dump: " + file, ex);
        }
    }
}
