package work.lcod.crosscheck.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "crosscheck",
    description = "Cross-validate tree-sitter-kotlin parse trees against JetBrains PSI dumps.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        RunCommand.class,
        DebugCommand.class,
        CompareCommand.class,
        CheckTablesCommand.class
    }
)
final class CrossCheckCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return CommandLine.ExitCode.USAGE;
    }
}
