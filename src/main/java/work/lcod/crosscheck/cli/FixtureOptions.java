package work.lcod.crosscheck.cli;

import java.nio.file.Path;
import java.util.Arrays;
import picocli.CommandLine;
import work.lcod.crosscheck.api.CrossCheckConfiguration;
import work.lcod.crosscheck.config.DurationParser;
import work.lcod.crosscheck.config.SettingsFile;

/**
 * Options shared by the commands that work on a fixture directory. Values given on the
 * command line override {@code crosscheck.toml}.
 */
final class FixtureOptions {
    @CommandLine.Option(
        names = "--config",
        description = "Settings file (ignored when missing).",
        defaultValue = SettingsFile.FILE_NAME
    )
    Path config;

    @CommandLine.Option(
        names = {"-f", "--fixtures"},
        description = "Directory holding Foo.kt / Foo.txt fixture pairs.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path fixtures;

    @CommandLine.Option(
        names = "--dumps",
        description = "Read pre-generated Foo.ts dumps instead of running tree-sitter."
    )
    boolean dumps;

    @CommandLine.Option(
        names = "--parser-command",
        description = "Command printing the S-expression tree of the file appended to it (e.g. 'npx tree-sitter parse').",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String parserCommand;

    @CommandLine.Option(
        names = "--timeout",
        description = "Timeout of one parser run (e.g. 30s, 2m).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String timeoutRaw;

    CrossCheckConfiguration.Builder builder() {
        var builder = SettingsFile.apply(config, CrossCheckConfiguration.builder());
        if (fixtures != null) {
            builder.fixturesDirectory(fixtures.toAbsolutePath().normalize());
        }
        if (dumps) {
            builder.pregeneratedDumps(true);
        }
        if (parserCommand != null && !parserCommand.isBlank()) {
            builder.candidateCommand(Arrays.asList(parserCommand.trim().split("\\s+")));
        }
        if (timeoutRaw != null) {
            builder.candidateTimeout(DurationParser.parse(timeoutRaw));
        }
        return builder;
    }
}
