package work.lcod.crosscheck.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import work.lcod.crosscheck.api.CrossCheckConfiguration;

/**
 * Reads {@code crosscheck.toml}:
 * <pre>
 * fixtures = "fixtures"
 * report = "build/report.md"
 *
 * [candidate]
 * command = ["npx", "tree-sitter", "parse"]
 * timeout_seconds = 30
 * dumps = false
 * </pre>
 * Every key is optional. Relative paths are resolved against the file's directory.
 */
public final class SettingsFile {
    public static final String FILE_NAME = "crosscheck.toml";

    private SettingsFile() {}

    /** Applies the file to the builder; a missing file leaves the builder unchanged. */
    public static CrossCheckConfiguration.Builder apply(Path file, CrossCheckConfiguration.Builder builder) {
        if (file == null || !Files.isRegularFile(file)) {
            return builder;
        }
        TomlParseResult settings;
        try {
            settings = Toml.parse(Files.readString(file));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read settings: " + file, ex);
        }
        if (settings.hasErrors()) {
            throw new IllegalStateException("Invalid settings " + file + ": " + settings.errors().get(0).toString());
        }
        var base = file.toAbsolutePath().getParent();

        var fixtures = settings.getString("fixtures");
        if (fixtures != null && !fixtures.isBlank()) {
            builder.fixturesDirectory(base.resolve(fixtures).normalize());
        }
        var report = settings.getString("report");
        if (report != null && !report.isBlank()) {
            builder.reportFile(base.resolve(report).normalize());
        }
        var candidate = settings.getTable("candidate");
        if (candidate != null) {
            var command = candidate.getArray("command");
            if (command != null) {
                builder.candidateCommand(readStrings(file, command));
            }
            var timeout = candidate.getLong("timeout_seconds");
            if (timeout != null) {
                builder.candidateTimeout(Duration.ofSeconds(timeout));
            }
            var dumps = candidate.getBoolean("dumps");
            if (dumps != null) {
                builder.pregeneratedDumps(dumps);
            }
        }
        return builder;
    }

    private static List<String> readStrings(Path file, TomlArray array) {
        var values = new ArrayList<String>(array.size());
        for (int i = 0; i < array.size(); i++) {
            if (!(array.get(i) instanceof String value)) {
                throw new IllegalStateException("Invalid settings " + file + ": candidate.command must hold strings");
            }
            values.add(value);
        }
        return values;
    }
}
