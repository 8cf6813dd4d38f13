package work.lcod.crosscheck.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable configuration of a fixture run.
 */
public record CrossCheckConfiguration(
    Path fixturesDirectory,
    Path reportFile,
    List<String> candidateCommand,
    Duration candidateTimeout,
    boolean pregeneratedDumps
) {
    public static final List<String> DEFAULT_COMMAND = List.of("tree-sitter", "parse");
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public CrossCheckConfiguration {
        Objects.requireNonNull(fixturesDirectory, "fixturesDirectory");
        Objects.requireNonNull(reportFile, "reportFile");
        Objects.requireNonNull(candidateCommand, "candidateCommand");
        Objects.requireNonNull(candidateTimeout, "candidateTimeout");
        candidateCommand = List.copyOf(candidateCommand);
        if (candidateCommand.isEmpty()) {
            throw new IllegalArgumentException("Candidate command must not be empty");
        }
        if (candidateTimeout.isNegative() || candidateTimeout.isZero()) {
            throw new IllegalArgumentException("Candidate timeout must be positive: " + candidateTimeout);
        }
    }

    /** Sibling of the Markdown report with another extension, e.g. {@code report.json}. */
    public Path reportSibling(String extension) {
        var fileName = reportFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        var base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return reportFile.resolveSibling(base + "." + extension);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path fixturesDirectory = Path.of("fixtures");
        private Path reportFile = Path.of("report.md");
        private List<String> candidateCommand = DEFAULT_COMMAND;
        private Duration candidateTimeout = DEFAULT_TIMEOUT;
        private boolean pregeneratedDumps;

        public Builder fixturesDirectory(Path fixturesDirectory) {
            this.fixturesDirectory = fixturesDirectory;
            return this;
        }

        public Builder reportFile(Path reportFile) {
            this.reportFile = reportFile;
            return this;
        }

        public Builder candidateCommand(List<String> candidateCommand) {
            this.candidateCommand = candidateCommand;
            return this;
        }

        public Builder candidateTimeout(Duration candidateTimeout) {
            this.candidateTimeout = candidateTimeout;
            return this;
        }

        public Builder pregeneratedDumps(boolean pregeneratedDumps) {
            this.pregeneratedDumps = pregeneratedDumps;
            return this;
        }

        public CrossCheckConfiguration build() {
            return new CrossCheckConfiguration(
                fixturesDirectory,
                reportFile,
                candidateCommand,
                candidateTimeout,
                pregeneratedDumps
            );
        }
    }
}
