package work.lcod.crosscheck.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code tree-sitter parse <file>} (or a configured equivalent) and captures stdout.
 * A non-zero exit code is expected when the tree contains ERROR nodes, so the output is
 * kept whenever there is some.
 */
public final class TreeSitterProcessSource implements CandidateSource {
    private final List<String> command;
    private final Duration timeout;

    public TreeSitterProcessSource(List<String> command, Duration timeout) {
        this.command = List.copyOf(Objects.requireNonNull(command, "command"));
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public String dump(Path sourceFile) throws CandidateUnavailableException {
        var arguments = new ArrayList<>(command);
        arguments.add(sourceFile.toString());
        Path output = null;
        Process process = null;
        try {
            output = Files.createTempFile("crosscheck-", ".ts");
            var builder = new ProcessBuilder(arguments);
            builder.redirectOutput(output.toFile());
            builder.redirectError(ProcessBuilder.Redirect.DISCARD);
            process = builder.start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new CandidateUnavailableException(
                    String.join(" ", arguments) + " timed out after " + timeout.toSeconds() + "s");
            }
            var text = Files.readString(output, StandardCharsets.UTF_8);
            if (text.isBlank() && process.exitValue() != 0) {
                throw new CandidateUnavailableException(
                    String.join(" ", arguments) + " exited with code " + process.exitValue() + " and no output");
            }
            return text;
        } catch (IOException ex) {
            throw new CandidateUnavailableException("Failed to run " + String.join(" ", arguments), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CandidateUnavailableException("Interrupted while running " + String.join(" ", arguments), ex);
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            deleteQuietly(output);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            System.err.println("Warning: could not delete " + file + ": " + ex.getMessage());
        }
    }
}
