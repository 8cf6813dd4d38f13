package work.lcod.crosscheck.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import work.lcod.crosscheck.compare.CompareStatus;
import work.lcod.crosscheck.dump.MalformedDumpException;
import work.lcod.crosscheck.model.Dialect;

/**
 * Runs the cross-check over a fixture directory: every {@code Foo.kt} paired with its PSI
 * dump {@code Foo.txt}, in file name order.
 */
public final class FixtureRunner {
    public static final String SOURCE_EXTENSION = ".kt";
    public static final String REFERENCE_EXTENSION = ".txt";

    private final Path fixturesDirectory;
    private final CandidateSource candidates;
    private final CrossChecker checker;

    public FixtureRunner(CrossCheckConfiguration configuration) {
        this(configuration.fixturesDirectory(), CandidateSource.from(configuration), new CrossChecker());
    }

    public FixtureRunner(Path fixturesDirectory, CandidateSource candidates, CrossChecker checker) {
        this.fixturesDirectory = Objects.requireNonNull(fixturesDirectory, "fixturesDirectory");
        this.candidates = Objects.requireNonNull(candidates, "candidates");
        this.checker = Objects.requireNonNull(checker, "checker");
    }

    /** Dumps and trees of a single fixture, for the debug command. */
    public record DebugRun(String name, String candidateDump, CrossChecker.Trace trace) {
    }

    public List<Path> fixtures() {
        if (!Files.isDirectory(fixturesDirectory)) {
            throw new IllegalStateException("Fixtures directory not found: " + fixturesDirectory);
        }
        try (var stream = Files.list(fixturesDirectory)) {
            return stream
                .filter(path -> path.getFileName().toString().endsWith(SOURCE_EXTENSION))
                .filter(Files::isRegularFile)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to list fixtures: " + fixturesDirectory, ex);
        }
    }

    public RunSummary runAll() {
        return runAll(result -> { });
    }

    public RunSummary runAll(Consumer<FixtureResult> listener) {
        var results = new ArrayList<FixtureResult>();
        for (var source : fixtures()) {
            var result = check(source);
            listener.accept(result);
            results.add(result);
        }
        return new RunSummary(results);
    }

    public FixtureResult check(Path source) {
        var name = baseName(source);
        var referenceFile = companion(source, REFERENCE_EXTENSION);
        if (!Files.isRegularFile(referenceFile)) {
            return FixtureResult.failed(name, CompareStatus.REFERENCE_PARSE_ERROR, "No corresponding " + REFERENCE_EXTENSION + " PSI dump found");
        }
        String candidateDump;
        try {
            candidateDump = candidates.dump(source);
        } catch (CandidateUnavailableException ex) {
            return FixtureResult.failed(name, CompareStatus.CANDIDATE_PARSE_ERROR, ex.getMessage());
        }
        String referenceDump;
        try {
            referenceDump = Files.readString(referenceFile, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            return FixtureResult.failed(name, CompareStatus.REFERENCE_PARSE_ERROR, "Failed to read PSI dump: " + ex.getMessage());
        }
        try {
            var trace = checker.trace(candidateDump, referenceDump);
            if (trace.candidateErrors().isPresent()) {
                return FixtureResult.candidateErrors(name, trace.candidateErrors().get());
            }
            return FixtureResult.compared(name, trace.result(), trace.droppedRoots());
        } catch (MalformedDumpException ex) {
            var status = ex.dialect() == Dialect.CANDIDATE
                ? CompareStatus.CANDIDATE_PARSE_ERROR
                : CompareStatus.REFERENCE_PARSE_ERROR;
            return FixtureResult.failed(name, status, ex.getMessage());
        }
    }

    public DebugRun debug(String name) {
        var source = fixturesDirectory.resolve(name + SOURCE_EXTENSION);
        var referenceFile = companion(source, REFERENCE_EXTENSION);
        if (!Files.isRegularFile(source)) {
            throw new IllegalArgumentException("Fixture not found: " + source);
        }
        if (!Files.isRegularFile(referenceFile)) {
            throw new IllegalArgumentException("PSI dump not found: " + referenceFile);
        }
        String candidateDump;
        try {
            candidateDump = candidates.dump(source);
        } catch (CandidateUnavailableException ex) {
            throw new IllegalStateException(ex.getMessage(), ex);
        }
        String referenceDump;
        try {
            referenceDump = Files.readString(referenceFile, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read PSI dump: " + referenceFile, ex);
        }
        return new DebugRun(name, candidateDump, checker.trace(candidateDump, referenceDump));
    }

    static String baseName(Path file) {
        var fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    static Path companion(Path source, String extension) {
        return source.resolveSibling(baseName(source) + extension);
    }
}
