package work.lcod.crosscheck.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@code Foo.ts} next to {@code Foo.kt}.
 */
public final class PregeneratedDumpSource implements CandidateSource {
    public static final String EXTENSION = ".ts";

    @Override
    public String dump(Path sourceFile) throws CandidateUnavailableException {
        var dumpFile = FixtureRunner.companion(sourceFile, EXTENSION);
        if (!Files.isRegularFile(dumpFile)) {
            throw new CandidateUnavailableException("No pre-generated candidate dump: " + dumpFile);
        }
        try {
            return Files.readString(dumpFile, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CandidateUnavailableException("Failed to read candidate dump: " + dumpFile, ex);
        }
    }
}
