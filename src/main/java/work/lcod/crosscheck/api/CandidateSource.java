package work.lcod.crosscheck.api;

import java.nio.file.Path;

/**
 * Supplies the S-expression dump of a Kotlin source file.
 */
public interface CandidateSource {
    String dump(Path sourceFile) throws CandidateUnavailableException;

    static CandidateSource from(CrossCheckConfiguration configuration) {
        return configuration.pregeneratedDumps()
            ? new PregeneratedDumpSource()
            : new TreeSitterProcessSource(configuration.candidateCommand(), configuration.candidateTimeout());
    }
}
