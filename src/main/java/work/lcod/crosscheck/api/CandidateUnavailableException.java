package work.lcod.crosscheck.api;

/**
 * The candidate parser produced no dump for a source file.
 */
public class CandidateUnavailableException extends Exception {
    public CandidateUnavailableException(String message) {
        super(message);
    }

    public CandidateUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
