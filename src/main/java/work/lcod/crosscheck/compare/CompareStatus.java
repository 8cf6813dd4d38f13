package work.lcod.crosscheck.compare;

/**
 * Outcome of one comparison. Only {@link #MATCH} and {@link #MISMATCH} count toward the
 * clean-parse match rate.
 */
public enum CompareStatus {
    MATCH,
    MISMATCH,
    CANDIDATE_PARSE_ERROR,
    REFERENCE_PARSE_ERROR;

    public boolean isParseError() {
        return this == CANDIDATE_PARSE_ERROR || this == REFERENCE_PARSE_ERROR;
    }
}
