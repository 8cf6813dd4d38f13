package work.lcod.crosscheck.dump;

import work.lcod.crosscheck.model.Dialect;

/**
 * Raised when a dump is present but structurally corrupt (unbalanced parentheses,
 * indentation that escapes the root, ...). Distinct from an absent dump.
 * The message ends with the token index (S-expression dumps) or the 1-based line number
 * (indented dumps) of the offending input.
 */
public final class MalformedDumpException extends RuntimeException {
    private final Dialect dialect;

    public MalformedDumpException(Dialect dialect, int location, String message) {
        super(dialect.label() + " dump is malformed: " + message + " (" + unit(dialect) + " " + location + ")");
        this.dialect = dialect;
    }

    private static String unit(Dialect dialect) {
        return dialect == Dialect.CANDIDATE ? "token" : "line";
    }

    public Dialect dialect() {
        return dialect;
    }
}
