package work.lcod.crosscheck.compare;

import java.util.Objects;

/**
 * One structural deviation. {@code path} is the trail of candidate-side names from the root
 * down to the node where the deviation was found, joined with {@value #SEPARATOR}.
 */
public record Difference(String path, DiffKind kind, String expected, String actual) {
    public static final String SEPARATOR = " > ";
    public static final String NONE = "(none)";

    public Difference {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(expected, "expected");
        Objects.requireNonNull(actual, "actual");
    }

    @Override
    public String toString() {
        return "[" + kind + "] at " + path + ": expected " + expected + ", got " + actual;
    }
}
