package work.lcod.crosscheck.compare;

import java.util.List;
import java.util.Objects;

public record CompareResult(CompareStatus status, List<Difference> differences) {
    public CompareResult {
        Objects.requireNonNull(status, "status");
        differences = differences == null ? List.of() : List.copyOf(differences);
        if ((status == CompareStatus.MISMATCH) == differences.isEmpty()) {
            throw new IllegalArgumentException("Only MISMATCH carries differences, and it needs at least one: " + status);
        }
    }

    public static CompareResult of(CompareStatus status) {
        return new CompareResult(status, List.of());
    }

    public boolean isMatch() {
        return status == CompareStatus.MATCH;
    }
}
