package work.lcod.crosscheck.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.crosscheck.compare.CompareResult;
import work.lcod.crosscheck.compare.CompareStatus;
import work.lcod.crosscheck.compare.Difference;

/**
 * Outcome of checking one fixture.
 */
public record FixtureResult(
    String name,
    CompareStatus status,
    Optional<CompareResult> compareResult,
    Optional<String> candidateErrorDetail,
    Optional<String> errorMessage,
    int droppedRoots
) {
    public FixtureResult {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(compareResult, "compareResult");
        Objects.requireNonNull(candidateErrorDetail, "candidateErrorDetail");
        Objects.requireNonNull(errorMessage, "errorMessage");
    }

    public static FixtureResult compared(String name, CompareResult result, int droppedRoots) {
        return new FixtureResult(name, result.status(), Optional.of(result), Optional.empty(), Optional.empty(), droppedRoots);
    }

    /** The candidate dump exists but contains ERROR or MISSING nodes. */
    public static FixtureResult candidateErrors(String name, String detail) {
        return new FixtureResult(name, CompareStatus.CANDIDATE_PARSE_ERROR, Optional.empty(), Optional.of(detail), Optional.empty(), 0);
    }

    public static FixtureResult failed(String name, CompareStatus status, String message) {
        if (!status.isParseError()) {
            throw new IllegalArgumentException("Not a parse error status: " + status);
        }
        return new FixtureResult(name, status, Optional.empty(), Optional.empty(), Optional.of(message), 0);
    }

    public List<Difference> differences() {
        return compareResult.map(CompareResult::differences).orElse(List.of());
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", name);
        map.put("status", status.name().toLowerCase(Locale.ROOT));
        candidateErrorDetail.ifPresent(detail -> map.put("candidateErrorDetail", detail));
        errorMessage.ifPresent(message -> map.put("error", message));
        if (droppedRoots > 0) {
            map.put("droppedRoots", droppedRoots);
        }
        var differences = differences().stream().map(difference -> {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("path", difference.path());
            entry.put("kind", difference.kind().name());
            entry.put("expected", difference.expected());
            entry.put("actual", difference.actual());
            return entry;
        }).toList();
        map.put("differences", differences);
        return map;
    }
}
