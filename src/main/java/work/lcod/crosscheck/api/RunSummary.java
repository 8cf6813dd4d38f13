package work.lcod.crosscheck.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import work.lcod.crosscheck.compare.CompareStatus;

/**
 * Results of a fixture run with the aggregate counts the reports need.
 */
public record RunSummary(List<FixtureResult> results) {
    public RunSummary {
        results = List.copyOf(results);
    }

    public int total() {
        return results.size();
    }

    public int count(CompareStatus status) {
        return (int) results.stream().filter(result -> result.status() == status).count();
    }

    /** Fixtures the candidate parser handled without errors. */
    public int cleanParses() {
        return total() - count(CompareStatus.CANDIDATE_PARSE_ERROR);
    }

    public double matchRate() {
        int clean = cleanParses();
        return clean == 0 ? 0.0 : (double) count(CompareStatus.MATCH) / clean;
    }

    /** For example {@code 3/4 (75.0%)}, or {@code 0/0}. */
    public String formattedMatchRate() {
        int clean = cleanParses();
        if (clean == 0) {
            return "0/0";
        }
        return String.format(Locale.ROOT, "%d/%d (%.1f%%)", count(CompareStatus.MATCH), clean, matchRate() * 100);
    }

    public boolean allMatched() {
        return total() > 0 && count(CompareStatus.MATCH) == total();
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("total", total());
        for (var status : CompareStatus.values()) {
            map.put(status.name().toLowerCase(Locale.ROOT), count(status));
        }
        map.put("cleanParses", cleanParses());
        map.put("matchRate", matchRate());
        return map;
    }
}
