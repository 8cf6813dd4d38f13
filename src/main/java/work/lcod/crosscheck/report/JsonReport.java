package work.lcod.crosscheck.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.crosscheck.api.FixtureResult;
import work.lcod.crosscheck.api.RunSummary;

/**
 * Machine-readable run report.
 */
public final class JsonReport {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    private JsonReport() {
    }

    public static Map<String, Object> toSerializableMap(RunSummary summary) {
        var map = new LinkedHashMap<String, Object>();
        map.put("status", summary.allMatched() ? "ok" : "mismatch");
        map.put("summary", summary.toSerializableMap());
        map.put("categories", DifferenceTally.of(summary).categories().stream().map(category -> {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("kind", category.kind().name());
            entry.put("expected", category.expected());
            entry.put("actual", category.actual());
            entry.put("count", category.count());
            entry.put("fixtures", category.fixtures());
            return entry;
        }).toList());
        map.put("results", summary.results().stream().map(FixtureResult::toSerializableMap).toList());
        return map;
    }

    public static String render(RunSummary summary) {
        try {
            return WRITER.writeValueAsString(toSerializableMap(summary));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize run report: " + ex.getOriginalMessage(), ex);
        }
    }

    public static void write(RunSummary summary, Path file) {
        try {
            Files.writeString(file, render(summary), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to write JSON report: " + file, ex);
        }
    }
}
