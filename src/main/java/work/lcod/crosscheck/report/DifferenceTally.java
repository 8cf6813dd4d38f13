package work.lcod.crosscheck.report;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import work.lcod.crosscheck.api.RunSummary;
import work.lcod.crosscheck.compare.CompareStatus;
import work.lcod.crosscheck.compare.DiffKind;

/**
 * Differences of all mismatching fixtures grouped by {@code (kind, expected, actual)},
 * most frequent first.
 */
public final class DifferenceTally {
    static final String[] CSV_HEADER = {"kind", "expected", "actual", "count", "fixtures"};

    public record Category(DiffKind kind, String expected, String actual, int count, List<String> fixtures) {
        public Category {
            fixtures = List.copyOf(fixtures);
        }
    }

    private record Key(DiffKind kind, String expected, String actual) {
    }

    private final List<Category> categories;

    private DifferenceTally(List<Category> categories) {
        this.categories = List.copyOf(categories);
    }

    public static DifferenceTally of(RunSummary summary) {
        var counts = new LinkedHashMap<Key, Integer>();
        var fixtures = new LinkedHashMap<Key, Set<String>>();
        for (var result : summary.results()) {
            if (result.status() != CompareStatus.MISMATCH) {
                continue;
            }
            for (var difference : result.differences()) {
                var key = new Key(difference.kind(), difference.expected(), difference.actual());
                counts.merge(key, 1, Integer::sum);
                fixtures.computeIfAbsent(key, ignored -> new LinkedHashSet<>()).add(result.name());
            }
        }
        var categories = new ArrayList<Category>();
        counts.forEach((key, count) -> categories.add(
            new Category(key.kind(), key.expected(), key.actual(), count, new ArrayList<>(fixtures.get(key)))));
        categories.sort(Comparator.<Category>comparingInt(Category::count).reversed()
            .thenComparing(Category::kind)
            .thenComparing(Category::expected)
            .thenComparing(Category::actual));
        return new DifferenceTally(categories);
    }

    public List<Category> categories() {
        return categories;
    }

    public boolean isEmpty() {
        return categories.isEmpty();
    }

    /** Fixture names are joined with spaces in the last column. */
    public void writeCsv(Writer out) throws IOException {
        try (var printer = new CSVPrinter(out, CSVFormat.DEFAULT.withHeader(CSV_HEADER))) {
            for (var category : categories) {
                printer.printRecord(
                    category.kind().name(),
                    category.expected(),
                    category.actual(),
                    category.count(),
                    String.join(" ", category.fixtures()));
            }
        }
    }

    public void writeCsv(Path file) {
        try (var writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeCsv(writer);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to write difference tally: " + file, ex);
        }
    }
}
