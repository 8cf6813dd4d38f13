package work.lcod.crosscheck.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Parses user-friendly durations such as {@code 500ms}, {@code 30s}, {@code 2m} or {@code 1h}.
 * A bare number is read as seconds.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Duration parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Duration must not be empty");
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        long multiplier = 1_000L;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
            multiplier = 1L;
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000L;
        }
        try {
            return Duration.ofMillis(Math.multiplyExact(Long.parseLong(trimmed.trim()), multiplier));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Duration out of range: " + raw, ex);
        }
    }
}
