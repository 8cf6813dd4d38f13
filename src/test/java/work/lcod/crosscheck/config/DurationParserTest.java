package work.lcod.crosscheck.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class DurationParserTest {
    @Test
    void parsesMilliseconds() {
        assertEquals(Duration.ofMillis(500), DurationParser.parse("500ms"));
    }

    @Test
    void parsesSeconds() {
        assertEquals(Duration.ofSeconds(30), DurationParser.parse("30s"));
    }

    @Test
    void parsesMinutesAndHours() {
        assertEquals(Duration.ofMinutes(2), DurationParser.parse("2m"));
        assertEquals(Duration.ofHours(1), DurationParser.parse(" 1H "));
    }

    @Test
    void bareNumberIsSeconds() {
        assertEquals(Duration.ofSeconds(45), DurationParser.parse("45"));
    }

    @Test
    void rejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("soon"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse(""));
    }

    @Test
    void rejectsOverflow() {
        var ex = assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("3000000000000000h"));
        assertTrue(ex.getMessage().contains("3000000000000000h"));
    }
}
