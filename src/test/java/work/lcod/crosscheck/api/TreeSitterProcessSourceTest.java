package work.lcod.crosscheck.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@EnabledOnOs({OS.LINUX, OS.MAC})
class TreeSitterProcessSourceTest {
    @TempDir
    Path workDir;

    @Test
    void capturesStandardOutput() throws Exception {
        var source = workDir.resolve("A.kt");
        Files.writeString(source, "(source_file (class_declaration))\n");
        var dump = new TreeSitterProcessSource(List.of("cat"), Duration.ofSeconds(10)).dump(source);
        assertEquals("(source_file (class_declaration))\n", dump);
    }

    @Test
    void failingCommandWithoutOutputIsUnavailable() throws IOException {
        var source = Files.writeString(workDir.resolve("B.kt"), "class B");
        var ex = assertThrows(CandidateUnavailableException.class,
            () -> new TreeSitterProcessSource(List.of("false"), Duration.ofSeconds(10)).dump(source));
        assertTrue(ex.getMessage().contains("exited with code"));
    }

    @Test
    void unknownCommandIsUnavailable() {
        var source = workDir.resolve("C.kt");
        assertThrows(CandidateUnavailableException.class,
            () -> new TreeSitterProcessSource(List.of("crosscheck-no-such-parser"), Duration.ofSeconds(10)).dump(source));
    }

    @Test
    void slowCommandTimesOut() throws IOException {
        var source = Files.writeString(workDir.resolve("D.kt"), "class D");
        var ex = assertThrows(CandidateUnavailableException.class,
            () -> new TreeSitterProcessSource(List.of("sh", "-c", "sleep 5", "parser"), Duration.ofMillis(200)).dump(source));
        assertTrue(ex.getMessage().contains("timed out"));
    }
}
