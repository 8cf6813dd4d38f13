package work.lcod.crosscheck.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.crosscheck.compare.CompareResult;
import work.lcod.crosscheck.compare.CompareStatus;
import work.lcod.crosscheck.compare.DiffKind;
import work.lcod.crosscheck.compare.Difference;

class RunSummaryTest {
    static RunSummary sample() {
        var mismatch = new CompareResult(CompareStatus.MISMATCH, List.of(
            new Difference("KtFile > CLASS", DiffKind.CHILD_COUNT_MISMATCH, "1", "0"),
            new Difference("KtFile > CLASS", DiffKind.MISSING_CHILD, "TYPE_PARAMETER_LIST", Difference.NONE)));
        return new RunSummary(List.of(
            FixtureResult.compared("Alpha", CompareResult.of(CompareStatus.MATCH), 0),
            FixtureResult.compared("Beta", mismatch, 1),
            FixtureResult.candidateErrors("Gamma", "(source_file (ERROR))"),
            FixtureResult.failed("Delta", CompareStatus.REFERENCE_PARSE_ERROR, "No corresponding .txt PSI dump found")));
    }

    @Test
    void countsPerStatus() {
        var summary = sample();
        assertEquals(4, summary.total());
        assertEquals(1, summary.count(CompareStatus.MATCH));
        assertEquals(1, summary.count(CompareStatus.MISMATCH));
        assertEquals(3, summary.cleanParses());
        assertEquals("1/3 (33.3%)", summary.formattedMatchRate());
        assertFalse(summary.allMatched());
    }

    @Test
    void emptyRunHasNoRate() {
        var summary = new RunSummary(List.of());
        assertEquals(0.0, summary.matchRate());
        assertEquals("0/0", summary.formattedMatchRate());
        assertFalse(summary.allMatched());
    }

    @Test
    void serializableMapUsesLowerCaseStatuses() {
        var map = sample().toSerializableMap();
        assertEquals(4, map.get("total"));
        assertEquals(1, map.get("candidate_parse_error"));
        var beta = sample().results().get(1).toSerializableMap();
        assertEquals("mismatch", beta.get("status"));
        assertEquals(1, beta.get("droppedRoots"));
        assertEquals(2, ((List<?>) beta.get("differences")).size());
    }

    @Test
    void failedResultsNeedAParseErrorStatus() {
        assertThrows(IllegalArgumentException.class, () -> FixtureResult.failed("X", CompareStatus.MATCH, "nope"));
        assertTrue(FixtureResult.failed("X", CompareStatus.CANDIDATE_PARSE_ERROR, "timeout").differences().isEmpty());
    }
}
