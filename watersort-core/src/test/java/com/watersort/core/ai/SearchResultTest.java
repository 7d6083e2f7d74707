package com.watersort.core.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.watersort.core.Move;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SearchResultTest {

    @Test
    void solvedResultsCopyTheirMoves() {
        List<Move> moves = new ArrayList<>(List.of(new Move(0, 1)));

        SearchResult result = SearchResult.solved(moves, SearchTelemetry.empty());
        moves.add(new Move(1, 0));

        assertEquals(1, result.moves().size());
        assertTrue(result.isFinal());
        assertThrows(UnsupportedOperationException.class, () -> result.moves().add(new Move(2, 0)));
    }

    @Test
    void onlySolvedResultsCarryMoves() {
        assertThrows(IllegalArgumentException.class, () -> new SearchResult(SearchResult.Outcome.UNSOLVABLE,
                List.of(new Move(0, 1)), SearchResult.Limit.NONE, List.of(), null));
    }

    @Test
    void exhaustedResultsNameTheirLimit() {
        assertThrows(IllegalArgumentException.class,
                () -> SearchResult.exhausted(SearchResult.Limit.NONE, SearchTelemetry.empty()));
        assertThrows(IllegalArgumentException.class, () -> new SearchResult(SearchResult.Outcome.SOLVED,
                List.of(), SearchResult.Limit.TIME, List.of(), null));

        SearchResult result = SearchResult.exhausted(SearchResult.Limit.TIME, SearchTelemetry.empty());
        assertFalse(result.isFinal());
        assertFalse(result.isSolved());
    }

    @Test
    void invalidResultsKeepProblems() {
        SearchResult result = SearchResult.invalid(List.of("Tube 1 is missing"));

        assertEquals(SearchResult.Outcome.INVALID_INPUT, result.outcome());
        assertEquals(List.of("Tube 1 is missing"), result.problems());
        assertEquals(0, result.telemetry().expandedStates());
        assertFalse(result.isFinal());
    }
}
