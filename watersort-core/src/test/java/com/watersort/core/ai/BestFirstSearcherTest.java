package com.watersort.core.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.watersort.core.PourPolicy;
import com.watersort.core.PuzzleInput;
import com.watersort.core.PuzzleState;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class BestFirstSearcherTest {

    private static final SearchConstraints BEST = SearchConstraints.defaults();

    private final BestFirstSearcher searcher = new BestFirstSearcher();

    @Test
    void solvesSolvablePuzzlesWithValidMoves() {
        for (PuzzleInput input : new PuzzleInput[] {PuzzleFixtures.TWO_COLORS, PuzzleFixtures.THREE_COLORS}) {
            for (PourPolicy policy : PourPolicy.values()) {
                PuzzleState initial = PuzzleFixtures.state(input);

                SearchResult result = searcher.search(initial, BEST.withPourPolicy(policy));

                assertEquals(SearchResult.Outcome.SOLVED, result.outcome(), "Expected a solution for " + initial);
                PuzzleFixtures.assertValidSolution(initial, result.moves(), policy);
            }
        }
    }

    @Test
    void neverBeatsBreadthFirstLength() {
        PuzzleState initial = PuzzleFixtures.state(PuzzleFixtures.THREE_COLORS);
        SearchConstraints bfs = BEST.withMode(SearchConstraints.SearchMode.BREADTH_FIRST);

        int shortest = new BreadthFirstSearcher().search(initial, bfs).moves().size();
        int bestFirst = searcher.search(initial, BEST).moves().size();

        assertTrue(bestFirst >= shortest, "Breadth-first solutions are the shortest possible");
    }

    @Test
    void equalPriorityEntriesLeaveInInsertionOrder() {
        PuzzleState initial = PuzzleFixtures.state(PuzzleFixtures.THREE_COLORS);

        SearchResult first = searcher.search(initial, BEST);
        SearchResult second = searcher.search(initial, BEST);

        assertEquals(first.moves(), second.moves());
        assertEquals(first.telemetry().expandedStates(), second.telemetry().expandedStates());
    }

    @Test
    void settledPuzzleNeedsNoMoves() {
        SearchResult result = searcher.search(PuzzleFixtures.state(PuzzleFixtures.SINGLE_COLOR), BEST);

        assertTrue(result.isSolved());
        assertTrue(result.moves().isEmpty());
    }

    @Test
    void reportsUnsolvableWhenNoMoveExists() {
        SearchResult result = searcher.search(PuzzleFixtures.state(PuzzleFixtures.NO_MOVES), BEST);

        assertEquals(SearchResult.Outcome.UNSOLVABLE, result.outcome());
        assertTrue(result.isFinal());
    }

    @Test
    void stopsAtStateLimit() {
        SearchResult result = searcher.search(PuzzleFixtures.state(PuzzleFixtures.FIVE_COLORS), BEST.withMaxStates(3));

        assertEquals(SearchResult.Outcome.BUDGET_EXHAUSTED, result.outcome());
        assertEquals(SearchResult.Limit.STATES, result.limit());
        assertEquals(3, result.telemetry().expandedStates());
    }

    @Test
    void stopsAtTimeLimit() {
        SearchResult result = searcher.search(PuzzleFixtures.state(PuzzleFixtures.FIVE_COLORS),
                BEST.withTimeLimit(Duration.ofNanos(1)));

        assertEquals(SearchResult.Limit.TIME, result.limit());
    }

    @Test
    void reopensStatesReachedByCheaperPaths() {
        for (PourPolicy policy : PourPolicy.values()) {
            SearchResult result = searcher.search(PuzzleFixtures.REOPENING, BEST.withPourPolicy(policy));

            assertEquals(SearchResult.Outcome.SOLVED, result.outcome(), policy.name());
            PuzzleFixtures.assertValidSolution(PuzzleFixtures.REOPENING, result.moves(), policy);
            SearchTelemetry telemetry = result.telemetry();
            assertTrue(telemetry.reopenedStates() > 0, telemetry.toString());
            assertTrue(telemetry.staleEntries() <= telemetry.reopenedStates(), telemetry.toString());
            assertTrue(telemetry.peakFrontier() > 0);
        }
    }
}
