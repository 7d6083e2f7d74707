package com.watersort.core.ai;

import com.watersort.core.Move;
import java.util.List;
import java.util.Objects;

/**
 * Result payload returned by {@link Searcher} implementations and by {@link PuzzleSolver}.
 *
 * @param outcome   how the search ended
 * @param moves     the solution for {@link Outcome#SOLVED}, empty otherwise
 * @param limit     the limit that stopped a {@link Outcome#BUDGET_EXHAUSTED} search, {@link Limit#NONE} otherwise
 * @param problems  validation problems for {@link Outcome#INVALID_INPUT}, empty otherwise
 * @param telemetry counters collected while searching
 */
public record SearchResult(Outcome outcome, List<Move> moves, Limit limit, List<String> problems,
        SearchTelemetry telemetry) {

    public SearchResult {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(limit, "limit");
        moves = moves == null ? List.of() : List.copyOf(moves);
        problems = problems == null ? List.of() : List.copyOf(problems);
        telemetry = telemetry == null ? SearchTelemetry.empty() : telemetry;
        if (outcome != Outcome.SOLVED && !moves.isEmpty()) {
            throw new IllegalArgumentException("Only solved results carry moves");
        }
        if ((outcome == Outcome.BUDGET_EXHAUSTED) != (limit != Limit.NONE)) {
            throw new IllegalArgumentException("A limit is required exactly for exhausted results");
        }
    }

    public static SearchResult solved(List<Move> moves, SearchTelemetry telemetry) {
        return new SearchResult(Outcome.SOLVED, moves, Limit.NONE, List.of(), telemetry);
    }

    public static SearchResult unsolvable(SearchTelemetry telemetry) {
        return new SearchResult(Outcome.UNSOLVABLE, List.of(), Limit.NONE, List.of(), telemetry);
    }

    public static SearchResult exhausted(Limit limit, SearchTelemetry telemetry) {
        return new SearchResult(Outcome.BUDGET_EXHAUSTED, List.of(), limit, List.of(), telemetry);
    }

    public static SearchResult invalid(List<String> problems) {
        return new SearchResult(Outcome.INVALID_INPUT, List.of(), Limit.NONE, problems, SearchTelemetry.empty());
    }

    public boolean isSolved() {
        return outcome == Outcome.SOLVED;
    }

    /**
     * Returns {@code true} for outcomes that will not change when the search is repeated with a
     * larger budget.
     */
    public boolean isFinal() {
        return outcome == Outcome.SOLVED || outcome == Outcome.UNSOLVABLE;
    }

    public enum Outcome {
        SOLVED,
        UNSOLVABLE,
        BUDGET_EXHAUSTED,
        INVALID_INPUT
    }

    public enum Limit {
        NONE,
        STATES,
        TIME
    }
}
