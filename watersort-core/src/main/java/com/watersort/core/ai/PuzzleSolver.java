package com.watersort.core.ai;

import com.watersort.core.ColorPalette;
import com.watersort.core.Move;
import com.watersort.core.PourPolicy;
import com.watersort.core.PuzzleInput;
import com.watersort.core.PuzzleState;
import com.watersort.core.PuzzleValidator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point that validates raw input, runs the searcher selected by the constraints and checks
 * any solution it returns.
 */
public final class PuzzleSolver {

    private static final Logger LOGGER = Logger.getLogger(PuzzleSolver.class.getName());

    private final Searcher breadthFirst;
    private final Searcher bestFirst;

    public PuzzleSolver() {
        this(new BreadthFirstSearcher(), new BestFirstSearcher());
    }

    public PuzzleSolver(Searcher breadthFirst, Searcher bestFirst) {
        this.breadthFirst = Objects.requireNonNull(breadthFirst, "breadthFirst");
        this.bestFirst = Objects.requireNonNull(bestFirst, "bestFirst");
    }

    /**
     * Validates {@code input} and, if it is well formed, searches for a solution.
     * Malformed input yields an {@link SearchResult.Outcome#INVALID_INPUT} report without searching.
     */
    public SolveReport solve(PuzzleInput input, SearchConstraints constraints) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(constraints, "constraints");

        ColorPalette palette = new ColorPalette();
        List<String> problems = PuzzleValidator.validate(input);
        if (!problems.isEmpty()) {
            LOGGER.warning(() -> "Rejected puzzle input: " + String.join("; ", problems));
            return new SolveReport(palette, null, constraints, SearchResult.invalid(problems));
        }

        PuzzleState initial = palette.toState(input);
        return new SolveReport(palette, initial, constraints, search(initial, constraints));
    }

    /**
     * Searches from an already built state.
     */
    public SearchResult search(PuzzleState initial, SearchConstraints constraints) {
        Objects.requireNonNull(initial, "initial");
        Objects.requireNonNull(constraints, "constraints");

        Searcher searcher = constraints.mode() == SearchConstraints.SearchMode.BREADTH_FIRST
                ? breadthFirst
                : bestFirst;
        LOGGER.info(() -> String.format("Solving %d tubes (capacity %d) with %s, %s pours",
                initial.tubeCount(), initial.capacity(), constraints.mode(), constraints.pourPolicy()));

        SearchResult result = searcher.search(initial, constraints);
        if (result.isSolved() && !SolutionReplay.isSolution(initial, result.moves(), constraints.pourPolicy())) {
            LOGGER.log(Level.SEVERE, "Searcher {0} returned moves that do not solve the puzzle",
                    searcher.getClass().getSimpleName());
            throw new IllegalStateException("Search returned an invalid solution: " + result.moves());
        }
        return result;
    }

    /**
     * Describes a move in terms of the colors it pours, for example {@code Pour 2 x 'red' from tube 0 to tube 3}.
     */
    public static String describe(PuzzleState before, Move move, PourPolicy policy, ColorPalette palette) {
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(move, "move");
        Objects.requireNonNull(palette, "palette");
        int amount = before.transferAmount(move.from(), move.to(), policy);
        if (amount == 0) {
            throw new IllegalArgumentException("Move " + move + " is not legal in " + before);
        }
        String color = palette.nameOf(before.tube(move.from()).topColor());
        return String.format("Pour %d x '%s' from tube %d to tube %d", amount, color, move.from(), move.to());
    }

    /**
     * Everything a caller needs to report a solve: the palette that names the colors, the initial
     * state ({@code null} for invalid input), the constraints used and the search result.
     */
    public record SolveReport(ColorPalette palette, PuzzleState initial, SearchConstraints constraints,
            SearchResult result) {

        public SolveReport {
            Objects.requireNonNull(palette, "palette");
            Objects.requireNonNull(constraints, "constraints");
            Objects.requireNonNull(result, "result");
            if (initial == null && result.outcome() != SearchResult.Outcome.INVALID_INPUT) {
                throw new IllegalArgumentException("Only invalid input reports may omit the initial state");
            }
        }

        /**
         * Returns the states the solution passes through, initial state first. Empty unless solved.
         */
        public List<PuzzleState> states() {
            if (!result.isSolved()) {
                return List.of();
            }
            return SolutionReplay.replay(initial, result.moves(), constraints.pourPolicy());
        }

        /**
         * Returns one human readable line per solution move.
         */
        public List<String> describeMoves() {
            List<PuzzleState> states = states();
            List<Move> moves = result.moves();
            String[] lines = new String[moves.size()];
            for (int i = 0; i < moves.size(); i++) {
                lines[i] = describe(states.get(i), moves.get(i), constraints.pourPolicy(), palette);
            }
            return List.of(lines);
        }
    }
}
