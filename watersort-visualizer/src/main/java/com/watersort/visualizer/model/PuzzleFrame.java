package com.watersort.visualizer.model;

import com.watersort.core.ColorPalette;
import com.watersort.core.Move;
import com.watersort.core.PuzzleState;
import com.watersort.core.ai.SearchResult;
import java.util.Objects;

/**
 * Snapshot of a single step while replaying a solution.
 *
 * @param state       the tubes after {@code lastMove}
 * @param palette     names for the color ids in {@code state}
 * @param step        number of moves applied so far
 * @param totalSteps  number of moves in the solution, 0 when there is none
 * @param lastMove    the move that produced {@code state}, {@code null} for the first frame
 * @param description human readable form of {@code lastMove}
 * @param result      the search result the frame belongs to, {@code null} before a search ran
 */
public record PuzzleFrame(
        PuzzleState state,
        ColorPalette palette,
        int step,
        int totalSteps,
        Move lastMove,
        String description,
        SearchResult result) {

    public PuzzleFrame {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(palette, "palette");
        if (step < 0 || step > totalSteps) {
            throw new IllegalArgumentException("Step " + step + " outside [0, " + totalSteps + "]");
        }
    }

    public static PuzzleFrame initial(PuzzleState state, ColorPalette palette, SearchResult result) {
        int total = result == null ? 0 : result.moves().size();
        return new PuzzleFrame(state, palette, 0, total, null, "Initial state", result);
    }

    public boolean hasLastMove() {
        return lastMove != null;
    }
}
