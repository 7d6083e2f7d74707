package com.watersort.visualizer.simulation;

import com.watersort.core.PuzzleInput;
import com.watersort.core.PuzzleState;
import com.watersort.core.ai.PuzzleSolver;
import com.watersort.core.ai.SearchConstraints;
import com.watersort.core.ai.SearchResult;
import com.watersort.visualizer.model.PuzzleFrame;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Consumer;
import javafx.application.Platform;
import javafx.concurrent.Task;

/**
 * Background task that solves a puzzle and turns the solution into playback frames.
 */
public final class SolveTask extends Task<List<PuzzleFrame>> {

    private final PuzzleSolver solver;
    private final PuzzleInput input;
    private final SearchConstraints constraints;
    private final Consumer<PuzzleFrame> frameListener;

    public SolveTask(PuzzleSolver solver, PuzzleInput input, SearchConstraints constraints,
            Consumer<PuzzleFrame> frameListener) {
        this.solver = Objects.requireNonNull(solver, "solver");
        this.input = Objects.requireNonNull(input, "input");
        this.constraints = Objects.requireNonNull(constraints, "constraints");
        this.frameListener = Objects.requireNonNull(frameListener, "frameListener");
    }

    @Override
    protected List<PuzzleFrame> call() {
        boolean onFxThread;
        try {
            onFxThread = Platform.isFxApplicationThread();
        } catch (IllegalStateException ex) {
            onFxThread = false;
        }
        if (onFxThread) {
            throw new IllegalStateException("Search must not run on the JavaFX application thread");
        }

        updateMessage("Solving...");
        updateProgress(-1, 1);

        PuzzleSolver.SolveReport report = solver.solve(input, constraints);
        SearchResult result = report.result();
        if (result.outcome() == SearchResult.Outcome.INVALID_INPUT) {
            throw new IllegalArgumentException("Invalid puzzle: " + String.join("; ", result.problems()));
        }

        List<PuzzleFrame> frames = new ArrayList<>();
        PuzzleFrame first = PuzzleFrame.initial(report.initial(), report.palette(), result);
        frames.add(first);
        publishFrame(first);
        if (!result.isSolved()) {
            updateProgress(1, 1);
            updateMessage(summary(result));
            return frames;
        }

        List<PuzzleState> states = report.states();
        List<String> descriptions = report.describeMoves();
        int total = result.moves().size();
        for (int i = 0; i < total; i++) {
            if (isCancelled()) {
                updateMessage("Stopped");
                return frames;
            }
            PuzzleFrame frame = new PuzzleFrame(states.get(i + 1), report.palette(), i + 1, total,
                    result.moves().get(i), descriptions.get(i), result);
            frames.add(frame);
            publishFrame(frame);
            updateProgress(i + 1, total);
        }

        updateProgress(1, 1);
        updateMessage(summary(result));
        return frames;
    }

    private static String summary(SearchResult result) {
        return switch (result.outcome()) {
            case SOLVED -> String.format("Solved in %d moves", result.moves().size());
            case UNSOLVABLE -> "No solution exists";
            case BUDGET_EXHAUSTED -> "Stopped by the " + result.limit().name().toLowerCase(Locale.ROOT) + " limit";
            case INVALID_INPUT -> "Invalid puzzle";
        };
    }

    private void publishFrame(PuzzleFrame frame) {
        Platform.runLater(() -> frameListener.accept(frame));
    }
}
