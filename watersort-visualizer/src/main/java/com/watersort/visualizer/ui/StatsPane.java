package com.watersort.visualizer.ui;

import com.watersort.core.ai.SearchConstraints;
import com.watersort.core.ai.SearchResult;
import com.watersort.core.ai.SearchTelemetry;
import com.watersort.visualizer.model.PuzzleFrame;
import java.util.Locale;
import javafx.geometry.Insets;
import javafx.scene.Node;
import javafx.scene.control.Label;
import javafx.scene.layout.GridPane;
import javafx.scene.layout.VBox;

/**
 * Displays the current playback step together with the counters of the search that produced it.
 */
public final class StatsPane extends VBox {

    private static final String NONE = "-";

    private final Label stepValue = valueLabel();
    private final Label lastMoveValue = valueLabel();
    private final Label outcomeValue = valueLabel();
    private final Label modeValue = valueLabel();
    private final Label expandedValue = valueLabel();
    private final Label generatedValue = valueLabel();
    private final Label duplicatesValue = valueLabel();
    private final Label staleValue = valueLabel();
    private final Label reopenedValue = valueLabel();
    private final Label frontierValue = valueLabel();
    private final Label knownValue = valueLabel();
    private final Label searchTimeValue = valueLabel();

    public StatsPane() {
        setPadding(new Insets(16));
        setSpacing(12);
        setStyle("-fx-background-color: rgba(255,255,255,0.85); -fx-border-color: #d0d6e6; -fx-border-radius: 6; -fx-background-radius: 6;");
        setPrefWidth(308);
        setMinWidth(308);
        setMaxWidth(308);

        Label title = new Label("Statistics");
        title.setStyle("-fx-font-size: 18px; -fx-font-weight: bold;");

        GridPane grid = new GridPane();
        grid.setHgap(10);
        grid.setVgap(8);

        addRow(grid, 0, "Step", stepValue);
        addRow(grid, 1, "Last move", lastMoveValue);
        addRow(grid, 2, "Outcome", outcomeValue);
        addRow(grid, 3, "Search", modeValue);
        addRow(grid, 4, "Expanded", expandedValue);
        addRow(grid, 5, "Generated", generatedValue);
        addRow(grid, 6, "Duplicates", duplicatesValue);
        addRow(grid, 7, "Stale entries", staleValue);
        addRow(grid, 8, "Reopened", reopenedValue);
        addRow(grid, 9, "Peak frontier", frontierValue);
        addRow(grid, 10, "Known states", knownValue);
        addRow(grid, 11, "Search time", searchTimeValue);

        getChildren().addAll(title, grid);
    }

    public void update(PuzzleFrame frame, SearchConstraints constraints) {
        modeValue.setText(constraints == null ? NONE : String.format("%s, %s",
                constraints.mode().name().toLowerCase(Locale.ROOT).replace('_', '-'),
                constraints.pourPolicy().name().toLowerCase(Locale.ROOT).replace('_', '-')));
        if (frame == null) {
            stepValue.setText(NONE);
            lastMoveValue.setText(NONE);
            showResult(null);
            return;
        }

        stepValue.setText(frame.totalSteps() > 0
                ? String.format("%d / %d", frame.step(), frame.totalSteps())
                : Integer.toString(frame.step()));
        lastMoveValue.setText(frame.hasLastMove() ? frame.description() : NONE);
        lastMoveValue.setWrapText(true);
        showResult(frame.result());
    }

    private void showResult(SearchResult result) {
        if (result == null) {
            outcomeValue.setText("Not solved yet");
            for (Label label : new Label[] {expandedValue, generatedValue, duplicatesValue, staleValue,
                    reopenedValue, frontierValue, knownValue, searchTimeValue}) {
                label.setText(NONE);
            }
            return;
        }

        outcomeValue.setText(result.outcome() == SearchResult.Outcome.BUDGET_EXHAUSTED
                ? "Budget exhausted (" + result.limit().name().toLowerCase(Locale.ROOT) + ")"
                : result.outcome().name().toLowerCase(Locale.ROOT).replace('_', ' '));
        SearchTelemetry telemetry = result.telemetry();
        expandedValue.setText(Long.toString(telemetry.expandedStates()));
        generatedValue.setText(Long.toString(telemetry.generatedStates()));
        duplicatesValue.setText(Long.toString(telemetry.duplicateStates()));
        staleValue.setText(Long.toString(telemetry.staleEntries()));
        reopenedValue.setText(Long.toString(telemetry.reopenedStates()));
        frontierValue.setText(Integer.toString(telemetry.peakFrontier()));
        knownValue.setText(Integer.toString(telemetry.knownStates()));
        searchTimeValue.setText(telemetry.elapsedNanos() > 0
                ? String.format("%.1f ms", telemetry.elapsedMillis())
                : NONE);
    }

    private static void addRow(GridPane grid, int row, String label, Node value) {
        Label caption = new Label(label + ":");
        caption.setStyle("-fx-text-fill: #4a4f64; -fx-font-weight: 600;");
        grid.addRow(row, caption, value);
    }

    private static Label valueLabel() {
        Label label = new Label(NONE);
        label.setStyle("-fx-font-size: 14px; -fx-text-fill: #1f2333;");
        label.setMaxWidth(180);
        return label;
    }
}
