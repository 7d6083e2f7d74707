package com.watersort.visualizer;

import com.watersort.core.ColorPalette;
import com.watersort.core.PourPolicy;
import com.watersort.core.PuzzleInput;
import com.watersort.core.PuzzleParser;
import com.watersort.core.PuzzleValidator;
import com.watersort.core.ai.PuzzleSolver;
import com.watersort.core.ai.SearchConstraints;
import com.watersort.visualizer.model.PuzzleFrame;
import com.watersort.visualizer.simulation.SolveTask;
import com.watersort.visualizer.simulation.SolveWorker;
import com.watersort.visualizer.ui.StatsPane;
import com.watersort.visualizer.ui.TubeRackView;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import javafx.animation.KeyFrame;
import javafx.animation.Timeline;
import javafx.application.Application;
import javafx.application.Platform;
import javafx.beans.binding.Bindings;
import javafx.beans.property.BooleanProperty;
import javafx.beans.property.IntegerProperty;
import javafx.beans.property.ObjectProperty;
import javafx.beans.property.SimpleBooleanProperty;
import javafx.beans.property.SimpleIntegerProperty;
import javafx.beans.property.SimpleObjectProperty;
import javafx.collections.FXCollections;
import javafx.collections.ObservableList;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Scene;
import javafx.scene.control.Button;
import javafx.scene.control.ComboBox;
import javafx.scene.control.Label;
import javafx.scene.control.ProgressBar;
import javafx.scene.control.Spinner;
import javafx.scene.control.SpinnerValueFactory;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.Priority;
import javafx.scene.layout.Region;
import javafx.stage.Stage;

public final class VisualizerApp extends Application {

    private static final Logger LOGGER = Logger.getLogger(VisualizerApp.class.getName());
    private static final Duration PLAYBACK_STEP = Duration.ofMillis(600);
    private static final int DEFAULT_TIME_LIMIT_MILLIS = 10_000;
    private static final int MAX_STATES_STEP = 50_000;
    private static final String CANCELLING = "Cancelling, the search stops at its budget";
    private static final PuzzleInput SAMPLE = PuzzleInput.of(4, List.of(
            List.of("orange", "pink", "green", "pink"),
            List.of("orange", "red", "red", "blue"),
            List.of("blue", "green", "red", "red"),
            List.of("pink", "red", "orange", "orange"),
            List.of("green", "orange", "pink", "blue"),
            List.of(),
            List.of()));

    private final ObservableList<PuzzleFrame> frames = FXCollections.observableArrayList();
    private final IntegerProperty currentIndex = new SimpleIntegerProperty(0);
    private final ObjectProperty<PuzzleFrame> currentFrame = new SimpleObjectProperty<>();
    private final BooleanProperty playing = new SimpleBooleanProperty(false);
    private final BooleanProperty solving = new SimpleBooleanProperty(false);
    private final BooleanProperty workerBusy = new SimpleBooleanProperty(false);

    private final PuzzleSolver solver = new PuzzleSolver();
    private final SolveWorker solveWorker = new SolveWorker("watersort-visualizer-solve", Platform::runLater);
    private Timeline playbackTimeline;
    private PuzzleInput puzzle = SAMPLE;
    private SearchConstraints constraints = SearchConstraints.defaults();
    private TubeRackView rackView;
    private StatsPane statsPane;
    private ComboBox<SearchConstraints.SearchMode> modeComboBox;
    private ComboBox<PourPolicy> pourComboBox;
    private Spinner<Integer> maxStatesSpinner;
    private Spinner<Integer> timeLimitSpinner;
    private ProgressBar progressBar;
    private Label statusLabel;
    private SolveTask solveTask;

    public static void main(String[] args) {
        launch(args);
    }

    @Override
    public void start(Stage stage) {
        String loadProblem = configure(getParameters().getRaw());

        rackView = new TubeRackView();
        statsPane = new StatsPane();

        setupIndexListener();
        setupPlaybackTimeline();

        currentFrame.addListener((obs, oldFrame, newFrame) -> {
            rackView.update(newFrame);
            statsPane.update(newFrame, newFrame == null || newFrame.result() == null ? null : constraints);
        });

        BorderPane root = new BorderPane();
        root.setPadding(new Insets(16));
        root.setCenter(rackView);
        BorderPane.setAlignment(rackView, Pos.CENTER);
        root.setRight(statsPane);
        BorderPane.setMargin(statsPane, new Insets(0, 0, 0, 16));

        HBox controls = buildControls();
        root.setBottom(controls);
        BorderPane.setMargin(controls, new Insets(16, 0, 0, 0));

        showPuzzle();
        if (loadProblem != null) {
            statusLabel.setText(loadProblem);
        }

        Scene scene = new Scene(root, 1200, 720);
        stage.setTitle("Water Sort Visualizer");
        stage.setScene(scene);
        stage.setMinWidth(960);
        stage.setMinHeight(560);
        stage.show();
    }

    @Override
    public void stop() {
        if (solveTask != null) {
            solveTask.cancel(true);
        }
        if (playbackTimeline != null) {
            playbackTimeline.stop();
        }
    }

    private void showPuzzle() {
        List<String> problems = PuzzleValidator.validate(puzzle);
        if (!problems.isEmpty()) {
            LOGGER.warning(() -> "Puzzle rejected, showing the sample instead: " + String.join("; ", problems));
            puzzle = SAMPLE;
            statusLabel.setText("Invalid puzzle, showing sample");
        }
        ColorPalette palette = new ColorPalette();
        PuzzleFrame frame = PuzzleFrame.initial(palette.toState(puzzle), palette, null);
        frames.setAll(frame);
        currentIndex.set(0);
        currentFrame.set(frame);
    }

    private void setupIndexListener() {
        currentIndex.addListener((obs, oldValue, newValue) -> {
            if (frames.isEmpty()) {
                currentFrame.set(null);
                return;
            }
            int requested = newValue.intValue();
            int clamped = Math.max(0, Math.min(requested, frames.size() - 1));
            if (clamped != requested) {
                currentIndex.set(clamped);
                return;
            }
            currentFrame.set(frames.get(clamped));
        });
    }

    private void setupPlaybackTimeline() {
        playbackTimeline = new Timeline(new KeyFrame(
                javafx.util.Duration.millis(PLAYBACK_STEP.toMillis()),
                event -> advanceFrame()));
        playbackTimeline.setCycleCount(Timeline.INDEFINITE);
    }

    private HBox buildControls() {
        Button solveButton = new Button("Solve");
        solveButton.setOnAction(event -> runSolve());

        Button cancelButton = new Button("Cancel");
        cancelButton.setOnAction(event -> {
            if (solveTask != null) {
                solveTask.cancel(true);
            }
        });

        Button previousButton = new Button("⏮");
        previousButton.setOnAction(event -> {
            pausePlayback();
            stepBackward();
        });

        Button nextButton = new Button("⏭");
        nextButton.setOnAction(event -> {
            pausePlayback();
            stepForward();
        });

        Button playButton = new Button("▶");
        playButton.setOnAction(event -> startPlayback());

        Button pauseButton = new Button("⏸");
        pauseButton.setOnAction(event -> pausePlayback());

        Button resetButton = new Button("⏮⏮");
        resetButton.setOnAction(event -> {
            pausePlayback();
            if (!frames.isEmpty()) {
                currentIndex.set(0);
            }
        });

        modeComboBox = new ComboBox<>();
        modeComboBox.getItems().setAll(SearchConstraints.SearchMode.values());
        modeComboBox.setValue(constraints.mode());

        pourComboBox = new ComboBox<>();
        pourComboBox.getItems().setAll(PourPolicy.values());
        pourComboBox.setValue(constraints.pourPolicy());

        maxStatesSpinner = new Spinner<>();
        maxStatesSpinner.setValueFactory(new SpinnerValueFactory.IntegerSpinnerValueFactory(1, 10_000_000,
                (int) Math.min(Integer.MAX_VALUE, constraints.maxStates()), MAX_STATES_STEP));
        maxStatesSpinner.setEditable(true);
        maxStatesSpinner.setPrefWidth(120);

        timeLimitSpinner = new Spinner<>();
        timeLimitSpinner.setValueFactory(new SpinnerValueFactory.IntegerSpinnerValueFactory(0, 600_000,
                DEFAULT_TIME_LIMIT_MILLIS, 500));
        timeLimitSpinner.setEditable(true);
        timeLimitSpinner.setPrefWidth(110);

        progressBar = new ProgressBar(0);
        progressBar.setPrefWidth(160);

        statusLabel = new Label("Ready");
        statusLabel.setMinWidth(180);

        Region spacer = new Region();
        HBox.setHgrow(spacer, Priority.ALWAYS);

        HBox navigation = new HBox(8, resetButton, previousButton, nextButton, playButton, pauseButton);
        navigation.setAlignment(Pos.CENTER_LEFT);

        HBox controls = new HBox(12,
                solveButton,
                cancelButton,
                new Label("Search:"),
                modeComboBox,
                new Label("Pour:"),
                pourComboBox,
                new Label("Max states:"),
                maxStatesSpinner,
                new Label("Time limit (ms):"),
                timeLimitSpinner,
                navigation,
                spacer,
                progressBar,
                statusLabel);
        controls.setAlignment(Pos.CENTER_LEFT);

        var frameCount = Bindings.size(frames);
        previousButton.disableProperty().bind(Bindings.createBooleanBinding(
                () -> currentIndex.get() <= 0, currentIndex, frameCount));
        nextButton.disableProperty().bind(Bindings.createBooleanBinding(
                () -> frames.isEmpty() || currentIndex.get() >= frames.size() - 1, currentIndex, frameCount));
        resetButton.disableProperty().bind(Bindings.createBooleanBinding(
                () -> frames.isEmpty() || currentIndex.get() == 0, currentIndex, frameCount));
        playButton.disableProperty().bind(playing.or(frameCount.lessThanOrEqualTo(1)).or(solving));
        pauseButton.disableProperty().bind(playing.not());
        solveButton.disableProperty().bind(solving.or(workerBusy));
        cancelButton.disableProperty().bind(solving.not());
        modeComboBox.disableProperty().bind(solving);
        pourComboBox.disableProperty().bind(solving);
        maxStatesSpinner.disableProperty().bind(solving);
        timeLimitSpinner.disableProperty().bind(solving);

        return controls;
    }

    private void startPlayback() {
        if (frames.size() <= 1) {
            return;
        }
        if (currentIndex.get() >= frames.size() - 1) {
            currentIndex.set(0);
        }
        playing.set(true);
        playbackTimeline.play();
    }

    private void pausePlayback() {
        playbackTimeline.stop();
        playing.set(false);
    }

    private void stepForward() {
        if (frames.isEmpty()) {
            return;
        }
        currentIndex.set(Math.min(frames.size() - 1, currentIndex.get() + 1));
    }

    private void stepBackward() {
        if (frames.isEmpty()) {
            return;
        }
        currentIndex.set(Math.max(0, currentIndex.get() - 1));
    }

    private void advanceFrame() {
        int next = currentIndex.get() + 1;
        if (frames.isEmpty() || next >= frames.size()) {
            pausePlayback();
            return;
        }
        currentIndex.set(next);
    }

    private void runSolve() {
        if (solveWorker.isBusy()) {
            statusLabel.setText(CANCELLING);
            return;
        }
        pausePlayback();

        constraints = SearchConstraints.defaults()
                .withMode(modeComboBox.getValue())
                .withPourPolicy(pourComboBox.getValue())
                .withMaxStates(Math.max(1, normalizeSpinnerValue(maxStatesSpinner)))
                .withTimeLimit(Duration.ofMillis(Math.max(0, normalizeSpinnerValue(timeLimitSpinner))));

        frames.clear();
        currentIndex.set(0);
        currentFrame.set(null);

        SolveTask task = new SolveTask(solver, puzzle, constraints, frame -> {
            frames.add(frame);
            if (frames.size() == 1) {
                currentFrame.set(frame);
            }
        });
        solveTask = task;
        solving.set(true);
        progressBar.progressProperty().bind(task.progressProperty());
        statusLabel.textProperty().bind(task.messageProperty());

        task.setOnSucceeded(event -> {
            cleanupTaskBindings();
            List<PuzzleFrame> result = task.getValue();
            frames.setAll(result);
            currentIndex.set(0);
            currentFrame.set(frames.isEmpty() ? null : frames.get(0));
            progressBar.setProgress(1.0);
            statusLabel.setText(task.getMessage());
        });

        task.setOnFailed(event -> {
            cleanupTaskBindings();
            Throwable error = task.getException();
            progressBar.setProgress(0);
            statusLabel.setText(error == null ? "Error" : "Error: " + error.getMessage());
            LOGGER.log(Level.SEVERE, "Solve failed", error);
            showPuzzle();
        });

        task.setOnCancelled(event -> {
            cleanupTaskBindings();
            progressBar.setProgress(0);
            statusLabel.setText(CANCELLING);
            showPuzzle();
        });

        workerBusy.set(true);
        boolean started = solveWorker.start(task, () -> {
            workerBusy.set(false);
            if (CANCELLING.equals(statusLabel.getText())) {
                statusLabel.setText("Cancelled");
            }
        });
        if (!started) {
            workerBusy.set(false);
            cleanupTaskBindings();
            statusLabel.setText(CANCELLING);
            showPuzzle();
        }
    }

    private void cleanupTaskBindings() {
        solving.set(false);
        progressBar.progressProperty().unbind();
        statusLabel.textProperty().unbind();
        solveTask = null;
    }

    private int normalizeSpinnerValue(Spinner<Integer> spinner) {
        SpinnerValueFactory<Integer> factory = spinner.getValueFactory();
        if (factory != null) {
            try {
                Integer parsed = factory.getConverter().fromString(spinner.getEditor().getText());
                if (parsed != null) {
                    factory.setValue(parsed);
                }
            } catch (NumberFormatException ex) {
                LOGGER.log(Level.FINE, "Keeping previous spinner value", ex);
            }
        }
        Integer value = spinner.getValue();
        return value == null ? 0 : value;
    }

    /**
     * Applies {@code --puzzle=}, {@code --mode=} and {@code --pour=} parameters. Returns a message
     * describing a puzzle file that could not be loaded, or {@code null}.
     */
    private String configure(List<String> args) {
        String problem = null;
        for (String arg : args) {
            if (arg == null) {
                continue;
            }
            String trimmed = arg.trim();
            if (trimmed.startsWith("--puzzle=")) {
                Path path = Paths.get(trimmed.substring("--puzzle=".length()));
                try {
                    puzzle = PuzzleParser.parse(path);
                } catch (IOException | IllegalArgumentException ex) {
                    LOGGER.log(Level.WARNING, "Failed to load puzzle " + path + ", showing the sample instead", ex);
                    problem = "Cannot load " + path.getFileName();
                }
            } else if (trimmed.startsWith("--mode=")) {
                String value = trimmed.substring("--mode=".length()).toLowerCase(Locale.ROOT);
                if ("bfs".equals(value)) {
                    constraints = constraints.withMode(SearchConstraints.SearchMode.BREADTH_FIRST);
                } else if ("best".equals(value)) {
                    constraints = constraints.withMode(SearchConstraints.SearchMode.BEST_FIRST);
                } else {
                    LOGGER.warning(() -> "Unknown search mode: " + value);
                }
            } else if (trimmed.startsWith("--pour=")) {
                String value = trimmed.substring("--pour=".length()).toLowerCase(Locale.ROOT);
                if ("partial".equals(value)) {
                    constraints = constraints.withPourPolicy(PourPolicy.PARTIAL);
                } else if ("all".equals(value)) {
                    constraints = constraints.withPourPolicy(PourPolicy.ALL_OR_NOTHING);
                } else {
                    LOGGER.warning(() -> "Unknown pour policy: " + value);
                }
            }
        }
        return problem;
    }
}
