package com.watersort.core;

import com.watersort.core.ai.PuzzleSolver;
import com.watersort.core.ai.SearchConstraints;
import com.watersort.core.ai.SearchResult;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Console front-end that solves a puzzle file and prints the moves.
 */
public final class WaterSortCLI {

    public static final int EXIT_SOLVED = 0;
    public static final int EXIT_UNSOLVABLE = 1;
    public static final int EXIT_BUDGET_EXHAUSTED = 2;
    public static final int EXIT_INVALID = 3;

    private static final Logger LOGGER = Logger.getLogger(WaterSortCLI.class.getName());

    private WaterSortCLI() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the CLI and returns the process exit status.
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        Path puzzlePath = null;
        SearchConstraints constraints = SearchConstraints.defaults();
        boolean verbose = false;

        try {
            for (String option : args) {
                if (option.startsWith("--mode=")) {
                    constraints = constraints.withMode(parseMode(option.substring("--mode=".length())));
                } else if (option.startsWith("--pour=")) {
                    constraints = constraints.withPourPolicy(parsePourPolicy(option.substring("--pour=".length())));
                } else if (option.startsWith("--maxStates=")) {
                    constraints = constraints.withMaxStates(Long.parseLong(option.substring("--maxStates=".length())));
                } else if (option.startsWith("--timeLimitMillis=")) {
                    long millis = Long.parseLong(option.substring("--timeLimitMillis=".length()));
                    constraints = constraints.withTimeLimit(Duration.ofMillis(millis));
                } else if ("--verbose".equals(option)) {
                    verbose = true;
                } else if (option.startsWith("--")) {
                    throw new IllegalArgumentException("Unrecognised option: " + option);
                } else if (puzzlePath == null) {
                    puzzlePath = Paths.get(option);
                } else {
                    throw new IllegalArgumentException("Puzzle file specified more than once: " + option);
                }
            }
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage(err);
            return EXIT_INVALID;
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            printUsage(err);
            return EXIT_INVALID;
        }

        if (puzzlePath == null) {
            printUsage(err);
            return EXIT_INVALID;
        }
        if (verbose) {
            enableVerboseLogging();
        }

        PuzzleInput input;
        try {
            input = PuzzleParser.parse(puzzlePath);
        } catch (IOException ex) {
            LOGGER.log(Level.SEVERE, "Failed to read puzzle file " + puzzlePath, ex);
            err.println("Cannot read " + puzzlePath + ": " + ex.getMessage());
            return EXIT_INVALID;
        } catch (IllegalArgumentException ex) {
            err.println("Cannot parse " + puzzlePath + ": " + ex.getMessage());
            return EXIT_INVALID;
        }

        PuzzleSolver.SolveReport report = new PuzzleSolver().solve(input, constraints);
        return print(report, out, err);
    }

    static int print(PuzzleSolver.SolveReport report, PrintStream out, PrintStream err) {
        SearchResult result = report.result();
        if (report.initial() != null) {
            printState(report.palette().describe(report.initial()), out);
        }
        switch (result.outcome()) {
            case SOLVED -> {
                List<String> lines = report.describeMoves();
                out.printf("Solved in %d moves (%d states expanded)%n", lines.size(),
                        result.telemetry().expandedStates());
                for (int i = 0; i < lines.size(); i++) {
                    out.printf("%3d. %s%n", i + 1, lines.get(i));
                }
                return EXIT_SOLVED;
            }
            case UNSOLVABLE -> {
                out.printf("No solution exists (%d states expanded). Check the captured puzzle state.%n",
                        result.telemetry().expandedStates());
                return EXIT_UNSOLVABLE;
            }
            case BUDGET_EXHAUSTED -> {
                out.printf("Search stopped by the %s limit after %d states; retry with a larger budget.%n",
                        result.limit().name().toLowerCase(Locale.ROOT), result.telemetry().expandedStates());
                return EXIT_BUDGET_EXHAUSTED;
            }
            case INVALID_INPUT -> {
                err.println("Invalid puzzle:");
                for (String problem : result.problems()) {
                    err.println("  - " + problem);
                }
                return EXIT_INVALID;
            }
            default -> throw new IllegalStateException("Unknown outcome: " + result.outcome());
        }
    }

    private static void printState(List<List<String>> tubes, PrintStream out) {
        for (int i = 0; i < tubes.size(); i++) {
            List<String> tube = tubes.get(i);
            out.printf("Tube %d: %s%n", i, tube.isEmpty() ? "[empty]" : String.join(" ", tube));
        }
    }

    private static SearchConstraints.SearchMode parseMode(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "bfs", "breadth-first" -> SearchConstraints.SearchMode.BREADTH_FIRST;
            case "best", "best-first", "astar" -> SearchConstraints.SearchMode.BEST_FIRST;
            default -> throw new IllegalArgumentException("Unknown search mode: " + value);
        };
    }

    private static PourPolicy parsePourPolicy(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "all", "all-or-nothing" -> PourPolicy.ALL_OR_NOTHING;
            case "partial" -> PourPolicy.PARTIAL;
            default -> throw new IllegalArgumentException("Unknown pour policy: " + value);
        };
    }

    private static void enableVerboseLogging() {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(Level.FINE);
        }
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage: WaterSortCLI <puzzleFile> [--mode=bfs|best] [--pour=all|partial] "
                + "[--maxStates=<count>] [--timeLimitMillis=<value>] [--verbose]");
    }
}
