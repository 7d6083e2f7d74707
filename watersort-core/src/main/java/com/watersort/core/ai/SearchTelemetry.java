package com.watersort.core.ai;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregated instrumentation data captured during a single {@link Searcher#search} call.
 */
public final class SearchTelemetry {

    public static final long CHECKPOINT_INTERVAL = 10_000L;

    private static final SearchTelemetry EMPTY = new SearchTelemetry(0L, 0L, 0L, 0L, 0L, 0, 0, 0L, List.of());

    private final long expandedStates;
    private final long generatedStates;
    private final long duplicateStates;
    private final long staleEntries;
    private final long reopenedStates;
    private final int peakFrontier;
    private final int knownStates;
    private final long elapsedNanos;
    private final List<Checkpoint> checkpoints;

    public SearchTelemetry(long expandedStates, long generatedStates, long duplicateStates, long staleEntries,
            long reopenedStates, int peakFrontier, int knownStates, long elapsedNanos, List<Checkpoint> checkpoints) {
        this.expandedStates = expandedStates;
        this.generatedStates = generatedStates;
        this.duplicateStates = duplicateStates;
        this.staleEntries = staleEntries;
        this.reopenedStates = reopenedStates;
        this.peakFrontier = peakFrontier;
        this.knownStates = knownStates;
        this.elapsedNanos = elapsedNanos;
        if (checkpoints == null || checkpoints.isEmpty()) {
            this.checkpoints = List.of();
        } else {
            this.checkpoints = Collections.unmodifiableList(new ArrayList<>(checkpoints));
        }
    }

    public static SearchTelemetry empty() {
        return EMPTY;
    }

    /** States taken off the frontier and checked. */
    public long expandedStates() {
        return expandedStates;
    }

    /** Successor states produced by legal moves, duplicates included. */
    public long generatedStates() {
        return generatedStates;
    }

    /** Successors dropped because an equal or cheaper path to them was already known. */
    public long duplicateStates() {
        return duplicateStates;
    }

    /** Frontier entries skipped because a cheaper path superseded them after they were queued. */
    public long staleEntries() {
        return staleEntries;
    }

    /** Known states queued again because a cheaper path to them turned up. */
    public long reopenedStates() {
        return reopenedStates;
    }

    public int peakFrontier() {
        return peakFrontier;
    }

    /** Distinct canonical keys recorded when the search ended. */
    public int knownStates() {
        return knownStates;
    }

    public long elapsedNanos() {
        return elapsedNanos;
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }

    public List<Checkpoint> checkpoints() {
        return checkpoints;
    }

    public Checkpoint latest() {
        return checkpoints.isEmpty() ? null : checkpoints.get(checkpoints.size() - 1);
    }

    @Override
    public String toString() {
        return String.format("expanded=%d, generated=%d, duplicates=%d, stale=%d, reopened=%d, peakFrontier=%d, "
                + "known=%d, elapsed=%.1f ms", expandedStates, generatedStates, duplicateStates, staleEntries,
                reopenedStates, peakFrontier, knownStates, elapsedMillis());
    }

    /**
     * Progress snapshot taken every {@link #CHECKPOINT_INTERVAL} expanded states.
     */
    public record Checkpoint(long expandedStates, int frontierSize, int knownStates, long elapsedNanos) {

        public double elapsedMillis() {
            return elapsedNanos / 1_000_000.0;
        }
    }

    /**
     * Mutable counters owned by a single search invocation.
     */
    static final class Recorder {

        private final long startNanos = System.nanoTime();
        private final List<Checkpoint> checkpoints = new ArrayList<>();
        private long expanded;
        private long generated;
        private long duplicates;
        private long stale;
        private long reopened;
        private int peakFrontier;

        /**
         * Counts one expanded state and returns a checkpoint when the interval is reached.
         */
        Checkpoint expanded(int frontierSize, int knownStates) {
            expanded++;
            if (expanded % CHECKPOINT_INTERVAL != 0) {
                return null;
            }
            Checkpoint checkpoint = new Checkpoint(expanded, frontierSize, knownStates, System.nanoTime() - startNanos);
            checkpoints.add(checkpoint);
            return checkpoint;
        }

        void generated() {
            generated++;
        }

        void duplicate() {
            duplicates++;
        }

        void stale() {
            stale++;
        }

        void reopened() {
            reopened++;
        }

        void frontier(int size) {
            if (size > peakFrontier) {
                peakFrontier = size;
            }
        }

        long expandedCount() {
            return expanded;
        }

        SearchTelemetry finish(int knownStates) {
            return new SearchTelemetry(expanded, generated, duplicates, stale, reopened, peakFrontier, knownStates,
                    System.nanoTime() - startNanos, checkpoints);
        }
    }
}
