package com.watersort.core.ai;

import com.watersort.core.PourPolicy;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable search configuration passed to {@link Searcher} implementations.
 *
 * @param mode       which search strategy to run
 * @param pourPolicy how much of a block a pour moves when the destination is short on space
 * @param maxStates  the number of states the search may expand before giving up
 * @param timeLimit  wall-clock limit for a single search, {@link Duration#ZERO} for none
 */
public record SearchConstraints(SearchMode mode, PourPolicy pourPolicy, long maxStates, Duration timeLimit) {

    public static final long DEFAULT_MAX_STATES = 1_000_000L;
    public static final long UNLIMITED_STATES = Long.MAX_VALUE;

    public SearchConstraints {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(pourPolicy, "pourPolicy");
        Objects.requireNonNull(timeLimit, "timeLimit");
        if (maxStates < 1) {
            throw new IllegalArgumentException("maxStates must be at least 1");
        }
        if (timeLimit.isNegative()) {
            throw new IllegalArgumentException("timeLimit must not be negative");
        }
    }

    /**
     * Best-first search with all-or-nothing pours, a million states and no time limit.
     */
    public static SearchConstraints defaults() {
        return new SearchConstraints(SearchMode.BEST_FIRST, PourPolicy.ALL_OR_NOTHING, DEFAULT_MAX_STATES,
                Duration.ZERO);
    }

    public SearchConstraints withMode(SearchMode mode) {
        return new SearchConstraints(mode, pourPolicy, maxStates, timeLimit);
    }

    public SearchConstraints withPourPolicy(PourPolicy pourPolicy) {
        return new SearchConstraints(mode, pourPolicy, maxStates, timeLimit);
    }

    public SearchConstraints withMaxStates(long maxStates) {
        return new SearchConstraints(mode, pourPolicy, maxStates, timeLimit);
    }

    public SearchConstraints withTimeLimit(Duration timeLimit) {
        return new SearchConstraints(mode, pourPolicy, maxStates, timeLimit);
    }

    /**
     * Search strategy selector.
     */
    public enum SearchMode {
        /** Breadth-first search; solutions have the minimum number of moves. */
        BREADTH_FIRST,
        /** Heuristic best-first search; usually faster, solutions may be longer than necessary. */
        BEST_FIRST
    }
}
