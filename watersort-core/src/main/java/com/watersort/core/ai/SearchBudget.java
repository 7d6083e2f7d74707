package com.watersort.core.ai;

import java.time.Duration;

/**
 * Per-search bounds on expanded states and wall-clock time. Checked once per dequeued state.
 */
final class SearchBudget {

    private final long maxStates;
    private final long deadlineNanos;

    private SearchBudget(long maxStates, long deadlineNanos) {
        this.maxStates = maxStates;
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * Starts the clock for a search configured by {@code constraints}.
     */
    static SearchBudget start(SearchConstraints constraints) {
        long timeLimitNanos = toTimeLimitNanos(constraints.timeLimit());
        long deadline = timeLimitNanos == Long.MAX_VALUE
                ? Long.MAX_VALUE
                : saturatingAdd(System.nanoTime(), timeLimitNanos);
        return new SearchBudget(constraints.maxStates(), deadline);
    }

    /**
     * Returns the limit reached after {@code expandedStates} expansions, or {@link SearchResult.Limit#NONE}.
     */
    SearchResult.Limit check(long expandedStates) {
        if (expandedStates >= maxStates) {
            return SearchResult.Limit.STATES;
        }
        if (deadlineNanos != Long.MAX_VALUE && System.nanoTime() >= deadlineNanos) {
            return SearchResult.Limit.TIME;
        }
        return SearchResult.Limit.NONE;
    }

    private static long toTimeLimitNanos(Duration timeLimit) {
        long nanos = timeLimit.isZero() ? Long.MAX_VALUE : timeLimit.toNanos();
        return nanos <= 0L ? 1L : nanos;
    }

    private static long saturatingAdd(long a, long b) {
        long result = a + b;
        if (((a ^ result) & (b ^ result)) < 0) {
            return Long.MAX_VALUE;
        }
        return result;
    }
}
