package com.watersort.core.ai;

import com.watersort.core.PuzzleState;

/**
 * Generic interface for puzzle search implementations.
 */
public interface Searcher {

    /**
     * Searches for a sequence of moves that turns {@code initial} into a solved state under the
     * supplied {@link SearchConstraints}. The initial state is never modified.
     *
     * @param initial the starting state
     * @param constraints the pour policy and the limits guiding the search
     * @return the outcome of the search
     */
    SearchResult search(PuzzleState initial, SearchConstraints constraints);
}
