package com.watersort.core;

/**
 * A pour from tube {@code from} into tube {@code to}.
 */
public record Move(int from, int to) {

    public Move {
        if (from < 0 || to < 0) {
            throw new IllegalArgumentException("Tube indices must not be negative: " + from + " -> " + to);
        }
        if (from == to) {
            throw new IllegalArgumentException("A tube cannot pour into itself: " + from);
        }
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
