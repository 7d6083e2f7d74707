package com.watersort.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Raw puzzle description as delivered by the state-capture side: the declared tube count, the
 * shared capacity, the contents of every tube (bottom first) and, optionally, the declared number
 * of empty tubes. Nothing beyond nullness is checked here; see {@link PuzzleValidator}.
 */
public record PuzzleInput(int totalTubes, int capacity, List<List<String>> tubes, OptionalInt declaredEmptyTubes) {

    public PuzzleInput {
        Objects.requireNonNull(tubes, "tubes");
        Objects.requireNonNull(declaredEmptyTubes, "declaredEmptyTubes");
        List<List<String>> copy = new ArrayList<>(tubes.size());
        for (List<String> tube : tubes) {
            copy.add(tube == null ? null : Collections.unmodifiableList(new ArrayList<>(tube)));
        }
        tubes = Collections.unmodifiableList(copy);
    }

    public PuzzleInput(int totalTubes, int capacity, List<List<String>> tubes) {
        this(totalTubes, capacity, tubes, OptionalInt.empty());
    }

    /**
     * Creates an input whose tube count is taken from the tube list.
     */
    public static PuzzleInput of(int capacity, List<List<String>> tubes) {
        Objects.requireNonNull(tubes, "tubes");
        return new PuzzleInput(tubes.size(), capacity, tubes);
    }
}
