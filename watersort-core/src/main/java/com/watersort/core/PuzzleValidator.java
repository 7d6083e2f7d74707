package com.watersort.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structural checks run on a {@link PuzzleInput} before any search starts.
 */
public final class PuzzleValidator {

    public static final int MIN_TUBES = 2;

    private PuzzleValidator() {
    }

    /**
     * Returns every problem found in {@code input}; an empty list means the input is usable.
     */
    public static List<String> validate(PuzzleInput input) {
        Objects.requireNonNull(input, "input");
        List<String> problems = new ArrayList<>();
        if (input.totalTubes() < MIN_TUBES) {
            problems.add("Total tube count must be at least " + MIN_TUBES + " but was " + input.totalTubes());
        }
        if (input.capacity() < 1) {
            problems.add("Capacity must be at least 1 but was " + input.capacity());
        }
        if (input.tubes().size() != input.totalTubes()) {
            problems.add("Declared " + input.totalTubes() + " tubes but " + input.tubes().size() + " were supplied");
        }

        int empty = 0;
        for (int index = 0; index < input.tubes().size(); index++) {
            List<String> tube = input.tubes().get(index);
            if (tube == null) {
                problems.add("Tube " + index + " is missing");
                continue;
            }
            if (tube.isEmpty()) {
                empty++;
            }
            if (input.capacity() >= 1 && tube.size() > input.capacity()) {
                problems.add("Tube " + index + " holds " + tube.size() + " units but capacity is " + input.capacity());
            }
            for (int unit = 0; unit < tube.size(); unit++) {
                String color = tube.get(unit);
                if (color == null || color.isBlank()) {
                    problems.add("Tube " + index + " has a blank color at position " + unit);
                }
            }
        }

        if (input.declaredEmptyTubes().isPresent() && input.declaredEmptyTubes().getAsInt() != empty) {
            problems.add("Declared " + input.declaredEmptyTubes().getAsInt() + " empty tubes but found " + empty);
        }
        return problems;
    }
}
