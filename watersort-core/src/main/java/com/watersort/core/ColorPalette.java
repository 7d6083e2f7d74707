package com.watersort.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Interns color tokens to small integer ids in first-seen order.
 */
public final class ColorPalette {

    private final Map<String, Integer> ids = new HashMap<>();
    private final List<String> names = new ArrayList<>();

    /**
     * Returns the id for {@code name}, assigning the next free id on first use.
     */
    public int idOf(String name) {
        Objects.requireNonNull(name, "name");
        Integer existing = ids.get(name);
        if (existing != null) {
            return existing;
        }
        int id = names.size();
        ids.put(name, id);
        names.add(name);
        return id;
    }

    /**
     * Returns the token registered for {@code id}.
     */
    public String nameOf(int id) {
        if (id < 0 || id >= names.size()) {
            throw new IllegalArgumentException("Unknown color id: " + id);
        }
        return names.get(id);
    }

    public int size() {
        return names.size();
    }

    public List<String> names() {
        return Collections.unmodifiableList(names);
    }

    /**
     * Builds the puzzle state described by {@code input}, registering its colors in this palette.
     * The input must already be valid.
     */
    public PuzzleState toState(PuzzleInput input) {
        Objects.requireNonNull(input, "input");
        List<Tube> tubes = new ArrayList<>(input.tubes().size());
        for (List<String> tube : input.tubes()) {
            int[] units = new int[tube.size()];
            for (int i = 0; i < units.length; i++) {
                units[i] = idOf(tube.get(i));
            }
            tubes.add(new Tube(units, input.capacity()));
        }
        return new PuzzleState(tubes);
    }

    /**
     * Renders the tube contents as color tokens, bottom first.
     */
    public List<List<String>> describe(PuzzleState state) {
        List<List<String>> result = new ArrayList<>(state.tubeCount());
        for (Tube tube : state.tubes()) {
            List<String> units = new ArrayList<>(tube.size());
            for (int i = 0; i < tube.size(); i++) {
                units.add(nameOf(tube.colorAt(i)));
            }
            result.add(units);
        }
        return result;
    }
}
