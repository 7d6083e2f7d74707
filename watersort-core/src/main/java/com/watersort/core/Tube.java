package com.watersort.core;

import java.util.Arrays;

/**
 * Immutable stack of color units. Index 0 is the bottom unit, the last index is the top unit.
 * Colors are opaque integer ids handed out by a {@link ColorPalette}.
 */
public final class Tube {

    private static final int[] NO_UNITS = new int[0];

    private final int[] units;
    private final int capacity;

    /**
     * Creates an empty tube with the provided capacity.
     */
    public Tube(int capacity) {
        this(NO_UNITS, capacity);
    }

    /**
     * Creates a tube holding the provided units, bottom first.
     */
    public Tube(int[] units, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }
        if (units.length > capacity) {
            throw new IllegalArgumentException("Tube holds " + units.length + " units but capacity is " + capacity);
        }
        this.units = units.length == 0 ? NO_UNITS : units.clone();
        this.capacity = capacity;
    }

    public int capacity() {
        return capacity;
    }

    public int size() {
        return units.length;
    }

    public int freeSpace() {
        return capacity - units.length;
    }

    public boolean isEmpty() {
        return units.length == 0;
    }

    public boolean isFull() {
        return units.length == capacity;
    }

    /**
     * Returns the color at {@code index}, counted from the bottom.
     */
    public int colorAt(int index) {
        if (index < 0 || index >= units.length) {
            throw new IllegalArgumentException("Unit index out of range: " + index);
        }
        return units[index];
    }

    /**
     * Returns the top color, or {@code -1} if the tube is empty.
     */
    public int topColor() {
        return units.length == 0 ? -1 : units[units.length - 1];
    }

    /**
     * Returns the bottom color, or {@code -1} if the tube is empty.
     */
    public int bottomColor() {
        return units.length == 0 ? -1 : units[0];
    }

    /**
     * Returns the number of topmost units that share the top color.
     */
    public int blockSize() {
        if (units.length == 0) {
            return 0;
        }
        int top = units[units.length - 1];
        int count = 0;
        for (int i = units.length - 1; i >= 0 && units[i] == top; i--) {
            count++;
        }
        return count;
    }

    /**
     * Returns {@code true} if the tube is empty or holds a single color. The fill level is irrelevant.
     */
    public boolean isSettled() {
        return blockSize() == units.length;
    }

    /**
     * Counts the adjacent unit pairs whose colors differ.
     */
    public int colorBreaks() {
        int breaks = 0;
        for (int i = 1; i < units.length; i++) {
            if (units[i] != units[i - 1]) {
                breaks++;
            }
        }
        return breaks;
    }

    /**
     * Returns a copy of the units, bottom first.
     */
    public int[] units() {
        return units.clone();
    }

    /**
     * Returns a new tube with the top {@code amount} units removed.
     */
    public Tube withoutTop(int amount) {
        if (amount < 0 || amount > units.length) {
            throw new IllegalArgumentException("Cannot remove " + amount + " units from a tube of size " + units.length);
        }
        if (amount == 0) {
            return this;
        }
        return new Tube(Arrays.copyOf(units, units.length - amount), capacity);
    }

    /**
     * Returns a new tube with {@code amount} units of {@code color} added on top.
     */
    public Tube withAdded(int color, int amount) {
        if (amount < 0 || amount > freeSpace()) {
            throw new IllegalArgumentException("Cannot add " + amount + " units to a tube with "
                    + freeSpace() + " free slots");
        }
        if (amount == 0) {
            return this;
        }
        int[] updated = Arrays.copyOf(units, units.length + amount);
        Arrays.fill(updated, units.length, updated.length, color);
        return new Tube(updated, capacity);
    }

    void appendKey(StringBuilder builder) {
        for (int i = 0; i < units.length; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(units[i]);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Tube tube)) {
            return false;
        }
        return capacity == tube.capacity && Arrays.equals(units, tube.units);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(units) + capacity;
    }

    @Override
    public String toString() {
        return Arrays.toString(units);
    }
}
