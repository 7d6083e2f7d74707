package com.watersort.core;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class TubeTest {

    @Test
    void blockSizeCountsTopRun() {
        assertEquals(0, new Tube(4).blockSize());
        assertEquals(2, new Tube(new int[] {0, 1, 1}, 4).blockSize());
        assertEquals(3, new Tube(new int[] {2, 2, 2}, 3).blockSize());
        assertEquals(1, new Tube(new int[] {1, 1, 0}, 4).blockSize());
    }

    @Test
    void settledIgnoresFillLevel() {
        assertTrue(new Tube(4).isSettled());
        assertTrue(new Tube(new int[] {3}, 4).isSettled());
        assertTrue(new Tube(new int[] {3, 3, 3, 3}, 4).isSettled());
        assertFalse(new Tube(new int[] {0, 1}, 4).isSettled());
    }

    @Test
    void countsColorBreaks() {
        assertEquals(3, new Tube(new int[] {0, 1, 0, 1}, 4).colorBreaks());
        assertEquals(0, new Tube(new int[] {5, 5}, 4).colorBreaks());
        assertEquals(0, new Tube(4).colorBreaks());
    }

    @Test
    void addAndRemoveReturnNewTubes() {
        Tube tube = new Tube(new int[] {0, 1}, 4);
        Tube added = tube.withAdded(1, 2);
        Tube removed = added.withoutTop(3);

        assertArrayEquals(new int[] {0, 1}, tube.units());
        assertArrayEquals(new int[] {0, 1, 1, 1}, added.units());
        assertTrue(added.isFull());
        assertArrayEquals(new int[] {0}, removed.units());
        assertEquals(3, removed.freeSpace());
    }

    @Test
    void rejectsOverflow() {
        assertThrows(IllegalArgumentException.class, () -> new Tube(new int[] {0, 0, 0}, 2));
        assertThrows(IllegalArgumentException.class, () -> new Tube(new int[] {0}, 2).withAdded(0, 2));
        assertThrows(IllegalArgumentException.class, () -> new Tube(new int[] {0}, 2).withoutTop(2));
        assertThrows(IllegalArgumentException.class, () -> new Tube(0));
    }

    @Test
    void unitsAreCopiedDefensively() {
        int[] units = {0, 1};
        Tube tube = new Tube(units, 3);
        units[0] = 9;
        tube.units()[1] = 9;

        assertArrayEquals(new int[] {0, 1}, tube.units());
        assertEquals(0, tube.bottomColor());
        assertEquals(1, tube.topColor());
    }

    @Test
    void derivedTubesKeepCapacityAndUnitOrder() {
        Tube tube = new Tube(new int[] {2}, 5);

        Tube filled = tube.withAdded(7, 3);
        Tube drained = filled.withoutTop(4);

        assertEquals(5, filled.capacity());
        assertEquals(1, filled.freeSpace());
        assertArrayEquals(new int[] {2, 7, 7, 7}, filled.units());
        assertEquals(5, drained.capacity());
        assertTrue(drained.isEmpty());
        assertEquals(new Tube(5), drained);
    }
}
