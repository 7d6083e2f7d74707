package com.watersort.core;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class ColorPaletteTest {

    @Test
    void assignsIdsInFirstSeenOrder() {
        ColorPalette palette = new ColorPalette();

        assertEquals(0, palette.idOf("orange"));
        assertEquals(1, palette.idOf("pink"));
        assertEquals(0, palette.idOf("orange"));
        assertEquals("pink", palette.nameOf(1));
        assertEquals(List.of("orange", "pink"), palette.names());
        assertThrows(IllegalArgumentException.class, () -> palette.nameOf(2));
    }

    @Test
    void buildsStatesAndDescribesThemBack() {
        ColorPalette palette = new ColorPalette();
        List<List<String>> tubes = List.of(List.of("red", "blue"), List.of("blue"), List.of());

        PuzzleState state = palette.toState(PuzzleInput.of(3, tubes));

        assertEquals(3, state.capacity());
        assertArrayEquals(new int[] {0, 1}, state.tube(0).units());
        assertArrayEquals(new int[] {1}, state.tube(1).units());
        assertEquals(tubes, palette.describe(state));
    }
}
