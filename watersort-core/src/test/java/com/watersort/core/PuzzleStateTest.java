package com.watersort.core;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class PuzzleStateTest {

    private static final int RED = 0;
    private static final int BLUE = 1;

    @Test
    void cannotPourFromEmptyTube() {
        PuzzleState state = PuzzleState.of(4, new int[] {}, new int[] {RED});
        assertFalse(state.canPour(0, 1, PourPolicy.ALL_OR_NOTHING));
        assertFalse(state.canPour(0, 1, PourPolicy.PARTIAL));
    }

    @Test
    void cannotPourIntoFullTube() {
        PuzzleState state = PuzzleState.of(2, new int[] {RED}, new int[] {RED, RED});
        assertFalse(state.canPour(0, 1, PourPolicy.PARTIAL));
    }

    @Test
    void anyBlockMayEnterAnEmptyTube() {
        PuzzleState state = PuzzleState.of(4, new int[] {RED, BLUE, BLUE}, new int[] {});
        assertEquals(2, state.transferAmount(0, 1, PourPolicy.ALL_OR_NOTHING));
    }

    @Test
    void topColorsMustMatch() {
        PuzzleState state = PuzzleState.of(4, new int[] {RED, BLUE}, new int[] {RED});
        assertFalse(state.canPour(0, 1, PourPolicy.PARTIAL));
        assertFalse(state.canPour(1, 0, PourPolicy.PARTIAL));
    }

    @Test
    void rejectsSelfAndOutOfRangePours() {
        PuzzleState state = PuzzleState.of(4, new int[] {RED}, new int[] {});
        assertFalse(state.canPour(0, 0, PourPolicy.PARTIAL));
        assertFalse(state.canPour(0, 2, PourPolicy.PARTIAL));
        assertFalse(state.canPour(-1, 1, PourPolicy.PARTIAL));
    }

    @Test
    void pourPolicyDecidesWhenBlockDoesNotFit() {
        PuzzleState state = PuzzleState.of(4, new int[] {BLUE, RED, RED}, new int[] {RED, RED, RED});

        assertEquals(0, state.transferAmount(0, 1, PourPolicy.ALL_OR_NOTHING));
        assertEquals(1, state.transferAmount(0, 1, PourPolicy.PARTIAL));

        PuzzleState poured = state.applyMove(new Move(0, 1), PourPolicy.PARTIAL);
        assertArrayEquals(new int[] {BLUE, RED}, poured.tube(0).units());
        assertArrayEquals(new int[] {RED, RED, RED, RED}, poured.tube(1).units());
        assertThrows(IllegalArgumentException.class,
                () -> state.applyMove(new Move(0, 1), PourPolicy.ALL_OR_NOTHING));
    }

    @Test
    void settledTubeIntoEmptyTubeIsNotUseful() {
        PuzzleState state = PuzzleState.of(4, new int[] {RED, RED}, new int[] {BLUE, RED}, new int[] {});
        assertTrue(state.canPour(0, 2, PourPolicy.ALL_OR_NOTHING));
        assertFalse(state.isUsefulMove(0, 2));
        assertTrue(state.isUsefulMove(1, 2));
    }

    @Test
    void legalMovesFollowIndexOrderAndSkipUselessPours() {
        PuzzleState state = PuzzleState.of(3, new int[] {RED, BLUE}, new int[] {BLUE}, new int[] {});

        List<Move> moves = state.legalMoves(PourPolicy.ALL_OR_NOTHING);

        assertEquals(List.of(new Move(0, 1), new Move(0, 2), new Move(1, 0)), moves);
    }

    @Test
    void applyMoveLeavesOriginalUntouched() {
        PuzzleState state = PuzzleState.of(4, new int[] {RED, BLUE, BLUE}, new int[] {});
        String before = state.canonicalKey();

        PuzzleState next = state.applyMove(new Move(0, 1), PourPolicy.ALL_OR_NOTHING);

        assertEquals(before, state.canonicalKey());
        assertArrayEquals(new int[] {RED}, next.tube(0).units());
        assertArrayEquals(new int[] {BLUE, BLUE}, next.tube(1).units());
        assertEquals(state.colorCounts(), next.colorCounts());
    }

    @Test
    void solvedWhenEveryTubeIsSettled() {
        assertTrue(PuzzleState.of(4, new int[] {RED, RED}, new int[] {BLUE}, new int[] {}).isSolved());
        assertTrue(PuzzleState.of(4, new int[] {RED}, new int[] {RED}).isSolved());
        assertFalse(PuzzleState.of(4, new int[] {RED, BLUE}, new int[] {}).isSolved());
    }

    @Test
    void canonicalKeyKeepsTubeOrder() {
        PuzzleState state = PuzzleState.of(4, new int[] {RED, BLUE}, new int[] {}, new int[] {BLUE});
        PuzzleState same = PuzzleState.of(4, new int[] {RED, BLUE}, new int[] {}, new int[] {BLUE});
        PuzzleState swapped = PuzzleState.of(4, new int[] {BLUE}, new int[] {}, new int[] {RED, BLUE});

        assertEquals("0,1||1", state.canonicalKey());
        assertEquals(state, same);
        assertEquals(state.hashCode(), same.hashCode());
        assertNotEquals(state.canonicalKey(), swapped.canonicalKey());
    }

    @Test
    void keyDistinguishesMultiDigitColors() {
        PuzzleState first = PuzzleState.of(4, new int[] {1, 12}, new int[] {});
        PuzzleState second = PuzzleState.of(4, new int[] {11, 2}, new int[] {});
        assertNotEquals(first.canonicalKey(), second.canonicalKey());
    }

    @Test
    void countsEmptyTubesAndColors() {
        PuzzleState state = PuzzleState.of(4, new int[] {RED, BLUE, RED}, new int[] {}, new int[] {BLUE}, new int[] {});
        assertEquals(2, state.emptyTubeCount());
        assertEquals(2, state.colorCounts().get(RED));
        assertEquals(2, state.colorCounts().get(BLUE));
    }

    @Test
    void rejectsMalformedStates() {
        assertThrows(IllegalArgumentException.class, () -> PuzzleState.of(4, new int[] {RED}));
        assertThrows(IllegalArgumentException.class,
                () -> new PuzzleState(List.of(new Tube(4), new Tube(3))));
        assertThrows(IllegalArgumentException.class, () -> PuzzleState.of(1, new int[] {RED, RED}, new int[] {}));
    }
}
