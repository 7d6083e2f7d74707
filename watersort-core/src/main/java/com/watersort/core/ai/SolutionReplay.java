package com.watersort.core.ai;

import com.watersort.core.Move;
import com.watersort.core.PourPolicy;
import com.watersort.core.PuzzleState;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Re-derives the states a move list passes through. Independent of any {@link Searcher}.
 */
public final class SolutionReplay {

    private SolutionReplay() {
    }

    /**
     * Returns the initial state followed by the state after each move.
     *
     * @throws IllegalArgumentException if a move references a missing tube or is illegal in the state
     *         it is applied to
     */
    public static List<PuzzleState> replay(PuzzleState initial, List<Move> moves, PourPolicy policy) {
        Objects.requireNonNull(initial, "initial");
        Objects.requireNonNull(moves, "moves");
        Objects.requireNonNull(policy, "policy");

        List<PuzzleState> states = new ArrayList<>(moves.size() + 1);
        PuzzleState current = initial;
        states.add(current);
        for (int i = 0; i < moves.size(); i++) {
            Move move = Objects.requireNonNull(moves.get(i), "move");
            if (move.from() >= current.tubeCount() || move.to() >= current.tubeCount()) {
                throw new IllegalArgumentException("Move " + (i + 1) + " (" + move + ") references a tube outside [0, "
                        + current.tubeCount() + ")");
            }
            if (!current.canPour(move.from(), move.to(), policy)) {
                throw new IllegalArgumentException("Move " + (i + 1) + " (" + move + ") is not legal in " + current);
            }
            current = current.applyMove(move, policy);
            states.add(current);
        }
        return Collections.unmodifiableList(states);
    }

    /**
     * Returns {@code true} if every move is legal and the last state is solved.
     */
    public static boolean isSolution(PuzzleState initial, List<Move> moves, PourPolicy policy) {
        List<PuzzleState> states;
        try {
            states = replay(initial, moves, policy);
        } catch (IllegalArgumentException ex) {
            return false;
        }
        return states.get(states.size() - 1).isSolved();
    }
}
