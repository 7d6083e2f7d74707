package com.watersort.core.ai;

import com.watersort.core.Move;
import com.watersort.core.PuzzleState;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Frontier entry: a state together with the move that produced it and a link to its parent.
 * Paths are rebuilt from the parent chain only when a solution is found.
 */
record SearchNode(PuzzleState state, SearchNode parent, Move move, int depth) {

    static SearchNode root(PuzzleState state) {
        return new SearchNode(state, null, null, 0);
    }

    SearchNode child(PuzzleState next, Move via) {
        return new SearchNode(next, this, via, depth + 1);
    }

    List<Move> path() {
        List<Move> moves = new ArrayList<>(depth);
        for (SearchNode node = this; node.parent != null; node = node.parent) {
            moves.add(node.move);
        }
        Collections.reverse(moves);
        return moves;
    }
}
