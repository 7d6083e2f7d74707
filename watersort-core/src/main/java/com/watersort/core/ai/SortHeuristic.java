package com.watersort.core.ai;

import com.watersort.core.PuzzleState;
import com.watersort.core.Tube;
import java.util.HashMap;
import java.util.Map;

/**
 * Distance estimate used by {@link BestFirstSearcher}. Not admissible.
 */
public final class SortHeuristic {

    private SortHeuristic() {
    }

    /**
     * Returns the number of adjacent differing unit pairs inside tubes plus, for every color that
     * sits at the bottom of several tubes, one point per tube beyond the first.
     */
    public static int estimate(PuzzleState state) {
        int breaks = 0;
        Map<Integer, Integer> bottoms = new HashMap<>();
        for (Tube tube : state.tubes()) {
            breaks += tube.colorBreaks();
            if (!tube.isEmpty()) {
                bottoms.merge(tube.bottomColor(), 1, Integer::sum);
            }
        }
        int bottomPenalty = 0;
        for (int count : bottoms.values()) {
            if (count > 1) {
                bottomPenalty += count - 1;
            }
        }
        return breaks + bottomPenalty;
    }
}
