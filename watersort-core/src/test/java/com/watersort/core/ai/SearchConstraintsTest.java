package com.watersort.core.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.watersort.core.PourPolicy;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class SearchConstraintsTest {

    @Test
    void defaultsUseBestFirstWithWholeBlockPours() {
        SearchConstraints defaults = SearchConstraints.defaults();

        assertEquals(SearchConstraints.SearchMode.BEST_FIRST, defaults.mode());
        assertEquals(PourPolicy.ALL_OR_NOTHING, defaults.pourPolicy());
        assertEquals(1_000_000L, defaults.maxStates());
        assertEquals(Duration.ZERO, defaults.timeLimit());
    }

    @Test
    void copiesReplaceOneComponent() {
        SearchConstraints base = SearchConstraints.defaults();

        SearchConstraints changed = base.withPourPolicy(PourPolicy.PARTIAL).withMaxStates(50);

        assertEquals(PourPolicy.PARTIAL, changed.pourPolicy());
        assertEquals(50, changed.maxStates());
        assertEquals(base.mode(), changed.mode());
        assertEquals(PourPolicy.ALL_OR_NOTHING, base.pourPolicy());
    }

    @Test
    void rejectsInvalidBudgets() {
        SearchConstraints base = SearchConstraints.defaults();

        assertThrows(IllegalArgumentException.class, () -> base.withMaxStates(0));
        assertThrows(IllegalArgumentException.class, () -> base.withTimeLimit(Duration.ofMillis(-1)));
        assertThrows(NullPointerException.class, () -> base.withMode(null));
    }
}
