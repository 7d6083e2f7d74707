package com.watersort.core.ai;

import com.watersort.core.Move;
import com.watersort.core.PourPolicy;
import com.watersort.core.PuzzleState;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.logging.Logger;

/**
 * A*-style best-first searcher ordered by {@code moves so far + SortHeuristic.estimate}. Entries with
 * equal priority leave the queue in insertion order, so repeated runs expand the same states.
 * The heuristic is not admissible and returned solutions may be longer than the shortest one.
 */
public final class BestFirstSearcher implements Searcher {

    private static final Logger LOGGER = Logger.getLogger(BestFirstSearcher.class.getName());
    private static final Comparator<QueueEntry> ORDER =
            Comparator.comparingInt(QueueEntry::priority).thenComparingLong(QueueEntry::sequence);

    @Override
    public SearchResult search(PuzzleState initial, SearchConstraints constraints) {
        Objects.requireNonNull(initial, "initial");
        Objects.requireNonNull(constraints, "constraints");

        PourPolicy policy = constraints.pourPolicy();
        SearchBudget budget = SearchBudget.start(constraints);
        SearchTelemetry.Recorder recorder = new SearchTelemetry.Recorder();

        PriorityQueue<QueueEntry> frontier = new PriorityQueue<>(ORDER);
        Map<String, Integer> bestDepth = new HashMap<>();
        long sequence = 0L;

        frontier.add(new QueueEntry(SearchNode.root(initial), SortHeuristic.estimate(initial), sequence++));
        bestDepth.put(initial.canonicalKey(), 0);
        recorder.frontier(frontier.size());

        while (!frontier.isEmpty()) {
            SearchResult.Limit limit = budget.check(recorder.expandedCount());
            if (limit != SearchResult.Limit.NONE) {
                SearchTelemetry telemetry = recorder.finish(bestDepth.size());
                LOGGER.info(() -> String.format("Best-first search stopped by %s limit (%s)", limit, telemetry));
                return SearchResult.exhausted(limit, telemetry);
            }

            SearchNode node = frontier.poll().node();
            PuzzleState state = node.state();
            Integer known = bestDepth.get(state.canonicalKey());
            if (known != null && node.depth() > known) {
                recorder.stale();
                continue;
            }

            SearchTelemetry.Checkpoint checkpoint = recorder.expanded(frontier.size(), bestDepth.size());
            if (checkpoint != null) {
                LOGGER.fine(() -> String.format("Best-first progress: %d states expanded, %d queued, %d known",
                        checkpoint.expandedStates(), checkpoint.frontierSize(), checkpoint.knownStates()));
            }

            if (state.isSolved()) {
                List<Move> path = node.path();
                SearchTelemetry telemetry = recorder.finish(bestDepth.size());
                LOGGER.info(() -> String.format("Best-first search found a %d-move solution (%s)", path.size(),
                        telemetry));
                return SearchResult.solved(path, telemetry);
            }

            int childDepth = node.depth() + 1;
            for (Move move : state.legalMoves(policy)) {
                PuzzleState next = state.applyMove(move, policy);
                recorder.generated();
                String key = next.canonicalKey();
                Integer previous = bestDepth.get(key);
                if (previous != null && previous <= childDepth) {
                    recorder.duplicate();
                    continue;
                }
                if (previous != null) {
                    recorder.reopened();
                }
                bestDepth.put(key, childDepth);
                int priority = childDepth + SortHeuristic.estimate(next);
                frontier.add(new QueueEntry(node.child(next, move), priority, sequence++));
            }
            recorder.frontier(frontier.size());
        }

        SearchTelemetry telemetry = recorder.finish(bestDepth.size());
        LOGGER.info(() -> String.format("Best-first search exhausted the state space without a solution (%s)",
                telemetry));
        return SearchResult.unsolvable(telemetry);
    }

    private record QueueEntry(SearchNode node, int priority, long sequence) {
    }
}
