package com.watersort.core.ai;

import com.watersort.core.Move;
import com.watersort.core.PourPolicy;
import com.watersort.core.PuzzleState;
import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Breadth-first searcher. The first solved state dequeued is reached with the fewest moves
 * possible under the configured {@link PourPolicy}.
 */
public final class BreadthFirstSearcher implements Searcher {

    private static final Logger LOGGER = Logger.getLogger(BreadthFirstSearcher.class.getName());

    @Override
    public SearchResult search(PuzzleState initial, SearchConstraints constraints) {
        Objects.requireNonNull(initial, "initial");
        Objects.requireNonNull(constraints, "constraints");

        PourPolicy policy = constraints.pourPolicy();
        SearchBudget budget = SearchBudget.start(constraints);
        SearchTelemetry.Recorder recorder = new SearchTelemetry.Recorder();

        ArrayDeque<SearchNode> frontier = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        frontier.add(SearchNode.root(initial));
        visited.add(initial.canonicalKey());
        recorder.frontier(frontier.size());

        while (!frontier.isEmpty()) {
            SearchResult.Limit limit = budget.check(recorder.expandedCount());
            if (limit != SearchResult.Limit.NONE) {
                SearchTelemetry telemetry = recorder.finish(visited.size());
                LOGGER.info(() -> String.format("BFS stopped by %s limit (%s)", limit, telemetry));
                return SearchResult.exhausted(limit, telemetry);
            }

            SearchNode node = frontier.poll();
            SearchTelemetry.Checkpoint checkpoint = recorder.expanded(frontier.size(), visited.size());
            if (checkpoint != null) {
                LOGGER.fine(() -> String.format("BFS progress: %d states expanded, %d queued, %d known",
                        checkpoint.expandedStates(), checkpoint.frontierSize(), checkpoint.knownStates()));
            }

            if (node.state().isSolved()) {
                List<Move> path = node.path();
                SearchTelemetry telemetry = recorder.finish(visited.size());
                LOGGER.info(() -> String.format("BFS found a %d-move solution (%s)", path.size(), telemetry));
                return SearchResult.solved(path, telemetry);
            }

            for (Move move : node.state().legalMoves(policy)) {
                PuzzleState next = node.state().applyMove(move, policy);
                recorder.generated();
                if (!visited.add(next.canonicalKey())) {
                    recorder.duplicate();
                    continue;
                }
                frontier.add(node.child(next, move));
            }
            recorder.frontier(frontier.size());
        }

        SearchTelemetry telemetry = recorder.finish(visited.size());
        LOGGER.info(() -> String.format("BFS exhausted the state space without a solution (%s)", telemetry));
        return SearchResult.unsolvable(telemetry);
    }
}
