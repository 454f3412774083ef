package org.astar.core;

import org.astar.graph.GraphNode;

import java.util.List;

/**
 * Outcome of one path search.
 *
 * @param reachable whether the goal is reachable from the start.
 * @param totalCost summed edge cost of {@code path} (or {@code +INF} when unreachable).
 * @param path nodes from start to goal inclusive (empty when unreachable).
 * @param expandedSteps number of steps polled and expanded (goal step excluded).
 * @param relaxations number of queued steps re-routed through a cheaper predecessor.
 * @param peakFrontierSize high-water mark of the frontier.
 * @param <N> node type.
 */
public record PathResult<N extends GraphNode<N>>(
        boolean reachable,
        double totalCost,
        List<N> path,
        int expandedSteps,
        int relaxations,
        int peakFrontierSize
) {
    public PathResult {
        path = List.copyOf(path);
    }

    /**
     * Creates the zero-edge result for a search whose start is its goal.
     */
    static <N extends GraphNode<N>> PathResult<N> startIsGoal(N start) {
        return new PathResult<N>(true, 0.0d, List.of(start), 0, 0, 0);
    }

    /**
     * Creates a canonical unreachable result.
     */
    static <N extends GraphNode<N>> PathResult<N> unreachable(int expandedSteps, int relaxations, int peakFrontierSize) {
        return new PathResult<N>(false, Double.POSITIVE_INFINITY, List.of(), expandedSteps, relaxations, peakFrontierSize);
    }

    /**
     * @return number of edges in {@code path}, or {@code -1} when unreachable.
     */
    public int hops() {
        return reachable ? path.size() - 1 : -1;
    }
}
