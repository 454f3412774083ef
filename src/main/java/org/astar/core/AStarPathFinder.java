package org.astar.core;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import lombok.Builder;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.astar.graph.GraphNode;
import org.astar.search.ClosedSet;
import org.astar.search.Step;
import org.astar.search.StepFrontier;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Best-first (A*) path search over any {@link GraphNode} graph.
 *
 * <p>The search seeds the frontier with the start node's neighbors, then repeatedly polls the
 * step with the lowest {@code g + h}. The goal test runs when a step is polled, not when it is
 * generated. Expanded nodes are closed and never queued again; a cheaper path to a queued node
 * relaxes that node's step in place.</p>
 *
 * <p>Results are reproducible when {@code neighborOrder} is set: neighbors are expanded in that
 * order and equal-cost steps are polled in creation order. Without it, the order of each
 * {@link GraphNode#connectedNodes()} set decides between equal-cost alternatives.</p>
 *
 * <p>Instances are immutable; every search owns its own frontier and closed set.</p>
 *
 * @param <N> node type.
 */
@Slf4j
@Getter
@Accessors(fluent = true)
public final class AStarPathFinder<N extends GraphNode<N>> {

    /** Optional neighbor expansion order; {@code null} keeps set iteration order. */
    private final Comparator<? super N> neighborOrder;

    private final SearchBudget budget;

    @Builder
    private AStarPathFinder(Comparator<? super N> neighborOrder, SearchBudget budget) {
        this.neighborOrder = neighborOrder;
        this.budget = budget == null ? SearchBudget.defaults() : budget;
    }

    /**
     * Returns a finder with set iteration order and the system-property budget.
     */
    public static <N extends GraphNode<N>> AStarPathFinder<N> defaults() {
        return AStarPathFinder.<N>builder().build();
    }

    /**
     * Finds the cheapest path from {@code start} to {@code goal}.
     *
     * @return nodes in start-to-goal order; {@code [start]} when start is the goal; empty when
     * the goal is unreachable.
     * @throws PathSearchException on null nodes, invalid costs or an exceeded budget.
     */
    public List<N> findPath(N start, N goal) {
        return search(start, goal).path();
    }

    /**
     * Runs one search and reports the path with its cost and search statistics.
     *
     * @throws PathSearchException on null nodes, invalid costs, failing node callbacks or an
     * exceeded budget.
     */
    public PathResult<N> search(N start, N goal) {
        requireNode(start, "start");
        requireNode(goal, "goal");

        if (start.equals(goal)) {
            return PathResult.startIsGoal(start);
        }

        try {
            return run(start, goal);
        } catch (PathSearchException ex) {
            log.warn("Search {} -> {} aborted: {}", start, goal, ex.getMessage());
            throw ex;
        }
    }

    private PathResult<N> run(N start, N goal) {
        StepFrontier<N> frontier = new StepFrontier<>();
        ClosedSet<N> closed = new ClosedSet<>();
        closed.markClosed(start);

        long sequence = 0;
        for (N neighbor : orderedNeighbors(start)) {
            if (closed.isClosed(neighbor)) {
                continue;
            }
            double edgeCost = edgeCost(start, neighbor);
            frontier.offer(Step.first(neighbor, edgeCost, estimate(neighbor, goal), sequence++));
        }
        budget.checkFrontierSize(frontier.size());

        int expandedSteps = 0;
        int relaxations = 0;
        while (!frontier.isEmpty()) {
            Step<N> step = frontier.poll();
            N node = step.node();

            if (node.equals(goal)) {
                List<N> path = reconstruct(start, step);
                log.debug("Path {} -> {} found: cost={}, hops={}, expanded={}, relaxations={}",
                        start, goal, step.stepCost(), path.size() - 1, expandedSteps, relaxations);
                return new PathResult<>(true, step.stepCost(), path, expandedSteps, relaxations, frontier.getPeakSize());
            }

            closed.markClosed(node);
            expandedSteps++;
            budget.checkExpandedSteps(expandedSteps);

            for (N neighbor : orderedNeighbors(node)) {
                if (closed.isClosed(neighbor)) {
                    continue;
                }
                double edgeCost = edgeCost(node, neighbor);
                double stepCost = CostGuard.checkPathCost(start, neighbor, step.stepCost() + edgeCost);
                Step<N> queued = frontier.get(neighbor);
                if (queued != null && stepCost >= queued.stepCost()) {
                    continue;
                }
                double goalCost = queued != null ? queued.goalCost() : estimate(neighbor, goal);
                StepFrontier.Offer outcome = frontier.offer(Step.extend(step, neighbor, edgeCost, goalCost, sequence++));
                if (outcome == StepFrontier.Offer.RELAXED) {
                    relaxations++;
                }
            }
            budget.checkFrontierSize(frontier.size());
        }

        log.debug("No path {} -> {}: expanded={}, closed={}", start, goal, expandedSteps, closed.size());
        return PathResult.unreachable(expandedSteps, relaxations, frontier.getPeakSize());
    }

    /**
     * Walks predecessor links back from the goal step, then prepends the start node.
     */
    private static <N extends GraphNode<N>> List<N> reconstruct(N start, Step<N> goalStep) {
        ObjectArrayList<N> reversed = new ObjectArrayList<>();
        for (Step<N> cursor = goalStep; cursor != null; cursor = cursor.previous()) {
            reversed.add(cursor.node());
        }
        reversed.add(start);

        ObjectArrayList<N> path = new ObjectArrayList<>(reversed.size());
        for (int i = reversed.size() - 1; i >= 0; i--) {
            path.add(reversed.get(i));
        }
        return path;
    }

    private double edgeCost(N from, N to) {
        double cost;
        try {
            cost = from.cost(to);
        } catch (RuntimeException ex) {
            throw nodeFailure("cost", from, to, ex);
        }
        return CostGuard.checkEdgeCost(from, to, cost);
    }

    private double estimate(N node, N goal) {
        double estimate;
        try {
            estimate = node.estimatedCost(goal);
        } catch (RuntimeException ex) {
            throw nodeFailure("estimatedCost", node, goal, ex);
        }
        return CostGuard.checkEstimate(node, goal, estimate);
    }

    private Collection<N> orderedNeighbors(N node) {
        Collection<N> neighbors;
        try {
            neighbors = node.connectedNodes();
        } catch (RuntimeException ex) {
            throw nodeFailure("connectedNodes", node, null, ex);
        }
        if (neighbors == null || neighbors.isEmpty()) {
            return List.of();
        }
        if (neighborOrder == null) {
            return neighbors;
        }
        ObjectArrayList<N> sorted = new ObjectArrayList<>(neighbors);
        sorted.sort(neighborOrder);
        return sorted;
    }

    /**
     * Wraps a failure raised by a caller-supplied node; search contract failures pass through.
     */
    private static PathSearchException nodeFailure(String operation, Object node, Object other, RuntimeException cause) {
        if (cause instanceof PathSearchException) {
            return (PathSearchException) cause;
        }
        String target = other == null ? "" : " -> " + other;
        return new PathSearchException(
                PathSearchException.REASON_NODE_FAILURE,
                operation + " failed for " + node + target + ": " + cause.getMessage(),
                cause
        );
    }

    private static void requireNode(Object node, String role) {
        if (node == null) {
            throw new PathSearchException(PathSearchException.REASON_NULL_NODE, role + " node must be non-null");
        }
    }
}
