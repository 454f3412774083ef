package org.astar.search;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.astar.graph.GraphNode;

import java.util.Objects;

/**
 * One node as reached by a candidate path during a search.
 * <p>
 * Steps form a backward-only tree through {@link #previous()}: every predecessor was created
 * earlier in the same search, so walking the chain always terminates. A step without a
 * predecessor is a first-layer step whose path starts at the (implicit) start node.
 * </p>
 * <p>
 * <strong>Ordering:</strong> ascending {@link #totalCost()}, then ascending creation
 * {@link #sequence()} so equal-cost steps leave the frontier in insertion order.
 * </p>
 *
 * @param <N> node type.
 */
@Getter
@Accessors(fluent = true)
public final class Step<N extends GraphNode<N>> implements Comparable<Step<N>> {

    private final N node;
    private Step<N> previous;

    /** Accumulated actual cost (g) from the start node. */
    private double stepCost;

    /** Heuristic estimate (h) to the goal, fixed at creation. */
    private final double goalCost;

    private final long sequence;

    private Step(N node, Step<N> previous, double stepCost, double goalCost, long sequence) {
        this.node = node;
        this.previous = previous;
        this.stepCost = stepCost;
        this.goalCost = goalCost;
        this.sequence = sequence;
    }

    /**
     * Creates a first-layer step for an edge leaving the start node.
     *
     * @param node     neighbor of the start node reached by this step.
     * @param edgeCost {@code start.cost(node)}.
     * @param goalCost heuristic estimate from {@code node} to the goal.
     * @param sequence creation order within the search.
     */
    public static <N extends GraphNode<N>> Step<N> first(N node, double edgeCost, double goalCost, long sequence) {
        Objects.requireNonNull(node, "node");
        return new Step<>(node, null, edgeCost, goalCost, sequence);
    }

    /**
     * Creates a step extending {@code previous} by one edge to {@code node}.
     *
     * @param previous step being expanded.
     * @param node     neighbor of {@code previous.node()}.
     * @param edgeCost {@code previous.node().cost(node)}.
     * @param goalCost heuristic estimate from {@code node} to the goal.
     * @param sequence creation order within the search.
     */
    public static <N extends GraphNode<N>> Step<N> extend(
            Step<N> previous,
            N node,
            double edgeCost,
            double goalCost,
            long sequence
    ) {
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(node, "node");
        return new Step<>(node, previous, previous.stepCost + edgeCost, goalCost, sequence);
    }

    /**
     * @return f-cost, {@code stepCost + goalCost}.
     */
    public double totalCost() {
        return stepCost + goalCost;
    }

    /**
     * Re-routes this step through {@code candidate}'s predecessor and takes over its g-cost.
     * <p>
     * Only the owning frontier calls this, and only with a strictly cheaper candidate for the
     * same node; the frontier restores heap order afterwards.
     * </p>
     */
    void relaxTo(Step<N> candidate) {
        this.previous = candidate.previous;
        this.stepCost = candidate.stepCost;
    }

    @Override
    public int compareTo(Step<N> other) {
        int costCompare = Double.compare(totalCost(), other.totalCost());
        if (costCompare != 0) {
            return costCompare;
        }
        return Long.compare(sequence, other.sequence);
    }

    @Override
    public String toString() {
        return "Step{" +
                "node=" + node +
                ", g=" + stepCost +
                ", h=" + goalCost +
                ", prev=" + (previous == null ? "start" : previous.node) +
                '}';
    }
}
