package org.astar.graph;

import org.astar.core.AStarPathFinder;

import java.util.List;
import java.util.Set;

/**
 * Read-only capability contract a caller's node type must satisfy to be searched.
 *
 * <p>Node identity is {@link Object#equals(Object)} / {@link Object#hashCode()}; implementations
 * must keep both stable for the duration of a search. The engine never edits connectivity.</p>
 *
 * <p>Optimality of returned paths holds only when {@link #cost(GraphNode)} is non-negative and
 * {@link #estimatedCost(GraphNode)} never overestimates the true remaining cost. Admissibility is
 * not verified.</p>
 *
 * @param <N> the implementing node type.
 */
public interface GraphNode<N extends GraphNode<N>> {

    /**
     * @return nodes this node has an edge leading to (unordered, no duplicates).
     */
    Set<N> connectedNodes();

    /**
     * Returns the actual cost of the edge from this node to {@code node}.
     *
     * @param node edge end point, one of {@link #connectedNodes()}.
     * @return finite, non-negative edge cost.
     */
    double cost(N node);

    /**
     * Returns the heuristic estimate of the remaining cost from this node to {@code node}.
     *
     * @param node goal node.
     * @return finite, non-negative estimate.
     */
    double estimatedCost(N node);

    /**
     * Finds the cheapest path from this node to {@code goalNode}.
     *
     * @param goalNode goal of the search.
     * @return nodes in start-to-goal order, {@code [this]} when this node is the goal,
     * or an empty list when the goal is unreachable.
     */
    default List<N> findPathTo(N goalNode) {
        return AStarPathFinder.<N>defaults().findPath(self(), goalNode);
    }

    /**
     * As {@link #findPathTo(GraphNode)}, except this node is the goal and {@code startNode} the start.
     *
     * @param startNode start of the search.
     * @return nodes in start-to-goal order.
     */
    default List<N> findPathFrom(N startNode) {
        return AStarPathFinder.<N>defaults().findPath(startNode, self());
    }

    // Sound as long as implementations bind N to their own type.
    @SuppressWarnings("unchecked")
    private N self() {
        return (N) this;
    }
}
