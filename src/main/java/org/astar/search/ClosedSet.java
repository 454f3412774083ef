package org.astar.search;

import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import org.astar.graph.GraphNode;

/**
 * Set of nodes a search has already expanded.
 * <p>
 * Once closed, a node is never queued, relaxed or expanded again by the same search.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> This class is NOT thread-safe. It is intended
 * for use within a single search.
 * </p>
 *
 * @param <N> node type.
 */
public class ClosedSet<N extends GraphNode<N>> {

    private final ObjectOpenHashSet<N> closed;

    public ClosedSet() {
        this.closed = new ObjectOpenHashSet<>();
    }

    /**
     * Marks a node as closed if it hasn't been closed already.
     *
     * @param node the node being expanded.
     * @return {@code true} if the node was newly closed, {@code false} if it was already closed.
     */
    public boolean markClosed(N node) {
        return closed.add(node);
    }

    public boolean isClosed(N node) {
        return closed.contains(node);
    }

    public int size() {
        return closed.size();
    }
}
