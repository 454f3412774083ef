package org.astar.search;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.astar.graph.GraphNode;

import java.util.Objects;

/**
 * Open list of an A* search: a min-priority queue of {@link Step}s keyed by node.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>One Step per Node:</strong> a node -> heap-index table is kept in sync with the heap,
 * so membership is answered by node identity, never by cost position.</li>
 * <li><strong>Decrease-Key:</strong> offering a cheaper step for a queued node relaxes the queued
 * step in place and restores heap order in O(log n).</li>
 * <li><strong>Deterministic Ties:</strong> equal f-costs are polled in step creation order.</li>
 * </ul>
 * </p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. It is owned by one search.</p>
 *
 * @param <N> node type.
 */
public class StepFrontier<N extends GraphNode<N>> {

    /**
     * Outcome of {@link #offer(Step)}.
     */
    public enum Offer {
        /** No step for the node was queued; the candidate was added. */
        INSERTED,
        /** A queued step was re-routed through the cheaper candidate. */
        RELAXED,
        /** A queued step was at least as cheap; the candidate was dropped. */
        DISCARDED
    }

    // Binary heap, 1-based (slot 0 unused) for parent/child math.
    private final ObjectArrayList<Step<N>> heap;

    // positions[node] = heap index; 0 means not queued.
    private final Object2IntOpenHashMap<N> positions;

    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    @Getter
    private int peakSize = 0;

    public StepFrontier() {
        this.heap = new ObjectArrayList<>();
        this.heap.add(null);
        this.positions = new Object2IntOpenHashMap<>();
        this.positions.defaultReturnValue(0);
    }

    /**
     * Queues a candidate step or relaxes the queued step for the same node.
     * <p>
     * <strong>Behavior:</strong>
     * <ul>
     * <li>Node not queued: the candidate is added.</li>
     * <li>Node queued with a higher g-cost: the queued step takes the candidate's predecessor and
     * g-cost, then moves up the heap. The candidate itself is not stored.</li>
     * <li>Otherwise: the candidate is discarded.</li>
     * </ul>
     * </p>
     *
     * @param candidate step to offer.
     * @return what happened to the candidate.
     */
    public Offer offer(Step<N> candidate) {
        Objects.requireNonNull(candidate, "candidate");

        int existingIdx = positions.getInt(candidate.node());
        if (existingIdx > 0) {
            Step<N> existing = heap.get(existingIdx);
            if (candidate.stepCost() < existing.stepCost()) {
                existing.relaxTo(candidate);
                swim(existingIdx);
                return Offer.RELAXED;
            }
            return Offer.DISCARDED;
        }

        heap.add(candidate);
        size++;
        positions.put(candidate.node(), size);
        if (size > peakSize) {
            peakSize = size;
        }
        swim(size);
        return Offer.INSERTED;
    }

    /**
     * Removes and returns the step with the lowest f-cost.
     *
     * @return the minimum step.
     * @throws EmptyFrontierException if the frontier is empty.
     */
    public Step<N> poll() {
        if (isEmpty()) {
            throw new EmptyFrontierException("Frontier is empty");
        }

        Step<N> min = heap.get(1);
        Step<N> last = heap.remove(size);
        size--;
        positions.removeInt(min.node());

        if (size > 0) {
            heap.set(1, last);
            positions.put(last.node(), 1);
            sink(1);
        }
        return min;
    }

    /**
     * @return the queued step for {@code node}, or {@code null} if none is queued.
     */
    public Step<N> get(N node) {
        int idx = positions.getInt(node);
        return idx > 0 ? heap.get(idx) : null;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    // --- Heap Helper Methods ---

    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && greater(j, j + 1)) j++;
            if (!greater(k, j)) break;
            swap(k, j);
            k = j;
        }
    }

    private boolean greater(int i, int j) {
        return heap.get(i).compareTo(heap.get(j)) > 0;
    }

    private void swap(int i, int j) {
        Step<N> s1 = heap.get(i);
        Step<N> s2 = heap.get(j);

        heap.set(i, s2);
        heap.set(j, s1);

        positions.put(s1.node(), j);
        positions.put(s2.node(), i);
    }
}
