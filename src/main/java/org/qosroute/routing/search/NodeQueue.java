package org.qosroute.routing.search;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;

/**
 * Min-priority queue of node indices keyed by a double distance.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Decrease-Key Support:</strong> O(log n) key updates through a position tracking array.</li>
 * <li><strong>Deterministic ties:</strong> equal keys are ordered by node index.</li>
 * <li><strong>Primitive storage:</strong> no per-entry objects.</li>
 * </ul>
 * Not thread-safe.
 */
public class NodeQueue {

    // 1-based binary heap of node indices
    private final int[] heap;
    private final double[] keys;
    // positions[node] = heap index, 0 means absent
    private final int[] positions;

    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    /**
     * @param nodeCount number of addressable nodes; valid indices are {@code [0, nodeCount)}.
     */
    public NodeQueue(int nodeCount) {
        if (nodeCount < 0) {
            throw new IllegalArgumentException("nodeCount must be non-negative");
        }
        this.heap = new int[nodeCount + 1];
        this.keys = new double[nodeCount];
        this.positions = new int[nodeCount];
    }

    /**
     * Inserts {@code node} or lowers its key. A key that is not lower is ignored.
     *
     * @return true when the queue changed.
     */
    public boolean offer(int node, double key) {
        if (node < 0 || node >= positions.length) {
            throw new IllegalArgumentException("node " + node + " out of bounds (max: " + (positions.length - 1) + ")");
        }
        int existing = positions[node];
        if (existing > 0) {
            if (key < keys[node]) {
                keys[node] = key;
                swim(existing);
                return true;
            }
            return false;
        }
        size++;
        heap[size] = node;
        keys[node] = key;
        positions[node] = size;
        swim(size);
        return true;
    }

    public boolean contains(int node) {
        return positions[node] > 0;
    }

    public double peekKey() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        return keys[heap[1]];
    }

    /**
     * Removes and returns the node with the smallest key.
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public int extractMin() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        int min = heap[1];
        int last = heap[size];
        heap[1] = last;
        positions[last] = 1;
        positions[min] = 0;
        size--;
        if (size > 0) {
            sink(1);
        }
        return min;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public void clear() {
        for (int i = 1; i <= size; i++) {
            positions[heap[i]] = 0;
        }
        Arrays.fill(heap, 0);
        size = 0;
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
        int a = heap[i];
        int b = heap[j];
        int cmp = Double.compare(keys[a], keys[b]);
        return cmp > 0 || (cmp == 0 && a > b);
    }

    private void swap(int i, int j) {
        int a = heap[i];
        int b = heap[j];
        heap[i] = b;
        heap[j] = a;
        positions[a] = j;
        positions[b] = i;
    }
}
