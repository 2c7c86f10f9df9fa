package org.qosroute.routing.solver.qlearning;

import it.unimi.dsi.fastutil.longs.Long2DoubleOpenHashMap;
import org.qosroute.routing.graph.NetworkGraph;

/**
 * Sparse action-value table keyed by {@code (state node, action node)}.
 * Missing entries read as zero. Not thread-safe.
 */
public final class QTable {
    private final Long2DoubleOpenHashMap values = new Long2DoubleOpenHashMap();

    public QTable() {
        values.defaultReturnValue(0.0d);
    }

    public double get(int state, int action) {
        return values.get(key(state, action));
    }

    public void set(int state, int action, double value) {
        values.put(key(state, action), value);
    }

    /**
     * Largest Q-value over every neighbor of {@code state}, or zero without neighbors.
     */
    public double maxOverNeighbors(NetworkGraph graph, int state) {
        return maxOverNeighbors(graph.arcs(), state);
    }

    /**
     * Same as {@link #maxOverNeighbors(NetworkGraph, int)} but walks {@code arcs}, which is reset
     * to {@code state} and left exhausted.
     */
    public double maxOverNeighbors(NetworkGraph.ArcIterator arcs, int state) {
        arcs.resetForNode(state);
        if (!arcs.hasNext()) {
            return 0.0d;
        }
        double max = Double.NEGATIVE_INFINITY;
        while (arcs.hasNext()) {
            max = Math.max(max, get(state, arcs.target(arcs.next())));
        }
        return max;
    }

    public int size() {
        return values.size();
    }

    public void clear() {
        values.clear();
    }

    private static long key(int state, int action) {
        return ((long) state << 32) | (action & 0xFFFFFFFFL);
    }
}
