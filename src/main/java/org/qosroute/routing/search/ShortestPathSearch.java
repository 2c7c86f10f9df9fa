package org.qosroute.routing.search;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import org.qosroute.routing.graph.NetworkGraph;
import org.qosroute.routing.graph.Paths;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * Deterministic point-to-point searches over a {@link NetworkGraph}.
 * <p>
 * Every method returns the found path as node indices from source to target, or
 * {@link Paths#EMPTY} when the target is unreachable. Neighbors are expanded in CSR order and
 * only strictly better labels replace existing ones, so equal inputs always yield equal paths.
 */
public final class ShortestPathSearch {
    private static final int NO_PREDECESSOR = -1;
    private static final IntPredicate ALLOW_ALL = x -> true;

    private ShortestPathSearch() {
    }

    /**
     * Dijkstra with caller-supplied link weights.
     *
     * @param weights solver-local weight lookup, finite and non-negative.
     */
    public static int[] weighted(NetworkGraph graph, int source, int target, LinkWeightFunction weights) {
        Objects.requireNonNull(weights, "weights");
        checkEndpoints(graph, source, target);
        int n = graph.nodeCount();
        double[] distance = new double[n];
        int[] predecessor = new int[n];
        boolean[] settled = new boolean[n];
        Arrays.fill(distance, Double.POSITIVE_INFINITY);
        Arrays.fill(predecessor, NO_PREDECESSOR);

        NodeQueue queue = new NodeQueue(n);
        NetworkGraph.ArcIterator arcs = graph.arcs();
        distance[source] = 0.0d;
        queue.offer(source, 0.0d);

        while (!queue.isEmpty()) {
            int u = queue.extractMin();
            settled[u] = true;
            if (u == target) {
                return reconstruct(predecessor, source, target);
            }
            arcs.resetForNode(u);
            while (arcs.hasNext()) {
                int arc = arcs.next();
                int v = arcs.target(arc);
                if (settled[v]) {
                    continue;
                }
                double w = weights.weight(arcs.link(arc), u, v);
                if (!(w >= 0.0d) || Double.isInfinite(w)) {
                    throw new IllegalArgumentException("link weight must be finite and >= 0, got " + w);
                }
                double candidate = distance[u] + w;
                if (candidate < distance[v]) {
                    distance[v] = candidate;
                    predecessor[v] = u;
                    queue.offer(v, candidate);
                }
            }
        }
        return Paths.EMPTY;
    }

    /**
     * Breadth-first fewest-hop path.
     */
    public static int[] fewestHops(NetworkGraph graph, int source, int target) {
        return fewestHops(graph, source, target, ALLOW_ALL, ALLOW_ALL);
    }

    /**
     * Breadth-first fewest-hop path restricted to allowed links and nodes.
     * Source and target are always allowed.
     *
     * @param linkAllowed predicate over link ids.
     * @param nodeAllowed predicate over intermediate node indices.
     */
    public static int[] fewestHops(
            NetworkGraph graph,
            int source,
            int target,
            IntPredicate linkAllowed,
            IntPredicate nodeAllowed
    ) {
        checkEndpoints(graph, source, target);
        int[] predecessor = bfs(graph, source, target, linkAllowed, nodeAllowed);
        if (source != target && predecessor[target] == NO_PREDECESSOR) {
            return Paths.EMPTY;
        }
        return reconstruct(predecessor, source, target);
    }

    /**
     * Returns true when {@code target} can be reached from {@code source}.
     */
    public static boolean isReachable(NetworkGraph graph, int source, int target) {
        checkEndpoints(graph, source, target);
        if (source == target) {
            return true;
        }
        int[] predecessor = bfs(graph, source, target, ALLOW_ALL, ALLOW_ALL);
        return predecessor[target] != NO_PREDECESSOR;
    }

    private static int[] bfs(
            NetworkGraph graph,
            int source,
            int target,
            IntPredicate linkAllowed,
            IntPredicate nodeAllowed
    ) {
        int n = graph.nodeCount();
        int[] predecessor = new int[n];
        boolean[] visited = new boolean[n];
        Arrays.fill(predecessor, NO_PREDECESSOR);
        IntArrayFIFOQueue frontier = new IntArrayFIFOQueue();
        NetworkGraph.ArcIterator arcs = graph.arcs();
        visited[source] = true;
        frontier.enqueue(source);

        while (!frontier.isEmpty()) {
            int u = frontier.dequeueInt();
            if (u == target) {
                break;
            }
            arcs.resetForNode(u);
            while (arcs.hasNext()) {
                int arc = arcs.next();
                int v = arcs.target(arc);
                if (visited[v] || !linkAllowed.test(arcs.link(arc))) {
                    continue;
                }
                if (v != target && !nodeAllowed.test(v)) {
                    continue;
                }
                visited[v] = true;
                predecessor[v] = u;
                frontier.enqueue(v);
            }
        }
        return predecessor;
    }

    private static int[] reconstruct(int[] predecessor, int source, int target) {
        int length = 1;
        for (int node = target; node != source; node = predecessor[node]) {
            length++;
        }
        int[] path = new int[length];
        int node = target;
        for (int i = length - 1; i >= 0; i--) {
            path[i] = node;
            node = i > 0 ? predecessor[node] : node;
        }
        return path;
    }

    private static void checkEndpoints(NetworkGraph graph, int source, int target) {
        Objects.requireNonNull(graph, "graph");
        if (source < 0 || source >= graph.nodeCount()) {
            throw new IndexOutOfBoundsException("source " + source + " out of bounds");
        }
        if (target < 0 || target >= graph.nodeCount()) {
            throw new IndexOutOfBoundsException("target " + target + " out of bounds");
        }
    }
}
