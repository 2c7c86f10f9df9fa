package org.qosroute.routing.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import org.qosroute.routing.graph.NetworkGraph;
import org.qosroute.routing.graph.Paths;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Randomized depth-first search producing simple source-to-target paths.
 * <p>
 * Neighbor order is shuffled per expansion with the caller's random source, so the walk is
 * reproducible for a seeded {@link Random}. The walk gives up after {@code expansionBudget}
 * node expansions, which bounds the cost on large graphs where the target is unreachable.
 */
public final class RandomWalkSearch {

    private RandomWalkSearch() {
    }

    /**
     * @param maxLength maximum number of nodes on the returned path (>= 2).
     * @param expansionBudget maximum number of node expansions (> 0).
     * @return simple path, or {@link Paths#EMPTY} when none is found within the bounds.
     */
    public static int[] walk(
            NetworkGraph graph,
            int source,
            int target,
            int maxLength,
            int expansionBudget,
            Random random
    ) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(random, "random");
        if (maxLength < 2) {
            throw new IllegalArgumentException("maxLength must be >= 2");
        }
        if (expansionBudget <= 0) {
            throw new IllegalArgumentException("expansionBudget must be > 0");
        }
        if (source == target) {
            return new int[]{source};
        }

        boolean[] onPath = new boolean[graph.nodeCount()];
        IntArrayList path = new IntArrayList();
        List<int[]> neighborStack = new ArrayList<>();
        IntArrayList cursorStack = new IntArrayList();

        path.add(source);
        onPath[source] = true;
        neighborStack.add(shuffledNeighbors(graph, source, random));
        cursorStack.add(0);
        int expansions = 1;

        while (!path.isEmpty()) {
            int top = path.size() - 1;
            int[] neighbors = neighborStack.get(top);
            int cursor = cursorStack.getInt(top);
            if (cursor >= neighbors.length) {
                onPath[path.removeInt(top)] = false;
                neighborStack.remove(top);
                cursorStack.removeInt(top);
                continue;
            }
            cursorStack.set(top, cursor + 1);
            int next = neighbors[cursor];
            if (onPath[next]) {
                continue;
            }
            if (next == target) {
                path.add(target);
                return path.toIntArray();
            }
            if (path.size() + 1 >= maxLength) {
                continue;
            }
            if (expansions >= expansionBudget) {
                return Paths.EMPTY;
            }
            expansions++;
            path.add(next);
            onPath[next] = true;
            neighborStack.add(shuffledNeighbors(graph, next, random));
            cursorStack.add(0);
        }
        return Paths.EMPTY;
    }

    private static int[] shuffledNeighbors(NetworkGraph graph, int node, Random random) {
        int[] neighbors = graph.neighbors(node);
        IntArrays.shuffle(neighbors, random);
        return neighbors;
    }
}
