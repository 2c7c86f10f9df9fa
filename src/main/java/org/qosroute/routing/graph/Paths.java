package org.qosroute.routing.graph;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

import java.util.Arrays;

/**
 * Static helpers over node-index paths ({@code int[]}, source first).
 */
public final class Paths {
    public static final int[] EMPTY = new int[0];

    private Paths() {
    }

    /**
     * Returns true when no node occurs twice.
     */
    public static boolean isSimple(int[] path) {
        if (path == null) {
            return false;
        }
        IntOpenHashSet seen = new IntOpenHashSet(path.length);
        for (int node : path) {
            if (!seen.add(node)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns true when the path has at least two nodes, consecutive nodes are linked in
     * {@code graph}, and no node repeats.
     */
    public static boolean isValid(NetworkGraph graph, int[] path) {
        if (path == null || path.length < 2) {
            return false;
        }
        for (int i = 0; i + 1 < path.length; i++) {
            int u = path[i];
            int v = path[i + 1];
            if (u < 0 || u >= graph.nodeCount() || v < 0 || v >= graph.nodeCount()) {
                return false;
            }
            if (!graph.hasLink(u, v)) {
                return false;
            }
        }
        return isSimple(path);
    }

    /**
     * Removes cycles by cutting back to the first occurrence of any revisited node.
     * The endpoints stay in place and the result is simple.
     */
    public static int[] eraseLoops(int[] path) {
        if (path == null || path.length == 0) {
            return EMPTY;
        }
        Int2IntOpenHashMap positionOf = new Int2IntOpenHashMap(path.length);
        positionOf.defaultReturnValue(-1);
        IntArrayList out = new IntArrayList(path.length);
        for (int node : path) {
            int seenAt = positionOf.get(node);
            if (seenAt >= 0) {
                for (int i = out.size() - 1; i > seenAt; i--) {
                    positionOf.remove(out.getInt(i));
                }
                out.size(seenAt + 1);
                continue;
            }
            positionOf.put(node, out.size());
            out.add(node);
        }
        return out.toIntArray();
    }

    /**
     * Joins {@code head} and {@code tail}, dropping the first node of {@code tail} when it equals
     * the last node of {@code head}.
     */
    public static int[] concat(int[] head, int[] tail) {
        if (head.length > 0 && tail.length > 0 && head[head.length - 1] == tail[0]) {
            int[] out = Arrays.copyOf(head, head.length + tail.length - 1);
            System.arraycopy(tail, 1, out, head.length, tail.length - 1);
            return out;
        }
        int[] out = Arrays.copyOf(head, head.length + tail.length);
        System.arraycopy(tail, 0, out, head.length, tail.length);
        return out;
    }

    /**
     * Stable hashable key for a path, used by tabu memory and duplicate detection.
     */
    public static String signature(int[] path) {
        return Arrays.toString(path);
    }
}
