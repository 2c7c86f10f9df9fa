package org.qosroute.routing.graph;

import java.util.Objects;

/**
 * Derives the feasible sub-network for one bandwidth demand.
 * <p>
 * The filtered graph keeps every node with the same internal index and external id, so paths
 * found on it are valid paths of the source graph as well.
 */
public final class BandwidthFilter {

    private BandwidthFilter() {
    }

    /**
     * Keeps only links whose bandwidth is at least {@code demand}.
     *
     * @param graph source graph, left untouched.
     * @param demand minimum bandwidth in Mbps (finite, >= 0).
     * @return filtered graph; the source instance itself when every link already qualifies.
     */
    public static NetworkGraph filter(NetworkGraph graph, double demand) {
        Objects.requireNonNull(graph, "graph");
        if (!Double.isFinite(demand) || demand < 0.0d) {
            throw new IllegalArgumentException("demand must be finite and >= 0, got " + demand);
        }
        boolean allQualify = true;
        for (int link = 0; link < graph.linkCount(); link++) {
            if (graph.bandwidth(link) < demand) {
                allQualify = false;
                break;
            }
        }
        if (allQualify) {
            return graph;
        }
        return graph.retainLinks(link -> graph.bandwidth(link) >= demand);
    }
}
