package org.qosroute.routing.solver;

import org.qosroute.routing.cost.QosWeights;
import org.qosroute.routing.cost.StaticLinkCost;
import org.qosroute.routing.graph.BandwidthFilter;
import org.qosroute.routing.graph.NetworkGraph;

import java.util.Objects;

/**
 * One constrained path query in internal index space.
 *
 * @param graph full network graph.
 * @param filteredGraph {@code graph} restricted to links meeting {@code bandwidthDemand}.
 * @param source internal source index.
 * @param target internal target index.
 * @param bandwidthDemand minimum bandwidth in Mbps.
 * @param weights normalized weight triple.
 * @param staticLinkCost per-link scalar cost over {@code graph} link ids.
 */
public record SearchProblem(
        NetworkGraph graph,
        NetworkGraph filteredGraph,
        int source,
        int target,
        double bandwidthDemand,
        QosWeights weights,
        StaticLinkCost staticLinkCost
) {
    public SearchProblem {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(filteredGraph, "filteredGraph");
        Objects.requireNonNull(weights, "weights");
        Objects.requireNonNull(staticLinkCost, "staticLinkCost");
        if (filteredGraph.nodeCount() != graph.nodeCount()) {
            throw new IllegalArgumentException("filtered graph must keep every node");
        }
        if (source < 0 || source >= graph.nodeCount()) {
            throw new IndexOutOfBoundsException("source " + source + " out of bounds");
        }
        if (target < 0 || target >= graph.nodeCount()) {
            throw new IndexOutOfBoundsException("target " + target + " out of bounds");
        }
        if (source == target) {
            throw new IllegalArgumentException("source and target must differ");
        }
        if (!weights.isNormalized()) {
            throw new IllegalArgumentException("weights must be normalized: " + weights);
        }
    }

    /**
     * Builds a problem: normalizes weights, filters by bandwidth and precomputes static link costs.
     */
    public static SearchProblem of(
            NetworkGraph graph,
            int source,
            int target,
            double bandwidthDemand,
            QosWeights weights
    ) {
        QosWeights normalized = weights.normalize();
        return new SearchProblem(
                graph,
                BandwidthFilter.filter(graph, bandwidthDemand),
                source,
                target,
                bandwidthDemand,
                normalized,
                StaticLinkCost.compute(graph, normalized, StaticLinkCost.DEFAULT_RELIABILITY_SCALE)
        );
    }
}
