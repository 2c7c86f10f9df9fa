package org.qosroute.routing.cost;

import org.qosroute.routing.graph.NetworkGraph;

import java.util.Objects;

/**
 * Precomputed scalar cost per link for plain shortest-path baselines.
 * <p>
 * {@code cost = wD * delay + wR * (-ln r) * scale + wRes * 1000 / bw}. The array is indexed by the
 * link ids of the graph it was computed for.
 */
public final class StaticLinkCost {
    public static final double DEFAULT_RELIABILITY_SCALE = 100.0d;

    private final double[] costs;

    private StaticLinkCost(double[] costs) {
        this.costs = costs;
    }

    /**
     * Computes one cost per link of {@code graph}.
     *
     * @param graph graph whose link ids index the result.
     * @param weights normalized weight triple.
     * @param reliabilityScale multiplier for the reliability term.
     */
    public static StaticLinkCost compute(NetworkGraph graph, QosWeights weights, double reliabilityScale) {
        Objects.requireNonNull(graph, "graph");
        QosWeights normalized = Objects.requireNonNull(weights, "weights").normalize();
        double[] costs = new double[graph.linkCount()];
        for (int link = 0; link < costs.length; link++) {
            costs[link] = normalized.delay() * graph.linkDelay(link)
                    + normalized.reliability() * CostModel.reliabilityTerm(graph.linkReliability(link)) * reliabilityScale
                    + normalized.resource() * CostModel.resourceTerm(graph.bandwidth(link));
        }
        return new StaticLinkCost(costs);
    }

    public double cost(int link) {
        return costs[link];
    }

    public int size() {
        return costs.length;
    }
}
