package org.qosroute.routing.cost;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.qosroute.routing.graph.NetworkGraph;

import java.util.Objects;

/**
 * Scalar QoS cost of a path.
 * <p>
 * Contract:
 * <ul>
 * <li>Link delay, {@code -ln(max(r, EPSILON))} and {@code 1000 / max(bw, EPSILON)} are summed over links.</li>
 * <li>Processing delay is summed over interior nodes only.</li>
 * <li>Node reliability cost is summed over all nodes, endpoints included.</li>
 * <li>{@code fitness = wD * delay + wR * reliabilityCost * K + wRes * resourceCost}.</li>
 * </ul>
 * Paths shorter than two nodes, with an unlinked consecutive pair, or with a repeated node are
 * infeasible. Stateless apart from its bound weights; safe to share.
 */
@Getter
@Accessors(fluent = true)
public final class CostModel {
    public static final double EPSILON = 1e-6d;
    public static final double RESOURCE_NUMERATOR = 1000.0d;

    private final QosWeights weights;
    private final double reliabilityScale;

    /**
     * @param weights weight triple, normalized on entry.
     * @param reliabilityScale multiplier {@code K} applied to the reliability cost term (finite, > 0).
     */
    public CostModel(QosWeights weights, double reliabilityScale) {
        this.weights = Objects.requireNonNull(weights, "weights").normalize();
        if (!Double.isFinite(reliabilityScale) || reliabilityScale <= 0.0d) {
            throw new IllegalArgumentException("reliabilityScale must be finite and > 0");
        }
        this.reliabilityScale = reliabilityScale;
    }

    /**
     * Computes the full metric breakdown of {@code path}.
     *
     * @return breakdown, or {@link CostBreakdown#INFEASIBLE}.
     */
    public CostBreakdown evaluate(NetworkGraph graph, int[] path) {
        if (!isCandidate(graph, path)) {
            return CostBreakdown.INFEASIBLE;
        }
        double delay = 0.0d;
        double reliabilityCost = 0.0d;
        double resourceCost = 0.0d;
        double bottleneck = Double.POSITIVE_INFINITY;

        for (int i = 0; i + 1 < path.length; i++) {
            int link = graph.findLink(path[i], path[i + 1]);
            if (link == NetworkGraph.NO_LINK) {
                return CostBreakdown.INFEASIBLE;
            }
            double bandwidth = graph.bandwidth(link);
            delay += graph.linkDelay(link);
            reliabilityCost += reliabilityTerm(graph.linkReliability(link));
            resourceCost += resourceTerm(bandwidth);
            bottleneck = Math.min(bottleneck, bandwidth);
        }
        for (int i = 1; i + 1 < path.length; i++) {
            delay += graph.procDelay(path[i]);
        }
        for (int node : path) {
            reliabilityCost += reliabilityTerm(graph.nodeReliability(node));
        }

        double fitness = combine(delay, reliabilityCost, resourceCost);
        return new CostBreakdown(
                delay,
                reliabilityCost,
                resourceCost,
                fitness,
                Math.exp(-reliabilityCost) * 100.0d,
                bottleneck,
                path.length - 1
        );
    }

    /**
     * Fitness only; same value as {@code evaluate(graph, path).fitness()}.
     *
     * @return fitness, or {@code +INF} when the path is infeasible.
     */
    public double fitness(NetworkGraph graph, int[] path) {
        return evaluate(graph, path).fitness();
    }

    /**
     * Applies the bound weights to precomputed metric sums.
     */
    public double combine(double delay, double reliabilityCost, double resourceCost) {
        return weights.delay() * delay
                + weights.reliability() * reliabilityCost * reliabilityScale
                + weights.resource() * resourceCost;
    }

    public static double reliabilityTerm(double reliability) {
        return -Math.log(Math.max(reliability, EPSILON));
    }

    public static double resourceTerm(double bandwidth) {
        return RESOURCE_NUMERATOR / Math.max(bandwidth, EPSILON);
    }

    private static boolean isCandidate(NetworkGraph graph, int[] path) {
        if (graph == null || path == null || path.length < 2) {
            return false;
        }
        IntOpenHashSet seen = new IntOpenHashSet(path.length);
        for (int node : path) {
            if (node < 0 || node >= graph.nodeCount() || !seen.add(node)) {
                return false;
            }
        }
        return true;
    }
}
