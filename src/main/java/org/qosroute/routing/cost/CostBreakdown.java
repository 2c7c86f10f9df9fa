package org.qosroute.routing.cost;

/**
 * Per-path QoS metrics produced by {@link CostModel#evaluate}.
 *
 * @param totalDelay sum of link delays plus processing delay of interior nodes (ms).
 * @param reliabilityCost sum of {@code -ln(reliability)} over every link and node of the path.
 * @param resourceCost sum of {@code 1000 / bandwidth} over path links.
 * @param fitness weighted scalar cost, lower is better.
 * @param finalReliabilityPercent end-to-end reliability in percent.
 * @param bottleneckBandwidth smallest link bandwidth on the path (Mbps).
 * @param hopCount number of links on the path.
 */
public record CostBreakdown(
        double totalDelay,
        double reliabilityCost,
        double resourceCost,
        double fitness,
        double finalReliabilityPercent,
        double bottleneckBandwidth,
        int hopCount
) {
    /**
     * Sentinel for paths that are not simple connected source-to-target paths.
     */
    public static final CostBreakdown INFEASIBLE = new CostBreakdown(
            Double.POSITIVE_INFINITY,
            Double.POSITIVE_INFINITY,
            Double.POSITIVE_INFINITY,
            Double.POSITIVE_INFINITY,
            0.0d,
            0.0d,
            0
    );

    public boolean isFeasible() {
        return Double.isFinite(fitness);
    }
}
