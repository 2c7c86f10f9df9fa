package org.qosroute.routing.cost;

/**
 * Importance weights for the delay, reliability and resource terms of the QoS fitness.
 *
 * @param delay weight of end-to-end delay.
 * @param reliability weight of the reliability cost.
 * @param resource weight of the bandwidth usage term.
 */
public record QosWeights(double delay, double reliability, double resource) {
    private static final double SUM_TOLERANCE = 1e-9d;

    /**
     * Pure delay optimization, also the fallback for an all-zero triple.
     */
    public static final QosWeights DELAY_ONLY = new QosWeights(1.0d, 0.0d, 0.0d);

    public static QosWeights of(double delay, double reliability, double resource) {
        return new QosWeights(delay, reliability, resource);
    }

    /**
     * Returns true when all three weights are finite and non-negative.
     */
    public boolean isValid() {
        return isValidWeight(delay) && isValidWeight(reliability) && isValidWeight(resource);
    }

    public double sum() {
        return delay + reliability + resource;
    }

    /**
     * Returns true when the triple already sums to one.
     */
    public boolean isNormalized() {
        return isValid() && Math.abs(sum() - 1.0d) <= SUM_TOLERANCE;
    }

    /**
     * Scales the triple so it sums to one. A zero triple maps to {@link #DELAY_ONLY}.
     *
     * @throws IllegalArgumentException when any weight is negative or not finite.
     */
    public QosWeights normalize() {
        if (!isValid()) {
            throw new IllegalArgumentException("weights must be finite and >= 0: " + this);
        }
        double total = sum();
        if (total == 0.0d) {
            return DELAY_ONLY;
        }
        return new QosWeights(delay / total, reliability / total, resource / total);
    }

    private static boolean isValidWeight(double weight) {
        return Double.isFinite(weight) && weight >= 0.0d;
    }
}
