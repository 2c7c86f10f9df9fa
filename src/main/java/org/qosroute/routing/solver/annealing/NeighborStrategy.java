package org.qosroute.routing.solver.annealing;

/**
 * Move types used to derive a neighboring path.
 */
public enum NeighborStrategy {
    /** Exchange two interior nodes. */
    SWAP,
    /** Reverse a contiguous interior segment. */
    TWO_OPT,
    /** Re-route a sub-segment around its own links. */
    SEGMENT_REVERSAL,
    /** No valid neighbor within the attempt budget; the current path is reused. */
    NONE;

    static final NeighborStrategy[] MOVES = {SWAP, TWO_OPT, SEGMENT_REVERSAL};

    /**
     * Temperature-driven default: exploration moves while hot, re-routing while cold.
     *
     * @param temperatureRatio current temperature divided by the initial temperature.
     */
    static NeighborStrategy forTemperatureRatio(double temperatureRatio) {
        if (temperatureRatio > 0.6d) {
            return SWAP;
        }
        if (temperatureRatio > 0.3d) {
            return TWO_OPT;
        }
        return SEGMENT_REVERSAL;
    }
}
