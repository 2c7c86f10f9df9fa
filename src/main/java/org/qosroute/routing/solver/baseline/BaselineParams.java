package org.qosroute.routing.solver.baseline;

import lombok.Builder;
import lombok.Value;
import org.qosroute.routing.cost.StaticLinkCost;
import org.qosroute.routing.solver.SolverParameters;
import org.qosroute.routing.solver.SolverProperties;

/**
 * Settings of {@link DijkstraBaselineSolver}.
 */
@Value
@Builder(toBuilder = true)
public class BaselineParams implements SolverParameters {
    static final String SOLVER = "baseline";

    /** Multiplier of the reliability term inside the static link cost. */
    double linkReliabilityScale;
    /** Multiplier of the reliability term in the reported fitness. */
    double reliabilityScale;

    public static BaselineParams defaults() {
        return BaselineParams.builder()
                .linkReliabilityScale(SolverProperties.readDouble(
                        SOLVER, "linkReliabilityScale", StaticLinkCost.DEFAULT_RELIABILITY_SCALE))
                .reliabilityScale(SolverProperties.readDouble(SOLVER, "reliabilityScale", 100.0d))
                .build();
    }

    public BaselineParams validate() {
        require(linkReliabilityScale > 0.0d && !Double.isInfinite(linkReliabilityScale),
                "linkReliabilityScale must be finite and > 0");
        require(reliabilityScale > 0.0d && !Double.isInfinite(reliabilityScale), "reliabilityScale must be finite and > 0");
        return this;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
