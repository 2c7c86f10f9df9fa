package org.qosroute.routing.solver.swarm;

import lombok.Builder;
import lombok.Value;
import org.qosroute.routing.solver.SolverParameters;
import org.qosroute.routing.solver.SolverProperties;

/**
 * Tuning knobs of {@link SwarmSolver}.
 */
@Value
@Builder(toBuilder = true)
public class SwarmParams implements SolverParameters {
    static final String SOLVER = "swarm";

    int swarmSize;
    int iterations;
    /** Inertia weight {@code w}. */
    double inertia;
    /** Cognitive coefficient {@code c1}, pull towards the personal best. */
    double cognitive;
    /** Social coefficient {@code c2}, pull towards the global best. */
    double social;
    double minPriority;
    double maxPriority;
    /** Half-width of the uniform initial velocity range. */
    double initialVelocity;
    double reliabilityScale;
    Long seed;

    public static SwarmParams defaults() {
        return SwarmParams.builder()
                .swarmSize(SolverProperties.readInt(SOLVER, "swarmSize", 30))
                .iterations(SolverProperties.readInt(SOLVER, "iterations", 25))
                .inertia(SolverProperties.readDouble(SOLVER, "inertia", 0.7d))
                .cognitive(SolverProperties.readDouble(SOLVER, "cognitive", 1.5d))
                .social(SolverProperties.readDouble(SOLVER, "social", 2.0d))
                .minPriority(SolverProperties.readDouble(SOLVER, "minPriority", 0.001d))
                .maxPriority(SolverProperties.readDouble(SOLVER, "maxPriority", 1.0d))
                .initialVelocity(SolverProperties.readDouble(SOLVER, "initialVelocity", 0.1d))
                .reliabilityScale(SolverProperties.readDouble(SOLVER, "reliabilityScale", 10.0d))
                .seed(SolverProperties.readSeed(SOLVER))
                .build();
    }

    /**
     * @throws IllegalArgumentException when a field is out of range.
     */
    public SwarmParams validate() {
        require(swarmSize > 0, "swarmSize must be > 0");
        require(iterations >= 0, "iterations must be >= 0");
        require(inertia >= 0.0d && cognitive >= 0.0d && social >= 0.0d, "inertia, cognitive and social must be >= 0");
        require(minPriority >= 0.0d && maxPriority > minPriority && !Double.isInfinite(maxPriority),
                "priority range must satisfy 0 <= min < max < INF");
        require(initialVelocity >= 0.0d && !Double.isInfinite(initialVelocity), "initialVelocity must be finite and >= 0");
        require(reliabilityScale > 0.0d && !Double.isInfinite(reliabilityScale), "reliabilityScale must be > 0");
        return this;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
