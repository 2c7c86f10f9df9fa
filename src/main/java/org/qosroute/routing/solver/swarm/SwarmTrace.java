package org.qosroute.routing.solver.swarm;

import it.unimi.dsi.fastutil.doubles.DoubleList;
import org.qosroute.routing.solver.SolverTrace;

/**
 * Particle-swarm diagnostics.
 *
 * @param bestFitnessHistory global-best fitness after each iteration.
 * @param iterations iterations executed.
 * @param pathsExtracted particle evaluations that produced a path.
 * @param cancelled whether the run stopped on cancellation.
 */
public record SwarmTrace(
        DoubleList bestFitnessHistory,
        int iterations,
        int pathsExtracted,
        boolean cancelled
) implements SolverTrace {
}
