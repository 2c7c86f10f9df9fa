package org.qosroute.routing.solver.baseline;

import it.unimi.dsi.fastutil.doubles.DoubleList;
import org.qosroute.routing.solver.SolverTrace;

/**
 * Baseline diagnostics; the search is a single pass.
 *
 * @param bestFitnessHistory single entry holding the path fitness.
 * @param iterations always 1 for a completed search.
 * @param staticPathCost sum of static link costs along the path.
 * @param cancelled always false; the baseline is not interruptible.
 */
public record BaselineTrace(
        DoubleList bestFitnessHistory,
        int iterations,
        double staticPathCost,
        boolean cancelled
) implements SolverTrace {
}
