package org.qosroute.routing.solver.annealing;

import it.unimi.dsi.fastutil.doubles.DoubleList;
import org.qosroute.routing.solver.SolverTrace;

import java.util.Map;

/**
 * Simulated-annealing diagnostics.
 *
 * @param bestFitnessHistory best cost after each cooling step.
 * @param acceptanceRateHistory accepted proposals per Markov block, as a fraction.
 * @param strategyUsage proposals per neighbor strategy.
 * @param iterations cooling steps executed.
 * @param proposals total proposals evaluated.
 * @param restarts reheats performed.
 * @param acceptanceRate accepted proposals over all proposals.
 * @param cancelled whether the run stopped on cancellation.
 */
public record AnnealingTrace(
        DoubleList bestFitnessHistory,
        DoubleList acceptanceRateHistory,
        Map<NeighborStrategy, Integer> strategyUsage,
        int iterations,
        int proposals,
        int restarts,
        double acceptanceRate,
        boolean cancelled
) implements SolverTrace {

    public int coolingSteps() {
        return iterations;
    }
}
