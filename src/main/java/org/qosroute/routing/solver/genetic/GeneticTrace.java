package org.qosroute.routing.solver.genetic;

import it.unimi.dsi.fastutil.doubles.DoubleList;
import org.qosroute.routing.solver.SolverTrace;

/**
 * Genetic search diagnostics.
 *
 * @param bestFitnessHistory best fitness seen up to each generation.
 * @param generationBestHistory best fitness within each generation's population.
 * @param iterations generations executed.
 * @param initialPopulationSize distinct individuals produced by seeding.
 * @param cancelled whether the run stopped on cancellation.
 */
public record GeneticTrace(
        DoubleList bestFitnessHistory,
        DoubleList generationBestHistory,
        int iterations,
        int initialPopulationSize,
        boolean cancelled
) implements SolverTrace {
}
