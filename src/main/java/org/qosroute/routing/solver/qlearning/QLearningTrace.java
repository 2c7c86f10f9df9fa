package org.qosroute.routing.solver.qlearning;

import it.unimi.dsi.fastutil.doubles.DoubleList;
import org.qosroute.routing.solver.SolverTrace;

/**
 * Q-learning diagnostics.
 *
 * @param bestFitnessHistory fitness of the best eligible path after each episode.
 * @param bestRewardHistory highest eligible terminal reward after each episode.
 * @param iterations episodes run.
 * @param successfulEpisodes episodes that reached the target.
 * @param tableSize Q-table entries after training.
 * @param cancelled whether training stopped on cancellation.
 */
public record QLearningTrace(
        DoubleList bestFitnessHistory,
        DoubleList bestRewardHistory,
        int iterations,
        int successfulEpisodes,
        int tableSize,
        boolean cancelled
) implements SolverTrace {
}
