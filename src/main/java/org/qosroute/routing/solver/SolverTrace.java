package org.qosroute.routing.solver;

import it.unimi.dsi.fastutil.doubles.DoubleList;

/**
 * Diagnostic history a solver records while searching.
 */
public interface SolverTrace {

    /**
     * Best fitness seen so far, one entry per outer iteration (generation, swarm iteration,
     * cooling step or episode). Entries are {@code +INF} until a first path is found.
     */
    DoubleList bestFitnessHistory();

    /**
     * Number of outer iterations actually executed.
     */
    int iterations();

    /**
     * Returns true when the search stopped early on a cancellation request.
     */
    boolean cancelled();

    /**
     * Trace for searches that never started.
     */
    static SolverTrace empty() {
        return EmptyTrace.INSTANCE;
    }
}
