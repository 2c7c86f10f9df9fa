package org.qosroute.routing.solver;

/**
 * Common surface of the per-solver parameter records.
 */
public interface SolverParameters {

    /**
     * Seed for the solver-owned random source; null draws a fresh seed per call.
     * Deterministic solvers keep the default.
     */
    default Long getSeed() {
        return null;
    }
}
