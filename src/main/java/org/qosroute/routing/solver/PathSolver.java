package org.qosroute.routing.solver;

import java.util.Random;

/**
 * Strategy contract shared by every search algorithm.
 * <p>
 * Implementations never throw for search outcomes: infeasible demands, exhausted budgets and
 * cancellation are reported through {@link SolverResult#failure}. Every successful path is
 * simple, starts at the source, ends at the target and only uses links of the filtered graph.
 */
public interface PathSolver {

    /**
     * Runs one search.
     *
     * @param problem query, graphs and weights.
     * @param cancellation cooperative stop flag.
     * @return tagged result, never null.
     */
    SolverResult solve(SearchProblem problem, SearchCancellation cancellation);

    /**
     * Runs one search that cannot be cancelled.
     */
    default SolverResult solve(SearchProblem problem) {
        return solve(problem, SearchCancellation.never());
    }

    /**
     * Creates the solver-owned random source for one call.
     */
    static Random randomFor(SolverParameters params) {
        Long seed = params.getSeed();
        return seed == null ? new Random() : new Random(seed);
    }
}
