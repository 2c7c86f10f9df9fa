package org.qosroute.routing.solver;

/**
 * Typed reason for a search that produced no path.
 */
public enum FailureReason {
    /** No path exists once links below the bandwidth demand are removed. */
    INFEASIBLE_DEMAND,
    /** The search ran its budget without producing a path to the target. */
    NO_PATH_FOUND,
    /** Source or target unknown, degenerate weights, or malformed parameters. */
    INVALID_INPUT,
    /** The caller cancelled the search before any path was found. */
    CANCELLED,
    /** The solver raised an unexpected exception. */
    SOLVER_ERROR
}
