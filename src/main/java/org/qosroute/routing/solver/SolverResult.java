package org.qosroute.routing.solver;

import org.qosroute.routing.cost.CostBreakdown;
import org.qosroute.routing.graph.Paths;

import java.util.Objects;

/**
 * Uniform solver output: either a path with its breakdown, or a failure reason.
 *
 * @param path internal node path, empty on failure.
 * @param breakdown metrics of {@code path} under the solver's own cost model, or
 *                  {@link CostBreakdown#INFEASIBLE} on failure.
 * @param failureReason null on success.
 * @param failureDetail human-readable detail, null on success.
 * @param trace search diagnostics, never null.
 */
public record SolverResult(
        int[] path,
        CostBreakdown breakdown,
        FailureReason failureReason,
        String failureDetail,
        SolverTrace trace
) {
    public SolverResult {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(breakdown, "breakdown");
        Objects.requireNonNull(trace, "trace");
        if (failureReason == null && path.length < 2) {
            throw new IllegalArgumentException("successful result needs a path of at least two nodes");
        }
    }

    public static SolverResult success(int[] path, CostBreakdown breakdown, SolverTrace trace) {
        return new SolverResult(path, breakdown, null, null, trace);
    }

    public static SolverResult failure(FailureReason reason, String detail, SolverTrace trace) {
        return new SolverResult(
                Paths.EMPTY,
                CostBreakdown.INFEASIBLE,
                Objects.requireNonNull(reason, "reason"),
                detail,
                trace
        );
    }

    public static SolverResult failure(FailureReason reason, String detail) {
        return failure(reason, detail, SolverTrace.empty());
    }

    public boolean isSuccess() {
        return failureReason == null;
    }
}
