package org.qosroute.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.qosroute.routing.solver.FailureReason;
import org.qosroute.routing.solver.SolverTrace;

import java.util.List;

/**
 * Client-facing result of one dispatched search.
 *
 * <p>When {@code success=false}, {@code path} is empty, metrics are {@code +INF} or zero and
 * {@code failureReason} tells why.</p>
 */
@Value
@Builder
public class RouteResult {
    /** Whether a path was found. */
    boolean success;
    /** Strategy that produced the result, null when the name could not be resolved. */
    RoutingAlgorithm algorithm;
    /** Path expressed in external node ids from source to target. */
    @Singular("pathNode")
    List<Integer> path;
    /** Link delay plus interior processing delay (ms). */
    double totalDelay;
    /** End-to-end reliability in percent. */
    double finalReliabilityPercent;
    /** Sum of {@code 1000 / bandwidth} over path links. */
    double resourceCost;
    /** Sum of {@code -ln(reliability)} over path links and nodes. */
    double reliabilityCost;
    /** Weighted fitness at reporting scale, comparable across algorithms. */
    double fitness;
    /** Number of links on the path. */
    int hopCount;
    /** Smallest link bandwidth on the path (Mbps). */
    double bottleneckBandwidth;
    /** Failure category, null on success. */
    FailureReason failureReason;
    /** Reason-coded failure message, null on success. */
    String failureDetail;
    /** Solver diagnostics. */
    SolverTrace trace;
    /** Wall-clock time spent in the dispatcher. */
    long elapsedNanos;

    /**
     * Creates a canonical failure result.
     */
    static RouteResult failure(
            RoutingAlgorithm algorithm,
            FailureReason reason,
            String detail,
            SolverTrace trace,
            long elapsedNanos
    ) {
        return RouteResult.builder()
                .success(false)
                .algorithm(algorithm)
                .totalDelay(Double.POSITIVE_INFINITY)
                .finalReliabilityPercent(0.0d)
                .resourceCost(Double.POSITIVE_INFINITY)
                .reliabilityCost(Double.POSITIVE_INFINITY)
                .fitness(Double.POSITIVE_INFINITY)
                .failureReason(reason)
                .failureDetail(detail)
                .trace(trace == null ? SolverTrace.empty() : trace)
                .elapsedNanos(elapsedNanos)
                .build();
    }
}
