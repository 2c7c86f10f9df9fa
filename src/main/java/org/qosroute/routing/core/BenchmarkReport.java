package org.qosroute.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of running several algorithms over a list of demands.
 * <p>
 * Each scenario is won by the successful result with the highest balanced score: delay,
 * reliability and resource cost are min-max normalized across that scenario's successful
 * results and averaged, lower delay and cost scoring higher. Equal scores go to the algorithm
 * that comes first in enum order.
 */
@Value
@Builder
public class BenchmarkReport {
    /** Smoothing added to every min-max range so a single result or a tie stays finite. */
    private static final double RANGE_SMOOTHING = 0.001d;

    /** One entry per demand, in input order. */
    @Singular
    List<ScenarioOutcome> scenarios;
    /** Scenarios won per algorithm; algorithms that never won are absent. */
    Map<RoutingAlgorithm, Integer> wins;
    /** Mean dispatcher time per algorithm over every scenario it ran, successful or not. */
    Map<RoutingAlgorithm, Double> meanElapsedNanos;
    /** Fraction of scenarios in which at least one algorithm found a path. */
    double successRate;

    public int winsOf(RoutingAlgorithm algorithm) {
        return wins.getOrDefault(algorithm, 0);
    }

    /**
     * @return wins of {@code algorithm} divided by the number of scenarios, 0 when there are none.
     */
    public double winRate(RoutingAlgorithm algorithm) {
        return scenarios.isEmpty() ? 0.0d : (double) winsOf(algorithm) / scenarios.size();
    }

    /**
     * Algorithm with the most scenario wins; ties go to enum order.
     */
    public Optional<RoutingAlgorithm> overallWinner() {
        RoutingAlgorithm best = null;
        int bestWins = 0;
        for (Map.Entry<RoutingAlgorithm, Integer> entry : wins.entrySet()) {
            if (entry.getValue() > bestWins) {
                best = entry.getKey();
                bestWins = entry.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Results of one demand.
     */
    @Value
    @Builder
    public static class ScenarioOutcome {
        Demand demand;
        Map<RoutingAlgorithm, RouteResult> results;
        /** Balanced score of every successful result. */
        Map<RoutingAlgorithm, Double> balancedScores;
        /** Highest balanced score, null when no algorithm succeeded. */
        RoutingAlgorithm winner;

        public boolean hasSuccess() {
            return winner != null;
        }
    }

    /**
     * Scores every successful result in {@code results} against the others.
     *
     * @return score in [0, 1] per successful algorithm, in enum order.
     */
    static Map<RoutingAlgorithm, Double> balancedScores(Map<RoutingAlgorithm, RouteResult> results) {
        double minDelay = Double.POSITIVE_INFINITY;
        double maxDelay = Double.NEGATIVE_INFINITY;
        double minReliability = Double.POSITIVE_INFINITY;
        double maxReliability = Double.NEGATIVE_INFINITY;
        double minCost = Double.POSITIVE_INFINITY;
        double maxCost = Double.NEGATIVE_INFINITY;
        for (RouteResult result : results.values()) {
            if (!result.isSuccess()) {
                continue;
            }
            minDelay = Math.min(minDelay, result.getTotalDelay());
            maxDelay = Math.max(maxDelay, result.getTotalDelay());
            minReliability = Math.min(minReliability, result.getFinalReliabilityPercent());
            maxReliability = Math.max(maxReliability, result.getFinalReliabilityPercent());
            minCost = Math.min(minCost, result.getResourceCost());
            maxCost = Math.max(maxCost, result.getResourceCost());
        }

        Map<RoutingAlgorithm, Double> scores = new EnumMap<>(RoutingAlgorithm.class);
        for (Map.Entry<RoutingAlgorithm, RouteResult> entry : results.entrySet()) {
            RouteResult result = entry.getValue();
            if (!result.isSuccess()) {
                continue;
            }
            double delay = 1.0d - (result.getTotalDelay() - minDelay) / (maxDelay - minDelay + RANGE_SMOOTHING);
            double reliability = (result.getFinalReliabilityPercent() - minReliability)
                    / (maxReliability - minReliability + RANGE_SMOOTHING);
            double cost = 1.0d - (result.getResourceCost() - minCost) / (maxCost - minCost + RANGE_SMOOTHING);
            scores.put(entry.getKey(), (delay + reliability + cost) / 3.0d);
        }
        return Collections.unmodifiableMap(scores);
    }

    /**
     * @return the highest-scoring algorithm, first in enum order on ties, or null for no scores.
     */
    static RoutingAlgorithm winnerOf(Map<RoutingAlgorithm, Double> scores) {
        RoutingAlgorithm winner = null;
        double best = Double.NEGATIVE_INFINITY;
        for (Map.Entry<RoutingAlgorithm, Double> entry : scores.entrySet()) {
            if (entry.getValue() > best) {
                winner = entry.getKey();
                best = entry.getValue();
            }
        }
        return winner;
    }
}
