package org.qosroute.routing.solver.annealing;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import lombok.extern.slf4j.Slf4j;
import org.qosroute.routing.cost.CostModel;
import org.qosroute.routing.graph.NetworkGraph;
import org.qosroute.routing.graph.Paths;
import org.qosroute.routing.search.ShortestPathSearch;
import org.qosroute.routing.solver.FailureReason;
import org.qosroute.routing.solver.PathSolver;
import org.qosroute.routing.solver.SearchCancellation;
import org.qosroute.routing.solver.SearchProblem;
import org.qosroute.routing.solver.SolverResult;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Objects;
import java.util.Random;

/**
 * Simulated annealing over simple paths of the bandwidth-filtered graph.
 * <p>
 * Starts from the fewest-hop path and cools geometrically, switching from
 * {@code phaseOneAlpha} to {@code phaseTwoAlpha} after {@code phaseThreshold} cooling steps.
 * Each temperature level runs {@code markovLength} Metropolis proposals. Accepted paths enter a
 * tabu memory that discourages, but does not forbid, revisiting them. When too many accepted
 * moves pass without improvement the search reheats and resumes from the best path.
 */
@Slf4j
public final class AnnealingSolver implements PathSolver {
    private final AnnealingParams params;

    public AnnealingSolver() {
        this(AnnealingParams.defaults());
    }

    public AnnealingSolver(AnnealingParams params) {
        this.params = Objects.requireNonNull(params, "params").validate();
    }

    /**
     * Metropolis criterion: improvements always pass, worse moves pass with
     * probability {@code exp(-delta / temperature)}.
     *
     * @param draw uniform sample in [0, 1).
     */
    static boolean accept(double delta, double temperature, double draw) {
        if (delta < 0.0d) {
            return true;
        }
        return draw < Math.exp(-delta / temperature);
    }

    @Override
    public SolverResult solve(SearchProblem problem, SearchCancellation cancellation) {
        NetworkGraph filtered = problem.filteredGraph();
        int[] initial = ShortestPathSearch.fewestHops(filtered, problem.source(), problem.target());
        if (initial.length < 2) {
            return SolverResult.failure(
                    FailureReason.INFEASIBLE_DEMAND,
                    "no path with bandwidth >= " + problem.bandwidthDemand()
            );
        }

        Random random = PathSolver.randomFor(params);
        CostModel costModel = new CostModel(problem.weights(), params.getReliabilityScale());
        Neighborhood neighborhood = new Neighborhood(filtered, costModel, random);

        int[] current = initial;
        double currentCost = costModel.fitness(filtered, current);
        int[] best = current;
        double bestCost = currentCost;

        double initialTemperature = params.getInitialTemperature();
        double temperature = initialTemperature;
        DoubleArrayList bestHistory = new DoubleArrayList();
        DoubleArrayList acceptanceHistory = new DoubleArrayList();
        EnumMap<NeighborStrategy, Integer> usage = new EnumMap<>(NeighborStrategy.class);
        int coolingStep = 0;
        int proposals = 0;
        int accepted = 0;
        int noImprove = 0;
        int restarts = 0;
        boolean cancelled = false;

        while (temperature > params.getFinalTemperature()) {
            if (cancellation.isCancelled()) {
                cancelled = true;
                break;
            }
            coolingStep++;
            double alpha = coolingStep <= params.getPhaseThreshold() ? params.getPhaseOneAlpha() : params.getPhaseTwoAlpha();
            int blockAccepts = 0;

            for (int i = 0; i < params.getMarkovLength(); i++) {
                proposals++;
                Candidate candidate = neighborhood.propose(current, currentCost, temperature / initialTemperature);
                usage.merge(candidate.strategy(), 1, Integer::sum);
                if (!accept(candidate.cost() - currentCost, temperature, random.nextDouble())) {
                    continue;
                }
                current = candidate.path();
                currentCost = candidate.cost();
                accepted++;
                blockAccepts++;
                neighborhood.tabu.remember(current);
                if (currentCost < bestCost) {
                    best = current;
                    bestCost = currentCost;
                    noImprove = 0;
                } else {
                    noImprove++;
                }
            }

            bestHistory.add(bestCost);
            acceptanceHistory.add((double) blockAccepts / params.getMarkovLength());

            if (params.isRestartEnabled() && noImprove > params.getMaxNoImprove() && restarts < params.getMaxRestarts()) {
                restarts++;
                temperature = initialTemperature * params.getReheatFraction();
                noImprove = 0;
                current = best;
                currentCost = bestCost;
                log.debug("SA restart {} at cooling step {}, best cost {}", restarts, coolingStep, bestCost);
            }
            temperature *= alpha;
        }

        AnnealingTrace trace = new AnnealingTrace(
                bestHistory,
                acceptanceHistory,
                Collections.unmodifiableMap(usage),
                coolingStep,
                proposals,
                restarts,
                proposals == 0 ? 0.0d : (double) accepted / proposals,
                cancelled
        );
        log.debug("SA finished after {} cooling steps ({} proposals), best cost {}", coolingStep, proposals, bestCost);
        return SolverResult.success(best, costModel.evaluate(filtered, best), trace);
    }

    /**
     * Proposed neighbor and its fitness.
     */
    record Candidate(int[] path, double cost, NeighborStrategy strategy) {
    }

    /**
     * Per-call neighbor generator.
     */
    private final class Neighborhood {
        private final NetworkGraph graph;
        private final CostModel costModel;
        private final Random random;
        private final TabuMemory tabu;

        private Neighborhood(NetworkGraph graph, CostModel costModel, Random random) {
            this.graph = graph;
            this.costModel = costModel;
            this.random = random;
            this.tabu = new TabuMemory(params.getTabuSize());
        }

        /**
         * Tries up to {@code neighborAttempts} moves of one strategy. A move counts when it yields a
         * feasible path that is not rejected by tabu memory; otherwise the current path is reused.
         */
        Candidate propose(int[] current, double currentCost, double temperatureRatio) {
            if (current.length < 3) {
                return new Candidate(current, currentCost, NeighborStrategy.NONE);
            }
            NeighborStrategy strategy = NeighborStrategy.forTemperatureRatio(temperatureRatio);
            if (random.nextDouble() < params.getStrategyDiversityProbability()) {
                strategy = NeighborStrategy.MOVES[random.nextInt(NeighborStrategy.MOVES.length)];
            }
            for (int attempt = 0; attempt < params.getNeighborAttempts(); attempt++) {
                int[] path = switch (strategy) {
                    case SWAP -> swap(current);
                    case TWO_OPT -> twoOpt(current);
                    case SEGMENT_REVERSAL -> reroute(current);
                    case NONE -> current;
                };
                if (path == null) {
                    continue;
                }
                if (tabu.contains(path) && random.nextDouble() < params.getTabuRejectionProbability()) {
                    continue;
                }
                double cost = costModel.fitness(graph, path);
                if (Double.isFinite(cost)) {
                    return new Candidate(path, cost, strategy);
                }
            }
            return new Candidate(current, currentCost, NeighborStrategy.NONE);
        }

        private int[] swap(int[] path) {
            if (path.length < 4) {
                return null;
            }
            int interior = path.length - 2;
            int i = 1 + random.nextInt(interior);
            int j = 1 + random.nextInt(interior - 1);
            if (j >= i) {
                j++;
            }
            int[] next = path.clone();
            next[i] = path[j];
            next[j] = path[i];
            return next;
        }

        private int[] twoOpt(int[] path) {
            if (path.length < 4) {
                return null;
            }
            int i = 1 + random.nextInt(path.length - 3);
            int j = i + 1 + random.nextInt(path.length - 2 - i);
            int[] next = path.clone();
            for (int a = i, b = j; a < b; a++, b--) {
                int tmp = next[a];
                next[a] = next[b];
                next[b] = tmp;
            }
            return next;
        }

        /**
         * Removes the links of {@code path[idx1..idx2]} and splices in the fewest-hop detour between
         * the segment endpoints that avoids the rest of the path. Falls back to a two-opt move.
         */
        private int[] reroute(int[] path) {
            int idx1 = random.nextInt(path.length - 1);
            int idx2 = idx1 + 1 + random.nextInt(path.length - 1 - idx1);
            IntOpenHashSet segmentLinks = new IntOpenHashSet();
            for (int k = idx1; k < idx2; k++) {
                int link = graph.findLink(path[k], path[k + 1]);
                if (link != NetworkGraph.NO_LINK) {
                    segmentLinks.add(link);
                }
            }
            IntOpenHashSet outside = new IntOpenHashSet();
            for (int k = 0; k < idx1; k++) {
                outside.add(path[k]);
            }
            for (int k = idx2 + 1; k < path.length; k++) {
                outside.add(path[k]);
            }
            int[] detour = ShortestPathSearch.fewestHops(
                    graph,
                    path[idx1],
                    path[idx2],
                    link -> !segmentLinks.contains(link),
                    node -> !outside.contains(node)
            );
            if (detour.length < 2) {
                return twoOpt(path);
            }
            int[] head = Arrays.copyOf(path, idx1);
            int[] tail = Arrays.copyOfRange(path, idx2 + 1, path.length);
            return Paths.concat(Paths.concat(head, detour), tail);
        }
    }
}
