package org.qosroute.routing.solver.qlearning;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.extern.slf4j.Slf4j;
import org.qosroute.routing.cost.CostModel;
import org.qosroute.routing.graph.NetworkGraph;
import org.qosroute.routing.search.ShortestPathSearch;
import org.qosroute.routing.solver.FailureReason;
import org.qosroute.routing.solver.PathSolver;
import org.qosroute.routing.solver.SearchCancellation;
import org.qosroute.routing.solver.SearchProblem;
import org.qosroute.routing.solver.SolverResult;

import java.util.Objects;
import java.util.Random;

/**
 * Tabular Q-learning route search.
 * <p>
 * Episodes walk the full graph from the source with an epsilon-greedy policy over unvisited
 * neighbors, so links below the bandwidth demand stay selectable and are learned away through
 * the terminal penalty. Only episodes that reach the target without such a link are eligible as
 * the returned path.
 * <p>
 * The table belongs to the solver instance. With {@code resetTableEachRun == false} a caller can
 * keep training across calls and clear explicitly through {@link #resetTable()}. Instances are
 * not thread-safe.
 */
@Slf4j
public final class QLearningSolver implements PathSolver {
    private final QLearningParams params;
    private final QTable table = new QTable();

    public QLearningSolver() {
        this(QLearningParams.defaults());
    }

    public QLearningSolver(QLearningParams params) {
        this.params = Objects.requireNonNull(params, "params").validate();
    }

    public void resetTable() {
        table.clear();
    }

    /**
     * Read view for diagnostics and tests.
     */
    public QTable table() {
        return table;
    }

    @Override
    public SolverResult solve(SearchProblem problem, SearchCancellation cancellation) {
        if (!ShortestPathSearch.isReachable(problem.filteredGraph(), problem.source(), problem.target())) {
            return SolverResult.failure(
                    FailureReason.INFEASIBLE_DEMAND,
                    "no path with bandwidth >= " + problem.bandwidthDemand()
            );
        }
        if (params.isResetTableEachRun()) {
            table.clear();
        }

        Random random = PathSolver.randomFor(params);
        CostModel costModel = new CostModel(problem.weights(), params.getReliabilityScale());
        Episode episode = new Episode(problem, costModel, random);

        int episodes = params.getEpisodes();
        double epsilonDecay = (params.getEpsilonStart() - params.getEpsilonEnd()) / episodes;
        DoubleArrayList fitnessHistory = new DoubleArrayList(episodes);
        DoubleArrayList rewardHistory = new DoubleArrayList(episodes);
        int[] bestPath = null;
        double bestReward = Double.NEGATIVE_INFINITY;
        double bestFitness = Double.POSITIVE_INFINITY;
        int successful = 0;
        int run = 0;
        boolean cancelled = false;

        for (; run < episodes; run++) {
            if (cancellation.isCancelled()) {
                cancelled = true;
                break;
            }
            double epsilon = Math.max(params.getEpsilonEnd(), params.getEpsilonStart() - run * epsilonDecay);
            episode.train(epsilon);
            if (episode.reachedTarget) {
                successful++;
                if (!episode.violatesBandwidth && episode.reward > bestReward) {
                    bestReward = episode.reward;
                    bestPath = episode.path.toIntArray();
                    bestFitness = costModel.fitness(problem.graph(), bestPath);
                }
            }
            fitnessHistory.add(bestFitness);
            rewardHistory.add(bestReward);
        }

        QLearningTrace trace = new QLearningTrace(
                fitnessHistory,
                rewardHistory,
                run,
                successful,
                table.size(),
                cancelled
        );
        log.debug("Q-learning ran {} episodes, {} reached the target, best reward {}", run, successful, bestReward);
        if (bestPath == null) {
            if (cancelled) {
                return SolverResult.failure(FailureReason.CANCELLED, "cancelled before an eligible episode", trace);
            }
            return SolverResult.failure(
                    FailureReason.NO_PATH_FOUND,
                    "no episode reached the target within bandwidth " + problem.bandwidthDemand(),
                    trace
            );
        }
        return SolverResult.success(bestPath, costModel.evaluate(problem.graph(), bestPath), trace);
    }

    /**
     * Reusable per-call episode state.
     */
    private final class Episode {
        private final NetworkGraph graph;
        private final int source;
        private final int target;
        private final double demand;
        private final CostModel costModel;
        private final Random random;
        private final boolean[] visited;
        private final IntArrayList unvisited = new IntArrayList();
        private final NetworkGraph.ArcIterator arcs;

        private final IntArrayList path = new IntArrayList();
        private boolean reachedTarget;
        private boolean violatesBandwidth;
        private double reward;

        private Episode(SearchProblem problem, CostModel costModel, Random random) {
            this.graph = problem.graph();
            this.source = problem.source();
            this.target = problem.target();
            this.demand = problem.bandwidthDemand();
            this.costModel = costModel;
            this.random = random;
            this.visited = new boolean[graph.nodeCount()];
            this.arcs = graph.arcs();
        }

        void train(double epsilon) {
            for (int i = 0; i < path.size(); i++) {
                visited[path.getInt(i)] = false;
            }
            path.clear();
            path.add(source);
            visited[source] = true;
            reachedTarget = false;
            violatesBandwidth = false;
            reward = params.getUnreachedReward();

            int state = source;
            for (int step = 0; step < params.getMaxSteps(); step++) {
                int action = chooseAction(state, epsilon);
                if (action < 0) {
                    break;
                }
                path.add(action);
                visited[action] = true;
                double oldQ = table.get(state, action);
                double newQ;
                if (action == target) {
                    reachedTarget = true;
                    reward = terminalReward();
                    newQ = oldQ + params.getLearningRate() * (reward - oldQ);
                } else {
                    double maxNext = table.maxOverNeighbors(arcs, action);
                    newQ = oldQ + params.getLearningRate()
                            * (params.getStepReward() + params.getDiscountFactor() * maxNext - oldQ);
                }
                table.set(state, action, newQ);
                state = action;
                if (reachedTarget) {
                    break;
                }
            }
        }

        /**
         * Epsilon-greedy choice among unvisited neighbors, biased towards the target.
         *
         * @return next node, or -1 when every neighbor was visited.
         */
        private int chooseAction(int state, double epsilon) {
            unvisited.clear();
            boolean targetAvailable = false;
            arcs.resetForNode(state);
            while (arcs.hasNext()) {
                int next = arcs.target(arcs.next());
                if (!visited[next]) {
                    unvisited.add(next);
                    targetAvailable |= next == target;
                }
            }
            if (unvisited.isEmpty()) {
                return -1;
            }
            if (targetAvailable && random.nextDouble() > epsilon / 2.0d) {
                return target;
            }
            if (random.nextDouble() < epsilon) {
                return unvisited.getInt(random.nextInt(unvisited.size()));
            }
            int best = unvisited.getInt(0);
            double bestQ = table.get(state, best);
            for (int i = 1; i < unvisited.size(); i++) {
                int candidate = unvisited.getInt(i);
                double q = table.get(state, candidate);
                if (q > bestQ) {
                    best = candidate;
                    bestQ = q;
                }
            }
            return best;
        }

        private double terminalReward() {
            for (int i = 0; i + 1 < path.size(); i++) {
                int link = graph.findLink(path.getInt(i), path.getInt(i + 1));
                if (graph.bandwidth(link) < demand) {
                    violatesBandwidth = true;
                    return params.getBandwidthPenalty();
                }
            }
            double cost = costModel.fitness(graph, path.toIntArray());
            return params.getRewardNumerator() / (1.0d + cost) - params.getLengthPenalty() * path.size();
        }
    }
}
