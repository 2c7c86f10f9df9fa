package org.qosroute.routing.core;

import lombok.extern.slf4j.Slf4j;
import org.qosroute.core.id.NodeIdMapper;
import org.qosroute.routing.cost.CostBreakdown;
import org.qosroute.routing.cost.CostModel;
import org.qosroute.routing.cost.QosWeights;
import org.qosroute.routing.graph.NetworkGraph;
import org.qosroute.routing.graph.Paths;
import org.qosroute.routing.solver.FailureReason;
import org.qosroute.routing.solver.PathSolver;
import org.qosroute.routing.solver.SearchCancellation;
import org.qosroute.routing.solver.SearchProblem;
import org.qosroute.routing.solver.SolverParameters;
import org.qosroute.routing.solver.SolverResult;
import org.qosroute.routing.solver.annealing.AnnealingParams;
import org.qosroute.routing.solver.annealing.AnnealingSolver;
import org.qosroute.routing.solver.baseline.BaselineParams;
import org.qosroute.routing.solver.baseline.DijkstraBaselineSolver;
import org.qosroute.routing.solver.genetic.GeneticParams;
import org.qosroute.routing.solver.genetic.GeneticSolver;
import org.qosroute.routing.solver.qlearning.QLearningParams;
import org.qosroute.routing.solver.qlearning.QLearningSolver;
import org.qosroute.routing.solver.swarm.SwarmParams;
import org.qosroute.routing.solver.swarm.SwarmSolver;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.BiFunction;

/**
 * Single entry point for constrained QoS path search.
 * <p>
 * Pipeline per call:
 * <ol>
 * <li>Validate graph, demand, weights and algorithm selector.</li>
 * <li>Normalize weights, map external ids, filter by bandwidth, precompute static link costs.</li>
 * <li>Run the selected {@link PathSolver}.</li>
 * <li>Re-evaluate the returned path on the full graph at reporting scale.</li>
 * </ol>
 * Every outcome, including solver exceptions, is returned as a {@link RouteResult}; nothing is
 * thrown to the caller.
 */
@Slf4j
public final class RouteDispatcher {
    public static final String REASON_GRAPH_REQUIRED = "D1_GRAPH_REQUIRED";
    public static final String REASON_DEMAND_REQUIRED = "D1_DEMAND_REQUIRED";
    public static final String REASON_INVALID_DEMAND = "D1_INVALID_DEMAND";
    public static final String REASON_UNKNOWN_NODE = "D1_UNKNOWN_NODE";
    public static final String REASON_SAME_ENDPOINTS = "D1_SAME_ENDPOINTS";
    public static final String REASON_INVALID_WEIGHTS = "D1_INVALID_WEIGHTS";
    public static final String REASON_ALGORITHM_REQUIRED = "D1_ALGORITHM_REQUIRED";
    public static final String REASON_UNKNOWN_ALGORITHM = "D1_UNKNOWN_ALGORITHM";
    public static final String REASON_INVALID_PARAMETERS = "D1_INVALID_PARAMETERS";
    public static final String REASON_SOLVER_EXCEPTION = "D2_SOLVER_EXCEPTION";
    public static final String REASON_INVALID_SOLVER_PATH = "D2_INVALID_SOLVER_PATH";
    public static final String REASON_COMPARE_INTERRUPTED = "D3_COMPARE_INTERRUPTED";

    /**
     * Reliability multiplier used for reported fitness so results compare across algorithms.
     */
    public static final double REPORTING_RELIABILITY_SCALE = 1.0d;

    private final int compareParallelism;
    private final BiFunction<RoutingAlgorithm, SolverParameters, PathSolver> solverFactory;

    public RouteDispatcher() {
        this(Runtime.getRuntime().availableProcessors());
    }

    /**
     * @param compareParallelism maximum worker threads used by {@link #compare}.
     */
    public RouteDispatcher(int compareParallelism) {
        this(compareParallelism, RouteDispatcher::createSolver);
    }

    /**
     * @param solverFactory builds the solver for one call; throws {@link IllegalArgumentException}
     *                      for unusable parameters.
     */
    RouteDispatcher(int compareParallelism, BiFunction<RoutingAlgorithm, SolverParameters, PathSolver> solverFactory) {
        if (compareParallelism <= 0) {
            throw new IllegalArgumentException("compareParallelism must be > 0");
        }
        this.compareParallelism = compareParallelism;
        this.solverFactory = Objects.requireNonNull(solverFactory, "solverFactory");
    }

    /**
     * Runs one search with the default parameters of {@code algorithm}.
     */
    public RouteResult solve(NetworkGraph graph, Demand demand, QosWeights weights, RoutingAlgorithm algorithm) {
        return solve(graph, demand, weights, algorithm, null, SearchCancellation.never());
    }

    public RouteResult solve(
            NetworkGraph graph,
            Demand demand,
            QosWeights weights,
            RoutingAlgorithm algorithm,
            SolverParameters params
    ) {
        return solve(graph, demand, weights, algorithm, params, SearchCancellation.never());
    }

    /**
     * Runs one search selected by alias, e.g. {@code "ga"} or {@code "simulated-annealing"}.
     */
    public RouteResult solve(
            NetworkGraph graph,
            Demand demand,
            QosWeights weights,
            String algorithmName,
            SolverParameters params
    ) {
        long start = System.nanoTime();
        RoutingAlgorithm algorithm;
        try {
            algorithm = RoutingAlgorithm.fromName(algorithmName);
        } catch (IllegalArgumentException ex) {
            return invalid(null, REASON_UNKNOWN_ALGORITHM, ex.getMessage(), start);
        }
        return solve(graph, demand, weights, algorithm, params, SearchCancellation.never());
    }

    /**
     * Runs one search.
     *
     * @param params solver parameters of the matching type, or null for defaults.
     * @param cancellation cooperative stop flag forwarded to the solver.
     */
    public RouteResult solve(
            NetworkGraph graph,
            Demand demand,
            QosWeights weights,
            RoutingAlgorithm algorithm,
            SolverParameters params,
            SearchCancellation cancellation
    ) {
        long start = System.nanoTime();
        if (algorithm == null) {
            return invalid(null, REASON_ALGORITHM_REQUIRED, "algorithm must be provided", start);
        }
        if (graph == null) {
            return invalid(algorithm, REASON_GRAPH_REQUIRED, "graph must be provided", start);
        }
        if (demand == null) {
            return invalid(algorithm, REASON_DEMAND_REQUIRED, "demand must be provided", start);
        }
        if (!Double.isFinite(demand.bandwidth()) || demand.bandwidth() < 0.0d) {
            return invalid(algorithm, REASON_INVALID_DEMAND,
                    "bandwidth demand must be finite and >= 0, got " + demand.bandwidth(), start);
        }
        if (weights == null || !weights.isValid()) {
            return invalid(algorithm, REASON_INVALID_WEIGHTS,
                    "weights must be finite and >= 0: " + weights, start);
        }
        NodeIdMapper mapper = graph.nodeIdMapper();
        if (!mapper.containsExternal(demand.source())) {
            return invalid(algorithm, REASON_UNKNOWN_NODE, "unknown source node " + demand.source(), start);
        }
        if (!mapper.containsExternal(demand.target())) {
            return invalid(algorithm, REASON_UNKNOWN_NODE, "unknown target node " + demand.target(), start);
        }
        if (demand.source() == demand.target()) {
            return invalid(algorithm, REASON_SAME_ENDPOINTS, "source and target are both " + demand.source(), start);
        }

        PathSolver solver;
        try {
            solver = solverFactory.apply(algorithm, params);
        } catch (IllegalArgumentException ex) {
            return invalid(algorithm, REASON_INVALID_PARAMETERS, ex.getMessage(), start);
        }

        SearchProblem problem = SearchProblem.of(
                graph,
                mapper.toInternal(demand.source()),
                mapper.toInternal(demand.target()),
                demand.bandwidth(),
                weights
        );

        SolverResult result;
        try {
            result = solver.solve(problem, cancellation == null ? SearchCancellation.never() : cancellation);
        } catch (RuntimeException ex) {
            log.warn("{} solver failed for demand {}", algorithm, demand, ex);
            return RouteResult.failure(
                    algorithm,
                    FailureReason.SOLVER_ERROR,
                    format(REASON_SOLVER_EXCEPTION, ex.getClass().getSimpleName() + ": " + ex.getMessage()),
                    null,
                    System.nanoTime() - start
            );
        }

        if (!result.isSuccess()) {
            log.debug("{} found no path for {}: {} ({})", algorithm, demand, result.failureReason(), result.failureDetail());
            return RouteResult.failure(
                    algorithm,
                    result.failureReason(),
                    result.failureDetail(),
                    result.trace(),
                    System.nanoTime() - start
            );
        }
        return report(problem, algorithm, result, start);
    }

    /**
     * Runs several solvers against the same demand on a fixed thread pool.
     * The graph is shared read-only; every solver owns its random source and scratch state.
     *
     * @param paramsByAlgorithm optional per-algorithm parameters; missing entries use defaults.
     * @return one result per requested algorithm, in enum order.
     */
    public Map<RoutingAlgorithm, RouteResult> compare(
            NetworkGraph graph,
            Demand demand,
            QosWeights weights,
            Collection<RoutingAlgorithm> algorithms,
            Map<RoutingAlgorithm, ? extends SolverParameters> paramsByAlgorithm
    ) {
        Objects.requireNonNull(algorithms, "algorithms");
        Set<RoutingAlgorithm> selected = new LinkedHashSet<>(algorithms);
        selected.remove(null);
        Map<RoutingAlgorithm, RouteResult> results = new EnumMap<>(RoutingAlgorithm.class);
        if (selected.isEmpty()) {
            return results;
        }

        SearchCancellation cancellation = SearchCancellation.create();
        Map<RoutingAlgorithm, Future<RouteResult>> futures = new EnumMap<>(RoutingAlgorithm.class);
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(compareParallelism, selected.size()));
        try {
            for (RoutingAlgorithm algorithm : selected) {
                SolverParameters params = paramsByAlgorithm == null ? null : paramsByAlgorithm.get(algorithm);
                futures.put(algorithm, executor.submit(
                        () -> solve(graph, demand, weights, algorithm, params, cancellation)));
            }
            for (Map.Entry<RoutingAlgorithm, Future<RouteResult>> entry : futures.entrySet()) {
                results.put(entry.getKey(), await(entry.getKey(), entry.getValue(), cancellation));
            }
        } finally {
            executor.shutdownNow();
        }
        return results;
    }

    /**
     * Runs {@link #compare} for every demand in turn and scores the outcome per scenario.
     *
     * @param demands scenarios in the order they are reported.
     * @param paramsByAlgorithm optional per-algorithm parameters; missing entries use defaults.
     */
    public BenchmarkReport benchmark(
            NetworkGraph graph,
            List<Demand> demands,
            QosWeights weights,
            Collection<RoutingAlgorithm> algorithms,
            Map<RoutingAlgorithm, ? extends SolverParameters> paramsByAlgorithm
    ) {
        Objects.requireNonNull(demands, "demands");
        BenchmarkReport.BenchmarkReportBuilder report = BenchmarkReport.builder();
        Map<RoutingAlgorithm, Integer> wins = new EnumMap<>(RoutingAlgorithm.class);
        Map<RoutingAlgorithm, Long> elapsedTotals = new EnumMap<>(RoutingAlgorithm.class);
        Map<RoutingAlgorithm, Integer> runs = new EnumMap<>(RoutingAlgorithm.class);
        int successfulScenarios = 0;

        for (Demand demand : demands) {
            Map<RoutingAlgorithm, RouteResult> results = compare(graph, demand, weights, algorithms, paramsByAlgorithm);
            Map<RoutingAlgorithm, Double> scores = BenchmarkReport.balancedScores(results);
            RoutingAlgorithm winner = BenchmarkReport.winnerOf(scores);
            if (winner != null) {
                wins.merge(winner, 1, Integer::sum);
                successfulScenarios++;
            }
            for (Map.Entry<RoutingAlgorithm, RouteResult> entry : results.entrySet()) {
                elapsedTotals.merge(entry.getKey(), entry.getValue().getElapsedNanos(), Long::sum);
                runs.merge(entry.getKey(), 1, Integer::sum);
            }
            log.debug("benchmark scenario {} won by {}", demand, winner);
            report.scenario(BenchmarkReport.ScenarioOutcome.builder()
                    .demand(demand)
                    .results(Collections.unmodifiableMap(results))
                    .balancedScores(scores)
                    .winner(winner)
                    .build());
        }

        Map<RoutingAlgorithm, Double> meanElapsed = new EnumMap<>(RoutingAlgorithm.class);
        for (Map.Entry<RoutingAlgorithm, Long> entry : elapsedTotals.entrySet()) {
            meanElapsed.put(entry.getKey(), (double) entry.getValue() / runs.get(entry.getKey()));
        }
        return report
                .wins(Collections.unmodifiableMap(wins))
                .meanElapsedNanos(Collections.unmodifiableMap(meanElapsed))
                .successRate(demands.isEmpty() ? 0.0d : (double) successfulScenarios / demands.size())
                .build();
    }

    private RouteResult await(RoutingAlgorithm algorithm, Future<RouteResult> future, SearchCancellation cancellation) {
        long start = System.nanoTime();
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            cancellation.cancel();
            return RouteResult.failure(
                    algorithm,
                    FailureReason.CANCELLED,
                    format(REASON_COMPARE_INTERRUPTED, "comparison interrupted"),
                    null,
                    System.nanoTime() - start
            );
        } catch (ExecutionException ex) {
            log.warn("{} comparison task failed", algorithm, ex.getCause());
            return RouteResult.failure(
                    algorithm,
                    FailureReason.SOLVER_ERROR,
                    format(REASON_SOLVER_EXCEPTION, String.valueOf(ex.getCause())),
                    null,
                    System.nanoTime() - start
            );
        }
    }

    /**
     * Builds the solver for {@code algorithm}; null params select the defaults.
     *
     * @throws IllegalArgumentException when params have the wrong type or invalid values.
     */
    static PathSolver createSolver(RoutingAlgorithm algorithm, SolverParameters params) {
        return switch (algorithm) {
            case GENETIC -> new GeneticSolver(params == null ? GeneticParams.defaults() : cast(params, GeneticParams.class, algorithm));
            case PARTICLE_SWARM -> new SwarmSolver(params == null ? SwarmParams.defaults() : cast(params, SwarmParams.class, algorithm));
            case SIMULATED_ANNEALING -> new AnnealingSolver(params == null ? AnnealingParams.defaults() : cast(params, AnnealingParams.class, algorithm));
            case Q_LEARNING -> new QLearningSolver(params == null ? QLearningParams.defaults() : cast(params, QLearningParams.class, algorithm));
            case DIJKSTRA_BASELINE -> new DijkstraBaselineSolver(params == null ? BaselineParams.defaults() : cast(params, BaselineParams.class, algorithm));
        };
    }

    private static <P extends SolverParameters> P cast(SolverParameters params, Class<P> type, RoutingAlgorithm algorithm) {
        if (!type.isInstance(params)) {
            throw new IllegalArgumentException(
                    algorithm + " expects " + type.getSimpleName() + " but got " + params.getClass().getSimpleName());
        }
        return type.cast(params);
    }

    private RouteResult report(SearchProblem problem, RoutingAlgorithm algorithm, SolverResult result, long start) {
        int[] path = result.path();
        if (!Paths.isValid(problem.filteredGraph(), path)
                || path[0] != problem.source()
                || path[path.length - 1] != problem.target()) {
            log.warn("{} returned an invalid path {}", algorithm, Paths.signature(path));
            return RouteResult.failure(
                    algorithm,
                    FailureReason.SOLVER_ERROR,
                    format(REASON_INVALID_SOLVER_PATH, "solver returned " + Paths.signature(path)),
                    result.trace(),
                    System.nanoTime() - start
            );
        }

        CostModel reporting = new CostModel(problem.weights(), REPORTING_RELIABILITY_SCALE);
        CostBreakdown metrics = reporting.evaluate(problem.graph(), path);
        NodeIdMapper mapper = problem.graph().nodeIdMapper();
        RouteResult.RouteResultBuilder builder = RouteResult.builder()
                .success(true)
                .algorithm(algorithm)
                .totalDelay(metrics.totalDelay())
                .finalReliabilityPercent(metrics.finalReliabilityPercent())
                .resourceCost(metrics.resourceCost())
                .reliabilityCost(metrics.reliabilityCost())
                .fitness(metrics.fitness())
                .hopCount(metrics.hopCount())
                .bottleneckBandwidth(metrics.bottleneckBandwidth())
                .trace(result.trace());
        for (int node : path) {
            builder.pathNode(mapper.toExternal(node));
        }
        RouteResult routeResult = builder.elapsedNanos(System.nanoTime() - start).build();
        log.debug("{} path with {} hops, fitness {}", algorithm, routeResult.getHopCount(), routeResult.getFitness());
        return routeResult;
    }

    private static RouteResult invalid(RoutingAlgorithm algorithm, String reasonCode, String message, long start) {
        return RouteResult.failure(
                algorithm,
                FailureReason.INVALID_INPUT,
                format(reasonCode, message),
                null,
                System.nanoTime() - start
        );
    }

    private static String format(String reasonCode, String message) {
        return "[" + reasonCode + "] " + message;
    }
}
