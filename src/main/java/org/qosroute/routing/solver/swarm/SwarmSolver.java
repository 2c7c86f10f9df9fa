package org.qosroute.routing.solver.swarm;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import lombok.extern.slf4j.Slf4j;
import org.qosroute.routing.cost.CostModel;
import org.qosroute.routing.graph.NetworkGraph;
import org.qosroute.routing.search.LinkWeightFunction;
import org.qosroute.routing.search.ShortestPathSearch;
import org.qosroute.routing.solver.FailureReason;
import org.qosroute.routing.solver.PathSolver;
import org.qosroute.routing.solver.SearchCancellation;
import org.qosroute.routing.solver.SearchProblem;
import org.qosroute.routing.solver.SolverResult;

import java.util.Objects;
import java.util.Random;

/**
 * Particle-swarm path search.
 * <p>
 * A particle is a priority per node. Its path is the Dijkstra shortest path on the
 * bandwidth-filtered graph where traversing an arc costs the priority of the arc's target node.
 * Priorities are read through a per-particle {@link LinkWeightFunction}; the shared graph is
 * never annotated.
 */
@Slf4j
public final class SwarmSolver implements PathSolver {
    private final SwarmParams params;

    public SwarmSolver() {
        this(SwarmParams.defaults());
    }

    public SwarmSolver(SwarmParams params) {
        this.params = Objects.requireNonNull(params, "params").validate();
    }

    @Override
    public SolverResult solve(SearchProblem problem, SearchCancellation cancellation) {
        NetworkGraph filtered = problem.filteredGraph();
        int source = problem.source();
        int target = problem.target();
        if (!ShortestPathSearch.isReachable(filtered, source, target)) {
            return SolverResult.failure(
                    FailureReason.INFEASIBLE_DEMAND,
                    "no path with bandwidth >= " + problem.bandwidthDemand()
            );
        }

        Random random = PathSolver.randomFor(params);
        CostModel costModel = new CostModel(problem.weights(), params.getReliabilityScale());
        int dimension = filtered.nodeCount();
        Particle[] swarm = new Particle[params.getSwarmSize()];
        for (int i = 0; i < swarm.length; i++) {
            swarm[i] = new Particle(dimension, params, random);
        }
        double[] globalBestPosition = new double[dimension];
        for (int i = 0; i < dimension; i++) {
            globalBestPosition[i] = Math.max(params.getMinPriority(), random.nextDouble() * params.getMaxPriority());
        }
        double globalBestFitness = Double.POSITIVE_INFINITY;
        int[] globalBestPath = null;

        DoubleArrayList history = new DoubleArrayList(params.getIterations());
        int pathsExtracted = 0;
        int iteration = 0;
        boolean cancelled = false;
        for (; iteration < params.getIterations(); iteration++) {
            if (cancellation.isCancelled()) {
                cancelled = true;
                break;
            }
            for (Particle particle : swarm) {
                double[] priority = particle.position;
                int[] path = ShortestPathSearch.weighted(filtered, source, target, (link, from, to) -> priority[to]);
                if (path.length < 2) {
                    continue;
                }
                pathsExtracted++;
                double fitness = costModel.fitness(filtered, path);
                particle.offer(fitness);
                if (fitness < globalBestFitness) {
                    globalBestFitness = fitness;
                    globalBestPath = path;
                    System.arraycopy(particle.position, 0, globalBestPosition, 0, dimension);
                }
            }
            for (Particle particle : swarm) {
                particle.move(globalBestPosition, params, random);
            }
            history.add(globalBestFitness);
        }

        SwarmTrace trace = new SwarmTrace(history, iteration, pathsExtracted, cancelled);
        if (globalBestPath == null) {
            if (cancelled) {
                return SolverResult.failure(FailureReason.CANCELLED, "cancelled before any particle reached the target", trace);
            }
            return SolverResult.failure(FailureReason.NO_PATH_FOUND, "no particle reached the target", trace);
        }
        log.debug("PSO finished after {} iterations, best fitness {}", iteration, globalBestFitness);
        return SolverResult.success(globalBestPath, costModel.evaluate(filtered, globalBestPath), trace);
    }
}
