package org.qosroute.routing.solver.baseline;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import lombok.extern.slf4j.Slf4j;
import org.qosroute.routing.cost.CostModel;
import org.qosroute.routing.cost.StaticLinkCost;
import org.qosroute.routing.graph.NetworkGraph;
import org.qosroute.routing.search.ShortestPathSearch;
import org.qosroute.routing.solver.FailureReason;
import org.qosroute.routing.solver.PathSolver;
import org.qosroute.routing.solver.SearchCancellation;
import org.qosroute.routing.solver.SearchProblem;
import org.qosroute.routing.solver.SolverResult;

import java.util.Objects;

/**
 * Deterministic comparison baseline: Dijkstra over static per-link costs on the
 * bandwidth-filtered graph.
 * <p>
 * Link costs are computed on the full graph and looked up through the link joining the same
 * endpoints, since filtering renumbers link ids.
 */
@Slf4j
public final class DijkstraBaselineSolver implements PathSolver {
    private final BaselineParams params;

    public DijkstraBaselineSolver() {
        this(BaselineParams.defaults());
    }

    public DijkstraBaselineSolver(BaselineParams params) {
        this.params = Objects.requireNonNull(params, "params").validate();
    }

    @Override
    public SolverResult solve(SearchProblem problem, SearchCancellation cancellation) {
        if (cancellation.isCancelled()) {
            return SolverResult.failure(FailureReason.CANCELLED, "cancelled before search");
        }
        NetworkGraph graph = problem.graph();
        StaticLinkCost linkCost = params.getLinkReliabilityScale() == StaticLinkCost.DEFAULT_RELIABILITY_SCALE
                ? problem.staticLinkCost()
                : StaticLinkCost.compute(graph, problem.weights(), params.getLinkReliabilityScale());

        int[] path = ShortestPathSearch.weighted(
                problem.filteredGraph(),
                problem.source(),
                problem.target(),
                (link, from, to) -> linkCost.cost(graph.findLink(from, to))
        );
        if (path.length < 2) {
            return SolverResult.failure(
                    FailureReason.INFEASIBLE_DEMAND,
                    "no path with bandwidth >= " + problem.bandwidthDemand()
            );
        }

        double staticCost = 0.0d;
        for (int i = 0; i + 1 < path.length; i++) {
            staticCost += linkCost.cost(graph.findLink(path[i], path[i + 1]));
        }
        CostModel costModel = new CostModel(problem.weights(), params.getReliabilityScale());
        var breakdown = costModel.evaluate(problem.filteredGraph(), path);
        DoubleArrayList history = DoubleArrayList.wrap(new double[]{breakdown.fitness()});
        log.debug("Baseline path with {} hops, static cost {}", path.length - 1, staticCost);
        return SolverResult.success(path, breakdown, new BaselineTrace(history, 1, staticCost, false));
    }
}
