package org.qosroute.routing.solver.baseline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.qosroute.routing.cost.QosWeights;
import org.qosroute.routing.graph.NetworkGraph;
import org.qosroute.routing.solver.FailureReason;
import org.qosroute.routing.solver.SearchCancellation;
import org.qosroute.routing.solver.SearchProblem;
import org.qosroute.routing.solver.SolverResult;
import org.qosroute.routing.testutil.QosFixtureFactory;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DijkstraBaselineSolver Tests")
class DijkstraBaselineSolverTest {

    @Test
    @DisplayName("Delay weights pick the lower diamond route")
    void testDiamond() {
        NetworkGraph graph = QosFixtureFactory.diamond();
        SolverResult result = new DijkstraBaselineSolver()
                .solve(QosFixtureFactory.problem(graph, 10, 40, 0.0d, QosWeights.DELAY_ONLY));

        assertTrue(result.isSuccess());
        assertArrayEquals(QosFixtureFactory.internalPath(graph, 10, 30, 40), result.path());
        BaselineTrace trace = (BaselineTrace) result.trace();
        assertEquals(3.0d, trace.staticPathCost(), 1e-9d);
        assertEquals(1, trace.iterations());
        assertEquals(6.0d, result.breakdown().totalDelay(), 1e-9d);
    }

    @Test
    @DisplayName("Filtering renumbers links but costs follow the endpoints")
    void testFilteredMesh() {
        NetworkGraph graph = QosFixtureFactory.mesh();
        SearchProblem problem = QosFixtureFactory.problem(graph, 1, 8, 100.0d, QosWeights.DELAY_ONLY);

        SolverResult result = new DijkstraBaselineSolver().solve(problem);

        assertArrayEquals(QosFixtureFactory.internalPath(graph, 1, 2, 4, 6, 8), result.path());
        assertEquals(2.0d + 3.0d + 1.0d + 4.0d, ((BaselineTrace) result.trace()).staticPathCost(), 1e-9d);
    }

    @Test
    @DisplayName("Reliability weights prefer the reliable shortcut when it qualifies")
    void testReliabilityWeights() {
        NetworkGraph graph = QosFixtureFactory.mesh();
        QosWeights reliabilityOnly = QosWeights.of(0.0d, 1.0d, 0.0d);

        SolverResult open = new DijkstraBaselineSolver()
                .solve(QosFixtureFactory.problem(graph, 1, 8, 0.0d, reliabilityOnly));
        SolverResult constrained = new DijkstraBaselineSolver()
                .solve(QosFixtureFactory.problem(graph, 1, 8, 100.0d, reliabilityOnly));

        assertArrayEquals(QosFixtureFactory.internalPath(graph, 1, 8), open.path());
        assertTrue(constrained.breakdown().bottleneckBandwidth() >= 100.0d);
    }

    @Test
    @DisplayName("Unreachable target under the demand is infeasible")
    void testInfeasible() {
        NetworkGraph graph = QosFixtureFactory.lowBandwidthPair();
        SolverResult result = new DijkstraBaselineSolver()
                .solve(QosFixtureFactory.problem(graph, 1, 2, 100.0d, QosWeights.DELAY_ONLY));

        assertEquals(FailureReason.INFEASIBLE_DEMAND, result.failureReason());
    }

    @Test
    @DisplayName("Cancelled token skips the search")
    void testCancelled() {
        SearchCancellation cancellation = SearchCancellation.create();
        cancellation.cancel();

        SolverResult result = new DijkstraBaselineSolver().solve(
                QosFixtureFactory.problem(QosFixtureFactory.mesh(), 1, 8, 0.0d, QosWeights.DELAY_ONLY), cancellation);

        assertEquals(FailureReason.CANCELLED, result.failureReason());
    }

    @Test
    @DisplayName("Non-positive scales are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new DijkstraBaselineSolver(
                BaselineParams.defaults().toBuilder().reliabilityScale(0.0d).build()));
        assertThrows(IllegalArgumentException.class, () -> BaselineParams.defaults().toBuilder()
                .linkReliabilityScale(Double.NaN).build().validate());
    }
}
