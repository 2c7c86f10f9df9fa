package org.qosroute.routing.solver.swarm;

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

@DisplayName("SwarmSolver Tests")
class SwarmSolverTest {

    private static SwarmParams seeded(long seed) {
        return SwarmParams.defaults().toBuilder().seed(seed).build();
    }

    @Test
    @DisplayName("Single link pair returns the direct path")
    void testTrivial() {
        NetworkGraph graph = QosFixtureFactory.trivialPair();
        SolverResult result = new SwarmSolver(seeded(1L))
                .solve(QosFixtureFactory.problem(graph, 1, 2, 100.0d, QosWeights.DELAY_ONLY));

        assertTrue(result.isSuccess());
        assertArrayEquals(new int[]{0, 1}, result.path());
    }

    @Test
    @DisplayName("Paths stay on links meeting the demand")
    void testFilteredPaths() {
        NetworkGraph graph = QosFixtureFactory.mesh();
        SearchProblem problem = QosFixtureFactory.problem(graph, 1, 8, 100.0d, QosWeights.of(0.5d, 0.3d, 0.2d));
        SolverResult result = new SwarmSolver(seeded(9L)).solve(problem);

        assertTrue(result.isSuccess());
        QosFixtureFactory.assertSimpleRoute(problem.filteredGraph(), 0, 7, result.path());
        assertTrue(result.breakdown().bottleneckBandwidth() >= 100.0d);
        assertTrue(((SwarmTrace) result.trace()).pathsExtracted() > 0);
    }

    @Test
    @DisplayName("Global best history never increases")
    void testHistory() {
        NetworkGraph graph = QosFixtureFactory.randomTopology(40, 0.1d, 13L);
        SolverResult result = new SwarmSolver(seeded(4L))
                .solve(QosFixtureFactory.problem(graph, 0, 39, 0.0d, QosWeights.of(0.4d, 0.4d, 0.2d)));

        assertTrue(result.isSuccess());
        assertEquals(25, result.trace().iterations());
        for (int i = 1; i < result.trace().bestFitnessHistory().size(); i++) {
            assertTrue(result.trace().bestFitnessHistory().getDouble(i)
                    <= result.trace().bestFitnessHistory().getDouble(i - 1));
        }
    }

    @Test
    @DisplayName("Same seed reproduces the path")
    void testReproducible() {
        NetworkGraph graph = QosFixtureFactory.randomTopology(40, 0.1d, 13L);
        SearchProblem problem = QosFixtureFactory.problem(graph, 0, 39, 0.0d, QosWeights.of(0.4d, 0.4d, 0.2d));

        assertArrayEquals(
                new SwarmSolver(seeded(31L)).solve(problem).path(),
                new SwarmSolver(seeded(31L)).solve(problem).path());
    }

    @Test
    @DisplayName("Unreachable target under the demand is infeasible")
    void testInfeasible() {
        NetworkGraph graph = QosFixtureFactory.lowBandwidthPair();
        SolverResult result = new SwarmSolver(seeded(1L))
                .solve(QosFixtureFactory.problem(graph, 1, 2, 100.0d, QosWeights.DELAY_ONLY));

        assertEquals(FailureReason.INFEASIBLE_DEMAND, result.failureReason());
    }

    @Test
    @DisplayName("Cancellation before the first iteration reports no path")
    void testCancelled() {
        NetworkGraph graph = QosFixtureFactory.mesh();
        SearchCancellation cancellation = SearchCancellation.create();
        cancellation.cancel();

        SolverResult result = new SwarmSolver(seeded(1L))
                .solve(QosFixtureFactory.problem(graph, 1, 8, 0.0d, QosWeights.DELAY_ONLY), cancellation);

        assertEquals(FailureReason.CANCELLED, result.failureReason());
        assertTrue(result.trace().cancelled());
    }

    @Test
    @DisplayName("Out-of-range parameters are rejected")
    void testValidation() {
        SwarmParams base = SwarmParams.defaults();

        assertThrows(IllegalArgumentException.class, () -> new SwarmSolver(base.toBuilder().swarmSize(0).build()));
        assertThrows(IllegalArgumentException.class,
                () -> new SwarmSolver(base.toBuilder().minPriority(2.0d).build()));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> base.toBuilder().inertia(Double.NaN).build().validate());
        assertEquals("inertia, cognitive and social must be >= 0", ex.getMessage());
        assertThrows(IllegalArgumentException.class,
                () -> base.toBuilder().reliabilityScale(Double.POSITIVE_INFINITY).build().validate());
    }
}
