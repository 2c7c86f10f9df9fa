package org.qosroute.routing.solver.annealing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.qosroute.routing.cost.QosWeights;
import org.qosroute.routing.graph.NetworkGraph;
import org.qosroute.routing.solver.FailureReason;
import org.qosroute.routing.solver.SearchCancellation;
import org.qosroute.routing.solver.SearchProblem;
import org.qosroute.routing.solver.SolverResult;
import org.qosroute.routing.testutil.QosFixtureFactory;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AnnealingSolver Tests")
class AnnealingSolverTest {

    private static AnnealingParams seeded(long seed) {
        return AnnealingParams.defaults().toBuilder().seed(seed).build();
    }

    @Nested
    @DisplayName("Metropolis Criterion")
    class AcceptanceTests {

        @Test
        @DisplayName("Improvements are always accepted")
        void testImprovement() {
            assertTrue(AnnealingSolver.accept(-5.0d, 1.0d, 0.999999d));
        }

        @Test
        @DisplayName("Worse moves pass with probability exp(-delta / T)")
        void testWorseMove() {
            double threshold = Math.exp(-10.0d / 100.0d);

            assertTrue(AnnealingSolver.accept(10.0d, 100.0d, threshold - 1e-9d));
            assertFalse(AnnealingSolver.accept(10.0d, 100.0d, threshold + 1e-9d));
            assertFalse(AnnealingSolver.accept(1_000.0d, 0.01d, 0.0d));
        }

        @Test
        @DisplayName("Equal cost moves are accepted for any draw below one")
        void testEqualCost() {
            assertTrue(AnnealingSolver.accept(0.0d, 5.0d, 0.99d));
        }
    }

    @Nested
    @DisplayName("Cooling Schedule")
    class ScheduleTests {

        @Test
        @DisplayName("Single-phase geometric cooling from 300 to 1 takes 36 steps")
        void testCoolingSteps() {
            AnnealingParams params = seeded(1L).toBuilder()
                    .phaseOneAlpha(0.85d)
                    .phaseTwoAlpha(0.85d)
                    .restartEnabled(false)
                    .markovLength(5)
                    .build();
            NetworkGraph graph = QosFixtureFactory.mesh();

            SolverResult result = new AnnealingSolver(params)
                    .solve(QosFixtureFactory.problem(graph, 1, 8, 0.0d, QosWeights.DELAY_ONLY));

            AnnealingTrace trace = (AnnealingTrace) result.trace();
            assertEquals(36, trace.coolingSteps());
            assertEquals(36, trace.bestFitnessHistory().size());
            assertEquals(36 * 5, trace.proposals());
            assertEquals(0, trace.restarts());
        }

        @Test
        @DisplayName("Restarts are bounded by maxRestarts")
        void testRestartBound() {
            AnnealingParams params = seeded(2L).toBuilder()
                    .maxNoImprove(0)
                    .maxRestarts(2)
                    .build();
            NetworkGraph graph = QosFixtureFactory.randomTopology(25, 0.2d, 6L);

            SolverResult result = new AnnealingSolver(params)
                    .solve(QosFixtureFactory.problem(graph, 0, 24, 0.0d, QosWeights.of(0.4d, 0.4d, 0.2d)));

            assertTrue(((AnnealingTrace) result.trace()).restarts() <= 2);
        }
    }

    @Nested
    @DisplayName("Search Outcomes")
    class OutcomeTests {

        @Test
        @DisplayName("Single link pair returns the direct path")
        void testTrivial() {
            NetworkGraph graph = QosFixtureFactory.trivialPair();
            SolverResult result = new AnnealingSolver(seeded(1L))
                    .solve(QosFixtureFactory.problem(graph, 1, 2, 100.0d, QosWeights.DELAY_ONLY));

            assertTrue(result.isSuccess());
            assertArrayEquals(new int[]{0, 1}, result.path());
        }

        @Test
        @DisplayName("Re-routing escapes the fewest-hop start on the diamond")
        void testDiamond() {
            NetworkGraph graph = QosFixtureFactory.diamond();
            SolverResult result = new AnnealingSolver(seeded(4L))
                    .solve(QosFixtureFactory.problem(graph, 10, 40, 0.0d, QosWeights.of(1.0d, 1.0d, 1.0d)));

            assertTrue(result.isSuccess());
            assertArrayEquals(QosFixtureFactory.internalPath(graph, 10, 30, 40), result.path());
        }

        @Test
        @DisplayName("Best cost never exceeds the starting path and paths stay simple")
        void testRandomTopology() {
            NetworkGraph graph = QosFixtureFactory.randomTopology(40, 0.1d, 12L);
            SearchProblem problem = QosFixtureFactory.problem(graph, 0, 39, 300.0d, QosWeights.of(0.5d, 0.3d, 0.2d));
            SolverResult result = new AnnealingSolver(seeded(6L)).solve(problem);

            if (!result.isSuccess()) {
                assertEquals(FailureReason.INFEASIBLE_DEMAND, result.failureReason());
                return;
            }
            QosFixtureFactory.assertSimpleRoute(problem.filteredGraph(), 0, 39, result.path());
            AnnealingTrace trace = (AnnealingTrace) result.trace();
            for (int i = 1; i < trace.bestFitnessHistory().size(); i++) {
                assertTrue(trace.bestFitnessHistory().getDouble(i) <= trace.bestFitnessHistory().getDouble(i - 1));
            }
            assertTrue(trace.acceptanceRate() >= 0.0d && trace.acceptanceRate() <= 1.0d);
        }

        @Test
        @DisplayName("Same seed reproduces the path")
        void testReproducible() {
            NetworkGraph graph = QosFixtureFactory.randomTopology(30, 0.15d, 9L);
            SearchProblem problem = QosFixtureFactory.problem(graph, 0, 29, 0.0d, QosWeights.of(0.4d, 0.4d, 0.2d));

            assertArrayEquals(
                    new AnnealingSolver(seeded(13L)).solve(problem).path(),
                    new AnnealingSolver(seeded(13L)).solve(problem).path());
        }

        @Test
        @DisplayName("Unreachable target under the demand is infeasible")
        void testInfeasible() {
            NetworkGraph graph = QosFixtureFactory.lowBandwidthPair();
            SolverResult result = new AnnealingSolver(seeded(1L))
                    .solve(QosFixtureFactory.problem(graph, 1, 2, 100.0d, QosWeights.DELAY_ONLY));

            assertEquals(FailureReason.INFEASIBLE_DEMAND, result.failureReason());
        }

        @Test
        @DisplayName("Cancellation keeps the starting path")
        void testCancelled() {
            NetworkGraph graph = QosFixtureFactory.mesh();
            SearchCancellation cancellation = SearchCancellation.create();
            cancellation.cancel();

            SolverResult result = new AnnealingSolver(seeded(1L))
                    .solve(QosFixtureFactory.problem(graph, 1, 8, 0.0d, QosWeights.DELAY_ONLY), cancellation);

            assertTrue(result.isSuccess());
            assertTrue(result.trace().cancelled());
            assertEquals(0, result.trace().iterations());
            assertArrayEquals(QosFixtureFactory.internalPath(graph, 1, 8), result.path());
        }
    }

    @Test
    @DisplayName("Out-of-range parameters are rejected")
    void testValidation() {
        AnnealingParams base = AnnealingParams.defaults();

        assertThrows(IllegalArgumentException.class,
                () -> new AnnealingSolver(base.toBuilder().phaseOneAlpha(1.0d).build()));
        assertThrows(IllegalArgumentException.class,
                () -> new AnnealingSolver(base.toBuilder().finalTemperature(500.0d).build()));
        assertThrows(IllegalArgumentException.class,
                () -> new AnnealingSolver(base.toBuilder().markovLength(0).build()));
    }
}
