package org.qosroute.routing.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.qosroute.routing.cost.CostBreakdown;
import org.qosroute.routing.cost.QosWeights;
import org.qosroute.routing.cost.StaticLinkCost;
import org.qosroute.routing.graph.NetworkGraph;
import org.qosroute.routing.testutil.QosFixtureFactory;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SearchProblem and SolverResult Tests")
class SearchProblemTest {

    @Test
    @DisplayName("of normalizes weights and filters the graph")
    void testOf() {
        NetworkGraph graph = QosFixtureFactory.mesh();
        SearchProblem problem = SearchProblem.of(graph, 0, 7, 100.0d, QosWeights.of(2.0d, 1.0d, 1.0d));

        assertSame(graph, problem.graph());
        assertEquals(graph.linkCount() - 2, problem.filteredGraph().linkCount());
        assertTrue(problem.weights().isNormalized());
        assertEquals(graph.linkCount(), problem.staticLinkCost().size());
    }

    @Test
    @DisplayName("Equal endpoints and unnormalized weights are rejected")
    void testValidation() {
        NetworkGraph graph = QosFixtureFactory.mesh();

        assertThrows(IllegalArgumentException.class,
                () -> SearchProblem.of(graph, 3, 3, 0.0d, QosWeights.DELAY_ONLY));
        assertThrows(IndexOutOfBoundsException.class,
                () -> SearchProblem.of(graph, 0, 99, 0.0d, QosWeights.DELAY_ONLY));
        StaticLinkCost costs = StaticLinkCost.compute(graph, QosWeights.DELAY_ONLY, 100.0d);
        assertThrows(IllegalArgumentException.class,
                () -> new SearchProblem(graph, graph, 0, 7, 0.0d, QosWeights.of(1.0d, 1.0d, 0.0d), costs));
    }

    @Test
    @DisplayName("Results are tagged by failure reason")
    void testResultTagging() {
        SolverResult failure = SolverResult.failure(FailureReason.NO_PATH_FOUND, "nothing");

        assertFalse(failure.isSuccess());
        assertEquals(0, failure.path().length);
        assertSame(CostBreakdown.INFEASIBLE, failure.breakdown());
        assertEquals(0, failure.trace().iterations());
        assertThrows(IllegalArgumentException.class,
                () -> SolverResult.success(new int[]{0}, CostBreakdown.INFEASIBLE, SolverTrace.empty()));
    }

    @Test
    @DisplayName("The shared never token cannot be cancelled")
    void testCancellation() {
        SearchCancellation token = SearchCancellation.create();
        assertFalse(token.isCancelled());
        token.cancel();
        assertTrue(token.isCancelled());

        assertThrows(UnsupportedOperationException.class, () -> SearchCancellation.never().cancel());
        assertFalse(SearchCancellation.never().isCancelled());
    }
}
