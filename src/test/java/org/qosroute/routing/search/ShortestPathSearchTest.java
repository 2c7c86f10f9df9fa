package org.qosroute.routing.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.qosroute.routing.graph.BandwidthFilter;
import org.qosroute.routing.graph.NetworkGraph;
import org.qosroute.routing.graph.Paths;
import org.qosroute.routing.testutil.QosFixtureFactory;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ShortestPathSearch Tests")
class ShortestPathSearchTest {

    @Nested
    @DisplayName("Weighted")
    class WeightedTests {

        @Test
        @DisplayName("Delay weights pick the low-latency core")
        void testMeshDelay() {
            NetworkGraph graph = QosFixtureFactory.mesh();
            int[] path = ShortestPathSearch.weighted(graph,
                    graph.nodeIdMapper().toInternal(1),
                    graph.nodeIdMapper().toInternal(8),
                    (link, from, to) -> graph.linkDelay(link));

            assertArrayEquals(QosFixtureFactory.internalPath(graph, 1, 2, 4, 6, 8), path);
        }

        @Test
        @DisplayName("Diamond picks the lower route")
        void testDiamond() {
            NetworkGraph graph = QosFixtureFactory.diamond();
            int[] path = ShortestPathSearch.weighted(graph, 0, 3, (link, from, to) -> graph.linkDelay(link));

            assertArrayEquals(QosFixtureFactory.internalPath(graph, 10, 30, 40), path);
        }

        @Test
        @DisplayName("Unreachable target yields an empty path")
        void testUnreachable() {
            NetworkGraph filtered = BandwidthFilter.filter(QosFixtureFactory.lowBandwidthPair(), 100.0d);

            assertSame(Paths.EMPTY, ShortestPathSearch.weighted(filtered, 0, 1, (link, from, to) -> 1.0d));
        }

        @Test
        @DisplayName("Negative or NaN weights are rejected")
        void testInvalidWeight() {
            NetworkGraph graph = QosFixtureFactory.diamond();

            assertThrows(IllegalArgumentException.class,
                    () -> ShortestPathSearch.weighted(graph, 0, 3, (link, from, to) -> -1.0d));
            assertThrows(IllegalArgumentException.class,
                    () -> ShortestPathSearch.weighted(graph, 0, 3, (link, from, to) -> Double.NaN));
        }

        @Test
        @DisplayName("Out-of-range endpoints are rejected")
        void testBounds() {
            NetworkGraph graph = QosFixtureFactory.diamond();

            assertThrows(IndexOutOfBoundsException.class,
                    () -> ShortestPathSearch.weighted(graph, 0, 9, (link, from, to) -> 1.0d));
        }
    }

    @Nested
    @DisplayName("Fewest Hops")
    class FewestHopsTests {

        @Test
        @DisplayName("Direct link is the fewest-hop path")
        void testDirect() {
            NetworkGraph graph = QosFixtureFactory.mesh();

            assertArrayEquals(QosFixtureFactory.internalPath(graph, 1, 8),
                    ShortestPathSearch.fewestHops(graph, 0, 7));
        }

        @Test
        @DisplayName("Link and node predicates restrict the search")
        void testRestricted() {
            NetworkGraph graph = QosFixtureFactory.mesh();
            int shortcut = graph.findLink(0, 7);
            int node3 = graph.nodeIdMapper().toInternal(3);

            int[] withoutShortcut = ShortestPathSearch.fewestHops(graph, 0, 7, link -> link != shortcut, node -> true);
            assertArrayEquals(QosFixtureFactory.internalPath(graph, 1, 3, 7, 8), withoutShortcut);

            int[] withoutNode3 = ShortestPathSearch.fewestHops(graph, 0, 7,
                    link -> link != shortcut, node -> node != node3);
            assertEquals(5, withoutNode3.length);
            QosFixtureFactory.assertSimpleRoute(graph, 0, 7, withoutNode3);
        }

        @Test
        @DisplayName("Reachability follows the filtered links")
        void testReachability() {
            NetworkGraph graph = QosFixtureFactory.lowBandwidthPair();

            assertTrue(ShortestPathSearch.isReachable(graph, 0, 1));
            assertFalse(ShortestPathSearch.isReachable(BandwidthFilter.filter(graph, 100.0d), 0, 1));
            assertSame(Paths.EMPTY, ShortestPathSearch.fewestHops(BandwidthFilter.filter(graph, 100.0d), 0, 1));
        }
    }
}
