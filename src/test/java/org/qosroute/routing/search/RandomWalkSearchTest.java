package org.qosroute.routing.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.qosroute.routing.graph.BandwidthFilter;
import org.qosroute.routing.graph.NetworkGraph;
import org.qosroute.routing.graph.Paths;
import org.qosroute.routing.testutil.QosFixtureFactory;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RandomWalkSearch Tests")
class RandomWalkSearchTest {

    @Test
    @DisplayName("Walks are simple source-to-target paths")
    void testSimplePaths() {
        NetworkGraph graph = QosFixtureFactory.randomTopology(30, 0.1d, 3L);
        Random random = new Random(5L);

        int found = 0;
        for (int i = 0; i < 50; i++) {
            int[] path = RandomWalkSearch.walk(graph, 0, 29, 40, 10_000, random);
            if (path.length == 0) {
                continue;
            }
            found++;
            QosFixtureFactory.assertSimpleRoute(graph, 0, 29, path);
            assertTrue(path.length <= 40);
        }
        assertTrue(found > 0);
    }

    @Test
    @DisplayName("Same seed gives the same walk")
    void testReproducible() {
        NetworkGraph graph = QosFixtureFactory.randomTopology(30, 0.1d, 3L);

        int[] first = RandomWalkSearch.walk(graph, 0, 29, 40, 10_000, new Random(17L));
        int[] second = RandomWalkSearch.walk(graph, 0, 29, 40, 10_000, new Random(17L));

        assertArrayEquals(first, second);
    }

    @Test
    @DisplayName("Length bound is honored")
    void testMaxLength() {
        NetworkGraph graph = QosFixtureFactory.mesh();

        for (long seed = 0; seed < 20; seed++) {
            int[] path = RandomWalkSearch.walk(graph, 0, 7, 3, 1_000, new Random(seed));
            assertTrue(path.length == 0 || path.length <= 3);
        }
        // chain 0..9 needs ten nodes
        NetworkGraph chain = QosFixtureFactory.randomTopology(10, 0.0d, 1L);
        assertSame(Paths.EMPTY, RandomWalkSearch.walk(chain, 0, 9, 5, 1_000, new Random(1L)));
        assertEquals(10, RandomWalkSearch.walk(chain, 0, 9, 10, 1_000, new Random(1L)).length);
    }

    @Test
    @DisplayName("Unreachable target yields an empty path")
    void testUnreachable() {
        NetworkGraph filtered = BandwidthFilter.filter(QosFixtureFactory.lowBandwidthPair(), 100.0d);

        assertSame(Paths.EMPTY, RandomWalkSearch.walk(filtered, 0, 1, 10, 100, new Random(1L)));
    }

    @Test
    @DisplayName("Invalid bounds are rejected")
    void testInvalidArguments() {
        NetworkGraph graph = QosFixtureFactory.mesh();

        assertThrows(IllegalArgumentException.class, () -> RandomWalkSearch.walk(graph, 0, 7, 1, 10, new Random()));
        assertThrows(IllegalArgumentException.class, () -> RandomWalkSearch.walk(graph, 0, 7, 5, 0, new Random()));
    }
}
