package org.qosroute.routing.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.qosroute.routing.testutil.QosFixtureFactory;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Paths Tests")
class PathsTest {

    @Test
    @DisplayName("isSimple detects repeated nodes")
    void testIsSimple() {
        assertTrue(Paths.isSimple(new int[]{0, 1, 2}));
        assertFalse(Paths.isSimple(new int[]{0, 1, 0}));
        assertFalse(Paths.isSimple(null));
    }

    @Test
    @DisplayName("isValid checks length, links and repetition")
    void testIsValid() {
        NetworkGraph graph = QosFixtureFactory.diamond();

        assertTrue(Paths.isValid(graph, QosFixtureFactory.internalPath(graph, 10, 20, 40)));
        assertFalse(Paths.isValid(graph, QosFixtureFactory.internalPath(graph, 10)));
        assertFalse(Paths.isValid(graph, QosFixtureFactory.internalPath(graph, 20, 30)));
        assertFalse(Paths.isValid(graph, QosFixtureFactory.internalPath(graph, 10, 20, 10, 30)));
        assertFalse(Paths.isValid(graph, new int[]{0, 7}));
    }

    @Test
    @DisplayName("eraseLoops cuts every cycle and keeps the endpoints")
    void testEraseLoops() {
        assertArrayEquals(new int[]{0, 1, 5}, Paths.eraseLoops(new int[]{0, 1, 2, 3, 1, 5}));
        assertArrayEquals(new int[]{0, 9}, Paths.eraseLoops(new int[]{0, 4, 0, 9}));
        assertArrayEquals(new int[]{0, 1, 2, 9}, Paths.eraseLoops(new int[]{0, 1, 2, 3, 1, 2, 9}));
        assertArrayEquals(new int[]{3, 4}, Paths.eraseLoops(new int[]{3, 4}));
        assertEquals(0, Paths.eraseLoops(null).length);
    }

    @Test
    @DisplayName("concat merges a shared junction node")
    void testConcat() {
        assertArrayEquals(new int[]{0, 1, 2, 3}, Paths.concat(new int[]{0, 1, 2}, new int[]{2, 3}));
        assertArrayEquals(new int[]{0, 1, 2, 3}, Paths.concat(new int[]{0, 1}, new int[]{2, 3}));
        assertArrayEquals(new int[]{5}, Paths.concat(new int[0], new int[]{5}));
    }

    @Test
    @DisplayName("signature distinguishes order")
    void testSignature() {
        assertEquals(Paths.signature(new int[]{1, 2, 3}), Paths.signature(new int[]{1, 2, 3}));
        assertNotEquals(Paths.signature(new int[]{1, 2, 3}), Paths.signature(new int[]{1, 3, 2}));
    }
}
