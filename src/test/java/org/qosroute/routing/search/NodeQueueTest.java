package org.qosroute.routing.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NodeQueue Tests")
class NodeQueueTest {

    @Test
    @DisplayName("Extracts in key order")
    void testOrdering() {
        NodeQueue queue = new NodeQueue(5);
        queue.offer(3, 7.0d);
        queue.offer(1, 2.0d);
        queue.offer(4, 5.0d);
        queue.offer(0, 9.0d);

        assertEquals(4, queue.size());
        assertEquals(2.0d, queue.peekKey());
        assertEquals(1, queue.extractMin());
        assertEquals(4, queue.extractMin());
        assertEquals(3, queue.extractMin());
        assertEquals(0, queue.extractMin());
        assertTrue(queue.isEmpty());
    }

    @Test
    @DisplayName("Decrease-key moves a node forward, increases are ignored")
    void testDecreaseKey() {
        NodeQueue queue = new NodeQueue(3);
        queue.offer(0, 5.0d);
        queue.offer(1, 4.0d);

        assertTrue(queue.offer(0, 1.0d));
        assertFalse(queue.offer(1, 10.0d));
        assertEquals(2, queue.size());
        assertEquals(0, queue.extractMin());
        assertEquals(4.0d, queue.peekKey());
    }

    @Test
    @DisplayName("Equal keys break ties by node index")
    void testTies() {
        NodeQueue queue = new NodeQueue(4);
        queue.offer(2, 1.0d);
        queue.offer(3, 1.0d);
        queue.offer(0, 1.0d);

        assertEquals(0, queue.extractMin());
        assertEquals(2, queue.extractMin());
        assertEquals(3, queue.extractMin());
    }

    @Test
    @DisplayName("Randomized keys come out sorted")
    void testRandomized() {
        int n = 200;
        NodeQueue queue = new NodeQueue(n);
        Random random = new Random(11L);
        for (int node = 0; node < n; node++) {
            queue.offer(node, random.nextDouble() * 100.0d);
        }
        for (int node = 0; node < n; node += 3) {
            queue.offer(node, random.nextDouble());
        }
        double previous = Double.NEGATIVE_INFINITY;
        while (!queue.isEmpty()) {
            double key = queue.peekKey();
            assertTrue(key >= previous);
            previous = key;
            queue.extractMin();
        }
    }

    @Test
    @DisplayName("Empty queue throws and clear resets membership")
    void testEmptyAndClear() {
        NodeQueue queue = new NodeQueue(2);

        assertThrows(EmptyQueueException.class, queue::extractMin);
        assertThrows(EmptyQueueException.class, queue::peekKey);

        queue.offer(1, 3.0d);
        assertTrue(queue.contains(1));
        queue.clear();
        assertFalse(queue.contains(1));
        assertTrue(queue.isEmpty());
        assertTrue(queue.offer(1, 8.0d));
        assertEquals(1, queue.extractMin());
    }

    @Test
    @DisplayName("Out-of-range node is rejected")
    void testBounds() {
        NodeQueue queue = new NodeQueue(2);

        assertThrows(IllegalArgumentException.class, () -> queue.offer(2, 1.0d));
        assertThrows(IllegalArgumentException.class, () -> queue.offer(-1, 1.0d));
        assertThrows(IllegalArgumentException.class, () -> new NodeQueue(-1));
    }
}
