package org.qosroute.routing.solver.annealing;

import it.unimi.dsi.fastutil.objects.ObjectLinkedOpenHashSet;
import org.qosroute.routing.graph.Paths;

/**
 * Bounded most-recently-used set of path signatures.
 * <p>
 * Remembering an entry that is already present refreshes it; the least recently remembered
 * entry is evicted once {@code capacity} is exceeded. A capacity of zero disables the memory.
 */
final class TabuMemory {
    private final int capacity;
    private final ObjectLinkedOpenHashSet<String> entries = new ObjectLinkedOpenHashSet<>();

    TabuMemory(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0");
        }
        this.capacity = capacity;
    }

    boolean isEnabled() {
        return capacity > 0;
    }

    void remember(int[] path) {
        if (capacity == 0) {
            return;
        }
        entries.addAndMoveToLast(Paths.signature(path));
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    boolean contains(int[] path) {
        return capacity > 0 && entries.contains(Paths.signature(path));
    }

    int size() {
        return entries.size();
    }
}
