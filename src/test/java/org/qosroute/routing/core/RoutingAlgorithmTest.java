package org.qosroute.routing.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RoutingAlgorithm Tests")
class RoutingAlgorithmTest {

    @ParameterizedTest
    @CsvSource({
            "ga, GENETIC",
            "Genetic, GENETIC",
            "pso, PARTICLE_SWARM",
            "particle-swarm, PARTICLE_SWARM",
            "SA, SIMULATED_ANNEALING",
            "simulated-annealing, SIMULATED_ANNEALING",
            "simulated_annealing, SIMULATED_ANNEALING",
            "q-learning, Q_LEARNING",
            "QLEARNING, Q_LEARNING",
            "' dijkstra ', DIJKSTRA_BASELINE",
            "baseline, DIJKSTRA_BASELINE"
    })
    @DisplayName("Aliases and constant names resolve case-insensitively")
    void testFromName(String name, RoutingAlgorithm expected) {
        assertEquals(expected, RoutingAlgorithm.fromName(name));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "dfs", "genetics"})
    @DisplayName("Unknown names are rejected")
    void testUnknown(String name) {
        assertThrows(IllegalArgumentException.class, () -> RoutingAlgorithm.fromName(name));
    }

    @Test
    @DisplayName("Null name is rejected")
    void testNull() {
        assertThrows(IllegalArgumentException.class, () -> RoutingAlgorithm.fromName(null));
    }

    @Test
    @DisplayName("Every algorithm has at least one alias")
    void testAliases() {
        for (RoutingAlgorithm algorithm : RoutingAlgorithm.values()) {
            assertFalse(algorithm.aliases().isEmpty());
            for (String alias : algorithm.aliases()) {
                assertSame(algorithm, RoutingAlgorithm.fromName(alias));
            }
        }
    }
}
