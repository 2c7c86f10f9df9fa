package org.qosroute.routing.core;

import java.util.List;
import java.util.Locale;

/**
 * Search strategy selector used by {@link RouteDispatcher}.
 */
public enum RoutingAlgorithm {
    GENETIC("genetic", "ga"),
    PARTICLE_SWARM("pso", "particle-swarm"),
    SIMULATED_ANNEALING("sa", "annealing", "simulated-annealing"),
    Q_LEARNING("qlearning", "q-learning"),
    DIJKSTRA_BASELINE("dijkstra", "baseline");

    private final List<String> aliases;

    RoutingAlgorithm(String... aliases) {
        this.aliases = List.of(aliases);
    }

    public List<String> aliases() {
        return aliases;
    }

    /**
     * Resolves a case-insensitive alias or enum constant name.
     *
     * @throws IllegalArgumentException when nothing matches.
     */
    public static RoutingAlgorithm fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("algorithm name must be non-blank");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (RoutingAlgorithm algorithm : values()) {
            if (algorithm.aliases.contains(normalized)
                    || algorithm.name().toLowerCase(Locale.ROOT).equals(normalized.replace('-', '_'))) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("unknown algorithm: " + name);
    }
}
