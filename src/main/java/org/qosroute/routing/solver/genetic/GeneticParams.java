package org.qosroute.routing.solver.genetic;

import lombok.Builder;
import lombok.Value;
import org.qosroute.routing.solver.SolverParameters;
import org.qosroute.routing.solver.SolverProperties;

/**
 * Tuning knobs of {@link GeneticSolver}.
 */
@Value
@Builder(toBuilder = true)
public class GeneticParams implements SolverParameters {
    static final String SOLVER = "genetic";

    /** Number of individuals per generation. */
    int populationSize;
    /** Number of generations after seeding. */
    int generations;
    /** Probability of splicing two parents. */
    double crossoverRate;
    /** Probability of re-routing one interior node of a child. */
    double mutationRate;
    /** Individuals copied unchanged into the next generation. */
    int eliteCount;
    /** Individuals sampled per tournament. */
    int tournamentSize;
    /** Maximum node count of a random walk. */
    int maxWalkLength;
    /** Seeding attempts per requested individual. */
    int seedingAttemptFactor;
    /** Node expansions allowed per random walk. */
    int walkExpansionBudget;
    /** Multiplier applied to the reliability cost term. */
    double reliabilityScale;
    Long seed;

    /**
     * Defaults, overridable through {@code qosroute.genetic.*} system properties.
     */
    public static GeneticParams defaults() {
        return GeneticParams.builder()
                .populationSize(SolverProperties.readInt(SOLVER, "populationSize", 50))
                .generations(SolverProperties.readInt(SOLVER, "generations", 200))
                .crossoverRate(SolverProperties.readDouble(SOLVER, "crossoverRate", 0.8d))
                .mutationRate(SolverProperties.readDouble(SOLVER, "mutationRate", 0.08d))
                .eliteCount(SolverProperties.readInt(SOLVER, "eliteCount", 2))
                .tournamentSize(SolverProperties.readInt(SOLVER, "tournamentSize", 3))
                .maxWalkLength(SolverProperties.readInt(SOLVER, "maxWalkLength", 30))
                .seedingAttemptFactor(SolverProperties.readInt(SOLVER, "seedingAttemptFactor", 20))
                .walkExpansionBudget(SolverProperties.readInt(SOLVER, "walkExpansionBudget", 20_000))
                .reliabilityScale(SolverProperties.readDouble(SOLVER, "reliabilityScale", 1.0d))
                .seed(SolverProperties.readSeed(SOLVER))
                .build();
    }

    /**
     * @throws IllegalArgumentException when a field is out of range.
     */
    public GeneticParams validate() {
        require(populationSize > 0, "populationSize must be > 0");
        require(generations >= 0, "generations must be >= 0");
        require(crossoverRate >= 0.0d && crossoverRate <= 1.0d, "crossoverRate must be in [0, 1]");
        require(mutationRate >= 0.0d && mutationRate <= 1.0d, "mutationRate must be in [0, 1]");
        require(eliteCount >= 0 && eliteCount <= populationSize, "eliteCount must be in [0, populationSize]");
        require(tournamentSize > 0, "tournamentSize must be > 0");
        require(maxWalkLength >= 2, "maxWalkLength must be >= 2");
        require(seedingAttemptFactor > 0, "seedingAttemptFactor must be > 0");
        require(walkExpansionBudget > 0, "walkExpansionBudget must be > 0");
        require(Double.isFinite(reliabilityScale) && reliabilityScale > 0.0d, "reliabilityScale must be > 0");
        return this;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
