package org.qosroute.routing.solver.annealing;

import lombok.Builder;
import lombok.Value;
import org.qosroute.routing.solver.SolverParameters;
import org.qosroute.routing.solver.SolverProperties;

/**
 * Cooling schedule and neighborhood settings of {@link AnnealingSolver}.
 */
@Value
@Builder(toBuilder = true)
public class AnnealingParams implements SolverParameters {
    static final String SOLVER = "annealing";

    double initialTemperature;
    double finalTemperature;
    /** Cooling factor for the first {@code phaseThreshold} cooling steps. */
    double phaseOneAlpha;
    /** Cooling factor afterwards. */
    double phaseTwoAlpha;
    int phaseThreshold;
    /** Proposals per temperature level. */
    int markovLength;
    int tabuSize;
    /** Probability that a candidate found in tabu memory is rejected. */
    double tabuRejectionProbability;
    /** Probability of ignoring the temperature-driven strategy and picking one at random. */
    double strategyDiversityProbability;
    int neighborAttempts;
    /** Accepted non-improving moves tolerated before a restart. */
    int maxNoImprove;
    boolean restartEnabled;
    int maxRestarts;
    /** Restart temperature as a fraction of {@code initialTemperature}. */
    double reheatFraction;
    double reliabilityScale;
    Long seed;

    public static AnnealingParams defaults() {
        return AnnealingParams.builder()
                .initialTemperature(SolverProperties.readDouble(SOLVER, "initialTemperature", 300.0d))
                .finalTemperature(SolverProperties.readDouble(SOLVER, "finalTemperature", 1.0d))
                .phaseOneAlpha(SolverProperties.readDouble(SOLVER, "phaseOneAlpha", 0.85d))
                .phaseTwoAlpha(SolverProperties.readDouble(SOLVER, "phaseTwoAlpha", 0.80d))
                .phaseThreshold(SolverProperties.readInt(SOLVER, "phaseThreshold", 15))
                .markovLength(SolverProperties.readInt(SOLVER, "markovLength", 50))
                .tabuSize(SolverProperties.readInt(SOLVER, "tabuSize", 10))
                .tabuRejectionProbability(SolverProperties.readDouble(SOLVER, "tabuRejectionProbability", 0.5d))
                .strategyDiversityProbability(SolverProperties.readDouble(SOLVER, "strategyDiversityProbability", 0.1d))
                .neighborAttempts(SolverProperties.readInt(SOLVER, "neighborAttempts", 5))
                .maxNoImprove(SolverProperties.readInt(SOLVER, "maxNoImprove", 50))
                .restartEnabled(SolverProperties.readBoolean(SOLVER, "restartEnabled", true))
                .maxRestarts(SolverProperties.readInt(SOLVER, "maxRestarts", 3))
                .reheatFraction(SolverProperties.readDouble(SOLVER, "reheatFraction", 0.7d))
                .reliabilityScale(SolverProperties.readDouble(SOLVER, "reliabilityScale", 1.0d))
                .seed(SolverProperties.readSeed(SOLVER))
                .build();
    }

    /**
     * @throws IllegalArgumentException when a field is out of range.
     */
    public AnnealingParams validate() {
        require(Double.isFinite(initialTemperature) && initialTemperature > 0.0d, "initialTemperature must be > 0");
        require(finalTemperature > 0.0d && finalTemperature < initialTemperature,
                "finalTemperature must be in (0, initialTemperature)");
        require(isCoolingFactor(phaseOneAlpha), "phaseOneAlpha must be in (0, 1)");
        require(isCoolingFactor(phaseTwoAlpha), "phaseTwoAlpha must be in (0, 1)");
        require(phaseThreshold >= 0, "phaseThreshold must be >= 0");
        require(markovLength > 0, "markovLength must be > 0");
        require(tabuSize >= 0, "tabuSize must be >= 0");
        require(isProbability(tabuRejectionProbability), "tabuRejectionProbability must be in [0, 1]");
        require(isProbability(strategyDiversityProbability), "strategyDiversityProbability must be in [0, 1]");
        require(neighborAttempts > 0, "neighborAttempts must be > 0");
        require(maxNoImprove >= 0, "maxNoImprove must be >= 0");
        require(maxRestarts >= 0, "maxRestarts must be >= 0");
        require(reheatFraction > 0.0d && reheatFraction <= 1.0d, "reheatFraction must be in (0, 1]");
        require(Double.isFinite(reliabilityScale) && reliabilityScale > 0.0d, "reliabilityScale must be > 0");
        return this;
    }

    private static boolean isCoolingFactor(double alpha) {
        return alpha > 0.0d && alpha < 1.0d;
    }

    private static boolean isProbability(double p) {
        return p >= 0.0d && p <= 1.0d;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
