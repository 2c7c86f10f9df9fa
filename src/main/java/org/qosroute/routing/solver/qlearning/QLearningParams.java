package org.qosroute.routing.solver.qlearning;

import lombok.Builder;
import lombok.Value;
import org.qosroute.routing.solver.SolverParameters;
import org.qosroute.routing.solver.SolverProperties;

/**
 * Learning and reward settings of {@link QLearningSolver}.
 */
@Value
@Builder(toBuilder = true)
public class QLearningParams implements SolverParameters {
    static final String SOLVER = "qlearning";

    /** Step size {@code alpha}. */
    double learningRate;
    /** Discount {@code gamma}. */
    double discountFactor;
    double epsilonStart;
    double epsilonEnd;
    int episodes;
    int maxSteps;
    /** Immediate reward of a non-terminal transition. */
    double stepReward;
    /** Terminal reward when a traversed link is below the bandwidth demand. */
    double bandwidthPenalty;
    /** Reward of an episode that never reached the target. */
    double unreachedReward;
    /** {@code N} in the terminal reward {@code N / (1 + cost) - lengthPenalty * nodes}. */
    double rewardNumerator;
    double lengthPenalty;
    double reliabilityScale;
    /** Clear the table at the start of every {@code solve} call. */
    boolean resetTableEachRun;
    Long seed;

    public static QLearningParams defaults() {
        return QLearningParams.builder()
                .learningRate(SolverProperties.readDouble(SOLVER, "learningRate", 0.1d))
                .discountFactor(SolverProperties.readDouble(SOLVER, "discountFactor", 0.9d))
                .epsilonStart(SolverProperties.readDouble(SOLVER, "epsilonStart", 0.9d))
                .epsilonEnd(SolverProperties.readDouble(SOLVER, "epsilonEnd", 0.05d))
                .episodes(SolverProperties.readInt(SOLVER, "episodes", 500))
                .maxSteps(SolverProperties.readInt(SOLVER, "maxSteps", 100))
                .stepReward(SolverProperties.readDouble(SOLVER, "stepReward", -0.1d))
                .bandwidthPenalty(SolverProperties.readDouble(SOLVER, "bandwidthPenalty", -500.0d))
                .unreachedReward(SolverProperties.readDouble(SOLVER, "unreachedReward", -1000.0d))
                .rewardNumerator(SolverProperties.readDouble(SOLVER, "rewardNumerator", 1000.0d))
                .lengthPenalty(SolverProperties.readDouble(SOLVER, "lengthPenalty", 0.1d))
                .reliabilityScale(SolverProperties.readDouble(SOLVER, "reliabilityScale", 100.0d))
                .resetTableEachRun(SolverProperties.readBoolean(SOLVER, "resetTableEachRun", true))
                .seed(SolverProperties.readSeed(SOLVER))
                .build();
    }

    /**
     * @throws IllegalArgumentException when a field is out of range.
     */
    public QLearningParams validate() {
        require(learningRate > 0.0d && learningRate <= 1.0d, "learningRate must be in (0, 1]");
        require(discountFactor >= 0.0d && discountFactor <= 1.0d, "discountFactor must be in [0, 1]");
        require(epsilonStart >= 0.0d && epsilonStart <= 1.0d && epsilonEnd >= 0.0d && epsilonEnd <= epsilonStart,
                "epsilon must satisfy 0 <= epsilonEnd <= epsilonStart <= 1");
        require(episodes > 0 && maxSteps > 0, "episodes and maxSteps must be > 0");
        require(Double.isFinite(stepReward) && Double.isFinite(bandwidthPenalty) && Double.isFinite(unreachedReward),
                "rewards must be finite");
        require(rewardNumerator > 0.0d && lengthPenalty >= 0.0d && reliabilityScale > 0.0d,
                "rewardNumerator and reliabilityScale must be > 0, lengthPenalty >= 0");
        return this;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
