package org.qosroute.routing.solver.swarm;

import java.util.Random;

/**
 * One swarm member: a per-node priority vector with its velocity and personal best.
 */
final class Particle {
    final double[] position;
    final double[] velocity;
    final double[] personalBestPosition;
    double personalBestFitness = Double.POSITIVE_INFINITY;

    Particle(int dimension, SwarmParams params, Random random) {
        this.position = new double[dimension];
        this.velocity = new double[dimension];
        for (int i = 0; i < dimension; i++) {
            position[i] = clip(random.nextDouble(), params);
            velocity[i] = (random.nextDouble() * 2.0d - 1.0d) * params.getInitialVelocity();
        }
        this.personalBestPosition = position.clone();
    }

    /**
     * Records {@code fitness} as personal best when it improves on it.
     *
     * @return true when the personal best changed.
     */
    boolean offer(double fitness) {
        if (fitness < personalBestFitness) {
            personalBestFitness = fitness;
            System.arraycopy(position, 0, personalBestPosition, 0, position.length);
            return true;
        }
        return false;
    }

    /**
     * {@code v = w*v + c1*r1*(pbest - x) + c2*r2*(gbest - x)}, then {@code x = clip(x + v)}.
     * {@code r1} and {@code r2} are drawn once per particle.
     */
    void move(double[] globalBestPosition, SwarmParams params, Random random) {
        double r1 = random.nextDouble();
        double r2 = random.nextDouble();
        for (int i = 0; i < position.length; i++) {
            velocity[i] = params.getInertia() * velocity[i]
                    + params.getCognitive() * r1 * (personalBestPosition[i] - position[i])
                    + params.getSocial() * r2 * (globalBestPosition[i] - position[i]);
            position[i] = clip(position[i] + velocity[i], params);
        }
    }

    private static double clip(double value, SwarmParams params) {
        return Math.max(params.getMinPriority(), Math.min(params.getMaxPriority(), value));
    }
}
