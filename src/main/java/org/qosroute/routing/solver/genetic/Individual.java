package org.qosroute.routing.solver.genetic;

/**
 * One member of the population. Fitness is computed once, when the individual is created.
 *
 * @param path simple internal node path.
 * @param fitness cost model fitness of {@code path}.
 */
record Individual(int[] path, double fitness) {
}
