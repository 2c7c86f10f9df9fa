package org.qosroute.routing.search;

/**
 * Solver-local weight lookup for one traversal of a link.
 * <p>
 * Implementations must return finite, non-negative weights and must not depend on mutable
 * state of the graph being searched.
 */
@FunctionalInterface
public interface LinkWeightFunction {

    /**
     * @param link link id in the searched graph.
     * @param from node the arc leaves.
     * @param to node the arc enters.
     * @return traversal weight.
     */
    double weight(int link, int from, int to);
}
