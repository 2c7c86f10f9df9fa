package org.qosroute.routing.core;

/**
 * One routing request in external node id space.
 *
 * @param source external id of the origin node.
 * @param target external id of the destination node.
 * @param bandwidth minimum bandwidth every link must offer (Mbps).
 */
public record Demand(int source, int target, double bandwidth) {

    public static Demand of(int source, int target, double bandwidth) {
        return new Demand(source, target, bandwidth);
    }
}
