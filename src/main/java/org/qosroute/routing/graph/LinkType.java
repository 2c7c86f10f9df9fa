package org.qosroute.routing.graph;

/**
 * Physical link category.
 *
 * <p>Carried for topology providers and reporting only; search never reads it.</p>
 */
public enum LinkType {
    FIBER,
    MICROWAVE,
    SATELLITE,
    UNSPECIFIED
}
