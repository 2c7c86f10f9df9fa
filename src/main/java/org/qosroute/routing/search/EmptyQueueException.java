package org.qosroute.routing.search;

/**
 * Thrown when attempting to extract from an empty {@link NodeQueue}.
 */
public class EmptyQueueException extends IllegalStateException {
    public EmptyQueueException(String message) {
        super(message);
    }
}
