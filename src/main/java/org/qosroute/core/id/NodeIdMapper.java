package org.qosroute.core.id;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.experimental.StandardException;

/**
 * Bidirectional mapping contract between external integer node ids and internal dense indices.
 */
public interface NodeIdMapper {

    /**
     * Converts an external node id to an internal index.
     * @param externalId The client-facing node id.
     * @return The internal index.
     * @throws UnknownNodeException If the id is not mapped.
     */
    int toInternal(int externalId) throws UnknownNodeException;

    /**
     * Converts an internal index to its external node id.
     * @param internalId The internal engine index.
     * @return The client-facing node id.
     * @throws IndexOutOfBoundsException If the internal index is invalid.
     */
    int toExternal(int internalId);

    /**
     * Checks whether an external id has a mapped internal index.
     *
     * @param externalId external id to test.
     * @return true when the external id is present.
     */
    boolean containsExternal(int externalId);

    /**
     * Checks whether an internal index is within mapper bounds.
     *
     * @param internalId internal index to test.
     * @return true when the index is present.
     */
    boolean containsInternal(int internalId);

    /**
     * Returns number of id pairs in the mapping.
     *
     * @return total mapping size.
     */
    int size();

    /**
     * Exception thrown when an external node id cannot be found in the mapping.
     */
    @StandardException
    class UnknownNodeException extends RuntimeException {
    }

    /**
     * Factory method for the default immutable implementation.
     *
     * @param externalIds external ids in internal-index order; entry {@code i} maps to index {@code i}.
     * @return An immutable mapper instance.
     */
    static NodeIdMapper createImmutable(IntList externalIds) {
        return new FastUtilNodeIdMapper(externalIds);
    }
}
