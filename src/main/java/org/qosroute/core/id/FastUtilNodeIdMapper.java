package org.qosroute.core.id;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Node id translation layer backed by FastUtil.
 * <p>
 * Forward lookups go through a primitive open-addressing map, reverse lookups through a
 * plain array. Immutable and safe for concurrent reads.
 */
public class FastUtilNodeIdMapper implements NodeIdMapper {

    private static final int MISSING = -1;

    // external id -> internal index
    private final Int2IntOpenHashMap forward;
    // internal index -> external id
    private final int[] reverse;

    /**
     * Builds the mapper from external ids listed in internal-index order.
     * Rejects duplicate external ids.
     */
    public FastUtilNodeIdMapper(IntList externalIds) {
        if (externalIds == null) {
            throw new IllegalArgumentException("externalIds cannot be null");
        }
        int size = externalIds.size();
        this.forward = new Int2IntOpenHashMap(size);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new int[size];

        for (int i = 0; i < size; i++) {
            int externalId = externalIds.getInt(i);
            if (forward.containsKey(externalId)) {
                throw new IllegalArgumentException("Duplicate external node id: " + externalId);
            }
            forward.put(externalId, i);
            reverse[i] = externalId;
        }
        this.forward.trim();
    }

    @Override
    public int toInternal(int externalId) throws UnknownNodeException {
        int id = forward.get(externalId);
        if (id == MISSING) {
            throw new UnknownNodeException("External node id not found: " + externalId);
        }
        return id;
    }

    @Override
    public int toExternal(int internalId) {
        if (!containsInternal(internalId)) {
            throw new IndexOutOfBoundsException("Internal node index out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public boolean containsExternal(int externalId) {
        return forward.containsKey(externalId);
    }

    @Override
    public boolean containsInternal(int internalId) {
        return internalId >= 0 && internalId < reverse.length;
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
