package org.qosroute.routing.graph;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.qosroute.core.id.NodeIdMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * Immutable undirected QoS network graph.
 * <p>
 * Layout:
 * <ul>
 * <li>SoA (Structure of Arrays) attribute storage for nodes and links.</li>
 * <li>CSR (Compressed Sparse Row) adjacency; every undirected link is stored as two arcs
 * that share one link id.</li>
 * <li>Dense internal node indices, translated to caller ids by {@link NodeIdMapper}.</li>
 * </ul>
 * Instances never change after {@link Builder#build()} and may be shared across threads.
 */
public final class NetworkGraph {
    public static final String REASON_DUPLICATE_NODE = "G1_DUPLICATE_NODE";
    public static final String REASON_UNKNOWN_NODE = "G1_UNKNOWN_NODE";
    public static final String REASON_SELF_LOOP = "G1_SELF_LOOP";
    public static final String REASON_DUPLICATE_LINK = "G1_DUPLICATE_LINK";
    public static final String REASON_INVALID_ATTRIBUTE = "G1_INVALID_ATTRIBUTE";

    public static final int NO_LINK = -1;

    // ========================================================================
    // NODE ATTRIBUTES
    // ========================================================================
    private final double[] procDelay;
    private final double[] nodeReliability;

    // ========================================================================
    // LINK ATTRIBUTES
    // ========================================================================
    private final int[] linkEndpointA;
    private final int[] linkEndpointB;
    private final double[] bandwidth;
    private final double[] linkDelay;
    private final double[] linkReliability;
    private final LinkType[] linkType;

    // ========================================================================
    // CSR ADJACENCY
    // ========================================================================
    // firstArc[node] -> start index in arc arrays, firstArc[nodeCount] == arcCount
    private final int[] firstArc;
    private final int[] arcTarget;
    private final int[] arcLink;

    @Getter
    @Accessors(fluent = true)
    private final NodeIdMapper nodeIdMapper;
    @Getter
    @Accessors(fluent = true)
    private final int nodeCount;
    @Getter
    @Accessors(fluent = true)
    private final int linkCount;

    private NetworkGraph(
            NodeIdMapper nodeIdMapper,
            double[] procDelay,
            double[] nodeReliability,
            int[] linkEndpointA,
            int[] linkEndpointB,
            double[] bandwidth,
            double[] linkDelay,
            double[] linkReliability,
            LinkType[] linkType
    ) {
        this.nodeIdMapper = nodeIdMapper;
        this.nodeCount = procDelay.length;
        this.linkCount = linkEndpointA.length;
        this.procDelay = procDelay;
        this.nodeReliability = nodeReliability;
        this.linkEndpointA = linkEndpointA;
        this.linkEndpointB = linkEndpointB;
        this.bandwidth = bandwidth;
        this.linkDelay = linkDelay;
        this.linkReliability = linkReliability;
        this.linkType = linkType;

        this.firstArc = new int[nodeCount + 1];
        this.arcTarget = new int[linkCount * 2];
        this.arcLink = new int[linkCount * 2];
        buildAdjacency();
    }

    /**
     * Counting-sort pass that lays out both arcs of every link in CSR order.
     * Arcs of one node keep link insertion order, which keeps every search deterministic.
     */
    private void buildAdjacency() {
        for (int link = 0; link < linkCount; link++) {
            firstArc[linkEndpointA[link] + 1]++;
            firstArc[linkEndpointB[link] + 1]++;
        }
        for (int node = 0; node < nodeCount; node++) {
            firstArc[node + 1] += firstArc[node];
        }
        int[] cursor = new int[nodeCount];
        System.arraycopy(firstArc, 0, cursor, 0, nodeCount);
        for (int link = 0; link < linkCount; link++) {
            int a = linkEndpointA[link];
            int b = linkEndpointB[link];
            int arcA = cursor[a]++;
            arcTarget[arcA] = b;
            arcLink[arcA] = link;
            int arcB = cursor[b]++;
            arcTarget[arcB] = a;
            arcLink[arcB] = link;
        }
    }

    /**
     * Creates an empty graph builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // NODE ACCESSORS
    // ========================================================================

    public double procDelay(int node) {
        checkNode(node);
        return procDelay[node];
    }

    public double nodeReliability(int node) {
        checkNode(node);
        return nodeReliability[node];
    }

    public int degree(int node) {
        checkNode(node);
        return firstArc[node + 1] - firstArc[node];
    }

    /**
     * Returns a fresh copy of the neighbor indices of {@code node} in CSR order.
     */
    public int[] neighbors(int node) {
        checkNode(node);
        int start = firstArc[node];
        int end = firstArc[node + 1];
        int[] result = new int[end - start];
        System.arraycopy(arcTarget, start, result, 0, result.length);
        return result;
    }

    // ========================================================================
    // LINK ACCESSORS
    // ========================================================================

    public double bandwidth(int link) {
        checkLink(link);
        return bandwidth[link];
    }

    public double linkDelay(int link) {
        checkLink(link);
        return linkDelay[link];
    }

    public double linkReliability(int link) {
        checkLink(link);
        return linkReliability[link];
    }

    public LinkType linkType(int link) {
        checkLink(link);
        return linkType[link];
    }

    public int linkEndpointA(int link) {
        checkLink(link);
        return linkEndpointA[link];
    }

    public int linkEndpointB(int link) {
        checkLink(link);
        return linkEndpointB[link];
    }

    /**
     * Finds the link joining {@code u} and {@code v}.
     * Time Complexity: O(min(deg(u), deg(v)))
     *
     * @return link id, or {@link #NO_LINK} when the nodes are not adjacent.
     */
    public int findLink(int u, int v) {
        checkNode(u);
        checkNode(v);
        int from = u;
        int to = v;
        if (degree(v) < degree(u)) {
            from = v;
            to = u;
        }
        for (int arc = firstArc[from]; arc < firstArc[from + 1]; arc++) {
            if (arcTarget[arc] == to) {
                return arcLink[arc];
            }
        }
        return NO_LINK;
    }

    public boolean hasLink(int u, int v) {
        return findLink(u, v) != NO_LINK;
    }

    // ========================================================================
    // TRAVERSAL
    // ========================================================================

    /**
     * Returns a reusable arc iterator. Not thread-safe; create one per search.
     */
    public ArcIterator arcs() {
        return new ArcIterator(this);
    }

    /**
     * Zero-allocation cursor over the arcs leaving one node.
     */
    public static final class ArcIterator {
        private final NetworkGraph graph;
        private int current;
        private int end;

        ArcIterator(NetworkGraph graph) {
            this.graph = graph;
        }

        /**
         * Positions the cursor on the arcs leaving {@code node}.
         */
        public ArcIterator resetForNode(int node) {
            graph.checkNode(node);
            this.current = graph.firstArc[node];
            this.end = graph.firstArc[node + 1];
            return this;
        }

        public boolean hasNext() {
            return current < end;
        }

        /**
         * Advances to the next arc and returns its index.
         */
        public int next() {
            if (current >= end) throw new NoSuchElementException();
            return current++;
        }

        public int target(int arc) {
            return graph.arcTarget[arc];
        }

        public int link(int arc) {
            return graph.arcLink[arc];
        }
    }

    // ========================================================================
    // DERIVED GRAPHS
    // ========================================================================

    /**
     * Returns a graph with the same nodes (same indices and ids) and only the links accepted
     * by {@code keepLink}. Kept links are renumbered densely in their existing order.
     */
    NetworkGraph retainLinks(IntPredicate keepLink) {
        IntArrayList kept = new IntArrayList(linkCount);
        for (int link = 0; link < linkCount; link++) {
            if (keepLink.test(link)) {
                kept.add(link);
            }
        }
        int size = kept.size();
        int[] a = new int[size];
        int[] b = new int[size];
        double[] bw = new double[size];
        double[] delay = new double[size];
        double[] rel = new double[size];
        LinkType[] types = new LinkType[size];
        for (int i = 0; i < size; i++) {
            int link = kept.getInt(i);
            a[i] = linkEndpointA[link];
            b[i] = linkEndpointB[link];
            bw[i] = bandwidth[link];
            delay[i] = linkDelay[link];
            rel[i] = linkReliability[link];
            types[i] = linkType[link];
        }
        return new NetworkGraph(nodeIdMapper, procDelay, nodeReliability, a, b, bw, delay, rel, types);
    }

    private void checkNode(int node) {
        if (node < 0 || node >= nodeCount) {
            throw new IndexOutOfBoundsException("Node " + node + " out of bounds [0, " + nodeCount + ")");
        }
    }

    private void checkLink(int link) {
        if (link < 0 || link >= linkCount) {
            throw new IndexOutOfBoundsException("Link " + link + " out of bounds [0, " + linkCount + ")");
        }
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    /**
     * Incremental graph builder keyed by external node ids.
     * <p>
     * Nodes must be added before the links that reference them. Reliability values of zero are
     * accepted; the cost model clamps them instead of failing.
     */
    public static final class Builder {
        private final IntArrayList nodeIds = new IntArrayList();
        private final DoubleArrayList procDelays = new DoubleArrayList();
        private final DoubleArrayList nodeReliabilities = new DoubleArrayList();
        private final Int2IntOpenHashMap indexById = new Int2IntOpenHashMap();

        private final IntArrayList linkA = new IntArrayList();
        private final IntArrayList linkB = new IntArrayList();
        private final DoubleArrayList bandwidths = new DoubleArrayList();
        private final DoubleArrayList delays = new DoubleArrayList();
        private final DoubleArrayList linkReliabilities = new DoubleArrayList();
        private final List<LinkType> linkTypes = new ArrayList<>();
        private final LongOpenHashSet linkKeys = new LongOpenHashSet();

        private Builder() {
            indexById.defaultReturnValue(-1);
        }

        /**
         * Adds one node.
         *
         * @param nodeId external node id.
         * @param procDelay processing delay in ms (finite, >= 0).
         * @param reliability node reliability in [0, 1].
         */
        public Builder addNode(int nodeId, double procDelay, double reliability) {
            if (indexById.containsKey(nodeId)) {
                throw new GraphContractException(REASON_DUPLICATE_NODE, "node " + nodeId + " already added");
            }
            requireNonNegative(procDelay, "procDelay of node " + nodeId);
            requireProbability(reliability, "reliability of node " + nodeId);
            indexById.put(nodeId, nodeIds.size());
            nodeIds.add(nodeId);
            procDelays.add(procDelay);
            nodeReliabilities.add(reliability);
            return this;
        }

        /**
         * Adds one undirected link without a link category.
         */
        public Builder addLink(int fromNodeId, int toNodeId, double bandwidth, double linkDelay, double reliability) {
            return addLink(fromNodeId, toNodeId, bandwidth, linkDelay, reliability, LinkType.UNSPECIFIED);
        }

        /**
         * Adds one undirected link.
         *
         * @param fromNodeId external id of one endpoint.
         * @param toNodeId external id of the other endpoint.
         * @param bandwidth capacity in Mbps (finite, >= 0).
         * @param linkDelay propagation delay in ms (finite, >= 0).
         * @param reliability link reliability in [0, 1].
         * @param type link category tag.
         */
        public Builder addLink(
                int fromNodeId,
                int toNodeId,
                double bandwidth,
                double linkDelay,
                double reliability,
                LinkType type
        ) {
            int a = requireKnownNode(fromNodeId);
            int b = requireKnownNode(toNodeId);
            if (a == b) {
                throw new GraphContractException(REASON_SELF_LOOP, "self-loop on node " + fromNodeId);
            }
            String label = "link " + fromNodeId + "-" + toNodeId;
            requireNonNegative(bandwidth, "bandwidth of " + label);
            requireNonNegative(linkDelay, "delay of " + label);
            requireProbability(reliability, "reliability of " + label);
            Objects.requireNonNull(type, "type");
            long key = ((long) Math.min(a, b) << 32) | (Math.max(a, b) & 0xFFFFFFFFL);
            if (!linkKeys.add(key)) {
                throw new GraphContractException(REASON_DUPLICATE_LINK, label + " already added");
            }

            linkA.add(a);
            linkB.add(b);
            bandwidths.add(bandwidth);
            delays.add(linkDelay);
            linkReliabilities.add(reliability);
            linkTypes.add(type);
            return this;
        }

        /**
         * Freezes the builder contents into an immutable graph.
         */
        public NetworkGraph build() {
            return new NetworkGraph(
                    NodeIdMapper.createImmutable(new IntArrayList(nodeIds)),
                    procDelays.toDoubleArray(),
                    nodeReliabilities.toDoubleArray(),
                    linkA.toIntArray(),
                    linkB.toIntArray(),
                    bandwidths.toDoubleArray(),
                    delays.toDoubleArray(),
                    linkReliabilities.toDoubleArray(),
                    linkTypes.toArray(new LinkType[0])
            );
        }

        private int requireKnownNode(int nodeId) {
            int index = indexById.get(nodeId);
            if (index < 0) {
                throw new GraphContractException(REASON_UNKNOWN_NODE, "link references unknown node " + nodeId);
            }
            return index;
        }

        private static void requireNonNegative(double value, String what) {
            if (!Double.isFinite(value) || value < 0.0d) {
                throw new GraphContractException(REASON_INVALID_ATTRIBUTE, what + " must be finite and >= 0, got " + value);
            }
        }

        private static void requireProbability(double value, String what) {
            if (!Double.isFinite(value) || value < 0.0d || value > 1.0d) {
                throw new GraphContractException(REASON_INVALID_ATTRIBUTE, what + " must be in [0, 1], got " + value);
            }
        }
    }
}
