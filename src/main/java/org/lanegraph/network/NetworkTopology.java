package org.lanegraph.network;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.lanegraph.core.id.DenseIdIndex;
import org.lanegraph.core.sentinel.Sentinels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static directed graph of edges, lanes and junction-internal links.
 * <p>
 * Layout follows a structure-of-arrays: every edge owns a dense slot (see
 * {@link DenseIdIndex}) and its length, lane count and speed limit live in parallel
 * primitive arrays. Lane connectivity is pre-materialized into immutable per-lane lists,
 * so {@link #nextEdge(String, int)} and {@link #prevEdge(String, int)} are one hash
 * lookup plus two array reads.
 * </p>
 * <p>
 * Unknown-edge queries return {@link Sentinels#UNKNOWN_EDGE} and unknown lanes return an
 * empty list. Construction problems throw {@link TopologyException}.
 * </p>
 * <p>
 * Instances are immutable and may be shared by concurrently running sessions.
 * </p>
 */
public final class NetworkTopology {
    private static final Logger log = LoggerFactory.getLogger(NetworkTopology.class);

    public static final String DEFAULT_INTERNAL_MARKER = ":";
    public static final double DEFAULT_SPEED_LIMIT = 30.0d;

    public static final String REASON_BLANK_EDGE_ID = "T01_BLANK_EDGE_ID";
    public static final String REASON_DUPLICATE_EDGE = "T02_DUPLICATE_EDGE";
    public static final String REASON_INVALID_LENGTH = "T03_INVALID_LENGTH";
    public static final String REASON_INVALID_LANE_COUNT = "T04_INVALID_LANE_COUNT";
    public static final String REASON_INVALID_SPEED = "T05_INVALID_SPEED";
    public static final String REASON_UNKNOWN_CONNECTION_EDGE = "T06_UNKNOWN_CONNECTION_EDGE";
    public static final String REASON_CONNECTION_LANE_OUT_OF_RANGE = "T07_CONNECTION_LANE_OUT_OF_RANGE";

    private final DenseIdIndex edgeIndex;
    private final Edge[] edges;
    private final double[] lengths;
    private final int[] laneCounts;
    private final double[] speedLimits;

    // [edgeSlot][lane] -> immutable successor / predecessor lanes
    private final List<List<List<LaneRef>>> nextByLane;
    private final List<List<List<LaneRef>>> prevByLane;

    private final List<String> edgeList;
    private final List<String> junctionList;
    private final List<Connection> connections;

    @Getter
    @Accessors(fluent = true)
    private final String internalMarker;

    private final double maxSpeed;
    private final double totalLength;

    private NetworkTopology(
            DenseIdIndex edgeIndex,
            Edge[] edges,
            List<List<List<LaneRef>>> nextByLane,
            List<List<List<LaneRef>>> prevByLane,
            List<Connection> connections,
            String internalMarker
    ) {
        this.edgeIndex = edgeIndex;
        this.edges = edges;
        this.nextByLane = nextByLane;
        this.prevByLane = prevByLane;
        this.connections = connections;
        this.internalMarker = internalMarker;

        int count = edges.length;
        this.lengths = new double[count];
        this.laneCounts = new int[count];
        this.speedLimits = new double[count];

        List<String> edgeIds = new ArrayList<>();
        List<String> junctionIds = new ArrayList<>();
        double maxSpeedAcc = 0.0d;
        double lengthAcc = 0.0d;
        for (int slot = 0; slot < count; slot++) {
            Edge edge = edges[slot];
            lengths[slot] = edge.length();
            laneCounts[slot] = edge.laneCount();
            speedLimits[slot] = edge.speedLimit();
            if (edge.internal()) {
                junctionIds.add(edge.id());
            } else {
                edgeIds.add(edge.id());
                maxSpeedAcc = Math.max(maxSpeedAcc, edge.speedLimit());
                lengthAcc += edge.length();
            }
        }
        this.edgeList = Collections.unmodifiableList(edgeIds);
        this.junctionList = Collections.unmodifiableList(junctionIds);
        this.maxSpeed = maxSpeedAcc;
        this.totalLength = lengthAcc;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // STATIC EDGE FACTS (sentinel-encoded)
    // ========================================================================

    /**
     * Returns the edge length in meters, or {@link Sentinels#UNKNOWN_EDGE}.
     */
    public double edgeLength(String edgeId) {
        int slot = edgeIndex.indexOf(edgeId);
        if (slot == DenseIdIndex.NOT_FOUND) {
            log.trace("edgeLength: unknown edge {}", edgeId);
            return Sentinels.UNKNOWN_EDGE;
        }
        return lengths[slot];
    }

    /**
     * Returns the lane count, or {@link Sentinels#UNKNOWN_EDGE}.
     */
    public int numLanes(String edgeId) {
        int slot = edgeIndex.indexOf(edgeId);
        if (slot == DenseIdIndex.NOT_FOUND) {
            log.trace("numLanes: unknown edge {}", edgeId);
            return Sentinels.UNKNOWN_EDGE;
        }
        return laneCounts[slot];
    }

    /**
     * Returns the speed limit in m/s, or {@link Sentinels#UNKNOWN_EDGE}.
     */
    public double speedLimit(String edgeId) {
        int slot = edgeIndex.indexOf(edgeId);
        if (slot == DenseIdIndex.NOT_FOUND) {
            log.trace("speedLimit: unknown edge {}", edgeId);
            return Sentinels.UNKNOWN_EDGE;
        }
        return speedLimits[slot];
    }

    /**
     * Maximum speed limit over all non-internal edges ({@code 0} for an empty network).
     */
    public double maxSpeed() {
        return maxSpeed;
    }

    /**
     * Sum of non-internal edge lengths.
     */
    public double totalLength() {
        return totalLength;
    }

    /**
     * Returns the edge descriptor, or null when the id is unknown.
     */
    public Edge edge(String edgeId) {
        int slot = edgeIndex.indexOf(edgeId);
        return slot == DenseIdIndex.NOT_FOUND ? null : edges[slot];
    }

    public boolean containsEdge(String edgeId) {
        return edgeIndex.contains(edgeId);
    }

    /**
     * Returns true for junction-internal links. Unknown edges are reported as non-internal.
     */
    public boolean isInternal(String edgeId) {
        int slot = edgeIndex.indexOf(edgeId);
        return slot != DenseIdIndex.NOT_FOUND && edges[slot].internal();
    }

    /**
     * Non-internal edge ids in declaration order.
     */
    public List<String> getEdgeList() {
        return edgeList;
    }

    /**
     * Internal (junction) edge ids in declaration order.
     */
    public List<String> getJunctionList() {
        return junctionList;
    }

    /**
     * All edge ids, internal included, in declaration order.
     */
    public List<String> allEdgeIds() {
        return edgeIndex.ids();
    }

    public int edgeCount() {
        return edges.length;
    }

    public List<Connection> connections() {
        return connections;
    }

    // ========================================================================
    // CONNECTIVITY
    // ========================================================================

    /**
     * Lanes reachable directly from {@code (edgeId, lane)}. Empty when none exist or the
     * edge/lane is unknown.
     */
    public List<LaneRef> nextEdge(String edgeId, int lane) {
        return lookup(nextByLane, edgeId, lane);
    }

    /**
     * Lanes that lead directly into {@code (edgeId, lane)}. Empty when none exist or the
     * edge/lane is unknown.
     */
    public List<LaneRef> prevEdge(String edgeId, int lane) {
        return lookup(prevByLane, edgeId, lane);
    }

    private List<LaneRef> lookup(List<List<List<LaneRef>>> table, String edgeId, int lane) {
        int slot = edgeIndex.indexOf(edgeId);
        if (slot == DenseIdIndex.NOT_FOUND || lane < 0 || lane >= laneCounts[slot]) {
            return List.of();
        }
        return table.get(slot).get(lane);
    }

    // ========================================================================
    // DEBUG
    // ========================================================================

    @Override
    public String toString() {
        return String.format("NetworkTopology[edges=%d, internal=%d, connections=%d, length=%.2f, maxSpeed=%.2f]",
                edgeList.size(), junctionList.size(), connections.size(), totalLength, maxSpeed);
    }

    public String toDetailedString() {
        if (edges.length > 50) return toString() + " (too large to detail)";
        StringBuilder sb = new StringBuilder(toString()).append("\n");
        for (int slot = 0; slot < edges.length; slot++) {
            Edge edge = edges[slot];
            sb.append(String.format("%s%s len=%.2f lanes=%d speed=%.2f:",
                    edge.id(), edge.internal() ? " (internal)" : "", edge.length(), edge.laneCount(),
                    edge.speedLimit()));
            for (int lane = 0; lane < edge.laneCount(); lane++) {
                sb.append(" [").append(lane).append("->").append(nextByLane.get(slot).get(lane)).append(']');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Derives the junction-level id of an internal link by stripping one trailing
     * {@code _<digits>} suffix. Returns null when no such suffix exists.
     */
    static String deriveParentId(String edgeId) {
        int cut = edgeId.lastIndexOf('_');
        if (cut <= 0 || cut == edgeId.length() - 1) {
            return null;
        }
        for (int i = cut + 1; i < edgeId.length(); i++) {
            if (!Character.isDigit(edgeId.charAt(i))) {
                return null;
            }
        }
        return edgeId.substring(0, cut);
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    /**
     * Mutable accumulator for edges and connections. Validation happens eagerly for
     * per-edge facts and in {@link #build()} for cross references.
     */
    public static final class Builder {
        private record PendingEdge(double length, int laneCount, double speedLimit) {
        }

        private final Map<String, PendingEdge> pendingEdges = new LinkedHashMap<>();
        private final Set<Connection> connections = new LinkedHashSet<>();
        private String internalMarker = DEFAULT_INTERNAL_MARKER;

        private Builder() {
        }

        /**
         * Overrides the id prefix that marks junction-internal links (default {@code ":"}).
         */
        public Builder internalMarker(String marker) {
            Objects.requireNonNull(marker, "marker");
            if (marker.isEmpty()) {
                throw new IllegalArgumentException("internal marker must be non-empty");
            }
            this.internalMarker = marker;
            return this;
        }

        /**
         * Declares an edge with the default speed limit.
         */
        public Builder edge(String id, double length, int laneCount) {
            return edge(id, length, laneCount, DEFAULT_SPEED_LIMIT);
        }

        /**
         * Declares an edge.
         *
         * @throws TopologyException on blank/duplicate id, negative length, zero lanes or bad speed.
         */
        public Builder edge(String id, double length, int laneCount, double speedLimit) {
            if (id == null || id.isBlank()) {
                throw new TopologyException(REASON_BLANK_EDGE_ID, "edge id must be non-blank");
            }
            if (pendingEdges.containsKey(id)) {
                throw new TopologyException(REASON_DUPLICATE_EDGE, "edge declared twice: " + id);
            }
            if (!Double.isFinite(length) || length < 0.0d) {
                throw new TopologyException(REASON_INVALID_LENGTH,
                        "edge " + id + " length must be finite and >= 0, got " + length);
            }
            if (laneCount < 1) {
                throw new TopologyException(REASON_INVALID_LANE_COUNT,
                        "edge " + id + " must have at least one lane, got " + laneCount);
            }
            if (!Double.isFinite(speedLimit) || speedLimit < 0.0d) {
                throw new TopologyException(REASON_INVALID_SPEED,
                        "edge " + id + " speed limit must be finite and >= 0, got " + speedLimit);
            }
            pendingEdges.put(id, new PendingEdge(length, laneCount, speedLimit));
            return this;
        }

        public Builder connection(String fromEdge, int fromLane, String toEdge, int toLane) {
            return connection(new Connection(fromEdge, fromLane, toEdge, toLane));
        }

        public Builder connection(Connection connection) {
            connections.add(Objects.requireNonNull(connection, "connection"));
            return this;
        }

        public boolean hasEdge(String id) {
            return pendingEdges.containsKey(id);
        }

        /**
         * Validates cross references and freezes the topology.
         *
         * @throws TopologyException when a connection names an unknown edge or lane.
         */
        public NetworkTopology build() {
            DenseIdIndex index = DenseIdIndex.of(pendingEdges.keySet());
            Edge[] edges = new Edge[index.size()];
            int slot = 0;
            for (Map.Entry<String, PendingEdge> entry : pendingEdges.entrySet()) {
                String id = entry.getKey();
                PendingEdge pending = entry.getValue();
                boolean internal = id.startsWith(internalMarker);
                edges[slot++] = new Edge(
                        id,
                        pending.length(),
                        pending.laneCount(),
                        pending.speedLimit(),
                        internal,
                        internal ? deriveParentId(id) : null
                );
            }

            List<List<List<LaneRef>>> next = emptyLaneTable(edges);
            List<List<List<LaneRef>>> prev = emptyLaneTable(edges);
            for (Connection connection : connections) {
                int fromSlot = requireEdge(index, connection.fromEdge(), connection);
                int toSlot = requireEdge(index, connection.toEdge(), connection);
                requireLane(edges[fromSlot], connection.fromLane(), connection);
                requireLane(edges[toSlot], connection.toLane(), connection);
                next.get(fromSlot).get(connection.fromLane()).add(connection.to());
                prev.get(toSlot).get(connection.toLane()).add(connection.from());
            }

            NetworkTopology topology = new NetworkTopology(
                    index,
                    edges,
                    freeze(next),
                    freeze(prev),
                    List.copyOf(connections),
                    internalMarker
            );
            log.info("Built {}", topology);
            return topology;
        }

        private static int requireEdge(DenseIdIndex index, String edgeId, Connection connection) {
            int slot = index.indexOf(edgeId);
            if (slot == DenseIdIndex.NOT_FOUND) {
                throw new TopologyException(REASON_UNKNOWN_CONNECTION_EDGE,
                        "connection " + connection + " references unknown edge " + edgeId);
            }
            return slot;
        }

        private static void requireLane(Edge edge, int lane, Connection connection) {
            if (lane < 0 || lane >= edge.laneCount()) {
                throw new TopologyException(REASON_CONNECTION_LANE_OUT_OF_RANGE,
                        "connection " + connection + " uses lane " + lane + " of edge " + edge.id()
                                + " which has " + edge.laneCount() + " lane(s)");
            }
        }

        private static List<List<List<LaneRef>>> emptyLaneTable(Edge[] edges) {
            List<List<List<LaneRef>>> table = new ArrayList<>(edges.length);
            for (Edge edge : edges) {
                List<List<LaneRef>> lanes = new ArrayList<>(edge.laneCount());
                for (int lane = 0; lane < edge.laneCount(); lane++) {
                    lanes.add(new ArrayList<>(2));
                }
                table.add(lanes);
            }
            return table;
        }

        private static List<List<List<LaneRef>>> freeze(List<List<List<LaneRef>>> table) {
            List<List<List<LaneRef>>> frozen = new ArrayList<>(table.size());
            for (List<List<LaneRef>> lanes : table) {
                List<List<LaneRef>> frozenLanes = new ArrayList<>(lanes.size());
                for (List<LaneRef> refs : lanes) {
                    frozenLanes.add(List.copyOf(refs));
                }
                frozen.add(Collections.unmodifiableList(frozenLanes));
            }
            return Collections.unmodifiableList(frozen);
        }
    }
}
