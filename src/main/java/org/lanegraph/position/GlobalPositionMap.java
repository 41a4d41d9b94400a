package org.lanegraph.position;

import it.unimi.dsi.fastutil.doubles.DoubleOpenHashSet;
import it.unimi.dsi.fastutil.objects.Object2DoubleLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2DoubleMap;
import it.unimi.dsi.fastutil.objects.Object2DoubleOpenHashMap;
import org.lanegraph.core.sentinel.Sentinels;
import org.lanegraph.network.Edge;
import org.lanegraph.network.LaneRef;
import org.lanegraph.network.NetworkTopology;
import org.lanegraph.network.TopologyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Linearizes a {@link NetworkTopology} onto one global coordinate axis.
 * <p>
 * Construction order:
 * </p>
 * <ol>
 * <li>Non-internal edges: taken from {@link EdgeStartHints#getEdgeStarts()} or, when absent,
 * laid end to end in lexicographic id order.</li>
 * <li>Internal links: hinted internal starts, then hinted intersection starts, then starts
 * derived from connectivity ({@code start(pred) + length(pred)}) for links with no hint.
 * Entries are de-duplicated by offset, first writer wins.</li>
 * <li>Reverse table: non-internal entries first, then internal ones, again first writer wins
 * per offset, then sorted ascending. Zero-length entries are left out, as are internal starts
 * that fall inside a non-internal edge's span.</li>
 * </ol>
 * <p>
 * Within an edge, local position {@code p} maps to {@code start + p}. For every non-internal
 * edge {@code e} with a distinct start and {@code p in [0, length(e))},
 * {@code toLocal(toGlobal(e, p))} returns {@code (e, p)}.
 * </p>
 * <p>
 * Immutable after construction; safe to share across sessions.
 * </p>
 */
public final class GlobalPositionMap {
    private static final Logger log = LoggerFactory.getLogger(GlobalPositionMap.class);

    public static final String REASON_UNKNOWN_HINT_EDGE = "P01_UNKNOWN_HINT_EDGE";
    public static final String REASON_INVALID_OFFSET = "P02_INVALID_OFFSET";
    public static final String REASON_INTERNAL_HINT_FOR_EDGE = "P03_INTERNAL_HINT_FOR_EDGE";

    private final NetworkTopology topology;
    private final Object2DoubleOpenHashMap<String> edgeOffsets;
    private final Object2DoubleLinkedOpenHashMap<String> internalOffsets;
    // first derived child offset per junction id, used only by the parent fallback
    private final Object2DoubleOpenHashMap<String> junctionOffsets;

    private final String[] sortedIds;
    private final double[] sortedOffsets;

    private GlobalPositionMap(
            NetworkTopology topology,
            Object2DoubleOpenHashMap<String> edgeOffsets,
            Object2DoubleLinkedOpenHashMap<String> internalOffsets,
            Object2DoubleOpenHashMap<String> junctionOffsets,
            String[] sortedIds,
            double[] sortedOffsets
    ) {
        this.topology = topology;
        this.edgeOffsets = edgeOffsets;
        this.internalOffsets = internalOffsets;
        this.junctionOffsets = junctionOffsets;
        this.sortedIds = sortedIds;
        this.sortedOffsets = sortedOffsets;
    }

    /**
     * Builds a fully derived map (no external hints).
     */
    public static GlobalPositionMap build(NetworkTopology topology) {
        return build(topology, EdgeStartHints.none());
    }

    /**
     * Builds the offset tables for a topology.
     *
     * @param topology immutable network.
     * @param hints optional externally supplied starts.
     * @return immutable position map.
     * @throws TopologyException when a hint names an unknown edge or a non-finite offset.
     */
    public static GlobalPositionMap build(NetworkTopology topology, EdgeStartHints hints) {
        Objects.requireNonNull(topology, "topology");
        Objects.requireNonNull(hints, "hints");

        Object2DoubleOpenHashMap<String> edgeOffsets = new Object2DoubleOpenHashMap<>();
        edgeOffsets.defaultReturnValue(Double.NaN);
        List<EdgeStart> edgeEntries = hints.hasEdgeStarts()
                ? validatedEdgeStarts(topology, hints.getEdgeStarts())
                : derivedEdgeStarts(topology);
        for (EdgeStart start : edgeEntries) {
            edgeOffsets.putIfAbsent(start.edgeId(), start.offset());
        }
        if (edgeOffsets.size() < topology.getEdgeList().size()) {
            log.warn("{} non-internal edge(s) have no start offset; toGlobal returns {} for them",
                    topology.getEdgeList().size() - edgeOffsets.size(), Sentinels.UNKNOWN_EDGE);
        }

        // internal hints then intersection hints, first occurrence per offset wins
        List<EdgeStart> internalCandidates = new ArrayList<>(hints.getInternalEdgeStarts());
        internalCandidates.addAll(hints.getIntersectionEdgeStarts());
        for (EdgeStart start : internalCandidates) {
            requireFinite(start);
        }
        Set<String> hinted = new HashSet<>();
        for (EdgeStart start : internalCandidates) {
            hinted.add(start.edgeId());
        }

        Object2DoubleOpenHashMap<String> junctionOffsets = new Object2DoubleOpenHashMap<>();
        junctionOffsets.defaultReturnValue(Double.NaN);
        Map<String, Double> derived = deriveInternalStarts(topology, edgeOffsets);
        for (Map.Entry<String, Double> entry : derived.entrySet()) {
            Edge edge = topology.edge(entry.getKey());
            if (edge.parentId() != null) {
                junctionOffsets.putIfAbsent(edge.parentId(), entry.getValue().doubleValue());
            }
            if (!hinted.contains(entry.getKey())) {
                internalCandidates.add(EdgeStart.of(entry.getKey(), entry.getValue()));
            }
        }

        Object2DoubleLinkedOpenHashMap<String> internalOffsets = new Object2DoubleLinkedOpenHashMap<>();
        internalOffsets.defaultReturnValue(Double.NaN);
        DoubleOpenHashSet seenInternal = new DoubleOpenHashSet();
        for (EdgeStart start : internalCandidates) {
            if (internalOffsets.containsKey(start.edgeId())) {
                continue;
            }
            if (seenInternal.add(start.offset())) {
                internalOffsets.put(start.edgeId(), start.offset());
            } else {
                log.debug("Dropping internal start {} at {}: offset already claimed", start.edgeId(), start.offset());
            }
        }

        // combined reverse table; zero-length entries own no coordinate
        List<EdgeStart> combined = new ArrayList<>(edgeEntries.size() + internalOffsets.size());
        DoubleOpenHashSet seen = new DoubleOpenHashSet();
        Set<String> seenIds = new HashSet<>();
        for (EdgeStart start : edgeEntries) {
            if (seenIds.add(start.edgeId())
                    && topology.edgeLength(start.edgeId()) > 0.0d
                    && seen.add(start.offset())) {
                combined.add(start);
            }
        }
        EdgeSpans spans = EdgeSpans.of(topology, combined);
        for (Object2DoubleMap.Entry<String> entry : internalOffsets.object2DoubleEntrySet()) {
            String id = entry.getKey();
            double offset = entry.getDoubleValue();
            if (!seenIds.add(id)) {
                continue;
            }
            Edge edge = topology.edge(id);
            if (edge != null && edge.length() <= 0.0d) {
                continue;
            }
            if (spans.covers(offset)) {
                // still resolvable through toGlobal, but the coordinate belongs to the edge
                log.debug("Keeping internal start {} at {} out of the reverse table: inside an edge", id, offset);
                continue;
            }
            if (seen.add(offset)) {
                combined.add(EdgeStart.of(id, offset));
            }
        }
        combined.sort((a, b) -> Double.compare(a.offset(), b.offset()));

        String[] sortedIds = new String[combined.size()];
        double[] sortedOffsets = new double[combined.size()];
        for (int i = 0; i < combined.size(); i++) {
            sortedIds[i] = combined.get(i).edgeId();
            sortedOffsets[i] = combined.get(i).offset();
        }

        edgeOffsets.trim();
        internalOffsets.trim();
        GlobalPositionMap map = new GlobalPositionMap(
                topology, edgeOffsets, internalOffsets, junctionOffsets, sortedIds, sortedOffsets);
        log.info("Built global position map: {} edge start(s), {} internal start(s), {} reverse entries",
                edgeOffsets.size(), internalOffsets.size(), sortedIds.length);
        return map;
    }

    // ========================================================================
    // CONVERSIONS
    // ========================================================================

    /**
     * Converts an edge-local position to the global axis.
     *
     * @param edgeId edge (possibly internal) the position refers to.
     * @param position local position along that edge.
     * @return global position, or {@link Sentinels#UNKNOWN_EDGE} when the edge is empty,
     * unknown or cannot be resolved.
     */
    public double toGlobal(String edgeId, double position) {
        double start = startOf(edgeId);
        return Double.isNaN(start) ? Sentinels.UNKNOWN_EDGE : start + position;
    }

    /**
     * Returns true when {@link #toGlobal(String, double)} resolves the edge, independent of
     * where its coordinates fall on the axis.
     */
    public boolean hasStart(String edgeId) {
        return !Double.isNaN(startOf(edgeId));
    }

    private double startOf(String edgeId) {
        if (edgeId == null || edgeId.isEmpty()) {
            return Double.NaN;
        }
        Edge edge = topology.edge(edgeId);
        if (edge == null) {
            // hinted junction ids are not edges but still have a start
            return internalOffsets.getDouble(edgeId);
        }
        if (!edge.internal()) {
            return edgeOffsets.getDouble(edgeId);
        }

        double start = internalOffsets.getDouble(edgeId);
        if (!Double.isNaN(start)) {
            return start;
        }
        String parent = edge.parentId();
        if (parent == null) {
            return Double.NaN;
        }
        double parentStart = internalOffsets.getDouble(parent);
        if (Double.isNaN(parentStart)) {
            parentStart = edgeOffsets.getDouble(parent);
        }
        if (Double.isNaN(parentStart)) {
            parentStart = junctionOffsets.getDouble(parent);
        }
        return parentStart;
    }

    /**
     * Converts a global coordinate back to {@code (edge, local position)}: the entry with the
     * greatest start {@code <= globalPosition}.
     *
     * @return local position, or null when the coordinate lies before every start.
     */
    public LocalPosition toLocal(double globalPosition) {
        int idx = Arrays.binarySearch(sortedOffsets, globalPosition);
        if (idx < 0) {
            // insertion point - 1 is the greatest start below the coordinate
            idx = -idx - 2;
        }
        if (idx < 0) {
            return null;
        }
        return new LocalPosition(sortedIds[idx], globalPosition - sortedOffsets[idx]);
    }

    /**
     * Returns the start of an edge or junction, or {@link Sentinels#UNKNOWN_EDGE}.
     */
    public double edgeStart(String edgeId) {
        return toGlobal(edgeId, 0.0d);
    }

    // ========================================================================
    // READ-ONLY EXPORT
    // ========================================================================

    /**
     * Combined reverse-lookup table sorted by ascending offset.
     */
    public List<EdgeStart> offsetTable() {
        List<EdgeStart> table = new ArrayList<>(sortedIds.length);
        for (int i = 0; i < sortedIds.length; i++) {
            table.add(EdgeStart.of(sortedIds[i], sortedOffsets[i]));
        }
        return Collections.unmodifiableList(table);
    }

    /**
     * Internal/junction starts that survived de-duplication, in merge order.
     */
    public Map<String, Double> internalOffsets() {
        Map<String, Double> copy = new LinkedHashMap<>();
        for (Object2DoubleMap.Entry<String> entry : internalOffsets.object2DoubleEntrySet()) {
            copy.put(entry.getKey(), entry.getDoubleValue());
        }
        return Collections.unmodifiableMap(copy);
    }

    public NetworkTopology topology() {
        return topology;
    }

    @Override
    public String toString() {
        return String.format("GlobalPositionMap[edges=%d, internal=%d, entries=%d]",
                edgeOffsets.size(), internalOffsets.size(), sortedIds.length);
    }

    public String toDetailedString() {
        StringBuilder sb = new StringBuilder(toString()).append('\n');
        for (int i = 0; i < sortedIds.length; i++) {
            sb.append(String.format("%12.3f  %s%n", sortedOffsets[i], sortedIds[i]));
        }
        return sb.toString();
    }

    // ========================================================================
    // CONSTRUCTION HELPERS
    // ========================================================================

    private static List<EdgeStart> validatedEdgeStarts(NetworkTopology topology, List<EdgeStart> hints) {
        for (EdgeStart start : hints) {
            requireFinite(start);
            if (!topology.containsEdge(start.edgeId())) {
                throw new TopologyException(REASON_UNKNOWN_HINT_EDGE,
                        "edge start hint references unknown edge " + start.edgeId());
            }
            if (topology.isInternal(start.edgeId())) {
                throw new TopologyException(REASON_INTERNAL_HINT_FOR_EDGE,
                        "edge start hint " + start.edgeId() + " is an internal link; use internal edge starts");
            }
        }
        return List.copyOf(hints);
    }

    private static List<EdgeStart> derivedEdgeStarts(NetworkTopology topology) {
        List<EdgeStart> starts = new ArrayList<>(topology.getEdgeList().size());
        double length = 0.0d;
        for (String edgeId : new TreeSet<>(topology.getEdgeList())) {
            // each edge starts where the previous one ended
            starts.add(EdgeStart.of(edgeId, length));
            length += topology.edgeLength(edgeId);
        }
        return starts;
    }

    /**
     * Derives a start for each internal link from its first predecessor, walking back
     * through chains of internal links. Links with no resolvable predecessor are omitted.
     */
    private static Map<String, Double> deriveInternalStarts(
            NetworkTopology topology,
            Object2DoubleOpenHashMap<String> edgeOffsets
    ) {
        Map<String, Double> derived = new LinkedHashMap<>();
        for (String internalId : topology.getJunctionList()) {
            double start = deriveStart(topology, edgeOffsets, internalId, new HashSet<>());
            if (!Double.isNaN(start)) {
                derived.put(internalId, start);
            }
        }
        return derived;
    }

    private static double deriveStart(
            NetworkTopology topology,
            Object2DoubleOpenHashMap<String> edgeOffsets,
            String internalId,
            Set<String> visiting
    ) {
        if (!visiting.add(internalId)) {
            return Double.NaN;
        }
        int lanes = topology.numLanes(internalId);
        for (int lane = 0; lane < lanes; lane++) {
            for (LaneRef pred : topology.prevEdge(internalId, lane)) {
                double predStart = topology.isInternal(pred.edgeId())
                        ? deriveStart(topology, edgeOffsets, pred.edgeId(), visiting)
                        : edgeOffsets.getDouble(pred.edgeId());
                if (!Double.isNaN(predStart)) {
                    return predStart + topology.edgeLength(pred.edgeId());
                }
            }
        }
        return Double.NaN;
    }

    /**
     * Half-open {@code [start, start + length)} spans of the non-internal reverse entries.
     * {@code maxEnds[i]} is the furthest end among the first {@code i + 1} spans, so a single
     * binary search answers coverage even when hinted spans overlap.
     */
    private static final class EdgeSpans {
        private final double[] starts;
        private final double[] maxEnds;

        private EdgeSpans(double[] starts, double[] maxEnds) {
            this.starts = starts;
            this.maxEnds = maxEnds;
        }

        static EdgeSpans of(NetworkTopology topology, List<EdgeStart> entries) {
            List<EdgeStart> ordered = new ArrayList<>(entries);
            ordered.sort((a, b) -> Double.compare(a.offset(), b.offset()));
            double[] starts = new double[ordered.size()];
            double[] maxEnds = new double[ordered.size()];
            double furthest = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < ordered.size(); i++) {
                EdgeStart start = ordered.get(i);
                starts[i] = start.offset();
                furthest = Math.max(furthest, start.offset() + topology.edgeLength(start.edgeId()));
                maxEnds[i] = furthest;
            }
            return new EdgeSpans(starts, maxEnds);
        }

        boolean covers(double offset) {
            int idx = Arrays.binarySearch(starts, offset);
            if (idx < 0) {
                idx = -idx - 2;
            }
            return idx >= 0 && offset < maxEnds[idx];
        }
    }

    private static void requireFinite(EdgeStart start) {
        if (!Double.isFinite(start.offset())) {
            throw new TopologyException(REASON_INVALID_OFFSET,
                    "start offset of " + start.edgeId() + " must be finite, got " + start.offset());
        }
    }
}
