package org.lanegraph.vehicle;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectLinkedOpenHashSet;
import lombok.Builder;
import lombok.Singular;
import org.lanegraph.core.sentinel.Sentinels;
import org.lanegraph.position.GlobalPositionMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-session table of vehicle state, refreshed once per simulation step.
 * <p>
 * Besides the id-keyed records the table keeps:
 * </p>
 * <ul>
 * <li>an edge index ({@code edge -> ids}) updated incrementally: a vehicle is moved only
 * when its edge changes,</li>
 * <li>insertion-ordered id views (human, rl, controlled, lane-change controlled, observed),</li>
 * <li>per-step departure/arrival counts for flow-rate queries.</li>
 * </ul>
 * <p>
 * Every accessor takes a caller-supplied default returned for unknown vehicles; none of
 * them throws for a missing id. List overloads apply the same rule element-wise.
 * </p>
 * <p>
 * Not thread-safe. A table belongs to exactly one session.
 * </p>
 */
public final class VehicleStateTable {
    private static final Logger log = LoggerFactory.getLogger(VehicleStateTable.class);

    private final GlobalPositionMap positionMap;
    private final VehicleTableConfig config;
    private final Map<String, VehicleType> types;

    private final Object2ObjectLinkedOpenHashMap<String, VehicleRecord> records = new Object2ObjectLinkedOpenHashMap<>();
    private final Object2ObjectOpenHashMap<String, ObjectLinkedOpenHashSet<String>> idsByEdge = new Object2ObjectOpenHashMap<>();

    private final ObjectLinkedOpenHashSet<String> humanIds = new ObjectLinkedOpenHashSet<>();
    private final ObjectLinkedOpenHashSet<String> rlIds = new ObjectLinkedOpenHashSet<>();
    private final ObjectLinkedOpenHashSet<String> controlledIds = new ObjectLinkedOpenHashSet<>();
    private final ObjectLinkedOpenHashSet<String> controlledLcIds = new ObjectLinkedOpenHashSet<>();
    private final ObjectLinkedOpenHashSet<String> observedIds = new ObjectLinkedOpenHashSet<>();

    private final IntArrayList departedHistory = new IntArrayList();
    private final IntArrayList arrivedHistory = new IntArrayList();
    private int numDeparted;
    private int numArrived;
    private double time;

    /**
     * @param positionMap map used for absolute positions.
     * @param config table settings; defaults when null.
     * @param vehicleTypes registered vehicle classes.
     */
    @Builder
    private VehicleStateTable(
            GlobalPositionMap positionMap,
            VehicleTableConfig config,
            @Singular List<VehicleType> vehicleTypes
    ) {
        this.positionMap = Objects.requireNonNull(positionMap, "positionMap");
        this.config = config == null ? VehicleTableConfig.defaults() : config;
        this.config.validate();
        Map<String, VehicleType> byId = new Object2ObjectOpenHashMap<>();
        for (VehicleType type : vehicleTypes) {
            type.validate();
            if (byId.putIfAbsent(type.getTypeId(), type) != null) {
                throw new IllegalArgumentException("vehicle type registered twice: " + type.getTypeId());
            }
        }
        this.types = Collections.unmodifiableMap(byId);
    }

    // ========================================================================
    // STEP UPDATE
    // ========================================================================

    /**
     * Applies one simulator snapshot.
     * <ol>
     * <li>Arrived and teleported ids are removed.</li>
     * <li>Known ids are updated in place; unknown ids are added as departures.</li>
     * <li>Known ids missing from the snapshot are removed.</li>
     * </ol>
     */
    public void refresh(SimulationSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        Map<String, VehicleObservation> observed = snapshot.getVehicles();

        for (String id : snapshot.getArrivedIds()) {
            remove(id);
        }
        for (String id : snapshot.getTeleportedIds()) {
            remove(id);
        }

        int departed = 0;
        for (Map.Entry<String, VehicleObservation> entry : observed.entrySet()) {
            VehicleRecord record = records.get(entry.getKey());
            if (record == null) {
                add(entry.getKey(), entry.getValue());
                departed++;
            } else {
                move(record, entry.getValue());
            }
        }

        if (records.size() > observed.size()) {
            List<String> stale = new ArrayList<>();
            for (String id : records.keySet()) {
                if (!observed.containsKey(id)) {
                    stale.add(id);
                }
            }
            for (String id : stale) {
                log.trace("Vehicle {} no longer reported; removing", id);
                remove(id);
            }
        }

        numDeparted = departed;
        numArrived = snapshot.getArrivedIds().size();
        appendHistory(departedHistory, numDeparted);
        appendHistory(arrivedHistory, numArrived);
        time = snapshot.getTime();
    }

    /**
     * Removes a vehicle from the table, every id view and the edge index. Unknown ids are ignored.
     */
    public void remove(String vehicleId) {
        VehicleRecord record = records.remove(vehicleId);
        if (record == null) {
            return;
        }
        unindex(record);
        humanIds.remove(vehicleId);
        rlIds.remove(vehicleId);
        controlledIds.remove(vehicleId);
        controlledLcIds.remove(vehicleId);
        observedIds.remove(vehicleId);
    }

    /**
     * Drops all vehicles and flow history (episode reset).
     */
    public void clear() {
        records.clear();
        idsByEdge.clear();
        humanIds.clear();
        rlIds.clear();
        controlledIds.clear();
        controlledLcIds.clear();
        observedIds.clear();
        departedHistory.clear();
        arrivedHistory.clear();
        numDeparted = 0;
        numArrived = 0;
        time = 0.0d;
        log.debug("Vehicle table cleared");
    }

    private void add(String vehicleId, VehicleObservation observation) {
        VehicleType type = resolveType(observation.getTypeId());
        double length = type.getDefaultLength() > 0.0d ? type.getDefaultLength() : config.getDefaultLength();
        VehicleRecord record = new VehicleRecord(vehicleId, type, length);
        record.update(observation);
        records.put(vehicleId, record);
        index(record);

        if (type.isRl()) {
            rlIds.add(vehicleId);
        } else {
            humanIds.add(vehicleId);
            if (type.isAccelerationControlled()) {
                controlledIds.add(vehicleId);
            }
        }
        if (type.isLaneChangeControlled()) {
            controlledLcIds.add(vehicleId);
        }
    }

    private void move(VehicleRecord record, VehicleObservation observation) {
        String before = record.edgeId();
        record.update(observation);
        if (!before.equals(record.edgeId())) {
            removeFromEdge(before, record.id());
            index(record);
        }
    }

    private VehicleType resolveType(String typeId) {
        VehicleType type = typeId == null ? null : types.get(typeId);
        if (type != null) {
            return type;
        }
        log.debug("Unregistered vehicle type {}; treating as human", typeId);
        return VehicleType.human(typeId == null ? "human" : typeId);
    }

    private void index(VehicleRecord record) {
        if (!record.onEdge()) {
            return;
        }
        ObjectLinkedOpenHashSet<String> ids = idsByEdge.get(record.edgeId());
        if (ids == null) {
            ids = new ObjectLinkedOpenHashSet<>();
            idsByEdge.put(record.edgeId(), ids);
        }
        ids.add(record.id());
    }

    private void unindex(VehicleRecord record) {
        removeFromEdge(record.edgeId(), record.id());
    }

    private void removeFromEdge(String edgeId, String vehicleId) {
        ObjectLinkedOpenHashSet<String> ids = idsByEdge.get(edgeId);
        if (ids != null && ids.remove(vehicleId) && ids.isEmpty()) {
            idsByEdge.remove(edgeId);
        }
    }

    private void appendHistory(IntArrayList history, int count) {
        history.add(count);
        if (history.size() > config.getMaxHistorySteps()) {
            history.removeElements(0, history.size() - config.getMaxHistorySteps());
        }
    }

    // ========================================================================
    // ID VIEWS
    // ========================================================================

    public List<String> getIds() {
        return List.copyOf(records.keySet());
    }

    public List<String> getHumanIds() {
        return List.copyOf(humanIds);
    }

    public List<String> getRlIds() {
        return List.copyOf(rlIds);
    }

    /**
     * Human vehicles whose acceleration is set by an external controller.
     */
    public List<String> getControlledIds() {
        return List.copyOf(controlledIds);
    }

    /**
     * Vehicles whose lane changes are set by an external controller.
     */
    public List<String> getControlledLcIds() {
        return List.copyOf(controlledLcIds);
    }

    public List<String> getObservedIds() {
        return List.copyOf(observedIds);
    }

    /**
     * Ids currently indexed on the edge, in the order they entered it.
     */
    public List<String> getIdsByEdge(String edgeId) {
        ObjectLinkedOpenHashSet<String> ids = idsByEdge.get(edgeId);
        return ids == null ? List.of() : List.copyOf(ids);
    }

    /**
     * Concatenation of {@link #getIdsByEdge(String)} over the given edges.
     */
    public List<String> getIdsByEdge(Collection<String> edgeIds) {
        List<String> out = new ArrayList<>();
        for (String edgeId : edgeIds) {
            ObjectLinkedOpenHashSet<String> ids = idsByEdge.get(edgeId);
            if (ids != null) {
                out.addAll(ids);
            }
        }
        return out;
    }

    /**
     * Records currently on the edge. The list is a fresh copy; the records are live.
     */
    public List<VehicleRecord> recordsOnEdge(String edgeId) {
        ObjectLinkedOpenHashSet<String> ids = idsByEdge.get(edgeId);
        if (ids == null) {
            return List.of();
        }
        List<VehicleRecord> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            out.add(records.get(id));
        }
        return out;
    }

    public boolean contains(String vehicleId) {
        return records.containsKey(vehicleId);
    }

    /**
     * Returns the live record, or null for an unknown id.
     */
    public VehicleRecord get(String vehicleId) {
        return records.get(vehicleId);
    }

    public int numVehicles() {
        return records.size();
    }

    public int numRlVehicles() {
        return rlIds.size();
    }

    // ========================================================================
    // OBSERVATION FLAG
    // ========================================================================

    /**
     * Marks a vehicle as observed (for visualization). Repeated calls have no further effect.
     */
    public void setObserved(String vehicleId) {
        if (records.containsKey(vehicleId)) {
            observedIds.add(vehicleId);
        }
    }

    /**
     * Clears the observed mark; no-op when the vehicle is not marked.
     */
    public void removeObserved(String vehicleId) {
        observedIds.remove(vehicleId);
    }

    public boolean isObserved(String vehicleId) {
        return observedIds.contains(vehicleId);
    }

    // ========================================================================
    // FLOW
    // ========================================================================

    /** Vehicles that departed during the last refresh. */
    public int numDeparted() {
        return numDeparted;
    }

    /** Vehicles that arrived during the last refresh. */
    public int numArrived() {
        return numArrived;
    }

    /** Simulated time reported by the last refresh. */
    public double time() {
        return time;
    }

    /**
     * Departures per hour averaged over the trailing {@code timeSpan} seconds.
     */
    public double getInflowRate(double timeSpan) {
        return rate(departedHistory, timeSpan);
    }

    /**
     * Arrivals per hour averaged over the trailing {@code timeSpan} seconds.
     */
    public double getOutflowRate(double timeSpan) {
        return rate(arrivedHistory, timeSpan);
    }

    private double rate(IntArrayList history, double timeSpan) {
        if (history.isEmpty()) {
            return 0.0d;
        }
        int window = Math.max(1, (int) (timeSpan / config.getSimStep()));
        int from = Math.max(0, history.size() - window);
        int sum = 0;
        for (int i = from; i < history.size(); i++) {
            sum += history.getInt(i);
        }
        // averaged over the steps actually recorded, which may be fewer than the window
        return 3600.0d * sum / ((history.size() - from) * config.getSimStep());
    }

    // ========================================================================
    // ACCESSORS (caller default for unknown ids)
    // ========================================================================

    public double getSpeed(String vehicleId, double error) {
        VehicleRecord record = records.get(vehicleId);
        return record == null ? error : record.speed();
    }

    public double[] getSpeed(List<String> vehicleIds, double error) {
        double[] out = new double[vehicleIds.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = getSpeed(vehicleIds.get(i), error);
        }
        return out;
    }

    /**
     * Local position along the vehicle's current edge.
     */
    public double getPosition(String vehicleId, double error) {
        VehicleRecord record = records.get(vehicleId);
        return record == null ? error : record.position();
    }

    public double[] getPosition(List<String> vehicleIds, double error) {
        double[] out = new double[vehicleIds.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = getPosition(vehicleIds.get(i), error);
        }
        return out;
    }

    /**
     * Global position through the session's {@link GlobalPositionMap}. A known vehicle on an
     * edge the map cannot resolve yields {@link Sentinels#UNKNOWN_EDGE}.
     */
    public double getAbsolutePosition(String vehicleId, double error) {
        VehicleRecord record = records.get(vehicleId);
        return record == null ? error : positionMap.toGlobal(record.edgeId(), record.position());
    }

    public double[] getAbsolutePosition(List<String> vehicleIds, double error) {
        double[] out = new double[vehicleIds.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = getAbsolutePosition(vehicleIds.get(i), error);
        }
        return out;
    }

    public String getEdge(String vehicleId, String error) {
        VehicleRecord record = records.get(vehicleId);
        return record == null ? error : record.edgeId();
    }

    public List<String> getEdge(List<String> vehicleIds, String error) {
        List<String> out = new ArrayList<>(vehicleIds.size());
        for (String id : vehicleIds) {
            out.add(getEdge(id, error));
        }
        return out;
    }

    public int getLane(String vehicleId, int error) {
        VehicleRecord record = records.get(vehicleId);
        return record == null ? error : record.lane();
    }

    public int[] getLane(List<String> vehicleIds, int error) {
        int[] out = new int[vehicleIds.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = getLane(vehicleIds.get(i), error);
        }
        return out;
    }

    public double getLength(String vehicleId, double error) {
        VehicleRecord record = records.get(vehicleId);
        return record == null ? error : record.length();
    }

    public double[] getLength(List<String> vehicleIds, double error) {
        double[] out = new double[vehicleIds.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = getLength(vehicleIds.get(i), error);
        }
        return out;
    }

    /**
     * Registered type id of the vehicle.
     */
    public String getType(String vehicleId, String error) {
        VehicleRecord record = records.get(vehicleId);
        return record == null ? error : record.type().getTypeId();
    }

    public List<String> getType(List<String> vehicleIds, String error) {
        List<String> out = new ArrayList<>(vehicleIds.size());
        for (String id : vehicleIds) {
            out.add(getType(id, error));
        }
        return out;
    }

    public List<String> getRoute(String vehicleId, List<String> error) {
        VehicleRecord record = records.get(vehicleId);
        return record == null ? error : record.route();
    }

    public List<List<String>> getRoute(List<String> vehicleIds, List<String> error) {
        List<List<String>> out = new ArrayList<>(vehicleIds.size());
        for (String id : vehicleIds) {
            out.add(getRoute(id, error));
        }
        return out;
    }

    public GlobalPositionMap positionMap() {
        return positionMap;
    }

    public VehicleTableConfig config() {
        return config;
    }

    /**
     * Checks that the edge index and the record table agree. Used by tests and debug tooling.
     *
     * @return true when every record is indexed exactly once under its current edge.
     */
    public boolean indexConsistent() {
        Set<String> indexed = new HashSet<>();
        for (Map.Entry<String, ObjectLinkedOpenHashSet<String>> entry : idsByEdge.entrySet()) {
            for (String id : entry.getValue()) {
                VehicleRecord record = records.get(id);
                if (record == null || !record.edgeId().equals(entry.getKey()) || !indexed.add(id)) {
                    return false;
                }
            }
        }
        for (VehicleRecord record : records.values()) {
            if (record.onEdge() != indexed.contains(record.id())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return String.format("VehicleStateTable[vehicles=%d, rl=%d, edges=%d, t=%.2f]",
                records.size(), rlIds.size(), idsByEdge.size(), time);
    }
}
