package org.lanegraph.vehicle;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.lanegraph.core.sentinel.Sentinels;

import java.util.List;

/**
 * Mutable per-vehicle state owned by one {@link VehicleStateTable}.
 *
 * <p>Only the owning table writes to a record. Readers outside the package see the fluent
 * getters.</p>
 */
@Getter
@ToString
@Accessors(fluent = true)
public final class VehicleRecord {
    private final String id;
    private final VehicleType type;

    @Getter(AccessLevel.NONE)
    private String edgeId;
    private int lane;
    private double position;
    private double speed;
    private double length;
    private List<String> route;

    VehicleRecord(String id, VehicleType type, double length) {
        this.id = id;
        this.type = type;
        this.length = length;
        this.route = List.of();
    }

    /**
     * Current edge id, never null (empty when the simulator reported none).
     */
    public String edgeId() {
        return edgeId == null ? Sentinels.NO_EDGE : edgeId;
    }

    boolean onEdge() {
        return edgeId != null && !edgeId.isEmpty();
    }

    void update(VehicleObservation observation) {
        this.edgeId = observation.getEdgeId();
        this.lane = observation.getLane();
        this.position = observation.getPosition();
        this.speed = observation.getSpeed();
        if (observation.hasLength()) {
            this.length = observation.getLength();
        }
        if (!observation.getRoute().isEmpty()) {
            this.route = observation.getRoute();
        }
    }
}
