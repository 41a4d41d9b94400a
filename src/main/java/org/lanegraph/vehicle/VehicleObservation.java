package org.lanegraph.vehicle;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Per-vehicle state reported by the simulator for one step.
 */
@Value
@Builder
public class VehicleObservation {
    String edgeId;

    int lane;

    /** Local position along {@link #edgeId}. */
    double position;

    double speed;

    /** Physical length; NaN when the simulator does not report it. */
    @Builder.Default
    double length = Double.NaN;

    /** Registered {@link VehicleType} id; only read at departure. */
    String typeId;

    @Singular("routeEdge")
    List<String> route;

    /**
     * Shorthand for the common case of a positioned vehicle with a known length.
     */
    public static VehicleObservation of(String edgeId, int lane, double position, double speed, double length) {
        return VehicleObservation.builder()
                .edgeId(edgeId)
                .lane(lane)
                .position(position)
                .speed(speed)
                .length(length)
                .build();
    }

    public boolean hasLength() {
        return !Double.isNaN(length);
    }
}
