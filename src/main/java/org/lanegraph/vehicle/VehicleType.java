package org.lanegraph.vehicle;

import lombok.Builder;
import lombok.Value;

/**
 * Static description of a vehicle class registered with a {@link VehicleStateTable}.
 *
 * <p>{@code rl} vehicles are driven by an external policy. Non-RL vehicles are "human" and
 * may still have their acceleration or lane changes handled by a controller outside the
 * simulator.</p>
 */
@Value
@Builder
public class VehicleType {
    public static final String REASON_INVALID_DEFAULT_LENGTH = "V01_INVALID_DEFAULT_LENGTH";

    String typeId;

    @Builder.Default
    boolean rl = false;

    @Builder.Default
    boolean accelerationControlled = false;

    @Builder.Default
    boolean laneChangeControlled = false;

    /**
     * Length used when the snapshot does not report one. Non-positive means "use table default".
     */
    @Builder.Default
    double defaultLength = 0.0d;

    /**
     * Human vehicle whose acceleration and lane changes are both left to the simulator.
     */
    public static VehicleType human(String typeId) {
        return VehicleType.builder().typeId(typeId).build();
    }

    /**
     * Policy-driven vehicle.
     */
    public static VehicleType rl(String typeId) {
        return VehicleType.builder().typeId(typeId).rl(true).build();
    }

    void validate() {
        if (typeId == null || typeId.isBlank()) {
            throw new IllegalArgumentException("vehicle type id must be non-blank");
        }
        if (!Double.isFinite(defaultLength)) {
            throw new IllegalArgumentException(
                    REASON_INVALID_DEFAULT_LENGTH + ": defaultLength must be finite for type " + typeId);
        }
    }
}
