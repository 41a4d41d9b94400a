package org.lanegraph.vehicle;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything the simulator reports for one step.
 *
 * <p>{@code vehicles} holds every vehicle currently in the network keyed by id, in the order
 * the simulator listed them. The three id lists name vehicles that departed, arrived or were
 * teleported out during the step.</p>
 */
@Value
@Builder(toBuilder = true)
public class SimulationSnapshot {
    /** Simulated time at the end of the step, in seconds. */
    @Builder.Default
    double time = 0.0d;

    @Singular
    Map<String, VehicleObservation> vehicles;

    @Singular("departed")
    List<String> departedIds;

    @Singular("arrived")
    List<String> arrivedIds;

    @Singular("teleported")
    List<String> teleportedIds;

    public static SimulationSnapshot empty() {
        return SimulationSnapshot.builder().build();
    }
}
