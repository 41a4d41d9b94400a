package org.lanegraph.kernel;

import org.lanegraph.network.NetworkTopology;
import org.lanegraph.position.EdgeStartHints;
import org.lanegraph.vehicle.SimulationSnapshot;

/**
 * Capability boundary to a microscopic traffic simulator.
 *
 * <p>One adapter per simulator implements this interface. Everything above it (position map,
 * vehicle table, neighbor queries) is backend independent.</p>
 */
public interface SimulationBackend extends AutoCloseable {

    /**
     * Static network the simulator runs on. Called once per session.
     */
    NetworkTopology topology();

    /**
     * Global offsets the backend wants to impose, or {@link EdgeStartHints#none()}.
     */
    default EdgeStartHints edgeStartHints() {
        return EdgeStartHints.none();
    }

    /**
     * Advances the simulation by one step and reports the resulting state.
     *
     * @throws IllegalStateException when the backend cannot advance (closed or exhausted).
     */
    SimulationSnapshot advance();

    /**
     * Restarts the scenario and reports the initial state.
     */
    SimulationSnapshot reset();

    /**
     * Simulated seconds per {@link #advance()} call.
     */
    double stepLength();

    @Override
    default void close() {
    }
}
