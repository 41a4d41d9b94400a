package org.lanegraph.kernel;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.experimental.Accessors;
import org.lanegraph.neighbor.LaneNeighborQueryEngine;
import org.lanegraph.neighbor.NeighborQueryConfig;
import org.lanegraph.network.NetworkTopology;
import org.lanegraph.position.GlobalPositionMap;
import org.lanegraph.vehicle.SimulationSnapshot;
import org.lanegraph.vehicle.VehicleStateTable;
import org.lanegraph.vehicle.VehicleTableConfig;
import org.lanegraph.vehicle.VehicleType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * One episode-scoped run against a {@link SimulationBackend}.
 * <p>
 * The topology, position map and neighbor engine are built once at construction and are
 * immutable. The {@link VehicleStateTable} belongs to this session alone: {@link #step()}
 * performs exactly one backend advance followed by exactly one refresh, and
 * {@link #reset()} clears the table before loading the initial snapshot.
 * </p>
 * <p>
 * Construction fails fast with {@link org.lanegraph.network.TopologyException} when the
 * backend's network or offset hints are inconsistent.
 * </p>
 */
@Getter
@Accessors(fluent = true)
public final class SimulationSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SimulationSession.class);

    private final SimulationBackend backend;
    private final NetworkTopology topology;
    private final GlobalPositionMap positionMap;
    private final LaneNeighborQueryEngine neighbors;
    private final VehicleStateTable vehicles;
    private long stepCount;

    @Builder
    private SimulationSession(
            @NonNull SimulationBackend backend,
            NeighborQueryConfig neighborConfig,
            VehicleTableConfig tableConfig,
            @Singular List<VehicleType> vehicleTypes
    ) {
        this.backend = backend;
        this.topology = backend.topology();
        this.positionMap = GlobalPositionMap.build(topology, backend.edgeStartHints());
        this.neighbors = new LaneNeighborQueryEngine(
                positionMap,
                neighborConfig == null ? NeighborQueryConfig.defaults() : neighborConfig
        );
        this.vehicles = VehicleStateTable.builder()
                .positionMap(positionMap)
                .config(tableConfig == null
                        ? VehicleTableConfig.builder().simStep(backend.stepLength()).build()
                        : tableConfig)
                .vehicleTypes(vehicleTypes)
                .build();
        log.info("Session ready on {}", topology);
    }

    /**
     * Advances the backend by one step and refreshes the vehicle table.
     *
     * @return the snapshot that was applied.
     */
    public SimulationSnapshot step() {
        SimulationSnapshot snapshot = backend.advance();
        vehicles.refresh(snapshot);
        stepCount++;
        if (log.isTraceEnabled()) {
            log.trace("Step {}: {}", stepCount, vehicles);
        }
        return snapshot;
    }

    /**
     * Restarts the episode: resets the backend, clears the table and applies the initial snapshot.
     */
    public SimulationSnapshot reset() {
        SimulationSnapshot initial = backend.reset();
        vehicles.clear();
        vehicles.refresh(initial);
        stepCount = 0;
        log.debug("Session reset with {} vehicle(s)", vehicles.numVehicles());
        return initial;
    }

    @Override
    public void close() {
        backend.close();
        log.info("Session closed after {} step(s)", stepCount);
    }
}
