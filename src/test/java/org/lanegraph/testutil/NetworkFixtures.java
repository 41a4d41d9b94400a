package org.lanegraph.testutil;

import org.lanegraph.network.NetworkTopology;
import org.lanegraph.position.GlobalPositionMap;
import org.lanegraph.vehicle.SimulationSnapshot;
import org.lanegraph.vehicle.VehicleObservation;
import org.lanegraph.vehicle.VehicleStateTable;
import org.lanegraph.vehicle.VehicleType;

/**
 * Shared networks and snapshot helpers for tests.
 */
public final class NetworkFixtures {
    public static final double CAR_LENGTH = 5.0d;

    private NetworkFixtures() {
    }

    /**
     * One vehicle placed on a lane.
     */
    public record Placement(String vehicleId, String edgeId, int lane, double position, double speed, String typeId) {
        public static Placement at(String vehicleId, String edgeId, int lane, double position) {
            return new Placement(vehicleId, edgeId, lane, position, 0.0d, null);
        }

        public Placement withSpeed(double newSpeed) {
            return new Placement(vehicleId, edgeId, lane, position, newSpeed, typeId);
        }

        public Placement withType(String newTypeId) {
            return new Placement(vehicleId, edgeId, lane, position, speed, newTypeId);
        }
    }

    /**
     * Single closed-loop edge {@code "loop"} whose only lane feeds back into itself.
     */
    public static NetworkTopology loop(double length) {
        return NetworkTopology.builder()
                .edge("loop", length, 1)
                .connection("loop", 0, "loop", 0)
                .build();
    }

    /**
     * Four edges {@code bottom -> right -> top -> left -> bottom}, lane-to-lane connected.
     */
    public static NetworkTopology ring(double edgeLength, int lanes) {
        String[] ids = {"bottom", "right", "top", "left"};
        NetworkTopology.Builder builder = NetworkTopology.builder();
        for (String id : ids) {
            builder.edge(id, edgeLength, lanes);
        }
        for (int i = 0; i < ids.length; i++) {
            for (int lane = 0; lane < lanes; lane++) {
                builder.connection(ids[i], lane, ids[(i + 1) % ids.length], lane);
            }
        }
        return builder.build();
    }

    /**
     * Straight chain {@code highway_0 -> highway_1 -> ...} splitting {@code totalLength} evenly.
     */
    public static NetworkTopology highway(double totalLength, int lanes, int numEdges) {
        double edgeLength = totalLength / numEdges;
        NetworkTopology.Builder builder = NetworkTopology.builder();
        for (int i = 0; i < numEdges; i++) {
            builder.edge("highway_" + i, edgeLength, lanes);
        }
        for (int i = 0; i + 1 < numEdges; i++) {
            for (int lane = 0; lane < lanes; lane++) {
                builder.connection("highway_" + i, lane, "highway_" + (i + 1), lane);
            }
        }
        return builder.build();
    }

    /**
     * Merge with junction-internal links:
     * {@code inflow(100) -> :center_0(10) -> out(200)} and {@code ramp(50) -> :center_1(12) -> out}.
     * Derived offsets: inflow 0, out 100, ramp 300.
     */
    public static NetworkTopology merge() {
        return mergeBuilder().build();
    }

    public static NetworkTopology.Builder mergeBuilder() {
        return NetworkTopology.builder()
                .edge("inflow", 100.0d, 1, 30.0d)
                .edge("out", 200.0d, 1, 25.0d)
                .edge("ramp", 50.0d, 1, 15.0d)
                .edge(":center_0", 10.0d, 1, 13.9d)
                .edge(":center_1", 12.0d, 1, 13.9d)
                .connection("inflow", 0, ":center_0", 0)
                .connection(":center_0", 0, "out", 0)
                .connection("ramp", 0, ":center_1", 0)
                .connection(":center_1", 0, "out", 0);
    }

    public static VehicleStateTable table(NetworkTopology topology, VehicleType... types) {
        return table(GlobalPositionMap.build(topology), types);
    }

    public static VehicleStateTable table(GlobalPositionMap map, VehicleType... types) {
        VehicleStateTable.VehicleStateTableBuilder builder = VehicleStateTable.builder().positionMap(map);
        for (VehicleType type : types) {
            builder.vehicleType(type);
        }
        return builder.build();
    }

    /**
     * Snapshot listing the placements in order, all with {@link #CAR_LENGTH}.
     */
    public static SimulationSnapshot snapshot(Placement... placements) {
        SimulationSnapshot.SimulationSnapshotBuilder builder = SimulationSnapshot.builder();
        for (Placement p : placements) {
            builder.vehicle(p.vehicleId(), VehicleObservation.builder()
                    .edgeId(p.edgeId())
                    .lane(p.lane())
                    .position(p.position())
                    .speed(p.speed())
                    .length(CAR_LENGTH)
                    .typeId(p.typeId())
                    .build());
        }
        return builder.build();
    }

    /**
     * Table on {@code topology} refreshed once with the placements.
     */
    public static VehicleStateTable populated(NetworkTopology topology, Placement... placements) {
        VehicleStateTable table = table(topology);
        table.refresh(snapshot(placements));
        return table;
    }
}
