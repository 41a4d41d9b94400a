package org.lanegraph.vehicle;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.lanegraph.core.sentinel.Sentinels;
import org.lanegraph.network.NetworkTopology;
import org.lanegraph.position.GlobalPositionMap;
import org.lanegraph.testutil.NetworkFixtures;
import org.lanegraph.testutil.NetworkFixtures.Placement;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VehicleStateTableTest {

    private NetworkTopology topology;
    private VehicleStateTable table;

    @BeforeEach
    void setUp() {
        topology = NetworkFixtures.ring(50.0d, 2);
        table = NetworkFixtures.table(topology);
    }

    @Test
    @DisplayName("Refresh: new ids are added as departures and indexed by edge")
    void testRefreshAddsVehicles() {
        table.refresh(NetworkFixtures.snapshot(
                Placement.at("v0", "bottom", 0, 10.0d).withSpeed(3.0d),
                Placement.at("v1", "bottom", 1, 20.0d),
                Placement.at("v2", "top", 0, 5.0d)
        ));

        assertEquals(List.of("v0", "v1", "v2"), table.getIds());
        assertEquals(3, table.numVehicles());
        assertEquals(3, table.numDeparted());
        assertEquals(List.of("v0", "v1"), table.getIdsByEdge("bottom"));
        assertEquals(List.of("v2"), table.getIdsByEdge("top"));
        assertTrue(table.getIdsByEdge("left").isEmpty());
        assertEquals(3.0d, table.getSpeed("v0", -1.0d));
        assertEquals(1, table.getLane("v1", -1));
        assertTrue(table.indexConsistent());
    }

    @Test
    @DisplayName("Refresh: known ids update in place and move between edge indexes")
    void testRefreshMovesVehicles() {
        table.refresh(NetworkFixtures.snapshot(
                Placement.at("v0", "bottom", 0, 45.0d),
                Placement.at("v1", "bottom", 0, 10.0d)
        ));
        table.refresh(NetworkFixtures.snapshot(
                Placement.at("v0", "right", 0, 2.0d),
                Placement.at("v1", "bottom", 1, 14.0d)
        ));

        assertEquals(0, table.numDeparted());
        assertEquals(List.of("v1"), table.getIdsByEdge("bottom"));
        assertEquals(List.of("v0"), table.getIdsByEdge("right"));
        assertEquals("right", table.getEdge("v0", Sentinels.NO_EDGE));
        assertEquals(14.0d, table.getPosition("v1", -1.0d));
        assertEquals(1, table.getLane("v1", -1));
        assertTrue(table.indexConsistent());
    }

    @Test
    @DisplayName("Removed Vehicle: accessors return the caller default and every index forgets it")
    void testRemovedVehicle() {
        table.refresh(NetworkFixtures.snapshot(
                Placement.at("v0", "bottom", 0, 10.0d),
                Placement.at("gone", "bottom", 0, 20.0d)
        ));
        table.refresh(NetworkFixtures.snapshot(Placement.at("v0", "bottom", 0, 11.0d)));

        assertFalse(table.contains("gone"));
        assertEquals(-7.0d, table.getSpeed("gone", -7.0d));
        assertEquals(-7.0d, table.getPosition("gone", -7.0d));
        assertEquals("err", table.getEdge("gone", "err"));
        assertEquals(-3, table.getLane("gone", -3));
        assertEquals(-7.0d, table.getLength("gone", -7.0d));
        assertEquals(-7.0d, table.getAbsolutePosition("gone", -7.0d));
        assertNull(table.getType("gone", null));
        assertEquals(List.of("x"), table.getRoute("gone", List.of("x")));
        assertEquals(List.of("v0"), table.getIdsByEdge("bottom"));
        assertTrue(table.indexConsistent());
    }

    @Test
    @DisplayName("Refresh: arrived and teleported ids are removed, arrivals counted")
    void testArrivalsAndTeleports() {
        table.refresh(NetworkFixtures.snapshot(
                Placement.at("a", "bottom", 0, 1.0d),
                Placement.at("b", "bottom", 0, 2.0d),
                Placement.at("c", "top", 0, 3.0d)
        ));
        table.refresh(NetworkFixtures.snapshot(Placement.at("c", "top", 0, 4.0d)).toBuilder()
                .arrived("a")
                .teleported("b")
                .build());

        assertEquals(List.of("c"), table.getIds());
        assertEquals(1, table.numArrived());
        assertTrue(table.getIdsByEdge("bottom").isEmpty());
    }

    @Test
    @DisplayName("List Accessors: defaults applied element-wise")
    void testListAccessors() {
        table.refresh(NetworkFixtures.snapshot(
                Placement.at("v0", "bottom", 1, 10.0d).withSpeed(4.0d),
                Placement.at("v1", "left", 0, 30.0d).withSpeed(6.0d)
        ));
        List<String> ids = List.of("v0", "ghost", "v1");

        assertArrayEquals(new double[]{4.0d, -1001.0d, 6.0d}, table.getSpeed(ids, Sentinels.ERROR_VALUE));
        assertArrayEquals(new int[]{1, -1, 0}, table.getLane(ids, -1));
        assertEquals(List.of("bottom", "", "left"), table.getEdge(ids, Sentinels.NO_EDGE));
        assertArrayEquals(new double[]{10.0d, 0.0d, 30.0d}, table.getPosition(ids, 0.0d));
        assertArrayEquals(new double[]{5.0d, 0.0d, 5.0d}, table.getLength(ids, 0.0d));
    }

    @Test
    @DisplayName("Absolute Position: resolved through the global position map")
    void testAbsolutePosition() {
        GlobalPositionMap map = table.positionMap();
        table.refresh(NetworkFixtures.snapshot(
                Placement.at("v0", "right", 0, 10.0d),
                Placement.at("lost", "nowhere", 0, 10.0d)
        ));

        assertEquals(map.edgeStart("right") + 10.0d, table.getAbsolutePosition("v0", -1.0d));
        assertEquals(Sentinels.UNKNOWN_EDGE, table.getAbsolutePosition("lost", -1.0d));
    }

    @Test
    @DisplayName("Vehicle Types: human, rl and controlled views")
    void testTypeViews() {
        VehicleStateTable typed = NetworkFixtures.table(topology,
                VehicleType.human("plain"),
                VehicleType.builder().typeId("lc").laneChangeControlled(true).build(),
                VehicleType.builder().typeId("idm").accelerationControlled(true).build(),
                VehicleType.rl("rl"));
        typed.refresh(NetworkFixtures.snapshot(
                Placement.at("p0", "bottom", 0, 1.0d).withType("plain"),
                Placement.at("l0", "bottom", 0, 2.0d).withType("lc"),
                Placement.at("l1", "bottom", 0, 3.0d).withType("lc"),
                Placement.at("i0", "top", 0, 1.0d).withType("idm"),
                Placement.at("i1", "top", 0, 2.0d).withType("idm"),
                Placement.at("r0", "left", 0, 1.0d).withType("rl"),
                Placement.at("u0", "left", 0, 2.0d).withType("unregistered")
        ));

        assertEquals(7, typed.numVehicles());
        assertEquals(List.of("r0"), typed.getRlIds());
        assertEquals(1, typed.numRlVehicles());
        assertEquals(List.of("p0", "l0", "l1", "i0", "i1", "u0"), typed.getHumanIds());
        assertEquals(List.of("i0", "i1"), typed.getControlledIds());
        assertEquals(List.of("l0", "l1"), typed.getControlledLcIds());
        assertEquals("unregistered", typed.getType("u0", null));
    }

    @Test
    @DisplayName("Remove: vehicle disappears from every view")
    void testExplicitRemove() {
        VehicleStateTable typed = NetworkFixtures.table(topology, VehicleType.rl("rl"));
        typed.refresh(NetworkFixtures.snapshot(
                Placement.at("h0", "bottom", 0, 1.0d),
                Placement.at("r0", "bottom", 0, 2.0d).withType("rl")
        ));
        typed.setObserved("h0");

        typed.remove("h0");
        typed.remove("r0");
        typed.remove("never-seen");

        assertTrue(typed.getIds().isEmpty());
        assertTrue(typed.getHumanIds().isEmpty());
        assertTrue(typed.getRlIds().isEmpty());
        assertTrue(typed.getObservedIds().isEmpty());
        assertTrue(typed.getIdsByEdge("bottom").isEmpty());
        assertEquals(typed.numRlVehicles(), typed.getRlIds().size());
        assertNull(typed.get("h0"));
    }

    @Test
    @DisplayName("Observed Ids: idempotent set, tolerant remove")
    void testObservedIds() {
        table.refresh(NetworkFixtures.snapshot(
                Placement.at("test_0", "bottom", 0, 1.0d),
                Placement.at("test_1", "bottom", 0, 2.0d)
        ));

        table.setObserved("test_0");
        table.setObserved("test_1");
        table.setObserved("test_0");
        assertEquals(List.of("test_0", "test_1"), table.getObservedIds());

        table.removeObserved("test_0");
        table.removeObserved("test_0");
        assertEquals(List.of("test_1"), table.getObservedIds());
        assertTrue(table.isObserved("test_1"));

        table.setObserved("ghost");
        assertEquals(List.of("test_1"), table.getObservedIds());
    }

    @Test
    @DisplayName("Flow Rates: departures and arrivals per hour over a trailing window")
    void testFlowRates() {
        VehicleStateTable flow = VehicleStateTable.builder()
                .positionMap(GlobalPositionMap.build(topology))
                .config(VehicleTableConfig.builder().simStep(1.0d).build())
                .build();
        assertEquals(0.0d, flow.getInflowRate(10.0d));

        flow.refresh(NetworkFixtures.snapshot(
                Placement.at("a", "bottom", 0, 1.0d),
                Placement.at("b", "bottom", 0, 2.0d)
        ));
        flow.refresh(NetworkFixtures.snapshot(
                Placement.at("a", "bottom", 0, 3.0d),
                Placement.at("b", "bottom", 0, 4.0d)
        ));
        flow.refresh(NetworkFixtures.snapshot(
                Placement.at("b", "bottom", 0, 5.0d),
                Placement.at("c", "top", 0, 0.0d)
        ).toBuilder().arrived("a").build());

        assertEquals(1, flow.numDeparted());
        assertEquals(1, flow.numArrived());
        // last two steps: 0 + 1 departures over 2 s
        assertEquals(1800.0d, flow.getInflowRate(2.0d), 1e-9);
        // window longer than history: 3 departures over 3 recorded seconds
        assertEquals(3600.0d, flow.getInflowRate(100.0d), 1e-9);
        assertEquals(1200.0d, flow.getOutflowRate(100.0d), 1e-9);
    }

    @Test
    @DisplayName("Lengths: snapshot value, then type default, then table default")
    void testLengthResolution() {
        VehicleStateTable typed = VehicleStateTable.builder()
                .positionMap(GlobalPositionMap.build(topology))
                .config(VehicleTableConfig.builder().defaultLength(4.0d).build())
                .vehicleType(VehicleType.builder().typeId("truck").defaultLength(12.0d).build())
                .build();
        typed.refresh(SimulationSnapshot.builder()
                .vehicle("car", VehicleObservation.builder().edgeId("bottom").position(1.0d).build())
                .vehicle("truck", VehicleObservation.builder().edgeId("bottom").position(20.0d).typeId("truck").build())
                .vehicle("bike", VehicleObservation.of("top", 0, 1.0d, 4.0d, 1.8d))
                .build());

        assertEquals(4.0d, typed.getLength("car", -1.0d));
        assertEquals(12.0d, typed.getLength("truck", -1.0d));
        assertEquals(1.8d, typed.getLength("bike", -1.0d));
    }

    @Test
    @DisplayName("Routes: last reported route is retained")
    void testRoutes() {
        table.refresh(SimulationSnapshot.builder()
                .vehicle("v0", VehicleObservation.builder()
                        .edgeId("bottom")
                        .routeEdge("bottom")
                        .routeEdge("right")
                        .build())
                .build());
        table.refresh(SimulationSnapshot.builder()
                .vehicle("v0", VehicleObservation.builder().edgeId("right").build())
                .build());

        assertEquals(List.of("bottom", "right"), table.getRoute("v0", List.of()));
    }

    @Test
    @DisplayName("Clear: episode reset drops vehicles and history")
    void testClear() {
        table.refresh(NetworkFixtures.snapshot(Placement.at("v0", "bottom", 0, 1.0d)));
        table.setObserved("v0");

        table.clear();

        assertEquals(0, table.numVehicles());
        assertTrue(table.getObservedIds().isEmpty());
        assertTrue(table.getIdsByEdge("bottom").isEmpty());
        assertEquals(0.0d, table.getInflowRate(10.0d));
    }

    @Test
    @DisplayName("Configuration: invalid values are rejected")
    void testInvalidConfig() {
        GlobalPositionMap map = GlobalPositionMap.build(topology);

        assertThrows(IllegalArgumentException.class, () -> VehicleStateTable.builder()
                .positionMap(map)
                .config(VehicleTableConfig.builder().simStep(0.0d).build())
                .build());
        assertThrows(IllegalArgumentException.class, () -> VehicleStateTable.builder()
                .positionMap(map)
                .vehicleType(VehicleType.human("dup"))
                .vehicleType(VehicleType.rl("dup"))
                .build());
        assertThrows(NullPointerException.class, () -> VehicleStateTable.builder().build());
    }
}
