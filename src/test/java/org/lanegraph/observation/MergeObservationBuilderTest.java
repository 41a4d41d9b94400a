package org.lanegraph.observation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.lanegraph.neighbor.LaneNeighborQueryEngine;
import org.lanegraph.network.NetworkTopology;
import org.lanegraph.testutil.NetworkFixtures;
import org.lanegraph.testutil.NetworkFixtures.Placement;
import org.lanegraph.vehicle.VehicleStateTable;
import org.lanegraph.vehicle.VehicleType;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MergeObservationBuilderTest {

    private static final NetworkTopology LOOP = NetworkFixtures.loop(300.0d);

    private static VehicleStateTable table(Placement... placements) {
        VehicleStateTable table = NetworkFixtures.table(LOOP, VehicleType.rl("rl"));
        table.refresh(NetworkFixtures.snapshot(placements));
        return table;
    }

    @Test
    @DisplayName("Features: normalized speeds and gaps to leader and follower")
    void testFeatures() {
        VehicleStateTable table = table(
                Placement.at("rl_0", "loop", 0, 0.0d).withSpeed(10.0d).withType("rl"),
                Placement.at("h_0", "loop", 0, 100.0d).withSpeed(20.0d),
                Placement.at("h_1", "loop", 0, 200.0d).withSpeed(15.0d));
        MergeObservationBuilder builder =
                new MergeObservationBuilder(new LaneNeighborQueryEngine(table.positionMap()), LOOP, 0);

        MergeObservation obs = builder.build(table);

        assertEquals(1, obs.numRl());
        assertArrayEquals(new double[]{
                10.0d / 30.0d,
                10.0d / 30.0d,
                95.0d / 300.0d,
                -5.0d / 30.0d,
                95.0d / 300.0d
        }, obs.row(0), 1e-12);
        assertEquals(List.of("h_0"), obs.leaders());
        assertEquals(List.of("h_1"), obs.followers());
        assertEquals(List.of("h_0", "h_1"), table.getObservedIds());
    }

    @Test
    @DisplayName("Missing Neighbors: leader at max speed, follower standing, both a network length away")
    void testMissingNeighbors() {
        VehicleStateTable table = table(Placement.at("rl_0", "loop", 0, 50.0d).withSpeed(10.0d).withType("rl"));
        MergeObservationBuilder builder =
                new MergeObservationBuilder(new LaneNeighborQueryEngine(table.positionMap()), LOOP, 0);

        MergeObservation obs = builder.build(table);

        assertArrayEquals(new double[]{10.0d / 30.0d, 20.0d / 30.0d, 1.0d, 10.0d / 30.0d, 1.0d}, obs.row(0), 1e-12);
        assertTrue(obs.leaders().isEmpty());
        assertTrue(table.getObservedIds().isEmpty());
    }

    @Test
    @DisplayName("Padding: fixed row count with zero rows past the RL vehicles")
    void testPadding() {
        VehicleStateTable table = table(Placement.at("rl_0", "loop", 0, 50.0d).withSpeed(30.0d).withType("rl"));
        MergeObservationBuilder builder =
                new MergeObservationBuilder(new LaneNeighborQueryEngine(table.positionMap()), LOOP, 3);

        MergeObservation obs = builder.build(table);

        assertEquals(3, obs.features().length);
        assertEquals(1, obs.numRl());
        assertArrayEquals(new double[MergeObservationBuilder.FEATURES], obs.row(2));
        assertEquals(1.0d, obs.row(0)[0]);
    }

    @Test
    @DisplayName("Validation: degenerate networks cannot normalize")
    void testDegenerateNetwork() {
        NetworkTopology empty = NetworkTopology.builder().build();
        LaneNeighborQueryEngine engine =
                new LaneNeighborQueryEngine(NetworkFixtures.table(LOOP).positionMap());

        assertThrows(IllegalArgumentException.class, () -> new MergeObservationBuilder(engine, empty, 0));
        assertThrows(IllegalArgumentException.class, () -> new MergeObservationBuilder(engine, LOOP, -1));
    }
}
