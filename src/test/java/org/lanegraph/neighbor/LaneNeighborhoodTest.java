package org.lanegraph.neighbor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LaneNeighborhoodTest {

    @Test
    @DisplayName("Immutability: arrays are copied in and out")
    void testDefensiveCopies() {
        double[] headways = {1.0d, 2.0d};
        LaneNeighborhood hood = new LaneNeighborhood(List.of("a", ""), List.of("", "b"), headways, new double[2]);

        headways[0] = 99.0d;
        hood.headways()[1] = 99.0d;

        assertArrayEquals(new double[]{1.0d, 2.0d}, hood.headways());
        assertEquals(2, hood.laneCount());
    }

    @Test
    @DisplayName("Validation: per-lane vectors must agree in length")
    void testMismatchedLengths() {
        assertThrows(IllegalArgumentException.class,
                () -> new LaneNeighborhood(List.of("a"), List.of("b"), new double[2], new double[1]));
    }

    @Test
    @DisplayName("Defaults: filled neighborhood compares by value")
    void testFilled() {
        LaneNeighborhood filled = LaneNeighborhood.filled(3, "", 1000.0d);

        assertEquals(List.of("", "", ""), filled.leaders());
        assertArrayEquals(new double[]{1000.0d, 1000.0d, 1000.0d}, filled.tailways());
        assertEquals(filled, LaneNeighborhood.filled(3, "", 1000.0d));
        assertEquals(filled.hashCode(), LaneNeighborhood.filled(3, "", 1000.0d).hashCode());
    }
}
