package org.lanegraph.core.sentinel;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SentinelsTest {

    @Test
    void testNumericSentinelsAgree() {
        assertEquals(-1001, Sentinels.UNKNOWN_EDGE);
        assertEquals((double) Sentinels.UNKNOWN_EDGE, Sentinels.ERROR_VALUE);
    }

    @Test
    void testMissingVehicle() {
        assertTrue(Sentinels.isMissing(Sentinels.NO_VEHICLE));
        assertTrue(Sentinels.isMissing(null));
        assertFalse(Sentinels.isMissing("veh_0"));
    }
}
