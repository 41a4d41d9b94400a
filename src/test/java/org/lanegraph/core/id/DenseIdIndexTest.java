package org.lanegraph.core.id;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DenseIdIndexTest {

    @Test
    @DisplayName("Baseline Correctness: slots follow insertion order in both directions")
    void testBidirectionalMapping() {
        DenseIdIndex index = DenseIdIndex.of(List.of("bottom", ":center_0", "top"));

        assertEquals(0, index.indexOf("bottom"));
        assertEquals(1, index.indexOf(":center_0"));
        assertEquals(2, index.indexOf("top"));
        assertEquals("top", index.idAt(2));
        assertEquals(3, index.size());
        assertEquals(List.of("bottom", ":center_0", "top"), index.ids());
    }

    @Test
    @DisplayName("Sentinel Path: unknown and null ids report NOT_FOUND")
    void testUnknownIds() {
        DenseIdIndex index = DenseIdIndex.of(List.of("a"));

        assertEquals(DenseIdIndex.NOT_FOUND, index.indexOf("missing"));
        assertEquals(DenseIdIndex.NOT_FOUND, index.indexOf(null));
        assertFalse(index.contains("missing"));
        assertTrue(index.contains("a"));
    }

    @Test
    @DisplayName("Exception Path: invalid slot and bad input")
    void testInvalidInput() {
        DenseIdIndex index = DenseIdIndex.of(List.of("a", "b"));

        assertThrows(IndexOutOfBoundsException.class, () -> index.idAt(2));
        assertThrows(IndexOutOfBoundsException.class, () -> index.idAt(-1));
        assertThrows(IllegalArgumentException.class, () -> DenseIdIndex.of(List.of("a", "a")));
        assertThrows(IllegalArgumentException.class, () -> DenseIdIndex.of(Arrays.asList("a", null)));
    }

    @Test
    @DisplayName("Immutability: exported id list rejects mutation")
    void testIdsAreReadOnly() {
        DenseIdIndex index = DenseIdIndex.of(List.of("a"));

        assertThrows(UnsupportedOperationException.class, () -> index.ids().add("b"));
    }
}
