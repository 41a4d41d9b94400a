package org.lanegraph.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable bidirectional index between string ids and dense slots {@code [0, size)}.
 *
 * <p>Slots follow the iteration order of the source collection. Lookup of an unknown id
 * returns {@link #NOT_FOUND} instead of throwing, since callers run it once per vehicle
 * per step. Safe for concurrent reads.</p>
 */
public final class DenseIdIndex {
    public static final int NOT_FOUND = -1;

    // fastutil map for String -> slot (forward lookup)
    private final Object2IntOpenHashMap<String> forward;
    // slot -> String (reverse lookup), zero allocation read
    private final String[] reverse;

    private DenseIdIndex(Object2IntOpenHashMap<String> forward, String[] reverse) {
        this.forward = forward;
        this.reverse = reverse;
    }

    /**
     * Builds an index over the given ids in iteration order.
     *
     * @param ids distinct, non-null ids.
     * @return immutable index.
     * @throws IllegalArgumentException on null or duplicate ids.
     */
    public static DenseIdIndex of(Collection<String> ids) {
        Objects.requireNonNull(ids, "ids");
        int size = ids.size();
        Object2IntOpenHashMap<String> forward = new Object2IntOpenHashMap<>(size);
        forward.defaultReturnValue(NOT_FOUND);
        String[] reverse = new String[size];

        int slot = 0;
        for (String id : ids) {
            if (id == null) {
                throw new IllegalArgumentException("ids must not contain null (slot " + slot + ")");
            }
            if (forward.containsKey(id)) {
                throw new IllegalArgumentException("Duplicate id detected: " + id);
            }
            forward.put(id, slot);
            reverse[slot] = id;
            slot++;
        }
        forward.trim();
        return new DenseIdIndex(forward, reverse);
    }

    /**
     * Returns the dense slot of an id, or {@link #NOT_FOUND}.
     */
    public int indexOf(String id) {
        if (id == null) {
            return NOT_FOUND;
        }
        // getInt avoids boxing
        return forward.getInt(id);
    }

    /**
     * Returns the id stored at a slot.
     *
     * @throws IndexOutOfBoundsException if the slot is invalid.
     */
    public String idAt(int slot) {
        if (slot < 0 || slot >= reverse.length) {
            throw new IndexOutOfBoundsException("Slot out of bounds: " + slot + " [0, " + reverse.length + ")");
        }
        return reverse[slot];
    }

    public boolean contains(String id) {
        return id != null && forward.containsKey(id);
    }

    public int size() {
        return reverse.length;
    }

    /**
     * Returns ids in slot order.
     */
    public List<String> ids() {
        return Collections.unmodifiableList(Arrays.asList(reverse));
    }
}
