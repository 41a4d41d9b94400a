package org.lanegraph.network;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Immutable road segment (or junction-internal link) of a {@link NetworkTopology}.
 *
 * <p>{@code internal} and {@code parentId} are resolved once by the topology builder.
 * Nothing downstream re-parses the id string.</p>
 */
@Getter
@ToString
@EqualsAndHashCode
@Accessors(fluent = true)
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
public final class Edge {
    /** Edge identifier as reported by the simulator. */
    private final String id;
    /** Length in meters, {@code >= 0}. */
    private final double length;
    /** Number of lanes, {@code >= 1}. */
    private final int laneCount;
    /** Speed limit in m/s. */
    private final double speedLimit;
    /** True for junction-internal links. */
    private final boolean internal;
    /**
     * Junction-level id this internal link belongs to (trailing {@code _<n>} stripped).
     * Null for non-internal edges or when no suffix exists.
     */
    private final String parentId;
}
