package org.lanegraph.network;

import java.util.Objects;

/**
 * One lane of one edge: the unit of directed connectivity.
 *
 * @param edgeId edge identifier.
 * @param lane 0-based lane index on that edge.
 */
public record LaneRef(String edgeId, int lane) {
    public LaneRef {
        Objects.requireNonNull(edgeId, "edgeId");
    }

    public static LaneRef of(String edgeId, int lane) {
        return new LaneRef(edgeId, lane);
    }

    @Override
    public String toString() {
        return edgeId + "_" + lane;
    }
}
