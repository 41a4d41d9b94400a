package org.lanegraph.network;

import java.util.Objects;

/**
 * Directed arc {@code (fromEdge, fromLane) -> (toEdge, toLane)}.
 */
public record Connection(String fromEdge, int fromLane, String toEdge, int toLane) {
    public Connection {
        Objects.requireNonNull(fromEdge, "fromEdge");
        Objects.requireNonNull(toEdge, "toEdge");
    }

    public LaneRef from() {
        return new LaneRef(fromEdge, fromLane);
    }

    public LaneRef to() {
        return new LaneRef(toEdge, toLane);
    }
}
