package org.lanegraph.position;

import java.util.Objects;

/**
 * One entry of the global offset table: the global coordinate at which an edge (or a
 * junction) begins.
 *
 * @param edgeId edge or junction identifier.
 * @param offset global start coordinate.
 */
public record EdgeStart(String edgeId, double offset) {
    public EdgeStart {
        Objects.requireNonNull(edgeId, "edgeId");
    }

    public static EdgeStart of(String edgeId, double offset) {
        return new EdgeStart(edgeId, offset);
    }
}
