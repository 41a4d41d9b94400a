package org.lanegraph.position;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Externally supplied global offsets for a scenario.
 *
 * <p>All lists are optional. Missing non-internal starts are derived from edge lengths and
 * missing internal starts from connectivity; see {@link GlobalPositionMap}.</p>
 */
@Value
@Builder
public class EdgeStartHints {
    /** Starts of non-internal edges. Empty means "derive by sorted id". */
    @Singular
    List<EdgeStart> edgeStarts;

    /** Starts of individual junction-internal links. */
    @Singular
    List<EdgeStart> internalEdgeStarts;

    /**
     * Starts of whole intersections (junction ids). Merged after
     * {@link #internalEdgeStarts} and de-duplicated with them.
     */
    @Singular
    List<EdgeStart> intersectionEdgeStarts;

    /**
     * Returns hints that request fully derived offsets.
     */
    public static EdgeStartHints none() {
        return EdgeStartHints.builder().build();
    }

    public boolean hasEdgeStarts() {
        return !edgeStarts.isEmpty();
    }
}
