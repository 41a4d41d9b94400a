package org.lanegraph.neighbor;

import lombok.Builder;
import lombok.Value;

/**
 * Search limits and "no neighbor" policy of a {@link LaneNeighborQueryEngine}.
 */
@Value
@Builder
public class NeighborQueryConfig {
    public static final String REASON_INVALID_HOP_LIMIT = "N01_INVALID_HOP_LIMIT";
    public static final String REASON_INVALID_FALLBACK = "N02_INVALID_FALLBACK_DISTANCE";

    /**
     * Number of edges the search may step into beyond the vehicle's own edge.
     * {@code 0} restricts every query to the local edge.
     */
    @Builder.Default
    int hopLimit = 1;

    @Builder.Default
    FallbackDistancePolicy fallbackPolicy = FallbackDistancePolicy.NETWORK_LENGTH;

    /** Used when {@link #fallbackPolicy} is {@link FallbackDistancePolicy#FIXED}. */
    @Builder.Default
    double fixedFallbackDistance = 1_000.0d;

    public static NeighborQueryConfig defaults() {
        return NeighborQueryConfig.builder().build();
    }

    void validate() {
        if (hopLimit < 0) {
            throw new IllegalArgumentException(REASON_INVALID_HOP_LIMIT + ": hopLimit must be >= 0, got " + hopLimit);
        }
        if (fallbackPolicy == null) {
            throw new IllegalArgumentException(REASON_INVALID_FALLBACK + ": fallbackPolicy must be set");
        }
        if (!Double.isFinite(fixedFallbackDistance) || fixedFallbackDistance < 0.0d) {
            throw new IllegalArgumentException(
                    REASON_INVALID_FALLBACK + ": fixedFallbackDistance must be >= 0, got " + fixedFallbackDistance);
        }
    }
}
