package org.lanegraph.neighbor;

/**
 * Distance reported for a lane in which no leader or follower was found.
 */
public enum FallbackDistancePolicy {
    /** Total length of the non-internal network. */
    NETWORK_LENGTH,
    /** {@link NeighborQueryConfig#getFixedFallbackDistance()}. */
    FIXED
}
