package org.lanegraph.position;

/**
 * Result of a global-to-local lookup.
 *
 * @param edgeId edge (or junction) whose span contains the global coordinate.
 * @param position distance from the start of that edge.
 */
public record LocalPosition(String edgeId, double position) {
}
