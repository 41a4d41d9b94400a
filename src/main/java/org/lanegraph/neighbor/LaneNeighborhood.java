package org.lanegraph.neighbor;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Leaders, followers and gaps of one vehicle, indexed by lane of its current edge.
 *
 * <p>Missing neighbors carry an empty id and the engine's fallback distance. Arrays are
 * copied on the way in and on the way out.</p>
 */
public record LaneNeighborhood(
        List<String> leaders,
        List<String> followers,
        double[] headways,
        double[] tailways
) {
    public LaneNeighborhood {
        leaders = List.copyOf(Objects.requireNonNull(leaders, "leaders"));
        followers = List.copyOf(Objects.requireNonNull(followers, "followers"));
        headways = Objects.requireNonNull(headways, "headways").clone();
        tailways = Objects.requireNonNull(tailways, "tailways").clone();
        int lanes = leaders.size();
        if (followers.size() != lanes || headways.length != lanes || tailways.length != lanes) {
            throw new IllegalArgumentException("all per-lane vectors must have the same length");
        }
    }

    /**
     * Uniform neighborhood of the given width, typically used as a caller default.
     */
    public static LaneNeighborhood filled(int lanes, String id, double distance) {
        double[] distances = new double[lanes];
        Arrays.fill(distances, distance);
        List<String> ids = Collections.nCopies(lanes, id);
        return new LaneNeighborhood(ids, ids, distances, distances);
    }

    @Override
    public double[] headways() {
        return headways.clone();
    }

    @Override
    public double[] tailways() {
        return tailways.clone();
    }

    public int laneCount() {
        return leaders.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LaneNeighborhood other)) {
            return false;
        }
        return leaders.equals(other.leaders)
                && followers.equals(other.followers)
                && Arrays.equals(headways, other.headways)
                && Arrays.equals(tailways, other.tailways);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(leaders, followers);
        result = 31 * result + Arrays.hashCode(headways);
        return 31 * result + Arrays.hashCode(tailways);
    }

    @Override
    public String toString() {
        return "LaneNeighborhood[leaders=" + leaders + ", followers=" + followers
                + ", headways=" + Arrays.toString(headways) + ", tailways=" + Arrays.toString(tailways) + "]";
    }
}
