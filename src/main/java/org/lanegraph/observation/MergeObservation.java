package org.lanegraph.observation;

import java.util.List;
import java.util.Objects;

/**
 * Observation matrix for the RL vehicles of one step.
 *
 * @param rlIds vehicles described by the first {@code rlIds.size()} rows.
 * @param features one row of {@link MergeObservationBuilder#FEATURES} values per row; rows past
 *                 {@code rlIds.size()} are zero padding.
 * @param leaders leaders that contributed to the observation.
 * @param followers followers that contributed to the observation.
 */
public record MergeObservation(
        List<String> rlIds,
        double[][] features,
        List<String> leaders,
        List<String> followers
) {
    public MergeObservation {
        rlIds = List.copyOf(Objects.requireNonNull(rlIds, "rlIds"));
        leaders = List.copyOf(Objects.requireNonNull(leaders, "leaders"));
        followers = List.copyOf(Objects.requireNonNull(followers, "followers"));
        Objects.requireNonNull(features, "features");
        double[][] copy = new double[features.length][];
        for (int i = 0; i < features.length; i++) {
            copy[i] = features[i].clone();
        }
        features = copy;
    }

    /**
     * Number of populated rows (used to mask padding).
     */
    public int numRl() {
        return rlIds.size();
    }

    /**
     * Copy of one feature row.
     */
    public double[] row(int index) {
        return features[index].clone();
    }

    @Override
    public double[][] features() {
        double[][] copy = new double[features.length][];
        for (int i = 0; i < features.length; i++) {
            copy[i] = features[i].clone();
        }
        return copy;
    }
}
