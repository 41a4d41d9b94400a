package org.lanegraph.core.sentinel;

import lombok.experimental.UtilityClass;

/**
 * Value-encoded error channel shared by every per-step query.
 *
 * <p>Per-step accessors never throw for a missing edge or vehicle. They return one of
 * the values below (or a caller-supplied default) so hot loops can test for the
 * condition numerically.</p>
 */
@UtilityClass
public final class Sentinels {
    /** Returned by length/speed/lane/position queries when the edge is unknown. */
    public static final int UNKNOWN_EDGE = -1001;

    /** Default numeric error value for per-vehicle accessors. */
    public static final double ERROR_VALUE = -1001.0d;

    /** Id reported when no leader/follower exists. */
    public static final String NO_VEHICLE = "";

    /** Edge id reported for a vehicle that is no longer present. */
    public static final String NO_EDGE = "";

    /**
     * Returns true when the id is the "no vehicle" marker (or null).
     */
    public static boolean isMissing(String vehicleId) {
        return vehicleId == null || vehicleId.isEmpty();
    }
}
