package org.lanegraph.vehicle;

import lombok.Builder;
import lombok.Value;

/**
 * Tuning knobs of a {@link VehicleStateTable}.
 */
@Value
@Builder
public class VehicleTableConfig {
    public static final String REASON_INVALID_SIM_STEP = "V02_INVALID_SIM_STEP";
    public static final String REASON_INVALID_LENGTH = "V03_INVALID_DEFAULT_LENGTH";
    public static final String REASON_INVALID_HISTORY = "V04_INVALID_HISTORY_LIMIT";

    /** Simulated seconds per step; drives inflow/outflow rates. */
    @Builder.Default
    double simStep = 0.1d;

    /** Vehicle length used when neither the snapshot nor the type reports one. */
    @Builder.Default
    double defaultLength = 5.0d;

    /** Number of per-step departure/arrival counts retained for rate queries. */
    @Builder.Default
    int maxHistorySteps = 100_000;

    public static VehicleTableConfig defaults() {
        return VehicleTableConfig.builder().build();
    }

    void validate() {
        if (!Double.isFinite(simStep) || simStep <= 0.0d) {
            throw new IllegalArgumentException(REASON_INVALID_SIM_STEP + ": simStep must be > 0, got " + simStep);
        }
        if (!Double.isFinite(defaultLength) || defaultLength < 0.0d) {
            throw new IllegalArgumentException(
                    REASON_INVALID_LENGTH + ": defaultLength must be >= 0, got " + defaultLength);
        }
        if (maxHistorySteps < 1) {
            throw new IllegalArgumentException(
                    REASON_INVALID_HISTORY + ": maxHistorySteps must be >= 1, got " + maxHistorySteps);
        }
    }
}
