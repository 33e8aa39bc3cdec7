package com.sensorwatch.core.model;

/**
 * Outcome of evaluating a reading against a sensor's thresholds, ordered by
 * severity.
 *
 * @since 1.0.0
 */
public enum AlertLevel {

    /** Reading within thresholds (boundaries included). */
    NONE,

    /** Threshold breached by less than {@link #CRITICAL_MAGNITUDE}. */
    WARNING,

    /** Threshold breached by {@link #CRITICAL_MAGNITUDE} or more. */
    CRITICAL;

    /**
     * Normalised breach magnitude at which a breach becomes critical. Range
     * sensors normalise by their span, vibration by its RMS limit.
     */
    public static final double CRITICAL_MAGNITUDE = 0.5;

    /**
     * @return {@code true} for every level other than {@link #NONE}
     */
    public boolean isBreach() {
        return this != NONE;
    }

    /**
     * Map a normalised breach magnitude to a level.
     *
     * @param magnitude distance beyond the threshold, normalised; {@code 0}
     *                  (or less) means no breach
     * @return the matching level
     */
    public static AlertLevel fromMagnitude(double magnitude) {
        if (!(magnitude > 0)) {
            return NONE;
        }
        return magnitude < CRITICAL_MAGNITUDE ? WARNING : CRITICAL;
    }
}
