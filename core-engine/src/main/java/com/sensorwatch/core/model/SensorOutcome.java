package com.sensorwatch.core.model;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Per-sensor result of one monitoring cycle.
 *
 * <p>
 * Distinguishes a sensor that was evaluated (at any level, including
 * {@link AlertLevel#NONE}) from one whose reading or evaluation failed.
 * </p>
 *
 * @since 1.0.0
 */
public final class SensorOutcome {

    /** Whether the sensor produced and evaluated a reading. */
    public enum Status {
        EVALUATED,
        FAILED
    }

    private final String sensorId;
    private final Status status;
    private final AlertLevel level;
    private final SensorReading reading;
    private final String error;

    private SensorOutcome(String sensorId, Status status, AlertLevel level, SensorReading reading,
            String error) {
        this.sensorId = Objects.requireNonNull(sensorId, "sensorId must not be null");
        this.status = status;
        this.level = level;
        this.reading = reading;
        this.error = error;
    }

    public static SensorOutcome evaluated(SensorReading reading, AlertLevel level) {
        Objects.requireNonNull(reading, "reading must not be null");
        Objects.requireNonNull(level, "level must not be null");
        return new SensorOutcome(reading.getSensorId(), Status.EVALUATED, level, reading, null);
    }

    public static SensorOutcome failed(String sensorId, String error) {
        return new SensorOutcome(sensorId, Status.FAILED, AlertLevel.NONE, null, error);
    }

    public String getSensorId() {
        return sensorId;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    /**
     * @return evaluated level; {@link AlertLevel#NONE} for failed sensors
     */
    public AlertLevel getLevel() {
        return level;
    }

    public Optional<SensorReading> getReading() {
        return Optional.ofNullable(reading);
    }

    public OptionalDouble getValue() {
        return reading != null ? OptionalDouble.of(reading.getValue()) : OptionalDouble.empty();
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return status == Status.FAILED
                ? "SensorOutcome{sensorId='" + sensorId + "', FAILED: " + error + '}'
                : "SensorOutcome{sensorId='" + sensorId + "', level=" + level
                        + ", value=" + reading.getValue() + '}';
    }
}
