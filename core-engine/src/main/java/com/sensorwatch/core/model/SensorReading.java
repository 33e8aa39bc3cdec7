package com.sensorwatch.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single value produced by a sensor.
 *
 * <p>
 * Immutable once produced. Sensors keep only their most recent reading
 * (vibration sensors additionally keep a short RMS window).
 * </p>
 *
 * @since 1.0.0
 */
public final class SensorReading implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String sensorId;
    private final double value;
    private final Instant timestamp;

    /**
     * @param sensorId  identifier of the producing sensor; must not be
     *                  {@code null}
     * @param value     measured value (already calibrated)
     * @param timestamp production time; must not be {@code null}
     * @throws NullPointerException if {@code sensorId} or {@code timestamp} is
     *                              {@code null}
     */
    public SensorReading(String sensorId, double value, Instant timestamp) {
        this.sensorId = Objects.requireNonNull(sensorId, "sensorId must not be null");
        this.value = value;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public String getSensorId() {
        return sensorId;
    }

    public double getValue() {
        return value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SensorReading that))
            return false;
        return Double.compare(value, that.value) == 0
                && sensorId.equals(that.sensorId)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sensorId, value, timestamp);
    }

    @Override
    public String toString() {
        return "SensorReading{" +
                "sensorId='" + sensorId + '\'' +
                ", value=" + value +
                ", timestamp=" + timestamp +
                '}';
    }
}
