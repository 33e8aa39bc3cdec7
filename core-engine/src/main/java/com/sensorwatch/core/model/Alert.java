package com.sensorwatch.core.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Alert raised when a reading breaches its sensor's thresholds.
 *
 * <p>
 * Transient: created by the alert manager, handed to every notifier and then
 * discarded. A matching {@link AlertRecord} is kept in the manager's history.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code sensorId}, {@code level} and
 * {@code timestamp} are required, and the level must be a breach.
 * </p>
 *
 * @since 1.0.0
 */
public final class Alert {

    private final String sensorId;
    private final String sensorType;
    private final AlertLevel level;
    private final double value;
    private final double magnitude;
    private final String message;
    private final Instant timestamp;

    private Alert(Builder builder) {
        this.sensorId = Objects.requireNonNull(builder.sensorId, "sensorId must not be null");
        this.level = Objects.requireNonNull(builder.level, "level must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        if (!level.isBreach()) {
            throw new IllegalArgumentException("An alert cannot carry level " + level);
        }
        this.sensorType = builder.sensorType;
        this.value = builder.value;
        this.magnitude = builder.magnitude;
        this.message = builder.message != null
                ? builder.message
                : String.format(Locale.ROOT, "ALERT %s: sensor %s value=%.2f", level, sensorId, value);
    }

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String sensorId;
        private String sensorType;
        private AlertLevel level;
        private double value;
        private double magnitude;
        private String message;
        private Instant timestamp;

        public Builder sensorId(String sensorId) {
            this.sensorId = sensorId;
            return this;
        }

        public Builder sensorType(String sensorType) {
            this.sensorType = sensorType;
            return this;
        }

        public Builder level(AlertLevel level) {
            this.level = level;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder magnitude(double magnitude) {
            this.magnitude = magnitude;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /**
         * Build the alert.
         *
         * @return a new {@link Alert}
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if {@code level} is
         *                                  {@link AlertLevel#NONE}
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    public String getSensorId() {
        return sensorId;
    }

    public String getSensorType() {
        return sensorType;
    }

    public AlertLevel getLevel() {
        return level;
    }

    public double getValue() {
        return value;
    }

    /**
     * @return normalised distance beyond the breached threshold
     */
    public double getMagnitude() {
        return magnitude;
    }

    public String getMessage() {
        return message;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "Alert{" +
                "sensorId='" + sensorId + '\'' +
                ", level=" + level +
                ", value=" + value +
                ", timestamp=" + timestamp +
                ", message='" + message + '\'' +
                '}';
    }
}
