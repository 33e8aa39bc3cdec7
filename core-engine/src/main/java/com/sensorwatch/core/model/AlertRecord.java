package com.sensorwatch.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;
import java.util.Objects;

/**
 * History entry kept by the alert manager for every raised alert, including
 * alerts that were suppressed by the hourly budget.
 *
 * <p>
 * Exportable as JSON (ISO-8601 timestamps) or as a single CSV line.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "timestamp", "sensorId", "message", "level", "measuredValue" })
public final class AlertRecord {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private final String sensorId;
    private final String message;
    private final AlertLevel level;
    private final double measuredValue;
    private final Instant timestamp;

    public AlertRecord(String sensorId, String message, AlertLevel level, double measuredValue,
            Instant timestamp) {
        this.sensorId = Objects.requireNonNull(sensorId, "sensorId must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.level = Objects.requireNonNull(level, "level must not be null");
        this.measuredValue = measuredValue;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    /**
     * Create the history entry for an alert.
     *
     * @param alert the raised alert
     * @return record carrying the alert's sensor, message, level, value and time
     */
    public static AlertRecord of(Alert alert) {
        Objects.requireNonNull(alert, "Alert must not be null");
        return new AlertRecord(alert.getSensorId(), alert.getMessage(), alert.getLevel(),
                alert.getValue(), alert.getTimestamp());
    }

    /**
     * @return JSON object with keys {@code timestamp}, {@code sensorId},
     *         {@code message}, {@code level} and {@code measuredValue}
     * @throws IllegalStateException if serialization fails
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize alert record for sensor " + sensorId, e);
        }
    }

    /**
     * @return {@code timestamp,sensorId,level,measuredValue,'message'}
     */
    public String toCsv() {
        return timestamp + "," + sensorId + "," + level + "," + measuredValue + ",'" + message + "'";
    }

    public String getSensorId() {
        return sensorId;
    }

    public String getMessage() {
        return message;
    }

    public AlertLevel getLevel() {
        return level;
    }

    public double getMeasuredValue() {
        return measuredValue;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "AlertRecord{" +
                "sensorId='" + sensorId + '\'' +
                ", level=" + level +
                ", measuredValue=" + measuredValue +
                ", timestamp=" + timestamp +
                '}';
    }
}
