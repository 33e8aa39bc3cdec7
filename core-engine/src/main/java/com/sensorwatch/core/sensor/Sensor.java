package com.sensorwatch.core.sensor;

import com.sensorwatch.core.error.InvalidConfigurationException;
import com.sensorwatch.core.model.AlertLevel;
import com.sensorwatch.core.model.SensorReading;

import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Common contract for all sensor variants: produce a reading, then evaluate
 * it against the variant's thresholds.
 *
 * <p>
 * Each cycle a sensor goes {@code Idle → ReadingProduced → Evaluated(level)}.
 * The only state carried across cycles is the last reading (and, for
 * vibration, the RMS window).
 * </p>
 *
 * <h3>Thresholds</h3>
 * <p>
 * Boundaries are strict: a reading exactly on a threshold is not a breach.
 * Subclasses validate their thresholds in the constructor and fail with
 * {@link InvalidConfigurationException}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. A sensor is owned by a single alert manager and polled
 * from one thread.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class Sensor {

    /** Location used when none is configured. */
    public static final String DEFAULT_LOCATION = "Unspecified";

    private final String id;
    private final String location;
    private final double calibration;
    private final ReadingSource source;
    private final Clock clock;

    private SensorReading lastReading;

    /**
     * @param id          unique identifier; must not be blank
     * @param location    free-text location; {@code null} means
     *                    {@value #DEFAULT_LOCATION}
     * @param calibration offset added to every raw value; must be finite
     * @param source      raw value supplier; must not be {@code null}
     * @param clock       timestamp source; must not be {@code null}
     * @throws InvalidConfigurationException if {@code id} is blank or
     *                                       {@code calibration} is not finite
     */
    protected Sensor(String id, String location, double calibration, ReadingSource source, Clock clock) {
        if (id == null || id.isBlank()) {
            throw new InvalidConfigurationException("Sensor 'id' must not be blank");
        }
        if (!Double.isFinite(calibration)) {
            throw new InvalidConfigurationException(
                    "Sensor '" + id + "' calibration must be finite, got: " + calibration);
        }
        this.id = id;
        this.location = location != null && !location.isBlank() ? location : DEFAULT_LOCATION;
        this.calibration = calibration;
        this.source = Objects.requireNonNull(source, "ReadingSource must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    // ---------------------------------------------------------------
    // Readings
    // ---------------------------------------------------------------

    /**
     * Draw the next value from the reading source and record it.
     *
     * @return the new reading, also retained as {@link #getLastReading()}
     * @throws IllegalStateException if the source yields a non-finite value
     */
    public SensorReading produceReading() {
        double raw = source.next();
        if (!Double.isFinite(raw)) {
            throw new IllegalStateException("Sensor '" + id + "' produced a non-finite value: " + raw);
        }
        return record(raw);
    }

    /**
     * Record an externally supplied raw value, applying calibration.
     *
     * @param rawValue uncalibrated value; must be finite
     * @return the new reading, also retained as {@link #getLastReading()}
     * @throws IllegalArgumentException if {@code rawValue} is not finite
     */
    public SensorReading record(double rawValue) {
        if (!Double.isFinite(rawValue)) {
            throw new IllegalArgumentException("Reading value must be finite, got: " + rawValue);
        }
        SensorReading reading = new SensorReading(id, rawValue + calibration, clock.instant());
        lastReading = reading;
        onReading(reading);
        return reading;
    }

    /**
     * Hook invoked after every recorded reading. Default does nothing.
     *
     * @param reading the reading just recorded
     */
    protected void onReading(SensorReading reading) {
    }

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------

    /**
     * Evaluate a reading against this sensor's thresholds.
     *
     * @param reading reading produced by this sensor
     * @return {@link AlertLevel#NONE} within thresholds, otherwise a level
     *         scaled by {@link #breachMagnitude(SensorReading)}
     * @throws NullPointerException     if {@code reading} is {@code null}
     * @throws IllegalArgumentException if the reading belongs to another sensor
     */
    public AlertLevel evaluate(SensorReading reading) {
        return AlertLevel.fromMagnitude(breachMagnitude(checkOwnership(reading)));
    }

    /**
     * Normalised distance beyond the breached threshold.
     *
     * @param reading reading produced by this sensor
     * @return {@code 0} when no threshold is breached, otherwise a positive
     *         value that grows with the distance from the threshold
     */
    public abstract double breachMagnitude(SensorReading reading);

    /**
     * @return the variant tag
     */
    public abstract SensorType getType();

    /**
     * @return human-readable kind, e.g. {@code "Temperature (C)"}
     */
    public abstract String describe();

    /**
     * One-line status using the last reading.
     *
     * @return e.g. {@code "Sensor T1 (Temperature (C)): ALERT - last=85.00"}
     */
    public String getStatus() {
        if (lastReading == null) {
            return String.format(Locale.ROOT, "Sensor %s (%s): NORMAL - no reading", id, describe());
        }
        String state = evaluate(lastReading).isBreach() ? "ALERT" : "NORMAL";
        return String.format(Locale.ROOT, "Sensor %s (%s): %s - last=%.2f", id, describe(), state, lastReading.getValue());
    }

    protected SensorReading checkOwnership(SensorReading reading) {
        Objects.requireNonNull(reading, "Reading must not be null");
        if (!id.equals(reading.getSensorId())) {
            throw new IllegalArgumentException(
                    "Reading from sensor '" + reading.getSensorId() + "' cannot be evaluated by '" + id + "'");
        }
        return reading;
    }

    /**
     * Linear overshoot of {@code value} outside {@code [min, max]}, normalised
     * by the span.
     */
    static double rangeMagnitude(double value, double min, double max) {
        double span = max - min;
        if (value > max) {
            return (value - max) / span;
        }
        if (value < min) {
            return (min - value) / span;
        }
        return 0.0;
    }

    static void requireFinite(String sensorId, String name, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidConfigurationException(
                    "Sensor '" + sensorId + "' requires a finite '" + name + "', got: " + value);
        }
    }

    static void requireOrderedRange(String sensorId, double min, double max) {
        requireFinite(sensorId, "min", min);
        requireFinite(sensorId, "max", max);
        if (!(min < max)) {
            throw new InvalidConfigurationException(
                    "Sensor '" + sensorId + "' requires 'min' < 'max', got: min=" + min + ", max=" + max);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getLocation() {
        return location;
    }

    public double getCalibration() {
        return calibration;
    }

    public Optional<SensorReading> getLastReading() {
        return Optional.ofNullable(lastReading);
    }

    protected Clock getClock() {
        return clock;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id='" + id + "', location='" + location + "'}";
    }
}
