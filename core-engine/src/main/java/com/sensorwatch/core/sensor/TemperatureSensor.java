package com.sensorwatch.core.sensor;

import com.sensorwatch.core.model.SensorReading;

import java.time.Clock;

/**
 * Temperature sensor with a {@code [min, max]} comfort band.
 *
 * <p>
 * A reading strictly below {@code min} or strictly above {@code max} is a
 * breach; its magnitude is the overshoot divided by {@code max - min}.
 * </p>
 *
 * @since 1.0.0
 */
public class TemperatureSensor extends Sensor {

    /** Lower bound of the default simulated range. */
    static final double SIMULATED_LOW = -20.0;
    /** Upper bound of the default simulated range. */
    static final double SIMULATED_HIGH = 100.0;

    private final double min;
    private final double max;
    private final String unit;

    /**
     * Temperature sensor in Celsius with a seeded random source over
     * {@code [-20, 100)}.
     */
    public TemperatureSensor(String id, double min, double max) {
        this(id, min, max, "C", null, 0.0,
                ReadingSource.uniform(SIMULATED_LOW, SIMULATED_HIGH, id == null ? 0 : id.hashCode()),
                Clock.systemUTC());
    }

    /**
     * @throws com.sensorwatch.core.error.InvalidConfigurationException if the
     *         band is not finite or {@code min >= max}
     */
    public TemperatureSensor(String id, double min, double max, String unit, String location,
            double calibration, ReadingSource source, Clock clock) {
        super(id, location, calibration, source, clock);
        requireOrderedRange(id, min, max);
        this.min = min;
        this.max = max;
        this.unit = unit != null && !unit.isBlank() ? unit : "C";
    }

    @Override
    public double breachMagnitude(SensorReading reading) {
        return rangeMagnitude(checkOwnership(reading).getValue(), min, max);
    }

    /**
     * Convert the last reading to Fahrenheit. Assumes Celsius readings.
     *
     * @return last reading in Fahrenheit
     * @throws IllegalStateException if no reading has been recorded
     */
    public double toFahrenheit() {
        SensorReading last = getLastReading()
                .orElseThrow(() -> new IllegalStateException("Sensor '" + getId() + "' has no reading yet"));
        return last.getValue() * 9.0 / 5.0 + 32.0;
    }

    @Override
    public SensorType getType() {
        return SensorType.TEMPERATURE;
    }

    @Override
    public String describe() {
        return "Temperature (" + unit + ")";
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public String getUnit() {
        return unit;
    }
}
