package com.sensorwatch.core.sensor;

import com.sensorwatch.core.error.InvalidConfigurationException;
import com.sensorwatch.core.model.SensorReading;

import java.time.Clock;

/**
 * Relative-humidity sensor with a {@code [min, max]} band inside
 * {@code [0, 100]} percent.
 *
 * @since 1.0.0
 */
public class HumiditySensor extends Sensor {

    private final double min;
    private final double max;
    private final String environment;

    /**
     * Indoor humidity sensor with a seeded random source over {@code [0, 100)}.
     */
    public HumiditySensor(String id, double min, double max) {
        this(id, min, max, null, null, 0.0,
                ReadingSource.uniform(0.0, 100.0, id == null ? 0 : id.hashCode()),
                Clock.systemUTC());
    }

    /**
     * @throws InvalidConfigurationException if {@code min >= max} or either
     *                                       bound lies outside {@code [0, 100]}
     */
    public HumiditySensor(String id, double min, double max, String environment, String location,
            double calibration, ReadingSource source, Clock clock) {
        super(id, location, calibration, source, clock);
        requireOrderedRange(id, min, max);
        if (min < 0.0 || max > 100.0) {
            throw new InvalidConfigurationException(
                    "Sensor '" + id + "' humidity band must lie within [0, 100], got: min=" + min + ", max=" + max);
        }
        this.min = min;
        this.max = max;
        this.environment = environment != null && !environment.isBlank() ? environment : "indoor";
    }

    @Override
    public double breachMagnitude(SensorReading reading) {
        return rangeMagnitude(checkOwnership(reading).getValue(), min, max);
    }

    /**
     * Approximate dew point from the last reading, {@code h - (100 - h) / 5}.
     *
     * @return dew point, or {@code 0} when there is no positive reading
     */
    public double dewPoint() {
        double humidity = getLastReading().map(SensorReading::getValue).orElse(0.0);
        if (humidity > 0) {
            return humidity - (100.0 - humidity) / 5.0;
        }
        return 0.0;
    }

    @Override
    public SensorType getType() {
        return SensorType.HUMIDITY;
    }

    @Override
    public String describe() {
        return "Humidity (" + environment + ")";
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public String getEnvironment() {
        return environment;
    }
}
