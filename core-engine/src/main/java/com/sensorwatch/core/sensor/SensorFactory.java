package com.sensorwatch.core.sensor;

import com.sensorwatch.core.config.ConfigValues;
import com.sensorwatch.core.error.InvalidConfigurationException;
import com.sensorwatch.core.error.UnknownSensorTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Builds {@link Sensor} instances from a type tag and an option map.
 *
 * <p>
 * Recognised options: {@code id}, {@code min}, {@code max},
 * {@code rmsLimit}, {@code location}, {@code calibration}, {@code unit},
 * {@code windowSize}, {@code frequencyHz}, {@code environment},
 * {@code seed} and {@code values} (a list replayed in order instead of
 * random simulation). Anything else is ignored.
 * </p>
 *
 * <p>
 * Register new variants here and in {@link SensorType}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SensorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(SensorFactory.class);

    private SensorFactory() {
        // utility class — not instantiable
    }

    /**
     * Create a sensor whose type is read from the {@code type} option.
     *
     * @param params option map; must not be {@code null}
     * @return configured sensor
     * @throws UnknownSensorTypeException    if {@code type} is missing or
     *                                       unknown
     * @throws InvalidConfigurationException if a required option is missing or
     *                                       out of range
     */
    public static Sensor create(Map<String, ?> params) {
        Objects.requireNonNull(params, "Sensor configuration must not be null");
        Object type = params.get("type");
        return create(type != null ? type.toString() : null, params);
    }

    /**
     * Create a sensor of the given type.
     *
     * @param type   variant tag, e.g. {@code "temperature"}
     * @param params option map; must not be {@code null}
     * @return configured sensor
     * @throws UnknownSensorTypeException    if {@code type} is unknown
     * @throws InvalidConfigurationException if a required option is missing or
     *                                       out of range
     */
    public static Sensor create(String type, Map<String, ?> params) {
        SensorType sensorType = SensorType.fromTag(type);
        Objects.requireNonNull(params, "Sensor configuration must not be null");

        String id = ConfigValues.optionalString(params, "id", null);
        if (id == null) {
            id = sensorType.getTag() + "-" + UUID.randomUUID().toString().substring(0, 8);
        }
        String context = sensorType.getTag() + " sensor '" + id + "'";

        String location = ConfigValues.optionalString(params, "location", null);
        double calibration = ConfigValues.optionalDouble(params, "calibration", 0.0, context);
        Clock clock = Clock.systemUTC();

        Sensor sensor = switch (sensorType) {
            case TEMPERATURE -> new TemperatureSensor(id,
                    ConfigValues.requiredDouble(params, "min", context),
                    ConfigValues.requiredDouble(params, "max", context),
                    ConfigValues.optionalString(params, "unit", "C"),
                    location, calibration,
                    readingSource(params, id, TemperatureSensor.SIMULATED_LOW, TemperatureSensor.SIMULATED_HIGH,
                            context),
                    clock);
            case HUMIDITY -> new HumiditySensor(id,
                    ConfigValues.requiredDouble(params, "min", context),
                    ConfigValues.requiredDouble(params, "max", context),
                    ConfigValues.optionalString(params, "environment", null),
                    location, calibration,
                    readingSource(params, id, 0.0, 100.0, context),
                    clock);
            case VIBRATION -> new VibrationSensor(id,
                    ConfigValues.requiredDouble(params, "rmsLimit", context),
                    ConfigValues.optionalInt(params, "windowSize", VibrationSensor.DEFAULT_WINDOW_SIZE, context),
                    ConfigValues.optionalInt(params, "frequencyHz", VibrationSensor.DEFAULT_FREQUENCY_HZ, context),
                    location, calibration,
                    readingSource(params, id, 0.0, 5.0, context),
                    clock);
        };

        LOG.debug("Created {} sensor '{}'", sensorType.getTag(), id);
        return sensor;
    }

    /**
     * Create one sensor per configuration entry, preserving order.
     *
     * @param configs sensor option maps, each carrying a {@code type}
     * @return unmodifiable list of sensors
     * @throws NullPointerException if {@code configs} is {@code null}
     */
    public static List<Sensor> createAll(List<? extends Map<String, ?>> configs) {
        Objects.requireNonNull(configs, "Sensor configuration list must not be null");
        LOG.info("Creating {} sensor(s) from configuration", configs.size());
        List<Sensor> sensors = configs.stream()
                .map(SensorFactory::create)
                .toList();
        return Collections.unmodifiableList(sensors);
    }

    private static ReadingSource readingSource(Map<String, ?> params, String id, double low, double high,
            String context) {
        double[] values = ConfigValues.optionalDoubleList(params, "values", context);
        if (values != null) {
            return ReadingSource.fixed(values);
        }
        long seed = ConfigValues.optionalLong(params, "seed", id.hashCode(), context);
        return ReadingSource.uniform(low, high, seed);
    }
}
