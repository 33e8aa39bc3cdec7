package com.sensorwatch.core.sensor;

import com.sensorwatch.core.error.UnknownSensorTypeException;

import java.util.Locale;

/**
 * Sensor variants understood by {@link SensorFactory}.
 *
 * @since 1.0.0
 */
public enum SensorType {

    TEMPERATURE("temperature"),
    VIBRATION("vibration"),
    HUMIDITY("humidity");

    private final String tag;

    SensorType(String tag) {
        this.tag = tag;
    }

    /**
     * @return lowercase configuration tag, e.g. {@code "temperature"}
     */
    public String getTag() {
        return tag;
    }

    /**
     * Resolve a configuration tag, ignoring case and surrounding blanks.
     *
     * @param tag the tag from configuration
     * @return matching type
     * @throws UnknownSensorTypeException if {@code tag} is {@code null} or not
     *                                    recognised
     */
    public static SensorType fromTag(String tag) {
        if (tag != null) {
            String normalised = tag.trim().toLowerCase(Locale.ROOT);
            for (SensorType type : values()) {
                if (type.tag.equals(normalised)) {
                    return type;
                }
            }
        }
        throw new UnknownSensorTypeException(tag);
    }
}
