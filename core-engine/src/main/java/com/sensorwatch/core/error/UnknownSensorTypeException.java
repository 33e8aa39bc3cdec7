package com.sensorwatch.core.error;

/**
 * Thrown by the sensor factory for a type tag it does not recognise.
 *
 * @since 1.0.0
 */
public class UnknownSensorTypeException extends SensorWatchException {

    private static final long serialVersionUID = 1L;

    private final String type;

    public UnknownSensorTypeException(String type) {
        super("Unknown sensor type: '" + type + "'. Supported types: temperature, vibration, humidity");
        this.type = type;
    }

    public String getType() {
        return type;
    }
}
