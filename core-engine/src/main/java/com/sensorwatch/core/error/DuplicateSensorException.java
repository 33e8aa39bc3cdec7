package com.sensorwatch.core.error;

/**
 * Thrown when a sensor is registered under an identifier already held by the
 * same alert manager.
 *
 * @since 1.0.0
 */
public class DuplicateSensorException extends SensorWatchException {

    private static final long serialVersionUID = 1L;

    private final String sensorId;

    public DuplicateSensorException(String sensorId) {
        super("Sensor already registered: " + sensorId);
        this.sensorId = sensorId;
    }

    public String getSensorId() {
        return sensorId;
    }
}
