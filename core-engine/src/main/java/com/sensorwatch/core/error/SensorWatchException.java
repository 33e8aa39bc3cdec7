package com.sensorwatch.core.error;

/**
 * Base runtime exception for all Sensor Watch construction and registration
 * errors.
 *
 * @since 1.0.0
 */
public class SensorWatchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SensorWatchException(String message) {
        super(message);
    }

    public SensorWatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
