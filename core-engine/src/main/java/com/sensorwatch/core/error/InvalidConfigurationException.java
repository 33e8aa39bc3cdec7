package com.sensorwatch.core.error;

/**
 * Thrown when a sensor, notifier or system configuration is missing a
 * required value or carries one outside its domain (e.g. {@code min >= max}).
 *
 * <p>
 * Fatal to the construction that raised it only; callers decide whether to
 * skip the offending entry or abort.
 * </p>
 *
 * @since 1.0.0
 */
public class InvalidConfigurationException extends SensorWatchException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
