package com.sensorwatch.core.error;

/**
 * Thrown when a notifier is registered under a name already used by another
 * notifier of the same alert manager. Delivery results are keyed by notifier
 * name, so names must be unique.
 *
 * @since 1.0.0
 */
public class DuplicateNotifierException extends SensorWatchException {

    private static final long serialVersionUID = 1L;

    private final String notifierName;

    public DuplicateNotifierException(String notifierName) {
        super("Notifier already registered: " + notifierName);
        this.notifierName = notifierName;
    }

    public String getNotifierName() {
        return notifierName;
    }
}
