package com.sensorwatch.core.notify;

/**
 * Raised by a {@link NotificationTransport} when it cannot hand a message
 * over. Notifiers convert it into a failed delivery result.
 *
 * @since 1.0.0
 */
public class DeliveryException extends Exception {

    private static final long serialVersionUID = 1L;

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
