package com.sensorwatch.core.notify;

/**
 * Moves a formatted message to its destination.
 *
 * <p>
 * The only implementation shipped is {@link RecordingTransport}; real
 * SMTP/HTTP/SMS clients are deliberately not part of this library.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface NotificationTransport {

    /**
     * @param channel channel label, e.g. {@code "EMAIL"}
     * @param target  channel-specific address (email, URL, phone number)
     * @param message formatted message body
     * @throws DeliveryException if the message could not be delivered
     */
    void deliver(String channel, String target, String message) throws DeliveryException;
}
