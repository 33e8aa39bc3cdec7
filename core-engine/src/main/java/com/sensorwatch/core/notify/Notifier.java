package com.sensorwatch.core.notify;

import com.sensorwatch.core.model.Alert;
import com.sensorwatch.core.model.DeliveryResult;

/**
 * A delivery channel for alerts.
 *
 * <p>
 * Implementations report failure through the returned
 * {@link DeliveryResult}; they must not throw for delivery problems and do
 * not retry.
 * </p>
 */
public interface Notifier {

    /**
     * Attempt to deliver an alert.
     *
     * @param alert the alert to deliver
     * @return {@code DELIVERED}, or {@code FAILED} with a reason
     */
    DeliveryResult send(Alert alert);

    /**
     * @return name used in delivery results, e.g. {@code "email:ops@example.com"}
     */
    String getName();
}
