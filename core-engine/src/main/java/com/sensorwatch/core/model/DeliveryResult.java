package com.sensorwatch.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of handing one alert to one notifier.
 *
 * <p>
 * A failed delivery is data, not an exception: it is recorded in the cycle
 * summary and never retried.
 * </p>
 *
 * @since 1.0.0
 */
public final class DeliveryResult {

    /** Delivery outcome. */
    public enum Status {
        DELIVERED,
        FAILED
    }

    private final String notifierName;
    private final String sensorId;
    private final Status status;
    private final String reason;

    private DeliveryResult(String notifierName, String sensorId, Status status, String reason) {
        this.notifierName = Objects.requireNonNull(notifierName, "notifierName must not be null");
        this.sensorId = Objects.requireNonNull(sensorId, "sensorId must not be null");
        this.status = status;
        this.reason = reason;
    }

    public static DeliveryResult delivered(String notifierName, String sensorId) {
        return new DeliveryResult(notifierName, sensorId, Status.DELIVERED, null);
    }

    public static DeliveryResult failed(String notifierName, String sensorId, String reason) {
        return new DeliveryResult(notifierName, sensorId, Status.FAILED, reason);
    }

    public String getNotifierName() {
        return notifierName;
    }

    public String getSensorId() {
        return sensorId;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isDelivered() {
        return status == Status.DELIVERED;
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DeliveryResult that))
            return false;
        return notifierName.equals(that.notifierName)
                && sensorId.equals(that.sensorId)
                && status == that.status
                && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(notifierName, sensorId, status, reason);
    }

    @Override
    public String toString() {
        return "DeliveryResult{" +
                "notifier='" + notifierName + '\'' +
                ", sensorId='" + sensorId + '\'' +
                ", status=" + status +
                (reason != null ? ", reason='" + reason + '\'' : "") +
                '}';
    }
}
