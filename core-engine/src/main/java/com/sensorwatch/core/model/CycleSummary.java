package com.sensorwatch.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable result of one monitoring cycle.
 *
 * <p>
 * Sensor outcomes are in polling order; delivery results are in dispatch
 * order (alert by alert, notifier by notifier).
 * </p>
 *
 * @since 1.0.0
 */
public final class CycleSummary {

    private final long cycleNumber;
    private final Instant startedAt;
    private final List<SensorOutcome> sensorOutcomes;
    private final List<DeliveryResult> deliveries;
    private final int alertsRaised;
    private final int alertsSuppressed;

    public CycleSummary(long cycleNumber, Instant startedAt, List<SensorOutcome> sensorOutcomes,
            List<DeliveryResult> deliveries, int alertsRaised, int alertsSuppressed) {
        this.cycleNumber = cycleNumber;
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt must not be null");
        this.sensorOutcomes = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(sensorOutcomes, "sensorOutcomes must not be null")));
        this.deliveries = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(deliveries, "deliveries must not be null")));
        this.alertsRaised = alertsRaised;
        this.alertsSuppressed = alertsSuppressed;
    }

    public long getCycleNumber() {
        return cycleNumber;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    /**
     * @return unmodifiable list of per-sensor outcomes in polling order
     */
    public List<SensorOutcome> getSensorOutcomes() {
        return sensorOutcomes;
    }

    /**
     * @return unmodifiable list of delivery results in dispatch order
     */
    public List<DeliveryResult> getDeliveries() {
        return deliveries;
    }

    /**
     * @return number of alerts raised, suppressed ones included
     */
    public int getAlertsRaised() {
        return alertsRaised;
    }

    /**
     * @return number of alerts recorded but not dispatched because the hourly
     *         alert budget was exhausted
     */
    public int getAlertsSuppressed() {
        return alertsSuppressed;
    }

    public long failedDeliveries() {
        return deliveries.stream().filter(d -> !d.isDelivered()).count();
    }

    public long failedSensors() {
        return sensorOutcomes.stream().filter(SensorOutcome::isFailed).count();
    }

    /**
     * @param notifierName name reported by the notifier
     * @return that notifier's results in dispatch order
     */
    public List<DeliveryResult> deliveriesFor(String notifierName) {
        return deliveries.stream()
                .filter(d -> d.getNotifierName().equals(notifierName))
                .toList();
    }

    @Override
    public String toString() {
        return "CycleSummary{" +
                "cycle=" + cycleNumber +
                ", sensors=" + sensorOutcomes.size() +
                ", failedSensors=" + failedSensors() +
                ", alertsRaised=" + alertsRaised +
                ", alertsSuppressed=" + alertsSuppressed +
                ", deliveries=" + deliveries.size() +
                ", failedDeliveries=" + failedDeliveries() +
                '}';
    }
}
