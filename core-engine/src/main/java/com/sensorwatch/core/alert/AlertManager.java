package com.sensorwatch.core.alert;

import com.sensorwatch.core.config.MonitoringConfig;
import com.sensorwatch.core.error.DuplicateNotifierException;
import com.sensorwatch.core.error.DuplicateSensorException;
import com.sensorwatch.core.model.Alert;
import com.sensorwatch.core.model.AlertLevel;
import com.sensorwatch.core.model.AlertRecord;
import com.sensorwatch.core.model.CycleSummary;
import com.sensorwatch.core.model.DeliveryResult;
import com.sensorwatch.core.model.SensorOutcome;
import com.sensorwatch.core.model.SensorReading;
import com.sensorwatch.core.notify.Notifier;
import com.sensorwatch.core.sensor.Sensor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns the sensors and notifiers of one monitoring system and drives
 * evaluation cycles.
 *
 * <h3>Ordering</h3>
 * <p>
 * Sensors are polled in registration order; every alert is handed to every
 * notifier in registration order. There is no routing or filtering.
 * </p>
 *
 * <h3>Failure Isolation</h3>
 * <p>
 * {@link #runCycle()} never throws because of a sensor or a notifier. A
 * sensor that fails to read or evaluate is reported as
 * {@link SensorOutcome.Status#FAILED}; a notifier that throws is reported as a
 * failed delivery. Registration errors, by contrast, are thrown immediately.
 * </p>
 *
 * <h3>Alert Budget</h3>
 * <p>
 * Off by default: every alert reaches every notifier. When
 * {@link MonitoringConfig#getMaxAlertsPerHour()} is positive, at most that
 * many alerts are dispatched per rolling hour. Alerts over budget are still
 * recorded in the history and counted as suppressed in the summary.
 * </p>
 *
 * <h3>History</h3>
 * <p>
 * Keeps the last {@link MonitoringConfig#getMaxHistorySize()} alert records;
 * older ones are evicted first.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe; one cycle runs to completion before the next starts.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertManager {

    private static final Logger LOG = LoggerFactory.getLogger(AlertManager.class);

    /** Sensors keyed by id, in registration order. */
    private final Map<String, Sensor> sensors = new LinkedHashMap<>();
    private final List<Notifier> notifiers = new ArrayList<>();
    /** Recorded alerts, oldest first, capped at the configured history size. */
    private final Deque<AlertRecord> history = new ArrayDeque<>();

    private final MonitoringConfig config;
    private final AlertBudget budget;
    private final Clock clock;

    private long cycleCount;

    public AlertManager() {
        this(new MonitoringConfig());
    }

    public AlertManager(MonitoringConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * @param config system settings; validated here
     * @param clock  time source for cycles and the alert budget
     * @throws com.sensorwatch.core.error.InvalidConfigurationException if
     *         {@code config} is invalid
     */
    public AlertManager(MonitoringConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "MonitoringConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        config.validate();
        this.budget = new AlertBudget(config.getMaxAlertsPerHour(), clock);
    }

    // ---------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------

    /**
     * Append a sensor to the polling order.
     *
     * @param sensor sensor to own; must not be {@code null}
     * @throws DuplicateSensorException if a sensor with the same id is already
     *                                  registered (nothing is changed)
     */
    public void addSensor(Sensor sensor) {
        Objects.requireNonNull(sensor, "Sensor must not be null");
        if (sensors.containsKey(sensor.getId())) {
            throw new DuplicateSensorException(sensor.getId());
        }
        sensors.put(sensor.getId(), sensor);
        LOG.info("Sensor {} added ({})", sensor.getId(), sensor.describe());
    }

    /**
     * @param sensorId id of the sensor to drop
     * @return {@code true} if a sensor was removed
     */
    public boolean removeSensor(String sensorId) {
        Sensor removed = sensors.remove(sensorId);
        if (removed != null) {
            LOG.info("Sensor {} removed", sensorId);
        }
        return removed != null;
    }

    /**
     * Append a notifier to the dispatch order.
     *
     * @param notifier notifier to use; must not be {@code null}
     * @throws DuplicateNotifierException if a notifier with the same name is
     *                                    already registered (nothing is changed)
     */
    public void addNotifier(Notifier notifier) {
        Objects.requireNonNull(notifier, "Notifier must not be null");
        String name = notifier.getName();
        for (Notifier registered : notifiers) {
            if (registered.getName().equals(name)) {
                throw new DuplicateNotifierException(name);
            }
        }
        notifiers.add(notifier);
        LOG.info("Notifier {} added", name);
    }

    // ---------------------------------------------------------------
    // Cycle
    // ---------------------------------------------------------------

    /**
     * Poll every sensor once, evaluate its reading and dispatch an alert for
     * every breach.
     *
     * @return outcome of every sensor and every delivery attempt
     */
    public CycleSummary runCycle() {
        Instant startedAt = clock.instant();
        long cycleNumber = ++cycleCount;

        List<SensorOutcome> outcomes = new ArrayList<>(sensors.size());
        List<DeliveryResult> deliveries = new ArrayList<>();
        int raised = 0;
        int suppressed = 0;

        for (Sensor sensor : sensors.values()) {
            SensorReading reading;
            AlertLevel level;
            double magnitude;
            try {
                reading = sensor.produceReading();
                level = sensor.evaluate(reading);
                magnitude = level.isBreach() ? sensor.breachMagnitude(reading) : 0.0;
            } catch (RuntimeException e) {
                LOG.warn("Cycle {}: sensor {} failed: {}", cycleNumber, sensor.getId(), e.getMessage());
                outcomes.add(SensorOutcome.failed(sensor.getId(), e.toString()));
                continue;
            }

            outcomes.add(SensorOutcome.evaluated(reading, level));
            if (!level.isBreach()) {
                continue;
            }

            Alert alert = buildAlert(sensor, reading, level, magnitude);
            raised++;
            record(AlertRecord.of(alert));
            LOG.debug("Cycle {}: {}", cycleNumber, alert.getMessage());

            if (!budget.tryAcquire()) {
                suppressed++;
                LOG.warn("Cycle {}: alert for sensor {} suppressed, hourly budget of {} exhausted",
                        cycleNumber, sensor.getId(), config.getMaxAlertsPerHour());
                continue;
            }
            dispatch(alert, deliveries);
        }

        CycleSummary summary = new CycleSummary(cycleNumber, startedAt, outcomes, deliveries, raised, suppressed);
        LOG.info("Cycle {} finished: {}", cycleNumber, summary);
        return summary;
    }

    private Alert buildAlert(Sensor sensor, SensorReading reading, AlertLevel level, double magnitude) {
        return Alert.builder()
                .sensorId(sensor.getId())
                .sensorType(sensor.getType().getTag())
                .level(level)
                .value(reading.getValue())
                .magnitude(magnitude)
                .timestamp(reading.getTimestamp())
                .message(String.format(Locale.ROOT, "%s: sensor %s (%s) at %s breached thresholds (value=%.2f)",
                        level, sensor.getId(), sensor.describe(), sensor.getLocation(), reading.getValue()))
                .build();
    }

    private void record(AlertRecord alertRecord) {
        if (history.size() >= config.getMaxHistorySize()) {
            history.pollFirst();
        }
        history.addLast(alertRecord);
    }

    private void dispatch(Alert alert, List<DeliveryResult> deliveries) {
        for (Notifier notifier : notifiers) {
            DeliveryResult result;
            try {
                result = notifier.send(alert);
                if (result == null) {
                    result = DeliveryResult.failed(notifier.getName(), alert.getSensorId(),
                            "notifier returned no result");
                }
            } catch (RuntimeException e) {
                LOG.warn("Notifier {} threw while sending alert for {}", notifier.getName(), alert.getSensorId(), e);
                result = DeliveryResult.failed(notifier.getName(), alert.getSensorId(), e.toString());
            }
            if (!result.isDelivered()) {
                LOG.warn("Delivery via {} failed for sensor {}: {}", result.getNotifierName(),
                        result.getSensorId(), result.getReason().orElse("unknown reason"));
            }
            deliveries.add(result);
        }
    }

    // ---------------------------------------------------------------
    // Reporting / history
    // ---------------------------------------------------------------

    /**
     * @return multi-line report of sensors, notifiers, recorded alerts and
     *         each sensor's status
     */
    public String generateReport() {
        StringBuilder report = new StringBuilder("\n=== SYSTEM REPORT ===\n");
        report.append("Active sensors: ").append(sensors.size()).append('\n');
        report.append("Notifiers: ").append(notifiers.size()).append('\n');
        report.append("Recorded alerts: ").append(history.size()).append("\n\n");
        report.append("Sensor status:\n");
        for (Sensor sensor : sensors.values()) {
            report.append("- ").append(sensor.getStatus()).append('\n');
        }
        return report.toString();
    }

    /**
     * @return recorded alerts, oldest first (snapshot)
     */
    public List<AlertRecord> getAlertHistory() {
        return List.copyOf(history);
    }

    /**
     * @return number of records removed
     */
    public int clearHistory() {
        int removed = history.size();
        history.clear();
        LOG.info("Alert history cleared: {} record(s) removed", removed);
        return removed;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    /**
     * @return sensors in polling order (snapshot)
     */
    public List<Sensor> getSensors() {
        return List.copyOf(sensors.values());
    }

    public Optional<Sensor> getSensor(String sensorId) {
        return Optional.ofNullable(sensors.get(sensorId));
    }

    /**
     * @return notifiers in dispatch order (snapshot)
     */
    public List<Notifier> getNotifiers() {
        return List.copyOf(notifiers);
    }

    public MonitoringConfig getConfig() {
        return config;
    }

    public long getCycleCount() {
        return cycleCount;
    }
}
