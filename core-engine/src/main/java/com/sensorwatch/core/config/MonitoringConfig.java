package com.sensorwatch.core.config;

import com.sensorwatch.core.error.InvalidConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Top-level POJO for the monitoring YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * checkIntervalSeconds: 10
 * maxAlertsPerHour: 0        # 0 = no cap
 * maxHistorySize: 1000
 * logLevel: INFO
 * logPath: ./logs/
 * sensors:
 *   - type: temperature
 *     id: TEMP_001
 *     min: -10
 *     max: 75
 *     location: Server room
 * notifiers:
 *   - type: email
 *     target: admin@example.com
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * <p>
 * {@code checkIntervalSeconds}, {@code logLevel} and {@code logPath} are not
 * applied by this library. They are carried for the process that drives the
 * cycles: it schedules {@code runCycle()} every {@code checkIntervalSeconds}
 * and configures its SLF4J binding from {@code logLevel} and {@code logPath}.
 * They are validated here so a bad value fails at startup.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitoringConfig {

    private static final Set<String> LOG_LEVELS = Set.of("DEBUG", "INFO", "WARN", "WARNING", "ERROR");

    /** Seconds between two cycles when driven by an external scheduler. */
    private int checkIntervalSeconds = 10;

    /**
     * Alerts dispatched per rolling hour before further alerts are suppressed;
     * {@code 0} disables the cap.
     */
    private int maxAlertsPerHour = 0;

    /** Alert records kept in memory; the oldest are evicted beyond this. */
    private int maxHistorySize = 1000;

    /** Log level for the driving process's logging backend. */
    private String logLevel = "INFO";

    /** Log directory for the driving process's logging backend. */
    private String logPath = "./logs/";

    private List<Map<String, Object>> sensors = new ArrayList<>();

    private List<Map<String, Object>> notifiers = new ArrayList<>();

    /**
     * Check every setting and every sensor/notifier entry's shape. Entry
     * contents are validated later by the factories.
     *
     * @throws InvalidConfigurationException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (checkIntervalSeconds <= 0) {
            errors.add("'checkIntervalSeconds' must be > 0, got: " + checkIntervalSeconds);
        }
        if (maxAlertsPerHour < 0) {
            errors.add("'maxAlertsPerHour' must be >= 0 (0 = unlimited), got: " + maxAlertsPerHour);
        }
        if (maxHistorySize <= 0) {
            errors.add("'maxHistorySize' must be > 0, got: " + maxHistorySize);
        }
        if (logPath == null || logPath.isBlank()) {
            errors.add("'logPath' must not be blank");
        }
        if (logLevel == null || !LOG_LEVELS.contains(logLevel.toUpperCase(Locale.ROOT))) {
            errors.add("'logLevel' must be one of " + LOG_LEVELS + ", got: " + logLevel);
        }
        checkEntries("sensors", sensors, errors);
        checkEntries("notifiers", notifiers, errors);

        if (!errors.isEmpty()) {
            throw new InvalidConfigurationException(
                    "Monitoring configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    private static void checkEntries(String section, List<Map<String, Object>> entries, List<String> errors) {
        for (int i = 0; i < entries.size(); i++) {
            Map<String, Object> entry = entries.get(i);
            if (entry == null) {
                errors.add(section + "[" + i + "] is empty");
            } else if (entry.get("type") == null) {
                errors.add(section + "[" + i + "] requires 'type'");
            }
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getCheckIntervalSeconds() {
        return checkIntervalSeconds;
    }

    public void setCheckIntervalSeconds(int checkIntervalSeconds) {
        this.checkIntervalSeconds = checkIntervalSeconds;
    }

    public int getMaxAlertsPerHour() {
        return maxAlertsPerHour;
    }

    public void setMaxAlertsPerHour(int maxAlertsPerHour) {
        this.maxAlertsPerHour = maxAlertsPerHour;
    }

    public int getMaxHistorySize() {
        return maxHistorySize;
    }

    public void setMaxHistorySize(int maxHistorySize) {
        this.maxHistorySize = maxHistorySize;
    }

    public String getLogLevel() {
        return logLevel;
    }

    public void setLogLevel(String logLevel) {
        this.logLevel = logLevel;
    }

    public String getLogPath() {
        return logPath;
    }

    public void setLogPath(String logPath) {
        this.logPath = logPath;
    }

    /**
     * @return unmodifiable list of sensor option maps
     */
    public List<Map<String, Object>> getSensors() {
        return Collections.unmodifiableList(sensors);
    }

    public void setSensors(List<Map<String, Object>> sensors) {
        this.sensors = copyOf(sensors);
    }

    /**
     * @return unmodifiable list of notifier option maps
     */
    public List<Map<String, Object>> getNotifiers() {
        return Collections.unmodifiableList(notifiers);
    }

    public void setNotifiers(List<Map<String, Object>> notifiers) {
        this.notifiers = copyOf(notifiers);
    }

    private static List<Map<String, Object>> copyOf(List<Map<String, Object>> entries) {
        List<Map<String, Object>> copy = new ArrayList<>();
        if (entries != null) {
            for (Map<String, Object> entry : entries) {
                copy.add(entry != null ? new LinkedHashMap<>(entry) : null);
            }
        }
        return copy;
    }

    @Override
    public String toString() {
        return "MonitoringConfig{" +
                "checkIntervalSeconds=" + checkIntervalSeconds +
                ", maxAlertsPerHour=" + maxAlertsPerHour +
                ", maxHistorySize=" + maxHistorySize +
                ", logLevel='" + logLevel + '\'' +
                ", logPath='" + logPath + '\'' +
                ", sensors=" + sensors.size() +
                ", notifiers=" + notifiers.size() +
                '}';
    }
}
