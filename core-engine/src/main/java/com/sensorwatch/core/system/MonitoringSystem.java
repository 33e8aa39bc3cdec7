package com.sensorwatch.core.system;

import com.sensorwatch.core.alert.AlertManager;
import com.sensorwatch.core.model.CycleSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Top-level aggregate: one named system owning one {@link AlertManager}.
 *
 * <p>
 * Holds no state of its own beyond the manager, the lifecycle flag and the
 * summary of the last cycle.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitoringSystem {

    private static final Logger LOG = LoggerFactory.getLogger(MonitoringSystem.class);

    public static final String DEFAULT_VERSION = "1.0.0";

    private final String name;
    private final String version;
    private final AlertManager alertManager;

    private CycleSummary lastSummary;
    private boolean running;

    public MonitoringSystem(String name) {
        this(name, DEFAULT_VERSION, new AlertManager());
    }

    /**
     * @param name         display name; must not be {@code null}
     * @param version      display version; {@code null} means
     *                     {@value #DEFAULT_VERSION}
     * @param alertManager manager owned by this system
     */
    public MonitoringSystem(String name, String version, AlertManager alertManager) {
        this.name = Objects.requireNonNull(name, "System name must not be null");
        this.version = version != null ? version : DEFAULT_VERSION;
        this.alertManager = Objects.requireNonNull(alertManager, "AlertManager must not be null");
    }

    public void initialize() {
        running = true;
        LOG.info("Initializing system {} v{} with {} sensor(s) and {} notifier(s)", name, version,
                alertManager.getSensors().size(), alertManager.getNotifiers().size());
    }

    public void stop() {
        running = false;
        LOG.info("Stopping system {}", name);
    }

    /**
     * Run one cycle on the owned manager and remember its summary.
     *
     * @return the cycle summary
     */
    public CycleSummary runCycle() {
        CycleSummary summary = alertManager.runCycle();
        lastSummary = summary;
        return summary;
    }

    /**
     * @return summary of the most recent cycle, empty before the first one
     */
    public Optional<CycleSummary> getLastSummary() {
        return Optional.ofNullable(lastSummary);
    }

    /**
     * @return the manager's textual report
     */
    public String getOverallStatus() {
        return alertManager.generateReport();
    }

    public AlertManager getAlertManager() {
        return alertManager;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public String toString() {
        return "MonitoringSystem{name='" + name + "', version='" + version + "', running=" + running + '}';
    }
}
