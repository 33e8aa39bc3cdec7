package com.sensorwatch.core.system;

import com.sensorwatch.core.model.CycleSummary;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view over a {@link MonitoringSystem}. Never mutates it.
 *
 * @since 1.0.0
 */
public class ControlPanel {

    private static final String RULE = "=".repeat(50);

    private static final List<String> COMMANDS = List.of(
            "View status",
            "Generate report",
            "Clear history",
            "Exit");

    private final MonitoringSystem system;

    public ControlPanel(MonitoringSystem system) {
        this.system = Objects.requireNonNull(system, "MonitoringSystem must not be null");
    }

    /**
     * @return summary of the system's last cycle, empty before the first one
     */
    public Optional<CycleSummary> getStatusSummary() {
        return system.getLastSummary();
    }

    /**
     * @return banner with system name and version followed by the overall
     *         status report
     */
    public String renderDashboard() {
        return "\n" + RULE + "\n"
                + "  CONTROL PANEL - " + system.getName() + "\n"
                + "  Version: " + system.getVersion() + "\n"
                + RULE + "\n"
                + system.getOverallStatus()
                + RULE + "\n";
    }

    public List<String> availableCommands() {
        return COMMANDS;
    }
}
