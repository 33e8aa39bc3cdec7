package com.sensorwatch.core.system;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ControlPanel}.
 */
class ControlPanelTest {

    @Test
    @DisplayName("Dashboard should show name, version and the status report")
    void shouldRenderDashboard() {
        MonitoringSystem system = new MonitoringSystem("Plant A");
        ControlPanel panel = new ControlPanel(system);

        String dashboard = panel.renderDashboard();

        assertThat(dashboard)
                .contains("=".repeat(50))
                .contains("  CONTROL PANEL - Plant A")
                .contains("  Version: 1.0.0")
                .contains("=== SYSTEM REPORT ===")
                .contains("Active sensors: 0");
    }

    @Test
    @DisplayName("Status summary should follow the system's last cycle")
    void shouldExposeLastSummary() {
        MonitoringSystem system = new MonitoringSystem("Plant A");
        ControlPanel panel = new ControlPanel(system);

        assertThat(panel.getStatusSummary()).isEmpty();
        system.runCycle();
        assertThat(panel.getStatusSummary()).isEqualTo(system.getLastSummary());
    }

    @Test
    @DisplayName("Should list the operator commands in menu order")
    void shouldListCommands() {
        ControlPanel panel = new ControlPanel(new MonitoringSystem("Plant A"));

        assertThat(panel.availableCommands())
                .containsExactly("View status", "Generate report", "Clear history", "Exit");
    }
}
