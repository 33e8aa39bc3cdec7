package com.sensorwatch.core.system;

import com.sensorwatch.core.alert.AlertManager;
import com.sensorwatch.core.model.CycleSummary;
import com.sensorwatch.core.sensor.ReadingSource;
import com.sensorwatch.core.sensor.TemperatureSensor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MonitoringSystem}.
 */
class MonitoringSystemTest {

    @Test
    @DisplayName("Should toggle the running flag on initialize and stop")
    void shouldTrackLifecycle() {
        MonitoringSystem system = new MonitoringSystem("Plant A");

        assertThat(system.isRunning()).isFalse();
        system.initialize();
        assertThat(system.isRunning()).isTrue();
        system.stop();
        assertThat(system.isRunning()).isFalse();
        assertThat(system.getVersion()).isEqualTo(MonitoringSystem.DEFAULT_VERSION);
    }

    @Test
    @DisplayName("Should remember the summary of the last cycle")
    void shouldKeepLastSummary() {
        AlertManager manager = new AlertManager();
        manager.addSensor(new TemperatureSensor("T1", 10, 30, "C", "Lab", 0.0,
                ReadingSource.fixed(20.0, 40.0), Clock.systemUTC()));
        MonitoringSystem system = new MonitoringSystem("Plant A", "2.1.0", manager);

        assertThat(system.getLastSummary()).isEmpty();
        system.runCycle();
        CycleSummary second = system.runCycle();

        assertThat(system.getLastSummary()).containsSame(second);
        assertThat(second.getCycleNumber()).isEqualTo(2);
        assertThat(second.getAlertsRaised()).isEqualTo(1);
    }

    @Test
    @DisplayName("Overall status should be the manager's report")
    void shouldDelegateStatus() {
        AlertManager manager = new AlertManager();
        manager.addSensor(new TemperatureSensor("T1", 10, 30));
        MonitoringSystem system = new MonitoringSystem("Plant A", null, manager);

        assertThat(system.getOverallStatus())
                .isEqualTo(manager.generateReport())
                .contains("Sensor T1 (Temperature (C)): NORMAL - no reading");
        assertThat(system.getVersion()).isEqualTo("1.0.0");
    }
}
