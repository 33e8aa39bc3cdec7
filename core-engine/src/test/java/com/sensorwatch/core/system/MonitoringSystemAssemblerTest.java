package com.sensorwatch.core.system;

import com.sensorwatch.core.config.ConfigLoader;
import com.sensorwatch.core.config.MonitoringConfig;
import com.sensorwatch.core.error.DuplicateSensorException;
import com.sensorwatch.core.error.UnknownSensorTypeException;
import com.sensorwatch.core.model.AlertLevel;
import com.sensorwatch.core.model.CycleSummary;
import com.sensorwatch.core.model.SensorOutcome;
import com.sensorwatch.core.notify.Notifier;
import com.sensorwatch.core.notify.RecordingTransport;
import com.sensorwatch.core.sensor.Sensor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MonitoringSystemAssembler}.
 */
class MonitoringSystemAssemblerTest {

    private RecordingTransport transport;

    @BeforeEach
    void setUp() {
        transport = new RecordingTransport();
    }

    @Test
    @DisplayName("Should build sensors and notifiers from configuration in order")
    void shouldAssembleFromConfig() {
        MonitoringConfig config = ConfigLoader.fromClasspath("test-sensor-watch.yml");

        MonitoringSystem system = MonitoringSystemAssembler.assemble("Plant A", "1.2.0", config, transport);

        assertThat(system.getName()).isEqualTo("Plant A");
        assertThat(system.getVersion()).isEqualTo("1.2.0");
        assertThat(system.getAlertManager().getSensors()).extracting(Sensor::getId)
                .containsExactly("TEMP_001", "VIB_001", "HUM_001");
        assertThat(system.getAlertManager().getNotifiers()).extracting(Notifier::getName)
                .containsExactly("email:admin@example.com",
                        "webhook:https://api.example.com/alerts",
                        "sms:+1-555-123-4567");
    }

    @Test
    @DisplayName("Replayed readings should alert on the second cycle through every notifier")
    void shouldAlertEndToEnd() {
        MonitoringConfig config = ConfigLoader.fromClasspath("test-sensor-watch.yml");
        MonitoringSystem system = MonitoringSystemAssembler.assemble("Plant A", null, config, transport);
        system.initialize();

        CycleSummary first = system.runCycle();
        assertThat(first.getAlertsRaised()).isZero();
        assertThat(transport.getOutbox()).isEmpty();

        CycleSummary second = system.runCycle();
        assertThat(second.getSensorOutcomes()).extracting(SensorOutcome::getLevel)
                .containsOnly(AlertLevel.WARNING);
        assertThat(second.getAlertsRaised()).isEqualTo(3);
        assertThat(second.getDeliveries()).hasSize(9)
                .allSatisfy(result -> assertThat(result.isDelivered()).isTrue());
        assertThat(transport.getOutbox()).hasSize(9);
        assertThat(transport.getOutbox().get(0).getChannel()).isEqualTo("EMAIL");
        assertThat(transport.getOutbox().get(0).getMessage()).contains("smtp.example.com").contains("TEMP_001");
        assertThat(system.getAlertManager().getAlertHistory()).hasSize(3);
    }

    @Test
    @DisplayName("Should propagate an unknown sensor type")
    void shouldRejectUnknownSensorType() {
        MonitoringConfig config = new MonitoringConfig();
        config.setSensors(List.of(Map.of("type", "pressure", "id", "P1")));

        assertThatThrownBy(() -> MonitoringSystemAssembler.assemble("Plant A", null, config, transport))
                .isInstanceOf(UnknownSensorTypeException.class)
                .hasMessageContaining("pressure");
    }

    @Test
    @DisplayName("Should propagate duplicate sensor ids")
    void shouldRejectDuplicateIds() {
        MonitoringConfig config = new MonitoringConfig();
        config.setSensors(List.of(
                Map.of("type", "temperature", "id", "T1", "min", 0, "max", 10),
                Map.of("type", "humidity", "id", "T1", "min", 20, "max", 80)));

        assertThatThrownBy(() -> MonitoringSystemAssembler.assemble("Plant A", null, config, transport))
                .isInstanceOf(DuplicateSensorException.class);
    }
}
