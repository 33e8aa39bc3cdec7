package com.sensorwatch.core.sensor;

import com.sensorwatch.core.error.InvalidConfigurationException;
import com.sensorwatch.core.model.AlertLevel;
import com.sensorwatch.core.model.SensorReading;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link VibrationSensor}.
 */
class VibrationSensorTest {

    private VibrationSensor sensor;

    @BeforeEach
    void setUp() {
        sensor = new VibrationSensor("VIB_001", 2.0);
    }

    @Test
    @DisplayName("Should NOT breach below the RMS limit")
    void shouldNotBreachBelowLimit() {
        assertThat(sensor.evaluate(sensor.record(1.0))).isEqualTo(AlertLevel.NONE);
    }

    @Test
    @DisplayName("Should NOT breach when RMS equals the limit exactly")
    void shouldNotBreachAtLimit() {
        assertThat(sensor.evaluate(sensor.record(2.0))).isEqualTo(AlertLevel.NONE);
    }

    @Test
    @DisplayName("Should compute RMS over the window, not the single reading")
    void shouldUseWindowRms() {
        for (int i = 0; i < 4; i++) {
            sensor.record(1.0);
        }
        // (1 + 1 + 1 + 1 + 16) / 5 = 4, sqrt = 2: exactly on the limit
        SensorReading spike = sensor.record(4.0);

        assertThat(sensor.currentRms()).isCloseTo(2.0, within(1e-12));
        assertThat(sensor.evaluate(spike)).isEqualTo(AlertLevel.NONE);
    }

    @Test
    @DisplayName("Should not count a recorded reading twice")
    void shouldNotDoubleCountRecordedReading() {
        sensor.record(1.0);
        SensorReading reading = sensor.record(3.0);

        assertThat(sensor.breachMagnitude(reading))
                .isCloseTo((Math.sqrt(5.0) - 2.0) / 2.0, within(1e-12));
    }

    @Test
    @DisplayName("Should include an unrecorded reading without modifying the window")
    void shouldEvaluateUnrecordedReading() {
        for (int i = 0; i < 4; i++) {
            sensor.record(0.0);
        }
        SensorReading external = new SensorReading("VIB_001", 5.0, Instant.now());

        assertThat(sensor.evaluate(external)).isEqualTo(AlertLevel.WARNING);
        assertThat(sensor.currentRms()).isZero();
    }

    @Test
    @DisplayName("Should evict readings older than the window")
    void shouldEvictOldReadings() {
        VibrationSensor shortWindow = new VibrationSensor("VIB_002", 2.0, 2,
                VibrationSensor.DEFAULT_FREQUENCY_HZ, null, 0.0, ReadingSource.fixed(0.0), Clock.systemUTC());

        shortWindow.record(10.0);
        shortWindow.record(0.0);
        SensorReading latest = shortWindow.record(0.0);

        assertThat(shortWindow.evaluate(latest)).isEqualTo(AlertLevel.NONE);
        assertThat(shortWindow.currentRms()).isZero();
    }

    @Test
    @DisplayName("Severity should grow with sustained vibration")
    void shouldScaleSeverity() {
        double warning = sensor.breachMagnitude(sensor.record(2.5));
        VibrationSensor other = new VibrationSensor("VIB_003", 2.0);
        double critical = other.breachMagnitude(other.record(3.5));

        assertThat(AlertLevel.fromMagnitude(warning)).isEqualTo(AlertLevel.WARNING);
        assertThat(AlertLevel.fromMagnitude(critical)).isEqualTo(AlertLevel.CRITICAL);
        assertThat(critical).isGreaterThan(warning);
    }

    @Test
    @DisplayName("Should reject non-positive limits, windows and frequencies")
    void shouldRejectInvalidConfiguration() {
        assertThatThrownBy(() -> new VibrationSensor("V", 0.0))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("rmsLimit");
        assertThatThrownBy(() -> new VibrationSensor("V", -1.0))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new VibrationSensor("V", 2.0, 0, 1000, null, 0.0,
                ReadingSource.fixed(1.0), Clock.systemUTC()))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("windowSize");
        assertThatThrownBy(() -> new VibrationSensor("V", 2.0, 5, 0, null, 0.0,
                ReadingSource.fixed(1.0), Clock.systemUTC()))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("frequencyHz");
    }

    @Test
    @DisplayName("Should describe itself with its frequency")
    void shouldDescribeFrequency() {
        assertThat(sensor.describe()).isEqualTo("Vibration @ 1000Hz");
        assertThat(sensor.getType()).isEqualTo(SensorType.VIBRATION);
    }
}
