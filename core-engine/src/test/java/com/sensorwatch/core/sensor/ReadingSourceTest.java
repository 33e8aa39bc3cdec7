package com.sensorwatch.core.sensor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ReadingSource}.
 */
class ReadingSourceTest {

    @Test
    @DisplayName("Uniform source should stay in range and be reproducible per seed")
    void shouldProduceSeededBoundedValues() {
        ReadingSource first = ReadingSource.uniform(-20, 100, 42);
        ReadingSource second = ReadingSource.uniform(-20, 100, 42);

        for (int i = 0; i < 50; i++) {
            double value = first.next();
            assertThat(value).isGreaterThanOrEqualTo(-20).isLessThan(100);
            assertThat(second.next()).isEqualTo(value);
        }
    }

    @Test
    @DisplayName("Fixed source should cycle through its values")
    void shouldCycleFixedValues() {
        ReadingSource source = ReadingSource.fixed(1.0, 2.0);

        assertThat(source.next()).isEqualTo(1.0);
        assertThat(source.next()).isEqualTo(2.0);
        assertThat(source.next()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject empty or inverted definitions")
    void shouldRejectInvalidDefinitions() {
        assertThatThrownBy(() -> ReadingSource.fixed()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReadingSource.uniform(5, 5, 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("SensorType should resolve tags case-insensitively")
    void shouldResolveSensorTypeTags() {
        assertThat(SensorType.fromTag(" HUMIDITY ")).isEqualTo(SensorType.HUMIDITY);
        assertThat(SensorType.fromTag("temperature")).isEqualTo(SensorType.TEMPERATURE);
    }
}
