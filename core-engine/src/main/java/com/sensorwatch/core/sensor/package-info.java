/**
 * Sensor abstraction and its variants.
 *
 * <p>
 * Every variant extends {@link com.sensorwatch.core.sensor.Sensor} and is
 * normally built through {@link com.sensorwatch.core.sensor.SensorFactory}:
 * </p>
 * <ul>
 * <li>{@link com.sensorwatch.core.sensor.TemperatureSensor} — min/max
 * band</li>
 * <li>{@link com.sensorwatch.core.sensor.VibrationSensor} — RMS over a short
 * window</li>
 * <li>{@link com.sensorwatch.core.sensor.HumiditySensor} — min/max band within
 * 0–100 %</li>
 * </ul>
 *
 * <p>
 * Raw values come from a {@link com.sensorwatch.core.sensor.ReadingSource};
 * there is no hardware I/O.
 * </p>
 *
 * @since 1.0.0
 */
package com.sensorwatch.core.sensor;
