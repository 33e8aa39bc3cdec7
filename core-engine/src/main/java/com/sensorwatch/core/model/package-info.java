/**
 * Domain model shared by sensors, notifiers and the alert manager.
 *
 * <ul>
 * <li>{@link com.sensorwatch.core.model.SensorReading} — immutable sensor
 * value</li>
 * <li>{@link com.sensorwatch.core.model.Alert} — breach handed to
 * notifiers</li>
 * <li>{@link com.sensorwatch.core.model.AlertRecord} — history entry with
 * JSON/CSV export</li>
 * <li>{@link com.sensorwatch.core.model.CycleSummary} — per-cycle outcome
 * report</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.sensorwatch.core.model;
