/**
 * Configuration loading and validation.
 *
 * <p>
 * {@link com.sensorwatch.core.config.ConfigLoader} reads YAML into a
 * {@link com.sensorwatch.core.config.MonitoringConfig} and validates it
 * straight away. {@link com.sensorwatch.core.config.ConfigValues} gives the
 * factories typed access to the per-entry option maps.
 * </p>
 *
 * @since 1.0.0
 */
package com.sensorwatch.core.config;
