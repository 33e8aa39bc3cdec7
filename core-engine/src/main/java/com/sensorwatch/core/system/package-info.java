/**
 * System-level wiring: the monitoring system aggregate, its read-only
 * control panel and the configuration-driven assembler.
 *
 * @since 1.0.0
 */
package com.sensorwatch.core.system;
