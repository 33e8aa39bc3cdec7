/**
 * Exception hierarchy for construction and registration failures.
 *
 * <p>
 * Everything here extends
 * {@link com.sensorwatch.core.error.SensorWatchException} and is raised to the
 * caller immediately. Failures during a monitoring cycle are never thrown;
 * they are folded into the cycle summary instead.
 * </p>
 *
 * @since 1.0.0
 */
package com.sensorwatch.core.error;
