/**
 * Alert evaluation and fan-out.
 *
 * <p>
 * {@link com.sensorwatch.core.alert.AlertManager} polls sensors, turns
 * breaches into alerts and hands each alert to every notifier, folding all
 * runtime failures into the returned cycle summary.
 * </p>
 *
 * @since 1.0.0
 */
package com.sensorwatch.core.alert;
