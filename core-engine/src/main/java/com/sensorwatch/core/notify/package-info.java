/**
 * Alert delivery channels.
 *
 * <p>
 * {@link com.sensorwatch.core.notify.Notifier} is the single-method seam held
 * by the alert manager. The built-in email, webhook and SMS channels extend
 * {@link com.sensorwatch.core.notify.AbstractNotifier} and delegate the actual
 * hand-over to a {@link com.sensorwatch.core.notify.NotificationTransport};
 * the default {@link com.sensorwatch.core.notify.RecordingTransport} only logs
 * and records.
 * </p>
 *
 * @since 1.0.0
 */
package com.sensorwatch.core.notify;
