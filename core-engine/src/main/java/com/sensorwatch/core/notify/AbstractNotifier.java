package com.sensorwatch.core.notify;

import com.sensorwatch.core.model.Alert;
import com.sensorwatch.core.model.DeliveryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Base class for the built-in channels.
 *
 * <p>
 * Subclasses validate their target at construction and format the message;
 * this class hands it to the transport and turns every failure into a
 * {@code FAILED} result.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class AbstractNotifier implements Notifier {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractNotifier.class);

    private final String channel;
    private final NotificationTransport transport;

    protected AbstractNotifier(String channel, NotificationTransport transport) {
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.transport = Objects.requireNonNull(transport, "NotificationTransport must not be null");
    }

    @Override
    public final DeliveryResult send(Alert alert) {
        Objects.requireNonNull(alert, "Alert must not be null");
        try {
            transport.deliver(channel, getTarget(), formatMessage(alert));
            return DeliveryResult.delivered(getName(), alert.getSensorId());
        } catch (DeliveryException e) {
            LOG.warn("{} delivery to {} failed: {}", channel, getTarget(), e.getMessage());
            return DeliveryResult.failed(getName(), alert.getSensorId(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("{} delivery to {} failed unexpectedly", channel, getTarget(), e);
            return DeliveryResult.failed(getName(), alert.getSensorId(), e.toString());
        }
    }

    /**
     * @return the address the transport delivers to
     */
    public abstract String getTarget();

    /**
     * @param alert alert being delivered
     * @return message body for this channel
     */
    protected abstract String formatMessage(Alert alert);

    @Override
    public String getName() {
        return channel.toLowerCase(Locale.ROOT) + ":" + getTarget();
    }

    public String getChannel() {
        return channel;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + getTarget() + '}';
    }
}
