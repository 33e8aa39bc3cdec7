package com.sensorwatch.core.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Simulated transport: logs every message and keeps it in an in-memory
 * outbox. Always succeeds, so delivery is deterministic for a given input.
 *
 * @since 1.0.0
 */
public class RecordingTransport implements NotificationTransport {

    private static final Logger LOG = LoggerFactory.getLogger(RecordingTransport.class);

    private final List<Delivery> outbox = new ArrayList<>();

    @Override
    public void deliver(String channel, String target, String message) {
        Delivery delivery = new Delivery(channel, target, message);
        outbox.add(delivery);
        LOG.info("[{} -> {}] {}", channel, target, message);
    }

    /**
     * @return unmodifiable view of every recorded delivery, oldest first
     */
    public List<Delivery> getOutbox() {
        return Collections.unmodifiableList(outbox);
    }

    public void clear() {
        outbox.clear();
    }

    /**
     * One recorded message.
     */
    public static final class Delivery {
        private final String channel;
        private final String target;
        private final String message;

        public Delivery(String channel, String target, String message) {
            this.channel = channel;
            this.target = target;
            this.message = message;
        }

        public String getChannel() {
            return channel;
        }

        public String getTarget() {
            return target;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Delivery that))
                return false;
            return Objects.equals(channel, that.channel)
                    && Objects.equals(target, that.target)
                    && Objects.equals(message, that.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(channel, target, message);
        }

        @Override
        public String toString() {
            return "Delivery{" + channel + " -> " + target + ": '" + message + "'}";
        }
    }
}
