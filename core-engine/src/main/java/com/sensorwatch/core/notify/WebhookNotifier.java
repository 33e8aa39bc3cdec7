package com.sensorwatch.core.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sensorwatch.core.error.InvalidConfigurationException;
import com.sensorwatch.core.model.Alert;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Webhook channel. The message body is a JSON document describing the alert.
 *
 * @since 1.0.0
 */
public class WebhookNotifier extends AbstractNotifier {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String url;

    public WebhookNotifier(String url) {
        this(url, new RecordingTransport());
    }

    /**
     * @param url       {@code http://} or {@code https://} endpoint with a host
     * @param transport message transport
     * @throws InvalidConfigurationException if {@code url} is not an HTTP(S) URL
     */
    public WebhookNotifier(String url, NotificationTransport transport) {
        super("WEBHOOK", transport);
        if (!isValidUrl(url)) {
            throw new InvalidConfigurationException("Invalid webhook URL: '" + url + "'");
        }
        this.url = url;
    }

    static boolean isValidUrl(String url) {
        if (url == null || !(url.startsWith("http://") || url.startsWith("https://"))) {
            return false;
        }
        try {
            return new URI(url).getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    @Override
    public String getTarget() {
        return url;
    }

    @Override
    protected String formatMessage(Alert alert) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("sensorId", alert.getSensorId());
        payload.put("sensorType", alert.getSensorType());
        payload.put("level", alert.getLevel().name());
        payload.put("value", alert.getValue());
        payload.put("message", alert.getMessage());
        payload.put("timestamp", alert.getTimestamp().toString());
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize webhook payload", e);
        }
    }
}
