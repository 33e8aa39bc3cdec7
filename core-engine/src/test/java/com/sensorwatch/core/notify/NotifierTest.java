package com.sensorwatch.core.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensorwatch.core.error.InvalidConfigurationException;
import com.sensorwatch.core.model.Alert;
import com.sensorwatch.core.model.AlertLevel;
import com.sensorwatch.core.model.DeliveryResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the built-in {@link Notifier} channels.
 */
class NotifierTest {

    private RecordingTransport transport;
    private Alert alert;

    @BeforeEach
    void setUp() {
        transport = new RecordingTransport();
        alert = Alert.builder()
                .sensorId("TEMP_001")
                .sensorType("temperature")
                .level(AlertLevel.WARNING)
                .value(85.0)
                .message("Sensor TEMP_001 too hot")
                .timestamp(Instant.parse("2024-03-01T12:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("Email notifier should deliver through its transport")
    void shouldDeliverEmail() {
        EmailNotifier notifier = new EmailNotifier("admin@example.com", "smtp.example.com", transport);

        DeliveryResult result = notifier.send(alert);

        assertThat(result.isDelivered()).isTrue();
        assertThat(result.getNotifierName()).isEqualTo("email:admin@example.com");
        assertThat(result.getSensorId()).isEqualTo("TEMP_001");
        assertThat(transport.getOutbox()).containsExactly(new RecordingTransport.Delivery(
                "EMAIL", "admin@example.com", "via smtp.example.com [WARNING] Sensor TEMP_001 too hot"));
    }

    @Test
    @DisplayName("Delivery should be deterministic for the same input")
    void shouldDeliverDeterministically() {
        EmailNotifier notifier = new EmailNotifier("admin@example.com", null, transport);

        notifier.send(alert);
        notifier.send(alert);

        assertThat(transport.getOutbox()).hasSize(2);
        assertThat(transport.getOutbox().get(0)).isEqualTo(transport.getOutbox().get(1));
        assertThat(notifier.getSmtpServer()).isEqualTo(EmailNotifier.DEFAULT_SMTP_SERVER);
    }

    @Test
    @DisplayName("Email notifier should reject malformed addresses")
    void shouldRejectInvalidEmail() {
        assertThatThrownBy(() -> new EmailNotifier("not-an-email"))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("not-an-email");
        assertThatThrownBy(() -> new EmailNotifier(null))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    @DisplayName("Webhook notifier should post a JSON payload")
    void shouldDeliverWebhookJson() throws Exception {
        WebhookNotifier notifier = new WebhookNotifier("https://api.example.com/alerts", transport);

        assertThat(notifier.send(alert).isDelivered()).isTrue();

        JsonNode payload = new ObjectMapper().readTree(transport.getOutbox().get(0).getMessage());
        assertThat(payload.get("sensorId").asText()).isEqualTo("TEMP_001");
        assertThat(payload.get("sensorType").asText()).isEqualTo("temperature");
        assertThat(payload.get("level").asText()).isEqualTo("WARNING");
        assertThat(payload.get("value").asDouble()).isEqualTo(85.0);
        assertThat(payload.get("timestamp").asText()).isEqualTo("2024-03-01T12:00:00Z");
    }

    @Test
    @DisplayName("Webhook notifier should reject non-HTTP URLs")
    void shouldRejectInvalidWebhookUrl() {
        assertThatThrownBy(() -> new WebhookNotifier("ftp://example.com/hook"))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new WebhookNotifier("https://"))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    @DisplayName("SMS notifier should normalise the number")
    void shouldFormatSmsNumber() {
        SmsNotifier notifier = new SmsNotifier("(555) 123-4567", null, transport);

        notifier.send(alert);

        assertThat(notifier.getTarget()).isEqualTo("+1-555-123-4567");
        assertThat(notifier.getProvider()).isEqualTo(SmsNotifier.DEFAULT_PROVIDER);
        assertThat(transport.getOutbox().get(0).getTarget()).isEqualTo("+1-555-123-4567");
    }

    @Test
    @DisplayName("SMS notifier should truncate long messages to one SMS")
    void shouldTruncateLongSms() {
        Alert verbose = Alert.builder()
                .sensorId("TEMP_001")
                .level(AlertLevel.CRITICAL)
                .message("x".repeat(300))
                .timestamp(Instant.now())
                .build();

        new SmsNotifier("5551234567", "Twilio", transport).send(verbose);

        String body = transport.getOutbox().get(0).getMessage();
        assertThat(body).hasSize(SmsNotifier.MAX_LENGTH).endsWith("...");
    }

    @Test
    @DisplayName("SMS notifier should reject numbers with fewer than ten digits")
    void shouldRejectShortSmsNumber() {
        assertThatThrownBy(() -> new SmsNotifier("555-1234"))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    @DisplayName("A transport failure should be reported, not thrown")
    void shouldReportTransportFailure() {
        WebhookNotifier notifier = new WebhookNotifier("https://api.example.com/alerts",
                (channel, target, message) -> {
                    throw new DeliveryException("HTTP 503");
                });

        DeliveryResult result = notifier.send(alert);

        assertThat(result.getStatus()).isEqualTo(DeliveryResult.Status.FAILED);
        assertThat(result.getReason()).contains("HTTP 503");
    }

    @Test
    @DisplayName("An unexpected runtime failure should also be reported as FAILED")
    void shouldReportRuntimeFailure() {
        SmsNotifier notifier = new SmsNotifier("5551234567", "Twilio",
                (channel, target, message) -> {
                    throw new IllegalStateException("gateway crashed");
                });

        DeliveryResult result = notifier.send(alert);

        assertThat(result.isDelivered()).isFalse();
        assertThat(result.getReason()).hasValueSatisfying(r -> assertThat(r).contains("gateway crashed"));
    }
}
