package com.sensorwatch.core.notify;

import com.sensorwatch.core.config.ConfigValues;
import com.sensorwatch.core.error.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Builds {@link Notifier} instances from a type tag and an option map.
 *
 * <p>
 * Every type requires {@code target} (address, URL or number). Optional:
 * {@code server} for email, {@code provider} for SMS.
 * </p>
 *
 * @since 1.0.0
 */
public final class NotifierFactory {

    private static final Logger LOG = LoggerFactory.getLogger(NotifierFactory.class);

    private NotifierFactory() {
        // utility class — not instantiable
    }

    /**
     * @param params option map carrying {@code type}
     * @param transport transport shared by the created notifier
     * @return configured notifier
     * @throws InvalidConfigurationException if the type is unknown or
     *                                       {@code target} is missing/invalid
     */
    public static Notifier create(Map<String, ?> params, NotificationTransport transport) {
        Objects.requireNonNull(params, "Notifier configuration must not be null");
        Object type = params.get("type");
        return create(type != null ? type.toString() : null, params, transport);
    }

    /**
     * @param type      {@code email}, {@code webhook} or {@code sms}
     * @param params    option map
     * @param transport transport used by the created notifier
     * @return configured notifier
     * @throws InvalidConfigurationException if the type is unknown or
     *                                       {@code target} is missing/invalid
     */
    public static Notifier create(String type, Map<String, ?> params, NotificationTransport transport) {
        Objects.requireNonNull(params, "Notifier configuration must not be null");
        Objects.requireNonNull(transport, "NotificationTransport must not be null");
        if (type == null || type.isBlank()) {
            throw new InvalidConfigurationException("Notifier 'type' is required");
        }

        String tag = type.trim().toLowerCase(Locale.ROOT);
        String context = tag + " notifier";
        Notifier notifier = switch (tag) {
            case "email" -> new EmailNotifier(
                    ConfigValues.requiredString(params, "target", context),
                    ConfigValues.optionalString(params, "server", null),
                    transport);
            case "webhook" -> new WebhookNotifier(
                    ConfigValues.requiredString(params, "target", context),
                    transport);
            case "sms" -> new SmsNotifier(
                    ConfigValues.requiredString(params, "target", context),
                    ConfigValues.optionalString(params, "provider", null),
                    transport);
            default -> throw new InvalidConfigurationException(
                    "Unknown notifier type: '" + type + "'. Supported types: email, webhook, sms");
        };

        LOG.debug("Created notifier {}", notifier.getName());
        return notifier;
    }

    /**
     * Create one notifier per configuration entry, preserving order.
     *
     * @param configs   notifier option maps, each carrying a {@code type}
     * @param transport transport shared by all created notifiers
     * @return unmodifiable list of notifiers
     */
    public static List<Notifier> createAll(List<? extends Map<String, ?>> configs, NotificationTransport transport) {
        Objects.requireNonNull(configs, "Notifier configuration list must not be null");
        LOG.info("Creating {} notifier(s) from configuration", configs.size());
        return configs.stream()
                .map(c -> create(c, transport))
                .toList();
    }
}
