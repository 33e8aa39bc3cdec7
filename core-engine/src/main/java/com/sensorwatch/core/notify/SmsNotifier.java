package com.sensorwatch.core.notify;

import com.sensorwatch.core.error.InvalidConfigurationException;
import com.sensorwatch.core.model.Alert;

/**
 * SMS channel. Numbers are normalised to {@code +1-XXX-XXX-XXXX} from their
 * last ten digits; bodies are cut to a single 160-character message.
 *
 * @since 1.0.0
 */
public class SmsNotifier extends AbstractNotifier {

    /** Provider used when none is configured. */
    public static final String DEFAULT_PROVIDER = "Twilio";

    static final int MAX_LENGTH = 160;

    private final String number;
    private final String provider;
    private final String formattedNumber;

    public SmsNotifier(String number) {
        this(number, DEFAULT_PROVIDER, new RecordingTransport());
    }

    /**
     * @param number    phone number with at least ten digits; separators allowed
     * @param provider  SMS gateway name; {@code null} or blank means
     *                  {@value #DEFAULT_PROVIDER}
     * @param transport message transport
     * @throws InvalidConfigurationException if {@code number} has fewer than ten
     *                                       digits
     */
    public SmsNotifier(String number, String provider, NotificationTransport transport) {
        super("SMS", transport);
        String digits = number == null ? "" : number.replaceAll("\\D", "");
        if (digits.length() < 10) {
            throw new InvalidConfigurationException(
                    "SMS number must contain at least 10 digits: '" + number + "'");
        }
        this.number = number;
        this.provider = provider != null && !provider.isBlank() ? provider : DEFAULT_PROVIDER;
        this.formattedNumber = formatNumber(digits);
    }

    static String formatNumber(String digits) {
        String last = digits.substring(digits.length() - 10);
        return "+1-" + last.substring(0, 3) + "-" + last.substring(3, 6) + "-" + last.substring(6);
    }

    @Override
    public String getTarget() {
        return formattedNumber;
    }

    @Override
    protected String formatMessage(Alert alert) {
        String body = "via " + provider + " [" + alert.getLevel() + "] " + alert.getMessage();
        return body.length() <= MAX_LENGTH ? body : body.substring(0, MAX_LENGTH - 3) + "...";
    }

    public String getNumber() {
        return number;
    }

    public String getProvider() {
        return provider;
    }
}
