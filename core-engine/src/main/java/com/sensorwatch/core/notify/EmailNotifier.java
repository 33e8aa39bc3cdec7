package com.sensorwatch.core.notify;

import com.sensorwatch.core.error.InvalidConfigurationException;
import com.sensorwatch.core.model.Alert;

import java.util.regex.Pattern;

/**
 * Email channel. Delivery is simulated through the configured transport.
 *
 * @since 1.0.0
 */
public class EmailNotifier extends AbstractNotifier {

    /** SMTP server used when none is configured. */
    public static final String DEFAULT_SMTP_SERVER = "smtp.gmail.com";

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    private final String recipient;
    private final String smtpServer;

    public EmailNotifier(String recipient) {
        this(recipient, DEFAULT_SMTP_SERVER, new RecordingTransport());
    }

    /**
     * @param recipient  destination address
     * @param smtpServer relay host; {@code null} or blank means
     *                   {@value #DEFAULT_SMTP_SERVER}
     * @param transport  message transport
     * @throws InvalidConfigurationException if {@code recipient} is not a valid
     *                                       email address
     */
    public EmailNotifier(String recipient, String smtpServer, NotificationTransport transport) {
        super("EMAIL", transport);
        if (!isValidAddress(recipient)) {
            throw new InvalidConfigurationException("Invalid email recipient: '" + recipient + "'");
        }
        this.recipient = recipient;
        this.smtpServer = smtpServer != null && !smtpServer.isBlank() ? smtpServer : DEFAULT_SMTP_SERVER;
    }

    static boolean isValidAddress(String address) {
        return address != null && EMAIL_PATTERN.matcher(address).matches();
    }

    @Override
    public String getTarget() {
        return recipient;
    }

    @Override
    protected String formatMessage(Alert alert) {
        return "via " + smtpServer + " [" + alert.getLevel() + "] " + alert.getMessage();
    }

    public String getSmtpServer() {
        return smtpServer;
    }
}
