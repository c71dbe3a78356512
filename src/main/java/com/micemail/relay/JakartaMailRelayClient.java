package com.micemail.relay;

import com.micemail.config.MicemailProperties;
import com.micemail.domain.RelayCredentials;
import jakarta.mail.Address;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Properties;

/**
 * Relay client on Jakarta Mail
 * - SMTP AUTH with the configured sender credentials
 * - Opportunistic STARTTLS
 * - One connection per call
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JakartaMailRelayClient implements RelayClient {

    private final MicemailProperties properties;

    @Override
    public void sendOnce(RelayCredentials credentials, List<String> recipients, byte[] content) throws RelayException {
        Address[] addresses = toAddresses(recipients);
        Session session = Session.getInstance(sessionProperties(credentials));

        try {
            MimeMessage message = new MimeMessage(session, new ByteArrayInputStream(content));
            Transport transport = session.getTransport("smtp");
            try {
                transport.connect(credentials.getHost(), credentials.getPort(),
                        credentials.getSenderAddress(), credentials.getPassword());
                transport.sendMessage(message, addresses);
                log.debug("Relay {}:{} accepted message for {}",
                        credentials.getHost(), credentials.getPort(), recipients);
            } finally {
                transport.close();
            }
        } catch (MessagingException e) {
            throw new RelayException(classify(e), describe(e), e);
        }
    }

    Properties sessionProperties(RelayCredentials credentials) {
        MicemailProperties.Relay relay = properties.getRelay();
        Properties props = new Properties();
        props.put("mail.smtp.host", credentials.getHost());
        props.put("mail.smtp.port", String.valueOf(credentials.getPort()));
        props.put("mail.smtp.auth", "true");
        props.put("mail.smtp.auth.mechanisms", "PLAIN LOGIN");
        props.put("mail.smtp.from", credentials.getSenderAddress());
        props.put("mail.smtp.connectiontimeout", String.valueOf(relay.getConnectionTimeout().toMillis()));
        props.put("mail.smtp.timeout", String.valueOf(relay.getTimeout().toMillis()));
        props.put("mail.smtp.writetimeout", String.valueOf(relay.getWriteTimeout().toMillis()));
        props.put("mail.smtp.starttls.enable", String.valueOf(relay.isStarttls()));
        props.put("mail.smtp.starttls.required", "false");
        return props;
    }

    private static Address[] toAddresses(List<String> recipients) throws RelayException {
        Address[] addresses = new Address[recipients.size()];
        for (int i = 0; i < recipients.size(); i++) {
            try {
                addresses[i] = new InternetAddress(recipients.get(i), true);
            } catch (AddressException e) {
                throw new RelayException(RelayFailureReason.REJECTED,
                        "Invalid recipient address: " + recipients.get(i), e);
            }
        }
        return addresses;
    }

    static RelayFailureReason classify(MessagingException e) {
        if (e instanceof AuthenticationFailedException || e instanceof SendFailedException) {
            return RelayFailureReason.REJECTED;
        }
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof ConnectException
                    || cause instanceof UnknownHostException
                    || cause instanceof SocketTimeoutException) {
                return RelayFailureReason.UNREACHABLE;
            }
            cause = cause.getCause() == cause ? null : cause.getCause();
        }
        return RelayFailureReason.OTHER;
    }

    private static String describe(MessagingException e) {
        String message = e.getMessage();
        return message == null ? e.getClass().getSimpleName() : message.trim();
    }
}
