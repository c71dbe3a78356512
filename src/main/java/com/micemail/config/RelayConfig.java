package com.micemail.config;

import com.micemail.domain.RelayCredentials;
import com.micemail.exception.ConfigurationException;
import com.micemail.util.EmailValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.ArrayList;
import java.util.List;

/**
 * SMTP relay credentials, loaded once from the environment
 * - SENDER_EMAIL, EMAIL_PASSWORD, SMTP_SERVER, SMTP_PORT are all required
 * - Failure aborts context refresh, so the web server never starts listening
 */
@Slf4j
@Configuration
public class RelayConfig {

    public static final String SENDER_EMAIL = "SENDER_EMAIL";
    public static final String EMAIL_PASSWORD = "EMAIL_PASSWORD";
    public static final String SMTP_SERVER = "SMTP_SERVER";
    public static final String SMTP_PORT = "SMTP_PORT";

    @Bean
    public RelayCredentials relayCredentials(Environment environment) {
        RelayCredentials credentials = load(environment);
        log.info("SMTP relay configured: {}:{} (sender: {})",
                credentials.getHost(), credentials.getPort(), credentials.getSenderAddress());
        return credentials;
    }

    static RelayCredentials load(Environment environment) {
        String sender = environment.getProperty(SENDER_EMAIL);
        String password = environment.getProperty(EMAIL_PASSWORD);
        String host = environment.getProperty(SMTP_SERVER);
        String port = environment.getProperty(SMTP_PORT);

        List<String> missing = new ArrayList<>();
        if (isBlank(sender)) missing.add(SENDER_EMAIL);
        if (isBlank(password)) missing.add(EMAIL_PASSWORD);
        if (isBlank(host)) missing.add(SMTP_SERVER);
        if (isBlank(port)) missing.add(SMTP_PORT);
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Required environment variables are not set: " + missing);
        }

        if (!EmailValidator.isValid(sender.trim())) {
            throw new ConfigurationException("Sender email address is not valid: " + sender);
        }

        return RelayCredentials.builder()
                .senderAddress(sender.trim())
                .password(password)
                .host(host.trim())
                .port(parsePort(port.trim()))
                .build();
    }

    private static int parsePort(String value) {
        int port;
        try {
            port = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(SMTP_PORT + " is not a number: " + value, e);
        }
        if (port < 1 || port > 65535) {
            throw new ConfigurationException(SMTP_PORT + " is out of range: " + port);
        }
        return port;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
