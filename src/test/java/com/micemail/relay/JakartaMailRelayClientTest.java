package com.micemail.relay;

import com.micemail.config.MicemailProperties;
import com.micemail.domain.RelayCredentials;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * JakartaMailRelayClient unit tests
 */
class JakartaMailRelayClientTest {

    private MicemailProperties properties;
    private JakartaMailRelayClient client;

    @BeforeEach
    void setUp() {
        properties = new MicemailProperties();
        properties.getRelay().setConnectionTimeout(Duration.ofSeconds(2));
        client = new JakartaMailRelayClient(properties);
    }

    private static RelayCredentials credentials(int port) {
        return RelayCredentials.builder()
                .senderAddress("sender@example.com")
                .password("secret")
                .host("127.0.0.1")
                .port(port)
                .build();
    }

    @Test
    @DisplayName("Session properties: authenticated SMTP with envelope sender and timeouts")
    void testSessionProperties() {
        Properties props = client.sessionProperties(credentials(587));

        assertThat(props.getProperty("mail.smtp.host")).isEqualTo("127.0.0.1");
        assertThat(props.getProperty("mail.smtp.port")).isEqualTo("587");
        assertThat(props.getProperty("mail.smtp.auth")).isEqualTo("true");
        assertThat(props.getProperty("mail.smtp.from")).isEqualTo("sender@example.com");
        assertThat(props.getProperty("mail.smtp.connectiontimeout")).isEqualTo("2000");
        assertThat(props.getProperty("mail.smtp.starttls.enable")).isEqualTo("true");
        assertThat(props.getProperty("mail.smtp.starttls.required")).isEqualTo("false");
    }

    @Test
    @DisplayName("Classify: authentication and envelope refusals are REJECTED")
    void testClassifyRejected() {
        assertThat(JakartaMailRelayClient.classify(new AuthenticationFailedException("535")))
                .isEqualTo(RelayFailureReason.REJECTED);
        assertThat(JakartaMailRelayClient.classify(new SendFailedException("550")))
                .isEqualTo(RelayFailureReason.REJECTED);
    }

    @Test
    @DisplayName("Classify: connection failures are UNREACHABLE")
    void testClassifyUnreachable() {
        MessagingException e = new MessagingException("Couldn't connect", new ConnectException("refused"));

        assertThat(JakartaMailRelayClient.classify(e)).isEqualTo(RelayFailureReason.UNREACHABLE);
    }

    @Test
    @DisplayName("Classify: anything else is OTHER")
    void testClassifyOther() {
        assertThat(JakartaMailRelayClient.classify(new MessagingException("421 try later")))
                .isEqualTo(RelayFailureReason.OTHER);
    }

    @Test
    @DisplayName("Closed relay port: send fails as UNREACHABLE")
    void testSendToClosedPort() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        byte[] content = "To: a@b.co\r\nSubject: Hi\r\n\r\nBody\r\n".getBytes(StandardCharsets.UTF_8);

        RelayException e = catchThrowableOfType(
                () -> client.sendOnce(credentials(port), List.of("a@b.co"), content),
                RelayException.class);

        assertThat(e).isNotNull();
        assertThat(e.getReason()).isEqualTo(RelayFailureReason.UNREACHABLE);
    }
}
