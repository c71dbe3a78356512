package com.micemail.config;

import com.micemail.dispatch.DispatchMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * micemail service configuration properties
 *
 * Relay credentials are not part of this tree; they are read from the
 * environment by {@link RelayConfig}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "micemail")
public class MicemailProperties {

    private Dispatch dispatch = new Dispatch();
    private Relay relay = new Relay();

    @Data
    public static class Dispatch {
        private DispatchMode mode = DispatchMode.SYNC;
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
    }

    @Data
    public static class Relay {
        private Duration connectionTimeout = Duration.ofSeconds(10);
        private Duration timeout = Duration.ofSeconds(30);
        private Duration writeTimeout = Duration.ofSeconds(20);
        private boolean starttls = true; // opportunistic, never required
    }
}
