package com.agenttracker.discovery.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * IMAP mailbox used for newsletter import.
 */
@Configuration
@ConfigurationProperties(prefix = "discovery.mailbox")
@Data
public class MailboxProperties {

    private boolean enabled = false;

    private String host;

    private int port = 993;

    private String username;

    private String password;

    private boolean ssl = true;

    private String folder = "INBOX";

    /**
     * Connection and authentication timeout
     */
    private Duration connectTimeout = Duration.ofSeconds(30);

    /**
     * Upper bound for one whole fetch
     */
    private Duration fetchTimeout = Duration.ofSeconds(60);

    /**
     * Newsletter sender addresses to import from
     */
    private List<String> senders = new ArrayList<>(List.of(
            "news@alphasignal.ai",
            "superhuman@mail.joinsuperhuman.ai"
    ));

    public boolean isConfigured() {
        return enabled && host != null && !host.isBlank()
                && username != null && !username.isBlank();
    }
}
