package com.agenttracker.discovery.client;

import java.time.LocalDateTime;

/**
 * Newsletter message as read from the mailbox. {@code uid} is the IMAP UID within the folder.
 */
public record RawMessage(
        long uid,
        String sender,
        String subject,
        LocalDateTime date,
        String html,
        String text
) {

    /**
     * HTML body when present, plain text otherwise
     */
    public String body() {
        return html != null && !html.isBlank() ? html : text;
    }
}
