package com.agenttracker.discovery.client;

import java.util.List;

/**
 * Mailbox capability used by the newsletter import. Blocking.
 */
public interface MailboxClient {

    boolean isConfigured();

    /**
     * Fetch unread messages sent by any of the given addresses. Messages stay unread;
     * call {@link #markRead(List)} once they have been imported.
     */
    List<RawMessage> fetchUnreadFrom(List<String> senders) throws MailboxException;

    /**
     * Flag the messages with the given UIDs as read. Unknown UIDs are ignored.
     */
    void markRead(List<Long> uids) throws MailboxException;

    class MailboxException extends Exception {
        public MailboxException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
