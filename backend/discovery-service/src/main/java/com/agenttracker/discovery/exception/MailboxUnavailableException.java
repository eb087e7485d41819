package com.agenttracker.discovery.exception;

/**
 * Mailbox not configured or not reachable
 */
public class MailboxUnavailableException extends DiscoveryServiceException {

    public MailboxUnavailableException(String message) {
        super("MAILBOX_UNAVAILABLE", message);
    }

    public MailboxUnavailableException(String message, Throwable cause) {
        super("MAILBOX_UNAVAILABLE", message, cause);
    }
}
