package com.agenttracker.discovery.client;

import com.agenttracker.discovery.config.MailboxProperties;
import jakarta.mail.Address;
import jakarta.mail.Authenticator;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.UIDFolder;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.search.AndTerm;
import jakarta.mail.search.FlagTerm;
import jakarta.mail.search.FromStringTerm;
import jakarta.mail.search.OrTerm;
import jakarta.mail.search.SearchTerm;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * IMAP mailbox reader for newsletter import.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImapMailboxClient implements MailboxClient {

    private final MailboxProperties properties;

    @Override
    public boolean isConfigured() {
        return properties.isConfigured();
    }

    @Override
    public List<RawMessage> fetchUnreadFrom(List<String> senders) throws MailboxException {
        if (!isConfigured()) {
            throw new MailboxException("Mailbox is not configured", null);
        }
        if (senders == null || senders.isEmpty()) {
            return List.of();
        }

        List<RawMessage> result = new ArrayList<>();
        try (Store store = connect()) {
            Folder folder = store.getFolder(properties.getFolder());
            // read-only with peek, so fetching never sets the SEEN flag
            folder.open(Folder.READ_ONLY);
            try {
                UIDFolder uidFolder = uidFolder(folder);
                Message[] messages = folder.search(unreadFrom(senders));
                log.info("Found {} unread newsletter messages in {}", messages.length, properties.getFolder());
                for (Message message : messages) {
                    try {
                        result.add(toRawMessage(uidFolder.getUID(message), message));
                    } catch (MessagingException | IOException e) {
                        // left unread, picked up again on the next import
                        log.warn("Skipping unreadable message {} in {}: {}",
                                message.getMessageNumber(), properties.getFolder(), e.getMessage());
                    }
                }
            } finally {
                folder.close(false);
            }
        } catch (MessagingException e) {
            throw new MailboxException("Failed to read mailbox " + properties.getHost() + ": " + e.getMessage(), e);
        }
        return result;
    }

    @Override
    public void markRead(List<Long> uids) throws MailboxException {
        if (uids == null || uids.isEmpty()) {
            return;
        }
        if (!isConfigured()) {
            throw new MailboxException("Mailbox is not configured", null);
        }
        long[] uidArray = uids.stream().mapToLong(Long::longValue).toArray();
        try (Store store = connect()) {
            Folder folder = store.getFolder(properties.getFolder());
            folder.open(Folder.READ_WRITE);
            try {
                int marked = 0;
                for (Message message : uidFolder(folder).getMessagesByUID(uidArray)) {
                    if (message != null) {
                        message.setFlag(Flags.Flag.SEEN, true);
                        marked++;
                    }
                }
                log.info("Marked {} of {} newsletter messages read in {}", marked, uidArray.length, properties.getFolder());
            } finally {
                folder.close(false);
            }
        } catch (MessagingException e) {
            throw new MailboxException("Failed to update mailbox " + properties.getHost() + ": " + e.getMessage(), e);
        }
    }

    private Store connect() throws MessagingException {
        Session session = Session.getInstance(sessionProperties(), new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(properties.getUsername(), properties.getPassword());
            }
        });
        Store store = session.getStore(protocol());
        try {
            store.connect();
        } catch (MessagingException e) {
            store.close();
            throw e;
        }
        return store;
    }

    private static UIDFolder uidFolder(Folder folder) throws MessagingException {
        if (folder instanceof UIDFolder uidFolder) {
            return uidFolder;
        }
        throw new MessagingException("Folder " + folder.getFullName() + " does not support UIDs");
    }

    private Properties sessionProperties() {
        String protocol = protocol();
        String timeout = String.valueOf(properties.getConnectTimeout().toMillis());
        Properties props = new Properties();
        props.setProperty("mail.store.protocol", protocol);
        props.setProperty("mail." + protocol + ".host", properties.getHost());
        props.setProperty("mail." + protocol + ".port", String.valueOf(properties.getPort()));
        props.setProperty("mail." + protocol + ".connectiontimeout", timeout);
        props.setProperty("mail." + protocol + ".timeout", timeout);
        props.setProperty("mail." + protocol + ".peek", "true");
        props.setProperty("mail.user", properties.getUsername());
        return props;
    }

    private String protocol() {
        return properties.isSsl() ? "imaps" : "imap";
    }

    private SearchTerm unreadFrom(List<String> senders) {
        SearchTerm[] fromTerms = senders.stream()
                .map(FromStringTerm::new)
                .toArray(SearchTerm[]::new);
        return new AndTerm(new FlagTerm(new Flags(Flags.Flag.SEEN), false), new OrTerm(fromTerms));
    }

    private RawMessage toRawMessage(long uid, Message message) throws MessagingException, IOException {
        BodyParts parts = new BodyParts();
        collectBodies(message, parts);
        return new RawMessage(
                uid,
                senderAddress(message.getFrom()),
                message.getSubject(),
                message.getSentDate() != null
                        ? LocalDateTime.ofInstant(message.getSentDate().toInstant(), ZoneId.systemDefault())
                        : LocalDateTime.now(),
                parts.html,
                parts.text
        );
    }

    private void collectBodies(Part part, BodyParts parts) throws MessagingException, IOException {
        if (part.isMimeType("text/html") && parts.html == null) {
            parts.html = String.valueOf(part.getContent());
        } else if (part.isMimeType("text/plain") && parts.text == null) {
            parts.text = String.valueOf(part.getContent());
        } else if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            for (int i = 0; i < multipart.getCount(); i++) {
                collectBodies(multipart.getBodyPart(i), parts);
            }
        }
    }

    private String senderAddress(Address[] from) {
        if (from == null || from.length == 0) {
            return null;
        }
        if (from[0] instanceof InternetAddress internetAddress) {
            return internetAddress.getAddress();
        }
        return from[0].toString();
    }

    private static class BodyParts {
        private String html;
        private String text;
    }
}
