package com.agenttracker.discovery.service.newsletter;

import com.agenttracker.discovery.client.MailboxClient;
import com.agenttracker.discovery.client.MailboxClient.MailboxException;
import com.agenttracker.discovery.client.RawMessage;
import com.agenttracker.discovery.config.MailboxProperties;
import com.agenttracker.discovery.dto.pipeline.CandidateItem;
import com.agenttracker.discovery.dto.pipeline.ClassifiedItem;
import com.agenttracker.discovery.dto.pipeline.ProjectContext;
import com.agenttracker.discovery.exception.MailboxUnavailableException;
import com.agenttracker.discovery.exception.ProjectNotFoundException;
import com.agenttracker.discovery.repository.ProjectRepository;
import com.agenttracker.discovery.service.classify.RelevanceClassifierGateway;
import com.agenttracker.discovery.service.extract.ContentExtractor;
import com.agenttracker.discovery.service.extract.ExtractionResult;
import com.agenttracker.discovery.service.extract.NewsletterFormat;
import com.agenttracker.discovery.service.merge.DiscoveryMergeService;
import com.agenttracker.discovery.service.merge.MergeSummary;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Newsletter import.
 *
 * Fetches unread newsletters, extracts their links, classifies them and merges
 * them into the project's discoveries. A failing message does not stop the others
 * and stays unread; only fully imported messages are flagged read afterwards.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NewsletterImportService {

    private final MailboxClient mailboxClient;
    private final MailboxProperties mailboxProperties;
    private final ProjectRepository projectRepository;
    private final ContentExtractor contentExtractor;
    private final RelevanceClassifierGateway classifierGateway;
    private final DiscoveryMergeService mergeService;
    private final MeterRegistry meterRegistry;

    public NewsletterImportResult importForProject(Long projectId) {
        ProjectContext context = projectRepository.findById(projectId)
                .map(ProjectContext::from)
                .orElseThrow(() -> new ProjectNotFoundException(projectId));

        if (!mailboxClient.isConfigured()) {
            throw new MailboxUnavailableException("Mailbox is not configured");
        }

        List<RawMessage> messages = fetchMessages();
        log.info("Newsletter import started: projectId={}, messages={}", projectId, messages.size());

        int processed = 0;
        int failed = 0;
        int extracted = 0;
        int inserted = 0;
        int updated = 0;
        int unchanged = 0;
        int belowThreshold = 0;
        List<String> subjects = new ArrayList<>();
        List<Long> importedUids = new ArrayList<>();

        for (RawMessage message : messages) {
            try {
                List<CandidateItem> candidates = extract(message);
                extracted += candidates.size();
                if (!candidates.isEmpty()) {
                    List<ClassifiedItem> classified = classifierGateway.classifyAll(candidates, context).block();
                    MergeSummary summary = mergeService.mergeAll(context, classified != null ? classified : List.of());
                    inserted += summary.inserted();
                    updated += summary.updated();
                    unchanged += summary.unchanged();
                    belowThreshold += summary.belowThreshold();
                    if (summary.failed() > 0) {
                        // keep it unread so the next import retries the items that lost their merge
                        failed++;
                        log.warn("Newsletter message partly merged, leaving it unread: projectId={}, subject={}, mergeFailures={}",
                                projectId, message.subject(), summary.failed());
                        continue;
                    }
                }
                processed++;
                subjects.add(message.subject());
                importedUids.add(message.uid());
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to import newsletter message: projectId={}, sender={}, subject={}, error={}",
                        projectId, message.sender(), message.subject(), e.getMessage(), e);
            }
        }

        int markedRead = markRead(projectId, importedUids);
        log.info("Newsletter import finished: projectId={}, processed={}, failed={}, extracted={}, inserted={}, markedRead={}",
                projectId, processed, failed, extracted, inserted, markedRead);

        return NewsletterImportResult.builder()
                .projectId(projectId)
                .messagesFetched(messages.size())
                .messagesProcessed(processed)
                .messagesFailed(failed)
                .messagesMarkedRead(markedRead)
                .candidatesExtracted(extracted)
                .inserted(inserted)
                .updated(updated)
                .unchanged(unchanged)
                .belowThreshold(belowThreshold)
                .subjects(subjects)
                .build();
    }

    private List<RawMessage> fetchMessages() {
        List<String> senders = mailboxProperties.getSenders();
        List<RawMessage> messages = Mono.fromCallable(() -> mailboxClient.fetchUnreadFrom(senders))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(mailboxProperties.getFetchTimeout())
                .onErrorMap(MailboxException.class,
                        e -> new MailboxUnavailableException(e.getMessage(), e))
                .onErrorMap(TimeoutException.class,
                        e -> new MailboxUnavailableException(
                                "Mailbox fetch exceeded " + mailboxProperties.getFetchTimeout(), e))
                .block();
        return messages != null ? messages : List.of();
    }

    /**
     * Flag imported messages read. A failure here only means they are imported again
     * next time, which the merge makes a no-op.
     */
    private int markRead(Long projectId, List<Long> uids) {
        if (uids.isEmpty()) {
            return 0;
        }
        try {
            mailboxClient.markRead(uids);
            return uids.size();
        } catch (MailboxException e) {
            log.error("Failed to mark imported newsletters read: projectId={}, messages={}, error={}",
                    projectId, uids.size(), e.getMessage(), e);
            return 0;
        }
    }

    /**
     * Extract candidates from one message. Items take the message date as publication date.
     */
    List<CandidateItem> extract(RawMessage message) {
        NewsletterFormat format = NewsletterFormat.fromSender(message.sender());
        String origin = originOf(message, format);
        ExtractionResult result = contentExtractor.extract(message.body(), format, origin);

        meterRegistry.counter("discovery.extraction", "outcome", result.outcome().name()).increment();
        log.debug("Extracted {} items from '{}' ({}, outcome={}, strategy={})",
                result.items().size(), message.subject(), format, result.outcome(), result.strategy());

        List<CandidateItem> candidates = new ArrayList<>();
        for (CandidateItem item : result.items()) {
            candidates.add(item.toBuilder()
                    .publicationDate(item.getPublicationDate() != null ? item.getPublicationDate() : message.date())
                    .searchQuery("newsletter: " + message.subject())
                    .build());
        }
        return candidates;
    }

    private static String originOf(RawMessage message, NewsletterFormat format) {
        if (format != NewsletterFormat.GENERIC) {
            return format.name().toLowerCase(Locale.ROOT).replace('_', '-');
        }
        return message.sender() != null ? message.sender() : "newsletter";
    }
}
