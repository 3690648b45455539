package com.entity.linking.autolink;

import com.entity.linking.api.LinkingOptions;
import com.entity.linking.core.model.AutoLinkResult;
import com.entity.linking.core.model.EntityType;
import com.entity.linking.core.model.InboundMessage;
import com.entity.linking.core.model.MatchCandidate;
import com.entity.linking.core.model.MatchSignals;
import com.entity.linking.core.model.WorkItemHit;
import com.entity.linking.core.model.WorkItemKind;
import com.entity.linking.link.EntityLinkWriter;
import com.entity.linking.link.LinkWriteResult;
import com.entity.linking.logging.LogContext;
import com.entity.linking.logging.Redaction;
import com.entity.linking.match.ContactMatcher;
import com.entity.linking.match.InvalidQueryException;
import com.entity.linking.metrics.MetricsService;
import com.entity.linking.metrics.NoOpMetricsService;
import com.entity.linking.store.SearchQuery;
import com.entity.linking.store.WorkItemSearch;
import com.entity.linking.tracing.NoOpTracingService;
import com.entity.linking.tracing.Span;
import com.entity.linking.tracing.SpanNames;
import com.entity.linking.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Links an inbound message thread to the contact who sent it and to the work items it talks about.
 *
 * <p>Stages run strictly in order:</p>
 * <ol>
 *   <li>sender: match the sender phone/e-mail against contacts; every candidate at or above the
 *       sender threshold is linked to the thread</li>
 *   <li>gate: content matching only runs when the sender stage linked at least one contact, so an
 *       unknown sender can never attach a thread to the user's projects and todos</li>
 *   <li>content: search work items with the sanitized body; hits at or above the similarity
 *       threshold whose kind maps to project or todo are linked to the thread</li>
 * </ol>
 * <p>Each stage degrades to an empty result on failure. {@link #autoLinkInboundMessage} never throws,
 * because it runs inside message ingestion.</p>
 */
public class AutoLinker {
    private static final Logger log = LoggerFactory.getLogger(AutoLinker.class);

    static final String SENDER_LABEL = "inbound-message-sender";
    static final String CONTENT_LABEL_PREFIX = "auto-linked:";
    static final int CONTENT_LABEL_TITLE_LENGTH = 50;
    static final String WORK_ITEM_TYPES = "work_item";

    private final ContactMatcher matcher;
    private final WorkItemSearch search;
    private final EntityLinkWriter writer;
    private final LinkingOptions options;
    private final MetricsService metrics;
    private final TracingService tracing;

    public AutoLinker(ContactMatcher matcher, WorkItemSearch search, EntityLinkWriter writer, LinkingOptions options) {
        this(matcher, search, writer, options, new NoOpMetricsService(), new NoOpTracingService());
    }

    public AutoLinker(ContactMatcher matcher, WorkItemSearch search, EntityLinkWriter writer,
                      LinkingOptions options, MetricsService metrics, TracingService tracing) {
        this.matcher = matcher;
        this.search = search;
        this.writer = writer;
        this.options = options;
        this.metrics = metrics;
        this.tracing = tracing;
    }

    /**
     * Auto-links with the configured content similarity threshold.
     */
    public AutoLinkResult autoLinkInboundMessage(InboundMessage message) {
        return autoLinkInboundMessage(message, null);
    }

    /**
     * Runs the sender and content stages for one message.
     *
     * @param similarityThreshold content threshold overriding the configured one, or null
     * @return links created and the ids matched per type; the empty result on any unexpected failure
     */
    public AutoLinkResult autoLinkInboundMessage(InboundMessage message, Double similarityThreshold) {
        if (message == null) {
            log.warn("autolink.skipped reason=no message");
            return AutoLinkResult.empty();
        }
        try (LogContext logCtx = LogContext.forAutoLink(LogContext.generateCorrelationId(), message.threadId());
             Span span = tracing.startSpan(SpanNames.AUTOLINK_RUN)) {
            try {
                double threshold = similarityThreshold != null
                        ? similarityThreshold
                        : options.getContentSimilarityThreshold();
                log.info("autolink.starting sender={}/{} contentLength={}",
                        Redaction.maskPhone(message.senderPhone()), Redaction.maskEmail(message.senderEmail()),
                        message.content().length());

                List<String> contacts = linkSender(message);

                List<String> projects = new ArrayList<>();
                List<String> todos = new ArrayList<>();
                if (contacts.isEmpty()) {
                    log.info("autolink.gateClosed reason=no trusted sender match");
                } else {
                    linkContent(message, threshold, projects, todos);
                }

                AutoLinkResult result = AutoLinkResult.of(contacts, projects, todos);
                metrics.recordAutoLinkLinks(result.linksCreated());
                span.setAttribute("autolink.linksCreated", result.linksCreated());
                span.setStatus(Span.SpanStatus.OK);
                log.info("autolink.completed linksCreated={} contacts={} projects={} todos={}",
                        result.linksCreated(), contacts.size(), projects.size(), todos.size());
                return result;
            } catch (RuntimeException e) {
                log.error("autolink.failed error={}", Redaction.sanitizeError(e));
                span.fail(e);
                return AutoLinkResult.empty();
            }
        }
    }

    private List<String> linkSender(InboundMessage message) {
        MatchSignals signals = message.senderSignals();
        if (signals.isEmpty()) {
            log.debug("autolink.senderSkipped reason=no sender identifiers");
            return List.of();
        }

        try (Span span = tracing.startSpan(SpanNames.AUTOLINK_SENDER)) {
            List<MatchCandidate> candidates;
            try {
                candidates = matcher.suggestMatches(signals, options.getSenderContactLimit());
            } catch (InvalidQueryException e) {
                log.debug("autolink.senderSkipped reason=no usable sender identifiers");
                return List.of();
            } catch (RuntimeException e) {
                log.warn("autolink.senderFailed error={}", Redaction.sanitizeError(e));
                metrics.incrementAutoLinkStageFailure("sender");
                span.fail(e);
                return List.of();
            }

            List<String> linked = new ArrayList<>();
            for (MatchCandidate candidate : candidates) {
                if (!candidate.isAtLeast(options.getSenderMatchThreshold())) {
                    continue;
                }
                if (link(EntityType.CONTACT, candidate.contactId(), message.threadId(), SENDER_LABEL, "sender")) {
                    linked.add(candidate.contactId());
                }
            }
            span.setAttribute("autolink.contacts", linked.size());
            span.setStatus(Span.SpanStatus.OK);
            return linked;
        }
    }

    private void linkContent(InboundMessage message, double threshold, List<String> projects, List<String> todos) {
        String query = ContentSanitizer.toSearchQuery(message.content(), options.getMaxSearchQueryLength());
        if (query.isEmpty()) {
            log.debug("autolink.contentSkipped reason=empty content");
            return;
        }

        try (Span span = tracing.startSpan(SpanNames.AUTOLINK_CONTENT)) {
            List<WorkItemHit> hits;
            try {
                hits = search.search(new SearchQuery(query, WORK_ITEM_TYPES, options.getContentSearchLimit(), true));
            } catch (RuntimeException e) {
                log.warn("autolink.contentFailed error={}", Redaction.sanitizeError(e));
                metrics.incrementAutoLinkStageFailure("content");
                span.fail(e);
                return;
            }

            int accepted = 0;
            for (WorkItemHit hit : hits) {
                if (hit.score() < threshold) {
                    continue;
                }
                accepted++;
                Optional<EntityType> type = WorkItemKind.toEntityType(hit.kind());
                if (type.isEmpty()) {
                    log.debug("autolink.kindSkipped itemId={} kind={}", hit.id(), hit.kind());
                    continue;
                }
                if (link(type.get(), hit.id(), message.threadId(), contentLabel(hit), "content")) {
                    (type.get() == EntityType.PROJECT ? projects : todos).add(hit.id());
                }
            }
            if (accepted == 0) {
                log.debug("autolink.noContentMatch threshold={} results={} topScore={}",
                        threshold, hits.size(), hits.isEmpty() ? 0.0 : hits.get(0).score());
            }
            span.setAttribute("autolink.workItems", projects.size() + todos.size());
            span.setStatus(Span.SpanStatus.OK);
        }
    }

    private boolean link(EntityType sourceType, String sourceId, String threadId, String label, String stage) {
        try {
            LinkWriteResult result = writer.createLink(sourceType, sourceId, EntityType.THREAD, threadId, label, true);
            return result.isCreated();
        } catch (RuntimeException e) {
            log.warn("autolink.linkFailed stage={} sourceType={} sourceId={} error={}",
                    stage, sourceType.wireName(), sourceId, Redaction.sanitizeError(e));
            metrics.incrementAutoLinkStageFailure(stage);
            return false;
        }
    }

    static String contentLabel(WorkItemHit hit) {
        String title = hit.title();
        return CONTENT_LABEL_PREFIX + (title.length() > CONTENT_LABEL_TITLE_LENGTH
                ? title.substring(0, CONTENT_LABEL_TITLE_LENGTH)
                : title);
    }
}
