package com.entity.linking.link;

import com.entity.linking.core.model.EntityLink;
import com.entity.linking.core.model.EntityType;
import com.entity.linking.logging.LogContext;
import com.entity.linking.logging.Redaction;
import com.entity.linking.metrics.MetricsService;
import com.entity.linking.metrics.NoOpMetricsService;
import com.entity.linking.store.ItemStore;
import com.entity.linking.store.ItemWrite;
import com.entity.linking.store.StoredItem;
import com.entity.linking.tracing.NoOpTracingService;
import com.entity.linking.tracing.Span;
import com.entity.linking.tracing.SpanNames;
import com.entity.linking.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Writes and removes symmetric entity links in the item store.
 *
 * <p>A link A-B is two records: the forward record under key {@code A:B} and the reverse record
 * under key {@code B:A}. The store only offers single-key writes, so creation is a two-step
 * protocol with a compensating delete:</p>
 * <ol>
 *   <li>write forward; on failure stop, nothing to undo</li>
 *   <li>write reverse; on failure delete the forward record again, unless it existed before
 *       the call, in which case the earlier pair is left as it was</li>
 *   <li>if that delete fails too, the forward record is orphaned: logged at ERROR as
 *       {@code link.orphaned} and counted, never retried here</li>
 * </ol>
 * <p>Writes are upserts on the composite keys, so repeating a successful call leaves exactly
 * the same two records behind.</p>
 */
public class EntityLinkWriter {
    private static final Logger log = LoggerFactory.getLogger(EntityLinkWriter.class);

    private final ItemStore store;
    private final Clock clock;
    private final MetricsService metrics;
    private final TracingService tracing;

    public EntityLinkWriter(ItemStore store) {
        this(store, Clock.systemUTC(), new NoOpMetricsService(), new NoOpTracingService());
    }

    public EntityLinkWriter(ItemStore store, Clock clock, MetricsService metrics, TracingService tracing) {
        this.store = store;
        this.clock = clock;
        this.metrics = metrics;
        this.tracing = tracing;
    }

    /**
     * Creates a manual link in both directions.
     *
     * @return true only if both records were written
     * @throws IllegalArgumentException if the arguments do not describe a valid link
     */
    public boolean createLink(EntityType sourceType, String sourceId, EntityType targetType,
                              String targetRef, String label) {
        return createLink(sourceType, sourceId, targetType, targetRef, label, false).isCreated();
    }

    /**
     * Creates a link in both directions and reports the detailed outcome.
     *
     * @param autoLinked whether the link was created by the auto-linker rather than a user
     * @throws IllegalArgumentException if the arguments do not describe a valid link
     */
    public LinkWriteResult createLink(EntityType sourceType, String sourceId, EntityType targetType,
                                      String targetRef, String label, boolean autoLinked) {
        LinkValidator.validateSource(sourceType, sourceId);
        LinkValidator.validateTarget(targetType, targetRef);
        LinkValidator.validateLabel(label);

        EntityLink forward = new EntityLink(sourceType, sourceId, targetType, targetRef, label,
                Instant.now(clock), autoLinked);
        EntityLink reverse = forward.reversed();
        String forwardKey = keyOf(forward);
        String reverseKey = keyOf(reverse);

        try (LogContext logCtx = LogContext.forLink("link.create", forwardKey);
             Span span = tracing.startSpan(SpanNames.LINK_CREATE, Map.of(
                     "link.sourceType", sourceType.wireName(),
                     "link.targetType", targetType.wireName()))) {
            LinkWriteResult result = write(forward, forwardKey, reverse, reverseKey);
            metrics.recordLinkOutcome(result.outcome());
            span.setAttribute("link.outcome", result.outcome().name());
            span.setStatus(result.isCreated() ? Span.SpanStatus.OK : Span.SpanStatus.ERROR);
            return result;
        }
    }

    private LinkWriteResult write(EntityLink forward, String forwardKey, EntityLink reverse, String reverseKey) {
        boolean forwardExisted;
        try {
            forwardExisted = store.getByKey(LinkKeys.SKILL_ID, LinkKeys.COLLECTION, forwardKey).isPresent();
        } catch (RuntimeException e) {
            log.warn("link.lookupFailed forwardKey={} error={}", forwardKey, Redaction.sanitizeError(e));
            return new LinkWriteResult(LinkWriteResult.Outcome.FORWARD_FAILED, forwardKey, reverseKey, null, null);
        }

        StoredItem forwardItem;
        try {
            forwardItem = store.put(toWrite(forward, forwardKey));
        } catch (RuntimeException e) {
            log.warn("link.forwardFailed forwardKey={} error={}", forwardKey, Redaction.sanitizeError(e));
            return new LinkWriteResult(LinkWriteResult.Outcome.FORWARD_FAILED, forwardKey, reverseKey, null, null);
        }

        StoredItem reverseItem;
        try {
            reverseItem = store.put(toWrite(reverse, reverseKey));
        } catch (RuntimeException e) {
            log.warn("link.reverseFailed reverseKey={} error={}", reverseKey, Redaction.sanitizeError(e));
            if (forwardExisted) {
                // forward record predates this call and stays
                log.warn("link.keptExisting forwardKey={} forwardId={}", forwardKey, forwardItem.id());
                return new LinkWriteResult(LinkWriteResult.Outcome.KEPT_EXISTING, forwardKey, reverseKey,
                        forwardItem.id(), null);
            }
            return rollBackForward(forwardItem, forwardKey, reverseKey);
        }

        log.debug("link.created forwardKey={} forwardId={} reverseId={}",
                forwardKey, forwardItem.id(), reverseItem.id());
        return new LinkWriteResult(LinkWriteResult.Outcome.CREATED, forwardKey, reverseKey,
                forwardItem.id(), reverseItem.id());
    }

    private LinkWriteResult rollBackForward(StoredItem forwardItem, String forwardKey, String reverseKey) {
        boolean deleted;
        String failure = "store did not confirm delete";
        try {
            deleted = store.delete(forwardItem.id());
        } catch (RuntimeException e) {
            deleted = false;
            failure = Redaction.sanitizeError(e);
        }

        if (deleted) {
            log.warn("link.rolledBack forwardKey={} forwardId={}", forwardKey, forwardItem.id());
            return new LinkWriteResult(LinkWriteResult.Outcome.ROLLED_BACK, forwardKey, reverseKey, null, null);
        }

        log.error("link.orphaned orphaned forward link, partial state forwardKey={} forwardId={} error={}",
                forwardKey, forwardItem.id(), failure);
        return new LinkWriteResult(LinkWriteResult.Outcome.ORPHANED, forwardKey, reverseKey, forwardItem.id(), null);
    }

    /**
     * Removes both directions of a link. Directions that do not exist are skipped.
     *
     * @throws IllegalArgumentException if the arguments do not describe a valid link
     * @throws com.entity.linking.store.BackendUnavailableException if a record lookup fails
     */
    public LinkRemovalResult removeLink(EntityType sourceType, String sourceId, EntityType targetType,
                                        String targetRef) {
        LinkValidator.validateSource(sourceType, sourceId);
        LinkValidator.validateTarget(targetType, targetRef);

        String forwardKey = LinkKeys.linkKey(sourceType, sourceId, targetType, targetRef);
        String reverseKey = LinkKeys.linkKey(targetType, targetRef, sourceType, sourceId);

        try (LogContext logCtx = LogContext.forLink("link.remove", forwardKey);
             Span span = tracing.startSpan(SpanNames.LINK_REMOVE)) {
            Optional<StoredItem> forwardItem = store.getByKey(LinkKeys.SKILL_ID, LinkKeys.COLLECTION, forwardKey);
            Optional<StoredItem> reverseItem = store.getByKey(LinkKeys.SKILL_ID, LinkKeys.COLLECTION, reverseKey);

            if (forwardItem.isEmpty() && reverseItem.isEmpty()) {
                log.debug("link.removeNotFound forwardKey={}", forwardKey);
                span.setStatus(Span.SpanStatus.OK);
                return new LinkRemovalResult(LinkRemovalResult.Status.NOT_FOUND, 0, 0, List.of());
            }

            int found = 0;
            int deleted = 0;
            List<String> failed = new ArrayList<>(2);
            if (forwardItem.isPresent()) {
                found++;
                if (deleteQuietly(forwardItem.get(), "forward")) {
                    deleted++;
                } else {
                    failed.add("forward");
                }
            }
            if (reverseItem.isPresent()) {
                found++;
                if (deleteQuietly(reverseItem.get(), "reverse")) {
                    deleted++;
                } else {
                    failed.add("reverse");
                }
            }

            if (deleted < found) {
                log.error("link.removePartial forwardKey={} deleted={} found={} failed={}",
                        forwardKey, deleted, found, failed);
                span.setStatus(Span.SpanStatus.ERROR);
                return new LinkRemovalResult(LinkRemovalResult.Status.PARTIAL, deleted, found, failed);
            }

            log.debug("link.removed forwardKey={} deleted={}", forwardKey, deleted);
            span.setStatus(Span.SpanStatus.OK);
            return new LinkRemovalResult(LinkRemovalResult.Status.REMOVED, deleted, found, List.of());
        }
    }

    private boolean deleteQuietly(StoredItem item, String direction) {
        try {
            return store.delete(item.id());
        } catch (RuntimeException e) {
            log.warn("link.deleteFailed direction={} itemId={} error={}",
                    direction, item.id(), Redaction.sanitizeError(e));
            return false;
        }
    }

    /**
     * Lists links leaving an entity, optionally restricted to some target types.
     *
     * @param linkTypes target types to keep; null or empty keeps all
     * @param limit     maximum records to read from the store
     * @throws com.entity.linking.store.BackendUnavailableException if the store cannot be reached
     */
    public List<EntityLink> queryLinks(EntityType entityType, String entityId, Set<EntityType> linkTypes, int limit) {
        LinkValidator.validateSource(entityType, entityId);
        List<StoredItem> items = store.findByTag(LinkKeys.SKILL_ID, LinkKeys.COLLECTION,
                LinkKeys.sourceTag(entityType, entityId), limit);

        List<EntityLink> links = new ArrayList<>(items.size());
        for (StoredItem item : items) {
            Optional<EntityLink> link = fromItem(item);
            if (link.isEmpty()) {
                log.debug("link.skipMalformed itemId={}", item.id());
                continue;
            }
            if (linkTypes == null || linkTypes.isEmpty() || linkTypes.contains(link.get().targetType())) {
                links.add(link.get());
            }
        }
        return links;
    }

    private static String keyOf(EntityLink link) {
        return LinkKeys.linkKey(link.sourceType(), link.sourceId(), link.targetType(), link.targetRef());
    }

    private static ItemWrite toWrite(EntityLink link, String key) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("source_type", link.sourceType().wireName());
        data.put("source_id", link.sourceId());
        data.put("target_type", link.targetType().wireName());
        data.put("target_ref", link.targetRef());
        data.put("label", link.label());
        data.put("created_at", link.createdAt().toString());
        data.put("auto_linked", link.autoLinked());
        return new ItemWrite(LinkKeys.SKILL_ID, LinkKeys.COLLECTION, key, data,
                List.of(LinkKeys.sourceTag(link.sourceType(), link.sourceId())));
    }

    static Optional<EntityLink> fromItem(StoredItem item) {
        Optional<EntityType> sourceType = EntityType.fromWireName(item.dataString("source_type"));
        Optional<EntityType> targetType = EntityType.fromWireName(item.dataString("target_type"));
        String sourceId = item.dataString("source_id");
        String targetRef = item.dataString("target_ref");
        if (sourceType.isEmpty() || targetType.isEmpty() || sourceId == null || targetRef == null) {
            return Optional.empty();
        }

        Instant createdAt = null;
        String createdAtText = item.dataString("created_at");
        if (createdAtText != null) {
            try {
                createdAt = Instant.parse(createdAtText);
            } catch (DateTimeParseException e) {
                log.debug("link.badTimestamp itemId={} value={}", item.id(), createdAtText);
            }
        }
        boolean autoLinked = Boolean.parseBoolean(item.dataString("auto_linked"));
        return Optional.of(new EntityLink(sourceType.get(), sourceId, targetType.get(), targetRef,
                item.dataString("label"), createdAt, autoLinked));
    }
}
