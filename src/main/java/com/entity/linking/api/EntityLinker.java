package com.entity.linking.api;

import com.entity.linking.autolink.AutoLinker;
import com.entity.linking.core.model.AutoLinkResult;
import com.entity.linking.core.model.EntityLink;
import com.entity.linking.core.model.EntityType;
import com.entity.linking.core.model.InboundMessage;
import com.entity.linking.core.model.MatchCandidate;
import com.entity.linking.core.model.MatchSignals;
import com.entity.linking.link.EntityLinkWriter;
import com.entity.linking.link.LinkRemovalResult;
import com.entity.linking.link.LinkWriteResult;
import com.entity.linking.match.ContactMatcher;
import com.entity.linking.metrics.MetricsService;
import com.entity.linking.metrics.NoOpMetricsService;
import com.entity.linking.store.ContactDirectory;
import com.entity.linking.store.ItemStore;
import com.entity.linking.store.WorkItemSearch;
import com.entity.linking.store.http.BackendClient;
import com.entity.linking.store.http.HttpContactDirectory;
import com.entity.linking.store.http.HttpItemStore;
import com.entity.linking.store.http.HttpWorkItemSearch;
import com.entity.linking.tracing.NoOpTracingService;
import com.entity.linking.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point for contact matching and entity linking.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (EntityLinker linker = EntityLinker.builder()
 *         .backend("http://localhost:3000", apiToken)
 *         .build()) {
 *
 *     // Rank contacts for a phone number
 *     List&lt;MatchCandidate&gt; matches = linker.suggestMatches(MatchSignals.ofPhone("+61400123456"));
 *
 *     // Link a project to a GitHub issue, in both directions
 *     linker.createLink(EntityType.PROJECT, projectId, EntityType.GITHUB_ISSUE, "owner/repo#42", "tracks");
 *
 *     // Attach an inbound message thread to its sender and related work items
 *     AutoLinkResult result = linker.autoLinkInboundMessage(message);
 * }
 * </pre>
 */
public class EntityLinker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EntityLinker.class);

    private final ContactMatcher matcher;
    private final EntityLinkWriter writer;
    private final AutoLinker autoLinker;
    private final LinkingOptions options;
    private final ExecutorService ownedExecutor;

    private EntityLinker(Builder builder) {
        this.options = builder.options;
        MetricsService metrics = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracing = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();

        ExecutorService executor = builder.executor;
        if (executor == null) {
            // grows with concurrent requests; idle threads expire
            this.ownedExecutor = Executors.newCachedThreadPool(daemonThreads());
            executor = ownedExecutor;
        } else {
            this.ownedExecutor = null;
        }

        this.matcher = new ContactMatcher(builder.contactDirectory, options, executor, metrics, tracing);
        this.writer = new EntityLinkWriter(builder.itemStore, clock, metrics, tracing);
        this.autoLinker = new AutoLinker(matcher, builder.workItemSearch, writer, options, metrics, tracing);

        log.info("EntityLinker initialized with options: {}", options);
    }

    // ========== Matching API ==========

    /**
     * Ranks contacts against the given signals, returning at most the default number of matches.
     *
     * @throws com.entity.linking.match.InvalidQueryException if no signal is present
     */
    public List<MatchCandidate> suggestMatches(MatchSignals signals) {
        return matcher.suggestMatches(signals);
    }

    /**
     * Ranks contacts against the given signals.
     *
     * @throws com.entity.linking.match.InvalidQueryException if no signal is present or the limit is not positive
     */
    public List<MatchCandidate> suggestMatches(MatchSignals signals, int limit) {
        return matcher.suggestMatches(signals, limit);
    }

    // ========== Link API ==========

    /**
     * Creates a manual link in both directions.
     *
     * @return true only if both directions were written
     */
    public boolean createLink(EntityType sourceType, String sourceId, EntityType targetType,
                              String targetRef, String label) {
        return writer.createLink(sourceType, sourceId, targetType, targetRef, label);
    }

    /**
     * Creates a manual link and reports the detailed write outcome.
     */
    public LinkWriteResult createLinkDetailed(EntityType sourceType, String sourceId, EntityType targetType,
                                              String targetRef, String label) {
        return writer.createLink(sourceType, sourceId, targetType, targetRef, label, false);
    }

    public LinkRemovalResult removeLink(EntityType sourceType, String sourceId, EntityType targetType,
                                        String targetRef) {
        return writer.removeLink(sourceType, sourceId, targetType, targetRef);
    }

    /**
     * Lists the links leaving an entity, read up to the configured link query limit.
     *
     * @param linkTypes target types to keep; null or empty keeps all
     */
    public List<EntityLink> queryLinks(EntityType entityType, String entityId, Set<EntityType> linkTypes) {
        return writer.queryLinks(entityType, entityId, linkTypes, options.getLinkQueryLimit());
    }

    // ========== Auto-link API ==========

    /**
     * Auto-links an inbound message with the configured content threshold. Never throws.
     */
    public AutoLinkResult autoLinkInboundMessage(InboundMessage message) {
        return autoLinker.autoLinkInboundMessage(message);
    }

    /**
     * Auto-links an inbound message. Never throws.
     *
     * @param similarityThreshold content threshold, or null for the configured one
     */
    public AutoLinkResult autoLinkInboundMessage(InboundMessage message, Double similarityThreshold) {
        return autoLinker.autoLinkInboundMessage(message, similarityThreshold);
    }

    public LinkingOptions getOptions() {
        return options;
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(options.getCallTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "entity-linker-match-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ContactDirectory contactDirectory;
        private ItemStore itemStore;
        private WorkItemSearch workItemSearch;
        private LinkingOptions options = LinkingOptions.defaults();
        private MetricsService metricsService;
        private TracingService tracingService;
        private Clock clock;
        private ExecutorService executor;

        public Builder contactDirectory(ContactDirectory contactDirectory) {
            this.contactDirectory = contactDirectory;
            return this;
        }

        public Builder itemStore(ItemStore itemStore) {
            this.itemStore = itemStore;
            return this;
        }

        public Builder workItemSearch(WorkItemSearch workItemSearch) {
            this.workItemSearch = workItemSearch;
            return this;
        }

        /**
         * Uses the HTTP adapters for all three backends, served from one base URL.
         * Must be called after {@link #options(LinkingOptions)} for the call timeout to apply.
         */
        public Builder backend(String baseUrl, String bearerToken) {
            this.contactDirectory = new HttpContactDirectory(client("contacts", baseUrl, bearerToken));
            this.itemStore = new HttpItemStore(client("skill-store", baseUrl, bearerToken));
            this.workItemSearch = new HttpWorkItemSearch(client("search", baseUrl, bearerToken));
            return this;
        }

        private BackendClient client(String name, String baseUrl, String bearerToken) {
            return BackendClient.builder()
                    .name(name)
                    .baseUrl(baseUrl)
                    .bearerToken(bearerToken)
                    .timeout(options.getCallTimeout())
                    .build();
        }

        public Builder options(LinkingOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Executor for the concurrent signal queries. When not set, the linker owns a small
         * daemon pool and shuts it down on {@link #close()}.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public EntityLinker build() {
            if (contactDirectory == null) {
                throw new IllegalStateException("ContactDirectory is required");
            }
            if (itemStore == null) {
                throw new IllegalStateException("ItemStore is required");
            }
            if (workItemSearch == null) {
                throw new IllegalStateException("WorkItemSearch is required");
            }
            if (options == null) {
                throw new IllegalStateException("LinkingOptions is required");
            }
            return new EntityLinker(this);
        }
    }
}
