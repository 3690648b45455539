package com.entity.linking.match;

import com.entity.linking.api.LinkingOptions;
import com.entity.linking.core.model.Contact;
import com.entity.linking.core.model.Endpoint;
import com.entity.linking.core.model.EndpointType;
import com.entity.linking.core.model.MatchCandidate;
import com.entity.linking.core.model.MatchSignals;
import com.entity.linking.core.model.SignalType;
import com.entity.linking.logging.LogContext;
import com.entity.linking.logging.Redaction;
import com.entity.linking.metrics.MetricsService;
import com.entity.linking.metrics.NoOpMetricsService;
import com.entity.linking.similarity.EmailSimilarity;
import com.entity.linking.similarity.EndpointNormalizer;
import com.entity.linking.similarity.MatchScoring;
import com.entity.linking.similarity.NameSimilarity;
import com.entity.linking.similarity.PhoneSimilarity;
import com.entity.linking.store.ContactDirectory;
import com.entity.linking.store.ContactQuery;
import com.entity.linking.tracing.NoOpTracingService;
import com.entity.linking.tracing.Span;
import com.entity.linking.tracing.SpanNames;
import com.entity.linking.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Ranks contacts against phone, e-mail and name signals.
 *
 * <p>One bounded search is issued per present signal (phone prefix, e-mail domain, name
 * fragment), all of them concurrently. Results are unioned by contact id and every unique
 * contact is scored against every present signal:</p>
 * <ul>
 *   <li>per-signal score: best score over the contact's endpoints of that type</li>
 *   <li>combined score: the maximum per-signal score, raised by the multi-signal bonus for each
 *       additional signal above the strong threshold, capped at 1.0</li>
 * </ul>
 * <p>Ordering is confidence descending, then number of matching signals descending, then contact id.
 * A search that fails or times out is logged and left out; the others still contribute.</p>
 */
public class ContactMatcher {
    private static final Logger log = LoggerFactory.getLogger(ContactMatcher.class);

    private static final Comparator<MatchCandidate> RANKING =
            Comparator.comparingDouble(MatchCandidate::confidence).reversed()
                    .thenComparing(Comparator.comparingInt(MatchCandidate::matchedSignals).reversed())
                    .thenComparing(MatchCandidate::contactId);

    private final ContactDirectory directory;
    private final LinkingOptions options;
    private final MatchScoring scoring;
    private final PhoneSimilarity phoneSimilarity;
    private final EmailSimilarity emailSimilarity;
    private final NameSimilarity nameSimilarity;
    private final Executor executor;
    private final MetricsService metrics;
    private final TracingService tracing;

    /**
     * Creates a matcher that runs searches on the calling thread.
     */
    public ContactMatcher(ContactDirectory directory, LinkingOptions options) {
        this(directory, options, Runnable::run, new NoOpMetricsService(), new NoOpTracingService());
    }

    public ContactMatcher(ContactDirectory directory, LinkingOptions options, Executor executor,
                          MetricsService metrics, TracingService tracing) {
        this.directory = directory;
        this.options = options;
        this.scoring = options.getMatchScoring();
        this.phoneSimilarity = new PhoneSimilarity(scoring);
        this.emailSimilarity = new EmailSimilarity(scoring);
        this.nameSimilarity = new NameSimilarity(scoring);
        this.executor = executor;
        this.metrics = metrics;
        this.tracing = tracing;
    }

    /**
     * Suggests matches with the default limit.
     */
    public List<MatchCandidate> suggestMatches(MatchSignals signals) {
        return suggestMatches(signals, options.getDefaultMatchLimit());
    }

    /**
     * Returns up to {@code limit} contacts ranked by confidence. Read-only.
     *
     * @param signals phone, e-mail and name; at least one must be present
     * @param limit   maximum results; values above the configured maximum are clamped
     * @throws InvalidQueryException if no signal is present, none normalizes to a searchable value,
     *                               or the limit is not positive
     */
    public List<MatchCandidate> suggestMatches(MatchSignals signals, int limit) {
        if (signals == null || signals.isEmpty()) {
            throw new InvalidQueryException("At least one of phone, email or name is required");
        }
        if (limit <= 0) {
            throw new InvalidQueryException("limit must be positive, got " + limit);
        }
        List<ContactQuery> queries = buildQueries(signals);
        if (queries.isEmpty()) {
            throw new InvalidQueryException("No usable phone, email or name in the query");
        }
        int effectiveLimit = Math.min(limit, options.getMaxMatchLimit());
        long start = System.nanoTime();

        try (LogContext logCtx = LogContext.forMatch(LogContext.generateCorrelationId());
             Span span = tracing.startSpan(SpanNames.MATCH_SUGGEST)) {
            span.setAttribute("match.hasPhone", signals.hasPhone());
            span.setAttribute("match.hasEmail", signals.hasEmail());
            span.setAttribute("match.hasName", signals.hasName());

            Map<String, Contact> pool = fetchCandidates(queries);

            List<MatchCandidate> ranked = new ArrayList<>();
            for (Contact contact : pool.values()) {
                MatchCandidate candidate = score(contact, signals);
                if (candidate.confidence() > 0.0) {
                    ranked.add(candidate);
                }
            }
            ranked.sort(RANKING);
            List<MatchCandidate> result = ranked.size() > effectiveLimit
                    ? List.copyOf(ranked.subList(0, effectiveLimit))
                    : List.copyOf(ranked);

            result.forEach(c -> metrics.recordMatchConfidence(c.confidence()));
            span.setAttribute("match.candidates", result.size());
            span.setStatus(Span.SpanStatus.OK);
            log.debug("match.completed pool={} returned={} topConfidence={}",
                    pool.size(), result.size(), result.isEmpty() ? 0.0 : result.get(0).confidence());
            return result;
        } finally {
            metrics.recordMatchDuration(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Scores one contact against all present signals.
     */
    MatchCandidate score(Contact contact, MatchSignals signals) {
        Map<SignalType, Double> perSignal = new EnumMap<>(SignalType.class);
        if (signals.hasPhone()) {
            perSignal.put(SignalType.PHONE, bestEndpointScore(contact, EndpointType.PHONE, signals.phone()));
        }
        if (signals.hasEmail()) {
            perSignal.put(SignalType.EMAIL, bestEndpointScore(contact, EndpointType.EMAIL, signals.email()));
        }
        if (signals.hasName()) {
            perSignal.put(SignalType.NAME, nameSimilarity.compute(signals.name(), contact.getDisplayName()));
        }

        double best = 0.0;
        int matched = 0;
        int strong = 0;
        for (double value : perSignal.values()) {
            best = Math.max(best, value);
            if (value > 0.0) {
                matched++;
            }
            if (value >= scoring.strongSignalThreshold()) {
                strong++;
            }
        }
        double combined = strong >= 2
                ? Math.min(1.0, best + scoring.multiSignalBonus() * (strong - 1))
                : best;

        return new MatchCandidate(contact.getId(), contact.getDisplayName(), contact.getEndpoints(),
                combined, matched);
    }

    private double bestEndpointScore(Contact contact, EndpointType type, String query) {
        double best = 0.0;
        for (Endpoint endpoint : contact.getEndpoints(type)) {
            double value = type == EndpointType.PHONE
                    ? phoneSimilarity.compute(query, endpoint.normalizedValue())
                    : emailSimilarity.compute(query, endpoint.normalizedValue());
            best = Math.max(best, value);
        }
        return best;
    }

    private Map<String, Contact> fetchCandidates(List<ContactQuery> queries) {
        List<CompletableFuture<List<Contact>>> futures = new ArrayList<>(queries.size());
        for (ContactQuery query : queries) {
            futures.add(searchAsync(query));
        }

        Map<String, Contact> pool = new LinkedHashMap<>();
        for (int i = 0; i < futures.size(); i++) {
            ContactQuery query = queries.get(i);
            try {
                for (Contact contact : futures.get(i).join()) {
                    pool.putIfAbsent(contact.getId(), contact);
                }
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                String reason = cause instanceof TimeoutException
                        ? "timed out after " + options.getCallTimeout().toMillis() + "ms"
                        : Redaction.sanitizeError(cause);
                log.warn("match.signalFailed signal={} error={}", query.signal(), reason);
                metrics.incrementSignalQueryFailure(query.signal());
            }
        }
        return pool;
    }

    /**
     * Runs one search on the executor. The timeout is armed when the search starts running,
     * so time spent queued behind other searches does not count against it.
     */
    private CompletableFuture<List<Contact>> searchAsync(ContactQuery query) {
        CompletableFuture<List<Contact>> future = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                future.orTimeout(options.getCallTimeout().toMillis(), TimeUnit.MILLISECONDS);
                try {
                    future.complete(directory.search(query));
                } catch (RuntimeException e) {
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    private List<ContactQuery> buildQueries(MatchSignals signals) {
        int poolSize = options.getCandidatePoolSize();
        List<ContactQuery> queries = new ArrayList<>(3);
        if (signals.hasPhone()) {
            String prefix = phoneSimilarity.searchPrefix(signals.phone());
            if (!prefix.isEmpty()) {
                queries.add(new ContactQuery(SignalType.PHONE, prefix, poolSize));
            }
        }
        if (signals.hasEmail()) {
            String domain = EndpointNormalizer.emailDomain(signals.email());
            if (!domain.isEmpty()) {
                queries.add(new ContactQuery(SignalType.EMAIL, domain, poolSize));
            }
        }
        if (signals.hasName()) {
            String fragment = EndpointNormalizer.normalizeName(signals.name());
            if (!fragment.isEmpty()) {
                queries.add(new ContactQuery(SignalType.NAME, fragment, poolSize));
            }
        }
        return queries;
    }
}
