package com.entity.linking.cdi;

import com.entity.linking.api.EntityLinker;
import com.entity.linking.api.LinkingOptions;
import com.entity.linking.metrics.MetricsService;
import com.entity.linking.metrics.MicrometerMetricsService;
import com.entity.linking.metrics.NoOpMetricsService;
import com.entity.linking.tracing.NoOpTracingService;
import com.entity.linking.tracing.OpenTelemetryTracingService;
import com.entity.linking.tracing.TracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the entity linker from MicroProfile Config properties.
 *
 * <h2>Required configuration</h2>
 * <pre>
 * entity-linking.backend.base-url=http://localhost:3000
 * entity-linking.backend.token=...
 * </pre>
 *
 * <p>All other keys have defaults, listed in {@code META-INF/microprofile-config.properties}.
 * Metrics go to the container's {@link MeterRegistry} when one is available; spans go to
 * {@link GlobalOpenTelemetry} when tracing is enabled.</p>
 */
@ApplicationScoped
public class LinkingProducer {

    private static final Logger log = LoggerFactory.getLogger(LinkingProducer.class);

    static final String INSTRUMENTATION_NAME = "com.entity.linking";

    // ── Backend ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-linking.backend.base-url", defaultValue = "http://localhost:3000")
    String backendBaseUrl;

    @Inject
    @ConfigProperty(name = "entity-linking.backend.token")
    Optional<String> backendToken;

    @Inject
    @ConfigProperty(name = "entity-linking.backend.timeout-millis", defaultValue = "5000")
    long timeoutMillis;

    // ── Matching ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-linking.match.default-limit", defaultValue = "10")
    int defaultMatchLimit;

    @Inject
    @ConfigProperty(name = "entity-linking.match.max-limit", defaultValue = "50")
    int maxMatchLimit;

    @Inject
    @ConfigProperty(name = "entity-linking.match.candidate-pool-size", defaultValue = "50")
    int candidatePoolSize;

    // ── Auto-linking ──────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-linking.autolink.sender-threshold", defaultValue = "0.9")
    double senderThreshold;

    @Inject
    @ConfigProperty(name = "entity-linking.autolink.content-threshold", defaultValue = "0.75")
    double contentThreshold;

    @Inject
    @ConfigProperty(name = "entity-linking.autolink.content-search-limit", defaultValue = "10")
    int contentSearchLimit;

    @Inject
    @ConfigProperty(name = "entity-linking.autolink.sender-contact-limit", defaultValue = "5")
    int senderContactLimit;

    @Inject
    @ConfigProperty(name = "entity-linking.autolink.max-query-length", defaultValue = "500")
    int maxQueryLength;

    // ── Links ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-linking.links.query-limit", defaultValue = "200")
    int linkQueryLimit;

    // ── Observability ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-linking.tracing.enabled", defaultValue = "false")
    boolean tracingEnabled;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public LinkingOptions linkingOptions() {
        return LinkingOptions.builder()
                .defaultMatchLimit(defaultMatchLimit)
                .maxMatchLimit(maxMatchLimit)
                .candidatePoolSize(candidatePoolSize)
                .senderMatchThreshold(senderThreshold)
                .contentSimilarityThreshold(contentThreshold)
                .contentSearchLimit(contentSearchLimit)
                .senderContactLimit(senderContactLimit)
                .maxSearchQueryLength(maxQueryLength)
                .linkQueryLimit(linkQueryLimit)
                .callTimeout(Duration.ofMillis(timeoutMillis))
                .build();
    }

    @Produces
    @ApplicationScoped
    public EntityLinker entityLinker(LinkingOptions options) {
        log.info("Producing EntityLinker: backend={} timeoutMillis={}", backendBaseUrl, timeoutMillis);
        return EntityLinker.builder()
                .options(options)
                .backend(backendBaseUrl, backendToken.orElse(null))
                .metricsService(metricsService())
                .tracingService(tracingService())
                .build();
    }

    public void closeLinker(@Disposes EntityLinker linker) {
        log.info("Closing EntityLinker");
        linker.close();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    private MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Metrics enabled: Micrometer");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        log.info("Metrics disabled: no MeterRegistry bean");
        return new NoOpMetricsService();
    }

    private TracingService tracingService() {
        if (tracingEnabled) {
            log.info("Tracing enabled: OpenTelemetry");
            return new OpenTelemetryTracingService(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME));
        }
        return new NoOpTracingService();
    }
}
