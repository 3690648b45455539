package com.entity.linking.metrics;

import com.entity.linking.core.model.SignalType;
import com.entity.linking.link.LinkWriteResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code entity.match.duration} - Timer</li>
 *   <li>{@code entity.match.confidence} - DistributionSummary</li>
 *   <li>{@code entity.match.signal.failure} - Counter (tag: signal)</li>
 *   <li>{@code entity.link.outcome} - Counter (tag: outcome)</li>
 *   <li>{@code entity.autolink.links} - DistributionSummary</li>
 *   <li>{@code entity.autolink.stage.failure} - Counter (tag: stage)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer matchTimer;
    private final DistributionSummary confidenceSummary;
    private final DistributionSummary autoLinkSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.matchTimer = Timer.builder("entity.match.duration")
                .description("Duration of contact match queries")
                .register(registry);
        this.confidenceSummary = DistributionSummary.builder("entity.match.confidence")
                .description("Distribution of returned match confidences")
                .register(registry);
        this.autoLinkSummary = DistributionSummary.builder("entity.autolink.links")
                .description("Links created per inbound message")
                .register(registry);
    }

    @Override
    public void recordMatchDuration(Duration duration) {
        matchTimer.record(duration);
    }

    @Override
    public void recordMatchConfidence(double confidence) {
        confidenceSummary.record(confidence);
    }

    @Override
    public void incrementSignalQueryFailure(SignalType signal) {
        counter("entity.match.signal.failure", "signal", signal.name(),
                "Contact searches that failed and were excluded").increment();
    }

    @Override
    public void recordLinkOutcome(LinkWriteResult.Outcome outcome) {
        counter("entity.link.outcome", "outcome", outcome.name(),
                "Link writes by outcome").increment();
    }

    @Override
    public void recordAutoLinkLinks(int linksCreated) {
        autoLinkSummary.record(linksCreated);
    }

    @Override
    public void incrementAutoLinkStageFailure(String stage) {
        counter("entity.autolink.stage.failure", "stage", stage,
                "Auto-link stages that degraded to an empty result").increment();
    }

    private Counter counter(String name, String tagKey, String tagValue, String description) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
