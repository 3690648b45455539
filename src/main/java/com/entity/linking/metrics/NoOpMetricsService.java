package com.entity.linking.metrics;

import com.entity.linking.core.model.SignalType;
import com.entity.linking.link.LinkWriteResult;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 * All methods are empty, ensuring the library works without any metrics dependencies.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMatchDuration(Duration duration) {
    }

    @Override
    public void recordMatchConfidence(double confidence) {
    }

    @Override
    public void incrementSignalQueryFailure(SignalType signal) {
    }

    @Override
    public void recordLinkOutcome(LinkWriteResult.Outcome outcome) {
    }

    @Override
    public void recordAutoLinkLinks(int linksCreated) {
    }

    @Override
    public void incrementAutoLinkStageFailure(String stage) {
    }
}
