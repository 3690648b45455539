package com.entity.linking.metrics;

import com.entity.linking.core.model.SignalType;
import com.entity.linking.link.LinkWriteResult;

import java.time.Duration;

/**
 * Interface for recording entity linking metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordMatchDuration(Duration duration);

    void recordMatchConfidence(double confidence);

    void incrementSignalQueryFailure(SignalType signal);

    void recordLinkOutcome(LinkWriteResult.Outcome outcome);

    void recordAutoLinkLinks(int linksCreated);

    void incrementAutoLinkStageFailure(String stage);
}
