package com.entity.linking.tracing;

import com.entity.linking.logging.Redaction;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * {@link TracingService} backed by an OpenTelemetry {@link Tracer}.
 *
 * <p>String attribute values and exception messages are passed through {@link Redaction}
 * before they are handed to OTel, so phone numbers, e-mail addresses and bearer tokens are
 * masked even when a caller puts them on a span.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    static final AttributeKey<String> EXCEPTION_MESSAGE = AttributeKey.stringKey("exception.message");

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(String operationName) {
        return startSpan(operationName, null);
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName);
        if (attributes != null) {
            attributes.forEach((key, value) -> builder.setAttribute(key, scrub(value)));
        }
        return new RedactingSpan(builder.startSpan());
    }

    static String scrub(String value) {
        return value == null ? null : Redaction.sanitizeMessage(value);
    }

    private static final class RedactingSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        RedactingSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, scrub(value));
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, boolean value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            delegate.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            // overrides the raw message OTel would copy from the throwable
            delegate.recordException(t, Attributes.of(EXCEPTION_MESSAGE, Redaction.sanitizeError(t)));
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
