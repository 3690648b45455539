package com.entity.linking.tracing;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Span lifecycle runs without a tracing backend")
        void lifecycle() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startSpan(SpanNames.LINK_CREATE, Map.of("link.sourceType", "todo"))) {
                    span.setAttribute("link.outcome", "CREATED");
                    span.setAttribute("autolink.contacts", 2L);
                    span.setAttribute("match.hasPhone", true);
                    span.recordException(new IllegalStateException("ignored"));
                    span.fail(new IllegalStateException("ignored"));
                    span.setStatus(Span.SpanStatus.ERROR);
                }
            });
        }

        @Test
        @DisplayName("Every call returns the same inert span")
        void sameSpan() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startSpan(SpanNames.MATCH_SUGGEST), noOp.startSpan(SpanNames.AUTOLINK_RUN));
            assertSame(NoOpTracingService.InertSpan.INSTANCE, noOp.startSpan(SpanNames.LINK_CREATE, Map.of()));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer tracer;
        private SpanBuilder builder;
        private io.opentelemetry.api.trace.Span otelSpan;
        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            tracer = mock(Tracer.class);
            builder = mock(SpanBuilder.class);
            otelSpan = mock(io.opentelemetry.api.trace.Span.class);
            when(tracer.spanBuilder(anyString())).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);
            service = new OpenTelemetryTracingService(tracer);
        }

        @Test
        @DisplayName("Start attributes go on the span builder")
        void startAttributes() {
            service.startSpan(SpanNames.LINK_CREATE, Map.of("link.targetType", "thread"));

            verify(tracer).spanBuilder("link.create");
            verify(builder).setAttribute("link.targetType", "thread");
        }

        @Test
        @DisplayName("Attributes of every kind are forwarded")
        void attributes() {
            Span span = service.startSpan(SpanNames.AUTOLINK_SENDER);
            span.setAttribute("autolink.contacts", 1L);
            span.setAttribute("match.hasEmail", false);
            span.setAttribute("link.outcome", "ROLLED_BACK");

            verify(otelSpan).setAttribute("autolink.contacts", 1L);
            verify(otelSpan).setAttribute("match.hasEmail", false);
            verify(otelSpan).setAttribute("link.outcome", "ROLLED_BACK");
        }

        @Test
        @DisplayName("Status and exceptions map onto OpenTelemetry")
        void statusAndException() {
            Span span = service.startSpan(SpanNames.AUTOLINK_RUN);
            RuntimeException failure = new RuntimeException("search down");
            span.recordException(failure);
            span.setStatus(Span.SpanStatus.ERROR);
            span.setStatus(Span.SpanStatus.OK);

            verify(otelSpan).recordException(failure,
                    Attributes.of(OpenTelemetryTracingService.EXCEPTION_MESSAGE, "search down"));
            verify(otelSpan).setStatus(StatusCode.ERROR);
            verify(otelSpan).setStatus(StatusCode.OK);
        }

        @Test
        @DisplayName("fail marks the span as errored and records the cause")
        void failRecordsCause() {
            Span span = service.startSpan(SpanNames.AUTOLINK_CONTENT);
            IllegalStateException failure = new IllegalStateException("timeout");
            span.fail(failure);

            verify(otelSpan).setStatus(StatusCode.ERROR);
            verify(otelSpan).recordException(failure,
                    Attributes.of(OpenTelemetryTracingService.EXCEPTION_MESSAGE, "timeout"));
        }

        @Test
        @DisplayName("Phone numbers and e-mail addresses are masked before reaching OpenTelemetry")
        void identifiersMasked() {
            Span span = service.startSpan(SpanNames.MATCH_SUGGEST, Map.of("match.query", "alice@example.com"));
            span.setAttribute("match.sender", "+61 400 123 456");

            verify(builder).setAttribute("match.query", "***@example.com");
            verify(otelSpan).setAttribute("match.sender", "***");
            verify(otelSpan, never()).setAttribute("match.sender", "+61 400 123 456");
        }

        @Test
        @DisplayName("Exception messages are masked before reaching OpenTelemetry")
        void exceptionMessageMasked() {
            Span span = service.startSpan(SpanNames.AUTOLINK_SENDER);
            RuntimeException failure = new RuntimeException("no contact for bob@example.com");
            span.recordException(failure);

            verify(otelSpan).recordException(failure,
                    Attributes.of(OpenTelemetryTracingService.EXCEPTION_MESSAGE, "no contact for ***@example.com"));
        }

        @Test
        @DisplayName("Closing ends the span")
        void closeEnds() {
            try (Span span = service.startSpan(SpanNames.LINK_REMOVE)) {
                span.setStatus(Span.SpanStatus.OK);
            }
            verify(otelSpan).end();
        }
    }
}
