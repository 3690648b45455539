package com.entity.linking.tracing;

import java.util.Map;

/**
 * Tracing seam for the linking core. {@link NoOpTracingService} is the default, so the
 * library runs without any tracing backend; {@link OpenTelemetryTracingService} bridges to OTel.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
