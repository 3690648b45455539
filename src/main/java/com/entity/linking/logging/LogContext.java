package com.entity.linking.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forAutoLink(correlationId, threadId)) {
 *     log.info("autolink.completed linksCreated={}", count);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one auto-link run over an inbound message.
     */
    public static LogContext forAutoLink(String correlationId, String threadId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("threadId", threadId);
        ctx.put("operation", "autolink");
        return ctx;
    }

    /**
     * Creates a log context for a link write or removal.
     */
    public static LogContext forLink(String operation, String forwardKey) {
        LogContext ctx = new LogContext();
        ctx.put("linkKey", forwardKey);
        ctx.put("operation", operation);
        return ctx;
    }

    /**
     * Creates a log context for a contact match query.
     */
    public static LogContext forMatch(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", "match");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
