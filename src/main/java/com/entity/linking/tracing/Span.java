package com.entity.linking.tracing;

/**
 * A traced unit of linking work: a match query, a link write or an auto-link stage.
 * Closing the span ends it.
 * <pre>
 * try (Span span = tracing.startSpan(SpanNames.AUTOLINK_CONTENT)) {
 *     try {
 *         hits = search.search(query);
 *     } catch (RuntimeException e) {
 *         span.fail(e);
 *         return List.of();
 *     }
 *     span.setAttribute("autolink.workItems", hits.size());
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, boolean value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Marks the span as failed and records the cause.
     */
    default void fail(Throwable cause) {
        setStatus(SpanStatus.ERROR);
        recordException(cause);
    }

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
