package com.entity.linking.tracing;

/**
 * Operation names used for spans.
 */
public final class SpanNames {

    public static final String AUTOLINK_RUN = "autolink.run";
    public static final String AUTOLINK_SENDER = "autolink.sender";
    public static final String AUTOLINK_CONTENT = "autolink.content";
    public static final String MATCH_SUGGEST = "match.suggest";
    public static final String LINK_CREATE = "link.create";
    public static final String LINK_REMOVE = "link.remove";

    private SpanNames() {
    }
}
