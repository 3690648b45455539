package com.entity.linking.core.model;

import java.util.Objects;

/**
 * An inbound SMS or e-mail as seen by the auto-linker.
 *
 * @param threadId    id of the thread the message belongs to
 * @param senderPhone sender phone number, may be null
 * @param senderEmail sender e-mail address, may be null
 * @param content     message body, never null
 */
public record InboundMessage(String threadId, String senderPhone, String senderEmail, String content) {

    public InboundMessage {
        Objects.requireNonNull(threadId, "threadId is required");
        content = content != null ? content : "";
    }

    public MatchSignals senderSignals() {
        return new MatchSignals(senderPhone, senderEmail, null);
    }
}
