package com.entity.linking.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forAutoLink should set correlationId, threadId and operation in MDC")
    void forAutoLinkSetsMDC() {
        try (LogContext ctx = LogContext.forAutoLink("corr-123", "thread-1")) {
            assertEquals("corr-123", MDC.get("correlationId"));
            assertEquals("thread-1", MDC.get("threadId"));
            assertEquals("autolink", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forLink should set linkKey and operation in MDC")
    void forLinkSetsMDC() {
        try (LogContext ctx = LogContext.forLink("link.create", "todo:1:url:https://x")) {
            assertEquals("todo:1:url:https://x", MDC.get("linkKey"));
            assertEquals("link.create", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forMatch should set correlationId and operation in MDC")
    void forMatchSetsMDC() {
        try (LogContext ctx = LogContext.forMatch("corr-456")) {
            assertEquals("corr-456", MDC.get("correlationId"));
            assertEquals("match", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("Try-with-resources should clean up MDC")
    void tryWithResourcesCleansUp() {
        try (LogContext ctx = LogContext.forAutoLink("corr-123", "thread-1").with("stage", "sender")) {
            assertEquals("sender", MDC.get("stage"));
        }
        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("threadId"));
        assertNull(MDC.get("stage"));
    }

    @Test
    @DisplayName("Closing twice is harmless")
    void closeTwice() {
        LogContext ctx = LogContext.forMatch("corr-1");
        ctx.close();
        MDC.put("correlationId", "someone-else");
        ctx.close();
        assertEquals("someone-else", MDC.get("correlationId"));
    }

    @Test
    @DisplayName("generateCorrelationId should produce unique IDs")
    void uniqueCorrelationIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
    }
}
