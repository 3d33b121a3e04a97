package com.claim.traversal.logging;

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
    @DisplayName("forExtraction should set sessionId and operation in MDC")
    void forExtractionSetsMDC() {
        try (LogContext ctx = LogContext.forExtraction("session-1")) {
            assertEquals("session-1", MDC.get("sessionId"));
            assertEquals("extract", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forResolution should set sessionId, forcingPointId and operation in MDC")
    void forResolutionSetsMDC() {
        try (LogContext ctx = LogContext.forResolution("session-1", "g1")) {
            assertEquals("session-1", MDC.get("sessionId"));
            assertEquals("g1", MDC.get("forcingPointId"));
            assertEquals("resolve", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("Try-with-resources should clean up MDC")
    void tryWithResourcesCleansUp() {
        try (LogContext ctx = LogContext.forResolution("session-1", "g1")
                .with("selectedClaimId", "A")) {
            assertEquals("A", MDC.get("selectedClaimId"));
        }
        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("forcingPointId"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("selectedClaimId"));
    }

    @Test
    @DisplayName("generateSessionId should return unique UUIDs")
    void generateSessionIdReturnsUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateSessionId());
        }
        assertEquals(100, ids.size());
        assertTrue(ids.iterator().next()
                .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"));
    }
}
