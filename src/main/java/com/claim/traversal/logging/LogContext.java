package com.claim.traversal.logging;

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
 * try (LogContext ctx = LogContext.forResolution(sessionId, forcingPointId)) {
 *     log.info("traversal.resolved fp={} type={}", forcingPointId, type);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for forcing point extraction.
     */
    public static LogContext forExtraction(String sessionId) {
        LogContext ctx = new LogContext();
        ctx.put("sessionId", sessionId);
        ctx.put("operation", "extract");
        return ctx;
    }

    /**
     * Creates a log context for resolving one forcing point.
     */
    public static LogContext forResolution(String sessionId, String forcingPointId) {
        LogContext ctx = new LogContext();
        ctx.put("sessionId", sessionId);
        ctx.put("forcingPointId", forcingPointId);
        ctx.put("operation", "resolve");
        return ctx;
    }

    /**
     * Generates a unique session ID.
     */
    public static String generateSessionId() {
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
