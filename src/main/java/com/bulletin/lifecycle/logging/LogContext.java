package com.bulletin.lifecycle.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to the SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forStatusUpdate(correlationId, "USERS", entityHash)) {
 *     log.info("status.updated from={} to={}", from, to);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forStatusUpdate(String correlationId, String entityType, String entityHash) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("entityType", entityType);
        ctx.put("entityHash", entityHash);
        ctx.put("operation", "status");
        return ctx;
    }

    public static LogContext forAdministration(String correlationId, String entityHash, String action) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("entityHash", entityHash);
        ctx.put("operation", "administration." + action);
        return ctx;
    }

    public static LogContext forIndexRebuild(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", "index.rebuild");
        return ctx;
    }

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
