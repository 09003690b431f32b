package com.dnd.navigator.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSearch(LogContext.generateCorrelationId(), query)) {
 *     log.info("search.completed totalCount={}", total);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forSearch(String correlationId, String query) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("query", query);
        ctx.put("operation", "search");
        return ctx;
    }

    public static LogContext forPrefetch(String category) {
        LogContext ctx = new LogContext();
        ctx.put("category", category);
        ctx.put("operation", "prefetch");
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
