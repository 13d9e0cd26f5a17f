package com.entity.matching.logging;

import com.entity.matching.core.model.MatchMode;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) scope for structured logging.
 * Adds key-value pairs to the SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forBuild(runId, MatchMode.DEDUPLICATE)) {
 *     log.info("match.scored pairs={}", count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Scope for an engine build: pair generation, filtering and scoring.
     */
    public static LogContext forBuild(String runId, MatchMode mode) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("mode", mode.name());
        ctx.put("operation", "build");
        return ctx;
    }

    /**
     * Scope for a cluster query over {@code [lower, upper]}.
     */
    public static LogContext forClustering(String runId, double lower, double upper) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "cluster");
        ctx.put("lowerBound", String.valueOf(lower));
        ctx.put("upperBound", String.valueOf(upper));
        return ctx;
    }

    /**
     * Scope for loading or exporting tabular data.
     */
    public static LogContext forTransfer(String operation, String format) {
        LogContext ctx = new LogContext();
        ctx.put("operation", operation);
        ctx.put("format", format);
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds another key-value pair to this scope.
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
