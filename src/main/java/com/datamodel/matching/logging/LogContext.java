package com.datamodel.matching.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Scoped MDC entries for the matching engines.
 *
 * <p>Every scope sets {@code correlationId} and {@code operation} ({@code autoplan},
 * {@code infer} or {@code analyze}); planning adds {@code entity} and inference adds
 * {@code domainId}. Closing the scope removes exactly the keys it put, so nested
 * scopes leave the outer entries in place only if they use different keys.</p>
 *
 * <pre>
 * try (LogContext ctx = LogContext.forInference(LogContext.generateCorrelationId(), domainId)) {
 *     log.info("relationship.infer sources={}", sources.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for mapping planning.
     */
    public static LogContext forPlanning(String correlationId, String entityName) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("entity", entityName);
        ctx.put("operation", "autoplan");
        return ctx;
    }

    /**
     * Creates a log context for relationship inference over a domain.
     */
    public static LogContext forInference(String correlationId, String domainId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("domainId", domainId);
        ctx.put("operation", "infer");
        return ctx;
    }

    /**
     * Creates a log context for model quality analysis.
     */
    public static LogContext forAnalysis(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", "analyze");
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
