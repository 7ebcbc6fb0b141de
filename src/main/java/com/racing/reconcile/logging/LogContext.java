package com.racing.reconcile.logging;

import com.racing.reconcile.core.model.EntityType;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them again on close.
 *
 * <pre>
 * try (LogContext run = LogContext.forRun(runId);
 *      LogContext phase = LogContext.forEntityType(EntityType.RACE)) {
 *     log.info("Merged {} races", races.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for a whole reconciliation run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "reconcile");
        return ctx;
    }

    /**
     * Adds only the entity type, for nesting inside {@link #forRun(String)}.
     */
    public static LogContext forEntityType(EntityType entityType) {
        LogContext ctx = new LogContext();
        ctx.put("entityType", entityType.name());
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
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
