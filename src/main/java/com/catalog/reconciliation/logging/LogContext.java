package com.catalog.reconciliation.logging;

import org.slf4j.MDC;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable wrapper around the SLF4J MDC. Keys added through a context are
 * removed when it closes.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRun(runId, watermark)) {
 *     log.info("reconcile.started records={}", count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String WATERMARK = "watermark";
    public static final String PRODUCT_KEY = "productKey";
    public static final String GUARD = "guard";
    public static final String OPERATION = "operation";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forRun(String runId, Instant watermark) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        ctx.put(WATERMARK, String.valueOf(watermark));
        ctx.put(OPERATION, "reconcile");
        return ctx;
    }

    /**
     * Context for merge work on a shard thread, which does not inherit the caller's MDC.
     */
    public static LogContext forShard(String runId, int shard) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        ctx.put("shard", Integer.toString(shard));
        ctx.put(OPERATION, "merge");
        return ctx;
    }

    public static LogContext forGuard(String guardName) {
        LogContext ctx = new LogContext();
        ctx.put(GUARD, guardName);
        ctx.put(OPERATION, "guard");
        return ctx;
    }

    public static LogContext forOverride(String productKey) {
        LogContext ctx = new LogContext();
        ctx.put(PRODUCT_KEY, productKey);
        ctx.put(OPERATION, "override");
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

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
