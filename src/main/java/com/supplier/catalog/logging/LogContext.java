package com.supplier.catalog.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC wrapper. Keys added through a context are removed when it closes.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forImport(uploadId, supplierId)) {
 *     log.info("import.completed uploadId={} success={}", uploadId, success);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forImport(String uploadId, String supplierId) {
        LogContext ctx = new LogContext();
        ctx.put("uploadId", uploadId);
        ctx.put("supplierId", supplierId);
        ctx.put("operation", "import");
        return ctx;
    }

    public static LogContext forAssetJob(String jobId, String assetId) {
        LogContext ctx = new LogContext();
        ctx.put("jobId", jobId);
        ctx.put("assetId", assetId);
        ctx.put("operation", "asset-job");
        return ctx;
    }

    public static LogContext forReview(String supplierItemId, String actor) {
        LogContext ctx = new LogContext();
        ctx.put("supplierItemId", supplierItemId);
        ctx.put("actor", actor);
        ctx.put("operation", "review");
        return ctx;
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
