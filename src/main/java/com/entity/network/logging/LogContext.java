package com.entity.network.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Scoped MDC entries for one analytics call. Closing restores every key to the value it
 * had before, so a query nested inside another (a snapshot load inside a graph query)
 * hands the outer operation name back when it finishes.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forQuery(correlationId, scope.id(), "graph")) {
 *     log.info("graph.query.completed nodes={}", nodes);
 * }
 * </pre>
 */
public final class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String SCOPE = "scope";
    public static final String OPERATION = "operation";
    public static final String MUTATION = "mutation";
    public static final String IMPORT_ID = "importId";

    // previous value per key, null when the key was absent
    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext forQuery(String correlationId, String scope, String operation) {
        return new LogContext()
                .with(CORRELATION_ID, correlationId)
                .with(SCOPE, scope)
                .with(OPERATION, operation);
    }

    /**
     * A query context flagged as a write; writes invalidate the scope's cache.
     */
    public static LogContext forMutation(String correlationId, String scope, String operation) {
        return forQuery(correlationId, scope, operation).with(MUTATION, "true");
    }

    public static LogContext forImport(String importId, String scope) {
        return new LogContext()
                .with(IMPORT_ID, importId)
                .with(SCOPE, scope)
                .with(OPERATION, "import");
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
        return this;
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
