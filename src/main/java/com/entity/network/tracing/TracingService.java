package com.entity.network.tracing;

import com.entity.network.core.model.Scope;

import java.util.Map;

/**
 * Starts spans around analytics operations. {@link NoOpTracingService} is used when the
 * facade is built without a tracer.
 */
public interface TracingService {

    String SPAN_PREFIX = "network.";
    String SCOPE_ATTRIBUTE = "scope";

    Span startSpan(String spanName, Map<String, String> attributes);

    default Span startSpan(String spanName) {
        return startSpan(spanName, Map.of());
    }

    /**
     * Starts {@code network.<operation>} tagged with the scope id.
     */
    default Span startScopedSpan(String operation, Scope scope) {
        return startSpan(SPAN_PREFIX + operation, Map.of(SCOPE_ATTRIBUTE, scope.id()));
    }
}
