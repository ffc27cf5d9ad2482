package com.entity.network.tracing;

import java.util.Map;

/**
 * Tracing disabled: every call yields {@link Span#NOOP}.
 */
public class NoOpTracingService implements TracingService {

    @Override
    public Span startSpan(String spanName, Map<String, String> attributes) {
        return Span.NOOP;
    }
}
