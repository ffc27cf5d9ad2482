package com.entity.network.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;
import java.util.Objects;

/**
 * Bridges analytics spans onto an OpenTelemetry {@link Tracer}.
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String INSTRUMENTATION_NAME = "com.entity.network";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    public static OpenTelemetryTracingService from(OpenTelemetry openTelemetry) {
        return new OpenTelemetryTracingService(openTelemetry.getTracer(INSTRUMENTATION_NAME));
    }

    @Override
    public Span startSpan(String spanName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(spanName);
        if (attributes != null) {
            for (Map.Entry<String, String> attribute : attributes.entrySet()) {
                builder.setAttribute(attribute.getKey(), attribute.getValue());
            }
        }
        return new OTelSpan(builder.startSpan());
    }

    private record OTelSpan(io.opentelemetry.api.trace.Span delegate) implements Span {

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            delegate.setStatus(status == SpanStatus.ERROR ? StatusCode.ERROR : StatusCode.OK);
        }

        @Override
        public void recordException(Throwable t) {
            delegate.recordException(t);
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
