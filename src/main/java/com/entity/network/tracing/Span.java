package com.entity.network.tracing;

/**
 * A traced analytics phase. Closing the span ends it; a span that is closed without
 * a status keeps whatever the backend defaults to.
 *
 * <pre>
 * try (Span span = tracingService.startScopedSpan("layout", scope)) {
 *     span.setAttribute("nodes", snapshot.nodeCount());
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    /** Span that discards everything; shared by all callers. */
    Span NOOP = new Span() {
        @Override
        public void setAttribute(String key, String value) {
            // discarded
        }

        @Override
        public void setAttribute(String key, long value) {
            // discarded
        }

        @Override
        public void setStatus(SpanStatus status) {
            // discarded
        }

        @Override
        public void recordException(Throwable t) {
            // discarded
        }

        @Override
        public void close() {
            // nothing to end
        }
    };

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Records the failure and marks the span as errored.
     */
    default void fail(Throwable t) {
        recordException(t);
        setStatus(SpanStatus.ERROR);
    }

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
