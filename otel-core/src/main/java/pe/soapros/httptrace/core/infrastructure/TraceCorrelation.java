package pe.soapros.httptrace.core.infrastructure;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.slf4j.MDC;

import java.util.Optional;

/**
 * Shares the active trace id with the logging layer.
 * <p>
 * While a request span is current its ids are published in the SLF4J MDC so
 * that log lines written during the request carry the same trace id as the span.
 */
public final class TraceCorrelation {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String SPAN_ID_KEY = "spanId";
    public static final String TRACE_SAMPLED_KEY = "traceSampled";

    private TraceCorrelation() {
    }

    /**
     * Trace id of the span active on this thread, if any.
     */
    public static Optional<String> currentTraceId() {
        SpanContext spanContext = Span.current().getSpanContext();
        return spanContext.isValid() ? Optional.of(spanContext.getTraceId()) : Optional.empty();
    }

    public static Optional<String> currentSpanId() {
        SpanContext spanContext = Span.current().getSpanContext();
        return spanContext.isValid() ? Optional.of(spanContext.getSpanId()) : Optional.empty();
    }

    /**
     * Publishes the ids of {@code span} in the MDC. Closing the returned scope
     * puts back whatever was there before, so scopes nest.
     */
    public static MdcScope attach(Span span) {
        MdcScope scope = new MdcScope(
                MDC.get(TRACE_ID_KEY),
                MDC.get(SPAN_ID_KEY),
                MDC.get(TRACE_SAMPLED_KEY));

        SpanContext spanContext = span.getSpanContext();
        if (spanContext.isValid()) {
            MDC.put(TRACE_ID_KEY, spanContext.getTraceId());
            MDC.put(SPAN_ID_KEY, spanContext.getSpanId());
            MDC.put(TRACE_SAMPLED_KEY, String.valueOf(spanContext.isSampled()));
        }
        return scope;
    }

    public static final class MdcScope implements AutoCloseable {
        private final String previousTraceId;
        private final String previousSpanId;
        private final String previousSampled;

        private MdcScope(String previousTraceId, String previousSpanId, String previousSampled) {
            this.previousTraceId = previousTraceId;
            this.previousSpanId = previousSpanId;
            this.previousSampled = previousSampled;
        }

        @Override
        public void close() {
            restore(TRACE_ID_KEY, previousTraceId);
            restore(SPAN_ID_KEY, previousSpanId);
            restore(TRACE_SAMPLED_KEY, previousSampled);
        }

        private static void restore(String key, String value) {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        }
    }
}
