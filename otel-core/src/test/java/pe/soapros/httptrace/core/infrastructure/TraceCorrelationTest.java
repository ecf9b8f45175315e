package pe.soapros.httptrace.core.infrastructure;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.context.Scope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TraceCorrelationTest {

    private static final Span OUTER = Span.wrap(SpanContext.create(
            "0af7651916cd43dd8448eb211c80319c", "b7ad6b7169203331", TraceFlags.getSampled(), TraceState.getDefault()));
    private static final Span INNER = Span.wrap(SpanContext.create(
            "0af7651916cd43dd8448eb211c80319c", "53995c3f42cd8ad8", TraceFlags.getSampled(), TraceState.getDefault()));

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void noActiveSpanMeansNoTraceId() {
        assertEquals(Optional.empty(), TraceCorrelation.currentTraceId());
        assertEquals(Optional.empty(), TraceCorrelation.currentSpanId());
    }

    @Test
    void readsTheActiveSpanWithoutBeingHandedIt() {
        try (Scope scope = OUTER.makeCurrent()) {
            assertEquals(Optional.of("0af7651916cd43dd8448eb211c80319c"), TraceCorrelation.currentTraceId());
            assertEquals(Optional.of("b7ad6b7169203331"), TraceCorrelation.currentSpanId());
        }
        assertEquals(Optional.empty(), TraceCorrelation.currentTraceId());
    }

    @Test
    void mdcScopesNestAndRestore() {
        try (TraceCorrelation.MdcScope outer = TraceCorrelation.attach(OUTER)) {
            assertEquals("b7ad6b7169203331", MDC.get(TraceCorrelation.SPAN_ID_KEY));

            try (TraceCorrelation.MdcScope inner = TraceCorrelation.attach(INNER)) {
                assertEquals("53995c3f42cd8ad8", MDC.get(TraceCorrelation.SPAN_ID_KEY));
                assertEquals("0af7651916cd43dd8448eb211c80319c", MDC.get(TraceCorrelation.TRACE_ID_KEY));
            }

            assertEquals("b7ad6b7169203331", MDC.get(TraceCorrelation.SPAN_ID_KEY));
            assertEquals("true", MDC.get(TraceCorrelation.TRACE_SAMPLED_KEY));
        }

        assertNull(MDC.get(TraceCorrelation.TRACE_ID_KEY));
        assertNull(MDC.get(TraceCorrelation.SPAN_ID_KEY));
    }

    @Test
    void invalidSpanLeavesMdcUntouched() {
        MDC.put(TraceCorrelation.TRACE_ID_KEY, "previous");

        try (TraceCorrelation.MdcScope scope = TraceCorrelation.attach(Span.getInvalid())) {
            assertEquals("previous", MDC.get(TraceCorrelation.TRACE_ID_KEY));
        }

        assertEquals("previous", MDC.get(TraceCorrelation.TRACE_ID_KEY));
    }
}
