package pe.soapros.httptrace.core.infrastructure;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TracingUtilsTest {

    private InMemorySpanExporter spanExporter;
    private Tracer tracer;
    private TracingUtils tracingUtils;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build();
        tracer = tracerProvider.get("test");
        tracingUtils = new TracingUtils(tracer);
    }

    @Test
    void childSpanHangsOffTheCurrentSpan() {
        Span parent = tracer.spanBuilder("request").startSpan();
        String result;
        try (Scope scope = parent.makeCurrent()) {
            result = tracingUtils.withSpan("lookup", () -> "found");
        } finally {
            parent.end();
        }

        assertEquals("found", result);
        List<SpanData> spans = spanExporter.getFinishedSpanItems();
        assertEquals(2, spans.size());

        SpanData child = spans.get(0);
        assertEquals("lookup", child.getName());
        assertEquals(SpanKind.INTERNAL, child.getKind());
        assertEquals(parent.getSpanContext().getSpanId(), child.getParentSpanId());
        assertEquals(parent.getSpanContext().getTraceId(), child.getTraceId());
    }

    @Test
    void exceptionIsRecordedAndRethrown() {
        IllegalStateException failure = new IllegalStateException("boom");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> tracingUtils.withSpan("explode", (Runnable) () -> {
                    throw failure;
                }));

        assertSame(failure, thrown);
        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertEquals(StatusCode.ERROR, span.getStatus().getStatusCode());
        assertEquals("exception", span.getEvents().get(0).getName());
    }
}
