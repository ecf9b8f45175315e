package pe.soapros.httptrace.core.infrastructure;

import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FailureReportingSpanExporterTest {

    private static SpanExporter failingWith(CompletableResultCode result) {
        return new SpanExporter() {
            @Override
            public CompletableResultCode export(Collection<SpanData> spans) {
                return result;
            }

            @Override
            public CompletableResultCode flush() {
                return CompletableResultCode.ofSuccess();
            }

            @Override
            public CompletableResultCode shutdown() {
                return CompletableResultCode.ofSuccess();
            }
        };
    }

    @Test
    void successfulExportsAreNotCounted() {
        FailureReportingSpanExporter exporter = new FailureReportingSpanExporter(InMemorySpanExporter.create());

        CompletableResultCode result = exporter.export(List.of());

        assertTrue(result.isSuccess());
        assertEquals(0, exporter.getDroppedSpans());
    }

    private static List<SpanData> finishedSpans(int count) {
        InMemorySpanExporter recorder = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(recorder))
                .build();
        for (int i = 0; i < count; i++) {
            tracerProvider.get("test").spanBuilder("span-" + i).startSpan().end();
        }
        return recorder.getFinishedSpanItems();
    }

    @Test
    void failedExportsAreCountedAsDropped() {
        FailureReportingSpanExporter exporter = new FailureReportingSpanExporter(
                failingWith(CompletableResultCode.ofFailure()));

        exporter.export(finishedSpans(2));
        exporter.export(finishedSpans(3));

        assertEquals(5, exporter.getDroppedSpans());
    }

    @Test
    void lateFailureIsCountedWhenTheResultCompletes() {
        CompletableResultCode pending = new CompletableResultCode();
        FailureReportingSpanExporter exporter = new FailureReportingSpanExporter(failingWith(pending));

        exporter.export(finishedSpans(4));
        assertEquals(0, exporter.getDroppedSpans());

        pending.fail();
        assertEquals(4, exporter.getDroppedSpans());
    }

    @Test
    void exporterThatThrowsYieldsAFailedResult() {
        FailureReportingSpanExporter exporter = new FailureReportingSpanExporter(new SpanExporter() {
            @Override
            public CompletableResultCode export(Collection<SpanData> spans) {
                throw new IllegalStateException("connection refused");
            }

            @Override
            public CompletableResultCode flush() {
                return CompletableResultCode.ofSuccess();
            }

            @Override
            public CompletableResultCode shutdown() {
                return CompletableResultCode.ofSuccess();
            }
        });

        CompletableResultCode result = exporter.export(finishedSpans(1));

        assertEquals(1, exporter.getDroppedSpans());
        assertTrue(result.isDone());
        assertFalse(result.isSuccess());
    }
}
