package pe.soapros.httptrace.core.infrastructure;

import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Delegating exporter that logs batches the sink rejected or could not be
 * reached for. A failed batch is dropped; it never surfaces to request handling.
 */
public class FailureReportingSpanExporter implements SpanExporter {

    private static final Logger logger = LoggerFactory.getLogger(FailureReportingSpanExporter.class);

    private final SpanExporter delegate;
    private final AtomicLong droppedSpans = new AtomicLong();

    public FailureReportingSpanExporter(SpanExporter delegate) {
        this.delegate = delegate;
    }

    @Override
    public CompletableResultCode export(Collection<SpanData> spans) {
        int batchSize = spans.size();
        CompletableResultCode result;
        try {
            result = delegate.export(spans);
        } catch (RuntimeException e) {
            long total = droppedSpans.addAndGet(batchSize);
            logger.warn("Span export threw, dropped {} spans ({} dropped so far)", batchSize, total, e);
            return CompletableResultCode.ofFailure();
        }

        result.whenComplete(() -> {
            if (!result.isSuccess()) {
                long total = droppedSpans.addAndGet(batchSize);
                logger.warn("Span export failed, dropped {} spans ({} dropped so far)", batchSize, total);
            }
        });
        return result;
    }

    @Override
    public CompletableResultCode flush() {
        return delegate.flush();
    }

    @Override
    public CompletableResultCode shutdown() {
        return delegate.shutdown();
    }

    public long getDroppedSpans() {
        return droppedSpans.get();
    }

    @Override
    public String toString() {
        return "FailureReportingSpanExporter{" + delegate + "}";
    }
}
