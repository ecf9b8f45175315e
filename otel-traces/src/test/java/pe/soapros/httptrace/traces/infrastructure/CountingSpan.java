package pe.soapros.httptrace.traces.infrastructure;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.StatusCode;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delegating span that counts calls to {@code end}.
 */
class CountingSpan implements Span {

    private final Span delegate;
    private final AtomicInteger endCalls = new AtomicInteger();

    CountingSpan(Span delegate) {
        this.delegate = delegate;
    }

    int endCalls() {
        return endCalls.get();
    }

    @Override
    public Span setAttribute(String key, String value) {
        delegate.setAttribute(key, value);
        return this;
    }

    @Override
    public Span setAttribute(String key, long value) {
        delegate.setAttribute(key, value);
        return this;
    }

    @Override
    public Span setAttribute(String key, double value) {
        delegate.setAttribute(key, value);
        return this;
    }

    @Override
    public Span setAttribute(String key, boolean value) {
        delegate.setAttribute(key, value);
        return this;
    }

    @Override
    public <T> Span setAttribute(AttributeKey<T> key, T value) {
        delegate.setAttribute(key, value);
        return this;
    }

    @Override
    public Span addEvent(String name, Attributes attributes) {
        delegate.addEvent(name, attributes);
        return this;
    }

    @Override
    public Span addEvent(String name, Attributes attributes, long timestamp, TimeUnit unit) {
        delegate.addEvent(name, attributes, timestamp, unit);
        return this;
    }

    @Override
    public Span setStatus(StatusCode statusCode, String description) {
        delegate.setStatus(statusCode, description);
        return this;
    }

    @Override
    public Span recordException(Throwable exception, Attributes additionalAttributes) {
        delegate.recordException(exception, additionalAttributes);
        return this;
    }

    @Override
    public Span updateName(String name) {
        delegate.updateName(name);
        return this;
    }

    @Override
    public void end() {
        endCalls.incrementAndGet();
        delegate.end();
    }

    @Override
    public void end(long timestamp, TimeUnit unit) {
        endCalls.incrementAndGet();
        delegate.end(timestamp, unit);
    }

    @Override
    public SpanContext getSpanContext() {
        return delegate.getSpanContext();
    }

    @Override
    public boolean isRecording() {
        return delegate.isRecording();
    }
}
