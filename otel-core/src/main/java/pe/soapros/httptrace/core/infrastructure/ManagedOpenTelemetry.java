package pe.soapros.httptrace.core.infrastructure;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.TracerProvider;
import io.opentelemetry.context.propagation.ContextPropagators;

/**
 * The {@link OpenTelemetry} installed into {@code GlobalOpenTelemetry}.
 * <p>
 * {@code GlobalOpenTelemetry} accepts a single registration per process, while
 * {@link TracingManager} may be initialized again; this view resolves the
 * current manager on every call so the latest initialization is what global
 * callers see. With no live manager it behaves as a no-op.
 */
final class ManagedOpenTelemetry implements OpenTelemetry {

    @Override
    public TracerProvider getTracerProvider() {
        TracingManager manager = TracingManager.currentOrNull();
        return manager == null ? TracerProvider.noop() : manager.getTracerProvider();
    }

    @Override
    public ContextPropagators getPropagators() {
        TracingManager manager = TracingManager.currentOrNull();
        return manager == null ? ContextPropagators.noop() : manager.getOpenTelemetry().getPropagators();
    }
}
