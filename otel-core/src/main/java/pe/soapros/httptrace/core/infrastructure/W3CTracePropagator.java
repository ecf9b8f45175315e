package pe.soapros.httptrace.core.infrastructure;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapPropagator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pe.soapros.httptrace.core.domain.HeaderCarrier;
import pe.soapros.httptrace.core.domain.TraceContext;
import pe.soapros.httptrace.core.domain.TracePropagator;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Propagación W3C Trace Context sobre {@link HeaderCarrier}.
 * <p>
 * El parseo de {@code traceparent} lo hace el {@link W3CTraceContextPropagator}
 * de OpenTelemetry; {@code tracestate} se copia tal cual.
 */
public class W3CTracePropagator implements TracePropagator {

    public static final String TRACEPARENT = "traceparent";
    public static final String TRACESTATE = "tracestate";

    private static final Logger logger = LoggerFactory.getLogger(W3CTracePropagator.class);

    private static final W3CTracePropagator INSTANCE = new W3CTracePropagator();

    private final W3CTraceContextPropagator delegate = W3CTraceContextPropagator.getInstance();

    public static W3CTracePropagator getInstance() {
        return INSTANCE;
    }

    /**
     * Extrae el contexto del padre desde los headers de la petición. Un header
     * ausente o mal formado no es un error: se devuelve vacío y el llamador
     * empieza un trace nuevo.
     */
    @Override
    public Optional<TraceContext> extract(HeaderCarrier carrier) {
        if (carrier == null || carrier.isEmpty()) {
            return Optional.empty();
        }

        String traceparent = carrier.get(TRACEPARENT);
        if (traceparent == null) {
            return Optional.empty();
        }

        SpanContext spanContext = Span.fromContext(
                delegate.extract(Context.root(), carrier, HeaderCarrier.GETTER)).getSpanContext();
        if (!spanContext.isValid()) {
            logger.debug("Ignoring malformed traceparent header: {}", traceparent);
            return Optional.empty();
        }

        return Optional.of(TraceContext.fromSpanContext(spanContext, carrier.get(TRACESTATE)));
    }

    @Override
    public void inject(TraceContext context, HeaderCarrier carrier) {
        if (context == null || carrier == null) {
            return;
        }

        delegate.inject(context.asParentContext(), carrier, HeaderCarrier.SETTER);
        if (!context.traceState().isEmpty()) {
            carrier.set(TRACESTATE, context.traceState());
        }
    }

    @Override
    public void inject(Context context, HeaderCarrier carrier) {
        if (context == null || carrier == null) {
            return;
        }
        delegate.inject(context, carrier, HeaderCarrier.SETTER);
    }

    @Override
    public Collection<String> fields() {
        return List.of(TRACEPARENT, TRACESTATE);
    }

    @Override
    public TextMapPropagator textMapPropagator() {
        return delegate;
    }
}
