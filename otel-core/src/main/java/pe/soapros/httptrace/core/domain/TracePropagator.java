package pe.soapros.httptrace.core.domain;

import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapPropagator;

import java.util.Collection;
import java.util.Optional;

public interface TracePropagator {

    /**
     * Reads the trace position carried by the headers. A missing or malformed
     * header is not an error, it yields an empty result.
     */
    Optional<TraceContext> extract(HeaderCarrier carrier);

    void inject(TraceContext context, HeaderCarrier carrier);

    void inject(Context context, HeaderCarrier carrier);

    Collection<String> fields();

    TextMapPropagator textMapPropagator();
}
