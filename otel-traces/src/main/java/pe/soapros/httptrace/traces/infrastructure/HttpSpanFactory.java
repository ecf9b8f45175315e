package pe.soapros.httptrace.traces.infrastructure;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import pe.soapros.httptrace.core.domain.TraceContext;
import pe.soapros.httptrace.core.domain.TracePropagator;
import pe.soapros.httptrace.core.infrastructure.TracingManager;
import pe.soapros.httptrace.traces.domain.HttpClientRequest;
import pe.soapros.httptrace.traces.domain.HttpServerRequest;

import java.util.Objects;
import java.util.Optional;

import static pe.soapros.httptrace.core.infrastructure.TracingAttributes.HTTP_REQUEST_METHOD;
import static pe.soapros.httptrace.core.infrastructure.TracingAttributes.HTTP_ROUTE;
import static pe.soapros.httptrace.core.infrastructure.TracingAttributes.NETWORK_PROTOCOL_VERSION;
import static pe.soapros.httptrace.core.infrastructure.TracingAttributes.URL_FULL;
import static pe.soapros.httptrace.core.infrastructure.TracingAttributes.USER_AGENT_ORIGINAL;

/**
 * Crea el span de una petición HTTP. El span se devuelve iniciado pero no
 * activo; activarlo le toca al llamador.
 * <p>
 * El nombre de los spans de servidor usa la plantilla de la ruta, o
 * {@value #UNKNOWN_ROUTE} si ninguna ruta coincidió, para acotar la
 * cardinalidad de nombres. Los atributos {@code http.route} y {@code url.full}
 * guardan el path crudo de la petición.
 */
public class HttpSpanFactory {

    public static final String INSTRUMENTATION_NAME = "pe.soapros.httptrace.http";
    public static final String UNKNOWN_ROUTE = "{unknown}";

    private final Tracer tracer;
    private final TracePropagator propagator;

    public HttpSpanFactory(Tracer tracer, TracePropagator propagator) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.propagator = Objects.requireNonNull(propagator, "propagator");
    }

    public static HttpSpanFactory fromManager(TracingManager manager) {
        return new HttpSpanFactory(manager.tracer(INSTRUMENTATION_NAME), manager.propagator());
    }

    /**
     * Span para una petición entrante. Con un {@code traceparent} válido el span
     * es hijo del llamador remoto; si no, empieza un trace nuevo, sin importar
     * qué span esté activo en este hilo.
     */
    public Span makeServerSpan(HttpServerRequest request) {
        SpanBuilder builder = tracer.spanBuilder(serverSpanName(request))
                .setSpanKind(SpanKind.SERVER)
                .setAttribute(HTTP_REQUEST_METHOD, request.getMethod())
                .setAttribute(HTTP_ROUTE, request.getPath())
                .setAttribute(URL_FULL, request.getPath())
                .setAttribute(NETWORK_PROTOCOL_VERSION, request.getProtocolVersion())
                .setAttribute(USER_AGENT_ORIGINAL, request.getUserAgent().orElse(""));

        Optional<TraceContext> remoteParent = propagator.extract(request.getHeaders());
        if (remoteParent.isPresent()) {
            builder.setParent(remoteParent.get().asParentContext());
        } else {
            builder.setNoParent();
        }

        return builder.startSpan();
    }

    /**
     * Span para una petición saliente, hijo del contexto actual.
     */
    public Span makeClientSpan(HttpClientRequest request) {
        return tracer.spanBuilder(request.getMethod())
                .setSpanKind(SpanKind.CLIENT)
                .setParent(Context.current())
                .setAttribute(HTTP_REQUEST_METHOD, request.getMethod())
                .setAttribute(URL_FULL, request.getUrl().toString())
                .setAttribute(NETWORK_PROTOCOL_VERSION, request.getProtocolVersion())
                .startSpan();
    }

    static String serverSpanName(HttpServerRequest request) {
        return request.getMethod() + " " + request.getMatchedRoute().orElse(UNKNOWN_ROUTE);
    }
}
