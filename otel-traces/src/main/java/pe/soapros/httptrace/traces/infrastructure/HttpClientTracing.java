package pe.soapros.httptrace.traces.infrastructure;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import pe.soapros.httptrace.core.domain.TracePropagator;
import pe.soapros.httptrace.core.infrastructure.TracingManager;
import pe.soapros.httptrace.traces.domain.HttpClientCall;
import pe.soapros.httptrace.traces.domain.HttpClientRequest;

import java.util.Objects;
import java.util.function.ToIntFunction;

/**
 * Lado cliente de la propagación: abre un span de cliente bajo el contexto
 * actual, escribe su contexto en los headers salientes, hace la llamada y
 * clasifica el resultado igual que las peticiones entrantes.
 */
public class HttpClientTracing {

    private final HttpSpanFactory spanFactory;
    private final TracePropagator propagator;
    private final ResponseClassifier classifier;

    public HttpClientTracing(HttpSpanFactory spanFactory, TracePropagator propagator, ResponseClassifier classifier) {
        this.spanFactory = Objects.requireNonNull(spanFactory, "spanFactory");
        this.propagator = Objects.requireNonNull(propagator, "propagator");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public static HttpClientTracing fromManager(TracingManager manager) {
        return new HttpClientTracing(HttpSpanFactory.fromManager(manager), manager.propagator(), new ResponseClassifier());
    }

    /**
     * @param request  petición saliente; los headers de trace se agregan a su carrier
     * @param call     ejecuta la petición
     * @param statusOf lee el código HTTP del resultado de la llamada
     */
    public <R> R execute(HttpClientRequest request, HttpClientCall<R> call, ToIntFunction<R> statusOf) throws Exception {
        Span span = spanFactory.makeClientSpan(request);

        try (Scope scope = span.makeCurrent()) {
            propagator.inject(Context.current(), request.getHeaders());

            R response;
            try {
                response = call.send(request);
            } catch (Throwable failure) {
                classifier.onFailure(span, failure);
                throw failure;
            }

            classifier.onResponse(statusOf.applyAsInt(response), span);
            return response;
        } finally {
            span.end();
        }
    }
}
