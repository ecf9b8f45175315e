package pe.soapros.httptrace.traces.infrastructure;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pe.soapros.httptrace.core.infrastructure.TraceCorrelation;
import pe.soapros.httptrace.core.infrastructure.TracingManager;
import pe.soapros.httptrace.traces.domain.HttpServerHandler;
import pe.soapros.httptrace.traces.domain.HttpServerRequest;
import pe.soapros.httptrace.traces.domain.HttpServerResponse;

import java.util.Objects;

/**
 * Traza cada petición que pasa por el handler envuelto.
 * <p>
 * Mientras corre el handler interno el span de la petición está activo y sus
 * ids están en el MDC. El span se cierra una sola vez, retorne o lance el
 * handler; las excepciones se relanzan sin cambios.
 */
public class HttpTracingMiddleware implements HttpServerHandler {

    private static final Logger logger = LoggerFactory.getLogger(HttpTracingMiddleware.class);

    private final HttpServerHandler next;
    private final HttpSpanFactory spanFactory;
    private final ResponseClassifier classifier;

    public HttpTracingMiddleware(HttpServerHandler next, HttpSpanFactory spanFactory, ResponseClassifier classifier) {
        this.next = Objects.requireNonNull(next, "next");
        this.spanFactory = Objects.requireNonNull(spanFactory, "spanFactory");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    /**
     * Envuelve {@code next} usando el {@link TracingManager} actual.
     */
    public static HttpTracingMiddleware wrap(HttpServerHandler next) {
        return new HttpTracingMiddleware(next, HttpSpanFactory.fromManager(TracingManager.current()), new ResponseClassifier());
    }

    @Override
    public HttpServerResponse handle(HttpServerRequest request) throws Exception {
        Span span = spanFactory.makeServerSpan(request);

        try (Scope scope = span.makeCurrent();
             TraceCorrelation.MdcScope mdc = TraceCorrelation.attach(span)) {

            HttpServerResponse response;
            try {
                response = next.handle(request);
            } catch (Throwable failure) {
                classifier.onFailure(span, failure);
                logger.debug("Request {} failed without a response", request, failure);
                throw failure;
            }

            if (response == null) {
                logger.warn("Handler returned no response for {}", request);
                classifier.onFailure(span);
            } else {
                classifier.onResponse(response.getStatusCode(), span);
            }
            return response;
        } finally {
            span.end();
        }
    }
}
