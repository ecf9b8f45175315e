package pe.soapros.httptrace.traces.infrastructure;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;

import static pe.soapros.httptrace.core.infrastructure.TracingAttributes.HTTP_RESPONSE_STATUS_CODE;
import static pe.soapros.httptrace.core.infrastructure.TracingAttributes.OTEL_STATUS_CODE;

/**
 * Registra el resultado de una petición en su span, todavía abierto.
 * <p>
 * Todo código menor a 300 es "ok" y el resto es "error", redirecciones
 * incluidas.
 */
public class ResponseClassifier {

    public static final String OK = "ok";
    public static final String ERROR = "error";

    public static String classify(int statusCode) {
        return statusCode < 300 ? OK : ERROR;
    }

    public void onResponse(int statusCode, Span span) {
        String classification = classify(statusCode);
        span.setAttribute(HTTP_RESPONSE_STATUS_CODE, (long) statusCode);
        span.setAttribute(OTEL_STATUS_CODE, classification);
        if (OK.equals(classification)) {
            span.setStatus(StatusCode.OK);
        } else {
            span.setStatus(StatusCode.ERROR, "HTTP " + statusCode);
        }
    }

    /**
     * No hubo respuesta: el código de estado queda sin registrar.
     */
    public void onFailure(Span span) {
        span.setAttribute(OTEL_STATUS_CODE, ERROR);
        span.setStatus(StatusCode.ERROR);
    }

    public void onFailure(Span span, Throwable failure) {
        span.recordException(failure);
        span.setAttribute(OTEL_STATUS_CODE, ERROR);
        span.setStatus(StatusCode.ERROR, failure.getClass().getSimpleName());
    }
}
