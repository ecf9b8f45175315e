package pe.soapros.httptrace.core.infrastructure;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.function.Supplier;

/**
 * Ejecuta bloques de trabajo dentro de sub-spans del span actual, para que el
 * código que corre bajo un request pueda trazar sus pasos sin recibir el span.
 */
public class TracingUtils {
    private final Tracer tracer;

    public TracingUtils(Tracer tracer) {
        this.tracer = tracer;
    }

    /**
     * Ejecuta {@code operation} dentro de un nuevo sub-span interno, activo
     * mientras dura la llamada. Si lanza una excepción se registra y se relanza.
     *
     * @param spanName nombre del sub-span
     * @param operation operación a ejecutar
     * @param <T> tipo de retorno
     * @return resultado de la operación
     */
    public <T> T withSpan(String spanName, Supplier<T> operation) {
        Span span = tracer.spanBuilder(spanName)
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();
        try (Scope scope = span.makeCurrent()) {
            return operation.get();
        } catch (RuntimeException ex) {
            span.recordException(ex);
            span.setStatus(StatusCode.ERROR, ex.getMessage());
            throw ex;
        } finally {
            span.end();
        }
    }

    /**
     * Variante sin retorno de {@link #withSpan(String, Supplier)}.
     */
    public void withSpan(String spanName, Runnable runnable) {
        withSpan(spanName, () -> {
            runnable.run();
            return null;
        });
    }
}
