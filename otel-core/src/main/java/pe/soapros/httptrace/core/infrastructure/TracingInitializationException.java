package pe.soapros.httptrace.core.infrastructure;

/**
 * Raised by {@link TracingManager#initialize(TracingConfig)} when the tracing
 * pipeline cannot be built. The previous registration, if any, is left in place.
 */
public class TracingInitializationException extends RuntimeException {

    public TracingInitializationException(String message) {
        super(message);
    }

    public TracingInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
