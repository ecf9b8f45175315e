package pe.soapros.httptrace.core.infrastructure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scoped handle on an initialized {@link TracingManager}. Closing it flushes
 * every span ended so far to the sink and shuts the provider down; use it in a
 * try-with-resources block around the life of the process.
 */
public final class TracingGuard implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TracingGuard.class);

    private final TracingManager manager;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Thread shutdownHook;

    TracingGuard(TracingManager manager) {
        this.manager = manager;
    }

    /**
     * Closes the guard from a JVM shutdown hook when the process exits without
     * reaching {@link #close()}.
     */
    void registerShutdownHook() {
        Thread hook = new Thread(this::close, "tracing-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        this.shutdownHook = hook;
    }

    public TracingManager getManager() {
        return manager;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        removeShutdownHook();
        manager.shutdown();
    }

    private void removeShutdownHook() {
        Thread hook = shutdownHook;
        if (hook == null || Thread.currentThread() == hook) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            logger.debug("JVM already shutting down, leaving tracing shutdown hook in place");
        }
    }
}
