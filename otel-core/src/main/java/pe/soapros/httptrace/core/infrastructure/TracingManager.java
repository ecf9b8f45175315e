package pe.soapros.httptrace.core.infrastructure;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pe.soapros.httptrace.core.domain.TracePropagator;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide owner of the tracer provider, its batching exporter and the
 * global propagator.
 * <p>
 * {@link #initialize(TracingConfig)} installs a new manager as the current one
 * and hands back a {@link TracingGuard}; closing the guard flushes and shuts the
 * provider down. Initializing twice replaces the registration: the last call
 * wins and the earlier provider is left to its own guard. That case is logged,
 * not prevented.
 * <p>
 * Spans are queued without blocking. When the queue is full new spans are
 * dropped rather than stalling the request path.
 */
public final class TracingManager {

    private static final Logger logger = LoggerFactory.getLogger(TracingManager.class);

    private static final Object lock = new Object();
    private static final AtomicBoolean globalRegistered = new AtomicBoolean(false);
    private static final OpenTelemetry GLOBAL_VIEW = new ManagedOpenTelemetry();

    private static volatile TracingManager instance;

    private final TracingConfig config;
    private final Resource resource;
    private final FailureReportingSpanExporter spanExporter;
    private final SdkTracerProvider tracerProvider;
    private final OpenTelemetrySdk openTelemetry;
    private final TracePropagator propagator;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private TracingManager(TracingConfig config) {
        this.config = config;
        this.propagator = W3CTracePropagator.getInstance();
        this.resource = config.createResource();

        SpanExporter sink = null;
        try {
            sink = config.createSpanExporter();
            this.spanExporter = new FailureReportingSpanExporter(sink);
            this.tracerProvider = SdkTracerProvider.builder()
                    .setResource(resource)
                    .setSampler(Sampler.alwaysOn())
                    .addSpanProcessor(BatchSpanProcessor.builder(spanExporter)
                            .setScheduleDelay(config.getScheduleDelay())
                            .setMaxQueueSize(config.getMaxQueueSize())
                            .setMaxExportBatchSize(config.getMaxExportBatchSize())
                            .setExporterTimeout(config.getExportTimeout())
                            .build())
                    .build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            if (sink != null) {
                sink.shutdown();
            }
            throw new TracingInitializationException(String.format(
                    "Could not build the span export pipeline for service %s (protocol=%s, endpoint=%s)",
                    config.getServiceName(), config.getProtocol(), config.getEndpoint()), e);
        }

        this.openTelemetry = OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .setPropagators(ContextPropagators.create(propagator.textMapPropagator()))
                .build();
    }

    /**
     * Builds the export pipeline and registers it as the process-wide default.
     *
     * @return guard whose {@code close()} flushes pending spans and shuts the provider down
     * @throws TracingInitializationException if the pipeline cannot be built
     */
    public static TracingGuard initialize(TracingConfig config) {
        Objects.requireNonNull(config, "config");
        if (config.getServiceName() == null || config.getServiceName().isBlank()) {
            throw new TracingInitializationException("Service name is required");
        }

        TracingManager manager = new TracingManager(config);

        TracingManager previous;
        synchronized (lock) {
            previous = instance;
            instance = manager;
        }
        if (previous != null && !previous.isShutdown()) {
            logger.warn("Tracing re-initialized for service {}; provider of service {} is no longer registered",
                    config.getServiceName(), previous.config.getServiceName());
        }

        registerGlobal();

        logger.info("Tracing initialized: service={} version={} environment={} protocol={} endpoint={}",
                config.getServiceName(),
                config.getServiceVersion(),
                config.getEnvironment(),
                config.getProtocol(),
                config.getSpanExporter() != null ? config.getSpanExporter() : config.getEndpoint());

        TracingGuard guard = new TracingGuard(manager);
        if (config.isRegisterShutdownHook()) {
            guard.registerShutdownHook();
        }
        return guard;
    }

    public static TracingManager current() {
        TracingManager manager = instance;
        if (manager == null) {
            throw new IllegalStateException("TracingManager not initialized. Call initialize() first.");
        }
        return manager;
    }

    static TracingManager currentOrNull() {
        return instance;
    }

    public static boolean isInitialized() {
        TracingManager manager = instance;
        return manager != null && !manager.isShutdown();
    }

    /**
     * Shuts down and forgets the current manager.
     */
    public static void reset() {
        TracingManager manager;
        synchronized (lock) {
            manager = instance;
            instance = null;
        }
        if (manager != null) {
            manager.shutdown();
        }
    }

    private static void registerGlobal() {
        if (!globalRegistered.compareAndSet(false, true)) {
            return;
        }
        try {
            GlobalOpenTelemetry.set(GLOBAL_VIEW);
        } catch (IllegalStateException e) {
            logger.warn("GlobalOpenTelemetry was already set elsewhere; global lookups will not see this tracer provider", e);
        }
    }

    public Tracer tracer(String instrumentationName) {
        return tracerProvider.get(instrumentationName);
    }

    public TracePropagator propagator() {
        return propagator;
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public SdkTracerProvider getTracerProvider() {
        return tracerProvider;
    }

    public TracingConfig getConfig() {
        return config;
    }

    public Resource getResource() {
        return resource;
    }

    public long getDroppedSpans() {
        return spanExporter.getDroppedSpans();
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Drains the batching processor and shuts the provider down. Both steps
     * share one deadline of the configured shutdown timeout; whatever has not
     * finished by then is logged and abandoned.
     *
     * @return true if everything queued reached the sink
     */
    boolean shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return true;
        }

        long timeoutMillis = config.getShutdownTimeout().toMillis();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);

        CompletableResultCode flush = tracerProvider.forceFlush().join(remainingMillis(deadline), TimeUnit.MILLISECONDS);
        if (!flush.isDone()) {
            logger.warn("Span flush did not finish within {} ms; pending spans may be lost", timeoutMillis);
        } else if (!flush.isSuccess()) {
            logger.warn("Span flush failed; pending spans may be lost");
        }

        CompletableResultCode stop = tracerProvider.shutdown().join(remainingMillis(deadline), TimeUnit.MILLISECONDS);
        if (!stop.isDone()) {
            logger.warn("Tracer provider shutdown did not finish within {} ms", timeoutMillis);
        }

        synchronized (lock) {
            if (instance == this) {
                instance = null;
            }
        }

        logger.info("Tracing shut down for service {}", config.getServiceName());
        return flush.isSuccess() && stop.isSuccess();
    }

    private static long remainingMillis(long deadline) {
        return Math.max(0, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));
    }

    public String getHealthStatus() {
        if (isShutdown()) {
            return "UNHEALTHY: Tracing shut down";
        }

        return String.format("HEALTHY: Service=%s, Version=%s, Environment=%s, Endpoint=%s, DroppedSpans=%d",
                config.getServiceName(),
                config.getServiceVersion(),
                config.getEnvironment(),
                config.getEndpoint(),
                getDroppedSpans());
    }
}
