package pe.soapros.httptrace.core.infrastructure;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.semconv.ServiceAttributes;
import lombok.Getter;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Settings for the span export pipeline and the identity of this process.
 * <p>
 * Values not set on the builder fall back to the standard OpenTelemetry
 * environment variables, then to the defaults of the selected {@link Environment}.
 * An environment variable that cannot be parsed makes {@link Builder#build()}
 * throw {@link TracingInitializationException}.
 */
@Getter
public class TracingConfig {

    public static final String SCHEMA_URL = "https://opentelemetry.io/schemas/1.28.0";

    public enum Environment {
        DEVELOPMENT(Duration.ofSeconds(3), 100, Duration.ofSeconds(1)),
        STAGING(Duration.ofSeconds(10), 512, Duration.ofSeconds(5)),
        PRODUCTION(Duration.ofSeconds(30), 512, Duration.ofSeconds(5));

        private final Duration exportTimeout;
        private final int maxBatchSize;
        private final Duration scheduleDelay;

        Environment(Duration exportTimeout, int maxBatchSize, Duration scheduleDelay) {
            this.exportTimeout = exportTimeout;
            this.maxBatchSize = maxBatchSize;
            this.scheduleDelay = scheduleDelay;
        }

        public Duration getExportTimeout() { return exportTimeout; }
        public int getMaxBatchSize() { return maxBatchSize; }
        public Duration getScheduleDelay() { return scheduleDelay; }
    }

    public enum Protocol {
        HTTP_PROTOBUF("http/protobuf", "http://localhost:4318/v1/traces"),
        GRPC("grpc", "http://localhost:4317");

        private final String wireName;
        private final String defaultEndpoint;

        Protocol(String wireName, String defaultEndpoint) {
            this.wireName = wireName;
            this.defaultEndpoint = defaultEndpoint;
        }

        public String getWireName() { return wireName; }
        public String getDefaultEndpoint() { return defaultEndpoint; }

        public static Protocol fromWireName(String value) {
            for (Protocol protocol : values()) {
                if (protocol.wireName.equalsIgnoreCase(value.trim())) {
                    return protocol;
                }
            }
            throw new IllegalArgumentException("Unsupported OTLP protocol: " + value);
        }
    }

    private final String serviceName;
    private final String serviceVersion;
    private final Environment environment;
    private final Protocol protocol;
    private final String endpoint;
    private final Duration exportTimeout;
    private final Duration scheduleDelay;
    private final int maxExportBatchSize;
    private final int maxQueueSize;
    private final Duration shutdownTimeout;
    private final boolean registerShutdownHook;
    private final Map<String, String> resourceAttributes;
    private final SpanExporter spanExporter;

    private TracingConfig(Builder builder) {
        Function<String, String> env = builder.environmentLookup;

        this.serviceName = builder.serviceName;
        this.serviceVersion = builder.serviceVersion;
        this.environment = builder.environment != null ? builder.environment : detectEnvironment(env);
        this.protocol = builder.protocol != null ? builder.protocol : resolveProtocol(env);
        this.endpoint = resolveEndpoint(builder.endpoint, env);
        this.exportTimeout = firstNonNull(builder.exportTimeout,
                millis(env, "OTEL_EXPORTER_OTLP_TIMEOUT"), environment.getExportTimeout());
        this.scheduleDelay = firstNonNull(builder.scheduleDelay,
                millis(env, "OTEL_BSP_SCHEDULE_DELAY"), environment.getScheduleDelay());
        this.maxExportBatchSize = firstNonNull(builder.maxExportBatchSize,
                integer(env, "OTEL_BSP_MAX_EXPORT_BATCH_SIZE"), environment.getMaxBatchSize());
        this.maxQueueSize = firstNonNull(builder.maxQueueSize,
                integer(env, "OTEL_BSP_MAX_QUEUE_SIZE"), 2048);
        this.shutdownTimeout = builder.shutdownTimeout;
        this.registerShutdownHook = builder.registerShutdownHook;
        this.resourceAttributes = Map.copyOf(builder.resourceAttributes);
        this.spanExporter = builder.spanExporter;
    }

    /**
     * Identity of this process, attached to every span it produces.
     */
    public Resource createResource() {
        var resourceBuilder = Resource.getDefault()
                .toBuilder()
                .put(ServiceAttributes.SERVICE_NAME, serviceName)
                .put(ServiceAttributes.SERVICE_VERSION, serviceVersion)
                .put(TracingAttributes.DEPLOYMENT_ENVIRONMENT, environment.name().toLowerCase(Locale.ROOT))
                .setSchemaUrl(SCHEMA_URL);

        resourceAttributes.forEach((key, value) ->
                resourceBuilder.put(AttributeKey.stringKey(key), value));

        return resourceBuilder.build();
    }

    /**
     * Builds the sink spans are shipped to. A custom exporter set on the builder
     * wins over the OTLP transports.
     *
     * @throws IllegalArgumentException if the endpoint or timeout is not usable
     */
    public SpanExporter createSpanExporter() {
        if (spanExporter != null) {
            return spanExporter;
        }

        switch (protocol) {
            case GRPC:
                return OtlpGrpcSpanExporter.builder()
                        .setEndpoint(endpoint)
                        .setTimeout(exportTimeout)
                        .build();
            case HTTP_PROTOBUF:
            default:
                return OtlpHttpSpanExporter.builder()
                        .setEndpoint(endpoint)
                        .setTimeout(exportTimeout)
                        .build();
        }
    }

    private String resolveEndpoint(String customEndpoint, Function<String, String> env) {
        if (customEndpoint != null && !customEndpoint.isEmpty()) {
            return customEndpoint;
        }

        String tracesEndpoint = env.apply("OTEL_EXPORTER_OTLP_TRACES_ENDPOINT");
        if (tracesEndpoint != null && !tracesEndpoint.isEmpty()) {
            return tracesEndpoint;
        }

        String envEndpoint = env.apply("OTEL_EXPORTER_OTLP_ENDPOINT");
        if (envEndpoint != null && !envEndpoint.isEmpty()) {
            // The generic endpoint is a base URL; the HTTP transport needs the signal path
            if (protocol == Protocol.HTTP_PROTOBUF) {
                return envEndpoint.endsWith("/") ? envEndpoint + "v1/traces" : envEndpoint + "/v1/traces";
            }
            return envEndpoint;
        }

        return protocol.getDefaultEndpoint();
    }

    private static Protocol resolveProtocol(Function<String, String> env) {
        String value = env.apply("OTEL_EXPORTER_OTLP_TRACES_PROTOCOL");
        if (value == null || value.isEmpty()) {
            value = env.apply("OTEL_EXPORTER_OTLP_PROTOCOL");
        }
        if (value == null || value.isEmpty()) {
            return Protocol.HTTP_PROTOBUF;
        }
        try {
            return Protocol.fromWireName(value);
        } catch (IllegalArgumentException e) {
            throw new TracingInitializationException(e.getMessage(), e);
        }
    }

    private static Environment detectEnvironment(Function<String, String> env) {
        String name = env.apply("ENVIRONMENT");
        if (name == null) {
            name = System.getProperty("environment", "development");
        }

        try {
            return Environment.valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Environment.DEVELOPMENT;
        }
    }

    private static Duration millis(Function<String, String> env, String name) {
        Integer value = integer(env, name);
        return value == null ? null : Duration.ofMillis(value);
    }

    private static Integer integer(Function<String, String> env, String name) {
        String value = env.apply(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new TracingInitializationException("Invalid value for " + name + ": " + value, e);
        }
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public static Builder builder(String serviceName) {
        return new Builder(serviceName);
    }

    /**
     * Configuration for a service, with everything not given read from the
     * process environment.
     */
    public static TracingConfig fromEnvironment(String serviceName, String serviceVersion) {
        return builder(serviceName)
                .serviceVersion(serviceVersion)
                .build();
    }

    public static class Builder {
        private final String serviceName;
        private String serviceVersion = "1.0.0";
        private Environment environment;
        private Protocol protocol;
        private String endpoint;
        private Duration exportTimeout;
        private Duration scheduleDelay;
        private Integer maxExportBatchSize;
        private Integer maxQueueSize;
        private Duration shutdownTimeout = Duration.ofSeconds(5);
        private boolean registerShutdownHook = true;
        private Map<String, String> resourceAttributes = Map.of();
        private SpanExporter spanExporter;
        private Function<String, String> environmentLookup = System::getenv;

        private Builder(String serviceName) {
            this.serviceName = serviceName;
        }

        public Builder serviceVersion(String serviceVersion) {
            this.serviceVersion = serviceVersion;
            return this;
        }

        public Builder environment(Environment environment) {
            this.environment = environment;
            return this;
        }

        public Builder environment(String environmentName) {
            this.environment = Environment.valueOf(environmentName.toUpperCase(Locale.ROOT));
            return this;
        }

        public Builder protocol(Protocol protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder exportTimeout(Duration exportTimeout) {
            this.exportTimeout = exportTimeout;
            return this;
        }

        public Builder scheduleDelay(Duration scheduleDelay) {
            this.scheduleDelay = scheduleDelay;
            return this;
        }

        public Builder maxExportBatchSize(int maxExportBatchSize) {
            this.maxExportBatchSize = maxExportBatchSize;
            return this;
        }

        public Builder maxQueueSize(int maxQueueSize) {
            this.maxQueueSize = maxQueueSize;
            return this;
        }

        /**
         * Upper bound on {@link TracingGuard#close()}, covering the final flush
         * and the provider shutdown together.
         */
        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
            return this;
        }

        public Builder registerShutdownHook(boolean registerShutdownHook) {
            this.registerShutdownHook = registerShutdownHook;
            return this;
        }

        public Builder resourceAttributes(Map<String, String> resourceAttributes) {
            this.resourceAttributes = resourceAttributes;
            return this;
        }

        /**
         * Ships spans to the given exporter instead of an OTLP endpoint.
         */
        public Builder spanExporter(SpanExporter spanExporter) {
            this.spanExporter = spanExporter;
            return this;
        }

        public Builder environmentLookup(Function<String, String> environmentLookup) {
            this.environmentLookup = Objects.requireNonNull(environmentLookup, "environmentLookup");
            return this;
        }

        public TracingConfig build() {
            return new TracingConfig(this);
        }
    }
}
