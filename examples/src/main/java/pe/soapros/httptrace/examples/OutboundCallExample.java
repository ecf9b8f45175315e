package pe.soapros.httptrace.examples;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pe.soapros.httptrace.core.infrastructure.TraceCorrelation;
import pe.soapros.httptrace.core.infrastructure.TracingConfig;
import pe.soapros.httptrace.core.infrastructure.TracingGuard;
import pe.soapros.httptrace.core.infrastructure.TracingManager;
import pe.soapros.httptrace.traces.infrastructure.TracingHttpClient;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Calls a running {@link HelloService} with trace context propagation; the
 * server span it produces joins the trace started here.
 */
public class OutboundCallExample {

    private static final Logger logger = LoggerFactory.getLogger(OutboundCallExample.class);

    public static void main(String[] args) throws Exception {
        String target = args.length > 0 ? args[0] : "http://localhost:3000/world";

        try (TracingGuard guard = TracingManager.initialize(
                TracingConfig.fromEnvironment("hello-client", "0.1.0"))) {

            TracingHttpClient client = TracingHttpClient.create(HttpClient.newBuilder()
                    .connectTimeout(Duration.ofSeconds(2))
                    .build());

            Span span = guard.getManager().tracer(OutboundCallExample.class.getName())
                    .spanBuilder("call hello-service")
                    .startSpan();
            try (Scope scope = span.makeCurrent()) {
                HttpResponse<String> response = client.send(
                        HttpRequest.newBuilder(URI.create(target)).GET().build(),
                        HttpResponse.BodyHandlers.ofString());

                logger.info("{} -> {} {} (trace {})", target, response.statusCode(), response.body(),
                        TraceCorrelation.currentTraceId().orElse("none"));
            } finally {
                span.end();
            }

            logger.info("Health: {}", guard.getManager().getHealthStatus());
        }
    }
}
