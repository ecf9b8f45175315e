package pe.soapros.httptrace.examples;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.context.Scope;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.semconv.ServiceAttributes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import pe.soapros.httptrace.core.infrastructure.InMemorySpanExporter;
import pe.soapros.httptrace.core.infrastructure.TracingConfig;
import pe.soapros.httptrace.core.infrastructure.TracingGuard;
import pe.soapros.httptrace.core.infrastructure.TracingManager;
import pe.soapros.httptrace.traces.infrastructure.TracingHttpClient;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static pe.soapros.httptrace.core.infrastructure.TracingAttributes.HTTP_RESPONSE_STATUS_CODE;
import static pe.soapros.httptrace.core.infrastructure.TracingAttributes.HTTP_ROUTE;
import static pe.soapros.httptrace.core.infrastructure.TracingAttributes.OTEL_STATUS_CODE;
import static pe.soapros.httptrace.core.infrastructure.TracingAttributes.URL_FULL;

class HelloServiceIntegrationTest {

    private InMemorySpanExporter spanExporter;
    private TracingGuard guard;
    private HelloService service;
    private TracingHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        TracingManager.reset();
        spanExporter = InMemorySpanExporter.create();
        guard = TracingManager.initialize(TracingConfig.builder("hello-service")
                .serviceVersion("0.1.0")
                .environmentLookup(name -> null)
                .registerShutdownHook(false)
                .spanExporter(spanExporter)
                .build());

        service = new HelloService(guard.getManager(), new InetSocketAddress("127.0.0.1", 0));
        service.start();
        client = TracingHttpClient.create(HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build());
    }

    @AfterEach
    void tearDown() {
        service.stop();
        guard.close();
        TracingManager.reset();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(
                HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + service.getPort() + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private static SpanData find(List<SpanData> spans, SpanKind kind, String name) {
        return spans.stream()
                .filter(s -> s.getKind() == kind && s.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no " + kind + " span named " + name + " in " + spans));
    }

    @Test
    void serverSpanJoinsTheCallersTrace() throws Exception {
        Span caller = guard.getManager().tracer("test").spanBuilder("call hello-service").startSpan();
        HttpResponse<String> response;
        try (Scope scope = caller.makeCurrent()) {
            response = get("/world");
        } finally {
            caller.end();
        }

        assertEquals(200, response.statusCode());
        assertEquals("Hello, world!", response.body());

        guard.close();
        List<SpanData> spans = spanExporter.getFinishedSpanItems();

        SpanData clientSpan = find(spans, SpanKind.CLIENT, "GET");
        SpanData server = find(spans, SpanKind.SERVER, "GET /{name}");
        SpanData render = find(spans, SpanKind.INTERNAL, "render greeting");

        assertEquals(caller.getSpanContext().getTraceId(), server.getTraceId());
        assertEquals(clientSpan.getSpanId(), server.getParentSpanId());
        assertEquals(caller.getSpanContext().getSpanId(), clientSpan.getParentSpanId());
        assertEquals(server.getSpanId(), render.getParentSpanId());

        assertEquals("/world", server.getAttributes().get(HTTP_ROUTE));
        assertEquals("/world", server.getAttributes().get(URL_FULL));
        assertEquals(200L, server.getAttributes().get(HTTP_RESPONSE_STATUS_CODE));
        assertEquals("ok", server.getAttributes().get(OTEL_STATUS_CODE));
        assertEquals("hello-service", server.getResource().getAttribute(ServiceAttributes.SERVICE_NAME));
    }

    @Test
    void requestWithoutTraceContextStartsANewTrace() throws Exception {
        HttpResponse<String> response = HttpClient.newHttpClient().send(
                HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + service.getPort() + "/")).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertEquals("Hello, World!", response.body());

        guard.close();
        SpanData server = find(spanExporter.getFinishedSpanItems(), SpanKind.SERVER, "GET /");
        assertFalse(server.getParentSpanContext().isValid());
        assertEquals("/", server.getAttributes().get(HTTP_ROUTE));
    }

    @Test
    void unknownRouteIsNamedWithTheSentinelAndMarkedAsError() throws Exception {
        HttpResponse<String> response = get("/a/b/c");

        assertEquals(404, response.statusCode());

        guard.close();
        SpanData server = find(spanExporter.getFinishedSpanItems(), SpanKind.SERVER, "GET {unknown}");
        assertEquals("/a/b/c", server.getAttributes().get(HTTP_ROUTE));
        assertEquals(404L, server.getAttributes().get(HTTP_RESPONSE_STATUS_CODE));
        assertEquals("error", server.getAttributes().get(OTEL_STATUS_CODE));
    }
}
