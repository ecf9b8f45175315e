package pe.soapros.httptrace.traces.infrastructure;

import pe.soapros.httptrace.core.domain.HeaderCarrier;
import pe.soapros.httptrace.core.infrastructure.TracingManager;
import pe.soapros.httptrace.traces.domain.HttpClientRequest;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;

/**
 * {@link HttpClient} front that traces each call and forwards the trace
 * context in the request headers.
 */
public class TracingHttpClient {

    private final HttpClient client;
    private final HttpClientTracing tracing;

    public TracingHttpClient(HttpClient client, HttpClientTracing tracing) {
        this.client = client;
        this.tracing = tracing;
    }

    public static TracingHttpClient create(HttpClient client) {
        return new TracingHttpClient(client, HttpClientTracing.fromManager(TracingManager.current()));
    }

    public <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> bodyHandler)
            throws IOException, InterruptedException {
        HttpClientRequest traced = HttpClientRequest.builder(request.method(), request.uri())
                .protocolVersion(protocolVersion(request.version().orElse(client.version())))
                .headers(HeaderCarrier.ofMulti(request.headers().map()))
                .build();

        try {
            return tracing.execute(traced,
                    outbound -> client.send(withHeaders(request, outbound.getHeaders()), bodyHandler),
                    HttpResponse::statusCode);
        } catch (IOException | InterruptedException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException(e);
        }
    }

    // Copia la petición, fijando solo los headers que el carrier agregó o cambió
    private static HttpRequest withHeaders(HttpRequest request, HeaderCarrier headers) {
        Map<String, List<String>> existing = request.headers().map();
        HttpRequest.Builder builder = HttpRequest.newBuilder(request, (name, value) -> true);
        headers.asMap().forEach((name, value) -> {
            List<String> current = existing.get(name);
            if (current == null || current.isEmpty() || !current.get(0).equals(value)) {
                builder.setHeader(name, value);
            }
        });
        return builder.build();
    }

    static String protocolVersion(HttpClient.Version version) {
        return version == HttpClient.Version.HTTP_2 ? "2" : "1.1";
    }
}
