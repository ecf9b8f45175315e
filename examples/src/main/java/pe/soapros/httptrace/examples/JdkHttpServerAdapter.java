package pe.soapros.httptrace.examples;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pe.soapros.httptrace.core.domain.HeaderCarrier;
import pe.soapros.httptrace.traces.domain.HttpServerHandler;
import pe.soapros.httptrace.traces.domain.HttpServerRequest;
import pe.soapros.httptrace.traces.domain.HttpServerResponse;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Bridges the JDK built-in HTTP server to an {@link HttpServerHandler} pipeline.
 * The route is resolved here, before the pipeline runs, so the tracing layer
 * sees the matched template.
 */
public class JdkHttpServerAdapter implements HttpHandler {

    private static final Logger logger = LoggerFactory.getLogger(JdkHttpServerAdapter.class);

    private final RouteTable routes;
    private final HttpServerHandler pipeline;

    public JdkHttpServerAdapter(RouteTable routes, HttpServerHandler pipeline) {
        this.routes = routes;
        this.pipeline = pipeline;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String path = exchange.getRequestURI().getPath();

        HttpServerRequest request = HttpServerRequest.builder(method, path)
                .matchedRoute(routes.match(method, path).map(RouteTable.Match::getTemplate).orElse(null))
                .protocolVersion(protocolVersion(exchange.getProtocol()))
                .headers(HeaderCarrier.ofMulti(exchange.getRequestHeaders()))
                .build();

        HttpServerResponse response;
        try {
            response = pipeline.handle(request);
        } catch (Exception e) {
            logger.error("Unhandled error serving {}", request, e);
            response = HttpServerResponse.of(500, "Internal Server Error");
        }

        write(exchange, response);
    }

    private static void write(HttpExchange exchange, HttpServerResponse response) throws IOException {
        byte[] body = response.getBody() == null ? new byte[0] : response.getBody().getBytes(StandardCharsets.UTF_8);
        response.getHeaders().asMap().forEach((name, value) -> exchange.getResponseHeaders().set(name, value));
        exchange.sendResponseHeaders(response.getStatusCode(), body.length == 0 ? -1 : body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    // "HTTP/1.1" -> "1.1"
    static String protocolVersion(String protocol) {
        if (protocol == null) {
            return "1.1";
        }
        int slash = protocol.indexOf('/');
        return slash >= 0 ? protocol.substring(slash + 1) : protocol;
    }
}
