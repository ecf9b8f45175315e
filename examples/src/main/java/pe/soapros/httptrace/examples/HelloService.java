package pe.soapros.httptrace.examples;

import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pe.soapros.httptrace.core.infrastructure.TracingManager;
import pe.soapros.httptrace.core.infrastructure.TracingUtils;
import pe.soapros.httptrace.traces.infrastructure.HttpSpanFactory;
import pe.soapros.httptrace.traces.infrastructure.HttpTracingMiddleware;
import pe.soapros.httptrace.traces.infrastructure.ResponseClassifier;
import pe.soapros.httptrace.traces.domain.HttpServerResponse;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Greeting service with two routes, {@code /} and {@code /{name}}, served
 * through the tracing middleware.
 */
public class HelloService {

    private static final Logger logger = LoggerFactory.getLogger(HelloService.class);

    private final HttpServer server;
    private final ExecutorService executor;

    public HelloService(TracingManager tracing, InetSocketAddress address) throws IOException {
        TracingUtils tracingUtils = new TracingUtils(tracing.tracer(HelloService.class.getName()));
        RouteTable routes = routes(tracingUtils);

        HttpTracingMiddleware pipeline = new HttpTracingMiddleware(
                routes::dispatch,
                HttpSpanFactory.fromManager(tracing),
                new ResponseClassifier());

        this.executor = Executors.newFixedThreadPool(8);
        this.server = HttpServer.create(address, 0);
        this.server.createContext("/", new JdkHttpServerAdapter(routes, pipeline));
        this.server.setExecutor(executor);
    }

    static RouteTable routes(TracingUtils tracingUtils) {
        return new RouteTable()
                .get("/", (request, params) -> HttpServerResponse.ok("Hello, World!"))
                .get("/{name}", (request, params) -> {
                    String name = params.get("name");
                    logger.info("Greeting {}", name);
                    String greeting = tracingUtils.withSpan("render greeting", () -> "Hello, " + name + "!");
                    return HttpServerResponse.ok(greeting);
                });
    }

    public void start() {
        server.start();
        logger.info("Listening on port {}", getPort());
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    public void stop() {
        server.stop(0);
        executor.shutdownNow();
    }
}
