package pe.soapros.httptrace.examples;

import pe.soapros.httptrace.traces.domain.HttpServerRequest;
import pe.soapros.httptrace.traces.domain.HttpServerResponse;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal router: GET routes with {@code {param}} path segments, first match wins.
 */
public class RouteTable {

    @FunctionalInterface
    public interface RouteHandler {
        HttpServerResponse handle(HttpServerRequest request, Map<String, String> pathParams) throws Exception;
    }

    public static final class Match {
        private final String template;
        private final Map<String, String> pathParams;
        private final RouteHandler handler;

        private Match(String template, Map<String, String> pathParams, RouteHandler handler) {
            this.template = template;
            this.pathParams = pathParams;
            this.handler = handler;
        }

        public String getTemplate() { return template; }
        public Map<String, String> getPathParams() { return pathParams; }
    }

    private static final class Route {
        private final String method;
        private final String template;
        private final String[] segments;
        private final RouteHandler handler;

        private Route(String method, String template, RouteHandler handler) {
            this.method = method;
            this.template = template;
            this.segments = split(template);
            this.handler = handler;
        }
    }

    private final List<Route> routes = new ArrayList<>();

    public RouteTable get(String template, RouteHandler handler) {
        routes.add(new Route("GET", template, handler));
        return this;
    }

    public Optional<Match> match(String method, String path) {
        String[] requested = split(path);
        for (Route route : routes) {
            if (!route.method.equalsIgnoreCase(method) || route.segments.length != requested.length) {
                continue;
            }
            Map<String, String> params = new HashMap<>();
            boolean matched = true;
            for (int i = 0; i < requested.length && matched; i++) {
                String segment = route.segments[i];
                if (segment.startsWith("{") && segment.endsWith("}")) {
                    params.put(segment.substring(1, segment.length() - 1), requested[i]);
                } else {
                    matched = segment.equals(requested[i]);
                }
            }
            if (matched) {
                return Optional.of(new Match(route.template, Map.copyOf(params), route.handler));
            }
        }
        return Optional.empty();
    }

    /**
     * Runs the route the request was matched to, or answers 404.
     */
    public HttpServerResponse dispatch(HttpServerRequest request) throws Exception {
        Optional<Match> match = match(request.getMethod(), request.getPath());
        if (match.isEmpty()) {
            return HttpServerResponse.notFound();
        }
        return match.get().handler.handle(request, match.get().pathParams);
    }

    private static String[] split(String path) {
        String trimmed = path.startsWith("/") ? path.substring(1) : path;
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.isEmpty() ? new String[0] : trimmed.split("/");
    }
}
