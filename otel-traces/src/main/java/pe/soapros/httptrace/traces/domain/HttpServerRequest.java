package pe.soapros.httptrace.traces.domain;

import lombok.AccessLevel;
import lombok.Getter;
import pe.soapros.httptrace.core.domain.HeaderCarrier;

import java.util.Objects;
import java.util.Optional;

/**
 * Inbound request as seen by the tracing layer.
 * <p>
 * {@code matchedRoute} is the route template the router selected, such as
 * {@code /{name}}; it is absent when no route matched. {@code path} is the raw
 * request path.
 */
@Getter
public final class HttpServerRequest {

    public static final String USER_AGENT = "User-Agent";

    private final String method;
    @Getter(AccessLevel.NONE)
    private final String matchedRoute;
    private final String path;
    private final String protocolVersion;
    private final HeaderCarrier headers;

    private HttpServerRequest(Builder builder) {
        this.method = Objects.requireNonNull(builder.method, "method");
        this.path = Objects.requireNonNull(builder.path, "path");
        this.matchedRoute = builder.matchedRoute;
        this.protocolVersion = builder.protocolVersion;
        this.headers = builder.headers != null ? builder.headers : HeaderCarrier.empty();
    }

    public Optional<String> getMatchedRoute() {
        return Optional.ofNullable(matchedRoute);
    }

    public Optional<String> getUserAgent() {
        return Optional.ofNullable(headers.get(USER_AGENT));
    }

    public static Builder builder(String method, String path) {
        return new Builder(method, path);
    }

    @Override
    public String toString() {
        return method + " " + path + (matchedRoute != null ? " (" + matchedRoute + ")" : "");
    }

    public static class Builder {
        private final String method;
        private final String path;
        private String matchedRoute;
        private String protocolVersion = "1.1";
        private HeaderCarrier headers;

        private Builder(String method, String path) {
            this.method = method;
            this.path = path;
        }

        public Builder matchedRoute(String matchedRoute) {
            this.matchedRoute = matchedRoute;
            return this;
        }

        public Builder protocolVersion(String protocolVersion) {
            this.protocolVersion = protocolVersion;
            return this;
        }

        public Builder headers(HeaderCarrier headers) {
            this.headers = headers;
            return this;
        }

        public Builder header(String name, String value) {
            if (headers == null) {
                headers = HeaderCarrier.empty();
            }
            headers.set(name, value);
            return this;
        }

        public HttpServerRequest build() {
            return new HttpServerRequest(this);
        }
    }
}
