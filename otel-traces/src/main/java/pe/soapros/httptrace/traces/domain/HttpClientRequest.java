package pe.soapros.httptrace.traces.domain;

import lombok.Getter;
import pe.soapros.httptrace.core.domain.HeaderCarrier;

import java.net.URI;
import java.util.Objects;

/**
 * Outbound request. Its headers are writable so trace context can be injected
 * before it is sent.
 */
@Getter
public final class HttpClientRequest {

    private final String method;
    private final URI url;
    private final String protocolVersion;
    private final HeaderCarrier headers;

    private HttpClientRequest(Builder builder) {
        this.method = Objects.requireNonNull(builder.method, "method");
        this.url = Objects.requireNonNull(builder.url, "url");
        this.protocolVersion = builder.protocolVersion;
        this.headers = builder.headers != null ? builder.headers : HeaderCarrier.empty();
    }

    public static Builder builder(String method, URI url) {
        return new Builder(method, url);
    }

    @Override
    public String toString() {
        return method + " " + url;
    }

    public static class Builder {
        private final String method;
        private final URI url;
        private String protocolVersion = "1.1";
        private HeaderCarrier headers;

        private Builder(String method, URI url) {
            this.method = method;
            this.url = url;
        }

        public Builder protocolVersion(String protocolVersion) {
            this.protocolVersion = protocolVersion;
            return this;
        }

        public Builder headers(HeaderCarrier headers) {
            this.headers = headers;
            return this;
        }

        public HttpClientRequest build() {
            return new HttpClientRequest(this);
        }
    }
}
