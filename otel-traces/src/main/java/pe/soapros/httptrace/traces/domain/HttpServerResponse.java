package pe.soapros.httptrace.traces.domain;

import lombok.Getter;
import pe.soapros.httptrace.core.domain.HeaderCarrier;

@Getter
public final class HttpServerResponse {

    private final int statusCode;
    private final HeaderCarrier headers;
    private final String body;

    private HttpServerResponse(int statusCode, HeaderCarrier headers, String body) {
        this.statusCode = statusCode;
        this.headers = headers;
        this.body = body;
    }

    public static HttpServerResponse of(int statusCode, String body) {
        return new HttpServerResponse(statusCode, HeaderCarrier.empty(), body);
    }

    public static HttpServerResponse of(int statusCode) {
        return of(statusCode, "");
    }

    public static HttpServerResponse ok(String body) {
        HttpServerResponse response = of(200, body);
        response.headers.set("Content-Type", "text/plain; charset=utf-8");
        return response;
    }

    public static HttpServerResponse notFound() {
        return of(404, "Not Found");
    }

    public HttpServerResponse withHeader(String name, String value) {
        headers.set(name, value);
        return this;
    }
}
