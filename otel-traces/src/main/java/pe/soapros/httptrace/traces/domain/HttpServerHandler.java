package pe.soapros.httptrace.traces.domain;

/**
 * One step of the server's request pipeline. Throwing means no response was
 * produced.
 */
@FunctionalInterface
public interface HttpServerHandler {
    HttpServerResponse handle(HttpServerRequest request) throws Exception;
}
