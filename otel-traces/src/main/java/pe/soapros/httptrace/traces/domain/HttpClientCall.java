package pe.soapros.httptrace.traces.domain;

@FunctionalInterface
public interface HttpClientCall<R> {
    R send(HttpClientRequest request) throws Exception;
}
