package pe.soapros.httptrace.examples;

import pe.soapros.httptrace.core.infrastructure.TracingConfig;
import pe.soapros.httptrace.core.infrastructure.TracingGuard;
import pe.soapros.httptrace.core.infrastructure.TracingManager;

import java.net.InetSocketAddress;
import java.util.concurrent.CountDownLatch;

/**
 * Runs {@link HelloService} on port 3000, exporting spans over OTLP as
 * configured by the standard {@code OTEL_EXPORTER_OTLP_*} variables.
 */
public class HelloServiceExample {

    public static void main(String[] args) throws Exception {
        try (TracingGuard guard = TracingManager.initialize(config())) {
            HelloService service = new HelloService(guard.getManager(), new InetSocketAddress(3000));
            CountDownLatch stopped = new CountDownLatch(1);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                service.stop();
                guard.close();
                stopped.countDown();
            }, "hello-service-stop"));

            service.start();
            stopped.await();
        }
    }

    // The stop hook closes the guard itself, once the server has stopped
    static TracingConfig config() {
        return TracingConfig.builder("hello-service")
                .serviceVersion("0.1.0")
                .registerShutdownHook(false)
                .build();
    }
}
