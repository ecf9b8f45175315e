package pe.soapros.httptrace.examples;

import org.junit.jupiter.api.Test;
import pe.soapros.httptrace.core.infrastructure.TracingConfig;

import static org.junit.jupiter.api.Assertions.*;

class HelloServiceExampleTest {

    @Test
    void leavesShutdownToTheServiceStopHook() {
        TracingConfig config = HelloServiceExample.config();

        assertEquals("hello-service", config.getServiceName());
        assertEquals("0.1.0", config.getServiceVersion());
        assertFalse(config.isRegisterShutdownHook());
    }
}
