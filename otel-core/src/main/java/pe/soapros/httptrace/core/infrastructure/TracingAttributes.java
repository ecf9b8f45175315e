package pe.soapros.httptrace.core.infrastructure;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.semconv.HttpAttributes;
import io.opentelemetry.semconv.NetworkAttributes;
import io.opentelemetry.semconv.UrlAttributes;
import io.opentelemetry.semconv.UserAgentAttributes;

/**
 * Attribute keys written on request spans. Downstream consumers match on these
 * names, so they follow the OpenTelemetry semantic conventions exactly.
 */
public final class TracingAttributes {

    public static final AttributeKey<String> HTTP_REQUEST_METHOD = HttpAttributes.HTTP_REQUEST_METHOD;
    public static final AttributeKey<Long> HTTP_RESPONSE_STATUS_CODE = HttpAttributes.HTTP_RESPONSE_STATUS_CODE;
    public static final AttributeKey<String> HTTP_ROUTE = HttpAttributes.HTTP_ROUTE;
    public static final AttributeKey<String> URL_FULL = UrlAttributes.URL_FULL;
    public static final AttributeKey<String> NETWORK_PROTOCOL_VERSION = NetworkAttributes.NETWORK_PROTOCOL_VERSION;
    public static final AttributeKey<String> USER_AGENT_ORIGINAL = UserAgentAttributes.USER_AGENT_ORIGINAL;

    // Outcome classification, "ok" or "error"
    public static final AttributeKey<String> OTEL_STATUS_CODE = AttributeKey.stringKey("otel.status_code");

    public static final AttributeKey<String> DEPLOYMENT_ENVIRONMENT = AttributeKey.stringKey("deployment.environment");

    private TracingAttributes() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }
}
