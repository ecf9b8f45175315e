package pe.soapros.httptrace.core.domain;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.api.trace.TraceStateBuilder;
import io.opentelemetry.context.Context;

import java.util.Objects;

/**
 * Position in a distributed trace: trace id, span id and flags, as carried by
 * the {@code traceparent} header.
 * <p>
 * {@code traceState} is the raw {@code tracestate} header. It is forwarded
 * verbatim; converting to a {@link SpanContext} splits it into list members so
 * that child spans inherit it.
 *
 * @param traceId    32 lowercase hex characters
 * @param spanId     16 lowercase hex characters
 * @param traceFlags W3C trace flags, bit 0 is "sampled"
 * @param remote     true when parsed from an inbound carrier
 * @param traceState raw vendor state, empty when absent
 */
public record TraceContext(String traceId, String spanId, byte traceFlags, boolean remote, String traceState) {

    public TraceContext {
        Objects.requireNonNull(traceId, "traceId");
        Objects.requireNonNull(spanId, "spanId");
        traceState = traceState == null ? "" : traceState;
    }

    public static TraceContext fromSpanContext(SpanContext spanContext) {
        return fromSpanContext(spanContext, encode(spanContext.getTraceState()));
    }

    public static TraceContext fromSpanContext(SpanContext spanContext, String rawTraceState) {
        return new TraceContext(
                spanContext.getTraceId(),
                spanContext.getSpanId(),
                spanContext.getTraceFlags().asByte(),
                spanContext.isRemote(),
                rawTraceState);
    }

    public boolean isSampled() {
        return (traceFlags & TraceFlags.getSampled().asByte()) != 0;
    }

    public SpanContext toSpanContext() {
        TraceFlags flags = TraceFlags.fromByte(traceFlags);
        return remote
                ? SpanContext.createFromRemoteParent(traceId, spanId, flags, decode(traceState))
                : SpanContext.create(traceId, spanId, flags, decode(traceState));
    }

    /**
     * Root context holding this position as the parent span, for use with
     * {@code SpanBuilder.setParent}.
     */
    public Context asParentContext() {
        return Context.root().with(Span.wrap(toSpanContext()));
    }

    // Members are prepended by the builder, so walk the list backwards to keep header order
    static TraceState decode(String rawTraceState) {
        if (rawTraceState == null || rawTraceState.isBlank()) {
            return TraceState.getDefault();
        }

        String[] members = rawTraceState.split(",");
        TraceStateBuilder builder = TraceState.builder();
        for (int i = members.length - 1; i >= 0; i--) {
            String member = members[i].trim();
            int equals = member.indexOf('=');
            if (equals > 0) {
                builder.put(member.substring(0, equals).trim(), member.substring(equals + 1).trim());
            }
        }
        return builder.build();
    }

    static String encode(TraceState traceState) {
        StringBuilder raw = new StringBuilder();
        traceState.forEach((key, value) -> {
            if (raw.length() > 0) {
                raw.append(',');
            }
            raw.append(key).append('=').append(value);
        });
        return raw.toString();
    }
}
