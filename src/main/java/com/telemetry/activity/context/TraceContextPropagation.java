package com.telemetry.activity.context;

import com.telemetry.activity.core.model.SpanContext;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.context.propagation.TextMapSetter;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes W3C {@code traceparent} headers so a trace can continue in another process.
 */
public final class TraceContextPropagation {

    private static final TextMapPropagator PROPAGATOR = W3CTraceContextPropagator.getInstance();

    private static final TextMapSetter<Map<String, String>> SETTER = (carrier, key, value) -> {
        if (carrier != null) {
            carrier.put(key, value);
        }
    };

    private static final TextMapGetter<Map<String, String>> GETTER = new TextMapGetter<>() {
        @Override
        public Iterable<String> keys(Map<String, String> carrier) {
            return carrier.keySet();
        }

        @Override
        public String get(Map<String, String> carrier, String key) {
            if (carrier == null) {
                return null;
            }
            String value = carrier.get(key);
            if (value != null) {
                return value;
            }
            // header maps are not always lower-cased
            for (Map.Entry<String, String> entry : carrier.entrySet()) {
                if (entry.getKey() != null && entry.getKey().toLowerCase(Locale.ROOT).equals(key)) {
                    return entry.getValue();
                }
            }
            return null;
        }
    };

    private TraceContextPropagation() {
    }

    /**
     * Writes {@code traceparent} for the given span context into the carrier.
     * Invalid contexts write nothing.
     */
    public static void inject(SpanContext spanContext, Map<String, String> carrier) {
        if (spanContext == null || !spanContext.isValid() || carrier == null) {
            return;
        }
        io.opentelemetry.api.trace.SpanContext otelContext = io.opentelemetry.api.trace.SpanContext.create(
                spanContext.traceId(), spanContext.spanId(), TraceFlags.getSampled(), TraceState.getDefault());
        Context context = Context.root().with(Span.wrap(otelContext));
        PROPAGATOR.inject(context, carrier, SETTER);
    }

    /**
     * Reads a remote parent from the carrier's {@code traceparent} header, if present and valid.
     */
    public static Optional<SpanContext> extract(Map<String, String> carrier) {
        if (carrier == null || carrier.isEmpty()) {
            return Optional.empty();
        }
        Context context = PROPAGATOR.extract(Context.root(), carrier, GETTER);
        io.opentelemetry.api.trace.SpanContext otelContext = Span.fromContext(context).getSpanContext();
        if (!otelContext.isValid()) {
            return Optional.empty();
        }
        return Optional.of(SpanContext.remote(otelContext.getTraceId(), otelContext.getSpanId()));
    }
}
