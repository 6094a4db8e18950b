package com.telemetry.activity.core.model;

import io.opentelemetry.api.trace.SpanId;
import io.opentelemetry.api.trace.TraceId;

import java.util.HexFormat;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Random trace and span id generation plus hex helpers.
 * Ids are lowercase hex; the all-zero id is invalid and never generated.
 */
public final class Ids {

    private static final HexFormat HEX = HexFormat.of();

    private Ids() {
    }

    public static String newTraceId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        long high;
        long low;
        do {
            high = random.nextLong();
            low = random.nextLong();
        } while (high == 0 && low == 0);
        return TraceId.fromLongs(high, low);
    }

    public static String newSpanId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        long id;
        do {
            id = random.nextLong();
        } while (id == 0);
        return SpanId.fromLong(id);
    }

    public static boolean isValidTraceId(String traceId) {
        return traceId != null && TraceId.isValid(traceId);
    }

    public static boolean isValidSpanId(String spanId) {
        return spanId != null && SpanId.isValid(spanId);
    }

    public static byte[] toBytes(String hexId) {
        return HEX.parseHex(hexId);
    }
}
