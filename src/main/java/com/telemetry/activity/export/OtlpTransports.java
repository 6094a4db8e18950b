package com.telemetry.activity.export;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Creates the transport matching a configured {@link Protocol}.
 */
public final class OtlpTransports {

    private OtlpTransports() {
    }

    public static OtlpTransport create(Protocol protocol, URI endpoint, Duration timeout, Map<String, String> headers) {
        return switch (protocol) {
            case GRPC -> GrpcOtlpTransport.create(endpoint, timeout, headers);
            case HTTP_PROTOBUF -> new HttpProtobufOtlpTransport(endpoint, timeout, headers);
        };
    }
}
