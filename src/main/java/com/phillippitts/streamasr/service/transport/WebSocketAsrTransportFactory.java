package com.phillippitts.streamasr.service.transport;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Opens {@link WebSocketAsrTransport} connections. TLS is used for {@code wss://} endpoints.
 */
public final class WebSocketAsrTransportFactory implements AsrTransportFactory {

    @Override
    public AsrTransport open(URI endpoint, Map<String, String> headers, Duration connectTimeout) {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        WebSocketAsrTransport transport = new WebSocketAsrTransport(endpoint, Map.copyOf(headers));
        transport.connect(connectTimeout);
        return transport;
    }
}
