package com.phillippitts.streamasr.service.transport;

import com.phillippitts.streamasr.exception.ConnectionException;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Opens connections to the recognition service.
 */
@FunctionalInterface
public interface AsrTransportFactory {

    /**
     * Opens a connection and completes the handshake.
     *
     * @param endpoint       service URI
     * @param headers        handshake headers (e.g., Authorization)
     * @param connectTimeout deadline for the handshake
     * @return open transport
     * @throws ConnectionException if the connection cannot be established
     */
    AsrTransport open(URI endpoint, Map<String, String> headers, Duration connectTimeout);
}
