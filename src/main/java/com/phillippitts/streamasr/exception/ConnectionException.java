package com.phillippitts.streamasr.exception;

/**
 * Thrown when the transport to the recognition service cannot be established
 * (DNS failure, TLS/WebSocket handshake rejected, connect timeout).
 */
public class ConnectionException extends StreamAsrException {

    private final String endpoint;

    public ConnectionException(String endpoint, String reason) {
        super("Cannot connect to " + endpoint + ": " + reason);
        this.endpoint = endpoint;
    }

    public ConnectionException(String endpoint, String reason, Throwable cause) {
        super("Cannot connect to " + endpoint + ": " + reason, cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }

    @Override
    public String kind() {
        return "connection";
    }
}
