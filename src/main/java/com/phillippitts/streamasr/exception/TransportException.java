package com.phillippitts.streamasr.exception;

/**
 * Thrown when a send or receive fails on an established connection, including
 * receive deadlines expiring and connections aborted from another thread.
 */
public class TransportException extends StreamAsrException {

    private final boolean timeout;

    public TransportException(String message) {
        this(message, false);
    }

    public TransportException(String message, boolean timeout) {
        super(message);
        this.timeout = timeout;
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.timeout = false;
    }

    /**
     * @return true if the failure was a receive deadline expiring
     */
    public boolean isTimeout() {
        return timeout;
    }

    @Override
    public String kind() {
        return timeout ? "timeout" : "transport";
    }
}
