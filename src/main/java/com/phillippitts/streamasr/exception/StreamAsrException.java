package com.phillippitts.streamasr.exception;

/**
 * Base exception for all stream-asr application-specific errors.
 * All domain exceptions extend this class so a recognition session can surface
 * any failure through a single type.
 */
public class StreamAsrException extends RuntimeException {

    public StreamAsrException(String message) {
        super(message);
    }

    public StreamAsrException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short, stable identifier of the failure kind, used as a metrics tag and in API errors.
     *
     * @return failure kind (e.g., "connection", "remote")
     */
    public String kind() {
        return "unknown";
    }
}
