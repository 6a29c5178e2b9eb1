package com.phillippitts.streamasr.exception;

/**
 * Wraps any exception a recognition session did not anticipate, so the caller
 * still receives a structured failure.
 */
public class UnexpectedSessionException extends StreamAsrException {

    public UnexpectedSessionException(Throwable cause) {
        super("Recognition session failed unexpectedly: " + cause.getMessage(), cause);
    }
}
