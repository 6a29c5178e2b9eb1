package com.phillippitts.streamasr.exception;

/**
 * Thrown when a single compressed audio packet cannot be decoded.
 * Never ends a session: the audio pipeline logs it and skips the packet.
 */
public class CodecException extends StreamAsrException {

    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "codec";
    }
}
