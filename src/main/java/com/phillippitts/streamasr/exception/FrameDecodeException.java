package com.phillippitts.streamasr.exception;

/**
 * Thrown when a server frame cannot be decoded: truncated frame, corrupt gzip payload,
 * unparseable JSON, or a response body missing a field the session depends on.
 */
public class FrameDecodeException extends StreamAsrException {

    private final int frameLength;

    public FrameDecodeException(String message, int frameLength) {
        super(message + " (frameLength=" + frameLength + ")");
        this.frameLength = frameLength;
    }

    public FrameDecodeException(String message, int frameLength, Throwable cause) {
        super(message + " (frameLength=" + frameLength + ")", cause);
        this.frameLength = frameLength;
    }

    public int getFrameLength() {
        return frameLength;
    }

    @Override
    public String kind() {
        return "decode";
    }
}
