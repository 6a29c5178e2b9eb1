package com.phillippitts.streamasr.service.protocol;

import java.util.Optional;

/**
 * Message types carried in the high nibble of header byte 1.
 * Client types travel upstream, server types downstream.
 */
public enum MessageType {

    /** Client frame carrying the JSON session configuration. */
    FULL_REQUEST(0b0001),
    /** Client frame carrying one gzip-compressed audio chunk. */
    AUDIO_ONLY_REQUEST(0b0010),
    /** Server frame carrying a complete result document. */
    FULL_RESPONSE(0b1001),
    /** Server acknowledgment with a sequence number and optional payload. */
    ACK(0b1011),
    /** Server error frame with an error code and payload. */
    ERROR_RESPONSE(0b1111);

    private final int code;

    MessageType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Looks up a message type by its 4-bit wire code.
     *
     * @param code nibble value (0-15)
     * @return matching type, or empty for codes this client does not know
     */
    public static Optional<MessageType> fromCode(int code) {
        for (MessageType type : values()) {
            if (type.code == code) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
