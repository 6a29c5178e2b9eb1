package com.phillippitts.streamasr.service.protocol;

/**
 * Message-type-specific flags in the low nibble of header byte 1.
 * Only meaningful for {@link MessageType#AUDIO_ONLY_REQUEST}.
 */
public enum SequenceFlag {

    NONE(0b0000),
    /** Marks the last audio chunk of a session. */
    FINAL_SEGMENT(0b0010);

    private final int code;

    SequenceFlag(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
