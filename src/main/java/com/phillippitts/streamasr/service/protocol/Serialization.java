package com.phillippitts.streamasr.service.protocol;

import java.util.Optional;

/** Payload serialization methods (high nibble of header byte 2). */
public enum Serialization {

    NONE(0b0000),
    JSON(0b0001),
    THRIFT(0b0011),
    CUSTOM(0b1111);

    private final int code;

    Serialization(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<Serialization> fromCode(int code) {
        for (Serialization s : values()) {
            if (s.code == code) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
