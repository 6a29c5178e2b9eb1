package com.phillippitts.streamasr.service.protocol;

import java.util.Optional;

/** Payload compression methods (low nibble of header byte 2). */
public enum Compression {

    NONE(0b0000),
    GZIP(0b0001),
    CUSTOM(0b1111);

    private final int code;

    Compression(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<Compression> fromCode(int code) {
        for (Compression c : values()) {
            if (c.code == code) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
