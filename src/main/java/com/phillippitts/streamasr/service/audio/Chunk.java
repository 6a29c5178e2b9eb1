package com.phillippitts.streamasr.service.audio;

import java.util.Objects;

/**
 * One slice of the audio container, sent as a single audio-only frame.
 *
 * @param bytes chunk bytes
 * @param last  true only for the final chunk of a session
 */
public record Chunk(byte[] bytes, boolean last) {

    public Chunk {
        Objects.requireNonNull(bytes, "bytes");
    }

    public int length() {
        return bytes.length;
    }
}
