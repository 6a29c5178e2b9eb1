package com.phillippitts.streamasr.service.protocol;

import java.util.Objects;

/**
 * A client request frame taken apart: its header and the decompressed payload.
 *
 * @param header  parsed frame header
 * @param payload payload bytes after decompression
 */
public record DecodedRequest(FrameHeader header, byte[] payload) {

    public DecodedRequest {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(payload, "payload");
    }
}
