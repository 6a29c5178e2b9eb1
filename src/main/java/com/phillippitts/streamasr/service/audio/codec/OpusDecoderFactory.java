package com.phillippitts.streamasr.service.audio.codec;

/**
 * Creates a fresh {@link OpusPacketDecoder} per audio stream.
 */
@FunctionalInterface
public interface OpusDecoderFactory {

    /**
     * @return new decoder configured for 16 kHz mono
     * @throws com.phillippitts.streamasr.exception.CodecException if the decoder cannot be created
     */
    OpusPacketDecoder create();
}
