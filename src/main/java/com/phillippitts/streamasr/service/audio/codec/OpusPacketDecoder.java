package com.phillippitts.streamasr.service.audio.codec;

import com.phillippitts.streamasr.exception.CodecException;

/**
 * Decode-only Opus capability producing PCM16LE samples in the wire format.
 *
 * <p>Opus decoders keep inter-frame state, so one instance must decode the packets of a single
 * stream in order and must not be shared between sessions.
 */
public interface OpusPacketDecoder {

    /**
     * Decodes one Opus packet.
     *
     * @param packet    compressed Opus packet
     * @param frameSize maximum samples per channel to produce
     * @return PCM16LE samples (little-endian, interleaved if multi-channel)
     * @throws CodecException if the packet is corrupt or the decoder rejects it
     */
    byte[] decode(byte[] packet, int frameSize);
}
