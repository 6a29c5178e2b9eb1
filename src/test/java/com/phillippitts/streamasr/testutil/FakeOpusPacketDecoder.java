package com.phillippitts.streamasr.testutil;

import com.phillippitts.streamasr.exception.CodecException;
import com.phillippitts.streamasr.service.audio.codec.OpusDecoderFactory;
import com.phillippitts.streamasr.service.audio.codec.OpusPacketDecoder;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double for the Opus codec.
 *
 * <p>A packet decodes to {@code frameSize} 16-bit samples whose value is the packet's first
 * byte, so tests can tell which packets made it into the stream. A packet starting with
 * {@link #CORRUPT_MARKER} (or an empty packet) is rejected with {@link CodecException}.
 */
public class FakeOpusPacketDecoder implements OpusPacketDecoder {

    public static final byte CORRUPT_MARKER = (byte) 0xFF;

    /** Decoders created through {@link #factory()}, across all tests using it. */
    private static final AtomicInteger CREATED = new AtomicInteger();

    public static OpusDecoderFactory factory() {
        return () -> {
            CREATED.incrementAndGet();
            return new FakeOpusPacketDecoder();
        };
    }

    public static int createdCount() {
        return CREATED.get();
    }

    /** A packet the fake decodes to samples of the given value. */
    public static byte[] packet(int value) {
        return new byte[] {(byte) value, 0x01, 0x02};
    }

    /** A packet the fake rejects. */
    public static byte[] corruptPacket() {
        return new byte[] {CORRUPT_MARKER, 0x00};
    }

    @Override
    public byte[] decode(byte[] packet, int frameSize) {
        if (packet.length == 0 || packet[0] == CORRUPT_MARKER) {
            throw new CodecException("corrupted stream");
        }
        byte[] pcm = new byte[frameSize * 2];
        for (int i = 0; i < frameSize; i++) {
            pcm[2 * i] = packet[0];
            pcm[2 * i + 1] = 0;
        }
        return pcm;
    }
}
