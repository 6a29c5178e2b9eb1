package com.phillippitts.streamasr.service.audio.codec;

import com.phillippitts.streamasr.exception.CodecException;
import io.github.jaredmdobson.concentus.OpusDecoder;
import io.github.jaredmdobson.concentus.OpusException;

import java.util.Objects;

import static com.phillippitts.streamasr.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.streamasr.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;

/**
 * {@link OpusPacketDecoder} backed by Concentus, a pure-Java port of libopus.
 * Decodes at 16 kHz mono; no native library is required.
 *
 * <p>Not thread-safe: one instance per stream.
 */
public final class ConcentusOpusPacketDecoder implements OpusPacketDecoder {

    private final OpusDecoder decoder;
    private final int channels;

    /**
     * @throws CodecException if Concentus rejects the decoder configuration
     */
    public ConcentusOpusPacketDecoder() {
        this.channels = REQUIRED_CHANNELS;
        try {
            this.decoder = new OpusDecoder(REQUIRED_SAMPLE_RATE, channels);
        } catch (OpusException e) {
            throw new CodecException("Cannot create Opus decoder: " + e.getMessage(), e);
        }
    }

    /** Factory method reference for wiring. */
    public static OpusDecoderFactory factory() {
        return ConcentusOpusPacketDecoder::new;
    }

    @Override
    public byte[] decode(byte[] packet, int frameSize) {
        Objects.requireNonNull(packet, "packet");
        if (frameSize <= 0) {
            throw new IllegalArgumentException("frameSize must be positive, got: " + frameSize);
        }
        short[] pcm = new short[frameSize * channels];
        int samplesPerChannel;
        try {
            samplesPerChannel = decoder.decode(packet, 0, packet.length, pcm, 0, frameSize, false);
        } catch (OpusException e) {
            throw new CodecException("Opus decode failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // Concentus signals some corrupt packets with index/arithmetic errors
            throw new CodecException("Opus decoder rejected packet: " + e, e);
        }
        return toLittleEndian(pcm, samplesPerChannel * channels);
    }

    private static byte[] toLittleEndian(short[] samples, int count) {
        byte[] out = new byte[count * 2];
        for (int i = 0; i < count; i++) {
            out[2 * i] = (byte) (samples[i] & 0xFF);
            out[2 * i + 1] = (byte) ((samples[i] >>> 8) & 0xFF);
        }
        return out;
    }
}
