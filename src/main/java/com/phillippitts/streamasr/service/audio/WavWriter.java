package com.phillippitts.streamasr.service.audio;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

import static com.phillippitts.streamasr.service.audio.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.streamasr.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.streamasr.service.audio.AudioFormat.REQUIRED_BYTE_RATE;
import static com.phillippitts.streamasr.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.streamasr.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;
import static com.phillippitts.streamasr.service.audio.AudioFormat.WAV_HEADER_SIZE;

/**
 * Writes minimal PCM WAV containers in the wire audio format.
 *
 * <p>Format: 16 kHz, 16-bit signed PCM, mono, little-endian.
 * Only this fixed format is supported; the service contract does not allow any other.
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * Wraps raw PCM16LE mono 16 kHz samples in a 44-byte RIFF/WAVE header.
     *
     * @param pcm raw PCM samples
     * @return WAV bytes (header + samples)
     */
    public static byte[] toWav(byte[] pcm) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        ByteArrayOutputStream bos = new ByteArrayOutputStream(WAV_HEADER_SIZE + pcm.length);
        try {
            write(pcm, bos);
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new IllegalStateException("Failed to build WAV container: " + e.getMessage(), e);
        }
        return bos.toByteArray();
    }

    private static void write(byte[] pcm, OutputStream os) throws IOException {
        // RIFF chunk: "RIFF", 36 + data size, "WAVE"
        os.write(new byte[] { 'R', 'I', 'F', 'F' });
        writeLEInt(os, 36 + pcm.length);
        os.write(new byte[] { 'W', 'A', 'V', 'E' });

        // fmt chunk, 16 bytes of PCM parameters
        os.write(new byte[] { 'f', 'm', 't', ' ' });
        writeLEInt(os, WavFormat.FMT_CHUNK_MIN_SIZE);
        writeLEShort(os, (short) WavFormat.AUDIO_FORMAT_PCM);
        writeLEShort(os, (short) REQUIRED_CHANNELS);
        writeLEInt(os, REQUIRED_SAMPLE_RATE);
        writeLEInt(os, REQUIRED_BYTE_RATE);
        writeLEShort(os, (short) REQUIRED_BLOCK_ALIGN);
        writeLEShort(os, (short) REQUIRED_BITS_PER_SAMPLE);

        // data chunk
        os.write(new byte[] { 'd', 'a', 't', 'a' });
        writeLEInt(os, pcm.length);
        os.write(pcm);
    }

    private static void writeLEShort(OutputStream os, short v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
