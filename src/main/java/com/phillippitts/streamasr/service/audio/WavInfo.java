package com.phillippitts.streamasr.service.audio;

import com.phillippitts.streamasr.exception.InvalidAudioException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Format parameters read back from a WAV container header.
 *
 * @param channels    number of channels
 * @param sampleWidth bytes per sample per channel
 * @param sampleRate  sample rate in Hz
 * @param frameCount  number of sample frames in the data chunk
 * @param dataLength  size of the data chunk in bytes
 */
public record WavInfo(int channels, int sampleWidth, int sampleRate, int frameCount, int dataLength) {

    /** @return bytes of audio per second of playback */
    public int bytesPerSecond() {
        return channels * sampleWidth * sampleRate;
    }

    /**
     * Parses the RIFF/WAVE header, walking chunks until the data chunk is found.
     * Unknown chunks between "fmt " and "data" are skipped.
     *
     * @param wav complete WAV bytes
     * @return parsed format parameters
     * @throws InvalidAudioException if the header is missing, truncated, or not PCM
     */
    public static WavInfo read(byte[] wav) {
        Objects.requireNonNull(wav, "wav");
        if (wav.length < WavFormat.RIFF_HEADER_SIZE) {
            throw new InvalidAudioException(wav.length, "too short for a RIFF header");
        }
        ByteBuffer buf = ByteBuffer.wrap(wav).order(ByteOrder.LITTLE_ENDIAN);
        if (!WavFormat.RIFF_ID.equals(fourCc(wav, 0)) || !WavFormat.WAVE_ID.equals(fourCc(wav, 8))) {
            throw new InvalidAudioException(wav.length, "missing RIFF/WAVE markers");
        }

        int pos = WavFormat.RIFF_HEADER_SIZE;
        Integer channels = null;
        int sampleRate = 0;
        int bitsPerSample = 0;
        while (pos + WavFormat.CHUNK_HEADER_SIZE <= wav.length) {
            String id = fourCc(wav, pos);
            long size = Integer.toUnsignedLong(buf.getInt(pos + 4));
            int dataStart = pos + WavFormat.CHUNK_HEADER_SIZE;
            if (WavFormat.FMT_ID.equals(id)) {
                if (size < WavFormat.FMT_CHUNK_MIN_SIZE || dataStart + WavFormat.FMT_CHUNK_MIN_SIZE > wav.length) {
                    throw new InvalidAudioException(wav.length, "fmt chunk truncated");
                }
                int audioFormat = buf.getShort(dataStart) & 0xFFFF;
                if (audioFormat != WavFormat.AUDIO_FORMAT_PCM) {
                    throw new InvalidAudioException(wav.length, "not PCM (format=" + audioFormat + ")");
                }
                channels = buf.getShort(dataStart + 2) & 0xFFFF;
                sampleRate = buf.getInt(dataStart + 4);
                bitsPerSample = buf.getShort(dataStart + 14) & 0xFFFF;
            } else if (WavFormat.DATA_ID.equals(id)) {
                if (channels == null) {
                    throw new InvalidAudioException(wav.length, "data chunk before fmt chunk");
                }
                int available = wav.length - dataStart;
                int dataLength = (int) Math.min(size, available);
                int sampleWidth = bitsPerSample / 8;
                int blockAlign = Math.max(1, channels * sampleWidth);
                return new WavInfo(channels, sampleWidth, sampleRate, dataLength / blockAlign, dataLength);
            }
            // chunks are word-aligned
            pos = (int) Math.min(Integer.MAX_VALUE, dataStart + size + (size & 1));
        }
        throw new InvalidAudioException(wav.length, "no data chunk");
    }

    private static String fourCc(byte[] wav, int offset) {
        return new String(wav, offset, 4, StandardCharsets.US_ASCII);
    }
}
