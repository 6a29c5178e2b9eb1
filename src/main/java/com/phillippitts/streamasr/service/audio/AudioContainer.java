package com.phillippitts.streamasr.service.audio;

import java.util.Objects;

/**
 * Complete WAV container for one session: header plus linear PCM samples.
 * Created once per session and never modified.
 *
 * @param bytes         WAV bytes (header + samples); not copied, callers must not mutate
 * @param sampleRate    sample rate in Hz
 * @param channels      channel count
 * @param bitsPerSample bits per sample
 */
public record AudioContainer(byte[] bytes, int sampleRate, int channels, int bitsPerSample) {

    public AudioContainer {
        Objects.requireNonNull(bytes, "bytes");
        if (sampleRate <= 0 || channels <= 0 || bitsPerSample <= 0 || bitsPerSample % 8 != 0) {
            throw new IllegalArgumentException("Invalid audio format: rate=" + sampleRate
                    + ", channels=" + channels + ", bits=" + bitsPerSample);
        }
    }

    /** Builds a container by reading the format back from the WAV header. */
    public static AudioContainer fromWav(byte[] wav) {
        WavInfo info = WavInfo.read(wav);
        return new AudioContainer(wav, info.sampleRate(), info.channels(), info.sampleWidth() * 8);
    }

    /** @return bytes of audio per second of playback */
    public int bytesPerSecond() {
        return channels * (bitsPerSample / 8) * sampleRate;
    }

    /**
     * Number of container bytes covering the given duration of audio.
     *
     * @param durationMs segment duration in milliseconds (positive)
     * @return segment size in bytes, at least 1
     */
    public int segmentSize(int durationMs) {
        if (durationMs <= 0) {
            throw new IllegalArgumentException("durationMs must be positive, got: " + durationMs);
        }
        long size = (long) bytesPerSecond() * durationMs / 1000;
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, size));
    }

    /** @return container size in bytes */
    public int length() {
        return bytes.length;
    }
}
