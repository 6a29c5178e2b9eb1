package com.phillippitts.streamasr.service.audio;

/**
 * Single source of truth for the wire audio format agreed with the recognition service.
 * Required: 16 kHz, 16-bit signed PCM, mono, little-endian, delivered in a WAV container.
 */
public final class AudioFormat {

    /** Required sample rate in Hz. */
    public static final int REQUIRED_SAMPLE_RATE = 16_000;
    /** Required bits per sample. */
    public static final int REQUIRED_BITS_PER_SAMPLE = 16;
    /** Required number of channels (mono). */
    public static final int REQUIRED_CHANNELS = 1;

    /** Required endian flag (false = little-endian). */
    public static final boolean REQUIRED_BIG_ENDIAN = false;

    /** Bytes per sample for one channel. */
    public static final int REQUIRED_SAMPLE_WIDTH = REQUIRED_BITS_PER_SAMPLE / 8;                    // 2 bytes
    /** Bytes per PCM frame (sample for all channels). */
    public static final int REQUIRED_BLOCK_ALIGN = REQUIRED_SAMPLE_WIDTH * REQUIRED_CHANNELS;          // 2 bytes
    /** Bytes per second at required format. */
    public static final int REQUIRED_BYTE_RATE = REQUIRED_SAMPLE_RATE * REQUIRED_BLOCK_ALIGN;          // 32,000

    /** Samples per channel in one Opus packet: a 60 ms frame at 16 kHz. */
    public static final int OPUS_FRAME_SAMPLES = 960;

    /** Size of the canonical PCM WAV header. */
    public static final int WAV_HEADER_SIZE = 44;

    private AudioFormat() {}
}
