package com.phillippitts.streamasr.service.audio;

/**
 * Structural constants of the RIFF/WAVE container, used by {@link WavInfo} to walk
 * chunk headers without magic numbers.
 *
 * <pre>
 * ┌─────────────────────────────────────┐
 * │ RIFF Header (12 bytes)              │  RIFF_HEADER_SIZE
 * ├─────────────────────────────────────┤
 * │ fmt chunk:                          │
 * │   - Chunk ID + Size (8 bytes)       │  CHUNK_HEADER_SIZE
 * │   - Chunk Data (≥16 bytes)          │  FMT_CHUNK_MIN_SIZE
 * ├─────────────────────────────────────┤
 * │ data chunk:                         │
 * │   - Chunk ID + Size (8 bytes)       │  CHUNK_HEADER_SIZE
 * │   - PCM Audio Data (variable)       │
 * └─────────────────────────────────────┘
 * </pre>
 */
public final class WavFormat {

    /** "RIFF" id, file size - 8, "WAVE" id. */
    public static final int RIFF_HEADER_SIZE = 12;

    /** 4-character chunk id followed by a little-endian uint32 size. */
    public static final int CHUNK_HEADER_SIZE = 8;

    /** Minimum fmt chunk payload for PCM. */
    public static final int FMT_CHUNK_MIN_SIZE = 16;

    /** Audio format code for uncompressed PCM. */
    public static final int AUDIO_FORMAT_PCM = 1;

    public static final String RIFF_ID = "RIFF";
    public static final String WAVE_ID = "WAVE";
    public static final String FMT_ID = "fmt ";
    public static final String DATA_ID = "data";

    private WavFormat() {
        // Utility class - prevent instantiation
    }
}
