package com.phillippitts.streamasr.config;

import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Configuration;

import static com.phillippitts.streamasr.service.audio.AudioFormat.OPUS_FRAME_SAMPLES;
import static com.phillippitts.streamasr.service.audio.AudioFormat.REQUIRED_BIG_ENDIAN;
import static com.phillippitts.streamasr.service.audio.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.streamasr.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.streamasr.service.audio.AudioFormat.REQUIRED_BYTE_RATE;
import static com.phillippitts.streamasr.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.streamasr.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;

/**
 * Startup sanity check for the audio format declared to the recognition service.
 * Logs the effective format and fails fast if misconfigured.
 */
@Configuration
class AudioFormatConfig {
    private static final Logger LOG = LogManager.getLogger(AudioFormatConfig.class);

    @PostConstruct
    void validateAudioFormatConstants() {
        if (REQUIRED_SAMPLE_RATE != 16_000 || REQUIRED_BITS_PER_SAMPLE != 16
                || REQUIRED_CHANNELS != 1 || REQUIRED_BIG_ENDIAN) {
            throw new IllegalStateException(
                    "Audio format constants misconfigured. Expected 16kHz, 16-bit, mono, little-endian.");
        }
        if (OPUS_FRAME_SAMPLES * 1000 % REQUIRED_SAMPLE_RATE != 0) {
            throw new IllegalStateException("Opus frame of " + OPUS_FRAME_SAMPLES
                    + " samples is not a whole number of milliseconds at " + REQUIRED_SAMPLE_RATE + " Hz");
        }
        LOG.info("Audio format configured: sampleRate={} Hz, bitsPerSample={}, channels={}, "
                        + "byteRate={}, blockAlign={}, opusFrame={} samples (littleEndian={})",
                REQUIRED_SAMPLE_RATE, REQUIRED_BITS_PER_SAMPLE, REQUIRED_CHANNELS,
                REQUIRED_BYTE_RATE, REQUIRED_BLOCK_ALIGN, OPUS_FRAME_SAMPLES, !REQUIRED_BIG_ENDIAN);
    }
}
