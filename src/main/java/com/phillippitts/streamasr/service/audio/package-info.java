/**
 * Audio preparation for the recognition service.
 *
 * <p>Required wire format: 16kHz, 16-bit signed PCM, mono, little-endian, in a WAV container.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.streamasr.service.audio.AudioFormat} - single source of truth for
 *       format constants (sample rate, sample width, channels, Opus frame size, WAV offsets)</li>
 *   <li>{@link com.phillippitts.streamasr.service.audio.AudioPipeline} - Opus packets to WAV
 *       container, skipping packets the codec rejects</li>
 *   <li>{@link com.phillippitts.streamasr.service.audio.WavWriter} /
 *       {@link com.phillippitts.streamasr.service.audio.WavInfo} - write and read back the RIFF
 *       header</li>
 *   <li>{@link com.phillippitts.streamasr.service.audio.AudioChunker} - splits the container into
 *       per-frame segments</li>
 * </ul>
 *
 * <p>Usage Example:
 * <pre>
 * AudioContainer wav = pipeline.prepare(opusPackets).container();
 * Iterator&lt;Chunk&gt; chunks = AudioChunker.split(wav.bytes(), wav.segmentSize(15_000));
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.streamasr.service.audio;
