package com.phillippitts.streamasr.service.audio;

import com.phillippitts.streamasr.exception.CodecException;
import com.phillippitts.streamasr.service.audio.codec.OpusDecoderFactory;
import com.phillippitts.streamasr.service.audio.codec.OpusPacketDecoder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.phillippitts.streamasr.service.audio.AudioFormat.OPUS_FRAME_SAMPLES;

/**
 * Turns a recording's Opus packets into the WAV container the recognition service expects.
 *
 * <p>Decoding is best-effort: a packet the codec rejects is logged and skipped, and the
 * remaining packets still contribute their samples in stream order. The skipped audio
 * leaves a gap in the stream; no silence is inserted in its place.
 *
 * <p>Thread-safe: a new decoder is created for every call.
 */
public class AudioPipeline {

    private static final Logger LOG = LogManager.getLogger(AudioPipeline.class);

    private final OpusDecoderFactory decoderFactory;

    public AudioPipeline(OpusDecoderFactory decoderFactory) {
        this.decoderFactory = Objects.requireNonNull(decoderFactory, "decoderFactory");
    }

    /**
     * Decodes each packet with a 960-sample frame size.
     *
     * @param packets Opus packets in stream order
     * @return PCM16LE buffers for the packets that decoded, in input order
     */
    public List<byte[]> decodePackets(List<byte[]> packets) {
        Objects.requireNonNull(packets, "packets");
        OpusPacketDecoder decoder = decoderFactory.create();
        List<byte[]> pcm = new ArrayList<>(packets.size());
        for (int i = 0; i < packets.size(); i++) {
            try {
                pcm.add(decoder.decode(packets.get(i), OPUS_FRAME_SAMPLES));
            } catch (CodecException e) {
                LOG.warn("Skipping Opus packet {} of {}: {}", i + 1, packets.size(), e.getMessage(), e);
            }
        }
        return pcm;
    }

    /**
     * Concatenates PCM buffers in order and wraps them in a mono, 16-bit, 16 kHz WAV header.
     *
     * @param sampleBuffers PCM16LE buffers
     * @return WAV container
     */
    public AudioContainer buildContainer(List<byte[]> sampleBuffers) {
        Objects.requireNonNull(sampleBuffers, "sampleBuffers");
        int total = 0;
        for (byte[] buffer : sampleBuffers) {
            total += buffer.length;
        }
        ByteArrayOutputStream pcm = new ByteArrayOutputStream(total);
        for (byte[] buffer : sampleBuffers) {
            pcm.writeBytes(buffer);
        }
        // format is read back from the header so the container describes itself
        return AudioContainer.fromWav(WavWriter.toWav(pcm.toByteArray()));
    }

    /**
     * Decodes the packets and builds the session's container.
     *
     * @param packets Opus packets in stream order
     * @return prepared audio with the number of packets skipped
     */
    public PreparedAudio prepare(List<byte[]> packets) {
        List<byte[]> pcm = decodePackets(packets);
        AudioContainer container = buildContainer(pcm);
        int skipped = packets.size() - pcm.size();
        LOG.debug("Prepared audio: packets={}, skipped={}, containerBytes={}",
                packets.size(), skipped, container.length());
        return new PreparedAudio(container, packets.size(), skipped);
    }

    /**
     * Output of {@link #prepare(List)}.
     *
     * @param container      WAV container
     * @param packetCount    packets received
     * @param skippedPackets packets the codec rejected
     */
    public record PreparedAudio(AudioContainer container, int packetCount, int skippedPackets) {
    }
}
