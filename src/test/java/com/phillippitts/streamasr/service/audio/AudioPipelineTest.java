package com.phillippitts.streamasr.service.audio;

import com.phillippitts.streamasr.testutil.FakeOpusPacketDecoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.phillippitts.streamasr.service.audio.AudioFormat.OPUS_FRAME_SAMPLES;
import static com.phillippitts.streamasr.service.audio.AudioFormat.WAV_HEADER_SIZE;
import static org.assertj.core.api.Assertions.assertThat;

class AudioPipelineTest {

    private static final int FRAME_BYTES = OPUS_FRAME_SAMPLES * 2;

    private AudioPipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline = new AudioPipeline(FakeOpusPacketDecoder.factory());
    }

    @Test
    void decodesEveryPacketInOrder() {
        List<byte[]> pcm = pipeline.decodePackets(List.of(FakeOpusPacketDecoder.packet(1),
                FakeOpusPacketDecoder.packet(2)));

        assertThat(pcm).hasSize(2);
        assertThat(pcm.get(0)).hasSize(FRAME_BYTES);
        assertThat(pcm.get(0)[0]).isEqualTo((byte) 1);
        assertThat(pcm.get(1)[0]).isEqualTo((byte) 2);
    }

    @Test
    void skipsPacketsTheCodecRejects() {
        List<byte[]> packets = List.of(FakeOpusPacketDecoder.packet(1), FakeOpusPacketDecoder.corruptPacket(),
                FakeOpusPacketDecoder.packet(3));

        List<byte[]> pcm = pipeline.decodePackets(packets);

        assertThat(pcm).hasSize(2);
        assertThat(pcm.get(0)[0]).isEqualTo((byte) 1);
        assertThat(pcm.get(1)[0]).isEqualTo((byte) 3);
    }

    @Test
    void buildsContainerFromConcatenatedSamples() {
        byte[] a = {1, 2, 3, 4};
        byte[] b = {5, 6};

        AudioContainer container = pipeline.buildContainer(List.of(a, b));

        assertThat(container.length()).isEqualTo(WAV_HEADER_SIZE + 6);
        assertThat(Arrays.copyOfRange(container.bytes(), WAV_HEADER_SIZE, container.length()))
                .containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(container.sampleRate()).isEqualTo(16_000);
        assertThat(container.channels()).isEqualTo(1);
        assertThat(container.bitsPerSample()).isEqualTo(16);
    }

    @Test
    void prepareReportsSkippedPackets() {
        AudioPipeline.PreparedAudio audio = pipeline.prepare(List.of(FakeOpusPacketDecoder.packet(1),
                FakeOpusPacketDecoder.corruptPacket()));

        assertThat(audio.packetCount()).isEqualTo(2);
        assertThat(audio.skippedPackets()).isEqualTo(1);
        assertThat(audio.container().length()).isEqualTo(WAV_HEADER_SIZE + FRAME_BYTES);
    }

    @Test
    void emptyRecordingGivesHeaderOnlyContainer() {
        AudioPipeline.PreparedAudio audio = pipeline.prepare(List.of());

        assertThat(audio.container().length()).isEqualTo(WAV_HEADER_SIZE);
        assertThat(audio.skippedPackets()).isZero();
    }

    @Test
    void usesFreshDecoderPerCall() {
        int before = FakeOpusPacketDecoder.createdCount();

        pipeline.decodePackets(List.of(FakeOpusPacketDecoder.packet(1)));
        pipeline.decodePackets(List.of(FakeOpusPacketDecoder.packet(1)));

        assertThat(FakeOpusPacketDecoder.createdCount()).isGreaterThanOrEqualTo(before + 2);
    }
}
