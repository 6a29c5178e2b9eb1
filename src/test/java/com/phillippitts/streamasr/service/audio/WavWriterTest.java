package com.phillippitts.streamasr.service.audio;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static com.phillippitts.streamasr.service.audio.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.streamasr.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.streamasr.service.audio.AudioFormat.REQUIRED_BYTE_RATE;
import static com.phillippitts.streamasr.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.streamasr.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;
import static com.phillippitts.streamasr.service.audio.AudioFormat.WAV_HEADER_SIZE;
import static org.assertj.core.api.Assertions.assertThat;

class WavWriterTest {

    // little-endian field offsets within the 44-byte header
    private static final int CHANNELS_OFFSET = 22;
    private static final int SAMPLE_RATE_OFFSET = 24;
    private static final int BYTE_RATE_OFFSET = 28;
    private static final int BLOCK_ALIGN_OFFSET = 32;
    private static final int BITS_PER_SAMPLE_OFFSET = 34;

    @Test
    void shouldWriteValidWavHeaderAndPayload() {
        // 1 second of silence at 16kHz mono 16-bit = 32,000 bytes
        byte[] pcm = new byte[REQUIRED_BYTE_RATE];
        pcm[pcm.length - 1] = 0x42;

        byte[] all = WavWriter.toWav(pcm);
        ByteBuffer le = ByteBuffer.wrap(all).order(ByteOrder.LITTLE_ENDIAN);

        assertThat(all.length).isEqualTo(WAV_HEADER_SIZE + pcm.length);
        assertThat(new String(all, 0, 4)).isEqualTo("RIFF");
        assertThat(le.getInt(4)).isEqualTo(36 + pcm.length);
        assertThat(new String(all, 8, 4)).isEqualTo("WAVE");
        assertThat(new String(all, 12, 4)).isEqualTo("fmt ");
        assertThat(le.getInt(16)).isEqualTo(16);
        assertThat(le.getShort(20)).isEqualTo((short) 1);
        assertThat(le.getShort(CHANNELS_OFFSET)).isEqualTo((short) REQUIRED_CHANNELS);
        assertThat(le.getInt(SAMPLE_RATE_OFFSET)).isEqualTo(REQUIRED_SAMPLE_RATE);
        assertThat(le.getInt(BYTE_RATE_OFFSET)).isEqualTo(REQUIRED_BYTE_RATE);
        assertThat(le.getShort(BLOCK_ALIGN_OFFSET)).isEqualTo((short) REQUIRED_BLOCK_ALIGN);
        assertThat(le.getShort(BITS_PER_SAMPLE_OFFSET)).isEqualTo((short) REQUIRED_BITS_PER_SAMPLE);
        assertThat(new String(all, 36, 4)).isEqualTo("data");
        assertThat(le.getInt(40)).isEqualTo(pcm.length);
        assertThat(all[all.length - 1]).isEqualTo((byte) 0x42);
    }

    @Test
    void emptyPcmGivesHeaderOnly() {
        byte[] all = WavWriter.toWav(new byte[0]);

        assertThat(all).hasSize(WAV_HEADER_SIZE);
        assertThat(ByteBuffer.wrap(all).order(ByteOrder.LITTLE_ENDIAN).getInt(40)).isZero();
    }
}
