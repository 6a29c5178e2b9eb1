package com.phillippitts.streamasr.config.asr;

import com.phillippitts.streamasr.config.properties.AsrServiceProperties;
import com.phillippitts.streamasr.service.audio.AudioPipeline;
import com.phillippitts.streamasr.service.audio.archive.AudioArchive;
import com.phillippitts.streamasr.service.audio.archive.FileAudioArchive;
import com.phillippitts.streamasr.service.audio.codec.ConcentusOpusPacketDecoder;
import com.phillippitts.streamasr.service.audio.codec.OpusDecoderFactory;
import com.phillippitts.streamasr.service.metrics.RecognitionMetrics;
import com.phillippitts.streamasr.service.session.AsrSessionSettings;
import com.phillippitts.streamasr.service.session.DefaultStreamingRecognizer;
import com.phillippitts.streamasr.service.session.StreamingRecognizer;
import com.phillippitts.streamasr.service.transport.AsrTransportFactory;
import com.phillippitts.streamasr.service.transport.WebSocketAsrTransportFactory;
import com.phillippitts.streamasr.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.Executor;

/**
 * Wires the recognition pipeline explicitly: codec, transport, archive and recognizer.
 */
@Configuration
public class AsrConfig {

    private static final Logger LOG = LogManager.getLogger(AsrConfig.class);

    private final AsrServiceProperties properties;

    public AsrConfig(AsrServiceProperties properties) {
        this.properties = properties;
    }

    @Bean
    public AsrSessionSettings asrSessionSettings() {
        AsrSessionSettings settings = properties.toSessionSettings();
        LOG.info("ASR service configured: {} (token={})", settings,
                LogSanitizer.maskSecret(properties.accessToken()));
        return settings;
    }

    @Bean
    public OpusDecoderFactory opusDecoderFactory() {
        return ConcentusOpusPacketDecoder.factory();
    }

    @Bean
    public AsrTransportFactory asrTransportFactory() {
        return new WebSocketAsrTransportFactory();
    }

    @Bean
    public AudioPipeline audioPipeline(OpusDecoderFactory opusDecoderFactory) {
        return new AudioPipeline(opusDecoderFactory);
    }

    /**
     * File archive when {@code asr.output-dir} is set, otherwise an archive that stores nothing.
     */
    @Bean
    public AudioArchive audioArchive() {
        if (!properties.archivingEnabled()) {
            return AudioArchive.disabled();
        }
        FileAudioArchive archive = new FileAudioArchive(Path.of(properties.outputDir()));
        LOG.info("Archiving session audio to {}", archive.getDirectory());
        return archive;
    }

    @Bean
    public StreamingRecognizer streamingRecognizer(AsrSessionSettings settings,
                                                   AsrTransportFactory transportFactory,
                                                   AudioPipeline audioPipeline,
                                                   AudioArchive audioArchive,
                                                   RecognitionMetrics metrics,
                                                   @Qualifier("asrExecutor") Executor asrExecutor) {
        return new DefaultStreamingRecognizer(settings, transportFactory, audioPipeline, audioArchive,
                metrics, asrExecutor);
    }
}
