package com.phillippitts.streamasr.service.session;

import com.phillippitts.streamasr.domain.RecognitionResult;
import com.phillippitts.streamasr.domain.SessionFailure;
import com.phillippitts.streamasr.domain.SessionState;
import com.phillippitts.streamasr.exception.StreamAsrException;
import com.phillippitts.streamasr.exception.UnexpectedSessionException;
import com.phillippitts.streamasr.service.audio.AudioPipeline;
import com.phillippitts.streamasr.service.audio.AudioPipeline.PreparedAudio;
import com.phillippitts.streamasr.service.audio.archive.AudioArchive;
import com.phillippitts.streamasr.service.metrics.RecognitionMetrics;
import com.phillippitts.streamasr.service.transport.AsrTransportFactory;
import com.phillippitts.streamasr.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Default {@link StreamingRecognizer}: decodes the packets, archives the container if
 * configured, runs a {@link RecognitionSession} and records metrics for the outcome.
 *
 * <p><b>Thread Safety:</b> stateless apart from its collaborators; sessions share nothing,
 * so any number may run concurrently.
 *
 * <p><b>Configuration:</b> Not annotated as {@code @Component}; see
 * {@link com.phillippitts.streamasr.config.asr.AsrConfig} for bean wiring.
 */
public class DefaultStreamingRecognizer implements StreamingRecognizer {

    private static final Logger LOG = LogManager.getLogger(DefaultStreamingRecognizer.class);

    // Max characters of recognized text written to logs
    private static final int LOG_PREVIEW_CHARS = 60;

    private final AsrSessionSettings settings;
    private final AsrTransportFactory transportFactory;
    private final AudioPipeline pipeline;
    private final AudioArchive archive;
    private final RecognitionMetrics metrics;
    private final Executor executor;

    public DefaultStreamingRecognizer(AsrSessionSettings settings,
                                      AsrTransportFactory transportFactory,
                                      AudioPipeline pipeline,
                                      AudioArchive archive,
                                      RecognitionMetrics metrics,
                                      Executor executor) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.archive = Objects.requireNonNull(archive, "archive");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public RecognitionResult recognize(List<byte[]> packets) {
        Objects.requireNonNull(packets, "packets");
        return run(newSession(), packets);
    }

    @Override
    public RecognitionHandle recognizeAsync(List<byte[]> packets) {
        Objects.requireNonNull(packets, "packets");
        RecognitionSession session = newSession();
        CompletableFuture<RecognitionResult> future =
                CompletableFuture.supplyAsync(() -> run(session, packets), executor);
        return new RecognitionHandle(session, future);
    }

    RecognitionSession newSession() {
        return new RecognitionSession(settings, transportFactory);
    }

    private RecognitionResult run(RecognitionSession session, List<byte[]> packets) {
        long start = System.nanoTime();
        RecognitionResult result;
        PreparedAudio audio = null;
        try {
            audio = pipeline.prepare(packets);
        } catch (StreamAsrException e) {
            result = preparationFailed(session, e, start);
            metrics.recordResult(result, System.nanoTime() - start);
            return result;
        } catch (RuntimeException e) {
            result = preparationFailed(session, new UnexpectedSessionException(e), start);
            metrics.recordResult(result, System.nanoTime() - start);
            return result;
        }

        metrics.recordSkippedPackets(audio.skippedPackets());
        archive.archive(session.sessionId(), audio.container())
                .ifPresent(path -> LOG.debug("Archived session {} audio to {}", session.sessionId(), path));

        result = session.run(audio.container());
        metrics.recordResult(result, System.nanoTime() - start);
        if (result.isSuccess()) {
            LOG.info("Recognized session {}: packets={}, skipped={}, text='{}'",
                    result.sessionId(), audio.packetCount(), audio.skippedPackets(),
                    LogSanitizer.truncate(result.text().orElse(""), LOG_PREVIEW_CHARS));
        }
        return result;
    }

    private static RecognitionResult preparationFailed(RecognitionSession session, StreamAsrException error,
                                                       long startNanos) {
        LOG.error("Audio preparation failed for session {}: {}", session.sessionId(), error.getMessage(), error);
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000L;
        return RecognitionResult.failed(session.sessionId(), new SessionFailure(SessionState.IDLE, error), elapsedMs);
    }
}
