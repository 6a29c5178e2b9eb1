package com.phillippitts.streamasr.service.metrics;

import com.phillippitts.streamasr.domain.RecognitionResult;
import com.phillippitts.streamasr.domain.SessionFailure;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for recognition sessions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Session latency</li>
 *   <li>Successes by outcome (text, no_speech)</li>
 *   <li>Failures by kind and by the session state they occurred in</li>
 *   <li>Opus packets skipped by the decoder</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class RecognitionMetrics {

    private static final String METRIC_PREFIX = "streamasr.recognition";

    private final MeterRegistry registry;

    public RecognitionMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Records session latency.
     *
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to recognize a recording")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Increments the success counter.
     *
     * @param outcome "text" or "no_speech"
     */
    public void incrementSuccess(String outcome) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful recognitions")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter.
     *
     * @param reason failure kind (connection, timeout, remote, etc.)
     * @param state  session state the failure occurred in
     */
    public void incrementFailure(String reason, String state) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed recognitions")
                .tag("reason", reason)
                .tag("state", state)
                .register(registry)
                .increment();
    }

    /**
     * Adds packets the Opus decoder rejected.
     *
     * @param count skipped packets; zero is ignored
     */
    public void recordSkippedPackets(int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder("streamasr.audio.skipped_packets")
                .description("Number of Opus packets skipped because they failed to decode")
                .register(registry)
                .increment(count);
    }

    /** Records latency plus the success or failure counter matching the result. */
    public void recordResult(RecognitionResult result, long durationNanos) {
        recordLatency(durationNanos);
        if (result.failure().isPresent()) {
            SessionFailure failure = result.failure().get();
            incrementFailure(failure.kind(), failure.state().name().toLowerCase(Locale.ROOT));
        } else {
            incrementSuccess(result.isNoSpeech() ? "no_speech" : "text");
        }
    }
}
