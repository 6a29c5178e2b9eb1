package com.phillippitts.streamasr.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable outcome of one recognition session: recognized text, "no speech detected",
 * or a structured failure. Never carries both text and a failure.
 *
 * @param sessionId request id sent to the service for this session
 * @param text      recognized text; empty when no speech was detected or the session failed
 * @param failure   failure; empty on success
 * @param elapsedMs wall-clock duration of the session
 */
public record RecognitionResult(
        String sessionId,
        Optional<String> text,
        Optional<SessionFailure> failure,
        long elapsedMs
) {

    public RecognitionResult {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(failure, "failure");
        if (text.isPresent() && failure.isPresent()) {
            throw new IllegalArgumentException("A result cannot carry both text and a failure");
        }
    }

    public static RecognitionResult recognized(String sessionId, String text, long elapsedMs) {
        return new RecognitionResult(sessionId, Optional.of(text), Optional.empty(), elapsedMs);
    }

    public static RecognitionResult noSpeech(String sessionId, long elapsedMs) {
        return new RecognitionResult(sessionId, Optional.empty(), Optional.empty(), elapsedMs);
    }

    public static RecognitionResult failed(String sessionId, SessionFailure failure, long elapsedMs) {
        return new RecognitionResult(sessionId, Optional.empty(), Optional.of(failure), elapsedMs);
    }

    public boolean isSuccess() {
        return failure.isEmpty();
    }

    /** @return true if the session succeeded without recognizing any speech */
    public boolean isNoSpeech() {
        return failure.isEmpty() && text.isEmpty();
    }
}
