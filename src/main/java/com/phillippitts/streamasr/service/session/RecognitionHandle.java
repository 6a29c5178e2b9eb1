package com.phillippitts.streamasr.service.session;

import com.phillippitts.streamasr.domain.RecognitionResult;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Handle to a session running in the background.
 *
 * <p>Cancelling {@link #result()} aborts the session's connection as well.
 */
public final class RecognitionHandle {

    private final String sessionId;
    private final CompletableFuture<RecognitionResult> result;
    private final RecognitionSession session;

    RecognitionHandle(RecognitionSession session, CompletableFuture<RecognitionResult> result) {
        this.session = Objects.requireNonNull(session, "session");
        this.result = Objects.requireNonNull(result, "result");
        this.sessionId = session.sessionId();
        result.whenComplete((r, t) -> {
            if (result.isCancelled()) {
                session.abort();
            }
        });
    }

    public String sessionId() {
        return sessionId;
    }

    public CompletableFuture<RecognitionResult> result() {
        return result;
    }

    /**
     * Aborts the session's connection. The future still completes, with a transport failure.
     */
    public void abort() {
        session.abort();
    }
}
