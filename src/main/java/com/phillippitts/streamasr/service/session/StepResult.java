package com.phillippitts.streamasr.service.session;

import com.phillippitts.streamasr.domain.SessionState;
import com.phillippitts.streamasr.exception.StreamAsrException;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one session state transition: the next state, or the failure that stopped it.
 * The terminal DONE step also carries the recognized text, if any.
 */
record StepResult(SessionState next, Optional<StreamAsrException> failure, Optional<String> text) {

    StepResult {
        Objects.requireNonNull(next, "next");
        Objects.requireNonNull(failure, "failure");
        Objects.requireNonNull(text, "text");
    }

    static StepResult advance(SessionState next) {
        return new StepResult(next, Optional.empty(), Optional.empty());
    }

    static StepResult done(Optional<String> text) {
        return new StepResult(SessionState.DONE, Optional.empty(), text);
    }

    static StepResult fail(StreamAsrException error) {
        return new StepResult(SessionState.FAILED, Optional.of(error), Optional.empty());
    }

    boolean failed() {
        return failure.isPresent();
    }
}
