package com.phillippitts.streamasr.domain;

import com.phillippitts.streamasr.exception.StreamAsrException;

import java.util.Objects;

/**
 * Why and where a recognition session failed.
 *
 * @param state the state the session was in when the failure occurred
 * @param error the failure
 */
public record SessionFailure(SessionState state, StreamAsrException error) {

    public SessionFailure {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(error, "error");
        if (state.isTerminal()) {
            throw new IllegalArgumentException("Failure must originate in a non-terminal state, got: " + state);
        }
    }

    /** @return failure kind, e.g. "remote" or "timeout" */
    public String kind() {
        return error.kind();
    }
}
