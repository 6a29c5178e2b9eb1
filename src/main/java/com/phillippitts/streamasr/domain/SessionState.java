package com.phillippitts.streamasr.domain;

/**
 * States of one recognition session.
 *
 * <pre>
 * IDLE → CONNECTED → CONFIG_SENT → STREAMING → AWAITING_RESULT → DONE
 *   └────────┴───────────┴────────────┴──────────────┴──────────→ FAILED
 * </pre>
 */
public enum SessionState {
    IDLE,
    CONNECTED,
    CONFIG_SENT,
    STREAMING,
    AWAITING_RESULT,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
