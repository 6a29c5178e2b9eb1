package com.phillippitts.streamasr.presentation.controller;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Body of {@code POST /api/recognitions}.
 *
 * @param packets base64-encoded Opus packets in stream order
 */
record RecognitionRequest(
        @NotEmpty(message = "At least one Opus packet is required")
        List<@NotNull String> packets
) {
}
