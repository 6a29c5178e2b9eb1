package com.phillippitts.streamasr.presentation.controller;

import com.phillippitts.streamasr.domain.RecognitionResult;

/**
 * Successful recognition as returned to HTTP clients.
 *
 * @param text      recognized text; empty string when no speech was detected
 * @param noSpeech  true if the service recognized no speech
 * @param sessionId request id used with the recognition service
 * @param elapsedMs session duration
 */
record RecognitionResponse(String text, boolean noSpeech, String sessionId, long elapsedMs) {

    static RecognitionResponse from(RecognitionResult result) {
        return new RecognitionResponse(result.text().orElse(""), result.isNoSpeech(),
                result.sessionId(), result.elapsedMs());
    }
}
