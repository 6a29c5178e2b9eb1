package com.phillippitts.streamasr.service.session;

import com.phillippitts.streamasr.domain.RecognitionResult;

import java.util.List;

/**
 * Recognizes a recording of Opus voice packets against the remote service.
 *
 * <p>Each call is an independent session with its own connection, request id and decoder.
 * Service, transport and decode failures are returned inside the {@link RecognitionResult};
 * nothing is thrown for them.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * RecognitionResult result = recognizer.recognize(packets);
 * result.text().ifPresent(text -> ...);
 * }</pre>
 *
 * @see RecognitionSession
 */
public interface StreamingRecognizer {

    /**
     * Runs one session on the calling thread.
     *
     * @param packets Opus packets in stream order
     * @return recognized text, no-speech, or a failure
     * @throws NullPointerException if packets is null
     */
    RecognitionResult recognize(List<byte[]> packets);

    /**
     * Runs one session on the recognizer's executor.
     *
     * @param packets Opus packets in stream order
     * @return handle to await or abort the session
     * @throws NullPointerException if packets is null
     */
    RecognitionHandle recognizeAsync(List<byte[]> packets);
}
