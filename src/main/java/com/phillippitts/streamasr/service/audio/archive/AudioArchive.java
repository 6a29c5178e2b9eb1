package com.phillippitts.streamasr.service.audio.archive;

import com.phillippitts.streamasr.service.audio.AudioContainer;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Stores the WAV container of a session for later inspection.
 */
public interface AudioArchive {

    /**
     * Archives the container. Failures are reported by returning empty; they never fail a session.
     *
     * @param sessionId session identifier, used in the file name
     * @param container audio sent to the service
     * @return where the audio was stored, or empty if archiving is disabled or failed
     */
    Optional<Path> archive(String sessionId, AudioContainer container);

    /** Archive that stores nothing. */
    static AudioArchive disabled() {
        return (sessionId, container) -> Optional.empty();
    }
}
