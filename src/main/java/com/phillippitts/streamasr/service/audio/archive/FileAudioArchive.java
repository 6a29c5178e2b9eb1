package com.phillippitts.streamasr.service.audio.archive;

import com.phillippitts.streamasr.service.audio.AudioContainer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Writes each session's container to {@code asr_{sessionId}_{uuid}.wav} under a directory.
 */
public final class FileAudioArchive implements AudioArchive {

    private static final Logger LOG = LogManager.getLogger(FileAudioArchive.class);

    private final Path directory;

    /**
     * @param directory output directory, created if missing
     * @throws UncheckedIOException if the directory cannot be created
     */
    public FileAudioArchive(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create audio archive directory " + directory, e);
        }
    }

    @Override
    public Optional<Path> archive(String sessionId, AudioContainer container) {
        Path file = directory.resolve("asr_" + sessionId + "_" + UUID.randomUUID() + ".wav");
        try {
            Files.write(file, container.bytes());
            LOG.debug("Archived session audio: file={}, bytes={}", file, container.length());
            return Optional.of(file);
        } catch (IOException e) {
            LOG.warn("Failed to archive session audio to {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public Path getDirectory() {
        return directory;
    }
}
