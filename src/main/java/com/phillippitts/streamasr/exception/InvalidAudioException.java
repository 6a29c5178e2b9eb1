package com.phillippitts.streamasr.exception;

/**
 * Thrown when audio data is malformed: an unreadable WAV header, an undecodable
 * base64 packet, or a container that does not match the 16kHz/16-bit/mono format.
 */
public class InvalidAudioException extends StreamAsrException {

    private final int audioSize;
    private final String reason;

    public InvalidAudioException(String reason) {
        super("Invalid audio data: " + reason);
        this.audioSize = 0;
        this.reason = reason;
    }

    public InvalidAudioException(int audioSize, String reason) {
        super("Invalid audio data (" + audioSize + " bytes): " + reason);
        this.audioSize = audioSize;
        this.reason = reason;
    }

    public int getAudioSize() {
        return audioSize;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String kind() {
        return "invalid_audio";
    }
}
