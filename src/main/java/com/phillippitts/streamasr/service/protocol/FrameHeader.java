package com.phillippitts.streamasr.service.protocol;

import com.phillippitts.streamasr.exception.FrameDecodeException;

import java.util.Objects;

/**
 * The fixed 4-byte protocol header as a value, with the only pack/unpack pair for its
 * nibble layout.
 *
 * <pre>
 * byte 0: protocol version (4 bits) | header size in 4-byte words (4 bits)
 * byte 1: message type (4 bits)     | message-type-specific flags (4 bits)
 * byte 2: serialization (4 bits)    | compression (4 bits)
 * byte 3: reserved
 * </pre>
 *
 * <p>Fields are kept as raw nibble values so frames with codes this client does not
 * know still decode; use the enum lookups for interpretation.
 *
 * @param version       protocol version
 * @param headerWords   header size in 4-byte words (1 = no extensions)
 * @param messageType   message type code
 * @param flags         message-type-specific flags
 * @param serialization serialization method code
 * @param compression   compression method code
 * @param reserved      reserved byte
 */
public record FrameHeader(
        int version,
        int headerWords,
        int messageType,
        int flags,
        int serialization,
        int compression,
        int reserved
) {

    /** Size of the mandatory header word in bytes. */
    public static final int SIZE = 4;

    /** Protocol version written by this client. */
    public static final int PROTOCOL_VERSION = 0b0001;

    /** Header size written by this client: one word, no extensions. */
    public static final int DEFAULT_HEADER_WORDS = 0b0001;

    public FrameHeader {
        requireNibble("version", version);
        requireNibble("headerWords", headerWords);
        requireNibble("messageType", messageType);
        requireNibble("flags", flags);
        requireNibble("serialization", serialization);
        requireNibble("compression", compression);
        if (reserved < 0 || reserved > 0xFF) {
            throw new IllegalArgumentException("reserved must fit in one byte, got: " + reserved);
        }
    }

    /**
     * Header for a client request: version 1, no extensions, JSON serialization, gzip compression.
     */
    public static FrameHeader request(MessageType type, SequenceFlag flag) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(flag, "flag");
        return new FrameHeader(PROTOCOL_VERSION, DEFAULT_HEADER_WORDS, type.code(), flag.code(),
                Serialization.JSON.code(), Compression.GZIP.code(), 0x00);
    }

    /**
     * Packs this header into its 4-byte wire form.
     *
     * @return new 4-byte array
     */
    public byte[] pack() {
        return new byte[] {
                (byte) ((version << 4) | headerWords),
                (byte) ((messageType << 4) | flags),
                (byte) ((serialization << 4) | compression),
                (byte) reserved
        };
    }

    /**
     * Reads the header from the first four bytes of a frame.
     *
     * @param frame raw frame bytes
     * @return parsed header
     * @throws FrameDecodeException if the frame is shorter than {@link #SIZE}
     */
    public static FrameHeader unpack(byte[] frame) {
        Objects.requireNonNull(frame, "frame");
        if (frame.length < SIZE) {
            throw new FrameDecodeException("Frame shorter than protocol header", frame.length);
        }
        return new FrameHeader(
                (frame[0] >> 4) & 0x0F,
                frame[0] & 0x0F,
                (frame[1] >> 4) & 0x0F,
                frame[1] & 0x0F,
                (frame[2] >> 4) & 0x0F,
                frame[2] & 0x0F,
                frame[3] & 0xFF);
    }

    /** @return header length in bytes including extensions */
    public int headerLength() {
        return headerWords * SIZE;
    }

    private static void requireNibble(String name, int value) {
        if (value < 0 || value > 0x0F) {
            throw new IllegalArgumentException(name + " must fit in 4 bits, got: " + value);
        }
    }
}
