package com.phillippitts.streamasr.service.protocol;

import com.phillippitts.streamasr.exception.FrameDecodeException;
import com.phillippitts.streamasr.service.audio.Chunk;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Encoder and decoder for the framed binary ASR protocol.
 *
 * <p><b>Request frame layout:</b>
 * <pre>
 * ┌──────────────┬──────────────────────────┬───────────────────────────┐
 * │ header (4 B) │ payload length (4 B, BE) │ gzip-compressed payload   │
 * └──────────────┴──────────────────────────┴───────────────────────────┘
 * </pre>
 *
 * <p><b>Response bodies</b> (after the header and any header extension words):
 * <ul>
 *   <li>FULL_RESPONSE: signed payload size (4 B), payload</li>
 *   <li>ACK: signed sequence number (4 B), then if present unsigned payload size (4 B), payload</li>
 *   <li>ERROR_RESPONSE: unsigned error code (4 B), unsigned payload size (4 B), payload</li>
 *   <li>any other type: body is not interpreted</li>
 * </ul>
 *
 * <p>Decoding is lenient where the wire allows it: header extensions are skipped, unknown
 * serialization methods yield raw text, unknown compression methods pass bytes through, and the
 * declared payload size is reported as-is rather than checked against the bytes that follow.
 *
 * <p>Thread-safe: all methods are static and stateless.
 */
public final class FrameCodec {

    /** Size of the big-endian length, sequence and error-code fields. */
    static final int INT_FIELD_SIZE = 4;

    private FrameCodec() {}

    /**
     * Encodes a request header: version 1, one header word, JSON serialization, gzip compression.
     *
     * @param type message type
     * @param flag sequence flag
     * @return 4 header bytes
     */
    public static byte[] encodeHeader(MessageType type, SequenceFlag flag) {
        return FrameHeader.request(type, flag).pack();
    }

    /**
     * Builds a complete request frame: header, compressed length, gzip-compressed payload.
     *
     * @param type       message type
     * @param flag       sequence flag
     * @param rawPayload uncompressed payload bytes
     * @return frame ready to send
     */
    public static byte[] encodeRequestFrame(MessageType type, SequenceFlag flag, byte[] rawPayload) {
        Objects.requireNonNull(rawPayload, "rawPayload");
        byte[] header = encodeHeader(type, flag);
        byte[] compressed = gzip(rawPayload);
        return ByteBuffer.allocate(header.length + INT_FIELD_SIZE + compressed.length)
                .put(header)
                .putInt(compressed.length)
                .put(compressed)
                .array();
    }

    /** Encodes the session configuration as a FULL_REQUEST frame. */
    public static byte[] encodeFullRequest(SessionRequestConfig config) {
        Objects.requireNonNull(config, "config");
        return encodeRequestFrame(MessageType.FULL_REQUEST, SequenceFlag.NONE, config.toJsonBytes());
    }

    /** Encodes one audio chunk as an AUDIO_ONLY_REQUEST frame, flagged final if it is the last. */
    public static byte[] encodeAudioChunk(Chunk chunk) {
        Objects.requireNonNull(chunk, "chunk");
        SequenceFlag flag = chunk.last() ? SequenceFlag.FINAL_SEGMENT : SequenceFlag.NONE;
        return encodeRequestFrame(MessageType.AUDIO_ONLY_REQUEST, flag, chunk.bytes());
    }

    /**
     * Decodes a server frame.
     *
     * @param frame raw frame bytes as received from the transport
     * @return decoded response
     * @throws FrameDecodeException if the frame is truncated or its payload cannot be
     *                              decompressed or parsed
     */
    public static DecodedResponse decodeFrame(byte[] frame) {
        Objects.requireNonNull(frame, "frame");
        FrameHeader header = FrameHeader.unpack(frame);
        int bodyOffset = header.headerLength();
        if (bodyOffset < FrameHeader.SIZE || bodyOffset > frame.length) {
            throw new FrameDecodeException(
                    "Header declares " + header.headerWords() + " words but frame is shorter", frame.length);
        }
        ByteBuffer body = ByteBuffer.wrap(frame, bodyOffset, frame.length - bodyOffset).slice();

        OptionalInt sequence = OptionalInt.empty();
        OptionalLong errorCode = OptionalLong.empty();
        long declaredSize;
        int type = header.messageType();

        if (type == MessageType.FULL_RESPONSE.code()) {
            requireBody(body, INT_FIELD_SIZE, "FULL_RESPONSE", frame.length);
            declaredSize = body.getInt();
        } else if (type == MessageType.ACK.code()) {
            requireBody(body, INT_FIELD_SIZE, "ACK", frame.length);
            sequence = OptionalInt.of(body.getInt());
            if (body.remaining() < INT_FIELD_SIZE) {
                return new DecodedResponse(header, sequence, errorCode, ResponsePayload.ABSENT,
                        OptionalLong.empty());
            }
            declaredSize = Integer.toUnsignedLong(body.getInt());
        } else if (type == MessageType.ERROR_RESPONSE.code()) {
            requireBody(body, 2 * INT_FIELD_SIZE, "ERROR_RESPONSE", frame.length);
            errorCode = OptionalLong.of(Integer.toUnsignedLong(body.getInt()));
            declaredSize = Integer.toUnsignedLong(body.getInt());
        } else {
            return DecodedResponse.headerOnly(header);
        }

        byte[] payloadBytes = new byte[body.remaining()];
        body.get(payloadBytes);
        ResponsePayload payload = decodePayload(header, payloadBytes, frame.length);
        return new DecodedResponse(header, sequence, errorCode, payload, OptionalLong.of(declaredSize));
    }

    /**
     * Decodes a request frame as built by {@link #encodeRequestFrame}: header, compressed length,
     * payload. The inverse of encoding for every request type.
     *
     * @param frame raw request frame
     * @return header and decompressed payload
     * @throws FrameDecodeException if the frame is truncated, its declared length does not fit,
     *                              or the payload is not valid gzip
     */
    public static DecodedRequest decodeRequestFrame(byte[] frame) {
        Objects.requireNonNull(frame, "frame");
        FrameHeader header = FrameHeader.unpack(frame);
        int bodyOffset = header.headerLength();
        if (bodyOffset < FrameHeader.SIZE || bodyOffset > frame.length) {
            throw new FrameDecodeException(
                    "Header declares " + header.headerWords() + " words but frame is shorter", frame.length);
        }
        ByteBuffer body = ByteBuffer.wrap(frame, bodyOffset, frame.length - bodyOffset).slice();
        requireBody(body, INT_FIELD_SIZE, "request", frame.length);
        int length = body.getInt();
        if (length < 0 || length > body.remaining()) {
            throw new FrameDecodeException("Request declares " + Integer.toUnsignedLong(length)
                    + " payload bytes but carries " + body.remaining(), frame.length);
        }
        byte[] payload = new byte[length];
        body.get(payload);
        if (header.compression() == Compression.GZIP.code()) {
            payload = gunzip(payload, frame.length);
        }
        return new DecodedRequest(header, payload);
    }

    private static ResponsePayload decodePayload(FrameHeader header, byte[] bytes, int frameLength) {
        // an empty body carries nothing to decompress or parse
        if (bytes.length == 0) {
            return ResponsePayload.ABSENT;
        }
        if (header.compression() == Compression.GZIP.code()) {
            bytes = gunzip(bytes, frameLength);
        }
        int serialization = header.serialization();
        if (serialization == Serialization.NONE.code()) {
            return ResponsePayload.ABSENT;
        }
        String text = new String(bytes, StandardCharsets.UTF_8);
        if (serialization == Serialization.JSON.code()) {
            Object document = parseJson(text, frameLength);
            if (document instanceof JSONObject json) {
                return new ResponsePayload.JsonPayload(json);
            }
            // arrays and scalars are valid documents, surfaced as their raw text
            return new ResponsePayload.TextPayload(text);
        }
        return new ResponsePayload.TextPayload(text);
    }

    private static Object parseJson(String text, int frameLength) {
        JSONTokener tokener = new JSONTokener(text);
        try {
            Object value = tokener.nextValue();
            if (tokener.nextClean() != 0) {
                throw tokener.syntaxError("Trailing content after JSON value");
            }
            // the tokener accepts bare words as strings; JSON requires quotes
            if (value instanceof String && !text.strip().startsWith("\"")) {
                throw tokener.syntaxError("Unquoted text is not a JSON value");
            }
            return value;
        } catch (JSONException e) {
            throw new FrameDecodeException("Payload is not valid JSON: " + e.getMessage(), frameLength, e);
        }
    }

    static byte[] gzip(byte[] data) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream(Math.max(32, data.length / 2));
        try (OutputStream gz = new GZIPOutputStream(bos)) {
            gz.write(data);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to gzip payload: " + e.getMessage(), e);
        }
        return bos.toByteArray();
    }

    private static byte[] gunzip(byte[] data, int frameLength) {
        try (InputStream gz = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return gz.readAllBytes();
        } catch (IOException e) {
            throw new FrameDecodeException("Payload is not valid gzip: " + e.getMessage(), frameLength, e);
        }
    }

    private static void requireBody(ByteBuffer body, int minBytes, String type, int frameLength) {
        if (body.remaining() < minBytes) {
            throw new FrameDecodeException(type + " body needs " + minBytes + " bytes, got "
                    + body.remaining(), frameLength);
        }
    }
}
