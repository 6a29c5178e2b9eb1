package com.phillippitts.streamasr.service.protocol;

import org.json.JSONObject;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Immutable result of decoding one server frame.
 *
 * @param header         parsed frame header
 * @param sequenceNumber signed sequence number (ACK frames only)
 * @param errorCode      unsigned error code (ERROR_RESPONSE frames only)
 * @param payload        decompressed and deserialized payload
 * @param payloadSize    payload size as declared on the wire, before decompression
 */
public record DecodedResponse(
        FrameHeader header,
        OptionalInt sequenceNumber,
        OptionalLong errorCode,
        ResponsePayload payload,
        OptionalLong payloadSize
) {

    public DecodedResponse {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(sequenceNumber, "sequenceNumber");
        Objects.requireNonNull(errorCode, "errorCode");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(payloadSize, "payloadSize");
    }

    /** Response for a message type whose body is not interpreted. */
    static DecodedResponse headerOnly(FrameHeader header) {
        return new DecodedResponse(header, OptionalInt.empty(), OptionalLong.empty(),
                ResponsePayload.ABSENT, OptionalLong.empty());
    }

    /** @return raw 4-bit message type code */
    public int messageTypeCode() {
        return header.messageType();
    }

    /** @return message type, or empty if the code is unknown to this client */
    public Optional<MessageType> messageType() {
        return MessageType.fromCode(header.messageType());
    }

    public boolean isError() {
        return header.messageType() == MessageType.ERROR_RESPONSE.code();
    }

    /** @return the JSON document if the payload was JSON */
    public Optional<JSONObject> json() {
        if (payload instanceof ResponsePayload.JsonPayload jp) {
            return Optional.of(jp.document());
        }
        return Optional.empty();
    }
}
