package com.phillippitts.streamasr.service.protocol;

import org.json.JSONObject;

import java.util.Objects;

/**
 * Decoded payload of a server frame: absent, a JSON document, or raw text.
 */
public sealed interface ResponsePayload
        permits ResponsePayload.Absent, ResponsePayload.JsonPayload, ResponsePayload.TextPayload {

    /** Shared instance for frames without a payload. */
    Absent ABSENT = new Absent();

    /** No payload was present, or serialization was {@link Serialization#NONE}. */
    record Absent() implements ResponsePayload {
    }

    /** Payload serialized as JSON. */
    record JsonPayload(JSONObject document) implements ResponsePayload {
        public JsonPayload {
            Objects.requireNonNull(document, "document");
        }
    }

    /** Payload with a serialization this client does not interpret, kept as UTF-8 text. */
    record TextPayload(String text) implements ResponsePayload {
        public TextPayload {
            Objects.requireNonNull(text, "text");
        }
    }
}
