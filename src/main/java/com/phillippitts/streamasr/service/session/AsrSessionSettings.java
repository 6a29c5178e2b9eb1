package com.phillippitts.streamasr.service.session;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings handed to every recognition session.
 *
 * @param endpoint          service URI (e.g., {@code wss://openspeech.bytedance.com/api/v2/asr})
 * @param appId             application id
 * @param cluster           service cluster
 * @param accessToken       access token, sent in the handshake and in the configuration frame
 * @param language          recognition language
 * @param successCode       status code the service uses for success
 * @param segmentDurationMs audio duration carried by one chunk
 * @param connectTimeout    handshake deadline
 * @param receiveTimeout    deadline for each receive
 */
public record AsrSessionSettings(
        URI endpoint,
        String appId,
        String cluster,
        String accessToken,
        String language,
        long successCode,
        int segmentDurationMs,
        Duration connectTimeout,
        Duration receiveTimeout
) {

    public AsrSessionSettings {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(appId, "appId");
        Objects.requireNonNull(cluster, "cluster");
        Objects.requireNonNull(accessToken, "accessToken");
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(receiveTimeout, "receiveTimeout");
        if (segmentDurationMs <= 0) {
            throw new IllegalArgumentException("segmentDurationMs must be positive, got: " + segmentDurationMs);
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()
                || receiveTimeout.isNegative() || receiveTimeout.isZero()) {
            throw new IllegalArgumentException("Timeouts must be positive");
        }
    }

    /** @return value of the Authorization handshake header */
    public String authorizationHeader() {
        return "Bearer; " + accessToken;
    }

    @Override
    public String toString() {
        return "AsrSessionSettings[endpoint=" + endpoint + ", appId=" + appId + ", cluster=" + cluster
                + ", language=" + language + ", successCode=" + successCode
                + ", segmentDurationMs=" + segmentDurationMs + ", connectTimeout=" + connectTimeout
                + ", receiveTimeout=" + receiveTimeout + "]";
    }
}
