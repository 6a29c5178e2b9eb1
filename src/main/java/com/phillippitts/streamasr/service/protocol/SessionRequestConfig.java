package com.phillippitts.streamasr.service.protocol;

import org.json.JSONObject;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.UUID;

import static com.phillippitts.streamasr.service.audio.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.streamasr.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.streamasr.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;

/**
 * JSON configuration document sent as the first frame of every session.
 *
 * <p>Identity fields come from configuration; {@code uid} and {@code reqid} are fresh random
 * values per session. The audio declaration is fixed: WAV container, 16 kHz, 16-bit, mono,
 * raw (uncompressed) samples.
 *
 * @param appId    application id issued by the service
 * @param cluster  service cluster name
 * @param token    access token
 * @param userId   per-session user id
 * @param reqId    per-session request id
 * @param language recognition language (e.g., "zh-CN")
 */
public record SessionRequestConfig(
        String appId,
        String cluster,
        String token,
        String userId,
        String reqId,
        String language
) {

    static final String AUDIO_FORMAT = "wav";
    static final String AUDIO_CODEC = "raw";

    public SessionRequestConfig {
        Objects.requireNonNull(appId, "appId");
        Objects.requireNonNull(cluster, "cluster");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(reqId, "reqId");
        Objects.requireNonNull(language, "language");
    }

    /**
     * Creates a configuration with fresh random user and request ids.
     */
    public static SessionRequestConfig fresh(String appId, String cluster, String token, String language) {
        return new SessionRequestConfig(appId, cluster, token,
                UUID.randomUUID().toString(), UUID.randomUUID().toString(), language);
    }

    /**
     * Renders the wire document:
     * {@code {app:{appid,cluster,token}, user:{uid}, request:{reqid,show_utterances,sequence},
     * audio:{format,rate,language,bits,channel,codec}}}.
     */
    public JSONObject toJson() {
        JSONObject app = new JSONObject()
                .put("appid", appId)
                .put("cluster", cluster)
                .put("token", token);
        JSONObject user = new JSONObject()
                .put("uid", userId);
        JSONObject request = new JSONObject()
                .put("reqid", reqId)
                .put("show_utterances", false)
                .put("sequence", 1);
        JSONObject audio = new JSONObject()
                .put("format", AUDIO_FORMAT)
                .put("rate", REQUIRED_SAMPLE_RATE)
                .put("language", language)
                .put("bits", REQUIRED_BITS_PER_SAMPLE)
                .put("channel", REQUIRED_CHANNELS)
                .put("codec", AUDIO_CODEC);
        return new JSONObject()
                .put("app", app)
                .put("user", user)
                .put("request", request)
                .put("audio", audio);
    }

    /** @return UTF-8 bytes of {@link #toJson()} */
    public byte[] toJsonBytes() {
        return toJson().toString().getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        // token stays out of logs
        return "SessionRequestConfig[appId=" + appId + ", cluster=" + cluster + ", userId=" + userId
                + ", reqId=" + reqId + ", language=" + language + "]";
    }
}
