package com.phillippitts.streamasr.config.properties;

import com.phillippitts.streamasr.service.session.AsrSessionSettings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.time.Duration;

/**
 * Configuration properties for the remote recognition service.
 * Binds to properties prefixed with "asr".
 *
 * <p>Example application.properties:
 * <pre>
 * asr.app-id=${ASR_APP_ID}
 * asr.cluster=${ASR_CLUSTER}
 * asr.access-token=${ASR_ACCESS_TOKEN}
 * asr.language=zh-CN
 * asr.receive-timeout=10s
 * asr.output-dir=tmp/asr
 * </pre>
 *
 * @param appId             application id issued by the service
 * @param cluster           service cluster
 * @param accessToken       access token
 * @param scheme            URI scheme ("wss", or "ws" for a local test server)
 * @param host              service host
 * @param path              service path
 * @param language          recognition language
 * @param successCode       status code the service uses for success
 * @param segmentDurationMs audio duration carried by one chunk, in milliseconds
 * @param connectTimeout    handshake deadline
 * @param receiveTimeout    deadline for each response frame
 * @param outputDir         directory for archived session audio; blank disables archiving
 */
@ConfigurationProperties(prefix = "asr")
@Validated
public record AsrServiceProperties(
        @NotBlank(message = "ASR app id must not be blank")
        String appId,

        @NotBlank(message = "ASR cluster must not be blank")
        String cluster,

        @NotBlank(message = "ASR access token must not be blank")
        String accessToken,

        @DefaultValue("wss")
        @NotBlank
        String scheme,

        @DefaultValue("openspeech.bytedance.com")
        @NotBlank(message = "ASR host must not be blank")
        String host,

        @DefaultValue("/api/v2/asr")
        @NotBlank
        String path,

        @DefaultValue("zh-CN")
        @NotBlank(message = "Language must not be blank")
        String language,

        @DefaultValue("1000")
        long successCode,

        @DefaultValue("15000")
        @Positive(message = "Segment duration must be positive")
        int segmentDurationMs,

        @DefaultValue("5s")
        @NotNull
        Duration connectTimeout,

        @DefaultValue("10s")
        @NotNull
        Duration receiveTimeout,

        String outputDir
) {

    /** @return service endpoint, e.g. {@code wss://openspeech.bytedance.com/api/v2/asr} */
    public URI endpoint() {
        return URI.create(scheme + "://" + host + path);
    }

    public boolean archivingEnabled() {
        return outputDir != null && !outputDir.isBlank();
    }

    /** Immutable settings handed to each recognition session. */
    public AsrSessionSettings toSessionSettings() {
        return new AsrSessionSettings(endpoint(), appId, cluster, accessToken, language, successCode,
                segmentDurationMs, connectTimeout, receiveTimeout);
    }

    @Override
    public String toString() {
        return "AsrServiceProperties[endpoint=" + endpoint() + ", appId=" + appId + ", cluster=" + cluster
                + ", language=" + language + ", successCode=" + successCode
                + ", segmentDurationMs=" + segmentDurationMs + ", outputDir=" + outputDir + "]";
    }
}
