package com.phillippitts.streamasr.service.session;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AsrSessionSettingsTest {

    @Test
    void authorizationHeaderUsesBearerSemicolonScheme() {
        assertThat(SessionTestSupport.settings().authorizationHeader())
                .isEqualTo("Bearer; " + SessionTestSupport.TOKEN);
    }

    @Test
    void toStringOmitsToken() {
        assertThat(SessionTestSupport.settings().toString()).doesNotContain(SessionTestSupport.TOKEN);
    }

    @Test
    void rejectsNonPositiveSegmentDuration() {
        assertThatThrownBy(() -> SessionTestSupport.settings(0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsZeroTimeout() {
        assertThatThrownBy(() -> new AsrSessionSettings(URI.create("ws://localhost/asr"), "a", "c", "t", "zh-CN",
                1000, 100, Duration.ZERO, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
