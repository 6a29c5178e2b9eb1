package com.phillippitts.streamasr.service.session;

import com.phillippitts.streamasr.domain.RecognitionResult;
import com.phillippitts.streamasr.domain.SessionFailure;
import com.phillippitts.streamasr.domain.SessionState;
import com.phillippitts.streamasr.exception.ConnectionException;
import com.phillippitts.streamasr.exception.FrameDecodeException;
import com.phillippitts.streamasr.exception.RemoteServiceException;
import com.phillippitts.streamasr.exception.TransportException;
import com.phillippitts.streamasr.exception.UnexpectedSessionException;
import com.phillippitts.streamasr.service.audio.AudioContainer;
import com.phillippitts.streamasr.service.protocol.FrameHeader;
import com.phillippitts.streamasr.service.protocol.MessageType;
import com.phillippitts.streamasr.service.protocol.SequenceFlag;
import com.phillippitts.streamasr.service.transport.AsrTransportFactory;
import com.phillippitts.streamasr.testutil.FakeAsrTransport;
import com.phillippitts.streamasr.testutil.ServerFrames;
import org.apache.logging.log4j.ThreadContext;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static com.phillippitts.streamasr.service.session.SessionTestSupport.audio;
import static com.phillippitts.streamasr.service.session.SessionTestSupport.settings;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class RecognitionSessionTest {

    private FakeAsrTransport transport;

    @BeforeEach
    void setUp() {
        transport = new FakeAsrTransport();
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void recognizesTextFromFinalResponse() {
        transport.respondWith(ServerFrames.configAck(1000)).respondWith(ServerFrames.finalResult("你好"));
        RecognitionSession session = new RecognitionSession(settings(), transport.factory());

        RecognitionResult result = session.run(audio(3));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.text()).contains("你好");
        assertThat(result.sessionId()).isEqualTo(session.sessionId());
        assertThat(session.state()).isEqualTo(SessionState.DONE);
        assertThat(transport.isClosed()).isTrue();
    }

    @Test
    void opensConnectionWithBearerHeader() {
        transport.respondWith(ServerFrames.configAck(1000)).respondWith(ServerFrames.finalNoSpeech());

        new RecognitionSession(settings(), transport.factory()).run(audio(1));

        assertThat(transport.openedEndpoint()).isEqualTo(SessionTestSupport.ENDPOINT);
        assertThat(transport.openedHeaders()).containsEntry("Authorization", "Bearer; " + SessionTestSupport.TOKEN);
        assertThat(transport.openedConnectTimeout()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void sendsConfigurationThenAudioWithFinalFlagOnLastChunkOnly() {
        transport.respondWith(ServerFrames.configAck(1000)).respondWith(ServerFrames.finalResult("ok"));
        // 100 ms segments = 3200 bytes; 5 frames of 1920 bytes + 44 header bytes = 9644 bytes
        RecognitionSession session = new RecognitionSession(settings(100, Duration.ofSeconds(2)),
                transport.factory());
        AudioContainer audio = audio(5);

        session.run(audio);

        List<byte[]> sent = transport.sentFrames();
        assertThat(sent).hasSize(1 + 4);
        FrameHeader config = ServerFrames.requestHeader(sent.get(0));
        assertThat(config.messageType()).isEqualTo(MessageType.FULL_REQUEST.code());
        JSONObject configJson = ServerFrames.requestJson(sent.get(0));
        assertThat(configJson.getJSONObject("request").getString("reqid")).isEqualTo(session.sessionId());
        assertThat(configJson.getJSONObject("app").getString("token")).isEqualTo(SessionTestSupport.TOKEN);

        ByteArrayOutputStream streamed = new ByteArrayOutputStream();
        for (int i = 1; i < sent.size(); i++) {
            FrameHeader header = ServerFrames.requestHeader(sent.get(i));
            assertThat(header.messageType()).isEqualTo(MessageType.AUDIO_ONLY_REQUEST.code());
            int expectedFlag = i == sent.size() - 1 ? SequenceFlag.FINAL_SEGMENT.code() : SequenceFlag.NONE.code();
            assertThat(header.flags()).isEqualTo(expectedFlag);
            streamed.writeBytes(ServerFrames.requestPayload(sent.get(i)));
        }
        assertThat(streamed.toByteArray()).isEqualTo(audio.bytes());
    }

    @Test
    void emptyResultListMeansNoSpeech() {
        transport.respondWith(ServerFrames.configAck(1000)).respondWith(ServerFrames.finalNoSpeech());

        RecognitionResult result = new RecognitionSession(settings(), transport.factory()).run(audio(1));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isNoSpeech()).isTrue();
        assertThat(result.text()).isEmpty();
        assertThat(result.failure()).isEmpty();
    }

    @Test
    void emptyTextMeansNoSpeech() {
        transport.respondWith(ServerFrames.configAck(1000)).respondWith(ServerFrames.finalResult(""));

        RecognitionResult result = new RecognitionSession(settings(), transport.factory()).run(audio(1));

        assertThat(result.isNoSpeech()).isTrue();
    }

    @Test
    void missingResultFieldMeansNoSpeech() {
        transport.respondWith(ServerFrames.configAck(1000))
                .respondWith(ServerFrames.fullResponse(new JSONObject().put("code", 1000)));

        RecognitionResult result = new RecognitionSession(settings(), transport.factory()).run(audio(1));

        assertThat(result.isNoSpeech()).isTrue();
    }

    @Test
    void rejectedConfigurationFailsBeforeAnyAudioIsSent() {
        transport.respondWith(ServerFrames.configAck(1013));

        RecognitionResult result = new RecognitionSession(settings(), transport.factory()).run(audio(3));

        SessionFailure failure = result.failure().orElseThrow();
        assertThat(failure.state()).isEqualTo(SessionState.CONFIG_SENT);
        assertThat(failure.error()).isInstanceOf(RemoteServiceException.class);
        assertThat(((RemoteServiceException) failure.error()).getCode()).isEqualTo(1013);
        assertThat(transport.sentFrames()).hasSize(1);
        assertThat(transport.isClosed()).isTrue();
    }

    @Test
    void errorFrameOnConfigurationCarriesItsCode() {
        transport.respondWith(ServerFrames.errorResponse(45000001, "invalid token"));

        RecognitionResult result = new RecognitionSession(settings(), transport.factory()).run(audio(1));

        SessionFailure failure = result.failure().orElseThrow();
        assertThat(failure.state()).isEqualTo(SessionState.CONFIG_SENT);
        RemoteServiceException error = (RemoteServiceException) failure.error();
        assertThat(error.getCode()).isEqualTo(45000001L);
        assertThat(error.getServiceMessage()).isEqualTo("invalid token");
    }

    @Test
    void acknowledgementWithoutPayloadProceeds() {
        transport.respondWith(ServerFrames.emptyFullResponse()).respondWith(ServerFrames.finalResult("hi"));

        RecognitionResult result = new RecognitionSession(settings(), transport.factory()).run(audio(1));

        assertThat(result.text()).contains("hi");
    }

    @Test
    void acknowledgementWithoutStatusCodeIsADecodeFailure() {
        transport.respondWith(ServerFrames.fullResponse(new JSONObject().put("message", "?")));

        RecognitionResult result = new RecognitionSession(settings(), transport.factory()).run(audio(1));

        SessionFailure failure = result.failure().orElseThrow();
        assertThat(failure.error()).isInstanceOf(FrameDecodeException.class);
        assertThat(failure.state()).isEqualTo(SessionState.CONFIG_SENT);
    }

    @Test
    void acknowledgementThatIsAJsonArrayIsADecodeFailure() {
        transport.respondWith(ServerFrames.fullResponse("[1000]"));

        RecognitionResult result = new RecognitionSession(settings(), transport.factory()).run(audio(1));

        SessionFailure failure = result.failure().orElseThrow();
        assertThat(failure.error()).isInstanceOf(FrameDecodeException.class)
                .hasMessageContaining("JSON object");
        assertThat(failure.state()).isEqualTo(SessionState.CONFIG_SENT);
    }

    @Test
    void nonSuccessFinalCodeFailsAwaitingResult() {
        transport.respondWith(ServerFrames.configAck(1000))
                .respondWith(ServerFrames.fullResponse(new JSONObject().put("code", 1020).put("message", "busy")));

        RecognitionResult result = new RecognitionSession(settings(), transport.factory()).run(audio(1));

        SessionFailure failure = result.failure().orElseThrow();
        assertThat(failure.state()).isEqualTo(SessionState.AWAITING_RESULT);
        assertThat(failure.kind()).isEqualTo("remote");
        assertThat(((RemoteServiceException) failure.error()).getServiceMessage()).isEqualTo("busy");
    }

    @Test
    void errorFrameOnResultFailsAwaitingResult() {
        transport.respondWith(ServerFrames.configAck(1000)).respondWith(ServerFrames.errorResponse(1022, "x"));

        RecognitionResult result = new RecognitionSession(settings(), transport.factory()).run(audio(1));

        assertThat(result.failure().orElseThrow().state()).isEqualTo(SessionState.AWAITING_RESULT);
        assertThat(result.failure().get().error()).isInstanceOf(RemoteServiceException.class);
    }

    @Test
    void finalResponseWithoutPayloadIsADecodeFailure() {
        transport.respondWith(ServerFrames.configAck(1000)).respondWith(ServerFrames.emptyFullResponse());

        RecognitionResult result = new RecognitionSession(settings(), transport.factory()).run(audio(1));

        assertThat(result.failure().orElseThrow().error()).isInstanceOf(FrameDecodeException.class);
        assertThat(result.failure().get().state()).isEqualTo(SessionState.AWAITING_RESULT);
    }

    @Test
    void receiveDeadlineSurfacesAsTimeout() {
        RecognitionSession session = new RecognitionSession(settings(15_000, Duration.ofMillis(100)),
                transport.factory());

        RecognitionResult result = session.run(audio(1));

        SessionFailure failure = result.failure().orElseThrow();
        assertThat(failure.error()).isInstanceOf(TransportException.class);
        assertThat(((TransportException) failure.error()).isTimeout()).isTrue();
        assertThat(failure.kind()).isEqualTo("timeout");
        assertThat(failure.state()).isEqualTo(SessionState.CONFIG_SENT);
        assertThat(session.state()).isEqualTo(SessionState.FAILED);
        assertThat(transport.isClosed()).isTrue();
    }

    @Test
    void connectionFailureFailsInIdle() {
        AsrTransportFactory refusing = (uri, headers, timeout) -> {
            throw new ConnectionException(uri.toString(), "connection refused");
        };

        RecognitionResult result = new RecognitionSession(settings(), refusing).run(audio(1));

        SessionFailure failure = result.failure().orElseThrow();
        assertThat(failure.state()).isEqualTo(SessionState.IDLE);
        assertThat(failure.kind()).isEqualTo("connection");
    }

    @Test
    void sendFailureWhileStreamingClosesTransport() {
        transport.respondWith(ServerFrames.configAck(1000)).failSendAt(2);
        RecognitionSession session = new RecognitionSession(settings(100, Duration.ofSeconds(2)),
                transport.factory());

        RecognitionResult result = session.run(audio(5));

        SessionFailure failure = result.failure().orElseThrow();
        assertThat(failure.state()).isEqualTo(SessionState.STREAMING);
        assertThat(failure.error()).isInstanceOf(TransportException.class);
        assertThat(transport.sentFrames()).hasSize(2);
        assertThat(transport.isClosed()).isTrue();
    }

    @Test
    void unanticipatedExceptionBecomesUnexpectedFailure() {
        IllegalStateException boom = new IllegalStateException("boom");
        transport.failReceiveWith(boom);

        RecognitionResult result = new RecognitionSession(settings(), transport.factory()).run(audio(1));

        SessionFailure failure = result.failure().orElseThrow();
        assertThat(failure.error()).isInstanceOf(UnexpectedSessionException.class).hasCause(boom);
        assertThat(failure.kind()).isEqualTo("unknown");
        assertThat(failure.state()).isEqualTo(SessionState.CONFIG_SENT);
        assertThat(transport.isClosed()).isTrue();
    }

    @Test
    void abortWakesBlockedReceive() {
        RecognitionSession session = new RecognitionSession(settings(15_000, Duration.ofSeconds(30)),
                transport.factory());

        CompletableFuture<RecognitionResult> future = CompletableFuture.supplyAsync(() -> session.run(audio(1)));
        await().atMost(5, SECONDS).until(() -> session.state() == SessionState.CONFIG_SENT);
        session.abort();

        RecognitionResult result = future.orTimeout(5, SECONDS).join();
        SessionFailure failure = result.failure().orElseThrow();
        assertThat(failure.kind()).isEqualTo("transport");
        assertThat(failure.state()).isEqualTo(SessionState.CONFIG_SENT);
        assertThat(transport.wasAborted()).isTrue();
        assertThat(transport.isClosed()).isTrue();
    }

    @Test
    void abortBeforeRunFailsRightAfterConnecting() {
        transport.respondWith(ServerFrames.configAck(1000)).respondWith(ServerFrames.finalResult("late"));
        RecognitionSession session = new RecognitionSession(settings(), transport.factory());
        session.abort();

        RecognitionResult result = session.run(audio(1));

        assertThat(result.failure().orElseThrow().error()).isInstanceOf(TransportException.class);
        assertThat(transport.sentFrames()).isEmpty();
        assertThat(transport.isClosed()).isTrue();
    }

    @Test
    void sessionRunsOnlyOnce() {
        transport.respondWith(ServerFrames.configAck(1000)).respondWith(ServerFrames.finalNoSpeech());
        RecognitionSession session = new RecognitionSession(settings(), transport.factory());
        session.run(audio(1));

        assertThatThrownBy(() -> session.run(audio(1))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void requestIdIsInThreadContextDuringSessionAndRestoredAfter() {
        AtomicReference<String> seen = new AtomicReference<>();
        AsrTransportFactory delegate = transport.factory();
        AsrTransportFactory recording = (uri, headers, timeout) -> {
            seen.set(ThreadContext.get("reqid"));
            return delegate.open(uri, headers, timeout);
        };
        transport.respondWith(ServerFrames.configAck(1000)).respondWith(ServerFrames.finalNoSpeech());
        ThreadContext.put("reqid", "outer");
        RecognitionSession session = new RecognitionSession(settings(), recording);

        session.run(audio(1));

        assertThat(seen.get()).isEqualTo(session.sessionId());
        assertThat(ThreadContext.get("reqid")).isEqualTo("outer");
        assertThat(ThreadContext.get("sessionState")).isNull();
    }
}
