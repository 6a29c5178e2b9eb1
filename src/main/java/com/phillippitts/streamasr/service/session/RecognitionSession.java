package com.phillippitts.streamasr.service.session;

import com.phillippitts.streamasr.domain.RecognitionResult;
import com.phillippitts.streamasr.domain.SessionFailure;
import com.phillippitts.streamasr.domain.SessionState;
import com.phillippitts.streamasr.exception.ConnectionException;
import com.phillippitts.streamasr.exception.FrameDecodeException;
import com.phillippitts.streamasr.exception.RemoteServiceException;
import com.phillippitts.streamasr.exception.StreamAsrException;
import com.phillippitts.streamasr.exception.TransportException;
import com.phillippitts.streamasr.exception.UnexpectedSessionException;
import com.phillippitts.streamasr.service.audio.AudioChunker;
import com.phillippitts.streamasr.service.audio.AudioContainer;
import com.phillippitts.streamasr.service.audio.Chunk;
import com.phillippitts.streamasr.service.protocol.DecodedResponse;
import com.phillippitts.streamasr.service.protocol.FrameCodec;
import com.phillippitts.streamasr.service.protocol.ResponsePayload;
import com.phillippitts.streamasr.service.protocol.SessionRequestConfig;
import com.phillippitts.streamasr.service.transport.AsrTransport;
import com.phillippitts.streamasr.service.transport.AsrTransportFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * One recognition session against the remote service: connect, send the configuration frame,
 * stream the audio in chunks and read the final result.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → CONNECTED        (open transport)
 * CONNECTED → CONFIG_SENT (send FULL_REQUEST)
 * CONFIG_SENT → STREAMING (configuration acknowledged with the success code)
 * STREAMING → AWAITING_RESULT (every chunk sent, the last one flagged final)
 * AWAITING_RESULT → DONE  (final response parsed)
 * any non-terminal → FAILED
 * </pre>
 *
 * <p>Each transition is a method returning a {@link StepResult}; a failure is recorded together
 * with the state the session was in, so callers can tell a rejected configuration from a
 * rejected result. The transport is closed when {@link #run(AudioContainer)} returns, whatever
 * state was reached.
 *
 * <p><b>Thread Safety:</b> {@link #run(AudioContainer)} is called once, from one thread.
 * {@link #abort()} and {@link #state()} may be called from any thread.
 */
public final class RecognitionSession {

    private static final Logger LOG = LogManager.getLogger(RecognitionSession.class);

    static final String REQUEST_ID_KEY = "reqid";
    static final String STATE_KEY = "sessionState";

    private final AsrSessionSettings settings;
    private final AsrTransportFactory transportFactory;
    private final SessionRequestConfig request;

    private volatile SessionState state = SessionState.IDLE;
    private volatile AsrTransport transport;
    private volatile boolean aborted;
    private boolean started;

    public RecognitionSession(AsrSessionSettings settings, AsrTransportFactory transportFactory) {
        this(settings, transportFactory, SessionRequestConfig.fresh(settings.appId(), settings.cluster(),
                settings.accessToken(), settings.language()));
    }

    RecognitionSession(AsrSessionSettings settings, AsrTransportFactory transportFactory,
                       SessionRequestConfig request) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
        this.request = Objects.requireNonNull(request, "request");
    }

    /** @return request id sent to the service, also used as the session id */
    public String sessionId() {
        return request.reqId();
    }

    public SessionState state() {
        return state;
    }

    /**
     * Runs the session to completion. Never throws for service, transport or decode failures;
     * they are returned inside the result.
     *
     * @param audio WAV container to stream
     * @return recognized text, no-speech, or a failure tagged with the state it occurred in
     * @throws IllegalStateException if the session was already run
     */
    public RecognitionResult run(AudioContainer audio) {
        Objects.requireNonNull(audio, "audio");
        synchronized (this) {
            if (started) {
                throw new IllegalStateException("Session " + sessionId() + " was already run");
            }
            started = true;
        }

        String previousRequestId = ThreadContext.get(REQUEST_ID_KEY);
        String previousState = ThreadContext.get(STATE_KEY);
        ThreadContext.put(REQUEST_ID_KEY, sessionId());
        long start = System.nanoTime();
        try {
            LOG.info("Recognition session started: endpoint={}, audioBytes={}",
                    settings.endpoint(), audio.length());
            StepResult step = connect();
            if (!step.failed()) {
                step = enter(step, this::sendConfig);
            }
            if (!step.failed()) {
                step = enter(step, this::awaitConfigAck);
            }
            if (!step.failed()) {
                step = enter(step, () -> streamAudio(audio));
            }
            if (!step.failed()) {
                step = enter(step, this::awaitResult);
            }
            return finish(step, start);
        } catch (RuntimeException e) {
            return finish(StepResult.fail(new UnexpectedSessionException(e)), start);
        } finally {
            closeTransport();
            restore(REQUEST_ID_KEY, previousRequestId);
            restore(STATE_KEY, previousState);
        }
    }

    /**
     * Tears the connection down from another thread. A blocked send or receive fails with a
     * {@link TransportException} at whatever state the session is in; a session that has not
     * connected yet fails right after connecting.
     */
    public void abort() {
        aborted = true;
        AsrTransport current = transport;
        if (current != null) {
            LOG.info("Aborting recognition session {} in state {}", sessionId(), state);
            current.abort();
        }
    }

    private StepResult enter(StepResult previous, Step next) {
        moveTo(previous.next());
        return next.execute();
    }

    private void moveTo(SessionState next) {
        state = next;
        ThreadContext.put(STATE_KEY, next.name());
    }

    StepResult connect() {
        moveTo(SessionState.IDLE);
        Map<String, String> headers = Map.of("Authorization", settings.authorizationHeader());
        try {
            transport = transportFactory.open(settings.endpoint(), headers, settings.connectTimeout());
        } catch (ConnectionException e) {
            return StepResult.fail(e);
        }
        if (aborted) {
            transport.abort();
            return StepResult.fail(new TransportException("Session aborted before configuration was sent"));
        }
        return StepResult.advance(SessionState.CONNECTED);
    }

    StepResult sendConfig() {
        LOG.debug("Sending configuration: {}", request);
        try {
            transport.send(FrameCodec.encodeFullRequest(request));
        } catch (TransportException e) {
            return StepResult.fail(e);
        }
        return StepResult.advance(SessionState.CONFIG_SENT);
    }

    StepResult awaitConfigAck() {
        byte[] frame;
        DecodedResponse response;
        try {
            frame = transport.receive(settings.receiveTimeout());
            response = FrameCodec.decodeFrame(frame);
        } catch (TransportException | FrameDecodeException e) {
            return StepResult.fail(e);
        }
        if (response.isError()) {
            return StepResult.fail(errorFrame(response));
        }
        ResponsePayload payload = response.payload();
        if (payload instanceof ResponsePayload.Absent) {
            return StepResult.advance(SessionState.STREAMING);
        }
        if (payload instanceof ResponsePayload.TextPayload) {
            return StepResult.fail(new FrameDecodeException(
                    "Configuration response is not a JSON object", frame.length));
        }
        JSONObject json = response.json().orElseThrow();
        try {
            long code = statusCode(json, frame.length);
            if (code != settings.successCode()) {
                return StepResult.fail(new RemoteServiceException(code, json.optString("message", null)));
            }
        } catch (FrameDecodeException e) {
            return StepResult.fail(e);
        }
        return StepResult.advance(SessionState.STREAMING);
    }

    StepResult streamAudio(AudioContainer audio) {
        int segmentSize = audio.segmentSize(settings.segmentDurationMs());
        Iterator<Chunk> chunks = AudioChunker.split(audio.bytes(), segmentSize);
        int sent = 0;
        while (chunks.hasNext()) {
            Chunk chunk = chunks.next();
            try {
                transport.send(FrameCodec.encodeAudioChunk(chunk));
            } catch (TransportException e) {
                return StepResult.fail(e);
            }
            sent++;
            LOG.debug("Sent audio chunk {} ({} bytes, last={})", sent, chunk.length(), chunk.last());
        }
        LOG.debug("Streamed {} chunks with segment size {}", sent, segmentSize);
        return StepResult.advance(SessionState.AWAITING_RESULT);
    }

    StepResult awaitResult() {
        byte[] frame;
        DecodedResponse response;
        try {
            frame = transport.receive(settings.receiveTimeout());
            response = FrameCodec.decodeFrame(frame);
        } catch (TransportException | FrameDecodeException e) {
            return StepResult.fail(e);
        }
        if (response.isError()) {
            return StepResult.fail(errorFrame(response));
        }
        Optional<JSONObject> json = response.json();
        if (json.isEmpty()) {
            return StepResult.fail(new FrameDecodeException("Final response carries no JSON payload", frame.length));
        }
        try {
            long code = statusCode(json.get(), frame.length);
            if (code != settings.successCode()) {
                return StepResult.fail(new RemoteServiceException(code, json.get().optString("message", null)));
            }
            return StepResult.done(firstText(json.get(), frame.length));
        } catch (FrameDecodeException e) {
            return StepResult.fail(e);
        }
    }

    private RecognitionResult finish(StepResult step, long startNanos) {
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        if (step.failed()) {
            StreamAsrException error = step.failure().orElseThrow();
            SessionState failedIn = state.isTerminal() ? SessionState.IDLE : state;
            moveTo(SessionState.FAILED);
            LOG.error("Recognition session failed in state {} after {} ms: {}",
                    failedIn, elapsedMs, error.getMessage(), error);
            return RecognitionResult.failed(sessionId(), new SessionFailure(failedIn, error), elapsedMs);
        }
        moveTo(SessionState.DONE);
        LOG.info("Recognition session finished in {} ms (speech={})", elapsedMs, step.text().isPresent());
        return step.text()
                .map(text -> RecognitionResult.recognized(sessionId(), text, elapsedMs))
                .orElseGet(() -> RecognitionResult.noSpeech(sessionId(), elapsedMs));
    }

    private void closeTransport() {
        AsrTransport current = transport;
        if (current != null) {
            current.close();
        }
    }

    private static RemoteServiceException errorFrame(DecodedResponse response) {
        String message = null;
        if (response.payload() instanceof ResponsePayload.JsonPayload jp) {
            message = jp.document().optString("message", null);
        } else if (response.payload() instanceof ResponsePayload.TextPayload tp) {
            message = tp.text();
        }
        return new RemoteServiceException(response.errorCode().orElse(0L), message);
    }

    private static long statusCode(JSONObject json, int frameLength) {
        if (!json.has("code")) {
            throw new FrameDecodeException("Response carries no status code", frameLength);
        }
        try {
            return json.getLong("code");
        } catch (JSONException e) {
            throw new FrameDecodeException("Status code is not a number: " + json.opt("code"), frameLength, e);
        }
    }

    /** First hypothesis text; empty when the service recognized no speech. */
    private static Optional<String> firstText(JSONObject json, int frameLength) {
        JSONArray results = json.optJSONArray("result");
        if (results == null || results.isEmpty()) {
            return Optional.empty();
        }
        JSONObject first = results.optJSONObject(0);
        if (first == null) {
            throw new FrameDecodeException("Result entry is not an object", frameLength);
        }
        String text = first.optString("text", "");
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            ThreadContext.remove(key);
        } else {
            ThreadContext.put(key, previous);
        }
    }

    @FunctionalInterface
    private interface Step {
        StepResult execute();
    }
}
