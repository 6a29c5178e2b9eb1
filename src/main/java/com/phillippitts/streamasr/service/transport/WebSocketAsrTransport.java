package com.phillippitts.streamasr.service.transport;

import com.phillippitts.streamasr.exception.ConnectionException;
import com.phillippitts.streamasr.exception.TransportException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.exceptions.WebsocketNotConnectedException;
import org.java_websocket.handshake.ServerHandshake;

import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * {@link AsrTransport} over a Java-WebSocket client.
 *
 * <p>Inbound messages are queued by the client's reader thread and handed out by
 * {@link #receive(Duration)}. A close (remote, local, or {@link #abort()}) enqueues a marker so a
 * blocked receive wakes up with a {@link TransportException} instead of waiting for its deadline.
 */
public final class WebSocketAsrTransport implements AsrTransport {

    private static final Logger LOG = LogManager.getLogger(WebSocketAsrTransport.class);

    /** Queued when the connection closes; compared by identity. */
    private static final byte[] CLOSED = new byte[0];

    private final URI endpoint;
    private final BlockingQueue<byte[]> inbound = new LinkedBlockingQueue<>();
    private final Client client;
    private volatile String closeReason;

    WebSocketAsrTransport(URI endpoint, Map<String, String> headers) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.client = new Client(endpoint, headers);
    }

    /**
     * Performs the WebSocket handshake.
     *
     * @throws ConnectionException if the handshake fails or does not finish in time
     */
    void connect(Duration timeout) {
        boolean connected;
        try {
            connected = client.connectBlocking(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            client.close();
            throw new ConnectionException(endpoint.toString(), "interrupted while connecting", e);
        }
        if (!connected) {
            client.close();
            String reason = closeReason != null ? closeReason : "handshake not completed within " + timeout;
            throw new ConnectionException(endpoint.toString(), reason);
        }
        LOG.debug("Connected to {}", endpoint);
    }

    @Override
    public void send(byte[] frame) {
        Objects.requireNonNull(frame, "frame");
        if (!client.isOpen()) {
            throw new TransportException("Cannot send, connection closed: " + describeClose());
        }
        try {
            client.send(frame);
        } catch (WebsocketNotConnectedException e) {
            throw new TransportException("Cannot send, connection closed: " + describeClose(), e);
        }
    }

    @Override
    public byte[] receive(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        byte[] message;
        try {
            message = inbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for a frame", e);
        }
        if (message == null) {
            throw new TransportException("No frame received within " + timeout.toMillis() + " ms", true);
        }
        if (message == CLOSED) {
            // keep the marker so later receives fail the same way
            inbound.offer(CLOSED);
            throw new TransportException("Connection closed while waiting for a frame: " + describeClose());
        }
        return message;
    }

    @Override
    public void abort() {
        if (closeReason == null) {
            closeReason = "aborted";
        }
        inbound.offer(CLOSED);
        client.close();
    }

    @Override
    public boolean isOpen() {
        return client.isOpen();
    }

    @Override
    public void close() {
        if (!client.isClosed() && !client.isClosing()) {
            client.close();
        }
    }

    private String describeClose() {
        return closeReason != null ? closeReason : "unknown reason";
    }

    private final class Client extends WebSocketClient {

        Client(URI uri, Map<String, String> headers) {
            super(uri, headers);
        }

        @Override
        public void onOpen(ServerHandshake handshake) {
            LOG.trace("Handshake completed: status={}", handshake.getHttpStatus());
        }

        @Override
        public void onMessage(ByteBuffer bytes) {
            byte[] message = new byte[bytes.remaining()];
            bytes.get(message);
            inbound.offer(message);
        }

        @Override
        public void onMessage(String message) {
            // the protocol is binary; hand text through so the codec reports it
            LOG.warn("Unexpected text message from {} ({} chars)", endpoint, message.length());
            inbound.offer(message.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public void onClose(int code, String reason, boolean remote) {
            if (closeReason == null) {
                closeReason = (remote ? "closed by server" : "closed locally") + " (code=" + code
                        + (reason == null || reason.isBlank() ? "" : ", reason=" + reason) + ")";
            }
            LOG.debug("Connection to {} {}", endpoint, closeReason);
            inbound.offer(CLOSED);
        }

        @Override
        public void onError(Exception ex) {
            if (closeReason == null) {
                closeReason = ex.getClass().getSimpleName() + ": " + ex.getMessage();
            }
            LOG.debug("WebSocket error on {}: {}", endpoint, ex.getMessage());
        }
    }
}
