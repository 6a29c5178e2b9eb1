package com.phillippitts.streamasr.service.transport;

import com.phillippitts.streamasr.exception.TransportException;

import java.time.Duration;

/**
 * Message-framed duplex connection to the recognition service, owned by exactly one session.
 *
 * <p>{@link #send(byte[])} and {@link #receive(Duration)} block the calling thread. They are
 * called from the session thread only; {@link #abort()} may be called from any thread and makes
 * a blocked or subsequent operation fail with {@link TransportException}.
 */
public interface AsrTransport extends AutoCloseable {

    /**
     * Sends one binary message.
     *
     * @param frame message bytes
     * @throws TransportException if the connection is closed or the write fails
     */
    void send(byte[] frame);

    /**
     * Waits for the next binary message.
     *
     * @param timeout maximum time to wait
     * @return message bytes
     * @throws TransportException if the connection closes, is aborted, or the deadline expires
     *                            ({@link TransportException#isTimeout()} is then true)
     */
    byte[] receive(Duration timeout);

    /**
     * Tears the connection down from any thread, failing pending and future operations.
     */
    void abort();

    boolean isOpen();

    /** Closes the connection. Idempotent; never throws. */
    @Override
    void close();
}
