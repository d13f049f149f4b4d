package com.phillippitts.speaktoavatar.service.client.transport;

import java.time.Duration;

/**
 * Minimal WebSocket surface the protocol clients depend on.
 *
 * <p>Send methods throw {@link com.phillippitts.speaktoavatar.exception.ConnectionException}
 * when the socket is not open.
 */
public interface WebSocketTransport {

    /**
     * Opens the socket, blocking up to the request's connect timeout.
     *
     * @throws com.phillippitts.speaktoavatar.exception.ConnectionException on timeout,
     *         TLS failure, rejected upgrade or interruption
     */
    void open();

    void sendBinary(byte[] data);

    void sendText(String text);

    /** Sends a transport-level ping; the answer arrives through {@link TransportListener#onPong()}. */
    void sendPing();

    boolean isOpen();

    /**
     * Closes the socket, waiting up to {@code timeout} for the close handshake.
     * Safe to call on a socket that is already closed.
     */
    void close(Duration timeout);
}
