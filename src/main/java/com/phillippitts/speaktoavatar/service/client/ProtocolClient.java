package com.phillippitts.speaktoavatar.service.client;

import java.time.Duration;

/**
 * A client that owns exactly one persistent WebSocket to a remote speech or avatar service.
 *
 * <p>Implementations are thread-safe. Connecting and disconnecting are serialized per client;
 * outbound sequence numbers are assigned under a single-writer lock.
 *
 * @see AbstractProtocolClient
 */
public interface ProtocolClient {

    /** Short service name used in logs, metrics and errors ("tts", "stt", "avatar"). */
    String serviceName();

    /**
     * Opens the socket and completes the service handshake. No-op when already connected.
     *
     * @throws com.phillippitts.speaktoavatar.exception.ConnectionException if the socket cannot
     *         be opened, the handshake is refused, times out or the socket closes meanwhile
     */
    void connect();

    /**
     * Gracefully ends any bound session, closes the socket and clears bound state. Never throws.
     */
    void disconnect();

    /**
     * Sends a transport-level ping and waits for the pong.
     *
     * @return true if a pong arrived in time; false on timeout, closed socket or any error
     */
    boolean healthCheck();

    /**
     * Same as {@link #healthCheck()} with an explicit bound for the pong wait.
     */
    boolean healthCheck(Duration timeout);

    ConnectionState state();

    /** The single connection-state query: true only when connected and the socket is open. */
    boolean isConnected();

    /** Room or session currently bound to this connection, or null. */
    String boundId();
}
