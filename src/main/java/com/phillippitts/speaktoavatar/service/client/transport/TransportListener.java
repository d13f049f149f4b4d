package com.phillippitts.speaktoavatar.service.client.transport;

/**
 * Callbacks from a {@link WebSocketTransport}. Invoked on the transport's reader thread;
 * implementations must not block.
 */
public interface TransportListener {

    void onBinary(byte[] data);

    void onText(String text);

    void onPong();

    /**
     * @param code   WebSocket close code
     * @param reason close reason, possibly empty
     * @param remote true when the server initiated the close
     */
    void onClosed(int code, String reason, boolean remote);

    void onError(Exception error);
}
