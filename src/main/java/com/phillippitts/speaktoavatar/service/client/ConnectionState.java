package com.phillippitts.speaktoavatar.service.client;

/**
 * Connection lifecycle of one protocol client.
 *
 * <p>{@code DISCONNECTED -> CONNECTING -> CONNECTED -> DISCONNECTED}. An unexpected socket close
 * moves straight to {@code DISCONNECTED}; reconnecting is left to the caller.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
