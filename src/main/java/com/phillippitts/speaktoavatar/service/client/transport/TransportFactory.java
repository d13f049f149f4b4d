package com.phillippitts.speaktoavatar.service.client.transport;

/**
 * Creates unopened transports. The production bean builds {@link JavaWebSocketTransport};
 * tests swap in an in-memory implementation.
 */
@FunctionalInterface
public interface TransportFactory {

    WebSocketTransport create(TransportRequest request, TransportListener listener);
}
