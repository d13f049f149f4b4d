package com.phillippitts.speaktoavatar.service.client.transport;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Everything needed to open one WebSocket: target, handshake headers, TLS policy and bound.
 *
 * @param uri            ws:// or wss:// endpoint
 * @param headers        HTTP headers sent with the upgrade request
 * @param verifySsl      whether the server certificate and host name are verified
 * @param connectTimeout upper bound for the TCP/TLS/upgrade handshake
 */
public record TransportRequest(URI uri, Map<String, String> headers, boolean verifySsl, Duration connectTimeout) {

    public TransportRequest {
        if (uri == null) {
            throw new IllegalArgumentException("uri must not be null");
        }
        if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public TransportRequest withTls(boolean verify, Duration timeout) {
        return new TransportRequest(uri, headers, verify, timeout);
    }
}
