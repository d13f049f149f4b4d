package com.phillippitts.speaktoavatar.service.client.transport;

import com.phillippitts.speaktoavatar.exception.ConnectionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.java_websocket.WebSocket;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.drafts.Draft_6455;
import org.java_websocket.exceptions.WebsocketNotConnectedException;
import org.java_websocket.framing.Framedata;
import org.java_websocket.handshake.ServerHandshake;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * {@link WebSocketTransport} backed by Java-WebSocket's {@link WebSocketClient}.
 *
 * <p>When the request disables verification, certificates are trusted blindly and host name
 * checks are skipped. Some regional endpoints of the avatar service need this to connect.
 */
public final class JavaWebSocketTransport implements WebSocketTransport {

    private static final Logger LOG = LogManager.getLogger(JavaWebSocketTransport.class);
    private static final String SERVICE = "websocket";

    private final TransportRequest request;
    private final Client client;

    public JavaWebSocketTransport(TransportRequest request, TransportListener listener) {
        this.request = request;
        this.client = new Client(request, listener);
        if ("wss".equalsIgnoreCase(request.uri().getScheme()) && !request.verifySsl()) {
            client.setSocketFactory(trustAllContext().getSocketFactory());
        }
    }

    @Override
    public void open() {
        long timeoutMs = request.connectTimeout().toMillis();
        boolean opened;
        try {
            opened = client.connectBlocking(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            client.closeConnection(1001, "interrupted");
            throw new ConnectionException("Interrupted while connecting to " + request.uri(), SERVICE,
                    ConnectionException.Reason.TRANSPORT, e);
        }
        if (opened) {
            LOG.debug("WebSocket open: {} (verifySsl={})", request.uri(), request.verifySsl());
            return;
        }

        Exception error = client.lastError;
        client.closeConnection(1006, "connect failed");
        if (error instanceof SSLException) {
            throw new ConnectionException("TLS handshake with " + request.uri() + " failed", SERVICE,
                    ConnectionException.Reason.TLS, error);
        }
        if (error != null) {
            throw new ConnectionException("Could not connect to " + request.uri() + ": " + error.getMessage(),
                    SERVICE, ConnectionException.Reason.TRANSPORT, error);
        }
        if (client.closeReason != null) {
            throw new ConnectionException("Upgrade to " + request.uri() + " rejected: " + client.closeReason,
                    SERVICE, ConnectionException.Reason.HANDSHAKE);
        }
        throw new ConnectionException("No connection to " + request.uri() + " within " + timeoutMs + "ms",
                SERVICE, ConnectionException.Reason.TIMEOUT);
    }

    @Override
    public void sendBinary(byte[] data) {
        try {
            client.send(data);
        } catch (WebsocketNotConnectedException e) {
            throw closed(e);
        }
    }

    @Override
    public void sendText(String text) {
        try {
            client.send(text);
        } catch (WebsocketNotConnectedException e) {
            throw closed(e);
        }
    }

    @Override
    public void sendPing() {
        try {
            client.sendPing();
        } catch (WebsocketNotConnectedException e) {
            throw closed(e);
        }
    }

    @Override
    public boolean isOpen() {
        return client.isOpen();
    }

    @Override
    public void close(Duration timeout) {
        if (client.isClosed()) {
            return;
        }
        client.close();
        try {
            if (!client.closed.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Close handshake with {} did not finish within {}ms, dropping connection",
                        request.uri(), timeout.toMillis());
                client.closeConnection(1006, "close timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            client.closeConnection(1006, "interrupted");
        }
    }

    private ConnectionException closed(WebsocketNotConnectedException e) {
        return new ConnectionException("Socket to " + request.uri() + " is not open", SERVICE,
                ConnectionException.Reason.CLOSED, e);
    }

    private static SSLContext trustAllContext() {
        TrustManager trustAll = new X509TrustManager() {
            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public X509Certificate[] getAcceptedIssuers() {
                return new X509Certificate[0];
            }
        };
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[] {trustAll}, new SecureRandom());
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("TLS context unavailable", e);
        }
    }

    private static final class Client extends WebSocketClient {

        private final TransportListener listener;
        private final boolean verifySsl;
        private final CountDownLatch closed = new CountDownLatch(1);
        private volatile Exception lastError;
        private volatile String closeReason;

        Client(TransportRequest request, TransportListener listener) {
            super(request.uri(), new Draft_6455(), request.headers(), (int) request.connectTimeout().toMillis());
            this.listener = listener;
            this.verifySsl = request.verifySsl();
        }

        @Override
        protected void onSetSSLParameters(SSLParameters sslParameters) {
            if (verifySsl) {
                super.onSetSSLParameters(sslParameters);
            }
        }

        @Override
        public void onOpen(ServerHandshake handshake) {
            // readiness is observed through connectBlocking
        }

        @Override
        public void onMessage(String message) {
            listener.onText(message);
        }

        @Override
        public void onMessage(ByteBuffer bytes) {
            byte[] data = new byte[bytes.remaining()];
            bytes.get(data);
            listener.onBinary(data);
        }

        @Override
        public void onWebsocketPong(WebSocket conn, Framedata f) {
            listener.onPong();
        }

        @Override
        public void onClose(int code, String reason, boolean remote) {
            if (reason != null && !reason.isEmpty()) {
                closeReason = code + " " + reason;
            }
            closed.countDown();
            listener.onClosed(code, reason == null ? "" : reason, remote);
        }

        @Override
        public void onError(Exception ex) {
            lastError = ex;
            listener.onError(ex);
        }
    }
}
