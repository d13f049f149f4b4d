package com.phillippitts.speaktoavatar.service.client;

import com.phillippitts.speaktoavatar.exception.ConnectionException;
import com.phillippitts.speaktoavatar.exception.OperationTimeoutException;
import com.phillippitts.speaktoavatar.exception.RemoteServiceExceptionBuilder;
import com.phillippitts.speaktoavatar.service.client.transport.TransportFactory;
import com.phillippitts.speaktoavatar.service.client.transport.TransportListener;
import com.phillippitts.speaktoavatar.service.client.transport.TransportRequest;
import com.phillippitts.speaktoavatar.service.client.transport.WebSocketTransport;
import com.phillippitts.speaktoavatar.util.TimeUtils;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.IntFunction;

/**
 * Base class for the WebSocket protocol clients, providing connection lifecycle, inbound
 * message queueing, sequence numbering and ping/pong health checks.
 *
 * <p>Implements the Template Method pattern: {@link #connect()} opens the transport and calls
 * {@link #doHandshake()}; {@link #disconnect()} calls {@link #beforeClose()} and then closes the
 * socket.
 *
 * <p><b>Thread Safety:</b>
 * <ul>
 *   <li>{@code connect}/{@code disconnect} are serialized by a per-client connect lock</li>
 *   <li>Sequenced sends hold a single-writer lock around read-send-increment</li>
 *   <li>Transport callbacks run on the socket reader thread and only enqueue or flip volatile state</li>
 * </ul>
 *
 * <p>Callbacks from a transport that has since been replaced or closed on purpose are ignored,
 * so an old socket's close can never clear the state of a newer connection.
 *
 * @since 1.0
 */
public abstract class AbstractProtocolClient implements ProtocolClient {

    private static final Logger LOG = LogManager.getLogger(AbstractProtocolClient.class);

    private final TransportFactory transportFactory;
    private final ReentrantLock connectLock = new ReentrantLock();
    private final ReentrantLock sendLock = new ReentrantLock();
    private final ReentrantLock pongLock = new ReentrantLock();
    private final Condition pongArrived = pongLock.newCondition();
    private final LinkedBlockingQueue<InboundMessage> inbox = new LinkedBlockingQueue<>();
    private final AtomicInteger generation = new AtomicInteger();

    private volatile WebSocketTransport transport;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile String boundId;

    /** Guarded by {@link #sendLock}. */
    private int nextSequence = 1;

    /** Guarded by {@link #pongLock}. */
    private long pongCount;

    protected AbstractProtocolClient(TransportFactory transportFactory) {
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory must not be null");
    }

    /**
     * Request used by the default single-attempt {@link #openTransport()}.
     */
    protected abstract TransportRequest transportRequest();

    /**
     * Service handshake performed right after the socket opens. Implementations send their hello
     * frame and block on {@link #awaitInbound} for the acknowledgment. An
     * {@link OperationTimeoutException} thrown here surfaces as a timeout {@link ConnectionException}.
     */
    protected abstract void doHandshake();

    /**
     * Graceful goodbye sent before the socket closes, e.g. stop-live or finish-connection.
     * Only called while the socket is open. Exceptions are logged and ignored.
     */
    protected abstract void beforeClose();

    protected abstract Duration healthTimeout();

    protected abstract Duration closeTimeout();

    /**
     * Lets a subclass consume a message as it arrives instead of queueing it, e.g. heartbeats or
     * status events. Runs on the transport reader thread.
     *
     * @return true if the message was handled and must not be queued
     */
    protected boolean handleUnsolicited(InboundMessage message) {
        return false;
    }

    @Override
    public final void connect() {
        connectLock.lock();
        try {
            if (isConnected()) {
                return;
            }
            long start = System.nanoTime();
            state = ConnectionState.CONNECTING;
            resetConnectionState();
            try {
                openTransport();
                doHandshake();
                state = ConnectionState.CONNECTED;
                LOG.info("{} client connected in {}ms", serviceName(), TimeUtils.elapsedMillis(start));
            } catch (OperationTimeoutException e) {
                discardTransport();
                throw RemoteServiceExceptionBuilder.create("Handshake not acknowledged")
                        .service(serviceName())
                        .metadata("waitedMs", TimeUtils.elapsedMillis(start))
                        .cause(e)
                        .buildConnection(ConnectionException.Reason.TIMEOUT);
            } catch (RuntimeException e) {
                discardTransport();
                throw e;
            }
        } finally {
            connectLock.unlock();
        }
    }

    /**
     * Opens the socket. The default makes a single attempt with {@link #transportRequest()};
     * subclasses may try several strategies through {@link #openWith(TransportRequest)}.
     */
    protected void openTransport() {
        openWith(transportRequest());
    }

    /**
     * Creates and opens a transport for this client, replacing any previous one.
     *
     * @throws ConnectionException tagged with this client's service name
     */
    protected final void openWith(TransportRequest request) {
        int gen = generation.incrementAndGet();
        WebSocketTransport t = transportFactory.create(request, new Listener(gen));
        transport = t;
        try {
            t.open();
        } catch (ConnectionException e) {
            throw RemoteServiceExceptionBuilder.create("Could not open socket")
                    .service(serviceName())
                    .metadata("uri", request.uri())
                    .metadata("verifySsl", request.verifySsl())
                    .cause(e)
                    .buildConnection(e.getReason());
        }
    }

    /**
     * Drops the current transport without any goodbye. Used between connection strategies and
     * after a failed handshake.
     */
    protected final void discardTransport() {
        WebSocketTransport t = transport;
        generation.incrementAndGet();
        transport = null;
        state = ConnectionState.DISCONNECTED;
        boundId = null;
        if (t != null) {
            try {
                t.close(closeTimeout());
            } catch (RuntimeException e) {
                LOG.debug("{} discarding socket: {}", serviceName(), e.getMessage());
            }
        }
    }

    @Override
    @PreDestroy
    public final void disconnect() {
        boolean locked = false;
        try {
            locked = connectLock.tryLock(closeTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (!locked) {
            LOG.warn("{} connect still in progress, forcing disconnect", serviceName());
        }
        try {
            WebSocketTransport t = transport;
            if (t != null && t.isOpen() && state == ConnectionState.CONNECTED) {
                try {
                    beforeClose();
                } catch (RuntimeException e) {
                    LOG.warn("{} graceful shutdown failed: {}", serviceName(), e.getMessage());
                }
            }
            generation.incrementAndGet();
            if (t != null) {
                try {
                    t.close(closeTimeout());
                } catch (RuntimeException e) {
                    LOG.debug("{} socket already closed: {}", serviceName(), e.getMessage());
                }
                LOG.info("{} client disconnected", serviceName());
            }
        } finally {
            transport = null;
            state = ConnectionState.DISCONNECTED;
            boundId = null;
            inbox.clear();
            // wakes any thread still blocked on this connection
            inbox.offer(InboundMessage.closed(1000, "client disconnect"));
            if (locked) {
                connectLock.unlock();
            }
        }
    }

    @Override
    public final boolean healthCheck() {
        return healthCheck(healthTimeout());
    }

    @Override
    public final boolean healthCheck(Duration timeout) {
        WebSocketTransport t = transport;
        if (t == null || !t.isOpen()) {
            return false;
        }
        pongLock.lock();
        try {
            long seen = pongCount;
            t.sendPing();
            long nanos = timeout.toNanos();
            while (pongCount == seen) {
                if (nanos <= 0) {
                    LOG.warn("{} health check: no pong within {}ms", serviceName(), timeout.toMillis());
                    return false;
                }
                nanos = pongArrived.awaitNanos(nanos);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (RuntimeException e) {
            LOG.warn("{} health check failed: {}", serviceName(), e.getMessage());
            return false;
        } finally {
            pongLock.unlock();
        }
    }

    @Override
    public final ConnectionState state() {
        return state;
    }

    @Override
    public final boolean isConnected() {
        WebSocketTransport t = transport;
        return state == ConnectionState.CONNECTED && t != null && t.isOpen();
    }

    @Override
    public final String boundId() {
        return boundId;
    }

    protected final void bind(String id) {
        this.boundId = id;
    }

    protected final void unbind() {
        this.boundId = null;
    }

    /**
     * Takes the next queued message, blocking until the deadline.
     *
     * @param deadlineNanos absolute deadline from {@link TimeUtils#deadlineAfter(Duration)}
     * @param operation     what is being waited for, used in errors
     * @param bound         the original bound, used in errors
     * @throws OperationTimeoutException if nothing arrives before the deadline
     * @throws ConnectionException if the socket closes or the thread is interrupted
     */
    protected final InboundMessage awaitInbound(long deadlineNanos, String operation, Duration bound) {
        long remaining = TimeUtils.remainingNanos(deadlineNanos);
        if (remaining <= 0) {
            throw new OperationTimeoutException(serviceName() + " " + operation, bound);
        }
        InboundMessage message;
        try {
            message = inbox.poll(remaining, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted while waiting for " + operation, serviceName(),
                    ConnectionException.Reason.TRANSPORT, e);
        }
        if (message == null) {
            throw new OperationTimeoutException(serviceName() + " " + operation, bound);
        }
        if (message.isClosed()) {
            throw new ConnectionException("Socket closed while waiting for " + operation
                    + " (code " + message.closeCode() + ")", serviceName(), ConnectionException.Reason.CLOSED);
        }
        return message;
    }

    /** Drops messages left over from an earlier exchange. */
    protected final void drainInbox() {
        inbox.clear();
    }

    protected final void sendBinary(byte[] data) {
        requireTransport().sendBinary(data);
    }

    protected final void sendText(String text) {
        requireTransport().sendText(text);
    }

    /**
     * Sends a frame stamped with the next sequence number. The counter advances only after the
     * send succeeds, and the whole read-send-increment runs under one lock.
     *
     * @param encoder builds the wire bytes for a given sequence number
     * @return the sequence number that was sent
     */
    protected final int sendSequenced(IntFunction<byte[]> encoder) {
        sendLock.lock();
        try {
            int sequence = nextSequence;
            requireTransport().sendBinary(encoder.apply(sequence));
            nextSequence = sequence + 1;
            return sequence;
        } finally {
            sendLock.unlock();
        }
    }

    /** Visible for tests */
    final int nextSequence() {
        sendLock.lock();
        try {
            return nextSequence;
        } finally {
            sendLock.unlock();
        }
    }

    private WebSocketTransport requireTransport() {
        WebSocketTransport t = transport;
        if (t == null || !t.isOpen()) {
            throw new ConnectionException("Not connected", serviceName(), ConnectionException.Reason.CLOSED);
        }
        return t;
    }

    private void resetConnectionState() {
        sendLock.lock();
        try {
            nextSequence = 1;
        } finally {
            sendLock.unlock();
        }
        inbox.clear();
        boundId = null;
    }

    private void dispatch(InboundMessage message) {
        if (!handleUnsolicited(message)) {
            inbox.offer(message);
        }
    }

    private final class Listener implements TransportListener {

        private final int owner;

        Listener(int owner) {
            this.owner = owner;
        }

        private boolean current() {
            return generation.get() == owner;
        }

        @Override
        public void onBinary(byte[] data) {
            if (current()) {
                dispatch(InboundMessage.binary(data));
            }
        }

        @Override
        public void onText(String text) {
            if (current()) {
                dispatch(InboundMessage.text(text));
            }
        }

        @Override
        public void onPong() {
            pongLock.lock();
            try {
                pongCount++;
                pongArrived.signalAll();
            } finally {
                pongLock.unlock();
            }
        }

        @Override
        public void onClosed(int code, String reason, boolean remote) {
            if (!current()) {
                return;
            }
            ConnectionState previous = state;
            String wasBound = boundId;
            state = ConnectionState.DISCONNECTED;
            boundId = null;
            inbox.offer(InboundMessage.closed(code, reason));
            LOG.warn("{} socket closed unexpectedly (code={}, reason='{}', remote={}, state={}, bound={})",
                    serviceName(), code, reason, remote, previous, wasBound);
        }

        @Override
        public void onError(Exception error) {
            if (current()) {
                LOG.debug("{} transport error: {}", serviceName(), error.toString());
            }
        }
    }
}
