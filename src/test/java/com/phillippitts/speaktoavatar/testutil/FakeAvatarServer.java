package com.phillippitts.speaktoavatar.testutil;

import org.json.JSONObject;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scripted avatar control server. Answers start-live with an acknowledgment carrying a
 * configurable code and records every control message it receives.
 */
public class FakeAvatarServer implements ScriptedTransportFactory.Responder {

    private final List<String> controls = new CopyOnWriteArrayList<>();
    private final List<byte[]> audio = new CopyOnWriteArrayList<>();
    private volatile int ackCode = 1000;
    private volatile boolean silent;
    private volatile boolean holdAck;
    private volatile InMemoryTransport heldAck;

    public FakeAvatarServer ackWith(int code) {
        this.ackCode = code;
        return this;
    }

    /** Never answers start-live. */
    public FakeAvatarServer silent() {
        this.silent = true;
        return this;
    }

    /** Keeps the start-live acknowledgment back until {@link #releaseAck()}. */
    public FakeAvatarServer holdAck() {
        this.holdAck = true;
        return this;
    }

    public boolean hasHeldAck() {
        return heldAck != null;
    }

    /** Sends the acknowledgment held back by {@link #holdAck()}. */
    public void releaseAck() {
        InMemoryTransport transport = heldAck;
        if (transport == null) {
            throw new IllegalStateException("no start-live is waiting for an acknowledgment");
        }
        heldAck = null;
        holdAck = false;
        transport.pushText(ack());
    }

    public List<String> controls() {
        return controls;
    }

    public List<byte[]> audio() {
        return audio;
    }

    public long count(String tag) {
        return controls.stream().filter(c -> c.startsWith(tag)).count();
    }

    @Override
    public void onText(InMemoryTransport transport, String text) {
        controls.add(text);
        if (!text.startsWith("|CTL|00|") || silent) {
            return;
        }
        if (holdAck) {
            heldAck = transport;
        } else {
            transport.pushText(ack());
        }
    }

    private String ack() {
        return "|MSG|00|" + new JSONObject().put("code", ackCode).put("message",
                ackCode == 1000 ? "success" : "refused");
    }

    @Override
    public void onBinary(InMemoryTransport transport, byte[] data) {
        audio.add(data);
    }
}
