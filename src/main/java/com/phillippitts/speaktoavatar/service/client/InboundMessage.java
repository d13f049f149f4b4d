package com.phillippitts.speaktoavatar.service.client;

/**
 * One item taken off a client's inbox: a binary frame, a text frame, or the marker that the
 * socket closed.
 */
public record InboundMessage(Kind kind, byte[] binary, String text, int closeCode) {

    public enum Kind {
        BINARY,
        TEXT,
        CLOSED
    }

    public static InboundMessage binary(byte[] data) {
        return new InboundMessage(Kind.BINARY, data, null, 0);
    }

    public static InboundMessage text(String text) {
        return new InboundMessage(Kind.TEXT, null, text, 0);
    }

    public static InboundMessage closed(int code, String reason) {
        return new InboundMessage(Kind.CLOSED, null, reason, code);
    }

    public boolean isBinary() {
        return kind == Kind.BINARY;
    }

    public boolean isText() {
        return kind == Kind.TEXT;
    }

    public boolean isClosed() {
        return kind == Kind.CLOSED;
    }
}
