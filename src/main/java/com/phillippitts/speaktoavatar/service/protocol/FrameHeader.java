package com.phillippitts.speaktoavatar.service.protocol;

/**
 * The fixed four-byte frame header.
 *
 * <pre>
 * byte 0: protocolVersion (4 bits) | headerSize in 4-byte units (4 bits)
 * byte 1: messageType (4 bits)     | flags (4 bits)
 * byte 2: serialization (4 bits)   | compression (4 bits)
 * byte 3: reserved
 * </pre>
 */
public record FrameHeader(
        int protocolVersion,
        int headerSize,
        MessageType messageType,
        int flags,
        Serialization serialization,
        Compression compression,
        int reserved
) {

    public static final int PROTOCOL_VERSION = 0b0001;
    public static final int DEFAULT_HEADER_SIZE = 0b0001;
    public static final int HEADER_UNIT_BYTES = 4;

    public FrameHeader {
        if (messageType == null) {
            throw new IllegalArgumentException("messageType must not be null");
        }
        if (serialization == null) {
            serialization = Serialization.NONE;
        }
        if (compression == null) {
            compression = Compression.NONE;
        }
        requireNibble("protocolVersion", protocolVersion);
        requireNibble("headerSize", headerSize);
        requireNibble("flags", flags);
        if (headerSize < 1) {
            throw new IllegalArgumentException("headerSize must be at least 1, got " + headerSize);
        }
        if (reserved < 0 || reserved > 0xFF) {
            throw new IllegalArgumentException("reserved must fit in one byte, got " + reserved);
        }
    }

    /** Header with the default version and size and a zero reserved byte. */
    public static FrameHeader of(MessageType type, int flags, Serialization serialization, Compression compression) {
        return new FrameHeader(PROTOCOL_VERSION, DEFAULT_HEADER_SIZE, type, flags, serialization, compression, 0);
    }

    /** Header length in bytes, i.e. where the optional block starts. */
    public int sizeInBytes() {
        return headerSize * HEADER_UNIT_BYTES;
    }

    public byte[] toBytes() {
        return new byte[] {
                (byte) ((protocolVersion << 4) | headerSize),
                (byte) ((messageType.code() << 4) | flags),
                (byte) ((serialization.code() << 4) | compression.code()),
                (byte) reserved
        };
    }

    private static void requireNibble(String name, int value) {
        if (value < 0 || value > 0x0F) {
            throw new IllegalArgumentException(name + " must fit in 4 bits, got " + value);
        }
    }
}
