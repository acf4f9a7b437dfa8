package com.questrail.packetnet.protocol.codec;

import com.questrail.packetnet.protocol.model.Header;
import com.questrail.packetnet.protocol.model.Packet;
import com.questrail.packetnet.protocol.model.PacketFormat;

import java.util.Arrays;
import java.util.Objects;

/**
 * PacketCodec
 * -----------------------------------------------------------------------------
 * Stateless conversion between (format, payload) pairs and wire bytes.
 *
 * <p>Every frame is a fixed six byte header followed by the payload:</p>
 * <pre>
 *   byte 0       : format code (see {@link PacketFormat#code()})
 *   bytes 1-5    : payload length, ASCII decimal, zero-padded ("00042")
 *   bytes 6..6+L : payload
 * </pre>
 *
 * <p>There is no checksum and no magic number. A corrupted length field is
 * undetectable here and shows up as a desynchronized stream.</p>
 */
public final class PacketCodec
{
    /** Size of the fixed frame header in bytes. */
    public static final int HEADER_LENGTH = 6;

    /** Largest payload the five digit length field can describe. */
    public static final int MAX_PAYLOAD_LENGTH = 99_999;

    private static final int LENGTH_DIGITS = 5;

    private PacketCodec() {}

    /**
     * Builds the six byte header for a payload of {@code length} bytes.
     *
     * @throws IllegalArgumentException if {@code length} is negative or above
     *         {@link #MAX_PAYLOAD_LENGTH}
     */
    public static byte[] encodeHeader(PacketFormat format, int length) {
        Objects.requireNonNull(format, "format");
        if (length < 0 || length > MAX_PAYLOAD_LENGTH) {
            throw new IllegalArgumentException(
                    "Payload length " + length + " outside 0.." + MAX_PAYLOAD_LENGTH);
        }

        byte[] header = new byte[HEADER_LENGTH];
        header[0] = (byte) format.code();

        // Right-to-left so the leading positions keep their zero padding.
        int remaining = length;
        for (int i = HEADER_LENGTH - 1; i >= 1; i--) {
            header[i] = (byte) ('0' + (remaining % 10));
            remaining /= 10;
        }
        return header;
    }

    /**
     * Builds a complete frame: header followed by a copy of {@code payload}.
     *
     * @throws IllegalArgumentException if the payload exceeds {@link #MAX_PAYLOAD_LENGTH}
     */
    public static byte[] encodePacket(PacketFormat format, byte[] payload) {
        Objects.requireNonNull(payload, "payload");

        byte[] header = encodeHeader(format, payload.length);
        byte[] frame = Arrays.copyOf(header, HEADER_LENGTH + payload.length);
        System.arraycopy(payload, 0, frame, HEADER_LENGTH, payload.length);
        return frame;
    }

    /**
     * Decodes exactly {@link #HEADER_LENGTH} header bytes.
     *
     * @throws PacketDecodeException on a wrong buffer size, an unknown format
     *         code or a non-decimal length field
     */
    public static Header decodeHeader(byte[] bytes) throws PacketDecodeException {
        if (bytes == null || bytes.length != HEADER_LENGTH) {
            throw new PacketDecodeException("Header must be exactly " + HEADER_LENGTH + " bytes");
        }

        final PacketFormat format;
        try {
            format = PacketFormat.fromCode(bytes[0] & 0xFF);
        } catch (IllegalArgumentException e) {
            throw new PacketDecodeException(e.getMessage(), e);
        }

        int length = 0;
        for (int i = 1; i <= LENGTH_DIGITS; i++) {
            int digit = bytes[i] - '0';
            if (digit < 0 || digit > 9) {
                throw new PacketDecodeException(
                        "Non-decimal length byte 0x" + Integer.toHexString(bytes[i] & 0xFF) + " at offset " + i);
            }
            length = length * 10 + digit;
        }

        return new Header(format, length);
    }

    /**
     * Decodes one complete frame held in {@code frame}.
     *
     * <p>The socket path never calls this; it reads the header and the payload
     * separately. This is the inverse of {@link #encodePacket} for callers that
     * already hold a whole frame.</p>
     *
     * @param frame            header plus payload, nothing more
     * @param receivedAtNanos  timestamp to stamp on the resulting packet
     * @throws PacketDecodeException if the header is invalid or the buffer
     *         length disagrees with the header's length field
     */
    public static Packet decodePacket(byte[] frame, long receivedAtNanos) throws PacketDecodeException {
        if (frame == null || frame.length < HEADER_LENGTH) {
            throw new PacketDecodeException("Frame shorter than header");
        }

        Header header = decodeHeader(Arrays.copyOfRange(frame, 0, HEADER_LENGTH));
        if (frame.length - HEADER_LENGTH != header.length()) {
            throw new PacketDecodeException(
                    "Header announces " + header.length() + " payload bytes, frame carries "
                            + (frame.length - HEADER_LENGTH));
        }

        return new Packet(Arrays.copyOfRange(frame, HEADER_LENGTH, frame.length), header, receivedAtNanos);
    }
}
