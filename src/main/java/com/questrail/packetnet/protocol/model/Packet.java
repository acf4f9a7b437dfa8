package com.questrail.packetnet.protocol.model;

import java.util.Objects;

/**
 * Packet
 * -----------------------------------------------------------------------------
 * One received frame: its header, its payload and the monotonic instant at
 * which the last payload byte arrived.
 *
 * <p>Packets are created by a connection's receive loop, handed to the
 * dispatch loop through the inbound queue and then to a callback. They are
 * immutable; the payload is copied on the way in and on the way out.</p>
 */
public final class Packet
{
    private final byte[] payload;
    private final Header header;
    private final long receivedAtNanos;

    /**
     * @param payload          payload bytes ({@code null} is treated as empty)
     * @param header           decoded header
     * @param receivedAtNanos  monotonic timestamp (see {@code MonotonicClock})
     *                         taken when the payload was complete
     */
    public Packet(byte[] payload, Header header, long receivedAtNanos) {
        this.payload = (payload == null) ? new byte[0] : payload.clone();
        this.header = Objects.requireNonNull(header, "header");
        this.receivedAtNanos = receivedAtNanos;
    }

    /**
     * Returns a copy of the payload bytes.
     */
    public byte[] payload() {
        return payload.clone();
    }

    public int payloadLength() {
        return payload.length;
    }

    public Header header() {
        return header;
    }

    /**
     * Shortcut for {@code header().format()}.
     */
    public PacketFormat format() {
        return header.format();
    }

    /**
     * Monotonic nanosecond timestamp of arrival. Only meaningful relative to
     * other readings of the same clock.
     */
    public long receivedAtNanos() {
        return receivedAtNanos;
    }

    @Override
    public String toString() {
        return "Packet[" +
                "format=" + header.format() +
                ", length=" + payload.length +
                ", receivedAtNanos=" + receivedAtNanos +
                ']';
    }
}
