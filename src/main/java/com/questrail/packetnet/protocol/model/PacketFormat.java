package com.questrail.packetnet.protocol.model;

/**
 * PacketFormat
 * -----------------------------------------------------------------------------
 * Closed set of packet formats carried in byte 0 of every frame header.
 *
 * <p>The numeric codes are fixed and must be identical on both ends of a
 * connection:</p>
 * <ul>
 *   <li>{@code 0} RAW: opaque application payload</li>
 *   <li>{@code 1} HEARTBEAT_PING: latency probe sent by a client (empty payload)</li>
 *   <li>{@code 2} HEARTBEAT_PONG: reply sent by a server (empty payload)</li>
 * </ul>
 */
public enum PacketFormat
{
    RAW(0),
    HEARTBEAT_PING(1),
    HEARTBEAT_PONG(2);

    private final int code;

    PacketFormat(int code) {
        this.code = code;
    }

    /**
     * Returns the wire code for this format (0-255).
     */
    public int code() {
        return code;
    }

    /**
     * Returns true for the two heartbeat control formats.
     */
    public boolean isHeartbeat() {
        return this == HEARTBEAT_PING || this == HEARTBEAT_PONG;
    }

    /**
     * Resolves a wire code to its format.
     *
     * @param code unsigned value of the header's first byte
     * @return the matching format
     * @throws IllegalArgumentException if {@code code} is not a known format
     */
    public static PacketFormat fromCode(int code) {
        for (PacketFormat format : values()) {
            if (format.code == code) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown packet format code: " + code);
    }
}
