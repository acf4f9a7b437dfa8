package com.questrail.packetnet.protocol.model;

import java.util.Objects;

/**
 * Decoded frame header: the packet format and the byte length of the payload
 * that follows it on the wire.
 */
public record Header(
    PacketFormat format,
    int length
) {
    public Header {
        Objects.requireNonNull(format, "format");
        if (length < 0) {
            throw new IllegalArgumentException("length must be >= 0");
        }
    }
}
