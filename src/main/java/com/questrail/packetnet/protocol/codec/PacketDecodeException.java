package com.questrail.packetnet.protocol.codec;

/**
 * Indicates that header bytes read from the wire could not be decoded.
 *
 * This typically reflects:
 * <ul>
 *   <li>An unknown format code in byte 0</li>
 *   <li>A length field that is not five ASCII decimal digits</li>
 *   <li>A header or frame buffer of the wrong size</li>
 * </ul>
 *
 * The framing has no resynchronization, so a connection that produces this
 * exception cannot be trusted for further reads.
 */
public final class PacketDecodeException extends Exception
{
    public PacketDecodeException(String message) {
        super(message);
    }

    public PacketDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
