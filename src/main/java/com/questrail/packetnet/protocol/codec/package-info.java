/**
 * Packet Codec
 * =============================================================================
 *
 * <p>Wire-level framing for the packet protocol. Every frame on the TCP
 * stream is a fixed six byte header followed by the payload:</p>
 *
 * <pre>
 *   offset 0      format code (0 = RAW, 1 = HEARTBEAT_PING, 2 = HEARTBEAT_PONG)
 *   offset 1..5   payload length, five ASCII decimal digits, zero padded
 *   offset 6..    payload, exactly {length} bytes
 * </pre>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   socket bytes
 *        → PacketCodec.decodeHeader   (header rules applied here)
 *            → read exactly header.length bytes
 *                → Packet
 * </pre>
 *
 * <p>The codec is stateless and performs no I/O. Stream reassembly belongs to
 * the receive loop in {@code com.questrail.packetnet.transport}.</p>
 *
 * <p>An undecodable header is fatal for the connection that produced it:
 * once framing is lost there is no resynchronisation point in the stream.</p>
 */
package com.questrail.packetnet.protocol.codec;
