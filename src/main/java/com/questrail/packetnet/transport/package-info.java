/**
 * Connection Transport
 * =============================================================================
 *
 * Blocking-socket plumbing shared by the server and client runtimes.
 *
 * <h2>Threading model</h2>
 * Each live connection owns three platform threads (receive, dispatch, send)
 * and two unbounded queues. Nothing here is event-loop driven; a read blocks
 * its thread until bytes arrive or the socket is closed.
 *
 * <h2>Boundaries</h2>
 * <ul>
 *   <li>This package frames and moves packets. It does not interpret RAW
 *       payloads.</li>
 *   <li>Heartbeat roles (who pings, who answers) live in the runtimes, which
 *       plug into the loops through the hooks of
 *       {@link com.questrail.packetnet.transport.AbstractPacketConnection}.</li>
 * </ul>
 */
package com.questrail.packetnet.transport;
