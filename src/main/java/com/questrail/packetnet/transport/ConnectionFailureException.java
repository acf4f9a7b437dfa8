package com.questrail.packetnet.transport;

/**
 * Thrown out of a connection's worker loop when the connection cannot continue
 * for a reason other than ordinary teardown.
 *
 * This covers:
 * <ul>
 *   <li>An unexpected I/O error while the connection is still running</li>
 *   <li>A frame header that cannot be decoded</li>
 *   <li>An exception thrown by an event callback on the dispatch loop</li>
 * </ul>
 *
 * The connection has already been disconnected when this is thrown.
 */
public final class ConnectionFailureException extends RuntimeException
{
    public ConnectionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
