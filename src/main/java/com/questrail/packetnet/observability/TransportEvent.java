package com.questrail.packetnet.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a lifecycle or heartbeat event on a server, client or
 * single connection.
 *
 * @param endpoint human readable description of the runtime or connection
 *                 that produced the event (its {@code toString()})
 * @param detail   free-form detail, may be empty
 */
public record TransportEvent(
    Instant timestamp,
    Kind kind,
    String endpoint,
    String detail
) {
    public TransportEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(endpoint, "endpoint");
        detail = (detail == null) ? "" : detail;
    }

    public enum Kind {
        /** Server socket bound and listening. */
        LISTENING,
        /** A connection was accepted (server) or established (client). */
        CONNECTED,
        /** A connection finished its disconnect sequence. */
        DISCONNECTED,
        /** The peer closed its end of the stream. */
        PEER_CLOSED,
        /** The peer reset or aborted the connection. */
        PEER_RESET,
        /** A heartbeat round trip completed. */
        HEARTBEAT,
        /** Server stopped and all of its connections were joined. */
        STOPPED
    }
}
