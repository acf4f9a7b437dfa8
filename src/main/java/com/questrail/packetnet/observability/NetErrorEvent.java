package com.questrail.packetnet.observability;

import java.time.Instant;

/**
 * Record representing a failure that ended a worker loop or the accept loop.
 */
public record NetErrorEvent(
    Instant timestamp,
    String endpoint,
    String message,
    Throwable cause
) {
}
