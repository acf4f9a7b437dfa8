package com.questrail.packetnet.protocol.model;

import java.time.Duration;

/**
 * Wall-clock cost of the most recently completed iteration of each worker
 * loop of one connection.
 *
 * <p>These are instantaneous gauges. A profile is a snapshot assembled from
 * three independently written values, so the fields may come from different
 * iterations.</p>
 */
public record ConnectionProfile(
    Duration listenerTime,
    Duration processerTime,
    Duration senderTime
) {
}
