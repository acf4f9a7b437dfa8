package com.questrail.packetnet.time;

import java.time.Instant;

/**
 * Wall-clock source for observability and connection timestamps.
 *
 * <p>This clock may jump (NTP, manual adjustment). It must not be used for
 * heartbeat cadence or latency; use {@link MonotonicClock} for those.</p>
 */
public interface WallClock
{
    Instant now();
}
