package com.questrail.packetnet.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for everything that measures elapsed time: heartbeat cadence,
 * round-trip latency, packet arrival stamps and loop profiling.
 *
 * <p>Wall-clock time ({@link WallClock}) is used only for human-facing
 * timestamps such as a connection's {@code connectedAt}.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
