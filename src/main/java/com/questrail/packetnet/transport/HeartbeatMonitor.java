package com.questrail.packetnet.transport;

import com.questrail.packetnet.time.MonotonicClock;

import java.time.Duration;
import java.util.Objects;

/**
 * HeartbeatMonitor
 * -----------------------------------------------------------------------------
 * Bookkeeping for the client side of the heartbeat cycle.
 *
 * <h2>Cycle</h2>
 * <pre>
 *   isDue()         no ping pending and the interval has elapsed since the last ping
 *   markPingSent()  ping written; one ping is now pending
 *   onPong(t)       pending ping completed; latency = t - time the ping was sent
 * </pre>
 *
 * <p>At most one ping is outstanding at a time, so no more than one ping is
 * sent per interval. The first ping is due immediately.</p>
 *
 * <h2>Thread Safety</h2>
 * The send loop calls {@link #isDue} and {@link #markPingSent}; the dispatch
 * loop calls {@link #onPong}. All methods are synchronized.
 */
public final class HeartbeatMonitor {

    private final MonotonicClock clock;
    private final long intervalNanos;

    private boolean pending;
    private boolean everSent;
    private long lastPingSentAtNanos;
    private long latencyNanos = -1;

    public HeartbeatMonitor(MonotonicClock clock, Duration interval) {
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must be >= 0");
        }
        this.intervalNanos = interval.toNanos();
    }

    /**
     * Returns true if a ping should be sent now.
     */
    public synchronized boolean isDue() {
        return nanosUntilDue() == 0;
    }

    /**
     * Returns how long until the next ping is due: 0 if due now,
     * {@link Long#MAX_VALUE} while a ping is pending.
     */
    public synchronized long nanosUntilDue() {
        if (pending) {
            return Long.MAX_VALUE;
        }
        if (!everSent) {
            return 0;
        }
        long elapsed = clock.nowNanos() - lastPingSentAtNanos;
        return Math.max(0, intervalNanos - elapsed);
    }

    /**
     * Records that a ping has just been written.
     */
    public synchronized void markPingSent() {
        lastPingSentAtNanos = clock.nowNanos();
        everSent = true;
        pending = true;
    }

    /**
     * Completes the pending ping.
     *
     * @param receivedAtNanos arrival time of the pong, same clock as this monitor
     * @return the new latency, or {@code null} if no ping was pending (the pong
     *         is ignored)
     */
    public synchronized Duration onPong(long receivedAtNanos) {
        if (!pending) {
            return null;
        }
        pending = false;
        latencyNanos = Math.max(0, receivedAtNanos - lastPingSentAtNanos);
        return Duration.ofNanos(latencyNanos);
    }

    public synchronized boolean isPending() {
        return pending;
    }

    /**
     * Last measured round trip, or {@link Duration#ZERO} before the first pong.
     */
    public synchronized Duration latency() {
        return latencyNanos < 0 ? Duration.ZERO : Duration.ofNanos(latencyNanos);
    }

    /**
     * Returns true once at least one round trip has completed.
     */
    public synchronized boolean hasMeasurement() {
        return latencyNanos >= 0;
    }
}
