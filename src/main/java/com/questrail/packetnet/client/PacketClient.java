package com.questrail.packetnet.client;

import com.questrail.packetnet.config.ClientConfig;
import com.questrail.packetnet.event.EventBus;
import com.questrail.packetnet.event.EventType;
import com.questrail.packetnet.observability.TransportEvent;
import com.questrail.packetnet.protocol.codec.PacketCodec;
import com.questrail.packetnet.protocol.model.Packet;
import com.questrail.packetnet.protocol.model.PacketFormat;
import com.questrail.packetnet.time.MonotonicClock;
import com.questrail.packetnet.time.SystemMonotonicClock;
import com.questrail.packetnet.time.SystemWallClock;
import com.questrail.packetnet.time.WallClock;
import com.questrail.packetnet.transport.AbstractPacketConnection;
import com.questrail.packetnet.transport.HeartbeatMonitor;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * PacketClient
 * =============================================================================
 * Client end of a single connection to a {@code PacketServer}.
 *
 * <h2>Heartbeat</h2>
 * The client drives the heartbeat cycle. Before every outbound wait the send
 * loop checks its {@link HeartbeatMonitor}; when no ping is outstanding and the
 * heartbeat interval has elapsed, it writes an empty
 * {@link PacketFormat#HEARTBEAT_PING} ahead of any queued payloads. The
 * dispatch loop completes the cycle when the matching
 * {@link PacketFormat#HEARTBEAT_PONG} arrives and {@link #latency()} becomes
 * pong arrival minus ping departure. Pongs are not delivered to
 * {@link ClientEvents#ON_PACKET}.
 *
 * <p>A heartbeat interval of zero turns heartbeats off.</p>
 *
 * <h2>Lifecycle</h2>
 * One client object serves one connection: {@link #connect()} once, then
 * {@link #disconnect()} any number of times. Create a new client to reconnect.
 */
public final class PacketClient extends AbstractPacketConnection
{
    private static final byte[] PING_FRAME = PacketCodec.encodePacket(PacketFormat.HEARTBEAT_PING, new byte[0]);

    private final ClientConfig config;
    private final EventBus events = new EventBus(ClientEvents.ALL);
    private final HeartbeatMonitor heartbeat;
    private final boolean heartbeatEnabled;
    private final AtomicBoolean connectCalled = new AtomicBoolean(false);

    public PacketClient(ClientConfig config) {
        this(config, SystemMonotonicClock.INSTANCE, SystemWallClock.INSTANCE);
    }

    PacketClient(ClientConfig config, MonotonicClock clock, WallClock wallClock) {
        super(Objects.requireNonNull(config, "config").pollInterval(), clock, wallClock, config.observabilitySink());
        this.config = config;
        this.heartbeat = new HeartbeatMonitor(clock, config.heartbeatInterval());
        this.heartbeatEnabled = !config.heartbeatInterval().isZero();
    }

    /**
     * Registers a callback for one of the {@link ClientEvents}.
     * Callbacks run in registration order.
     */
    public <H> void register(EventType<H> event, H callback) {
        events.register(event, callback);
    }

    /**
     * Opens the connection, triggers {@link ClientEvents#ON_CONNECT} and starts
     * the worker threads.
     *
     * @throws IOException if the server cannot be reached
     * @throws IllegalStateException if {@code connect()} was already called
     */
    public void connect() throws IOException {
        if (!connectCalled.compareAndSet(false, true)) {
            throw new IllegalStateException("connect() may only be called once per client");
        }

        Socket socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(config.host(), config.port()),
                    (int) config.connectTimeout().toMillis());
            report(TransportEvent.Kind.CONNECTED, "local port " + socket.getLocalPort());
            events.trigger(ClientEvents.ON_CONNECT, Runnable::run);
            startWorkers(socket, "packetnet-client-" + socket.getLocalPort());
        }
        catch (IOException | RuntimeException e) {
            socket.close();
            throw e;
        }
    }

    /**
     * Last measured heartbeat round trip; {@link Duration#ZERO} until the first
     * pong has arrived.
     */
    public Duration latency() {
        return heartbeat.latency();
    }

    public boolean isHeartbeatPending() {
        return heartbeat.isPending();
    }

    public String host() {
        return config.host();
    }

    public int port() {
        return config.port();
    }

    // -------------------------------------------------------------------------
    // Worker hooks
    // -------------------------------------------------------------------------

    @Override
    protected void dispatch(Packet packet) {
        if (packet.format() == PacketFormat.HEARTBEAT_PONG) {
            Duration rtt = heartbeat.onPong(packet.receivedAtNanos());
            if (rtt != null) {
                report(TransportEvent.Kind.HEARTBEAT,
                        String.format(Locale.ROOT, "latency=%.3fms", rtt.toNanos() / 1_000_000.0));
            }
            return;
        }
        events.trigger(ClientEvents.ON_PACKET, cb -> cb.accept(packet));
    }

    @Override
    protected boolean beforeOutboundPoll() {
        if (heartbeatEnabled && heartbeat.isDue()) {
            heartbeat.markPingSent();
            return writeFrame(PING_FRAME, "heartbeat");
        }
        return true;
    }

    @Override
    protected long outboundWaitNanos(long pollIntervalNanos) {
        if (!heartbeatEnabled) {
            return pollIntervalNanos;
        }
        return Math.min(pollIntervalNanos, heartbeat.nanosUntilDue());
    }

    @Override
    protected void onDisconnecting() {
        events.trigger(ClientEvents.ON_DISCONNECT, Runnable::run);
    }

    @Override
    public String toString() {
        return "PacketClient(" + config.host() + ":" + config.port() + ")";
    }
}
