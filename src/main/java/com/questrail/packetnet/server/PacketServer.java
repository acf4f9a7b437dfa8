package com.questrail.packetnet.server;

import com.questrail.packetnet.config.ConnectionIdPolicy;
import com.questrail.packetnet.config.ServerConfig;
import com.questrail.packetnet.event.EventBus;
import com.questrail.packetnet.event.EventType;
import com.questrail.packetnet.observability.NetErrorEvent;
import com.questrail.packetnet.observability.NetObservabilitySink;
import com.questrail.packetnet.observability.TransportEvent;
import com.questrail.packetnet.time.MonotonicClock;
import com.questrail.packetnet.time.SystemMonotonicClock;
import com.questrail.packetnet.time.SystemWallClock;
import com.questrail.packetnet.time.WallClock;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * PacketServer
 * =============================================================================
 * TCP server that accepts clients and runs one {@link ServerConnection}
 * (three worker threads) per accepted socket.
 *
 * <h2>Threads</h2>
 * <pre>
 *   start()  binds, listens, triggers on_ready, starts the accept thread
 *   accept   [acquire admission slot] → accept → register → on_connect → start workers
 *   stop()   close listener → release a slot → join accept → disconnect all → join all
 * </pre>
 *
 * <h2>Admission control</h2>
 * With {@code maxConnections > 0} the accept thread takes a semaphore permit
 * before every accept and a connection returns it when it disconnects. While
 * the cap is reached, new clients wait in the OS listen backlog.
 *
 * <h2>Registry</h2>
 * Live connections are kept in accept order. The accept thread inserts and
 * each connection removes itself during its disconnect; both hold the
 * registry lock.
 *
 * <h2>Failure policy</h2>
 * An accept error after {@link #stop()} has begun ends the accept thread
 * quietly. Any other accept error is reported to the observability sink and
 * thrown out of the accept thread; existing connections keep running.
 *
 * <p>{@link #stop()} is meant to be called once, from a thread that is not one
 * of this server's workers. Repeated calls return immediately; concurrent
 * callers are the caller's responsibility.</p>
 */
public final class PacketServer
{
    private final ServerConfig config;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final NetObservabilitySink observabilitySink;
    private final EventBus events = new EventBus(ServerEvents.ALL);

    private final Semaphore admission;
    private final Object registryLock = new Object();
    private final List<ServerConnection> connections = new ArrayList<>();
    private final AtomicInteger nextId = new AtomicInteger();
    private final AtomicLong packetCounter = new AtomicLong();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile ServerSocket serverSocket;
    private volatile Thread acceptThread;

    public PacketServer(ServerConfig config) {
        this(config, SystemMonotonicClock.INSTANCE, SystemWallClock.INSTANCE);
    }

    PacketServer(ServerConfig config, MonotonicClock clock, WallClock wallClock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = config.observabilitySink();
        this.admission = new Semaphore(config.maxConnections());
    }

    /**
     * Registers a callback for one of the {@link ServerEvents}.
     * Callbacks run in registration order.
     */
    public <H> void register(EventType<H> event, H callback) {
        events.register(event, callback);
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Binds the listening socket, triggers {@link ServerEvents#ON_READY} and
     * starts the accept thread.
     *
     * @throws IOException if the address cannot be bound
     * @throws IllegalStateException if the server was already started
     */
    public void start() throws IOException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Server already started");
        }

        ServerSocket socket = new ServerSocket();
        try {
            socket.bind(new InetSocketAddress(config.host(), config.port()), config.backlog());
        }
        catch (IOException e) {
            socket.close();
            throw e;
        }
        serverSocket = socket;
        running.set(true);

        report(TransportEvent.Kind.LISTENING, toString(), "backlog=" + config.backlog()
                + " maxConnections=" + config.maxConnections());
        events.trigger(ServerEvents.ON_READY, Runnable::run);

        Thread t = new Thread(this::acceptLoop, "packetnet-accept-" + port());
        acceptThread = t;
        t.start();
    }

    /**
     * Stops accepting, disconnects every live connection and waits for all
     * worker threads to finish.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }

        try {
            serverSocket.close();
        }
        catch (IOException e) {
            observabilitySink.onError(new NetErrorEvent(wallClock.now(), toString(), "listener close failed", e));
        }

        // Wakes an accept thread parked on a full admission semaphore.
        admission.release();

        try {
            Thread t = acceptThread;
            if (t != null && t != Thread.currentThread()) {
                t.join();
            }

            List<ServerConnection> remaining = connections();
            for (ServerConnection connection : remaining) {
                connection.disconnect();
            }
            for (ServerConnection connection : remaining) {
                connection.awaitTermination();
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        report(TransportEvent.Kind.STOPPED, toString(), "");
    }

    public boolean isRunning() {
        return running.get();
    }

    private void acceptLoop() {
        while (running.get()) {
            if (config.maxConnections() > 0) {
                try {
                    admission.acquire();
                }
                catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (!running.get()) {
                    return;
                }
            }

            final Socket socket;
            try {
                socket = serverSocket.accept();
            }
            catch (IOException e) {
                releaseSlot();
                if (!running.get()) {
                    return;
                }
                observabilitySink.onError(new NetErrorEvent(wallClock.now(), toString(), "accept failed", e));
                throw new UncheckedIOException("accept failed on " + this, e);
            }

            final ServerConnection connection;
            synchronized (registryLock) {
                int id = (config.idPolicy() == ConnectionIdPolicy.MONOTONIC)
                        ? nextId.getAndIncrement()
                        : connections.size();
                connection = new ServerConnection(this, socket, id);
                connections.add(connection);
            }
            report(TransportEvent.Kind.CONNECTED, connection.toString(), "");

            try {
                events.trigger(ServerEvents.ON_CONNECT, cb -> cb.accept(connection));
                connection.start();
            }
            catch (IOException | RuntimeException e) {
                abandon(connection, socket);
                observabilitySink.onError(new NetErrorEvent(
                        wallClock.now(), connection.toString(), "connection setup failed", e));
                if (e instanceof RuntimeException) {
                    throw (RuntimeException) e;
                }
            }
        }
    }

    /**
     * Cleans up a connection whose workers never started, so its own
     * disconnect path would be a no-op.
     */
    private void abandon(ServerConnection connection, Socket socket) {
        unregister(connection);
        try {
            socket.close();
        }
        catch (IOException e) {
            observabilitySink.onError(new NetErrorEvent(wallClock.now(), connection.toString(), "socket close failed", e));
        }
        releaseSlot();
    }

    // -------------------------------------------------------------------------
    // Registry and counters
    // -------------------------------------------------------------------------

    /**
     * Snapshot of the live connections, in accept order.
     */
    public List<ServerConnection> connections() {
        synchronized (registryLock) {
            return List.copyOf(connections);
        }
    }

    public int connectionCount() {
        synchronized (registryLock) {
            return connections.size();
        }
    }

    /**
     * Number of RAW packets received across all connections since start or
     * the last {@link #resetPacketCount()}.
     */
    public long packetCount() {
        return packetCounter.get();
    }

    /**
     * Resets the packet counter.
     *
     * @return the count before the reset
     */
    public long resetPacketCount() {
        return packetCounter.getAndSet(0);
    }

    void countPacket() {
        packetCounter.incrementAndGet();
    }

    void unregister(ServerConnection connection) {
        synchronized (registryLock) {
            connections.remove(connection);
        }
    }

    void releaseSlot() {
        if (config.maxConnections() > 0) {
            admission.release();
        }
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    public String host() {
        return config.host();
    }

    /**
     * Bound port once started (resolves an ephemeral port), otherwise the
     * configured port.
     */
    public int port() {
        ServerSocket s = serverSocket;
        return (s != null) ? s.getLocalPort() : config.port();
    }

    ServerConfig config() {
        return config;
    }

    MonotonicClock clock() {
        return clock;
    }

    WallClock wallClock() {
        return wallClock;
    }

    EventBus events() {
        return events;
    }

    private void report(TransportEvent.Kind kind, String endpoint, String detail) {
        observabilitySink.onTransportEvent(new TransportEvent(wallClock.now(), kind, endpoint, detail));
    }

    @Override
    public String toString() {
        return "PacketServer(" + host() + ":" + port() + ", " + connectionCount() + " connections)";
    }
}
