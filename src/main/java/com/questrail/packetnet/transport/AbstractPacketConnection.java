package com.questrail.packetnet.transport;

import com.questrail.packetnet.observability.NetErrorEvent;
import com.questrail.packetnet.observability.NetObservabilitySink;
import com.questrail.packetnet.observability.TransportEvent;
import com.questrail.packetnet.protocol.codec.PacketCodec;
import com.questrail.packetnet.protocol.codec.PacketDecodeException;
import com.questrail.packetnet.protocol.model.ConnectionProfile;
import com.questrail.packetnet.protocol.model.Header;
import com.questrail.packetnet.protocol.model.Packet;
import com.questrail.packetnet.protocol.model.PacketFormat;
import com.questrail.packetnet.time.MonotonicClock;
import com.questrail.packetnet.time.WallClock;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * AbstractPacketConnection
 * =============================================================================
 * One live TCP connection driven by three worker threads that share a socket
 * and two queues.
 *
 * <pre>
 *   socket ──receive loop──▶ inbound queue ──dispatch loop──▶ dispatch(packet)
 *   enqueue(bytes) ──▶ outbound queue ──send loop──▶ socket
 * </pre>
 *
 * <h2>Loops</h2>
 * <ul>
 *   <li><b>receive</b>: reads a six byte header, then exactly
 *       {@code header.length} payload bytes, stamps the packet with the
 *       monotonic clock and puts it on the inbound queue.</li>
 *   <li><b>dispatch</b>: takes packets off the inbound queue (bounded wait of
 *       one poll interval) and hands each to {@link #dispatch(Packet)}.</li>
 *   <li><b>send</b>: takes payloads off the outbound queue (same bounded wait),
 *       frames each one as {@link PacketFormat#RAW} and writes it.
 *       {@link #beforeOutboundPoll()} runs before every wait so a subclass can
 *       inject control frames ahead of queued payloads.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * A single running flag is set by {@link #startWorkers} and cleared exactly
 * once by {@link #disconnect()}. Whichever thread clears it performs the
 * teardown ({@link #onDisconnecting()}, socket close, {@link #onDisconnected()});
 * every other caller returns immediately. Closing the socket is what unblocks
 * a receive loop stuck in a read; the two queue loops notice within one poll
 * interval.
 *
 * <h2>Failure policy</h2>
 * <ul>
 *   <li>End of stream: peer closed, disconnect, loop exits.</li>
 *   <li>{@link SocketException} while running (reset, broken pipe, abort):
 *       peer failure, disconnect, loop exits. The JDK reports nearly every
 *       socket-level failure as a {@code SocketException}, so in practice
 *       almost all OS errors on a live socket take this quiet path.</li>
 *   <li>Any I/O error once the flag is already cleared: shutdown noise, loop
 *       exits quietly.</li>
 *   <li>Any other I/O error while running (an {@code IOException} that is
 *       not a {@code SocketException}), an undecodable header, or an
 *       exception from {@link #dispatch}: reported to the sink, connection
 *       disconnected, then {@link ConnectionFailureException} is thrown out of
 *       the loop.</li>
 * </ul>
 *
 * <h2>Wire writes</h2>
 * The dispatch loop (heartbeat replies), the send loop and
 * {@link #sendImmediately} can all write. Every write of a whole frame holds
 * one per-connection lock, so frames never interleave on the wire.
 */
public abstract class AbstractPacketConnection
{
    private final long pollNanos;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final NetObservabilitySink observabilitySink;

    private final BlockingQueue<Packet> inbound = new LinkedBlockingQueue<>();
    private final BlockingQueue<byte[]> outbound = new LinkedBlockingQueue<>();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Object writeLock = new Object();

    private volatile Socket socket;
    private volatile InputStream input;
    private volatile OutputStream output;

    private volatile Thread receiveThread;
    private volatile Thread dispatchThread;
    private volatile Thread sendThread;

    private volatile long listenerNanos;
    private volatile long processerNanos;
    private volatile long senderNanos;

    protected AbstractPacketConnection(Duration pollInterval,
                                       MonotonicClock clock,
                                       WallClock wallClock,
                                       NetObservabilitySink observabilitySink)
    {
        Objects.requireNonNull(pollInterval, "pollInterval");
        this.pollNanos = pollInterval.toNanos();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    // -------------------------------------------------------------------------
    // Subclass hooks
    // -------------------------------------------------------------------------

    /**
     * Handles one packet on the dispatch thread. Runs synchronously, so the
     * next packet of this connection waits until it returns.
     */
    protected abstract void dispatch(Packet packet);

    /**
     * First teardown step, run exactly once on the thread that won the
     * disconnect, before the socket is closed.
     */
    protected abstract void onDisconnecting();

    /**
     * Last teardown step, run exactly once after the socket is closed.
     */
    protected void onDisconnected() {
    }

    /**
     * Called on the receive thread after a packet has been queued.
     */
    protected void onPacketReceived(Packet packet) {
    }

    /**
     * Called on the send thread before each outbound wait.
     *
     * @return {@code false} to stop the send loop (the connection is gone)
     */
    protected boolean beforeOutboundPoll() {
        return true;
    }

    /**
     * Upper bound for the next outbound wait. Subclasses shorten it when
     * something is due earlier than one poll interval.
     */
    protected long outboundWaitNanos(long pollIntervalNanos) {
        return pollIntervalNanos;
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Binds this connection to {@code socket} and starts the three loops.
     *
     * @param threadPrefix prefix for the worker thread names
     * @throws IllegalStateException if workers were already started
     * @throws IOException if the socket streams cannot be obtained
     */
    protected final void startWorkers(Socket socket, String threadPrefix) throws IOException {
        Objects.requireNonNull(socket, "socket");
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Connection already started");
        }

        this.socket = socket;
        this.input = socket.getInputStream();
        this.output = socket.getOutputStream();
        running.set(true);

        receiveThread = new Thread(this::receiveLoop, threadPrefix + "-receive");
        dispatchThread = new Thread(this::dispatchLoop, threadPrefix + "-dispatch");
        sendThread = new Thread(this::sendLoop, threadPrefix + "-send");

        receiveThread.start();
        dispatchThread.start();
        sendThread.start();
    }

    /**
     * Stops the connection. Safe to call any number of times from any thread;
     * only the first call on a running connection has an effect.
     */
    public final void disconnect() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        closed.set(true);

        try {
            onDisconnecting();
        }
        finally {
            closeSocket();
            onDisconnected();
            report(TransportEvent.Kind.DISCONNECTED, "");
        }
    }

    /**
     * Waits, without a time limit, for the worker threads to finish. The
     * calling thread is skipped if it is one of the workers.
     */
    public void awaitTermination() throws InterruptedException {
        for (Thread t : new Thread[] { receiveThread, dispatchThread, sendThread }) {
            if (t != null && t != Thread.currentThread()) {
                t.join();
            }
        }
    }

    /**
     * Bounded variant of {@link #awaitTermination()}.
     *
     * @param timeout maximum wait per thread
     * @return true if all workers have terminated
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        boolean terminated = true;
        for (Thread t : new Thread[] { receiveThread, dispatchThread, sendThread }) {
            if (t == null || t == Thread.currentThread()) {
                continue;
            }
            t.join(timeout.toMillis());
            terminated &= !t.isAlive();
        }
        return terminated;
    }

    public final boolean isRunning() {
        return running.get();
    }

    // -------------------------------------------------------------------------
    // Outbound API
    // -------------------------------------------------------------------------

    /**
     * Queues {@code payload} for the send loop. Never blocks.
     *
     * <p>Payloads may be queued before the connection starts, or while its
     * workers are starting; they are sent once the send loop runs. Payloads
     * offered after disconnect are dropped.</p>
     *
     * @return false if the connection has already been disconnected
     * @throws IllegalArgumentException if the payload exceeds
     *         {@link PacketCodec#MAX_PAYLOAD_LENGTH}
     */
    public final boolean enqueue(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        checkPayloadLength(payload);
        if (closed.get()) {
            return false;
        }
        return outbound.offer(payload.clone());
    }

    /**
     * Writes {@code payload} as a RAW frame on the calling thread, bypassing
     * the outbound queue.
     *
     * @return true if the frame was written; false if the connection is not
     *         running or the peer is gone
     */
    public final boolean sendImmediately(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        checkPayloadLength(payload);
        if (!running.get()) {
            return false;
        }
        return writeFrame(PacketCodec.encodePacket(PacketFormat.RAW, payload), "immediate send");
    }

    /**
     * Number of payloads waiting in the outbound queue.
     */
    public int pendingOutbound() {
        return outbound.size();
    }

    public ConnectionProfile connectionProfile() {
        return new ConnectionProfile(
                Duration.ofNanos(listenerNanos),
                Duration.ofNanos(processerNanos),
                Duration.ofNanos(senderNanos));
    }

    // -------------------------------------------------------------------------
    // Worker loops
    // -------------------------------------------------------------------------

    private void receiveLoop() {
        while (running.get()) {
            long frameStart = clock.nowNanos();

            byte[] headerBytes = readExactly(PacketCodec.HEADER_LENGTH);
            if (headerBytes == null) {
                return;
            }

            final Header header;
            try {
                header = PacketCodec.decodeHeader(headerBytes);
            }
            catch (PacketDecodeException e) {
                if (!running.get()) {
                    return;
                }
                throw fail("undecodable frame header", e);
            }

            byte[] payload = readExactly(header.length());
            if (payload == null) {
                return;
            }
            long receivedAt = clock.nowNanos();

            // Disconnected while the payload was in flight: drop it.
            if (!running.get()) {
                return;
            }

            Packet packet = new Packet(payload, header, receivedAt);
            inbound.add(packet);
            onPacketReceived(packet);

            listenerNanos = clock.nowNanos() - frameStart;
        }
    }

    private void dispatchLoop() {
        while (running.get()) {
            final Packet packet;
            try {
                packet = inbound.poll(pollNanos, TimeUnit.NANOSECONDS);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (packet == null) {
                continue;
            }

            long start = clock.nowNanos();
            try {
                dispatch(packet);
            }
            catch (ConnectionFailureException e) {
                throw e;
            }
            catch (RuntimeException e) {
                throw fail("packet callback failed", e);
            }
            processerNanos = clock.nowNanos() - start;
        }
    }

    private void sendLoop() {
        while (running.get()) {
            if (!beforeOutboundPoll()) {
                return;
            }

            final byte[] payload;
            try {
                payload = outbound.poll(outboundWaitNanos(pollNanos), TimeUnit.NANOSECONDS);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (payload == null) {
                continue;
            }

            long start = clock.nowNanos();
            if (!writeFrame(PacketCodec.encodePacket(PacketFormat.RAW, payload), "send")) {
                return;
            }
            senderNanos = clock.nowNanos() - start;
        }
    }

    // -------------------------------------------------------------------------
    // Socket helpers
    // -------------------------------------------------------------------------

    /**
     * Writes one whole frame under the connection's write lock.
     *
     * @return false if the connection went away (peer failure or already
     *         disconnected); true if the frame was written
     * @throws ConnectionFailureException on an unexpected I/O error while running
     */
    protected final boolean writeFrame(byte[] frame, String operation) {
        try {
            synchronized (writeLock) {
                output.write(frame);
                output.flush();
            }
            return true;
        }
        catch (IOException e) {
            handleIoFailure(e, operation);
            return false;
        }
    }

    /**
     * Reads exactly {@code length} bytes.
     *
     * @return the bytes, or {@code null} if the loop must exit
     */
    private byte[] readExactly(int length) {
        try {
            byte[] bytes = input.readNBytes(length);
            if (bytes.length < length) {
                if (running.get()) {
                    report(TransportEvent.Kind.PEER_CLOSED,
                            bytes.length == 0 ? "" : "mid-frame after " + bytes.length + " of " + length + " bytes");
                    disconnect();
                }
                return null;
            }
            return bytes;
        }
        catch (IOException e) {
            handleIoFailure(e, "receive");
            return null;
        }
    }

    private void handleIoFailure(IOException e, String operation) {
        if (!running.get()) {
            return;
        }
        if (e instanceof SocketException) {
            report(TransportEvent.Kind.PEER_RESET, operation + ": " + e.getMessage());
            disconnect();
            return;
        }
        throw fail(operation + " failed", e);
    }

    /**
     * Reports a fatal condition, disconnects, and returns the exception for the
     * caller to throw.
     */
    protected final ConnectionFailureException fail(String message, Throwable cause) {
        ConnectionFailureException failure = new ConnectionFailureException(this + ": " + message, cause);
        observabilitySink.onError(new NetErrorEvent(wallClock.now(), toString(), message, cause));
        try {
            disconnect();
        }
        catch (RuntimeException e) {
            failure.addSuppressed(e);
        }
        return failure;
    }

    private void closeSocket() {
        Socket s = socket;
        if (s == null) {
            return;
        }
        try {
            s.close();
        }
        catch (IOException e) {
            observabilitySink.onError(new NetErrorEvent(wallClock.now(), toString(), "socket close failed", e));
        }
    }

    protected final void report(TransportEvent.Kind kind, String detail) {
        observabilitySink.onTransportEvent(new TransportEvent(wallClock.now(), kind, toString(), detail));
    }

    private static void checkPayloadLength(byte[] payload) {
        if (payload.length > PacketCodec.MAX_PAYLOAD_LENGTH) {
            throw new IllegalArgumentException(
                    "Payload of " + payload.length + " bytes exceeds " + PacketCodec.MAX_PAYLOAD_LENGTH);
        }
    }
}
