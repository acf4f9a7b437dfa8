package com.questrail.packetnet.client;

import com.questrail.packetnet.config.ClientConfig;
import com.questrail.packetnet.observability.RecordingNetObservabilitySink;
import com.questrail.packetnet.observability.TransportEvent;
import com.questrail.packetnet.protocol.codec.PacketCodec;
import com.questrail.packetnet.protocol.codec.PacketDecodeException;
import com.questrail.packetnet.protocol.model.Header;
import com.questrail.packetnet.protocol.model.Packet;
import com.questrail.packetnet.protocol.model.PacketFormat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PacketClientTest
 * -----------------------------------------------------------------------------
 * Exercises the client against a bare loopback {@link ServerSocket} so the
 * test controls exactly which frames the "server" sends back.
 */
final class PacketClientTest
{
    private static final byte[] PONG_FRAME = PacketCodec.encodePacket(PacketFormat.HEARTBEAT_PONG, new byte[0]);

    private final RecordingNetObservabilitySink sink = new RecordingNetObservabilitySink();
    private ServerSocket listener;
    private Socket peer;
    private PacketClient client;

    @BeforeEach
    void setUp() throws IOException {
        listener = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
    }

    @AfterEach
    void tearDown() throws Exception {
        if (client != null) {
            client.disconnect();
            client.awaitTermination(Duration.ofSeconds(2));
        }
        if (peer != null) {
            peer.close();
        }
        listener.close();
    }

    // ---------------------------------------------------------------------
    // Heartbeat
    // ---------------------------------------------------------------------

    /**
     * With no pong coming back, exactly one ping is outstanding and no second
     * ping is sent no matter how long the interval has elapsed.
     */
    @Test
    void unansweredPingBlocksFurtherPings() throws Exception {
        connect(ClientConfig.builder("127.0.0.1", listener.getLocalPort())
                .withHeartbeatInterval(Duration.ofMillis(100)));

        Packet first = readFrame(peer.getInputStream());
        assertEquals(PacketFormat.HEARTBEAT_PING, first.format());
        assertEquals(0, first.payloadLength());

        peer.setSoTimeout(600);
        assertThrows(SocketTimeoutException.class, () -> readFrame(peer.getInputStream()));

        assertTrue(client.isHeartbeatPending());
        assertEquals(Duration.ZERO, client.latency());
    }

    @Test
    void pongCompletesCycleAndUpdatesLatency() throws Exception {
        connect(ClientConfig.builder("127.0.0.1", listener.getLocalPort())
                .withHeartbeatInterval(Duration.ofMillis(100)));
        InputStream in = peer.getInputStream();
        OutputStream out = peer.getOutputStream();

        assertEquals(PacketFormat.HEARTBEAT_PING, readFrame(in).format());
        Thread.sleep(30);
        out.write(PONG_FRAME);
        out.flush();

        awaitLatency();
        assertTrue(client.latency().compareTo(Duration.ofMillis(20)) >= 0,
                "latency covers the delayed pong: " + client.latency());

        // The next cycle starts once the pong is in.
        assertEquals(PacketFormat.HEARTBEAT_PING, readFrame(in).format());
        assertEquals(1, sink.transportEvents(TransportEvent.Kind.HEARTBEAT).size());
    }

    /**
     * When every ping is answered at once, pings are spaced by the heartbeat
     * interval measured from the previous ping.
     */
    @Test
    void answeredPingsFollowTheInterval() throws Exception {
        connect(ClientConfig.builder("127.0.0.1", listener.getLocalPort()));
        InputStream in = peer.getInputStream();
        OutputStream out = peer.getOutputStream();

        assertEquals(PacketFormat.HEARTBEAT_PING, readFrame(in).format());
        long firstAt = System.nanoTime();
        long window = Duration.ofMillis(2_200).toNanos();
        int pings = 1;

        out.write(PONG_FRAME);
        out.flush();
        while (true) {
            long remaining = window - (System.nanoTime() - firstAt);
            if (remaining <= 0) {
                break;
            }
            peer.setSoTimeout((int) Math.max(1, TimeUnit.NANOSECONDS.toMillis(remaining)));
            try {
                assertEquals(PacketFormat.HEARTBEAT_PING, readFrame(in).format());
            }
            catch (SocketTimeoutException e) {
                break;
            }
            if (System.nanoTime() - firstAt > window) {
                break;
            }
            pings++;
            out.write(PONG_FRAME);
            out.flush();
        }

        // 500 ms default interval: pings at 0, 500, 1000, 1500, 2000.
        assertTrue(pings <= 5, "too many pings: " + pings);
        assertTrue(pings >= 3, "too few pings: " + pings);
    }

    @Test
    void zeroIntervalDisablesHeartbeat() throws Exception {
        connect(ClientConfig.builder("127.0.0.1", listener.getLocalPort())
                .withHeartbeatInterval(Duration.ZERO));

        peer.setSoTimeout(700);
        assertThrows(SocketTimeoutException.class, () -> readFrame(peer.getInputStream()));
        assertFalse(client.isHeartbeatPending());
    }

    // ---------------------------------------------------------------------
    // Inbound routing
    // ---------------------------------------------------------------------

    @Test
    void unsolicitedPongIsConsumedAndOtherFramesAreDelivered() throws Exception {
        BlockingQueue<Packet> inbox = new LinkedBlockingQueue<>();
        client = new PacketClient(ClientConfig.builder("127.0.0.1", listener.getLocalPort())
                .withHeartbeatInterval(Duration.ZERO)
                .withObservabilitySink(sink)
                .build());
        client.register(ClientEvents.ON_PACKET, inbox::add);
        client.connect();
        peer = listener.accept();

        OutputStream out = peer.getOutputStream();
        out.write(PONG_FRAME);
        out.write(PacketCodec.encodePacket(PacketFormat.RAW, "data".getBytes(StandardCharsets.US_ASCII)));
        out.write(PacketCodec.encodePacket(PacketFormat.HEARTBEAT_PING, new byte[0]));
        out.flush();

        Packet raw = inbox.poll(5, TimeUnit.SECONDS);
        assertNotNull(raw);
        assertEquals(PacketFormat.RAW, raw.format());
        assertEquals("data", new String(raw.payload(), StandardCharsets.US_ASCII));

        Packet ping = inbox.poll(5, TimeUnit.SECONDS);
        assertNotNull(ping);
        assertEquals(PacketFormat.HEARTBEAT_PING, ping.format());

        assertNull(inbox.poll(200, TimeUnit.MILLISECONDS));
        assertEquals(Duration.ZERO, client.latency());
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Test
    void connectTriggersOnConnectAndPeerCloseTriggersOnDisconnectOnce() throws Exception {
        AtomicInteger connects = new AtomicInteger();
        AtomicInteger disconnects = new AtomicInteger();
        CountDownLatch down = new CountDownLatch(1);
        client = new PacketClient(ClientConfig.builder("127.0.0.1", listener.getLocalPort())
                .withObservabilitySink(sink)
                .build());
        client.register(ClientEvents.ON_CONNECT, connects::incrementAndGet);
        client.register(ClientEvents.ON_DISCONNECT, () -> {
            disconnects.incrementAndGet();
            down.countDown();
        });

        client.connect();
        peer = listener.accept();
        assertEquals(1, connects.get());
        assertTrue(client.isRunning());

        peer.close();

        assertTrue(down.await(5, TimeUnit.SECONDS));
        client.disconnect();
        assertEquals(1, disconnects.get());
        assertFalse(client.isRunning());
        assertTrue(client.awaitTermination(Duration.ofSeconds(2)));
    }

    @Test
    void connectIsOneShot() throws Exception {
        connect(ClientConfig.builder("127.0.0.1", listener.getLocalPort()));

        assertThrows(IllegalStateException.class, () -> client.connect());
    }

    @Test
    void nullConfigIsRejectedByName() {
        NullPointerException e = assertThrows(NullPointerException.class, () -> new PacketClient(null));

        assertEquals("config", e.getMessage());
    }

    @Test
    void connectToClosedPortFails() throws Exception {
        int port;
        try (ServerSocket probe = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = probe.getLocalPort();
        }
        PacketClient unreachable = new PacketClient(ClientConfig.builder("127.0.0.1", port)
                .withObservabilitySink(sink)
                .build());

        assertThrows(IOException.class, unreachable::connect);
        assertFalse(unreachable.isRunning());
        assertTrue(sink.transportEvents(TransportEvent.Kind.CONNECTED).isEmpty());
    }

    @Test
    void queuedPayloadsReachThePeer() throws Exception {
        connect(ClientConfig.builder("127.0.0.1", listener.getLocalPort())
                .withHeartbeatInterval(Duration.ZERO));

        client.enqueue("one".getBytes(StandardCharsets.US_ASCII));
        client.enqueue("two".getBytes(StandardCharsets.US_ASCII));

        InputStream in = peer.getInputStream();
        assertEquals("one", new String(readFrame(in).payload(), StandardCharsets.US_ASCII));
        assertEquals("two", new String(readFrame(in).payload(), StandardCharsets.US_ASCII));
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private void connect(ClientConfig.Builder builder) throws IOException {
        client = new PacketClient(builder.withObservabilitySink(sink).build());
        client.connect();
        peer = listener.accept();
        peer.setSoTimeout(5_000);
    }

    private void awaitLatency() throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (client.latency().isZero()) {
            if (System.nanoTime() > deadline) {
                fail("latency was never measured");
            }
            Thread.sleep(10);
        }
    }

    private static Packet readFrame(InputStream in) throws IOException, PacketDecodeException {
        Header header = PacketCodec.decodeHeader(in.readNBytes(PacketCodec.HEADER_LENGTH));
        return new Packet(in.readNBytes(header.length()), header, System.nanoTime());
    }
}
