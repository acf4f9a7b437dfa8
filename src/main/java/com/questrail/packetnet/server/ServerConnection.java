package com.questrail.packetnet.server;

import com.questrail.packetnet.protocol.codec.PacketCodec;
import com.questrail.packetnet.protocol.model.Packet;
import com.questrail.packetnet.protocol.model.PacketFormat;
import com.questrail.packetnet.transport.AbstractPacketConnection;

import java.io.IOException;
import java.net.Socket;
import java.time.Instant;
import java.util.Objects;

/**
 * ServerConnection
 * -----------------------------------------------------------------------------
 * Server-side end of one accepted client connection.
 *
 * <p>Created only by {@link PacketServer}'s accept loop. Events fire through
 * the owning server's bus with this connection as an argument, so a single
 * set of callbacks can serve every client.</p>
 *
 * <p>Heartbeats are answered passively: a {@link PacketFormat#HEARTBEAT_PING}
 * is answered with an empty {@link PacketFormat#HEARTBEAT_PONG} written
 * straight to the socket from the dispatch thread, ahead of anything waiting
 * in the outbound queue. Every other packet goes to
 * {@link ServerEvents#ON_PACKET}.</p>
 */
public final class ServerConnection extends AbstractPacketConnection
{
    private static final byte[] PONG_FRAME = PacketCodec.encodePacket(PacketFormat.HEARTBEAT_PONG, new byte[0]);

    private final PacketServer server;
    private final int id;
    private final String remoteAddress;
    private final int remotePort;
    private final Instant connectedAt;
    private final Socket socket;

    ServerConnection(PacketServer server, Socket socket, int id) {
        super(server.config().pollInterval(),
                server.clock(),
                server.wallClock(),
                server.config().observabilitySink());
        this.server = Objects.requireNonNull(server, "server");
        this.socket = Objects.requireNonNull(socket, "socket");
        this.id = id;
        this.remoteAddress = socket.getInetAddress().getHostAddress();
        this.remotePort = socket.getPort();
        this.connectedAt = server.wallClock().now();
    }

    void start() throws IOException {
        startWorkers(socket, "packetnet-conn-" + id);
    }

    /**
     * Connection id. Unique among live connections under
     * {@code ConnectionIdPolicy.MONOTONIC}; see {@code ConnectionIdPolicy} for
     * the reuse rules of the default policy.
     */
    public int id() {
        return id;
    }

    public String remoteAddress() {
        return remoteAddress;
    }

    public int remotePort() {
        return remotePort;
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    @Override
    protected void dispatch(Packet packet) {
        if (packet.format() == PacketFormat.HEARTBEAT_PING) {
            writeFrame(PONG_FRAME, "heartbeat reply");
            return;
        }
        server.events().trigger(ServerEvents.ON_PACKET, cb -> cb.accept(packet, this));
    }

    @Override
    protected void onPacketReceived(Packet packet) {
        if (packet.format() == PacketFormat.RAW) {
            server.countPacket();
        }
    }

    @Override
    protected void onDisconnecting() {
        server.unregister(this);
        server.events().trigger(ServerEvents.ON_DISCONNECT, cb -> cb.accept(this));
    }

    @Override
    protected void onDisconnected() {
        server.releaseSlot();
    }

    @Override
    public String toString() {
        return "ServerConnection(" + id + ", " + remoteAddress + ":" + remotePort + ")";
    }
}
