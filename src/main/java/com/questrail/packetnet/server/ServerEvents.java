package com.questrail.packetnet.server;

import com.questrail.packetnet.event.EventType;
import com.questrail.packetnet.protocol.model.Packet;

import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * The events a {@link PacketServer} triggers.
 *
 * <ul>
 *   <li>{@link #ON_READY}: listening socket is bound; runs on the thread
 *       that called {@link PacketServer#start()}</li>
 *   <li>{@link #ON_CONNECT}: a connection was accepted; runs on the accept
 *       thread before the connection's workers start</li>
 *   <li>{@link #ON_DISCONNECT}: a connection was removed from the registry;
 *       runs on whichever thread performed the disconnect</li>
 *   <li>{@link #ON_PACKET}: a non-heartbeat packet arrived; runs on the
 *       connection's dispatch thread</li>
 * </ul>
 */
public final class ServerEvents
{
    public static final EventType<Runnable> ON_READY = EventType.named("on_ready");
    public static final EventType<Consumer<ServerConnection>> ON_CONNECT = EventType.named("on_connect");
    public static final EventType<Consumer<ServerConnection>> ON_DISCONNECT = EventType.named("on_disconnect");
    public static final EventType<BiConsumer<Packet, ServerConnection>> ON_PACKET = EventType.named("on_packet");

    static final Set<EventType<?>> ALL = Set.of(ON_READY, ON_CONNECT, ON_DISCONNECT, ON_PACKET);

    private ServerEvents() {}
}
