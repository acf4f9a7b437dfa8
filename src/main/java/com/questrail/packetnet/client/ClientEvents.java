package com.questrail.packetnet.client;

import com.questrail.packetnet.event.EventType;
import com.questrail.packetnet.protocol.model.Packet;

import java.util.Set;
import java.util.function.Consumer;

/**
 * The events a {@link PacketClient} triggers.
 *
 * <ul>
 *   <li>{@link #ON_CONNECT}: socket connected; runs on the thread that called
 *       {@link PacketClient#connect()}, before the workers start</li>
 *   <li>{@link #ON_DISCONNECT}: runs once, on whichever thread performed the
 *       disconnect</li>
 *   <li>{@link #ON_PACKET}: a packet other than a heartbeat reply arrived;
 *       runs on the dispatch thread</li>
 * </ul>
 */
public final class ClientEvents
{
    public static final EventType<Runnable> ON_CONNECT = EventType.named("on_connect");
    public static final EventType<Runnable> ON_DISCONNECT = EventType.named("on_disconnect");
    public static final EventType<Consumer<Packet>> ON_PACKET = EventType.named("on_packet");

    static final Set<EventType<?>> ALL = Set.of(ON_CONNECT, ON_DISCONNECT, ON_PACKET);

    private ClientEvents() {}
}
