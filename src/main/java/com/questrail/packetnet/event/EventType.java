package com.questrail.packetnet.event;

import java.util.Objects;

/**
 * EventType
 * -----------------------------------------------------------------------------
 * Typed key for one named event of an {@link EventBus}.
 *
 * <p>The type parameter is the callback shape for the event, for example
 * {@code EventType<Runnable>} for an event without arguments or
 * {@code EventType<BiConsumer<Packet, ServerConnection>>} for a packet event
 * that also names the originating connection. Keys compare by identity; each
 * runtime declares its own constants.</p>
 *
 * @param <H> callback type registered under this key
 */
public final class EventType<H>
{
    private final String name;

    private EventType(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Declares a new event key.
     *
     * @param name event name, used only for diagnostics
     */
    public static <H> EventType<H> named(String name) {
        return new EventType<>(name);
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
