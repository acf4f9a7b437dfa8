package com.questrail.packetnet.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * EventBus
 * =============================================================================
 * Typed multicast dispatcher over a closed set of events.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>The set of supported {@link EventType}s is fixed at construction;
 *       registering under any other key fails immediately.</li>
 *   <li>{@link #register} appends; there is no unregister.</li>
 *   <li>{@link #trigger} invokes every callback of the event in registration
 *       order, synchronously, on the calling thread. An event with no
 *       callbacks is a no-op.</li>
 *   <li>An exception thrown by a callback propagates out of {@link #trigger}
 *       and the remaining callbacks for that trigger are skipped. A worker loop
 *       that triggers an event treats the exception as fatal for its
 *       connection.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * Registration and triggering may happen on different threads. Callback lists
 * are copy-on-write, so a trigger sees a consistent snapshot.
 */
public final class EventBus
{
    private final Map<EventType<?>, List<Object>> callbacks;

    /**
     * Creates a bus that accepts exactly the given events.
     */
    public EventBus(Set<? extends EventType<?>> supported) {
        Objects.requireNonNull(supported, "supported");
        Map<EventType<?>, List<Object>> map = new LinkedHashMap<>();
        for (EventType<?> type : supported) {
            map.put(Objects.requireNonNull(type, "event type"), new CopyOnWriteArrayList<>());
        }
        this.callbacks = Collections.unmodifiableMap(map);
    }

    /**
     * Appends {@code callback} to the ordered callback list of {@code type}.
     *
     * @throws IllegalArgumentException if this bus does not support {@code type}
     */
    public <H> void register(EventType<H> type, H callback) {
        Objects.requireNonNull(callback, "callback");
        listFor(type).add(callback);
    }

    /**
     * Invokes every callback registered for {@code type}, in order.
     *
     * @param invoker applies the event arguments to one callback, e.g.
     *                {@code cb -> cb.accept(connection)}
     * @throws IllegalArgumentException if this bus does not support {@code type}
     */
    @SuppressWarnings("unchecked")
    public <H> void trigger(EventType<H> type, Consumer<? super H> invoker) {
        Objects.requireNonNull(invoker, "invoker");
        for (Object callback : listFor(type)) {
            invoker.accept((H) callback);
        }
    }

    /**
     * Returns the number of callbacks registered for {@code type}.
     */
    public int callbackCount(EventType<?> type) {
        return listFor(type).size();
    }

    /**
     * Returns the events this bus accepts, in the iteration order of the set
     * given at construction.
     */
    public List<EventType<?>> supportedEvents() {
        return new ArrayList<>(callbacks.keySet());
    }

    private List<Object> listFor(EventType<?> type) {
        Objects.requireNonNull(type, "type");
        List<Object> list = callbacks.get(type);
        if (list == null) {
            throw new IllegalArgumentException("Unsupported event: " + type);
        }
        return list;
    }
}
