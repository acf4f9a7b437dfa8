package com.questrail.packetnet.observability;

/**
 * Receives observability events from servers, clients and their connections.
 *
 * <p>Callbacks arrive on whichever worker or accept thread produced them and
 * may be concurrent. Implementations must be thread-safe and must not block.</p>
 */
public interface NetObservabilitySink {
    /**
     * Called for lifecycle and heartbeat events.
     * @param event the transport event
     */
    void onTransportEvent(TransportEvent event);

    /**
     * Called when a failure terminates a worker loop or the accept loop.
     * The failure is still propagated by the loop after this call.
     * @param event the error event
     */
    void onError(NetErrorEvent event);
}
