package com.questrail.packetnet.observability;

/**
 * No-op implementation of NetObservabilitySink.
 */
public final class NullNetObservabilitySink implements NetObservabilitySink {
    public static final NullNetObservabilitySink INSTANCE = new NullNetObservabilitySink();

    private NullNetObservabilitySink() {}

    @Override
    public void onTransportEvent(TransportEvent event) {}

    @Override
    public void onError(NetErrorEvent event) {}
}
