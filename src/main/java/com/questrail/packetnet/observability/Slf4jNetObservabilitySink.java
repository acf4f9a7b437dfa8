package com.questrail.packetnet.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of NetObservabilitySink that emits logs via SLF4J.
 *
 * <p>Lifecycle transitions are logged at INFO. Peer teardown and heartbeats are
 * routine and go to DEBUG and TRACE respectively.</p>
 */
public final class Slf4jNetObservabilitySink implements NetObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jNetObservabilitySink.class);

    public static final Slf4jNetObservabilitySink INSTANCE = new Slf4jNetObservabilitySink();

    @Override
    public void onTransportEvent(TransportEvent event) {
        switch (event.kind()) {
            case HEARTBEAT:
                log.trace("{} heartbeat {}", event.endpoint(), event.detail());
                break;
            case PEER_CLOSED:
            case PEER_RESET:
                log.debug("{} {} {}", event.endpoint(), event.kind(), event.detail());
                break;
            default:
                log.info("{} {} {}", event.endpoint(), event.kind(), event.detail());
                break;
        }
    }

    @Override
    public void onError(NetErrorEvent event) {
        log.error("{}: {}", event.endpoint(), event.message(), event.cause());
    }
}
