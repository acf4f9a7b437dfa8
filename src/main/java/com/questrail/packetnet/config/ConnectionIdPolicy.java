package com.questrail.packetnet.config;

/**
 * How a server numbers the connections it accepts.
 */
public enum ConnectionIdPolicy {
    /**
     * Id is the number of live connections at accept time. Ids are reused
     * after disconnects, and a new connection can share an id with a live one
     * when a lower-numbered connection left first.
     */
    REGISTRY_SIZE,

    /**
     * Id comes from a counter that starts at 0 and only increases. Ids are
     * unique for the lifetime of the server.
     */
    MONOTONIC
}
