package com.questrail.packetnet.config;

import com.questrail.packetnet.observability.NetObservabilitySink;
import com.questrail.packetnet.observability.Slf4jNetObservabilitySink;

import java.time.Duration;
import java.util.Objects;

/**
 * Construction-time configuration for a {@code PacketClient}.
 *
 * @param heartbeatInterval minimum spacing between two heartbeat pings; zero
 *                          disables heartbeats
 * @param connectTimeout    connect timeout; zero leaves it to the OS, at most
 *                          {@link #MAX_CONNECT_TIMEOUT}
 */
public record ClientConfig(
    String host,
    int port,
    Duration pollInterval,
    Duration heartbeatInterval,
    Duration connectTimeout,
    NetObservabilitySink observabilitySink
) {
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofMillis(500);

    /** Largest timeout {@link java.net.Socket#connect} accepts, in whole milliseconds. */
    public static final Duration MAX_CONNECT_TIMEOUT = Duration.ofMillis(Integer.MAX_VALUE);

    public ClientConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be 1-65535");
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be > 0");
        }
        if (heartbeatInterval.isNegative()) {
            throw new IllegalArgumentException("heartbeatInterval must be >= 0");
        }
        if (connectTimeout.isNegative() || connectTimeout.compareTo(MAX_CONNECT_TIMEOUT) > 0) {
            throw new IllegalArgumentException("connectTimeout must be 0-" + MAX_CONNECT_TIMEOUT.toMillis() + " ms");
        }
    }

    public static Builder builder(String host, int port) {
        return new Builder(host, port);
    }

    public static final class Builder {
        private final String host;
        private final int port;
        private Duration pollInterval = ServerConfig.DEFAULT_POLL_INTERVAL;
        private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
        private Duration connectTimeout = Duration.ZERO;
        private NetObservabilitySink observabilitySink = Slf4jNetObservabilitySink.INSTANCE;

        private Builder(String host, int port) {
            this.host = host;
            this.port = port;
        }

        public Builder withPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder withHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withObservabilitySink(NetObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(host, port, pollInterval, heartbeatInterval, connectTimeout, observabilitySink);
        }
    }
}
