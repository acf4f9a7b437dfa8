package com.questrail.packetnet.config;

import com.questrail.packetnet.observability.NetObservabilitySink;
import com.questrail.packetnet.observability.Slf4jNetObservabilitySink;

import java.net.InetAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Construction-time configuration for a {@code PacketServer}.
 *
 * @param host           address to bind
 * @param port           port to bind; 0 selects an ephemeral port
 * @param backlog        listen backlog for not-yet-accepted connections
 * @param maxConnections cap on concurrently live connections; 0 means no cap
 * @param pollInterval   bounded wait of the dispatch and send loops
 */
public record ServerConfig(
    String host,
    int port,
    int backlog,
    int maxConnections,
    Duration pollInterval,
    ConnectionIdPolicy idPolicy,
    NetObservabilitySink observabilitySink
) {
    public static final int DEFAULT_BACKLOG = 5;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    public ServerConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(idPolicy, "idPolicy");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be 0-65535");
        }
        if (backlog < 0) {
            throw new IllegalArgumentException("backlog must be >= 0");
        }
        if (maxConnections < 0) {
            throw new IllegalArgumentException("maxConnections must be >= 0");
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be > 0");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = InetAddress.getLoopbackAddress().getHostAddress();
        private int port = 0;
        private int backlog = DEFAULT_BACKLOG;
        private int maxConnections = 0;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private ConnectionIdPolicy idPolicy = ConnectionIdPolicy.REGISTRY_SIZE;
        private NetObservabilitySink observabilitySink = Slf4jNetObservabilitySink.INSTANCE;

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withBacklog(int backlog) {
            this.backlog = backlog;
            return this;
        }

        public Builder withMaxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder withPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder withIdPolicy(ConnectionIdPolicy idPolicy) {
            this.idPolicy = idPolicy;
            return this;
        }

        public Builder withObservabilitySink(NetObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(host, port, backlog, maxConnections, pollInterval, idPolicy, observabilitySink);
        }
    }
}
