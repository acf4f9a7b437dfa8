package com.questrail.packetnet.config;

import com.questrail.packetnet.observability.NullNetObservabilitySink;
import com.questrail.packetnet.observability.Slf4jNetObservabilitySink;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class ConfigValidationTest
{
    // ---------------------------------------------------------------------
    // ServerConfig
    // ---------------------------------------------------------------------

    @Test
    void serverDefaults() {
        ServerConfig config = ServerConfig.builder().build();

        assertEquals("127.0.0.1", config.host());
        assertEquals(0, config.port());
        assertEquals(ServerConfig.DEFAULT_BACKLOG, config.backlog());
        assertEquals(0, config.maxConnections());
        assertEquals(Duration.ofMillis(100), config.pollInterval());
        assertEquals(ConnectionIdPolicy.REGISTRY_SIZE, config.idPolicy());
        assertSame(Slf4jNetObservabilitySink.INSTANCE, config.observabilitySink());
    }

    @Test
    void serverRejectsOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.builder().withPort(-1).build());
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.builder().withPort(65536).build());
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.builder().withBacklog(-1).build());
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.builder().withMaxConnections(-1).build());
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.builder().withPollInterval(Duration.ZERO).build());
        assertThrows(NullPointerException.class, () -> ServerConfig.builder().withHost(null).build());
        assertThrows(NullPointerException.class, () -> ServerConfig.builder().withIdPolicy(null).build());
    }

    @Test
    void serverBuilderCarriesOverrides() {
        ServerConfig config = ServerConfig.builder()
                .withHost("0.0.0.0")
                .withPort(9000)
                .withBacklog(16)
                .withMaxConnections(4)
                .withPollInterval(Duration.ofMillis(25))
                .withIdPolicy(ConnectionIdPolicy.MONOTONIC)
                .withObservabilitySink(NullNetObservabilitySink.INSTANCE)
                .build();

        assertEquals("0.0.0.0", config.host());
        assertEquals(9000, config.port());
        assertEquals(16, config.backlog());
        assertEquals(4, config.maxConnections());
        assertEquals(Duration.ofMillis(25), config.pollInterval());
        assertEquals(ConnectionIdPolicy.MONOTONIC, config.idPolicy());
        assertSame(NullNetObservabilitySink.INSTANCE, config.observabilitySink());
    }

    // ---------------------------------------------------------------------
    // ClientConfig
    // ---------------------------------------------------------------------

    @Test
    void clientDefaults() {
        ClientConfig config = ClientConfig.builder("localhost", 8080).build();

        assertEquals("localhost", config.host());
        assertEquals(8080, config.port());
        assertEquals(Duration.ofMillis(500), config.heartbeatInterval());
        assertEquals(ServerConfig.DEFAULT_POLL_INTERVAL, config.pollInterval());
        assertEquals(Duration.ZERO, config.connectTimeout());
    }

    @Test
    void clientRejectsOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class, () -> ClientConfig.builder("h", 0).build());
        assertThrows(IllegalArgumentException.class, () -> ClientConfig.builder("h", 70000).build());
        assertThrows(IllegalArgumentException.class,
                () -> ClientConfig.builder("h", 1).withHeartbeatInterval(Duration.ofMillis(-1)).build());
        assertThrows(IllegalArgumentException.class,
                () -> ClientConfig.builder("h", 1).withPollInterval(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> ClientConfig.builder("h", 1).withConnectTimeout(Duration.ofSeconds(-1)).build());
        assertThrows(NullPointerException.class, () -> ClientConfig.builder(null, 1).build());
    }

    @Test
    void connectTimeoutMustFitSocketConnect() {
        ClientConfig longest = ClientConfig.builder("h", 1)
                .withConnectTimeout(ClientConfig.MAX_CONNECT_TIMEOUT)
                .build();
        assertEquals(Integer.MAX_VALUE, longest.connectTimeout().toMillis());

        assertThrows(IllegalArgumentException.class,
                () -> ClientConfig.builder("h", 1).withConnectTimeout(Duration.ofDays(30)).build());
        assertThrows(IllegalArgumentException.class,
                () -> ClientConfig.builder("h", 1)
                        .withConnectTimeout(ClientConfig.MAX_CONNECT_TIMEOUT.plusMillis(1))
                        .build());
    }

    @Test
    void zeroHeartbeatIntervalIsAccepted() {
        ClientConfig config = ClientConfig.builder("h", 1).withHeartbeatInterval(Duration.ZERO).build();

        assertTrue(config.heartbeatInterval().isZero());
    }
}
