package com.questrail.statsd.config;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Construction parameters for the StatsD UDP transport.
 *
 * <p>{@code host == null} (or blank) and {@code port == 0} mean "not supplied";
 * {@link StatsdEnvironment#applyDefaults(StatsdUdpConfig)} fills them in.
 * {@code maxPacketSize == 0} disables splitting.</p>
 */
public record StatsdUdpConfig(
    String host,
    int port,
    int maxPacketSize,
    InetSocketAddress bindAddress
) {
    public static final int DEFAULT_PORT = 8125;
    public static final int DEFAULT_MAX_PACKET_SIZE = 8192;

    public StatsdUdpConfig {
        if (port < 0 || port > 0xFFFF) {
            throw new ConfigurationException("Port out of range: " + port);
        }
        if (maxPacketSize < 0) {
            throw new ConfigurationException("maxPacketSize must be >= 0 (0 disables splitting): " + maxPacketSize);
        }
        Objects.requireNonNull(bindAddress, "bindAddress");
    }

    public boolean hasHost() {
        return host != null && !host.isBlank();
    }

    public boolean hasPort() {
        return port != 0;
    }

    public StatsdUdpConfig withHost(String host) {
        return new StatsdUdpConfig(host, port, maxPacketSize, bindAddress);
    }

    public StatsdUdpConfig withPort(int port) {
        return new StatsdUdpConfig(host, port, maxPacketSize, bindAddress);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host;
        private int port;
        private int maxPacketSize = DEFAULT_MAX_PACKET_SIZE;
        private InetSocketAddress bindAddress = new InetSocketAddress("0.0.0.0", 0);

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withMaxPacketSize(int maxPacketSize) {
            this.maxPacketSize = maxPacketSize;
            return this;
        }

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public StatsdUdpConfig build() {
            return new StatsdUdpConfig(host, port, maxPacketSize, bindAddress);
        }
    }
}
