package com.questrail.statsd.resolve;

import java.net.Inet4Address;
import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Resolved destination of every datagram: an IPv4 address and a port.
 *
 * <p>Produced once by {@link EndpointResolver} and never re-resolved.</p>
 */
public record StatsdEndpoint(Inet4Address address, int port) {

    public StatsdEndpoint {
        Objects.requireNonNull(address, "address");
        if (port < 1 || port > 0xFFFF) {
            throw new IllegalArgumentException("Destination port must be 1-65535: " + port);
        }
    }

    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(address, port);
    }

    @Override
    public String toString() {
        return address.getHostAddress() + ":" + port;
    }
}
