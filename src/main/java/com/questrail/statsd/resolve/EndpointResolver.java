package com.questrail.statsd.resolve;

import io.netty.util.NetUtil;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Objects;

/**
 * EndpointResolver
 * =============================================================================
 * Turns a configured destination name and port into a {@link StatsdEndpoint}.
 *
 * <h2>Rules</h2>
 * <ol>
 *   <li>A literal IP address is used as-is; no lookup is performed. A literal
 *       IPv6 address is rejected unless it is IPv4-mapped, in which case the
 *       embedded IPv4 address is used.</li>
 *   <li>Any other name goes through the {@link NameService}. The result is
 *       scanned from the last entry toward the first and the first IPv4 entry
 *       found wins; resolvers tend to list IPv4 addresses last.</li>
 *   <li>If nothing qualifies, {@link AddressResolutionException} is thrown.
 *       There is no fallback to another address family and no retry.</li>
 * </ol>
 */
public final class EndpointResolver
{
    private final NameService nameService;

    public EndpointResolver()
    {
        this(NameService.system());
    }

    public EndpointResolver(NameService nameService)
    {
        this.nameService = Objects.requireNonNull(nameService, "nameService");
    }

    /**
     * @throws AddressResolutionException if no IPv4 address can be produced for {@code name}
     * @throws IllegalArgumentException   if {@code port} is not a valid destination port
     */
    public StatsdEndpoint resolve(String name, int port)
    {
        if (name == null || name.isBlank()) {
            throw new AddressResolutionException("No destination name to resolve");
        }

        final String host = name.trim();

        Inet4Address address = literalAddress(host);
        if (address == null) {
            address = lookupIpv4(host);
        }

        return new StatsdEndpoint(address, port);
    }

    /**
     * Returns the IPv4 address for a literal, or {@code null} if {@code host}
     * is not an address literal at all.
     */
    private static Inet4Address literalAddress(String host)
    {
        byte[] bytes = NetUtil.createByteArrayFromIpAddressString(host);
        if (bytes == null) {
            return null;
        }

        final InetAddress parsed;
        try {
            // No lookup happens for a raw address.
            parsed = InetAddress.getByAddress(bytes);
        } catch (UnknownHostException e) {
            throw new AddressResolutionException("Invalid address literal '" + host + "'", e);
        }

        if (parsed instanceof Inet4Address ipv4) {
            return ipv4;
        }
        throw new AddressResolutionException(
                "Address literal '" + host + "' is IPv6; an IPv4 destination is required");
    }

    private Inet4Address lookupIpv4(String host)
    {
        final InetAddress[] candidates;
        try {
            candidates = nameService.lookup(host);
        } catch (UnknownHostException e) {
            throw new AddressResolutionException("Unable to resolve '" + host + "'", e);
        }

        if (candidates != null) {
            for (int i = candidates.length - 1; i >= 0; i--) {
                if (candidates[i] instanceof Inet4Address ipv4) {
                    return ipv4;
                }
            }
        }

        throw new AddressResolutionException("No IPv4 address found for '" + host + "'");
    }
}
