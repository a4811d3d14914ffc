package com.questrail.statsd.resolve;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Host name lookup used by {@link EndpointResolver}.
 *
 * <p>May return addresses of any family, in any order.</p>
 */
@FunctionalInterface
public interface NameService
{
    InetAddress[] lookup(String host) throws UnknownHostException;

    /**
     * The platform resolver ({@link InetAddress#getAllByName(String)}).
     */
    static NameService system() {
        return InetAddress::getAllByName;
    }
}
