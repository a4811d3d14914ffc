package com.questrail.statsd.resolve;

import com.questrail.statsd.api.StatsdException;

/**
 * Indicates that no IPv4 address could be derived from a configured
 * destination name.
 *
 * <p>Raised at construction so that a bad destination is reported
 * immediately instead of surfacing on the first send.</p>
 */
public final class AddressResolutionException extends StatsdException
{
    public AddressResolutionException(String message) {
        super(message);
    }

    public AddressResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
