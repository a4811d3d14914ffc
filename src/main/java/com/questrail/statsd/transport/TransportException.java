package com.questrail.statsd.transport;

import com.questrail.statsd.api.StatsdException;

/**
 * Indicates that the underlying socket could not be opened or that a
 * datagram could not be handed to it.
 *
 * <p>Never retried by the transport.</p>
 */
public final class TransportException extends StatsdException
{
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
