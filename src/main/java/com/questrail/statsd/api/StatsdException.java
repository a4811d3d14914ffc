package com.questrail.statsd.api;

/**
 * Base type for all failures raised by the StatsD UDP transport.
 *
 * <p>Every failure is unchecked. Construction failures (configuration,
 * resolution, socket bind) are thrown from the constructor that detected
 * them; send failures are thrown from the blocking path or delivered through
 * the future returned by the non-blocking path.</p>
 */
public class StatsdException extends RuntimeException
{
    public StatsdException(String message) {
        super(message);
    }

    public StatsdException(String message, Throwable cause) {
        super(message, cause);
    }
}
