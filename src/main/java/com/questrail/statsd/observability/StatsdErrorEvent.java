package com.questrail.statsd.observability;

import java.time.Instant;

/**
 * Record representing a failure in the transport stack: a failed resolution,
 * socket bind or send.
 *
 * <p>Reporting an error to a sink never replaces propagating it to the caller.</p>
 */
public record StatsdErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
