package com.questrail.statsd.observability;

import com.questrail.statsd.resolve.StatsdEndpoint;

import java.time.Instant;

/**
 * Record representing a datagram larger than the configured maximum packet
 * size that is being sent anyway because it has no line boundary to split on.
 */
public record OversizedDatagramEvent(
    Instant timestamp,
    StatsdEndpoint endpoint,
    int size,
    int limit
) {
}
