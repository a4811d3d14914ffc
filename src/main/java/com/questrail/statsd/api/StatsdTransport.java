package com.questrail.statsd.api;

import com.questrail.statsd.resolve.StatsdEndpoint;

import java.util.concurrent.CompletableFuture;

/**
 * StatsdTransport
 * -----------------------------------------------------------------------------
 * Public send surface for already-formatted metric-protocol text.
 *
 * <p>Both send operations accept a single metric line or a batch of lines
 * joined by {@code '\n'}. Payloads larger than the configured maximum packet
 * size are split at line boundaries; a payload that cannot be split is sent
 * whole. Nothing is ever truncated.</p>
 *
 * <p>No delivery guarantee is made. A successful return only means the
 * datagrams were handed to the local socket.</p>
 */
public interface StatsdTransport extends AutoCloseable
{
    /**
     * The IPv4 endpoint resolved at construction.
     */
    StatsdEndpoint endpoint();

    /**
     * Send {@code text} on the calling thread, blocking until every chunk has
     * been written.
     *
     * <p>Chunks are written in order. The first failure stops the call and is
     * thrown; chunks already written are not recalled.</p>
     *
     * @throws com.questrail.statsd.transport.TransportException if a chunk could not be sent
     */
    void send(String text);

    /**
     * Send {@code text} without blocking the caller.
     *
     * <p>Chunks are sent strictly one after another. The returned future
     * completes when the last chunk has been written, or fails with the first
     * chunk failure, in which case later chunks are never attempted.</p>
     */
    CompletableFuture<Void> sendAsync(String text);

    /**
     * Release the socket. Calling this more than once has no further effect.
     */
    @Override
    void close();
}
