package com.questrail.statsd.transport;

import com.questrail.statsd.codec.ByteView;
import com.questrail.statsd.resolve.StatsdEndpoint;

import java.util.concurrent.CompletableFuture;

/**
 * DatagramTransport
 * -----------------------------------------------------------------------------
 * Owns one datagram socket and the one endpoint every datagram is sent to.
 *
 * <p>The socket is opened when the implementation is constructed and released
 * by {@link #close()}. Both send operations transmit one payload as one
 * datagram; splitting happens above this port.</p>
 *
 * <p>Sending after {@link #close()} is a caller error and is reported as a
 * {@link TransportException}.</p>
 */
public interface DatagramTransport extends AutoCloseable
{
    /**
     * The destination fixed at construction.
     */
    StatsdEndpoint endpoint();

    /**
     * Send one datagram, blocking the calling thread until the socket write
     * has completed.
     *
     * @throws TransportException if the write failed or the transport is closed
     */
    void send(ByteView payload);

    /**
     * Send one datagram without blocking.
     *
     * <p>The returned future completes when the socket write has completed, or
     * fails with a {@link TransportException}. It never throws.</p>
     */
    CompletableFuture<Void> sendAsync(ByteView payload);

    boolean isOpen();

    /**
     * Release the socket. Idempotent.
     */
    @Override
    void close();
}
