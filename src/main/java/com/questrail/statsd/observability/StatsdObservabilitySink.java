package com.questrail.statsd.observability;

import com.questrail.statsd.resolve.StatsdEndpoint;

/**
 * Receives transport observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive on the caller's thread or on the transport's event
 * loop and must not block.</p>
 */
public interface StatsdObservabilitySink {
    /**
     * Called once the destination has been resolved, before the socket is opened.
     */
    void onEndpointResolved(StatsdEndpoint endpoint);

    /**
     * Called before an unsplittable, oversized datagram is sent.
     */
    void onOversizedDatagram(OversizedDatagramEvent event);

    /**
     * Called when the transport releases its socket.
     */
    void onTransportClosed(StatsdEndpoint endpoint);

    /**
     * Called when a resolution, bind or send failure is about to be propagated.
     */
    void onError(StatsdErrorEvent event);
}
