package com.questrail.statsd.observability;

import com.questrail.statsd.resolve.StatsdEndpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of StatsdObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jStatsdObservabilitySink implements StatsdObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jStatsdObservabilitySink.class);

    @Override
    public void onEndpointResolved(StatsdEndpoint endpoint) {
        log.info("StatsD endpoint resolved: {}", endpoint);
    }

    @Override
    public void onOversizedDatagram(OversizedDatagramEvent event) {
        log.debug("Sending unsplittable {}-byte datagram to {} (limit {})",
            event.size(), event.endpoint(), event.limit());
    }

    @Override
    public void onTransportClosed(StatsdEndpoint endpoint) {
        log.info("StatsD transport to {} closed", endpoint);
    }

    @Override
    public void onError(StatsdErrorEvent event) {
        log.error("StatsD Error: {}", event.message(), event.cause());
    }
}
