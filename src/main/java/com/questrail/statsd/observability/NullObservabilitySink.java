package com.questrail.statsd.observability;

import com.questrail.statsd.resolve.StatsdEndpoint;

/**
 * No-op implementation of StatsdObservabilitySink.
 */
public final class NullObservabilitySink implements StatsdObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onEndpointResolved(StatsdEndpoint endpoint) {}

    @Override
    public void onOversizedDatagram(OversizedDatagramEvent event) {}

    @Override
    public void onTransportClosed(StatsdEndpoint endpoint) {}

    @Override
    public void onError(StatsdErrorEvent event) {}
}
