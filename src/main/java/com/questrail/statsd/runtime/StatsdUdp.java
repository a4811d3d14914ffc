package com.questrail.statsd.runtime;

import com.questrail.statsd.api.StatsdException;
import com.questrail.statsd.api.StatsdTransport;
import com.questrail.statsd.config.StatsdEnvironment;
import com.questrail.statsd.config.StatsdUdpConfig;
import com.questrail.statsd.observability.NullObservabilitySink;
import com.questrail.statsd.observability.StatsdErrorEvent;
import com.questrail.statsd.observability.StatsdObservabilitySink;
import com.questrail.statsd.resolve.EndpointResolver;
import com.questrail.statsd.resolve.StatsdEndpoint;
import com.questrail.statsd.send.AsyncSender;
import com.questrail.statsd.send.BlockingSender;
import com.questrail.statsd.transport.DatagramTransport;
import com.questrail.statsd.transport.udp.netty.NettyDatagramTransport;

import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * StatsdUdp
 * =============================================================================
 * Composition root and lifecycle owner for the StatsD UDP transport.
 *
 * <h2>Construction order</h2>
 * <ol>
 *   <li>Explicit configuration is completed from the environment
 *       ({@link StatsdEnvironment}).</li>
 *   <li>The destination is resolved to an IPv4 {@link StatsdEndpoint}.</li>
 *   <li>Only then is the socket opened.</li>
 * </ol>
 * A failure at any step aborts construction with the step's exception; no
 * socket is left open.
 *
 * <p>No protocol semantics live here. Splitting lives in the codec layer, I/O
 * in the transport adapter; this class only wires them together and owns the
 * transport's lifetime.</p>
 */
public final class StatsdUdp implements StatsdTransport {

    /**
     * Opens the transport once the endpoint is known.
     */
    @FunctionalInterface
    public interface TransportFactory {
        DatagramTransport open(StatsdEndpoint endpoint, StatsdUdpConfig config);
    }

    private final StatsdUdpConfig config;
    private final DatagramTransport transport;
    private final BlockingSender blockingSender;
    private final AsyncSender asyncSender;
    private final StatsdObservabilitySink sink;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private StatsdUdp(StatsdUdpConfig config, DatagramTransport transport, StatsdObservabilitySink sink) {
        this.config = config;
        this.transport = transport;
        this.sink = sink;
        this.blockingSender = new BlockingSender(transport, config.maxPacketSize(), sink);
        this.asyncSender = new AsyncSender(transport, config.maxPacketSize(), sink);
    }

    /**
     * Transport to {@code host:port}, falling back to the environment for a
     * missing host ({@code null}) or port ({@code 0}).
     */
    public static StatsdUdp create(String host, int port, int maxPacketSize) {
        return create(host, port, maxPacketSize, StatsdEnvironment.system());
    }

    static StatsdUdp create(String host, int port, int maxPacketSize, StatsdEnvironment environment) {
        return builder()
                .withEnvironment(environment)
                .withHost(host)
                .withPort(port)
                .withMaxPacketSize(maxPacketSize)
                .build();
    }

    /**
     * Transport configured entirely from {@code DD_AGENT_HOST} and
     * {@code DD_DOGSTATSD_PORT}, with the default maximum packet size.
     */
    public static StatsdUdp fromEnvironment() {
        return fromEnvironment(StatsdEnvironment.system());
    }

    static StatsdUdp fromEnvironment(StatsdEnvironment environment) {
        return builder().withEnvironment(environment).build();
    }

    @Override
    public StatsdEndpoint endpoint() {
        return transport.endpoint();
    }

    public int maxPacketSize() {
        return config.maxPacketSize();
    }

    @Override
    public void send(String text) {
        blockingSender.send(text);
    }

    @Override
    public CompletableFuture<Void> sendAsync(String text) {
        return asyncSender.sendAsync(text);
    }

    public boolean isOpen() {
        return !closed.get() && transport.isOpen();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        transport.close();
        sink.onTransportClosed(transport.endpoint());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final StatsdUdpConfig.Builder config = StatsdUdpConfig.builder();
        private StatsdEnvironment environment = StatsdEnvironment.system();
        private EndpointResolver resolver = new EndpointResolver();
        private StatsdObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private TransportFactory transportFactory =
                (endpoint, cfg) -> new NettyDatagramTransport(endpoint, cfg.bindAddress());

        public Builder withConfig(StatsdUdpConfig config) {
            Objects.requireNonNull(config, "config");
            this.config
                    .withHost(config.host())
                    .withPort(config.port())
                    .withMaxPacketSize(config.maxPacketSize())
                    .withBindAddress(config.bindAddress());
            return this;
        }

        public Builder withHost(String host) {
            config.withHost(host);
            return this;
        }

        public Builder withPort(int port) {
            config.withPort(port);
            return this;
        }

        public Builder withMaxPacketSize(int maxPacketSize) {
            config.withMaxPacketSize(maxPacketSize);
            return this;
        }

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            config.withBindAddress(bindAddress);
            return this;
        }

        public Builder withEnvironment(StatsdEnvironment environment) {
            this.environment = environment;
            return this;
        }

        public Builder withResolver(EndpointResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder withObservabilitySink(StatsdObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withTransportFactory(TransportFactory factory) {
            this.transportFactory = factory;
            return this;
        }

        /**
         * @throws com.questrail.statsd.config.ConfigurationException      if configuration is malformed or incomplete
         * @throws com.questrail.statsd.resolve.AddressResolutionException if no IPv4 address can be resolved
         * @throws com.questrail.statsd.transport.TransportException       if the socket cannot be opened
         */
        public StatsdUdp build() {
            Objects.requireNonNull(environment, "environment");
            Objects.requireNonNull(resolver, "resolver");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(transportFactory, "transportFactory");

            try {
                StatsdUdpConfig effective = environment.applyDefaults(config.build());

                StatsdEndpoint endpoint = resolver.resolve(effective.host(), effective.port());
                observabilitySink.onEndpointResolved(endpoint);

                DatagramTransport transport = Objects.requireNonNull(
                        transportFactory.open(endpoint, effective),
                        "transportFactory returned null");

                return new StatsdUdp(effective, transport, observabilitySink);
            } catch (StatsdException e) {
                observabilitySink.onError(new StatsdErrorEvent(Instant.now(), e.getMessage(), e));
                throw e;
            }
        }
    }
}
