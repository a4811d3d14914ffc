package com.questrail.statsd.send;

import com.questrail.statsd.codec.ByteView;
import com.questrail.statsd.observability.StatsdErrorEvent;
import com.questrail.statsd.observability.StatsdObservabilitySink;
import com.questrail.statsd.transport.DatagramTransport;
import com.questrail.statsd.transport.TransportException;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * BlockingSender
 * =============================================================================
 * Blocking send path.
 *
 * <pre>
 *   String
 *      → UTF-8 bytes
 *          → PayloadSplitter
 *              → DatagramTransport.send(chunk)   (once per chunk, in order)
 * </pre>
 *
 * <p>Runs entirely on the calling thread. The first failed chunk aborts the
 * call and its {@link TransportException} is thrown; earlier chunks have
 * already been sent and later ones are not attempted.</p>
 */
public final class BlockingSender
{
    private final DatagramTransport transport;
    private final int maxPacketSize;
    private final StatsdObservabilitySink sink;

    public BlockingSender(DatagramTransport transport, int maxPacketSize, StatsdObservabilitySink sink)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        Chunking.checkMaxPacketSize(maxPacketSize);
        this.maxPacketSize = maxPacketSize;
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * @throws TransportException on the first chunk that cannot be sent
     */
    public void send(String text)
    {
        List<ByteView> chunks = Chunking.plan(text, maxPacketSize, transport.endpoint(), sink);

        for (ByteView chunk : chunks) {
            try {
                transport.send(chunk);
            } catch (TransportException e) {
                sink.onError(new StatsdErrorEvent(Instant.now(), e.getMessage(), e));
                throw e;
            }
        }
    }
}
