package com.questrail.statsd.send;

import com.questrail.statsd.codec.ByteView;
import com.questrail.statsd.codec.PayloadSplitter;
import com.questrail.statsd.observability.OversizedDatagramEvent;
import com.questrail.statsd.observability.StatsdObservabilitySink;
import com.questrail.statsd.resolve.StatsdEndpoint;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Encoding and splitting shared by {@link BlockingSender} and {@link AsyncSender},
 * so both paths put identical datagrams on the wire.
 */
final class Chunking
{
    private Chunking() {}

    static List<ByteView> plan(String text,
                               int maxPacketSize,
                               StatsdEndpoint endpoint,
                               StatsdObservabilitySink sink)
    {
        Objects.requireNonNull(text, "text");

        List<ByteView> chunks = PayloadSplitter.split(ByteView.utf8(text), maxPacketSize);

        if (maxPacketSize > 0) {
            for (ByteView chunk : chunks) {
                if (chunk.length() > maxPacketSize) {
                    sink.onOversizedDatagram(
                            new OversizedDatagramEvent(Instant.now(), endpoint, chunk.length(), maxPacketSize));
                }
            }
        }
        return chunks;
    }

    static void checkMaxPacketSize(int maxPacketSize)
    {
        if (maxPacketSize < 0) {
            throw new IllegalArgumentException("maxPacketSize must be >= 0: " + maxPacketSize);
        }
    }
}
