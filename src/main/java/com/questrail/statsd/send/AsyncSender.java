package com.questrail.statsd.send;

import com.questrail.statsd.codec.ByteView;
import com.questrail.statsd.observability.StatsdErrorEvent;
import com.questrail.statsd.observability.StatsdObservabilitySink;
import com.questrail.statsd.transport.DatagramTransport;

import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * AsyncSender
 * =============================================================================
 * Non-blocking send path, producing the same datagrams as {@link BlockingSender}.
 *
 * <h2>Sequencing</h2>
 * Chunks are sent one at a time: the send of chunk {@code n + 1} is started
 * from the completion of chunk {@code n}, never before. At most one chunk of
 * a call is in flight, and the chunks of one call reach the socket in order.
 *
 * <h2>Completion</h2>
 * The returned future completes normally after the last chunk's send succeeds.
 * It fails with the transport's exception as soon as one chunk fails, and the
 * remaining chunks are never attempted. No exception is thrown by
 * {@link #sendAsync(String)} itself.
 *
 * <p>Continuations run on whichever thread completes the transport's future
 * (the event loop, for the Netty transport). No threads are created here.</p>
 */
public final class AsyncSender
{
    private final DatagramTransport transport;
    private final int maxPacketSize;
    private final StatsdObservabilitySink sink;

    public AsyncSender(DatagramTransport transport, int maxPacketSize, StatsdObservabilitySink sink)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        Chunking.checkMaxPacketSize(maxPacketSize);
        this.maxPacketSize = maxPacketSize;
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public CompletableFuture<Void> sendAsync(String text)
    {
        final List<ByteView> chunks;
        try {
            chunks = Chunking.plan(text, maxPacketSize, transport.endpoint(), sink);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<Void> completion = new CompletableFuture<>();
        sendNext(chunks.iterator(), completion);
        return completion;
    }

    /**
     * Issues chunks until one is still pending, then resumes from that
     * chunk's completion. Futures that are already done are consumed in the
     * loop, so the stack depth does not grow with the number of chunks.
     */
    private void sendNext(Iterator<ByteView> remaining, CompletableFuture<Void> completion)
    {
        while (remaining.hasNext()) {
            final CompletableFuture<Void> sent;
            try {
                sent = transport.sendAsync(remaining.next());
            } catch (RuntimeException e) {
                fail(completion, e);
                return;
            }

            if (!sent.isDone()) {
                sent.whenComplete((ignored, cause) -> {
                    if (cause != null) {
                        fail(completion, unwrap(cause));
                    }
                    else {
                        sendNext(remaining, completion);
                    }
                });
                return;
            }

            try {
                sent.join();
            } catch (CompletionException | CancellationException e) {
                fail(completion, unwrap(e));
                return;
            }
        }

        completion.complete(null);
    }

    private void fail(CompletableFuture<Void> completion, Throwable cause)
    {
        sink.onError(new StatsdErrorEvent(Instant.now(), "Send to " + transport.endpoint() + " failed", cause));
        completion.completeExceptionally(cause);
    }

    private static Throwable unwrap(Throwable cause)
    {
        Throwable t = cause;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
