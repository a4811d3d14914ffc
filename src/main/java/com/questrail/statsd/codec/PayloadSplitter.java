package com.questrail.statsd.codec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * PayloadSplitter
 * -----------------------------------------------------------------------------
 * Splits an encoded payload into datagram-sized chunks at line boundaries.
 *
 * <h2>Rule</h2>
 * <ul>
 *   <li>If {@code limit <= 0} or the payload fits, the payload is returned
 *       unchanged as the only chunk.</li>
 *   <li>Otherwise the payload is scanned backward from relative index
 *       {@code limit} down to relative index {@code 1}, both inclusive, for a
 *       {@code '\n'}. The rightmost one found at index {@code i} ends the chunk
 *       {@code [0, i)}, which is at most {@code limit} bytes. The newline itself
 *       is consumed and the rest, {@code [i + 1, end)}, is split by the same
 *       rule.</li>
 *   <li>If no newline exists in that window the remaining bytes cannot be
 *       split safely and are returned as one oversized chunk. The transport
 *       still attempts to send it.</li>
 * </ul>
 *
 * <p>A newline at index {@code 0} is never used as a split point: it would
 * produce an empty datagram.</p>
 *
 * <p>Bytes are never dropped, reordered or inserted, apart from the consumed
 * split newlines. Chunks are views over the input's backing array.</p>
 *
 * <p>The rule is defined recursively but applied iteratively here; every
 * prefix cut by the rule already fits, so only the suffix ever needs further
 * work.</p>
 */
public final class PayloadSplitter
{
    static final byte NEWLINE = '\n';

    private PayloadSplitter() {}

    /**
     * @param payload encoded payload, possibly several newline-joined lines
     * @param limit   maximum datagram payload size in bytes; {@code <= 0} disables splitting
     * @return ordered, non-empty list of chunks
     */
    public static List<ByteView> split(ByteView payload, int limit)
    {
        Objects.requireNonNull(payload, "payload");

        if (limit <= 0 || payload.length() <= limit) {
            return Collections.singletonList(payload);
        }

        List<ByteView> chunks = new ArrayList<>();
        ByteView remaining = payload;

        while (remaining.length() > limit) {
            final int splitAt = lastNewlineWithin(remaining, limit);
            if (splitAt < 0) {
                // Oversized and unsplittable: send as-is.
                break;
            }

            chunks.add(remaining.slice(0, splitAt));
            remaining = remaining.sliceFrom(splitAt + 1);

            if (remaining.isEmpty()) {
                return Collections.unmodifiableList(chunks);
            }
        }

        chunks.add(remaining);
        return Collections.unmodifiableList(chunks);
    }

    /**
     * Convenience overload over a whole array.
     */
    public static List<ByteView> split(byte[] payload, int limit)
    {
        return split(ByteView.of(payload), limit);
    }

    /**
     * Index of the rightmost newline in {@code [1, limit]}, or {@code -1}.
     * Requires {@code view.length() > limit}, so index {@code limit} exists.
     */
    private static int lastNewlineWithin(ByteView view, int limit)
    {
        final byte[] array = view.array();
        final int base = view.offset();

        for (int i = limit; i > 0; i--) {
            if (array[base + i] == NEWLINE) {
                return i;
            }
        }
        return -1;
    }
}
