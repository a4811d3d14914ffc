package com.questrail.statsd.codec;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PayloadSplitterTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link PayloadSplitter}.
 *
 * <p>Split points are newline bytes found by scanning backward from relative
 * index {@code limit} to relative index {@code 1}. The newline at a split
 * point is consumed.</p>
 */
final class PayloadSplitterTest
{
    private static List<String> splitUtf8(String payload, int limit)
    {
        return PayloadSplitter.split(ByteView.utf8(payload), limit).stream()
                .map(ByteView::toUtf8String)
                .collect(Collectors.toList());
    }

    // ---------------------------------------------------------------------
    // No splitting
    // ---------------------------------------------------------------------

    @Test
    void payloadThatFitsIsReturnedUnchanged()
    {
        ByteView payload = ByteView.utf8("page.views:1|c\npage.load:320|ms");

        List<ByteView> chunks = PayloadSplitter.split(payload, payload.length());

        assertEquals(1, chunks.size());
        assertSame(payload, chunks.get(0));
    }

    @Test
    void zeroLimitNeverSplitsEvenAMegabyte()
    {
        byte[] bytes = new byte[1 << 20];
        new Random(42).nextBytes(bytes);
        ByteView payload = ByteView.of(bytes);

        List<ByteView> chunks = PayloadSplitter.split(payload, 0);

        assertEquals(1, chunks.size());
        assertSame(payload, chunks.get(0));
        assertArrayEquals(bytes, chunks.get(0).toByteArray());
    }

    @Test
    void negativeLimitIsTreatedAsNoLimit()
    {
        assertEquals(List.of("a\nb\nc"), splitUtf8("a\nb\nc", -1));
    }

    @Test
    void emptyPayloadIsASingleEmptyChunk()
    {
        List<ByteView> chunks = PayloadSplitter.split(new byte[0], 4);

        assertEquals(1, chunks.size());
        assertTrue(chunks.get(0).isEmpty());
    }

    // ---------------------------------------------------------------------
    // Splitting at newlines
    // ---------------------------------------------------------------------

    /**
     * The rightmost newline within the limit wins, so the first chunk is the
     * largest prefix that fits.
     */
    @Test
    void peelsLargestFittingPrefix()
    {
        assertEquals(List.of("abcde\nfghij", "klmno"), splitUtf8("abcde\nfghij\nklmno", 12));
    }

    @Test
    void splitsEveryLineWhenOnlyOneLineFits()
    {
        assertEquals(List.of("abcde", "fghij", "klmno"), splitUtf8("abcde\nfghij\nklmno", 8));
    }

    @Test
    void newlineExactlyAtLimitIsASplitPoint()
    {
        assertEquals(List.of("abcd", "efgh"), splitUtf8("abcd\nefgh", 4));
    }

    @Test
    void trailingNewlineAtLimitLeavesNoEmptyChunk()
    {
        assertEquals(List.of("abcde"), splitUtf8("abcde\n", 5));
    }

    @Test
    void newlineAtIndexZeroIsNotASplitPoint()
    {
        assertEquals(List.of("\nabcdefg"), splitUtf8("\nabcdefg", 5));
    }

    @Test
    void multiByteCharactersAreCountedInBytes()
    {
        // "é" is two bytes in UTF-8: "café" is five bytes.
        assertEquals(List.of("café", "thé"), splitUtf8("café\nthé", 5));
    }

    // ---------------------------------------------------------------------
    // Oversized passthrough
    // ---------------------------------------------------------------------

    @Test
    void unsplittablePayloadIsReturnedWhole()
    {
        assertEquals(List.of("abcdefg"), splitUtf8("abcdefg", 5));
    }

    @Test
    void newlineBeyondLimitDoesNotCount()
    {
        assertEquals(List.of("abcdefg\nh"), splitUtf8("abcdefg\nh", 5));
    }

    /**
     * Once the remainder has no newline within the limit it is sent as one
     * oversized chunk, including any later lines.
     */
    @Test
    void oversizedRemainderIsPassedThroughAfterEarlierSplits()
    {
        assertEquals(List.of("ab", "cdefghij\nkl"), splitUtf8("ab\ncdefghij\nkl", 4));
    }

    // ---------------------------------------------------------------------
    // Views and round trip
    // ---------------------------------------------------------------------

    @Test
    void respectsViewOffset()
    {
        byte[] backing = "XXXXabc\ndef\nghiYYYY".getBytes(StandardCharsets.US_ASCII);
        ByteView view = ByteView.of(backing, 4, 11); // "abc\ndef\nghi"

        List<ByteView> chunks = PayloadSplitter.split(view, 4);

        assertEquals(List.of("abc", "def", "ghi"),
                chunks.stream().map(ByteView::toUtf8String).collect(Collectors.toList()));
        for (ByteView chunk : chunks) {
            assertSame(backing, chunk.array(), "chunks must share the backing array");
        }
    }

    @Test
    void chunksRejoinToOriginalAndFitTheLimit()
    {
        Random random = new Random(7);
        int limit = 64;

        List<String> lines = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            StringBuilder line = new StringBuilder("svc.metric.").append(i).append(':');
            int extra = random.nextInt(30);
            for (int j = 0; j < extra; j++) {
                line.append((char) ('a' + random.nextInt(26)));
            }
            line.append("|c");
            lines.add(line.toString());
        }
        String batch = String.join("\n", lines);

        List<String> chunks = splitUtf8(batch, limit);

        assertEquals(batch, String.join("\n", chunks));
        for (String chunk : chunks) {
            assertTrue(chunk.getBytes(StandardCharsets.UTF_8).length <= limit,
                    "chunk exceeds limit: " + chunk);
        }
        assertTrue(chunks.size() > 1);
    }

    @Test
    void manySmallLinesDoNotExhaustTheStack()
    {
        String batch = String.join("\n", Collections.nCopies(200_000, "a:1|c"));

        List<ByteView> chunks = PayloadSplitter.split(ByteView.utf8(batch), 5);

        assertEquals(200_000, chunks.size());
    }
}
