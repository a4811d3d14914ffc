package com.questrail.statsd.codec;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * ByteView
 * -----------------------------------------------------------------------------
 * Read-only window ({@code offset}, {@code length}) over a backing array.
 *
 * <p>Slicing never copies. Callers must not mutate the backing array while a
 * view over it is in use; the transport wraps the same array when sending.</p>
 *
 * <p>All indices taken by the methods below are relative to {@link #offset()}.</p>
 */
public final class ByteView
{
    private final byte[] array;
    private final int offset;
    private final int length;

    private ByteView(byte[] array, int offset, int length)
    {
        this.array = array;
        this.offset = offset;
        this.length = length;
    }

    public static ByteView of(byte[] array)
    {
        Objects.requireNonNull(array, "array");
        return new ByteView(array, 0, array.length);
    }

    public static ByteView of(byte[] array, int offset, int length)
    {
        Objects.requireNonNull(array, "array");
        Objects.checkFromIndexSize(offset, length, array.length);
        return new ByteView(array, offset, length);
    }

    public static ByteView utf8(String text)
    {
        Objects.requireNonNull(text, "text");
        return of(text.getBytes(StandardCharsets.UTF_8));
    }

    /** Backing array; shared, not copied. */
    public byte[] array()
    {
        return array;
    }

    public int offset()
    {
        return offset;
    }

    public int length()
    {
        return length;
    }

    public boolean isEmpty()
    {
        return length == 0;
    }

    public byte byteAt(int index)
    {
        Objects.checkIndex(index, length);
        return array[offset + index];
    }

    /**
     * View of {@code [fromInclusive, toExclusive)}, sharing this view's array.
     */
    public ByteView slice(int fromInclusive, int toExclusive)
    {
        Objects.checkFromToIndex(fromInclusive, toExclusive, length);
        return new ByteView(array, offset + fromInclusive, toExclusive - fromInclusive);
    }

    public ByteView sliceFrom(int fromInclusive)
    {
        return slice(fromInclusive, length);
    }

    public byte[] toByteArray()
    {
        return Arrays.copyOfRange(array, offset, offset + length);
    }

    public String toUtf8String()
    {
        return new String(array, offset, length, StandardCharsets.UTF_8);
    }

    /**
     * Two views are equal when they expose the same bytes, regardless of the
     * backing array or offset.
     */
    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof ByteView that)) return false;
        return Arrays.equals(array, offset, offset + length,
                that.array, that.offset, that.offset + that.length);
    }

    @Override
    public int hashCode()
    {
        int h = 1;
        for (int i = offset; i < offset + length; i++) {
            h = 31 * h + array[i];
        }
        return h;
    }

    @Override
    public String toString()
    {
        return "ByteView[offset=" + offset + ", length=" + length + "]";
    }
}
