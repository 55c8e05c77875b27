/*
 * ByteCursor.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of axml, an Android binary XML decoder.
 *
 * axml is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * axml is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with axml.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.axml.codec;

import java.text.MessageFormat;

/**
 * Bounds-checked sequential reader over a region of an immutable byte
 * array.
 * <p>
 * All multi-byte values are little-endian. Positions are relative to the
 * start of the cursor's region; {@link #absolutePosition()} gives the
 * offset in the underlying array, for diagnostics. Any read that would
 * pass the end of the region throws {@link TruncatedBufferException} and
 * leaves the position unchanged.
 * <p>
 * A cursor never copies the array it was created over: {@link #slice}
 * returns a view of the next bytes sharing the same array.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ByteCursor {

    private final byte[] data;
    private final int base;
    private final int limit;
    private int pos;

    /**
     * Creates a cursor over the whole of the given array.
     *
     * @param data the buffer
     */
    public ByteCursor(byte[] data) {
        this(data, 0, data.length);
    }

    private ByteCursor(byte[] data, int base, int limit) {
        this.data = data;
        this.base = base;
        this.limit = limit;
        this.pos = base;
    }

    /**
     * Returns the current position relative to the start of this region.
     */
    public int position() {
        return pos - base;
    }

    /**
     * Returns the current position in the underlying array.
     */
    public int absolutePosition() {
        return pos;
    }

    /**
     * Returns the length of this region.
     */
    public int length() {
        return limit - base;
    }

    /**
     * Returns the number of bytes between the position and the end of the
     * region.
     */
    public int remaining() {
        return limit - pos;
    }

    public boolean hasRemaining() {
        return pos < limit;
    }

    /**
     * Reads an unsigned byte.
     *
     * @return the value, 0-255
     * @throws TruncatedBufferException if no bytes remain
     */
    public int readU8() throws TruncatedBufferException {
        require(1);
        return data[pos++] & 0xff;
    }

    /**
     * Reads an unsigned 16-bit value.
     *
     * @return the value, 0-65535
     * @throws TruncatedBufferException if fewer than 2 bytes remain
     */
    public int readU16() throws TruncatedBufferException {
        require(2);
        int value = (data[pos] & 0xff) | ((data[pos + 1] & 0xff) << 8);
        pos += 2;
        return value;
    }

    /**
     * Reads an unsigned 32-bit value.
     *
     * @return the value as a non-negative long
     * @throws TruncatedBufferException if fewer than 4 bytes remain
     */
    public long readU32() throws TruncatedBufferException {
        return readI32() & 0xffffffffL;
    }

    /**
     * Reads a signed 32-bit value.
     *
     * @return the value
     * @throws TruncatedBufferException if fewer than 4 bytes remain
     */
    public int readI32() throws TruncatedBufferException {
        require(4);
        int value = (data[pos] & 0xff)
                | ((data[pos + 1] & 0xff) << 8)
                | ((data[pos + 2] & 0xff) << 16)
                | ((data[pos + 3] & 0xff) << 24);
        pos += 4;
        return value;
    }

    /**
     * Reads the next {@code len} bytes into a new array.
     *
     * @param len the number of bytes
     * @return a copy of the bytes
     * @throws TruncatedBufferException if fewer than {@code len} bytes remain
     */
    public byte[] readBytes(int len) throws TruncatedBufferException {
        require(len);
        byte[] bytes = new byte[len];
        System.arraycopy(data, pos, bytes, 0, len);
        pos += len;
        return bytes;
    }

    /**
     * Returns a cursor over the next {@code len} bytes and advances this
     * cursor past them. The returned cursor shares this cursor's array.
     *
     * @param len the length of the slice
     * @return a cursor positioned at the start of the slice
     * @throws TruncatedBufferException if fewer than {@code len} bytes remain
     */
    public ByteCursor slice(int len) throws TruncatedBufferException {
        require(len);
        ByteCursor slice = new ByteCursor(data, pos, pos + len);
        pos += len;
        return slice;
    }

    /**
     * Moves to the given offset relative to the start of this region.
     *
     * @param offset the new position
     * @throws TruncatedBufferException if the offset lies beyond the region
     */
    public void seekTo(long offset) throws TruncatedBufferException {
        if (offset < 0 || offset > length()) {
            String message = AXMLDecoder.L10N.getString("err.seek");
            message = MessageFormat.format(message, Long.toString(offset), Integer.toString(length()));
            throw new TruncatedBufferException(message, base + Math.max(offset, 0L));
        }
        pos = base + (int) offset;
    }

    /**
     * Advances the position by {@code n} bytes.
     *
     * @param n the number of bytes to skip
     * @throws TruncatedBufferException if fewer than {@code n} bytes remain
     */
    public void skip(int n) throws TruncatedBufferException {
        require(n);
        pos += n;
    }

    private void require(int n) throws TruncatedBufferException {
        if (n < 0 || limit - pos < n) {
            String message = AXMLDecoder.L10N.getString("err.truncated");
            message = MessageFormat.format(message, Integer.toString(n), Integer.toString(limit - pos));
            throw new TruncatedBufferException(message, pos);
        }
    }

}
