/*
 * ByteCursorTest.java
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

import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link ByteCursor}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ByteCursorTest {

    private static byte[] bytes(int... values) {
        byte[] b = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            b[i] = (byte) values[i];
        }
        return b;
    }

    @Test
    public void testLittleEndian() throws Exception {
        ByteCursor cursor = new ByteCursor(bytes(0xff, 0x34, 0x12, 0x78, 0x56, 0x34, 0x12));
        assertEquals(0xff, cursor.readU8());
        assertEquals(0x1234, cursor.readU16());
        assertEquals(0x12345678, cursor.readI32());
        assertFalse(cursor.hasRemaining());
    }

    @Test
    public void testUnsigned32() throws Exception {
        ByteCursor cursor = new ByteCursor(bytes(0xff, 0xff, 0xff, 0xff));
        assertEquals(0xffffffffL, cursor.readU32());
        cursor.seekTo(0);
        assertEquals(-1, cursor.readI32());
    }

    @Test(expected = TruncatedBufferException.class)
    public void testReadPastEnd() throws Exception {
        new ByteCursor(bytes(1, 2, 3)).readI32();
    }

    @Test
    public void testFailedReadDoesNotAdvance() throws Exception {
        ByteCursor cursor = new ByteCursor(bytes(1, 2, 3));
        try {
            cursor.readI32();
            fail("Expected TruncatedBufferException");
        } catch (TruncatedBufferException e) {
            assertEquals(0, e.getOffset());
        }
        assertEquals(0, cursor.position());
        assertEquals(0x0201, cursor.readU16());
    }

    @Test
    public void testSlice() throws Exception {
        ByteCursor cursor = new ByteCursor(bytes(1, 2, 3, 4, 5, 6));
        cursor.skip(1);
        ByteCursor slice = cursor.slice(3);
        assertEquals(4, cursor.position());
        assertEquals(3, slice.length());
        assertEquals(0, slice.position());
        assertEquals(1, slice.absolutePosition());
        assertEquals(2, slice.readU8());
        slice.seekTo(2);
        assertEquals(4, slice.readU8());
        assertFalse(slice.hasRemaining());
        try {
            slice.readU8();
            fail("Slice must not read beyond its limit");
        } catch (TruncatedBufferException e) {
            assertEquals(4, e.getOffset());
        }
    }

    @Test(expected = TruncatedBufferException.class)
    public void testSliceTooLong() throws Exception {
        new ByteCursor(bytes(1, 2)).slice(3);
    }

    @Test
    public void testSeekToEnd() throws Exception {
        ByteCursor cursor = new ByteCursor(bytes(1, 2));
        cursor.seekTo(2);
        assertEquals(0, cursor.remaining());
    }

    @Test(expected = TruncatedBufferException.class)
    public void testSeekBeyondEnd() throws Exception {
        new ByteCursor(bytes(1, 2)).seekTo(3);
    }

    @Test(expected = TruncatedBufferException.class)
    public void testSeekNegative() throws Exception {
        new ByteCursor(bytes(1, 2)).seekTo(-1);
    }

    @Test
    public void testReadBytesCopies() throws Exception {
        byte[] data = bytes(7, 8, 9);
        ByteCursor cursor = new ByteCursor(data);
        byte[] read = cursor.readBytes(2);
        read[0] = 0;
        assertArrayEquals(bytes(0, 8), read);
        assertEquals(7, data[0]);
        assertEquals(1, cursor.remaining());
    }

}
