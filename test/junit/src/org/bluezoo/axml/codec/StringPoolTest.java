/*
 * StringPoolTest.java
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

import java.util.Arrays;

import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link StringPool}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class StringPoolTest {

    // Offset of the first string entry in a pool of one string
    private static final int FIRST_ENTRY = 28 + 4;

    private static StringPool read(byte[] chunk) throws AXMLFormatException {
        ByteCursor cursor = new ByteCursor(chunk);
        ChunkHeader header = ChunkHeader.read(cursor);
        return StringPool.read(cursor, header);
    }

    private static String repeat(char c, int count) {
        char[] chars = new char[count];
        Arrays.fill(chars, c);
        return new String(chars);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Encodings
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testUtf16() throws Exception {
        StringPool pool = read(AXMLBuilder.stringPool(false, "manifest", "", "été"));
        assertFalse(pool.isUtf8());
        assertEquals(3, pool.size());
        assertEquals("manifest", pool.get(0));
        assertEquals("", pool.get(1));
        assertEquals("été", pool.get(2));
    }

    @Test
    public void testUtf8() throws Exception {
        StringPool pool = read(AXMLBuilder.stringPool(true, "package", "été", "日本"));
        assertTrue(pool.isUtf8());
        assertEquals(Arrays.asList("package", "été", "日本"), pool.getStrings());
    }

    @Test
    public void testSurrogatePair() throws Exception {
        String face = "smile 😀";
        assertEquals(face, read(AXMLBuilder.stringPool(false, face)).get(0));
        assertEquals(face, read(AXMLBuilder.stringPool(true, face)).get(0));
    }

    @Test
    public void testTwoByteUtf8Length() throws Exception {
        String s = repeat('x', 300);
        assertEquals(s, read(AXMLBuilder.stringPool(true, s)).get(0));
    }

    @Test
    public void testTwoUnitUtf16Length() throws Exception {
        String s = repeat('y', 40000);
        assertEquals(s, read(AXMLBuilder.stringPool(false, s)).get(0));
    }

    @Test
    public void testEmptyPool() throws Exception {
        StringPool pool = read(AXMLBuilder.stringPool(false));
        assertEquals(0, pool.size());
        assertEquals(0, pool.getStyleCount());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Lookup
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testIndexEqualToSize() throws Exception {
        StringPool pool = read(AXMLBuilder.stringPool(false, "a", "b"));
        try {
            pool.get(pool.size());
            fail("Expected StringIndexOutOfRangeException");
        } catch (StringIndexOutOfRangeException e) {
            assertEquals(-1, e.getOffset());
        }
    }

    @Test(expected = StringIndexOutOfRangeException.class)
    public void testNegativeIndex() throws Exception {
        read(AXMLBuilder.stringPool(false, "a")).get(-1);
    }

    @Test
    public void testOptional() throws Exception {
        StringPool pool = read(AXMLBuilder.stringPool(false, "a"));
        assertNull(pool.getOptional(StringPool.NO_INDEX));
        assertEquals("a", pool.getOptional(0));
    }

    @Test(expected = StringIndexOutOfRangeException.class)
    public void testOptionalOutOfRange() throws Exception {
        read(AXMLBuilder.stringPool(false, "a")).getOptional(-2);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testStringsUnmodifiable() throws Exception {
        read(AXMLBuilder.stringPool(false, "a")).getStrings().set(0, "b");
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Malformed pools
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testUtf16LengthBeyondPool() throws Exception {
        byte[] chunk = AXMLBuilder.stringPool(false, "abc");
        chunk[FIRST_ENTRY] = 0x00;
        chunk[FIRST_ENTRY + 1] = 0x70;
        try {
            read(chunk);
            fail("Expected MalformedStringLengthException");
        } catch (MalformedStringLengthException e) {
            assertEquals(ChunkType.STRING_POOL.getValue(), e.getChunkType());
        }
    }

    @Test(expected = MalformedStringLengthException.class)
    public void testUtf8LengthBeyondPool() throws Exception {
        byte[] chunk = AXMLBuilder.stringPool(true, "abc");
        chunk[FIRST_ENTRY + 1] = 0x7f;
        read(chunk);
    }

    @Test(expected = TruncatedBufferException.class)
    public void testStringCountBeyondPool() throws Exception {
        byte[] chunk = AXMLBuilder.stringPool(false, "abc");
        chunk[8] = (byte) 0xe8;
        chunk[9] = 0x03;
        read(chunk);
    }

    @Test(expected = TruncatedBufferException.class)
    public void testStringOffsetBeyondPool() throws Exception {
        byte[] chunk = AXMLBuilder.stringPool(false, "abc");
        chunk[28] = 0x00;
        chunk[29] = 0x10;
        read(chunk);
    }

}
