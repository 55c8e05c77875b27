/*
 * ChunkHeaderTest.java
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
 * Unit tests for {@link ChunkHeader}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ChunkHeaderTest {

    private static byte[] header(int type, int headerSize, int size, int padding) {
        AXMLBuilder.Bytes out = new AXMLBuilder.Bytes();
        out.u16(type).u16(headerSize).i32(size);
        for (int i = 0; i < padding; i++) {
            out.u8(0);
        }
        return out.toByteArray();
    }

    @Test
    public void testRead() throws Exception {
        ByteCursor cursor = new ByteCursor(header(0x0102, 16, 36, 28));
        ChunkHeader header = ChunkHeader.read(cursor);
        assertEquals(0x0102, header.getType());
        assertEquals(ChunkType.XML_START_ELEMENT, header.getChunkType());
        assertEquals(16, header.getHeaderSize());
        assertEquals(36, header.getSize());
        assertEquals(0, header.getStart());
        assertEquals(ChunkHeader.SIZE, cursor.position());
    }

    @Test
    public void testUnknownType() throws Exception {
        ChunkHeader header = ChunkHeader.read(new ByteCursor(header(0x0203, 8, 8, 0)));
        assertEquals(0x0203, header.getType());
        assertNull(header.getChunkType());
    }

    @Test(expected = TruncatedBufferException.class)
    public void testShortHeader() throws Exception {
        ChunkHeader.read(new ByteCursor(new byte[] { 3, 0, 8, 0, 0 }));
    }

    @Test
    public void testSizeBeyondBuffer() throws Exception {
        try {
            ChunkHeader.read(new ByteCursor(header(0x0003, 8, 64, 8)));
            fail("Expected TruncatedBufferException");
        } catch (TruncatedBufferException e) {
            assertEquals(0, e.getOffset());
            assertEquals(0x0003, e.getChunkType());
        }
    }

    @Test(expected = InvalidChunkTypeException.class)
    public void testHeaderSizeTooSmall() throws Exception {
        ChunkHeader.read(new ByteCursor(header(0x0001, 4, 8, 0)));
    }

    @Test(expected = InvalidChunkTypeException.class)
    public void testHeaderSizeLargerThanChunk() throws Exception {
        ChunkHeader.read(new ByteCursor(header(0x0001, 28, 16, 8)));
    }

    @Test
    public void testChunkTypeValues() {
        assertEquals(ChunkType.XML, ChunkType.forValue(0x0003));
        assertEquals(ChunkType.XML_RESOURCE_MAP, ChunkType.forValue(0x0180));
        assertNull(ChunkType.forValue(0x0200));
        assertEquals("0x0104", ChunkType.toHexString(ChunkType.XML_CDATA.getValue()));
    }

}
