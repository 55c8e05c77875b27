/*
 * ResourceMapTest.java
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
 * Unit tests for {@link ResourceMap}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ResourceMapTest {

    private static ResourceMap read(int... ids) throws AXMLFormatException {
        AXMLBuilder.Bytes out = new AXMLBuilder.Bytes();
        out.u16(ChunkType.XML_RESOURCE_MAP.getValue()).u16(8).i32(8 + ids.length * 4);
        for (int id : ids) {
            out.i32(id);
        }
        ByteCursor cursor = new ByteCursor(out.toByteArray());
        return ResourceMap.read(cursor, ChunkHeader.read(cursor));
    }

    @Test
    public void testRead() throws Exception {
        ResourceMap map = read(0x0101021b, 0x0101021c);
        assertEquals(2, map.size());
        assertTrue(map.contains(1));
        assertEquals(0x0101021b, map.get(0));
        assertEquals(0x0101021c, map.get(1));
    }

    @Test
    public void testAbsentIndex() throws Exception {
        ResourceMap map = read(0x0101021b);
        assertFalse(map.contains(1));
        assertFalse(map.contains(-1));
        assertEquals(0, map.get(1));
        assertEquals(0, map.get(-1));
    }

    @Test
    public void testEmpty() throws Exception {
        assertEquals(0, read().size());
        assertEquals(0, ResourceMap.EMPTY.get(0));
    }

}
