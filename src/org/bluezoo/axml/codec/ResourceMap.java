/*
 * ResourceMap.java
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

/**
 * The optional table of resource identifiers accompanying a binary XML
 * document.
 * <p>
 * Entry <i>i</i> is the resource identifier of the attribute whose name is
 * string pool entry <i>i</i>. The table covers only the leading pool
 * entries used as attribute names; other indices have no identifier.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ResourceMap {

    /**
     * The map of a document without a resource map chunk.
     */
    public static final ResourceMap EMPTY = new ResourceMap(new int[0]);

    private final int[] ids;

    private ResourceMap(int[] ids) {
        this.ids = ids;
    }

    /**
     * Decodes a resource map chunk.
     *
     * @param chunk a cursor over exactly the chunk, header included
     * @param header the chunk header
     * @return the decoded map
     * @throws AXMLFormatException if the chunk is malformed
     */
    public static ResourceMap read(ByteCursor chunk, ChunkHeader header) throws AXMLFormatException {
        chunk.seekTo(header.getHeaderSize());
        int[] ids = new int[(header.getSize() - header.getHeaderSize()) / 4];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = chunk.readI32();
        }
        return new ResourceMap(ids);
    }

    /**
     * Returns the number of resource identifiers in the table.
     */
    public int size() {
        return ids.length;
    }

    /**
     * Indicates whether the given string pool index has a resource
     * identifier.
     */
    public boolean contains(int index) {
        return index >= 0 && index < ids.length;
    }

    /**
     * Returns the resource identifier for the given string pool index.
     *
     * @param index the string pool index of an attribute name
     * @return the resource identifier, or 0 if there is none
     */
    public int get(int index) {
        return contains(index) ? ids[index] : 0;
    }

}
