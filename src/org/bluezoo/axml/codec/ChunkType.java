/*
 * ChunkType.java
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
 * Chunk types that may appear in an Android binary XML document.
 * <p>
 * Each chunk begins with a common header carrying one of these 16-bit
 * type identifiers. Chunk types not listed here are not an error: the
 * decoder skips them using the size declared in their header.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum ChunkType {

    /**
     * Pool of strings referenced by index from the rest of the document.
     */
    STRING_POOL(0x0001),

    /**
     * The XML document itself. This chunk wraps all the others.
     */
    XML(0x0003),

    /**
     * Start of a namespace prefix mapping.
     */
    XML_START_NAMESPACE(0x0100),

    /**
     * End of a namespace prefix mapping.
     */
    XML_END_NAMESPACE(0x0101),

    /**
     * Start tag of an element, with its attributes.
     */
    XML_START_ELEMENT(0x0102),

    /**
     * End tag of an element.
     */
    XML_END_ELEMENT(0x0103),

    /**
     * Character data.
     */
    XML_CDATA(0x0104),

    /**
     * Table mapping attribute name strings to resource identifiers.
     * Optional.
     */
    XML_RESOURCE_MAP(0x0180);

    private final int value;

    ChunkType(int value) {
        this.value = value;
    }

    /**
     * Returns the 16-bit type identifier of this chunk type.
     *
     * @return the type identifier
     */
    public int getValue() {
        return value;
    }

    /**
     * Returns the chunk type for the given type identifier.
     *
     * @param value the 16-bit type identifier
     * @return the chunk type, or null if the identifier is not recognized
     */
    public static ChunkType forValue(int value) {
        switch (value) {
            case 0x0001:
                return STRING_POOL;
            case 0x0003:
                return XML;
            case 0x0100:
                return XML_START_NAMESPACE;
            case 0x0101:
                return XML_END_NAMESPACE;
            case 0x0102:
                return XML_START_ELEMENT;
            case 0x0103:
                return XML_END_ELEMENT;
            case 0x0104:
                return XML_CDATA;
            case 0x0180:
                return XML_RESOURCE_MAP;
            default:
                return null;
        }
    }

    /**
     * Formats a chunk type identifier as four hexadecimal digits.
     */
    static String toHexString(int value) {
        return String.format("0x%04x", value);
    }

}
