/*
 * ChunkHeader.java
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
 * The header that begins every chunk: a 16-bit type, a 16-bit header size
 * and a 32-bit total size, each little-endian.
 * <p>
 * Adding the header size to the start of the chunk gives the start of the
 * chunk's data; adding the total size gives the start of the next chunk.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ChunkHeader {

    /**
     * The size in bytes of the common chunk header.
     */
    public static final int SIZE = 8;

    private final int type;
    private final int headerSize;
    private final int size;
    private final int start;

    ChunkHeader(int type, int headerSize, int size, int start) {
        this.type = type;
        this.headerSize = headerSize;
        this.size = size;
        this.start = start;
    }

    /**
     * Reads and validates a chunk header at the cursor's position.
     * On return the cursor is positioned just after the common header.
     *
     * @param cursor the cursor over the region enclosing the chunk
     * @return the header
     * @throws TruncatedBufferException if the header, or the chunk it
     * declares, does not fit in the remaining bytes
     * @throws InvalidChunkTypeException if the header size is smaller than
     * the common header or larger than the chunk
     */
    public static ChunkHeader read(ByteCursor cursor) throws AXMLFormatException {
        int start = cursor.position();
        long offset = cursor.absolutePosition();
        int available = cursor.remaining();
        int type = cursor.readU16();
        int headerSize = cursor.readU16();
        long size = cursor.readU32();
        if (headerSize < SIZE || headerSize > size) {
            String message = AXMLDecoder.L10N.getString("err.chunk_header_size");
            message = MessageFormat.format(message, Integer.toString(headerSize), Long.toString(size));
            throw new InvalidChunkTypeException(message, offset, type);
        }
        if (size > available) {
            String message = AXMLDecoder.L10N.getString("err.chunk_size");
            message = MessageFormat.format(message, Long.toString(size), Integer.toString(available));
            throw new TruncatedBufferException(message, offset, type);
        }
        return new ChunkHeader(type, headerSize, (int) size, start);
    }

    /**
     * Returns the 16-bit type identifier of the chunk.
     */
    public int getType() {
        return type;
    }

    /**
     * Returns the recognized chunk type.
     *
     * @return the chunk type, or null if it is not one the decoder knows
     */
    public ChunkType getChunkType() {
        return ChunkType.forValue(type);
    }

    /**
     * Returns the size of the chunk header, including any type-specific
     * header fields.
     */
    public int getHeaderSize() {
        return headerSize;
    }

    /**
     * Returns the total size of the chunk, header included.
     */
    public int getSize() {
        return size;
    }

    /**
     * Returns the position of the chunk in the enclosing region.
     */
    public int getStart() {
        return start;
    }

    @Override
    public String toString() {
        return "ChunkHeader[type=" + ChunkType.toHexString(type)
                + ", headerSize=" + headerSize + ", size=" + size + "]";
    }

}
