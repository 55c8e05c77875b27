/*
 * AXMLFormatException.java
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
 * Exception thrown when an Android binary XML document is malformed and
 * cannot be decoded.
 * <p>
 * Where known, the byte offset in the input buffer at which the problem
 * was detected and the type of the chunk being decoded are recorded and
 * appended to the message.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class AXMLFormatException extends Exception {

    private static final long serialVersionUID = 1L;

    private final long offset;
    private final int chunkType;

    /**
     * Creates a new exception with the specified message.
     *
     * @param message the error message
     */
    public AXMLFormatException(String message) {
        this(message, -1L, -1);
    }

    /**
     * Creates a new exception with the specified message and byte offset.
     *
     * @param message the error message
     * @param offset the byte offset in the buffer where the error occurred
     */
    public AXMLFormatException(String message, long offset) {
        this(message, offset, -1);
    }

    /**
     * Creates a new exception with the specified message, byte offset and
     * chunk type.
     *
     * @param message the error message
     * @param offset the byte offset in the buffer, or -1 if unknown
     * @param chunkType the type of the chunk being decoded, or -1 if unknown
     */
    public AXMLFormatException(String message, long offset, int chunkType) {
        super(describe(message, offset, chunkType));
        this.offset = offset;
        this.chunkType = chunkType;
    }

    /**
     * Returns the byte offset at which the error was detected.
     *
     * @return the offset, or -1 if unknown
     */
    public long getOffset() {
        return offset;
    }

    /**
     * Returns the type of the chunk being decoded when the error was
     * detected.
     *
     * @return the chunk type, or -1 if unknown
     */
    public int getChunkType() {
        return chunkType;
    }

    private static String describe(String message, long offset, int chunkType) {
        if (offset < 0 && chunkType < 0) {
            return message;
        }
        StringBuilder buf = new StringBuilder(message);
        buf.append(" (");
        if (offset >= 0) {
            buf.append("offset ").append(offset);
        }
        if (chunkType >= 0) {
            if (offset >= 0) {
                buf.append(", ");
            }
            buf.append("chunk ").append(ChunkType.toHexString(chunkType));
        }
        buf.append(')');
        return buf.toString();
    }

}
