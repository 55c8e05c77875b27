/*
 * StringPool.java
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

import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The pool of strings referenced by index from the rest of a binary XML
 * document: namespace prefixes and URIs, element and attribute names,
 * and raw attribute values.
 * <p>
 * The pool chunk header is followed by an array of 32-bit offsets, one per
 * string, relative to the start of the string data. Strings are encoded
 * either in UTF-16 or, if {@link #UTF8_FLAG} is set, in UTF-8, each
 * preceded by its length. Style spans, if present, are not retained.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class StringPool {

    private static final Logger LOGGER = Logger.getLogger(StringPool.class.getName());

    /**
     * The strings are sorted by value.
     */
    public static final int SORTED_FLAG = 1 << 0;

    /**
     * The strings are encoded in UTF-8 rather than UTF-16.
     */
    public static final int UTF8_FLAG = 1 << 8;

    /**
     * Index denoting the absence of a string.
     */
    public static final int NO_INDEX = -1;

    /**
     * A pool with no strings, used when a document has no pool chunk.
     */
    public static final StringPool EMPTY = new StringPool(new String[0], 0, 0);

    private final String[] strings;
    private final int flags;
    private final int styleCount;

    private StringPool(String[] strings, int flags, int styleCount) {
        this.strings = strings;
        this.flags = flags;
        this.styleCount = styleCount;
    }

    /**
     * Decodes a string pool chunk.
     *
     * @param chunk a cursor over exactly the chunk, header included
     * @param header the chunk header
     * @return the decoded pool
     * @throws AXMLFormatException if the chunk is malformed
     */
    public static StringPool read(ByteCursor chunk, ChunkHeader header) throws AXMLFormatException {
        chunk.seekTo(ChunkHeader.SIZE);
        long stringCount = chunk.readU32();
        long styleCount = chunk.readU32();
        int flags = chunk.readI32();
        long stringsStart = chunk.readU32();
        chunk.readU32(); // stylesStart
        chunk.seekTo(header.getHeaderSize());
        if (stringCount + styleCount > chunk.remaining() / 4) {
            String message = AXMLDecoder.L10N.getString("err.string_count");
            message = MessageFormat.format(message, Long.toString(stringCount), Long.toString(styleCount));
            throw new TruncatedBufferException(message, chunk.absolutePosition(), header.getType());
        }
        long[] offsets = new long[(int) stringCount];
        for (int i = 0; i < offsets.length; i++) {
            offsets[i] = chunk.readU32();
        }
        // Style span offsets follow; the spans themselves are not kept
        chunk.skip((int) styleCount * 4);
        boolean utf8 = (flags & UTF8_FLAG) != 0;
        String[] strings = new String[offsets.length];
        for (int i = 0; i < offsets.length; i++) {
            chunk.seekTo(stringsStart + offsets[i]);
            strings[i] = utf8 ? readUtf8(chunk, header) : readUtf16(chunk, header);
        }
        if (styleCount > 0 && LOGGER.isLoggable(Level.FINE)) {
            String message = AXMLDecoder.L10N.getString("fine.styles_skipped");
            LOGGER.fine(MessageFormat.format(message, Long.toString(styleCount)));
        }
        return new StringPool(strings, flags, (int) styleCount);
    }

    /*
     * A UTF-8 entry holds two lengths, the length in UTF-16 units and the
     * length in bytes. Each is one byte, or two if the high bit of the
     * first is set.
     */
    private static String readUtf8(ByteCursor chunk, ChunkHeader header) throws AXMLFormatException {
        readUtf8Length(chunk);
        int byteLength = readUtf8Length(chunk);
        checkLength(chunk, header, byteLength);
        byte[] bytes = chunk.readBytes(byteLength);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static int readUtf8Length(ByteCursor chunk) throws TruncatedBufferException {
        int length = chunk.readU8();
        if ((length & 0x80) != 0) {
            length = ((length & 0x7f) << 8) | chunk.readU8();
        }
        return length;
    }

    /*
     * A UTF-16 entry holds its length in code units: one unit, or two if
     * the high bit of the first is set.
     */
    private static String readUtf16(ByteCursor chunk, ChunkHeader header) throws AXMLFormatException {
        long length = chunk.readU16();
        if ((length & 0x8000) != 0) {
            length = ((length & 0x7fff) << 16) | chunk.readU16();
        }
        checkLength(chunk, header, length * 2);
        byte[] bytes = chunk.readBytes((int) (length * 2));
        return new String(bytes, StandardCharsets.UTF_16LE);
    }

    private static void checkLength(ByteCursor chunk, ChunkHeader header, long length)
            throws MalformedStringLengthException {
        if (length > chunk.remaining()) {
            String message = AXMLDecoder.L10N.getString("err.string_length");
            message = MessageFormat.format(message, Long.toString(length), Integer.toString(chunk.remaining()));
            throw new MalformedStringLengthException(message, chunk.absolutePosition(), header.getType());
        }
    }

    /**
     * Returns the string at the given index.
     *
     * @param index the index
     * @return the string
     * @throws StringIndexOutOfRangeException if the index is negative or
     * not less than {@link #size()}
     */
    public String get(int index) throws StringIndexOutOfRangeException {
        if (index < 0 || index >= strings.length) {
            String message = AXMLDecoder.L10N.getString("err.string_index");
            message = MessageFormat.format(message, Integer.toString(index), Integer.toString(strings.length));
            throw new StringIndexOutOfRangeException(message);
        }
        return strings[index];
    }

    /**
     * Returns the string at the given index, or null for {@link #NO_INDEX}.
     *
     * @param index the index, or -1
     * @return the string, or null
     * @throws StringIndexOutOfRangeException if the index is neither -1 nor
     * a valid index
     */
    public String getOptional(int index) throws StringIndexOutOfRangeException {
        return (index == NO_INDEX) ? null : get(index);
    }

    /**
     * Returns the number of strings in the pool.
     */
    public int size() {
        return strings.length;
    }

    public boolean isUtf8() {
        return (flags & UTF8_FLAG) != 0;
    }

    public boolean isSorted() {
        return (flags & SORTED_FLAG) != 0;
    }

    /**
     * Returns the number of style span arrays declared by the pool.
     * The spans themselves are not decoded.
     */
    public int getStyleCount() {
        return styleCount;
    }

    /**
     * Returns the strings in index order.
     *
     * @return an unmodifiable list of the strings
     */
    public List<String> getStrings() {
        return Collections.unmodifiableList(Arrays.asList(strings));
    }

}
