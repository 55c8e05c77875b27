/*
 * TypedValue.java
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
 * An 8-byte typed value record: a 16-bit size, a reserved byte, an 8-bit
 * type tag and 32 bits of data.
 * <p>
 * The type tag is kept as read, so that a value with a tag this decoder
 * does not recognize can still be carried; it fails only when rendered.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class TypedValue {

    /**
     * The encoded size of a typed value.
     */
    public static final int SIZE = 8;

    private final int size;
    private final int typeTag;
    private final int data;

    /**
     * Creates a typed value.
     *
     * @param typeTag the 8-bit type tag
     * @param data the 32-bit data
     */
    public TypedValue(int typeTag, int data) {
        this(SIZE, typeTag, data);
    }

    private TypedValue(int size, int typeTag, int data) {
        this.size = size;
        this.typeTag = typeTag;
        this.data = data;
    }

    /**
     * Creates a typed value of a known type.
     *
     * @param type the type
     * @param data the 32-bit data
     * @return the typed value
     */
    public static TypedValue of(TypedValueType type, int data) {
        return new TypedValue(type.getValue(), data);
    }

    /**
     * Reads a typed value at the cursor's position.
     *
     * @param cursor the cursor
     * @return the typed value
     * @throws TruncatedBufferException if fewer than 8 bytes remain
     */
    public static TypedValue read(ByteCursor cursor) throws TruncatedBufferException {
        int size = cursor.readU16();
        cursor.readU8(); // res0
        int typeTag = cursor.readU8();
        int data = cursor.readI32();
        return new TypedValue(size, typeTag, data);
    }

    /**
     * Returns the size recorded in the value.
     */
    public int getSize() {
        return size;
    }

    /**
     * Returns the raw 8-bit type tag.
     */
    public int getTypeTag() {
        return typeTag;
    }

    /**
     * Returns the type of this value.
     *
     * @return the type, or null if the tag is not recognized
     */
    public TypedValueType getType() {
        return TypedValueType.forValue(typeTag);
    }

    /**
     * Returns the 32-bit data.
     */
    public int getData() {
        return data;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof TypedValue)) {
            return false;
        }
        TypedValue other = (TypedValue) o;
        return typeTag == other.typeTag && data == other.data;
    }

    @Override
    public int hashCode() {
        return typeTag * 31 + data;
    }

    @Override
    public String toString() {
        return String.format("TypedValue[type=0x%02x, data=0x%08x]", typeTag, data);
    }

}
