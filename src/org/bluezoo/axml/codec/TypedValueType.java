/*
 * TypedValueType.java
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
 * The type tags of a typed value, identifying how its 32-bit data is to
 * be interpreted.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum TypedValueType {

    /**
     * No value. The data is 0 for undefined or 1 for empty.
     */
    NULL(0x00),

    /**
     * A reference to another resource.
     */
    REFERENCE(0x01),

    /**
     * A reference to an attribute in the current theme.
     */
    ATTRIBUTE(0x02),

    /**
     * An index into the string pool.
     */
    STRING(0x03),

    /**
     * A single-precision floating point number.
     */
    FLOAT(0x04),

    /**
     * A complex number encoding a dimension, such as "100dip".
     */
    DIMENSION(0x05),

    /**
     * A complex number encoding a fraction of a container.
     */
    FRACTION(0x06),

    /**
     * A reference whose package identifier must be resolved at run time.
     */
    DYNAMIC_REFERENCE(0x07),

    /**
     * An attribute reference whose package identifier must be resolved at
     * run time.
     */
    DYNAMIC_ATTRIBUTE(0x08),

    /**
     * A decimal integer.
     */
    INT_DEC(0x10),

    /**
     * A hexadecimal integer.
     */
    INT_HEX(0x11),

    /**
     * A boolean: 0 is false, anything else true.
     */
    INT_BOOLEAN(0x12),

    /**
     * A color of the form #aarrggbb.
     */
    INT_COLOR_ARGB8(0x1c),

    /**
     * A color of the form #rrggbb.
     */
    INT_COLOR_RGB8(0x1d),

    /**
     * A color of the form #argb.
     */
    INT_COLOR_ARGB4(0x1e),

    /**
     * A color of the form #rgb.
     */
    INT_COLOR_RGB4(0x1f);

    private final int value;

    TypedValueType(int value) {
        this.value = value;
    }

    /**
     * Returns the 8-bit type tag.
     */
    public int getValue() {
        return value;
    }

    /**
     * Returns the type for the given tag.
     *
     * @param value the 8-bit type tag
     * @return the type, or null if the tag is not recognized
     */
    public static TypedValueType forValue(int value) {
        for (TypedValueType type : values()) {
            if (type.value == value) {
                return type;
            }
        }
        return null;
    }

}
