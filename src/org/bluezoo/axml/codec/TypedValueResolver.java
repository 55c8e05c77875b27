/*
 * TypedValueResolver.java
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
 * Renders typed values in the textual form used in Android XML sources.
 * <p>
 * Each type tag has exactly one rendering rule:
 * <table border="1" cellpadding="3">
 *   <caption>Renderings</caption>
 *   <tr><th>Type</th><th>Example</th></tr>
 *   <tr><td>NULL</td><td>(empty)</td></tr>
 *   <tr><td>REFERENCE</td><td>{@code @7f040001}, {@code @null}</td></tr>
 *   <tr><td>ATTRIBUTE</td><td>{@code ?01010036}</td></tr>
 *   <tr><td>STRING</td><td>the string pool entry</td></tr>
 *   <tr><td>FLOAT</td><td>{@code 1.5}</td></tr>
 *   <tr><td>DIMENSION</td><td>{@code 16.0dip}</td></tr>
 *   <tr><td>FRACTION</td><td>{@code 50.0%p}</td></tr>
 *   <tr><td>INT_DEC</td><td>{@code -3}</td></tr>
 *   <tr><td>INT_HEX</td><td>{@code 0x7f}</td></tr>
 *   <tr><td>INT_BOOLEAN</td><td>{@code true}</td></tr>
 *   <tr><td>INT_COLOR_*</td><td>{@code #80ff0000}, {@code #ff0000}, {@code #8f00}, {@code #f00}</td></tr>
 * </table>
 * A tag with no rule raises {@link UnsupportedTypedValueException}; no
 * rendering is ever guessed.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TypedValueResolver {

    private static final int COMPLEX_UNIT_MASK = 0xf;
    private static final int COMPLEX_RADIX_SHIFT = 4;
    private static final int COMPLEX_RADIX_MASK = 0x3;
    private static final int COMPLEX_MANTISSA_MASK = 0xffffff00;

    // Radix 23p0, 16p7, 8p15 and 0p23, applied to the mantissa still
    // shifted left by 8 bits
    private static final float[] RADIX_MULTS = {
        1.0f / (1 << 8),
        1.0f / (1 << 15),
        1.0f / (1 << 23),
        1.0f / (1L << 31)
    };

    private static final String[] DIMENSION_UNITS = { "px", "dip", "sp", "pt", "in", "mm" };
    private static final String[] FRACTION_UNITS = { "%", "%p" };

    private final StringPool strings;

    /**
     * Creates a resolver that resolves string values against the given
     * pool.
     *
     * @param strings the document's string pool
     */
    public TypedValueResolver(StringPool strings) {
        this.strings = strings;
    }

    /**
     * Returns the textual form of a typed value.
     *
     * @param value the typed value
     * @return the rendering
     * @throws UnsupportedTypedValueException if the type tag, or the unit of
     * a dimension or fraction, is not recognized
     * @throws StringIndexOutOfRangeException if a string value refers
     * outside the string pool
     */
    public String resolve(TypedValue value)
            throws UnsupportedTypedValueException, StringIndexOutOfRangeException {
        TypedValueType type = value.getType();
        if (type == null) {
            throw unsupported(value);
        }
        int data = value.getData();
        switch (type) {
            case NULL:
                return "";
            case REFERENCE:
            case DYNAMIC_REFERENCE:
                return (data == 0) ? "@null" : "@" + String.format("%08x", data);
            case ATTRIBUTE:
            case DYNAMIC_ATTRIBUTE:
                return "?" + String.format("%08x", data);
            case STRING:
                return strings.get(data);
            case FLOAT:
                return Float.toString(Float.intBitsToFloat(data));
            case DIMENSION:
                return Float.toString(complexToFloat(data)) + unit(value, DIMENSION_UNITS);
            case FRACTION:
                return Float.toString(complexToFloat(data) * 100.0f) + unit(value, FRACTION_UNITS);
            case INT_DEC:
                return Integer.toString(data);
            case INT_HEX:
                return "0x" + Integer.toHexString(data);
            case INT_BOOLEAN:
                return (data != 0) ? "true" : "false";
            case INT_COLOR_ARGB8:
                if ((data >>> 24) == 0xff) {
                    return String.format("#%06x", data & 0xffffff);
                }
                return String.format("#%08x", data);
            case INT_COLOR_RGB8:
                return String.format("#%06x", data & 0xffffff);
            case INT_COLOR_ARGB4:
                return String.format("#%x%x%x%x",
                        (data >>> 28) & 0xf, (data >>> 20) & 0xf, (data >>> 12) & 0xf, (data >>> 4) & 0xf);
            case INT_COLOR_RGB4:
                return String.format("#%x%x%x",
                        (data >>> 20) & 0xf, (data >>> 12) & 0xf, (data >>> 4) & 0xf);
            default:
                throw unsupported(value);
        }
    }

    /**
     * Converts the complex number in a dimension or fraction to a float.
     * The top 24 bits are a signed mantissa and bits 4-5 select where the
     * binary point lies within it.
     *
     * @param complex the complex data
     * @return the value
     */
    public static float complexToFloat(int complex) {
        int radix = (complex >> COMPLEX_RADIX_SHIFT) & COMPLEX_RADIX_MASK;
        return (complex & COMPLEX_MANTISSA_MASK) * RADIX_MULTS[radix];
    }

    private static String unit(TypedValue value, String[] units) throws UnsupportedTypedValueException {
        int unit = value.getData() & COMPLEX_UNIT_MASK;
        if (unit >= units.length) {
            String message = AXMLDecoder.L10N.getString("err.complex_unit");
            message = MessageFormat.format(message, Integer.toString(unit), value.getType());
            throw new UnsupportedTypedValueException(message);
        }
        return units[unit];
    }

    private static UnsupportedTypedValueException unsupported(TypedValue value) {
        String message = AXMLDecoder.L10N.getString("err.typed_value");
        message = MessageFormat.format(message,
                String.format("%02x", value.getTypeTag()), String.format("%08x", value.getData()));
        return new UnsupportedTypedValueException(message);
    }

}
