/*
 * Attribute.java
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

package org.bluezoo.axml.dom;

import org.bluezoo.axml.codec.TypedValue;

/**
 * An attribute of a decoded element.
 * <p>
 * The attribute keeps both forms in which its value may be stored: the
 * raw string, if the compiler retained one, and the typed value. The
 * rendered value is the raw string when present, otherwise the textual
 * form of the typed value.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Attribute {

    private final String namespaceURI;
    private final String prefix;
    private final String name;
    private final String rawValue;
    private final TypedValue typedValue;
    private final int resourceId;
    private final String value;

    /**
     * Constructor.
     *
     * @param namespaceURI the namespace URI, or null
     * @param prefix the prefix bound to the namespace URI where the
     * attribute appeared, or null
     * @param name the local name
     * @param rawValue the raw string value, or null
     * @param typedValue the typed value
     * @param resourceId the resource identifier of the attribute name, or 0
     * @param value the rendered value
     */
    public Attribute(String namespaceURI, String prefix, String name, String rawValue,
                     TypedValue typedValue, int resourceId, String value) {
        this.namespaceURI = namespaceURI;
        this.prefix = prefix;
        this.name = name;
        this.rawValue = rawValue;
        this.typedValue = typedValue;
        this.resourceId = resourceId;
        this.value = value;
    }

    public String getNamespaceURI() {
        return namespaceURI;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getName() {
        return name;
    }

    /**
     * Returns the qualified name (prefix:name, or just name).
     */
    public String getQName() {
        if (prefix != null && !prefix.isEmpty()) {
            return prefix + ":" + name;
        }
        return name;
    }

    public String getRawValue() {
        return rawValue;
    }

    public TypedValue getTypedValue() {
        return typedValue;
    }

    /**
     * Returns the Android resource identifier of the attribute name, from
     * the document's resource map.
     *
     * @return the identifier, or 0 if the name has none
     */
    public int getResourceId() {
        return resourceId;
    }

    /**
     * Returns the value as it should appear in XML text.
     */
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return getQName() + "=\"" + value + "\"";
    }

}
