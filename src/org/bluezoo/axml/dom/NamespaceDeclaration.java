/*
 * NamespaceDeclaration.java
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

/**
 * A binding of a namespace prefix to a namespace URI, declared on an
 * element. A null or empty prefix denotes the default namespace.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class NamespaceDeclaration {

    private final String prefix;
    private final String uri;

    public NamespaceDeclaration(String prefix, String uri) {
        this.prefix = prefix;
        this.uri = uri;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getURI() {
        return uri;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof NamespaceDeclaration)) {
            return false;
        }
        NamespaceDeclaration other = (NamespaceDeclaration) o;
        return equal(prefix, other.prefix) && equal(uri, other.uri);
    }

    private static boolean equal(String s1, String s2) {
        return (s1 == null) ? s2 == null : s1.equals(s2);
    }

    @Override
    public int hashCode() {
        int hash = (prefix == null) ? 0 : prefix.hashCode();
        return hash * 31 + ((uri == null) ? 0 : uri.hashCode());
    }

    @Override
    public String toString() {
        if (prefix == null || prefix.isEmpty()) {
            return "xmlns=\"" + uri + "\"";
        }
        return "xmlns:" + prefix + "=\"" + uri + "\"";
    }

}
