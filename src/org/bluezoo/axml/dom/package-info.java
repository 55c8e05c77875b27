/*
 * package-info.java
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

/**
 * Document model produced by decoding an Android binary XML document.
 *
 * <p>The model is a plain tree: a {@link org.bluezoo.axml.dom.Document}
 * owns a root {@link org.bluezoo.axml.dom.Element}, whose children are
 * elements and {@link org.bluezoo.axml.dom.Text} nodes in document order.
 * Names are already resolved from the string pool, prefixes from the
 * namespace bindings in scope, and attribute values rendered, so the tree
 * can be serialized without reference to the binary input.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.axml.dom;
