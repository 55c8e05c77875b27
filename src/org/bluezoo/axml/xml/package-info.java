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
 * XML text output for decoded documents.
 *
 * <p>{@link org.bluezoo.axml.xml.AXMLSerializer} walks a
 * {@link org.bluezoo.axml.dom.Document} and drives an
 * {@link org.bluezoo.axml.xml.XMLWriter}, which handles escaping,
 * empty-element tags and optional indentation described by an
 * {@link org.bluezoo.axml.xml.IndentConfig}.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * AXMLSerializer serializer = new AXMLSerializer(IndentConfig.spaces(4), true);
 * serializer.serialize(document, System.out);
 * }</pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.axml.xml;
