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
 * Decodes Android binary XML documents, such as the
 * {@code AndroidManifest.xml} of an application package, back to XML
 * text.
 *
 * <p>The {@link org.bluezoo.axml.AXMLDump} command-line tool ties the
 * parts together: {@link org.bluezoo.axml.ManifestExtractor} obtains the
 * document bytes, {@link org.bluezoo.axml.codec.AXMLDecoder} decodes them
 * into a {@link org.bluezoo.axml.dom.Document}, and
 * {@link org.bluezoo.axml.xml.AXMLSerializer} renders the document as
 * text.
 *
 * <pre>
 * java -jar axml.jar app.apk
 * java -Daxml.indent=4 -jar axml.jar --pretty AndroidManifest.xml manifest.xml
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.axml;
