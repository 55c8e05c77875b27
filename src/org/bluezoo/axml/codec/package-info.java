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
 * Decoder for the Android binary XML format (AXML), the compiled form in
 * which {@code AndroidManifest.xml} and layout resources are stored in
 * application packages.
 *
 * <h2>Format</h2>
 *
 * <p>A document is a tree of chunks. Every chunk starts with a common
 * header giving its type, the size of its header and its total size, all
 * little-endian:
 *
 * <table border="1" cellpadding="5">
 *   <caption>Chunk types</caption>
 *   <tr><th>Type</th><th>Chunk</th></tr>
 *   <tr><td>{@code 0x0003}</td><td>XML document, wrapping all the others</td></tr>
 *   <tr><td>{@code 0x0001}</td><td>String pool</td></tr>
 *   <tr><td>{@code 0x0180}</td><td>Resource map (optional)</td></tr>
 *   <tr><td>{@code 0x0100}</td><td>Start of namespace binding</td></tr>
 *   <tr><td>{@code 0x0101}</td><td>End of namespace binding</td></tr>
 *   <tr><td>{@code 0x0102}</td><td>Start of element, with attributes</td></tr>
 *   <tr><td>{@code 0x0103}</td><td>End of element</td></tr>
 *   <tr><td>{@code 0x0104}</td><td>Character data</td></tr>
 * </table>
 *
 * <p>All names and most values are indices into the string pool. Attribute
 * values that are not strings are stored as 8-byte typed values, rendered
 * to text by {@link org.bluezoo.axml.codec.TypedValueResolver}.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link org.bluezoo.axml.codec.ByteCursor} - bounds-checked little-endian reader</li>
 *   <li>{@link org.bluezoo.axml.codec.ChunkHeader} - chunk framing</li>
 *   <li>{@link org.bluezoo.axml.codec.StringPool} - the string pool</li>
 *   <li>{@link org.bluezoo.axml.codec.ResourceMap} - attribute resource identifiers</li>
 *   <li>{@link org.bluezoo.axml.codec.TypedValueResolver} - typed value rendering</li>
 *   <li>{@link org.bluezoo.axml.codec.AXMLDecoder} - document decoder</li>
 *   <li>{@link org.bluezoo.axml.codec.AXMLFormatException} - base of all decoding errors</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * byte[] data = Files.readAllBytes(path);
 * Document document = new AXMLDecoder().decode(data);
 * String packageName = document.getRoot().getAttribute(null, "package").getValue();
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>The decoder keeps no state between calls and may be shared. Decoded
 * string pools, resource maps and documents are not modified after
 * decoding.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.axml.codec;
