/*
 * XMLWriter.java
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

package org.bluezoo.axml.xml;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Streaming XML writer producing UTF-8.
 * <p>
 * The writer keeps a stack of open elements, so that end tags need no
 * name, and a stack of namespace scopes, so that prefixes bound by
 * {@link #writeNamespace} can be looked up with {@link #getPrefix}.
 * Attribute values and character data are escaped. An element closed
 * with no content in between is written as an empty-element tag
 * ({@code <foo/>}).
 * <p>
 * If an {@link IndentConfig} is given, each element start and end tag
 * enclosing child elements begins on a new line indented by its depth.
 * Elements containing only text stay on one line.
 * <p>
 * Output is accumulated in an internal buffer and written to the stream
 * by {@link #flush()}.
 * <p>
 * This class is NOT thread-safe.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class XMLWriter {

    private static final int DEFAULT_CAPACITY = 4096;
    private static final String REPLACEMENT = "\ufffd";

    private final OutputStream out;
    private final IndentConfig indentConfig;
    private byte[] buffer;
    private int count;

    // Open elements, innermost first
    private final Deque<ElementInfo> elementStack = new ArrayDeque<>();

    // Namespace scopes (prefix to URI), innermost first
    private final Deque<Map<String, String>> namespaceStack = new ArrayDeque<>();

    // Start tag written but its closing '>' not yet
    private boolean pendingStartTag = false;

    private boolean atDocumentStart = true;

    /**
     * An open element.
     */
    private static class ElementInfo {

        final String qName;
        boolean hasContent;
        boolean hasChildElements;

        ElementInfo(String qName) {
            this.qName = qName;
        }

    }

    /**
     * Creates a new XML writer with no indentation.
     *
     * @param out the output stream to write to
     */
    public XMLWriter(OutputStream out) {
        this(out, null);
    }

    /**
     * Creates a new XML writer.
     *
     * @param out the output stream to write to
     * @param indentConfig the indentation configuration, or null for none
     */
    public XMLWriter(OutputStream out, IndentConfig indentConfig) {
        this.out = out;
        this.indentConfig = indentConfig;
        this.buffer = new byte[DEFAULT_CAPACITY];
        namespaceStack.push(new HashMap<>());
    }

    // ========== Prolog ==========

    /**
     * Writes an XML declaration. This must be the first thing written.
     *
     * @param encoding the encoding name to declare
     * @throws IOException if there is an error writing data
     * @throws IllegalStateException if anything has already been written
     */
    public void writeXMLDeclaration(String encoding) throws IOException {
        if (!atDocumentStart) {
            throw new IllegalStateException("XML declaration must come first");
        }
        writeRawString("<?xml version=\"1.0\" encoding=\"");
        writeRawString(encoding);
        writeRawString("\"?>");
        if (indentConfig == null) {
            append('\n');
        }
        atDocumentStart = false;
    }

    // ========== Element Methods ==========

    /**
     * Writes a start tag with no prefix.
     *
     * @param localName the element name
     * @throws IOException if there is an error writing data
     */
    public void writeStartElement(String localName) throws IOException {
        writeStartElement(null, localName);
    }

    /**
     * Writes a start tag.
     *
     * @param prefix the prefix, or null or empty for none
     * @param localName the local name
     * @throws IOException if there is an error writing data
     */
    public void writeStartElement(String prefix, String localName) throws IOException {
        ElementInfo parent = elementStack.peek();
        closePendingStartTag();
        if (parent != null) {
            parent.hasContent = true;
            parent.hasChildElements = true;
        }
        if (indentConfig != null && !atDocumentStart) {
            writeIndent(elementStack.size());
        }
        atDocumentStart = false;

        String qName = qName(prefix, localName);
        append('<');
        writeRawString(qName);
        elementStack.push(new ElementInfo(qName));
        namespaceStack.push(new HashMap<>());
        pendingStartTag = true;
    }

    /**
     * Writes the end tag of the innermost open element, or completes its
     * start tag as an empty-element tag if it has no content.
     *
     * @throws IOException if there is an error writing data
     * @throws IllegalStateException if there is no open element
     */
    public void writeEndElement() throws IOException {
        if (elementStack.isEmpty()) {
            throw new IllegalStateException("No open element to close");
        }
        ElementInfo element = elementStack.pop();
        namespaceStack.pop();
        if (pendingStartTag && !element.hasContent) {
            writeRawString("/>");
            pendingStartTag = false;
            return;
        }
        closePendingStartTag();
        if (indentConfig != null && element.hasChildElements) {
            writeIndent(elementStack.size());
        }
        writeRawString("</");
        writeRawString(element.qName);
        append('>');
    }

    // ========== Attribute Methods ==========

    /**
     * Writes an attribute of the current start tag.
     *
     * @param prefix the prefix, or null or empty for none
     * @param localName the local name
     * @param value the unescaped value
     * @throws IOException if there is an error writing data
     * @throws IllegalStateException if not in a start tag
     */
    public void writeAttribute(String prefix, String localName, String value) throws IOException {
        if (!pendingStartTag) {
            throw new IllegalStateException("Attributes must be written immediately after writeStartElement");
        }
        append(' ');
        writeRawString(qName(prefix, localName));
        writeRawString("=\"");
        writeEscaped(value, true);
        append('"');
    }

    // ========== Namespace Methods ==========

    /**
     * Writes a namespace declaration on the current start tag and binds
     * the prefix in the element's scope.
     *
     * @param prefix the prefix, or null or empty for the default namespace
     * @param namespaceURI the namespace URI
     * @throws IOException if there is an error writing data
     * @throws IllegalStateException if not in a start tag
     */
    public void writeNamespace(String prefix, String namespaceURI) throws IOException {
        if (!pendingStartTag) {
            throw new IllegalStateException("Namespace declarations must be written immediately after writeStartElement");
        }
        if (prefix == null) {
            prefix = "";
        }
        namespaceStack.peek().put(prefix, namespaceURI);
        if (prefix.isEmpty()) {
            writeRawString(" xmlns=\"");
        } else {
            writeRawString(" xmlns:");
            writeRawString(prefix);
            writeRawString("=\"");
        }
        writeEscaped(namespaceURI, true);
        append('"');
    }

    /**
     * Gets the prefix bound to a namespace URI in the current scope. A
     * prefix rebound to another URI in an inner scope does not count.
     *
     * @param namespaceURI the namespace URI
     * @return the prefix (empty for the default namespace), or null if the
     * URI is not bound
     */
    public String getPrefix(String namespaceURI) {
        if (namespaceURI == null) {
            return null;
        }
        for (Map<String, String> scope : namespaceStack) {
            for (Map.Entry<String, String> entry : scope.entrySet()) {
                String prefix = entry.getKey();
                if (namespaceURI.equals(entry.getValue()) && namespaceURI.equals(getNamespaceURI(prefix))) {
                    return prefix;
                }
            }
        }
        return null;
    }

    /**
     * Gets the namespace URI bound to a prefix in the current scope.
     *
     * @param prefix the prefix, or null or empty for the default namespace
     * @return the URI, or null if the prefix is not bound
     */
    public String getNamespaceURI(String prefix) {
        if (prefix == null) {
            prefix = "";
        }
        for (Map<String, String> scope : namespaceStack) {
            String uri = scope.get(prefix);
            if (uri != null) {
                return uri;
            }
        }
        return null;
    }

    // ========== Character Content Methods ==========

    /**
     * Writes character content, escaping special characters.
     *
     * @param text the text to write
     * @throws IOException if there is an error writing data
     */
    public void writeCharacters(String text) throws IOException {
        if (text == null || text.isEmpty()) {
            return;
        }
        closePendingStartTag();
        ElementInfo element = elementStack.peek();
        if (element != null) {
            element.hasContent = true;
        }
        writeEscaped(text, false);
    }

    // ========== Flush and Close ==========

    /**
     * Writes any buffered data to the stream.
     *
     * @throws IOException if there is an error writing data
     */
    public void flush() throws IOException {
        closePendingStartTag();
        if (count > 0) {
            out.write(buffer, 0, count);
            count = 0;
        }
        out.flush();
    }

    /**
     * Flushes the writer. The underlying stream is not closed.
     *
     * @throws IOException if there is an error writing data
     */
    public void close() throws IOException {
        flush();
    }

    // ========== Internal Helper Methods ==========

    private static String qName(String prefix, String localName) {
        if (prefix != null && !prefix.isEmpty()) {
            return prefix + ":" + localName;
        }
        return localName;
    }

    private void closePendingStartTag() {
        if (pendingStartTag) {
            append('>');
            pendingStartTag = false;
        }
    }

    private void writeIndent(int depth) {
        append('\n');
        int indentSize = indentConfig.getIndentCount() * depth;
        for (int i = 0; i < indentSize; i++) {
            append(indentConfig.getIndentChar());
        }
    }

    private void writeRawString(String s) {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        ensureCapacity(bytes.length);
        System.arraycopy(bytes, 0, buffer, count, bytes.length);
        count += bytes.length;
    }

    /**
     * Writes text with XML escaping. In attribute values double quotes are
     * escaped and line ends written as character references so that they
     * survive attribute value normalization. Characters XML 1.0 does not
     * allow, such as other C0 controls and unpaired surrogates, are
     * written as U+FFFD.
     */
    private void writeEscaped(String s, boolean attribute) {
        for (int i = 0; i < s.length(); ) {
            int codePoint = s.codePointAt(i);
            switch (codePoint) {
                case '<':
                    writeRawString("&lt;");
                    break;
                case '>':
                    writeRawString("&gt;");
                    break;
                case '&':
                    writeRawString("&amp;");
                    break;
                case '"':
                    if (attribute) {
                        writeRawString("&quot;");
                    } else {
                        append('"');
                    }
                    break;
                case '\t':
                    append('\t');
                    break;
                case '\n':
                case '\r':
                    if (attribute) {
                        writeCharacterReference(codePoint);
                    } else {
                        append((char) codePoint);
                    }
                    break;
                default:
                    if (codePoint < 0x20 || (codePoint >= 0xd800 && codePoint <= 0xdfff)
                            || codePoint == 0xfffe || codePoint == 0xffff) {
                        // Not an XML 1.0 character
                        writeRawString(REPLACEMENT);
                    } else if (codePoint < 0x80) {
                        append((char) codePoint);
                    } else {
                        writeRawString(new String(Character.toChars(codePoint)));
                    }
            }
            i += Character.charCount(codePoint);
        }
    }

    /**
     * Writes a character reference (&amp;#xHH; format).
     */
    private void writeCharacterReference(int codePoint) {
        writeRawString("&#x");
        writeRawString(Integer.toHexString(codePoint).toUpperCase());
        append(';');
    }

    private void append(char c) {
        ensureCapacity(1);
        buffer[count++] = (byte) c;
    }

    private void ensureCapacity(int needed) {
        if (buffer.length - count < needed) {
            byte[] newBuffer = new byte[Math.max(buffer.length * 2, count + needed)];
            System.arraycopy(buffer, 0, newBuffer, 0, count);
            buffer = newBuffer;
        }
    }

}
