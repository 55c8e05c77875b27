/*
 * AXMLDecoder.java
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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.axml.dom.Attribute;
import org.bluezoo.axml.dom.Document;
import org.bluezoo.axml.dom.Element;
import org.bluezoo.axml.dom.NamespaceDeclaration;
import org.bluezoo.axml.dom.Text;

/**
 * Decodes an Android binary XML document into a {@link Document}.
 * <p>
 * The input is a single XML chunk wrapping a string pool, an optional
 * resource map and a flat sequence of node chunks (namespace start and
 * end, element start and end, character data). The decoder walks the node
 * chunks once, keeping explicit stacks of open namespaces and elements, so
 * that nesting depth is bounded only by memory and never by the call
 * stack.
 * <p>
 * Decoding either succeeds completely or throws a subclass of
 * {@link AXMLFormatException}: there is no partial result. Chunks of a
 * type the decoder does not recognize are skipped using their declared
 * size; malformed chunks of a recognized type are errors.
 * <p>
 * All decoding state is local to a {@link #decode} call, so a single
 * decoder may be reused, including concurrently.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class AXMLDecoder {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.axml.codec.L10N");
    private static final Logger LOGGER = Logger.getLogger(AXMLDecoder.class.getName());

    /**
     * Size of the header of a node chunk: the common header followed by
     * the line number and comment index.
     */
    static final int NODE_HEADER_SIZE = 16;

    /**
     * Minimum size of an attribute record.
     */
    static final int ATTRIBUTE_SIZE = 20;

    /**
     * Decodes a complete binary XML document.
     *
     * @param data the document bytes
     * @return the decoded document
     * @throws AXMLFormatException if the document is malformed
     */
    public Document decode(byte[] data) throws AXMLFormatException {
        ByteCursor cursor = new ByteCursor(data);
        ChunkHeader header = ChunkHeader.read(cursor);
        if (header.getChunkType() != ChunkType.XML) {
            String message = L10N.getString("err.not_document");
            message = MessageFormat.format(message, ChunkType.toHexString(header.getType()));
            throw new InvalidChunkTypeException(message, 0L, header.getType());
        }
        cursor.seekTo(0);
        ByteCursor document = cursor.slice(header.getSize());
        if (cursor.hasRemaining() && LOGGER.isLoggable(Level.FINE)) {
            String message = L10N.getString("fine.trailing");
            LOGGER.fine(MessageFormat.format(message, Integer.toString(cursor.remaining())));
        }
        document.seekTo(header.getHeaderSize());
        Decoding decoding = new Decoding();
        while (document.hasRemaining()) {
            ChunkHeader chunkHeader = ChunkHeader.read(document);
            document.seekTo(chunkHeader.getStart());
            long offset = document.absolutePosition();
            ByteCursor chunk = document.slice(chunkHeader.getSize());
            try {
                decoding.chunk(chunk, chunkHeader, offset);
            } catch (StringIndexOutOfRangeException e) {
                if (e.getOffset() >= 0) {
                    throw e;
                }
                AXMLFormatException x = new StringIndexOutOfRangeException(e.getMessage(), offset, chunkHeader.getType());
                x.initCause(e);
                throw x;
            } catch (UnsupportedTypedValueException e) {
                if (e.getOffset() >= 0) {
                    throw e;
                }
                AXMLFormatException x = new UnsupportedTypedValueException(e.getMessage(), offset, chunkHeader.getType());
                x.initCause(e);
                throw x;
            }
        }
        return decoding.finish(document.absolutePosition());
    }

    /**
     * A namespace binding in scope, with the string pool indices it was
     * declared with.
     */
    private static final class Binding {

        final int prefixIndex;
        final int uriIndex;
        final String prefix;
        final String uri;

        Binding(int prefixIndex, int uriIndex, String prefix, String uri) {
            this.prefixIndex = prefixIndex;
            this.uriIndex = uriIndex;
            this.prefix = prefix;
            this.uri = uri;
        }

    }

    /**
     * An element whose end chunk has not been seen yet.
     */
    private static final class OpenElement {

        final Element element;
        final int namespaceIndex;
        final int nameIndex;

        OpenElement(Element element, int namespaceIndex, int nameIndex) {
            this.element = element;
            this.namespaceIndex = namespaceIndex;
            this.nameIndex = nameIndex;
        }

    }

    /**
     * The state of one decode pass.
     */
    private static final class Decoding {

        private StringPool strings = StringPool.EMPTY;
        private ResourceMap resourceMap = ResourceMap.EMPTY;
        private TypedValueResolver resolver = new TypedValueResolver(strings);
        private boolean haveStringPool;
        private boolean haveResourceMap;

        private final Deque<Binding> namespaces = new ArrayDeque<>();
        // Bindings started since the last element start
        private final List<Binding> pendingNamespaces = new ArrayList<>();
        private final Deque<OpenElement> elements = new ArrayDeque<>();
        private Element root;
        private int elementCount;

        void chunk(ByteCursor chunk, ChunkHeader header, long offset) throws AXMLFormatException {
            ChunkType type = header.getChunkType();
            if (type == null) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    String message = L10N.getString("fine.skip_chunk");
                    message = MessageFormat.format(message, ChunkType.toHexString(header.getType()),
                            Integer.toString(header.getSize()), Long.toString(offset));
                    LOGGER.fine(message);
                }
                return;
            }
            switch (type) {
                case STRING_POOL:
                    if (haveStringPool) {
                        throw invalid("err.duplicate_string_pool", header, offset);
                    }
                    strings = StringPool.read(chunk, header);
                    resolver = new TypedValueResolver(strings);
                    haveStringPool = true;
                    break;
                case XML_RESOURCE_MAP:
                    if (haveResourceMap) {
                        throw invalid("err.duplicate_resource_map", header, offset);
                    }
                    resourceMap = ResourceMap.read(chunk, header);
                    haveResourceMap = true;
                    break;
                case XML_START_NAMESPACE:
                    startNamespace(chunk, header, offset);
                    break;
                case XML_END_NAMESPACE:
                    endNamespace(chunk, header, offset);
                    break;
                case XML_START_ELEMENT:
                    startElement(chunk, header, offset);
                    break;
                case XML_END_ELEMENT:
                    endElement(chunk, header, offset);
                    break;
                case XML_CDATA:
                    characters(chunk, header, offset);
                    break;
                default:
                    throw invalid("err.nested_document", header, offset);
            }
        }

        private void startNamespace(ByteCursor chunk, ChunkHeader header, long offset) throws AXMLFormatException {
            readNodeHeader(chunk, header, offset);
            int prefixIndex = chunk.readI32();
            int uriIndex = chunk.readI32();
            Binding binding = new Binding(prefixIndex, uriIndex,
                    strings.getOptional(prefixIndex), strings.getOptional(uriIndex));
            namespaces.push(binding);
            pendingNamespaces.add(binding);
        }

        private void endNamespace(ByteCursor chunk, ChunkHeader header, long offset) throws AXMLFormatException {
            readNodeHeader(chunk, header, offset);
            int prefixIndex = chunk.readI32();
            int uriIndex = chunk.readI32();
            if (namespaces.isEmpty()) {
                String message = L10N.getString("err.namespace_end_empty");
                message = MessageFormat.format(message, describe(prefixIndex), describe(uriIndex));
                throw new UnbalancedNamespaceException(message, offset, header.getType());
            }
            Binding top = namespaces.peek();
            if (top.prefixIndex != prefixIndex || top.uriIndex != uriIndex) {
                String message = L10N.getString("err.namespace_mismatch");
                message = MessageFormat.format(message, describe(prefixIndex), describe(uriIndex),
                        describe(top.prefixIndex), describe(top.uriIndex));
                throw new UnbalancedNamespaceException(message, offset, header.getType());
            }
            namespaces.pop();
            pendingNamespaces.remove(top);
        }

        private void startElement(ByteCursor chunk, ChunkHeader header, long offset) throws AXMLFormatException {
            int lineNumber = readNodeHeader(chunk, header, offset);
            int extStart = chunk.position();
            int namespaceIndex = chunk.readI32();
            int nameIndex = chunk.readI32();
            int attributeStart = chunk.readU16();
            int attributeSize = chunk.readU16();
            int attributeCount = chunk.readU16();
            chunk.readU16(); // idIndex
            chunk.readU16(); // classIndex
            chunk.readU16(); // styleIndex
            if (attributeCount > 0 && attributeSize < ATTRIBUTE_SIZE) {
                String message = L10N.getString("err.attribute_size");
                message = MessageFormat.format(message, Integer.toString(attributeSize));
                throw new InvalidChunkTypeException(message, offset, header.getType());
            }

            String uri = strings.getOptional(namespaceIndex);
            String name = strings.get(nameIndex);
            Element element = new Element(uri, prefixFor(uri), name, lineNumber);
            for (Binding binding : pendingNamespaces) {
                element.addNamespaceDeclaration(new NamespaceDeclaration(binding.prefix, binding.uri));
            }
            pendingNamespaces.clear();
            for (int i = 0; i < attributeCount; i++) {
                chunk.seekTo(extStart + attributeStart + (long) i * attributeSize);
                element.addAttribute(readAttribute(chunk));
            }

            if (elements.isEmpty()) {
                if (root != null) {
                    String message = L10N.getString("err.multiple_roots");
                    message = MessageFormat.format(message, element.getQName());
                    throw new UnbalancedElementException(message, offset, header.getType());
                }
                root = element;
            } else {
                elements.peek().element.appendChild(element);
            }
            elements.push(new OpenElement(element, namespaceIndex, nameIndex));
            elementCount++;
        }

        private Attribute readAttribute(ByteCursor chunk) throws AXMLFormatException {
            int namespaceIndex = chunk.readI32();
            int nameIndex = chunk.readI32();
            int rawValueIndex = chunk.readI32();
            TypedValue typedValue = TypedValue.read(chunk);
            String uri = strings.getOptional(namespaceIndex);
            String name = strings.get(nameIndex);
            String rawValue = strings.getOptional(rawValueIndex);
            String value = (rawValue != null) ? rawValue : resolver.resolve(typedValue);
            return new Attribute(uri, prefixFor(uri), name, rawValue, typedValue,
                    resourceMap.get(nameIndex), value);
        }

        private void endElement(ByteCursor chunk, ChunkHeader header, long offset) throws AXMLFormatException {
            readNodeHeader(chunk, header, offset);
            int namespaceIndex = chunk.readI32();
            int nameIndex = chunk.readI32();
            if (elements.isEmpty()) {
                String message = L10N.getString("err.element_end_empty");
                message = MessageFormat.format(message, describe(nameIndex));
                throw new UnbalancedElementException(message, offset, header.getType());
            }
            OpenElement top = elements.peek();
            if (top.namespaceIndex != namespaceIndex || top.nameIndex != nameIndex) {
                String message = L10N.getString("err.element_mismatch");
                message = MessageFormat.format(message, describe(nameIndex), top.element.getQName());
                throw new UnbalancedElementException(message, offset, header.getType());
            }
            elements.pop();
        }

        private void characters(ByteCursor chunk, ChunkHeader header, long offset) throws AXMLFormatException {
            int lineNumber = readNodeHeader(chunk, header, offset);
            int dataIndex = chunk.readI32();
            TypedValue typedValue = TypedValue.read(chunk);
            if (elements.isEmpty()) {
                throw new UnbalancedElementException(L10N.getString("err.text_outside"), offset, header.getType());
            }
            String text = (dataIndex != StringPool.NO_INDEX) ? strings.get(dataIndex) : resolver.resolve(typedValue);
            elements.peek().element.appendChild(new Text(text, lineNumber));
        }

        /**
         * Reads the line number and comment of a node chunk and positions
         * the cursor at the node's extension data.
         */
        private int readNodeHeader(ByteCursor chunk, ChunkHeader header, long offset) throws AXMLFormatException {
            if (header.getHeaderSize() < NODE_HEADER_SIZE) {
                String message = L10N.getString("err.node_header_size");
                message = MessageFormat.format(message, Integer.toString(header.getHeaderSize()));
                throw new InvalidChunkTypeException(message, offset, header.getType());
            }
            chunk.seekTo(ChunkHeader.SIZE);
            int lineNumber = chunk.readI32();
            chunk.readI32(); // comment
            chunk.seekTo(header.getHeaderSize());
            return lineNumber;
        }

        /**
         * Returns the prefix bound to the given URI by the innermost
         * binding in scope whose prefix is not rebound by a closer
         * binding: the empty string for a default namespace, null if the
         * URI has no such binding.
         */
        private String prefixFor(String uri) {
            if (uri == null) {
                return null;
            }
            Set<String> shadowed = new HashSet<>();
            for (Binding binding : namespaces) {
                String prefix = (binding.prefix == null) ? "" : binding.prefix;
                if (uri.equals(binding.uri) && !shadowed.contains(prefix)) {
                    return prefix;
                }
                shadowed.add(prefix);
            }
            return null;
        }

        /**
         * Describes a string pool index for a diagnostic, without failing
         * if the index is invalid.
         */
        private String describe(int index) {
            if (index >= 0 && index < strings.size()) {
                return "\"" + strings.getStrings().get(index) + "\"";
            }
            return "#" + index;
        }

        private InvalidChunkTypeException invalid(String key, ChunkHeader header, long offset) {
            String message = L10N.getString(key);
            message = MessageFormat.format(message, ChunkType.toHexString(header.getType()));
            return new InvalidChunkTypeException(message, offset, header.getType());
        }

        Document finish(long offset) throws AXMLFormatException {
            if (!elements.isEmpty()) {
                String message = L10N.getString("err.element_unclosed");
                message = MessageFormat.format(message, elements.peek().element.getQName());
                throw new UnbalancedElementException(message, offset);
            }
            if (!namespaces.isEmpty()) {
                String message = L10N.getString("err.namespace_unclosed");
                message = MessageFormat.format(message, Integer.toString(namespaces.size()));
                throw new UnbalancedNamespaceException(message, offset);
            }
            if (root == null) {
                throw new UnbalancedElementException(L10N.getString("err.no_root"), offset);
            }
            if (LOGGER.isLoggable(Level.FINE)) {
                String message = L10N.getString("fine.decoded");
                message = MessageFormat.format(message, Integer.toString(strings.size()),
                        Integer.toString(resourceMap.size()), Integer.toString(elementCount));
                LOGGER.fine(message);
            }
            return new Document(root);
        }

    }

}
