/*
 * AXMLSerializer.java
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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import org.bluezoo.axml.dom.Attribute;
import org.bluezoo.axml.dom.Document;
import org.bluezoo.axml.dom.Element;
import org.bluezoo.axml.dom.NamespaceDeclaration;
import org.bluezoo.axml.dom.Node;
import org.bluezoo.axml.dom.Text;

/**
 * Renders a decoded document as XML text.
 * <p>
 * Namespace declarations are written on the element they were declared
 * on in the binary document, which for a manifest is the root element.
 * A namespace URI used by an element or attribute with no binding in
 * scope is given a generated prefix ({@code ns0}, {@code ns1}, ...)
 * declared on that element.
 * <p>
 * The whole document is rendered into memory before anything is written
 * to the destination stream, so a destination never receives a partial
 * document. The tree is walked with an explicit stack.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class AXMLSerializer {

    private final IndentConfig indentConfig;
    private final boolean xmlDeclaration;

    /**
     * Creates a serializer producing flat output with no XML declaration.
     */
    public AXMLSerializer() {
        this(null, false);
    }

    /**
     * Constructor.
     *
     * @param indentConfig indentation for pretty-printed output, or null
     * for flat output
     * @param xmlDeclaration whether to begin with an XML declaration
     */
    public AXMLSerializer(IndentConfig indentConfig, boolean xmlDeclaration) {
        this.indentConfig = indentConfig;
        this.xmlDeclaration = xmlDeclaration;
    }

    /**
     * Renders the document as a string.
     *
     * @param document the document
     * @return the XML text
     */
    public String serialize(Document document) {
        return new String(toByteArray(document), StandardCharsets.UTF_8);
    }

    /**
     * Renders the document and writes it, UTF-8 encoded, to the given
     * stream in a single write.
     *
     * @param document the document
     * @param out the destination
     * @throws IOException if the destination cannot be written
     */
    public void serialize(Document document, OutputStream out) throws IOException {
        byte[] bytes = toByteArray(document);
        out.write(bytes);
        out.flush();
    }

    /**
     * Renders the document as UTF-8 bytes.
     *
     * @param document the document
     * @return the XML text, UTF-8 encoded
     */
    public byte[] toByteArray(Document document) {
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        try {
            new Serialization(new XMLWriter(sink, indentConfig)).write(document);
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new UncheckedIOException(e);
        }
        return sink.toByteArray();
    }

    /**
     * The state of one serialization.
     */
    private class Serialization {

        private final XMLWriter writer;
        private int nextPrefix;

        Serialization(XMLWriter writer) {
            this.writer = writer;
        }

        void write(Document document) throws IOException {
            if (xmlDeclaration) {
                writer.writeXMLDeclaration("utf-8");
            }
            Deque<Iterator<Node>> stack = new ArrayDeque<>();
            Element root = document.getRoot();
            writeStartElement(root);
            stack.push(root.getChildren().iterator());
            while (!stack.isEmpty()) {
                Iterator<Node> children = stack.peek();
                if (!children.hasNext()) {
                    writer.writeEndElement();
                    stack.pop();
                    continue;
                }
                Node child = children.next();
                if (child instanceof Element) {
                    Element element = (Element) child;
                    writeStartElement(element);
                    stack.push(element.getChildren().iterator());
                } else {
                    writer.writeCharacters(((Text) child).getData());
                }
            }
            writer.flush();
        }

        private void writeStartElement(Element element) throws IOException {
            // uri to prefix, for namespaces with no binding in scope
            Map<String, String> generated = new LinkedHashMap<>();
            String prefix = prefixFor(element, element.getNamespaceURI(), element.getPrefix(), false, generated);
            String[] attributePrefixes = new String[element.getAttributes().size()];
            int i = 0;
            for (Attribute attribute : element.getAttributes()) {
                attributePrefixes[i++] = prefixFor(element, attribute.getNamespaceURI(),
                        attribute.getPrefix(), true, generated);
            }

            // An element in no namespace must not inherit a default namespace
            String inheritedDefault = writer.getNamespaceURI("");
            boolean undeclareDefault = element.getNamespaceURI() == null
                    && inheritedDefault != null && !inheritedDefault.isEmpty()
                    && !declaresPrefix(element, "");

            writer.writeStartElement(prefix, element.getName());
            for (NamespaceDeclaration declaration : element.getNamespaceDeclarations()) {
                writer.writeNamespace(declaration.getPrefix(), declaration.getURI());
            }
            if (undeclareDefault) {
                writer.writeNamespace("", "");
            }
            for (Map.Entry<String, String> entry : generated.entrySet()) {
                writer.writeNamespace(entry.getValue(), entry.getKey());
            }
            i = 0;
            for (Attribute attribute : element.getAttributes()) {
                writer.writeAttribute(attributePrefixes[i++], attribute.getName(), attribute.getValue());
            }
        }

        /**
         * Chooses the prefix to write for a name. A prefix is only reused
         * while it still maps to the name's URI at this element. Unprefixed
         * attributes are never in the default namespace, so an attribute
         * needs a non-empty prefix.
         */
        private String prefixFor(Element element, String uri, String prefix, boolean attribute,
                                 Map<String, String> generated) {
            if (uri == null) {
                return null;
            }
            if (usable(prefix, attribute) && uri.equals(namespaceURI(element, prefix))) {
                return prefix;
            }
            for (NamespaceDeclaration declaration : element.getNamespaceDeclarations()) {
                if (uri.equals(declaration.getURI()) && usable(declaration.getPrefix(), attribute)) {
                    return declaration.getPrefix();
                }
            }
            // The writer's scope is still the parent's here
            String bound = writer.getPrefix(uri);
            if (usable(bound, attribute) && uri.equals(namespaceURI(element, bound))) {
                return bound;
            }
            String generatedPrefix = generated.get(uri);
            if (generatedPrefix == null) {
                do {
                    generatedPrefix = "ns" + nextPrefix++;
                } while (namespaceURI(element, generatedPrefix) != null
                        || generated.containsValue(generatedPrefix));
                generated.put(uri, generatedPrefix);
            }
            return generatedPrefix;
        }

        /**
         * Returns the URI a prefix maps to at the given element, before any
         * generated declarations.
         */
        private String namespaceURI(Element element, String prefix) {
            for (NamespaceDeclaration declaration : element.getNamespaceDeclarations()) {
                String declared = declaration.getPrefix();
                if (prefix.equals((declared == null) ? "" : declared)) {
                    return declaration.getURI();
                }
            }
            return writer.getNamespaceURI(prefix);
        }

        private boolean declaresPrefix(Element element, String prefix) {
            for (NamespaceDeclaration declaration : element.getNamespaceDeclarations()) {
                String declared = declaration.getPrefix();
                if (prefix.equals((declared == null) ? "" : declared)) {
                    return true;
                }
            }
            return false;
        }

        private boolean usable(String prefix, boolean attribute) {
            return prefix != null && !(attribute && prefix.isEmpty());
        }

    }

}
