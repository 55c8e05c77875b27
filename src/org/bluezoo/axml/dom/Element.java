/*
 * Element.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An element of a decoded document.
 * <p>
 * Elements are assembled by the decoder as their start, content and end
 * chunks are read. Once decoding completes the tree is not modified.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Element extends Node {

    private final String namespaceURI;
    private final String prefix;
    private final String name;
    private final List<NamespaceDeclaration> namespaces = new ArrayList<>();
    private final List<Attribute> attributes = new ArrayList<>();
    private final List<Node> children = new ArrayList<>();

    /**
     * Constructor.
     *
     * @param namespaceURI the namespace URI, or null
     * @param prefix the prefix bound to the namespace URI where the element
     * appeared, or null
     * @param name the local name
     * @param lineNumber the source line number
     */
    public Element(String namespaceURI, String prefix, String name, int lineNumber) {
        super(lineNumber);
        this.namespaceURI = namespaceURI;
        this.prefix = prefix;
        this.name = name;
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

    /**
     * Returns the namespace bindings introduced on this element.
     */
    public List<NamespaceDeclaration> getNamespaceDeclarations() {
        return Collections.unmodifiableList(namespaces);
    }

    public List<Attribute> getAttributes() {
        return Collections.unmodifiableList(attributes);
    }

    /**
     * Returns the first attribute with the given namespace URI and local
     * name.
     *
     * @param namespaceURI the namespace URI, or null for none
     * @param name the local name
     * @return the attribute, or null
     */
    public Attribute getAttribute(String namespaceURI, String name) {
        for (Attribute attribute : attributes) {
            String uri = attribute.getNamespaceURI();
            boolean sameNamespace = (namespaceURI == null) ? uri == null : namespaceURI.equals(uri);
            if (sameNamespace && name.equals(attribute.getName())) {
                return attribute;
            }
        }
        return null;
    }

    /**
     * Returns the child elements and text, in document order.
     */
    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Returns the child elements only, in document order.
     */
    public List<Element> getChildElements() {
        List<Element> elements = new ArrayList<>();
        for (Node child : children) {
            if (child instanceof Element) {
                elements.add((Element) child);
            }
        }
        return elements;
    }

    /**
     * Returns the concatenation of the text children of this element.
     */
    public String getText() {
        StringBuilder buf = new StringBuilder();
        for (Node child : children) {
            if (child instanceof Text) {
                buf.append(((Text) child).getData());
            }
        }
        return buf.toString();
    }

    /**
     * Indicates whether this element has neither child elements nor text.
     */
    public boolean isEmpty() {
        return children.isEmpty();
    }

    public void addNamespaceDeclaration(NamespaceDeclaration declaration) {
        namespaces.add(declaration);
    }

    public void addAttribute(Attribute attribute) {
        attributes.add(attribute);
    }

    public void appendChild(Node child) {
        children.add(child);
    }

    @Override
    public String toString() {
        return "<" + getQName() + ">";
    }

}
