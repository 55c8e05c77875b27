/*
 * XMLWriterTest.java
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
import java.nio.charset.StandardCharsets;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link XMLWriter}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class XMLWriterTest {

    private ByteArrayOutputStream out;

    @Before
    public void setUp() {
        out = new ByteArrayOutputStream();
    }

    private String written() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void testEmptyElement() throws Exception {
        XMLWriter writer = new XMLWriter(out);
        writer.writeStartElement("manifest");
        writer.writeAttribute(null, "package", "com.example");
        writer.writeEndElement();
        writer.close();
        assertEquals("<manifest package=\"com.example\"/>", written());
    }

    @Test
    public void testNothingWrittenBeforeFlush() throws Exception {
        XMLWriter writer = new XMLWriter(out);
        writer.writeStartElement("a");
        writer.writeEndElement();
        assertEquals(0, out.size());
        writer.flush();
        assertEquals("<a/>", written());
    }

    @Test
    public void testNestedAndText() throws Exception {
        XMLWriter writer = new XMLWriter(out);
        writer.writeStartElement("a");
        writer.writeStartElement("b");
        writer.writeCharacters("x < y & \"z\"");
        writer.writeEndElement();
        writer.writeEndElement();
        writer.flush();
        assertEquals("<a><b>x &lt; y &amp; \"z\"</b></a>", written());
    }

    @Test
    public void testAttributeEscaping() throws Exception {
        XMLWriter writer = new XMLWriter(out);
        writer.writeStartElement("a");
        writer.writeAttribute(null, "v", "1\"2<3>&4\n5\t6");
        writer.writeEndElement();
        writer.flush();
        assertEquals("<a v=\"1&quot;2&lt;3&gt;&amp;4&#xA;5\t6\"/>", written());
    }

    @Test
    public void testInvalidCharactersReplaced() throws Exception {
        XMLWriter writer = new XMLWriter(out);
        writer.writeStartElement("a");
        writer.writeAttribute(null, "v", "x\u0002y");
        writer.writeCharacters("\u0001 \uD800 \uFFFF");
        writer.writeEndElement();
        writer.flush();
        assertEquals("<a v=\"x\uFFFDy\">\uFFFD \uFFFD \uFFFD</a>", written());
    }

    @Test
    public void testRedeclaredPrefix() throws Exception {
        XMLWriter writer = new XMLWriter(out);
        writer.writeStartElement("root");
        writer.writeNamespace("a", "urn:x");
        writer.writeStartElement("a", "child");
        writer.writeNamespace("a", "urn:y");
        assertEquals("urn:y", writer.getNamespaceURI("a"));
        assertEquals("a", writer.getPrefix("urn:y"));
        assertNull(writer.getPrefix("urn:x"));
        writer.writeEndElement();
        assertEquals("urn:x", writer.getNamespaceURI("a"));
        assertEquals("a", writer.getPrefix("urn:x"));
        assertNull(writer.getNamespaceURI("b"));
    }

    @Test
    public void testNonAscii() throws Exception {
        XMLWriter writer = new XMLWriter(out);
        writer.writeStartElement("a");
        writer.writeCharacters("日本 😀");
        writer.writeEndElement();
        writer.flush();
        assertEquals("<a>日本 😀</a>", written());
    }

    @Test
    public void testNamespaces() throws Exception {
        XMLWriter writer = new XMLWriter(out);
        writer.writeStartElement("manifest");
        writer.writeNamespace("android", "urn:android");
        writer.writeNamespace(null, "urn:default");
        assertEquals("android", writer.getPrefix("urn:android"));
        assertEquals("", writer.getPrefix("urn:default"));
        assertNull(writer.getPrefix("urn:other"));
        writer.writeStartElement("android", "child");
        assertEquals("android", writer.getPrefix("urn:android"));
        writer.writeEndElement();
        writer.writeEndElement();
        assertNull(writer.getPrefix("urn:android"));
        writer.flush();
        assertEquals("<manifest xmlns:android=\"urn:android\" xmlns=\"urn:default\"><android:child/></manifest>",
                written());
    }

    @Test
    public void testIndent() throws Exception {
        XMLWriter writer = new XMLWriter(out, IndentConfig.tabs(1));
        writer.writeXMLDeclaration("utf-8");
        writer.writeStartElement("a");
        writer.writeStartElement("b");
        writer.writeCharacters("text");
        writer.writeEndElement();
        writer.writeStartElement("c");
        writer.writeEndElement();
        writer.writeEndElement();
        writer.flush();
        assertEquals("<?xml version=\"1.0\" encoding=\"utf-8\"?>\n<a>\n\t<b>text</b>\n\t<c/>\n</a>", written());
    }

    @Test(expected = IllegalStateException.class)
    public void testDeclarationNotFirst() throws Exception {
        XMLWriter writer = new XMLWriter(out);
        writer.writeStartElement("a");
        writer.writeXMLDeclaration("utf-8");
    }

    @Test(expected = IllegalStateException.class)
    public void testAttributeOutsideStartTag() throws Exception {
        XMLWriter writer = new XMLWriter(out);
        writer.writeStartElement("a");
        writer.writeCharacters("text");
        writer.writeAttribute(null, "late", "1");
    }

    @Test(expected = IllegalStateException.class)
    public void testEndWithoutStart() throws Exception {
        new XMLWriter(out).writeEndElement();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidIndentCharacter() {
        new IndentConfig('x', 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeIndent() {
        IndentConfig.spaces(-1);
    }

}
