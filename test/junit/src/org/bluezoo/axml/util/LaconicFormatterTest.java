/*
 * LaconicFormatterTest.java
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

package org.bluezoo.axml.util;

import java.util.logging.Level;
import java.util.logging.LogRecord;

import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link LaconicFormatter}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class LaconicFormatterTest {

    @Test
    public void testMessage() {
        LogRecord record = new LogRecord(Level.WARNING, "Ignoring {0}");
        record.setParameters(new Object[] { "x" });
        String expected = Level.WARNING.getLocalizedName() + ": Ignoring x" + System.lineSeparator();
        assertEquals(expected, new LaconicFormatter().format(record));
    }

    @Test
    public void testThrown() {
        LogRecord record = new LogRecord(Level.FINE, "failed");
        record.setThrown(new IllegalStateException("boom"));
        String formatted = new LaconicFormatter().format(record);
        assertTrue(formatted, formatted.startsWith(Level.FINE.getLocalizedName() + ": failed" + System.lineSeparator()));
        assertTrue(formatted, formatted.contains("java.lang.IllegalStateException: boom"));
    }

    @Test
    public void testDebugNamesLogger() {
        LogRecord record = new LogRecord(Level.FINE, "Skipping chunk");
        record.setLoggerName("org.bluezoo.axml.codec.AXMLDecoder");
        String expected = Level.FINE.getLocalizedName() + " [AXMLDecoder]: Skipping chunk" + System.lineSeparator();
        assertEquals(expected, new LaconicFormatter().format(record));
    }

    @Test
    public void testWarningOmitsLogger() {
        LogRecord record = new LogRecord(Level.WARNING, "Ignoring level");
        record.setLoggerName("org.bluezoo.axml.AXMLDump");
        assertEquals(Level.WARNING.getLocalizedName() + ": Ignoring level" + System.lineSeparator(),
                new LaconicFormatter().format(record));
    }

}
