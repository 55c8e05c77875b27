/*
 * ManifestExtractorTest.java
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

package org.bluezoo.axml;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import org.bluezoo.axml.codec.AXMLBuilder;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link ManifestExtractor}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ManifestExtractorTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private byte[] manifest;

    @Before
    public void setUp() {
        manifest = new AXMLBuilder()
                .startElement(null, "manifest", AXMLBuilder.attr(null, "package", "com.example"))
                .endElement(null, "manifest")
                .build();
    }

    static File archive(File file, String name, byte[] content) throws IOException {
        try (ZipOutputStream zip = new ZipOutputStream(new FileOutputStream(file))) {
            zip.putNextEntry(new ZipEntry("classes.dex"));
            zip.write(new byte[] { 'd', 'e', 'x', '\n' });
            zip.closeEntry();
            zip.putNextEntry(new ZipEntry(name));
            zip.write(content);
            zip.closeEntry();
        }
        return file;
    }

    @Test
    public void testIsArchive() {
        assertTrue(ManifestExtractor.isArchive(new byte[] { 'P', 'K', 3, 4, 0 }));
        assertFalse(ManifestExtractor.isArchive(new byte[] { 'P', 'K', 5, 6 }));
        assertFalse(ManifestExtractor.isArchive(new byte[] { 'P', 'K' }));
        assertFalse(ManifestExtractor.isArchive(manifest));
    }

    @Test
    public void testReadRawDocument() throws Exception {
        File file = folder.newFile("AndroidManifest.xml");
        Files.write(file.toPath(), manifest);
        assertArrayEquals(manifest, ManifestExtractor.read(file));
    }

    @Test
    public void testReadArchive() throws Exception {
        // The name is irrelevant, only the content is examined
        File file = archive(folder.newFile("app.bin"), ManifestExtractor.MANIFEST_ENTRY, manifest);
        assertArrayEquals(manifest, ManifestExtractor.read(file));
    }

    @Test
    public void testArchiveWithoutManifest() throws Exception {
        File file = archive(folder.newFile("app.apk"), "res/layout/main.xml", manifest);
        try {
            ManifestExtractor.read(file);
            fail("Expected FileNotFoundException");
        } catch (FileNotFoundException e) {
            assertTrue(e.getMessage(), e.getMessage().contains(ManifestExtractor.MANIFEST_ENTRY));
        }
    }

    @Test(expected = IOException.class)
    public void testMissingFile() throws Exception {
        ManifestExtractor.read(new File(folder.getRoot(), "missing.apk"));
    }

}
