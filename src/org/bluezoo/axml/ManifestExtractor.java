/*
 * ManifestExtractor.java
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
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.text.MessageFormat;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Obtains the bytes of a binary XML document from a file that is either
 * the document itself or an application package containing a manifest.
 * <p>
 * Packages are recognized by the ZIP local file header signature, not by
 * file name.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ManifestExtractor {

    private static final Logger LOGGER = Logger.getLogger(ManifestExtractor.class.getName());

    /**
     * The name of the manifest entry in an application package.
     */
    public static final String MANIFEST_ENTRY = "AndroidManifest.xml";

    private static final byte[] ZIP_SIGNATURE = { 'P', 'K', 0x03, 0x04 };

    private ManifestExtractor() {
    }

    /**
     * Reads a binary XML document from a file. If the file is an archive,
     * the manifest entry is extracted from it.
     *
     * @param file the binary XML file or archive
     * @return the binary XML document
     * @throws IOException if the file cannot be read, or is an archive
     * without a manifest entry
     */
    public static byte[] read(File file) throws IOException {
        byte[] data = Files.readAllBytes(file.toPath());
        if (isArchive(data)) {
            return extract(file);
        }
        return data;
    }

    /**
     * Indicates whether the given bytes start with a ZIP local file header.
     *
     * @param data the file contents
     * @return true if the data looks like an archive
     */
    public static boolean isArchive(byte[] data) {
        if (data.length < ZIP_SIGNATURE.length) {
            return false;
        }
        for (int i = 0; i < ZIP_SIGNATURE.length; i++) {
            if (data[i] != ZIP_SIGNATURE[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Extracts the manifest entry from an archive.
     *
     * @param archive the archive
     * @return the bytes of the manifest entry
     * @throws FileNotFoundException if the archive has no manifest entry
     * @throws IOException if the archive cannot be read
     */
    public static byte[] extract(File archive) throws IOException {
        try (ZipFile zipFile = new ZipFile(archive)) {
            ZipEntry entry = zipFile.getEntry(MANIFEST_ENTRY);
            if (entry == null) {
                String message = AXMLDump.L10N.getString("err.no_manifest");
                message = MessageFormat.format(message, archive.getPath(), MANIFEST_ENTRY);
                throw new FileNotFoundException(message);
            }
            try (InputStream in = zipFile.getInputStream(entry)) {
                byte[] data = in.readAllBytes();
                if (LOGGER.isLoggable(Level.FINE)) {
                    String message = AXMLDump.L10N.getString("fine.extracted");
                    message = MessageFormat.format(message, Integer.toString(data.length), archive.getPath());
                    LOGGER.fine(message);
                }
                return data;
            }
        }
    }

}
