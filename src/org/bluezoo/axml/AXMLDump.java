/*
 * AXMLDump.java
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
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.axml.codec.AXMLDecoder;
import org.bluezoo.axml.codec.AXMLFormatException;
import org.bluezoo.axml.dom.Document;
import org.bluezoo.axml.util.LaconicFormatter;
import org.bluezoo.axml.xml.AXMLSerializer;
import org.bluezoo.axml.xml.IndentConfig;

/**
 * Command-line tool that prints the textual form of an Android binary XML
 * document.
 * <p>
 * Usage: {@code axml [-p|--pretty] [-d|--declaration] <file> [<output>]}
 * (or {@code axml --version}),
 * where {@code <file>} is a binary XML file or an application package
 * whose manifest is to be decoded. The XML is written to
 * {@code <output>} if given, otherwise to standard output.
 * <p>
 * The following system properties are recognized:
 * <ul>
 * <li>{@code axml.pretty} - pretty-print by default</li>
 * <li>{@code axml.indent} - number of indent characters per level (2)</li>
 * <li>{@code axml.indentChar} - {@code space} or {@code tab}</li>
 * <li>{@code axml.logLevel} - level of diagnostic logging (WARNING)</li>
 * </ul>
 * Exit codes: 0 on success, 1 on a usage error, 2 if the input cannot be
 * read or the output written, 3 if the input is not a well-formed binary
 * XML document. Nothing is written to the output unless decoding succeeds.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class AXMLDump {

    public static final String VERSION = "0.1";

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.axml.L10N");
    static final Logger LOGGER = Logger.getLogger(AXMLDump.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_IO = 2;
    static final int EXIT_FORMAT = 3;

    private static final int DEFAULT_INDENT = 2;

    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the tool.
     *
     * @param args the command-line arguments
     * @param out the standard output stream
     * @param err the standard error stream
     * @return the exit code
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        boolean pretty = Boolean.getBoolean("axml.pretty");
        boolean declaration = false;
        List<String> files = new ArrayList<>();
        for (String arg : args) {
            if ("-p".equals(arg) || "--pretty".equals(arg)) {
                pretty = true;
            } else if ("-d".equals(arg) || "--declaration".equals(arg)) {
                declaration = true;
            } else if ("-v".equals(arg) || "--version".equals(arg)) {
                out.println(MessageFormat.format(L10N.getString("version"), VERSION));
                return EXIT_OK;
            } else if (arg.startsWith("-") && arg.length() > 1) {
                err.println(MessageFormat.format(L10N.getString("err.unknown_option"), arg));
                err.println(L10N.getString("err.syntax"));
                return EXIT_USAGE;
            } else {
                files.add(arg);
            }
        }
        if (files.isEmpty() || files.size() > 2) {
            err.println(L10N.getString("err.syntax"));
            return EXIT_USAGE;
        }

        File input = new File(files.get(0));
        byte[] data;
        try {
            data = ManifestExtractor.read(input);
        } catch (IOException e) {
            err.println(MessageFormat.format(L10N.getString("err.read"), input.getPath(), e.getMessage()));
            LOGGER.log(Level.FINE, e.getMessage(), e);
            return EXIT_IO;
        }

        Document document;
        long t1 = System.currentTimeMillis();
        try {
            document = new AXMLDecoder().decode(data);
        } catch (AXMLFormatException e) {
            String message = L10N.getString("err.decode");
            message = MessageFormat.format(message, input.getPath(), e.getClass().getSimpleName(), e.getMessage());
            err.println(message);
            LOGGER.log(Level.FINE, e.getMessage(), e);
            return EXIT_FORMAT;
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            String message = L10N.getString("fine.decoded");
            message = MessageFormat.format(message, input.getPath(), Long.toString(System.currentTimeMillis() - t1));
            LOGGER.fine(message);
        }

        AXMLSerializer serializer = new AXMLSerializer(pretty ? indentConfig() : null, declaration);
        byte[] xml = serializer.toByteArray(document);
        if (files.size() == 2) {
            File output = new File(files.get(1));
            try (OutputStream sink = Files.newOutputStream(output.toPath())) {
                sink.write(xml);
                sink.write('\n');
            } catch (IOException e) {
                err.println(MessageFormat.format(L10N.getString("err.write"), output.getPath(), e.getMessage()));
                LOGGER.log(Level.FINE, e.getMessage(), e);
                return EXIT_IO;
            }
        } else {
            out.write(xml, 0, xml.length);
            out.println();
            out.flush();
            if (out.checkError()) {
                err.println(MessageFormat.format(L10N.getString("err.write"), "-", ""));
                return EXIT_IO;
            }
        }
        return EXIT_OK;
    }

    /**
     * Returns the indentation for pretty-printed output, from the
     * {@code axml.indent} and {@code axml.indentChar} system properties.
     */
    static IndentConfig indentConfig() {
        int count = Integer.getInteger("axml.indent", DEFAULT_INDENT);
        if (count < 0) {
            LOGGER.warning(MessageFormat.format(L10N.getString("warn.bad_indent"), Integer.toString(count)));
            count = DEFAULT_INDENT;
        }
        if ("tab".equals(System.getProperty("axml.indentChar"))) {
            return IndentConfig.tabs(count);
        }
        return IndentConfig.spaces(count);
    }

    /**
     * Sends log records for this tool's packages to standard error, at the
     * level given by the {@code axml.logLevel} system property.
     */
    static void configureLogging() {
        Level level = Level.WARNING;
        String levelName = System.getProperty("axml.logLevel");
        boolean badLevel = false;
        if (levelName != null) {
            try {
                level = Level.parse(levelName);
            } catch (IllegalArgumentException e) {
                badLevel = true;
            }
        }
        ConsoleHandler handler = new ConsoleHandler();
        handler.setFormatter(new LaconicFormatter());
        handler.setLevel(level);
        Logger logger = Logger.getLogger("org.bluezoo.axml");
        logger.setUseParentHandlers(false);
        logger.addHandler(handler);
        logger.setLevel(level);
        if (badLevel) {
            LOGGER.warning(MessageFormat.format(L10N.getString("warn.bad_level"), levelName));
        }
    }

}
