/*
 * LaconicFormatter.java
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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * A logging formatter that prints the level and the message, followed by
 * the stack trace of any exception. Records below INFO also carry the
 * simple name of their logger.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class LaconicFormatter extends Formatter {

    @Override
    public String format(LogRecord record) {
        StringBuilder buf = new StringBuilder();
        Level level = record.getLevel();
        buf.append(level.getLocalizedName());
        String loggerName = record.getLoggerName();
        if (level.intValue() < Level.INFO.intValue() && loggerName != null) {
            // Debug output names the class that logged it
            buf.append(" [");
            buf.append(loggerName.substring(loggerName.lastIndexOf('.') + 1));
            buf.append(']');
        }
        buf.append(": ");
        String message = formatMessage(record);
        if (message != null) {
            buf.append(message);
        }
        buf.append(System.lineSeparator());
        Throwable t = record.getThrown();
        if (t != null) {
            StringWriter sink = new StringWriter();
            PrintWriter filter = new PrintWriter(sink);
            t.printStackTrace(filter);
            filter.flush();
            buf.append(sink.toString());
        }
        return buf.toString();
    }

}
