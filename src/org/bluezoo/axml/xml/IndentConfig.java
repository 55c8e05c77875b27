/*
 * IndentConfig.java
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

/**
 * Indentation settings for pretty-printed output: the character used
 * and how many of it to write per level of nesting.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class IndentConfig {

    private final char indentChar;
    private final int indentCount;

    /**
     * Constructor.
     *
     * @param indentChar the indent character, space or tab
     * @param indentCount the number of indent characters per level
     */
    public IndentConfig(char indentChar, int indentCount) {
        if (indentChar != ' ' && indentChar != '\t') {
            throw new IllegalArgumentException("Indent character must be a space or a tab");
        }
        if (indentCount < 0) {
            throw new IllegalArgumentException("Indent count must not be negative: " + indentCount);
        }
        this.indentChar = indentChar;
        this.indentCount = indentCount;
    }

    /**
     * Returns a configuration indenting with the given number of spaces.
     */
    public static IndentConfig spaces(int count) {
        return new IndentConfig(' ', count);
    }

    /**
     * Returns a configuration indenting with the given number of tabs.
     */
    public static IndentConfig tabs(int count) {
        return new IndentConfig('\t', count);
    }

    public char getIndentChar() {
        return indentChar;
    }

    public int getIndentCount() {
        return indentCount;
    }

}
