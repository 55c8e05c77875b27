/*
 * UnbalancedElementException.java
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

/**
 * Thrown when element start and end chunks do not nest, or the document
 * does not have exactly one root element.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class UnbalancedElementException extends AXMLFormatException {

    private static final long serialVersionUID = 1L;

    public UnbalancedElementException(String message) {
        super(message);
    }

    public UnbalancedElementException(String message, long offset) {
        super(message, offset);
    }

    public UnbalancedElementException(String message, long offset, int chunkType) {
        super(message, offset, chunkType);
    }

}
