/*
 * This file is part of JCNF.
 * Copyright (c) 2025 The JCNF authors.
 *
 * JCNF is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JCNF is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JCNF. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jcnf;

/**
 * Signals malformed infix or prefix formula text.
 */
public class FormulaParseException extends Exception {
    private static final long serialVersionUID = 1L;

    private final String input;
    private final int position;

    public FormulaParseException(String message, String input, int position) {
        super(String.format("%s at position %d of \"%s\"", message, position, input));
        this.input = input;
        this.position = position;
    }

    /** The text that failed to parse. */
    public String input() {
        return input;
    }

    /** Index into {@link #input()} at which the problem was detected. */
    public int position() {
        return position;
    }
}
