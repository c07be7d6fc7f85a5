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
 * Thrown when a formula is evaluated under an assignment that does not bind one of its variables.
 */
public class UnboundVariableException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final char variable;

    public UnboundVariableException(char variable) {
        super("No value assigned to variable '" + variable + "'");
        this.variable = variable;
    }

    public char variable() {
        return variable;
    }
}
