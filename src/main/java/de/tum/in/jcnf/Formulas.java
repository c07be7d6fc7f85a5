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

public final class Formulas {
    private Formulas() {}

    /** Parses a fully parenthesized infix formula such as {@code ((p+q)*(~r))}. */
    public static ExpressionTree parse(String infix) throws FormulaParseException {
        return PrefixTreeBuilder.build(InfixToPrefixConverter.toPrefix(infix));
    }
}
