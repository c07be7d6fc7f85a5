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

import de.tum.in.jcnf.ExpressionTree.BinaryOperation;
import de.tum.in.jcnf.ExpressionTree.BinaryType;
import de.tum.in.jcnf.ExpressionTree.Node;
import de.tum.in.jcnf.ExpressionTree.Not;
import de.tum.in.jcnf.ExpressionTree.Variable;

/**
 * Builds expression trees from prefix notation by recursive descent. Formulas nested deeper than
 * {@link #MAXIMUM_NESTING} operators are rejected.
 */
public final class PrefixTreeBuilder {
    public static final int MAXIMUM_NESTING = CnfConfiguration.DEFAULT_MAXIMUM_RECURSION_DEPTH;

    private final String prefix;
    private int cursor = 0;

    private PrefixTreeBuilder(String prefix) {
        this.prefix = prefix;
    }

    public static ExpressionTree build(String prefix) throws FormulaParseException {
        PrefixTreeBuilder builder = new PrefixTreeBuilder(prefix);
        Node root = builder.next(1);
        if (builder.cursor != prefix.length()) {
            throw new FormulaParseException("Trailing input after complete formula", prefix, builder.cursor);
        }
        return new ExpressionTree(root);
    }

    private Node next(int depth) throws FormulaParseException {
        if (cursor >= prefix.length()) {
            throw new FormulaParseException("Unexpected end of formula", prefix, cursor);
        }
        if (depth > MAXIMUM_NESTING) {
            throw new FormulaParseException("Formula nesting exceeds " + MAXIMUM_NESTING + " levels", prefix, cursor);
        }
        int position = cursor;
        char token = prefix.charAt(cursor++);

        BinaryType type = BinaryType.fromSymbol(token);
        if (type != null) {
            Node left = next(depth + 1);
            Node right = next(depth + 1);
            return new BinaryOperation(type, left, right);
        }
        if (token == '~') {
            return new Not(next(depth + 1));
        }
        if (InfixToPrefixConverter.isVariable(token)) {
            return new Variable(token);
        }
        throw new FormulaParseException("Unexpected character '" + token + "'", prefix, position);
    }
}
