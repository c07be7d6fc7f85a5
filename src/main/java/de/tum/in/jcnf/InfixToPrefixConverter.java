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

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rewrites fully parenthesized infix formulas into prefix (Polish) notation.
 *
 * <p>The input is scanned from right to left. A {@code )} opens a group and binary operators
 * are stacked until the matching {@code (} closes the group again. Negation always follows its
 * complete operand in this order and is therefore emitted directly. Reversing the collected
 * output yields prefix order. Input that is not fully parenthesized is rejected before
 * conversion.
 */
public final class InfixToPrefixConverter {
    private InfixToPrefixConverter() {}

    static boolean isVariable(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    public static String toPrefix(String infix) throws FormulaParseException {
        validate(infix);

        // Positions into the input, resolved to their symbols when popped
        Deque<Integer> stack = new ArrayDeque<>();
        StringBuilder reversed = new StringBuilder(infix.length());

        for (int i = infix.length() - 1; i >= 0; i--) {
            char c = infix.charAt(i);
            if (Character.isWhitespace(c)) {
                continue;
            }
            if (c == ')' || ExpressionTree.BinaryType.fromSymbol(c) != null) {
                stack.push(i);
            } else if (c == '(') {
                while (true) {
                    Util.checkState(!stack.isEmpty(), "Unbalanced '(' at %d", i);
                    char symbol = infix.charAt(stack.pop());
                    if (symbol == ')') {
                        break;
                    }
                    reversed.append(symbol);
                }
            } else {
                reversed.append(c);
            }
        }

        while (!stack.isEmpty()) {
            char symbol = infix.charAt(stack.pop());
            Util.checkState(symbol != ')', "Unbalanced ')'");
            reversed.append(symbol);
        }
        return reversed.reverse().toString();
    }

    /**
     * Checks the fully parenthesized shape from left to right: operands and operators alternate,
     * {@code ~} precedes an operand, and every group as well as the top level holds at most one
     * binary operator.
     */
    private static void validate(String infix) throws FormulaParseException {
        // Positions of the open '(' and whether their group already has a binary operator
        Deque<Integer> groups = new ArrayDeque<>();
        Deque<Boolean> groupHasOperator = new ArrayDeque<>();
        boolean topLevelHasOperator = false;
        boolean expectOperand = true;
        boolean empty = true;

        for (int i = 0; i < infix.length(); i++) {
            char c = infix.charAt(i);
            if (Character.isWhitespace(c)) {
                continue;
            }
            empty = false;
            if (expectOperand) {
                if (c == '(') {
                    groups.push(i);
                    groupHasOperator.push(false);
                } else if (isVariable(c)) {
                    expectOperand = false;
                } else if (c != '~') {
                    throw unexpected(infix, i, c);
                }
            } else if (ExpressionTree.BinaryType.fromSymbol(c) != null) {
                boolean hasOperator = groups.isEmpty() ? topLevelHasOperator : groupHasOperator.peek();
                if (hasOperator) {
                    throw new FormulaParseException("Missing parentheses around operator '" + c + "'", infix, i);
                }
                if (groups.isEmpty()) {
                    topLevelHasOperator = true;
                } else {
                    groupHasOperator.pop();
                    groupHasOperator.push(true);
                }
                expectOperand = true;
            } else if (c == ')') {
                if (groups.isEmpty()) {
                    throw new FormulaParseException("Unbalanced ')'", infix, i);
                }
                groups.pop();
                groupHasOperator.pop();
            } else if (c == '(' || c == '~' || isVariable(c)) {
                throw new FormulaParseException("Missing operator before '" + c + "'", infix, i);
            } else {
                throw unexpected(infix, i, c);
            }
        }

        if (empty) {
            throw new FormulaParseException("Empty formula", infix, 0);
        }
        if (expectOperand) {
            throw new FormulaParseException("Unexpected end of formula", infix, infix.length());
        }
        if (!groups.isEmpty()) {
            throw new FormulaParseException("Unbalanced '('", infix, groups.peek());
        }
    }

    private static FormulaParseException unexpected(String infix, int position, char c) {
        return new FormulaParseException("Unexpected character '" + c + "'", infix, position);
    }
}
