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

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import javax.annotation.Nullable;

/**
 * An owned propositional formula over single-character variables.
 *
 * <p>Nodes are immutable and a tree never contains the same node instance twice. All factory
 * methods copy their operands, so combining a tree with itself still yields a proper tree.
 */
public final class ExpressionTree {
    private final Node root;

    ExpressionTree(Node root) {
        this.root = Objects.requireNonNull(root);
    }

    public static ExpressionTree variable(char identifier) {
        return new ExpressionTree(new Variable(identifier));
    }

    public static ExpressionTree not(ExpressionTree tree) {
        return new ExpressionTree(new Not(tree.root.copy()));
    }

    public static ExpressionTree and(ExpressionTree left, ExpressionTree right) {
        return binary(BinaryType.AND, left, right);
    }

    public static ExpressionTree or(ExpressionTree left, ExpressionTree right) {
        return binary(BinaryType.OR, left, right);
    }

    public static ExpressionTree implication(ExpressionTree left, ExpressionTree right) {
        return binary(BinaryType.IMPLIES, left, right);
    }

    public static ExpressionTree binary(BinaryType type, ExpressionTree left, ExpressionTree right) {
        return new ExpressionTree(new BinaryOperation(type, left.root.copy(), right.root.copy()));
    }

    public Node root() {
        return root;
    }

    /** Sorted set of all variable identifiers occurring in this formula. */
    public SortedSet<Character> variables() {
        SortedSet<Character> set = new TreeSet<>();
        root.gatherVariables(set);
        return set;
    }

    /** Number of nodes on the longest path from the root to a leaf. */
    public int height() {
        return root.height();
    }

    public int size() {
        return root.size();
    }

    public ExpressionTree copy() {
        return new ExpressionTree(root.copy());
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof ExpressionTree)) {
            return false;
        }
        ExpressionTree that = (ExpressionTree) object;
        return root.equals(that.root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    /** Fully parenthesized infix form, accepted again by {@link Formulas#parse(String)}. */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(2 * root.size());
        root.appendTo(builder);
        return builder.toString();
    }

    public enum BinaryType {
        AND('*'),
        OR('+'),
        IMPLIES('>');

        private final char symbol;

        BinaryType(char symbol) {
            this.symbol = symbol;
        }

        public char symbol() {
            return symbol;
        }

        @Nullable
        public static BinaryType fromSymbol(char symbol) {
            for (BinaryType type : values()) {
                if (type.symbol == symbol) {
                    return type;
                }
            }
            return null;
        }
    }

    public abstract static class Node {
        Node() {}

        public abstract int height();

        public abstract int size();

        /** Whether this node is a variable or a negated variable. */
        public abstract boolean isLiteral();

        abstract boolean evaluate(Map<Character, Boolean> assignment);

        abstract void gatherVariables(Set<Character> set);

        abstract Node copy();

        abstract void appendTo(StringBuilder builder);

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder();
            appendTo(builder);
            return builder.toString();
        }
    }

    public static final class Variable extends Node {
        private final char identifier;

        Variable(char identifier) {
            Util.checkArgument(Character.isLetter(identifier) && identifier < 128,
                    "Invalid variable identifier '%s'", identifier);
            this.identifier = identifier;
        }

        public char identifier() {
            return identifier;
        }

        @Override
        public int height() {
            return 1;
        }

        @Override
        public int size() {
            return 1;
        }

        @Override
        public boolean isLiteral() {
            return true;
        }

        @Override
        boolean evaluate(Map<Character, Boolean> assignment) {
            Boolean value = assignment.get(identifier);
            if (value == null) {
                throw new UnboundVariableException(identifier);
            }
            return value;
        }

        @Override
        void gatherVariables(Set<Character> set) {
            set.add(identifier);
        }

        @Override
        Node copy() {
            return new Variable(identifier);
        }

        @Override
        void appendTo(StringBuilder builder) {
            builder.append(identifier);
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Variable)) {
                return false;
            }
            return identifier == ((Variable) object).identifier;
        }

        @Override
        public int hashCode() {
            return Character.hashCode(identifier);
        }
    }

    public static final class Not extends Node {
        private final Node operand;
        private final int height;
        private final int size;

        Not(Node operand) {
            this.operand = Objects.requireNonNull(operand);
            this.height = operand.height() + 1;
            this.size = operand.size() + 1;
        }

        public Node operand() {
            return operand;
        }

        @Override
        public int height() {
            return height;
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        public boolean isLiteral() {
            return operand instanceof Variable;
        }

        @Override
        boolean evaluate(Map<Character, Boolean> assignment) {
            return !operand.evaluate(assignment);
        }

        @Override
        void gatherVariables(Set<Character> set) {
            operand.gatherVariables(set);
        }

        @Override
        Node copy() {
            return new Not(operand.copy());
        }

        @Override
        void appendTo(StringBuilder builder) {
            builder.append('~');
            operand.appendTo(builder);
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Not)) {
                return false;
            }
            return operand.equals(((Not) object).operand);
        }

        @Override
        public int hashCode() {
            return 31 * operand.hashCode() + 1;
        }
    }

    public static final class BinaryOperation extends Node {
        private final BinaryType type;
        private final Node left;
        private final Node right;
        private final int height;
        private final int size;

        BinaryOperation(BinaryType type, Node left, Node right) {
            this.type = Objects.requireNonNull(type);
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
            this.height = Math.max(left.height(), right.height()) + 1;
            this.size = left.size() + right.size() + 1;
        }

        public BinaryType type() {
            return type;
        }

        public Node left() {
            return left;
        }

        public Node right() {
            return right;
        }

        @Override
        public int height() {
            return height;
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        public boolean isLiteral() {
            return false;
        }

        @Override
        boolean evaluate(Map<Character, Boolean> assignment) {
            // Non-short-circuit so that every leaf is checked for a binding
            switch (type) {
                case AND:
                    return left.evaluate(assignment) & right.evaluate(assignment);
                case OR:
                    return left.evaluate(assignment) | right.evaluate(assignment);
                case IMPLIES:
                    return !left.evaluate(assignment) | right.evaluate(assignment);
                default:
                    throw new IllegalStateException("Unknown type " + type);
            }
        }

        @Override
        void gatherVariables(Set<Character> set) {
            left.gatherVariables(set);
            right.gatherVariables(set);
        }

        @Override
        Node copy() {
            return new BinaryOperation(type, left.copy(), right.copy());
        }

        @Override
        void appendTo(StringBuilder builder) {
            builder.append('(');
            left.appendTo(builder);
            builder.append(type.symbol());
            right.appendTo(builder);
            builder.append(')');
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof BinaryOperation)) {
                return false;
            }
            BinaryOperation that = (BinaryOperation) object;
            return type == that.type && left.equals(that.left) && right.equals(that.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, left, right);
        }
    }
}
