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

/**
 * Structural predicates for the vocabularies produced by the passes of {@link CnfTransformer}.
 */
public final class NormalForms {
    private NormalForms() {}

    public static boolean isImplicationFree(ExpressionTree tree) {
        return isImplicationFree(tree.root());
    }

    /** Implication free, and every negation sits directly above a variable. */
    public static boolean isNegationNormalForm(ExpressionTree tree) {
        return isNegationNormalForm(tree.root());
    }

    /** A conjunction of disjunctions of literals; no conjunction occurs below a disjunction. */
    public static boolean isConjunctiveNormalForm(ExpressionTree tree) {
        return isConjunctiveNormalForm(tree.root());
    }

    static boolean isImplicationFree(Node node) {
        if (node instanceof Not) {
            return isImplicationFree(((Not) node).operand());
        }
        if (node instanceof BinaryOperation) {
            BinaryOperation binary = (BinaryOperation) node;
            return binary.type() != BinaryType.IMPLIES
                    && isImplicationFree(binary.left())
                    && isImplicationFree(binary.right());
        }
        return true;
    }

    static boolean isNegationNormalForm(Node node) {
        if (node instanceof Not) {
            return node.isLiteral();
        }
        if (node instanceof BinaryOperation) {
            BinaryOperation binary = (BinaryOperation) node;
            return binary.type() != BinaryType.IMPLIES
                    && isNegationNormalForm(binary.left())
                    && isNegationNormalForm(binary.right());
        }
        return true;
    }

    static boolean isConjunctiveNormalForm(Node node) {
        if (node instanceof BinaryOperation && ((BinaryOperation) node).type() == BinaryType.AND) {
            BinaryOperation binary = (BinaryOperation) node;
            return isConjunctiveNormalForm(binary.left()) && isConjunctiveNormalForm(binary.right());
        }
        return isClause(node);
    }

    static boolean isClause(Node node) {
        if (node.isLiteral()) {
            return true;
        }
        if (node instanceof BinaryOperation && ((BinaryOperation) node).type() == BinaryType.OR) {
            BinaryOperation binary = (BinaryOperation) node;
            return isClause(binary.left()) && isClause(binary.right());
        }
        return false;
    }
}
