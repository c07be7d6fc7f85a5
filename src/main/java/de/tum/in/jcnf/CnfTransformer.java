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
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts formulas into conjunctive normal form in three passes: implication elimination,
 * negation normal form and distribution of disjunctions over conjunctions.
 *
 * <p>Every pass builds a new tree and leaves its input untouched. Subtrees that end up in more
 * than one place of the result are copied. Distribution may grow the formula exponentially;
 * each call is bounded by the limits of the {@link CnfConfiguration}.
 */
public final class CnfTransformer {
    private static final Logger logger = Logger.getLogger(CnfTransformer.class.getName());

    private final CnfConfiguration configuration;

    private CnfTransformer(CnfConfiguration configuration) {
        this.configuration = configuration;
    }

    public static CnfTransformer create() {
        return create(ImmutableCnfConfiguration.builder().build());
    }

    public static CnfTransformer create(CnfConfiguration configuration) {
        return new CnfTransformer(configuration);
    }

    /** Applies all three passes. */
    public ExpressionTree toConjunctiveNormalForm(ExpressionTree tree) throws FormulaTooLargeException {
        ExpressionTree result = distribute(negationNormalForm(eliminateImplications(tree)));
        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "Converted formula with {0} nodes into CNF with {1} nodes",
                    new Object[] {tree.size(), result.size()});
        }
        return result;
    }

    /** Replaces every {@code A > B} by {@code ~A + B}. */
    public ExpressionTree eliminateImplications(ExpressionTree tree) throws FormulaTooLargeException {
        return new ExpressionTree(eliminateImplications(tree.root(), 1));
    }

    /**
     * Pushes negations down to the variables using De Morgan's laws and removes double negations.
     *
     * @throws IllegalArgumentException
     *     if the formula still contains implications.
     */
    public ExpressionTree negationNormalForm(ExpressionTree tree) throws FormulaTooLargeException {
        return new ExpressionTree(negationNormalForm(tree.root(), false, 1));
    }

    /**
     * Distributes disjunctions over conjunctions until no conjunction occurs below a disjunction.
     *
     * @throws IllegalArgumentException
     *     if the formula is not in negation normal form.
     * @throws FormulaTooLargeException
     *     if the result would exceed the configured node count or recursion depth.
     */
    public ExpressionTree distribute(ExpressionTree tree) throws FormulaTooLargeException {
        Budget budget = new Budget();
        Node root = conjunctiveNormalForm(tree.root(), budget, 1);
        logger.log(Level.FINER, "Distribution allocated {0} nodes", budget.allocated);
        return new ExpressionTree(root);
    }

    private void checkDepth(int depth) throws FormulaTooLargeException {
        if (depth > configuration.maximumRecursionDepth()) {
            throw new FormulaTooLargeException(String.format(
                    "Formula nesting exceeds the recursion limit of %d", configuration.maximumRecursionDepth()));
        }
    }

    private Node eliminateImplications(Node node, int depth) throws FormulaTooLargeException {
        checkDepth(depth);
        if (node instanceof Variable) {
            return node.copy();
        }
        if (node instanceof Not) {
            return new Not(eliminateImplications(((Not) node).operand(), depth + 1));
        }
        BinaryOperation binary = (BinaryOperation) node;
        Node left = eliminateImplications(binary.left(), depth + 1);
        Node right = eliminateImplications(binary.right(), depth + 1);
        if (binary.type() == BinaryType.IMPLIES) {
            return new BinaryOperation(BinaryType.OR, new Not(left), right);
        }
        return new BinaryOperation(binary.type(), left, right);
    }

    // Computes the NNF of node, or of ~node if negated is set
    private Node negationNormalForm(Node node, boolean negated, int depth) throws FormulaTooLargeException {
        checkDepth(depth);
        if (node instanceof Variable) {
            return negated ? new Not(node.copy()) : node.copy();
        }
        if (node instanceof Not) {
            return negationNormalForm(((Not) node).operand(), !negated, depth + 1);
        }
        BinaryOperation binary = (BinaryOperation) node;
        Util.checkArgument(binary.type() != BinaryType.IMPLIES,
                "Formula contains implication %s, eliminate implications first", binary);
        BinaryType type = binary.type();
        if (negated) {
            type = type == BinaryType.AND ? BinaryType.OR : BinaryType.AND;
        }
        return new BinaryOperation(type,
                negationNormalForm(binary.left(), negated, depth + 1),
                negationNormalForm(binary.right(), negated, depth + 1));
    }

    private Node conjunctiveNormalForm(Node node, Budget budget, int depth) throws FormulaTooLargeException {
        checkDepth(depth);
        if (node.isLiteral()) {
            budget.allocate(node.size());
            return node.copy();
        }
        Util.checkArgument(node instanceof BinaryOperation, "Formula is not in negation normal form: %s", node);
        BinaryOperation binary = (BinaryOperation) node;
        Node left = conjunctiveNormalForm(binary.left(), budget, depth + 1);
        Node right = conjunctiveNormalForm(binary.right(), budget, depth + 1);
        switch (binary.type()) {
            case AND:
                budget.allocate(1);
                return new BinaryOperation(BinaryType.AND, left, right);
            case OR:
                return distribute(left, right, budget, depth + 1);
            default:
                throw new IllegalArgumentException("Formula is not in negation normal form: " + node);
        }
    }

    // Both operands are in CNF and owned by the caller; each is placed into the result at most
    // once, every further occurrence is a copy.
    private Node distribute(Node left, Node right, Budget budget, int depth) throws FormulaTooLargeException {
        checkDepth(depth);
        if (isConjunction(left)) {
            BinaryOperation conjunction = (BinaryOperation) left;
            budget.allocate(right.size() + 1);
            Node first = distribute(conjunction.left(), right, budget, depth + 1);
            Node second = distribute(conjunction.right(), right.copy(), budget, depth + 1);
            return new BinaryOperation(BinaryType.AND, first, second);
        }
        if (isConjunction(right)) {
            BinaryOperation conjunction = (BinaryOperation) right;
            budget.allocate(left.size() + 1);
            Node first = distribute(left, conjunction.left(), budget, depth + 1);
            Node second = distribute(left.copy(), conjunction.right(), budget, depth + 1);
            return new BinaryOperation(BinaryType.AND, first, second);
        }
        budget.allocate(1);
        return new BinaryOperation(BinaryType.OR, left, right);
    }

    private static boolean isConjunction(Node node) {
        return node instanceof BinaryOperation && ((BinaryOperation) node).type() == BinaryType.AND;
    }

    private final class Budget {
        long allocated = 0;

        void allocate(int nodes) throws FormulaTooLargeException {
            allocated += nodes;
            if (allocated > configuration.maximumNodeCount()) {
                throw new FormulaTooLargeException(String.format(
                        "Distribution exceeds the limit of %d nodes", configuration.maximumNodeCount()));
            }
        }
    }
}
