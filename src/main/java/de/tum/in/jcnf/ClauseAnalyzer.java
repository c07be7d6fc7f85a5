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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Splits CNF trees into clauses and counts the tautological ones.
 */
public final class ClauseAnalyzer {
    private static final Logger logger = Logger.getLogger(ClauseAnalyzer.class.getName());

    private ClauseAnalyzer() {}

    /**
     * Returns the clauses of the formula from left to right. Equal clauses are reported
     * individually.
     *
     * @throws IllegalArgumentException
     *     if the formula is not in conjunctive normal form.
     */
    public static List<Clause> clauses(ExpressionTree cnf) {
        List<Clause> clauses = new ArrayList<>();
        Deque<Node> conjuncts = new ArrayDeque<>();
        conjuncts.push(cnf.root());
        while (!conjuncts.isEmpty()) {
            Node node = conjuncts.pop();
            if (node instanceof BinaryOperation && ((BinaryOperation) node).type() == BinaryType.AND) {
                BinaryOperation conjunction = (BinaryOperation) node;
                conjuncts.push(conjunction.right());
                conjuncts.push(conjunction.left());
            } else {
                clauses.add(clause(node));
            }
        }
        return clauses;
    }

    public static ValidityReport analyze(ExpressionTree cnf) {
        List<Clause> clauses = clauses(cnf);
        int tautological = (int) clauses.stream().filter(Clause::isTautology).count();
        logger.log(Level.FINE, "Found {0} tautological out of {1} clauses",
                new Object[] {tautological, clauses.size()});
        return ValidityReport.of(clauses.size(), tautological);
    }

    private static Clause clause(Node disjunction) {
        List<Literal> literals = new ArrayList<>();
        Deque<Node> disjuncts = new ArrayDeque<>();
        disjuncts.push(disjunction);
        while (!disjuncts.isEmpty()) {
            Node node = disjuncts.pop();
            if (node instanceof Variable) {
                literals.add(Literal.positive(((Variable) node).identifier()));
            } else if (node.isLiteral()) {
                literals.add(Literal.negative(((Variable) ((Not) node).operand()).identifier()));
            } else if (node instanceof BinaryOperation && ((BinaryOperation) node).type() == BinaryType.OR) {
                BinaryOperation binary = (BinaryOperation) node;
                disjuncts.push(binary.right());
                disjuncts.push(binary.left());
            } else {
                throw new IllegalArgumentException(String.format(
                        "Formula is not in conjunctive normal form, clause %s contains %s", disjunction, node));
            }
        }
        return new Clause(literals);
    }
}
