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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class TruthEvaluator {
    private TruthEvaluator() {}

    /**
     * Evaluates the formula under the given assignment.
     *
     * @throws UnboundVariableException
     *     if a variable of the formula has no value in {@code assignment}.
     */
    public static boolean evaluate(ExpressionTree tree, Map<Character, Boolean> assignment) {
        return tree.root().evaluate(assignment);
    }

    /**
     * Lazily enumerates all {@code 2^k} assignments of the {@code k} variables of the formula.
     * The i-th variable in sorted order supplies the i-th, most significant first, bit of a
     * counter running from {@code 0} to {@code 2^k - 1}. Every call to {@code iterator()} starts
     * a fresh enumeration.
     */
    public static Iterable<TruthTableRow> truthTable(ExpressionTree tree) {
        List<Character> variables = new ArrayList<>(tree.variables());
        return () -> new Iterator<>() {
            private final AssignmentIterator assignments = new AssignmentIterator(variables.size());
            private final Map<Character, Boolean> assignment = new LinkedHashMap<>();

            @Override
            public boolean hasNext() {
                return assignments.hasNext();
            }

            @Override
            public TruthTableRow next() {
                BitSet bits = assignments.next();
                for (int i = 0; i < variables.size(); i++) {
                    assignment.put(variables.get(i), bits.get(i));
                }
                return new TruthTableRow(assignment, evaluate(tree, assignment));
            }
        };
    }
}
