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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class ExpressionTreeTest {
    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"p", "~p", "(p>q)", "(~(p>q))", "((p+q)*(r>s))", "(~~p)", "((~p)+(~(q*r)))"})
    public void testPrintParseRoundTrip(String infix) throws FormulaParseException {
        ExpressionTree tree = Formulas.parse(infix);
        ExpressionTree reparsed = Formulas.parse(tree.toString());
        assertThat(reparsed, is(tree));
        assertThat(reparsed.toString(), is(tree.toString()));
    }

    @Test
    public void testPrinting() throws FormulaParseException {
        assertThat(Formulas.parse("((~p)+(~(q*r)))").toString(), is("(~p+~(q*r))"));
        assertThat(Formulas.parse("(p>q)").toString(), is("(p>q)"));
    }

    @Test
    public void testHeightAndSize() throws FormulaParseException {
        assertThat(Formulas.parse("p").height(), is(1));
        assertThat(Formulas.parse("(~p)").height(), is(2));
        assertThat(Formulas.parse("((p+q)*(~r))").height(), is(3));
        assertThat(Formulas.parse("((p+q)*(~r))").size(), is(6));
    }

    @Test
    public void testVariablesSorted() throws FormulaParseException {
        assertThat(Formulas.parse("((r+q)*(p>(~q)))").variables(), contains('p', 'q', 'r'));
    }

    @Test
    public void testCopyIsDeep() throws FormulaParseException {
        ExpressionTree tree = Formulas.parse("((p+q)*(~r))");
        ExpressionTree copy = tree.copy();
        assertThat(copy, is(tree));
        assertThat(copy.root(), not(sameInstance(tree.root())));
        assertThat(TreeChecks.isDisjoint(tree, copy), is(true));
    }

    @Test
    public void testFactoriesDoNotShareOperands() {
        ExpressionTree p = ExpressionTree.variable('p');
        ExpressionTree conjunction = ExpressionTree.and(p, p);
        assertThat(TreeChecks.isProperTree(conjunction), is(true));
        assertThat(TreeChecks.isDisjoint(conjunction, p), is(true));
    }

    @Test
    public void testInvalidVariable() {
        assertThrows(IllegalArgumentException.class, () -> ExpressionTree.variable('1'));
    }
}
