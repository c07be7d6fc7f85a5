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
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class CnfTransformerTest {
    private final CnfTransformer transformer = CnfTransformer.create();

    private static ExpressionTree disjunctionOfConjunctions(int pairs) {
        ExpressionTree result = null;
        for (int i = 0; i < pairs; i++) {
            ExpressionTree pair = ExpressionTree.and(
                    ExpressionTree.variable((char) ('a' + i)), ExpressionTree.variable((char) ('A' + i)));
            result = result == null ? pair : ExpressionTree.or(result, pair);
        }
        return result;
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource({
        "(p>q), (~p+q)",
        "((p>q)>r), (~(~p+q)+r)",
        "(~(p>(q*r))), ~(~p+(q*r))",
        "((p+q)*r), ((p+q)*r)"
    })
    public void testEliminateImplications(String input, String expected)
            throws FormulaParseException, FormulaTooLargeException {
        ExpressionTree result = transformer.eliminateImplications(Formulas.parse(input));
        assertThat(result.toString(), is(expected));
        assertThat(NormalForms.isImplicationFree(result), is(true));
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource({
        "(~(p+q)), (~p*~q)",
        "(~(p*q)), (~p+~q)",
        "(~~p), p",
        "(~(~(p+(~q)))), (p+~q)",
        "(~((p*q)+(~r))), ((~p+~q)*r)",
        "(~p), ~p"
    })
    public void testNegationNormalForm(String input, String expected)
            throws FormulaParseException, FormulaTooLargeException {
        ExpressionTree result = transformer.negationNormalForm(Formulas.parse(input));
        assertThat(result.toString(), is(expected));
        assertThat(NormalForms.isNegationNormalForm(result), is(true));
    }

    @Test
    public void testNegationNormalFormRejectsImplication() throws FormulaParseException {
        ExpressionTree tree = Formulas.parse("(~(p>q))");
        assertThrows(IllegalArgumentException.class, () -> transformer.negationNormalForm(tree));
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource({
        "(p+(q*r)), ((p+q)*(p+r))",
        "((p*q)+r), ((p+r)*(q+r))",
        "((p*q)+(r*s)), (((p+r)*(p+s))*((q+r)*(q+s)))",
        "(p+(~q)), (p+~q)",
        "((p+q)*(r+s)), ((p+q)*(r+s))",
        "(p+(q+(r*s))), ((p+(q+r))*(p+(q+s)))"
    })
    public void testDistribute(String input, String expected)
            throws FormulaParseException, FormulaTooLargeException {
        ExpressionTree result = transformer.distribute(Formulas.parse(input));
        assertThat(result.toString(), is(expected));
        assertThat(NormalForms.isConjunctiveNormalForm(result), is(true));
    }

    @Test
    public void testDistributeRejectsNegatedConjunction() throws FormulaParseException {
        ExpressionTree tree = Formulas.parse("(p+(~(q*r)))");
        assertThrows(IllegalArgumentException.class, () -> transformer.distribute(tree));
    }

    @Test
    public void testFullConversion() throws FormulaParseException, FormulaTooLargeException {
        ExpressionTree tree = Formulas.parse("(p>(q*r))");
        ExpressionTree original = tree.copy();
        ExpressionTree cnf = transformer.toConjunctiveNormalForm(tree);
        assertThat(cnf.toString(), is("((~p+q)*(~p+r))"));
        assertThat(tree, is(original));
        assertThat(TreeChecks.isDisjoint(tree, cnf), is(true));
    }

    @Test
    public void testNodeLimit() {
        ExpressionTree tree = disjunctionOfConjunctions(8);
        CnfTransformer limited = CnfTransformer.create(
                ImmutableCnfConfiguration.builder().maximumNodeCount(1_000).build());
        assertThrows(FormulaTooLargeException.class, () -> limited.toConjunctiveNormalForm(tree));
    }

    @Test
    public void testExponentialClauseCount() throws FormulaTooLargeException {
        ExpressionTree cnf = transformer.toConjunctiveNormalForm(disjunctionOfConjunctions(8));
        assertThat(ClauseAnalyzer.clauses(cnf).size(), is(256));
        assertThat(TreeChecks.isProperTree(cnf), is(true));
    }

    @Test
    public void testRecursionLimit() throws FormulaParseException, FormulaTooLargeException {
        CnfTransformer limited = CnfTransformer.create(
                ImmutableCnfConfiguration.builder().maximumRecursionDepth(3).build());
        ExpressionTree shallow = Formulas.parse("(p>q)");
        ExpressionTree deep = Formulas.parse("(~(~(~(~p))))");
        assertThrows(FormulaTooLargeException.class, () -> limited.eliminateImplications(deep));
        assertThrows(FormulaTooLargeException.class, () -> limited.negationNormalForm(deep));
        assertThat(NormalForms.isImplicationFree(limited.eliminateImplications(shallow)), is(true));
    }

    @Test
    public void testInvalidConfiguration() {
        assertThrows(IllegalStateException.class,
                () -> ImmutableCnfConfiguration.builder().maximumNodeCount(0).build());
    }
}
