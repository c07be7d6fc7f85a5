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

import java.util.Objects;

/**
 * A variable, possibly negated.
 */
public final class Literal implements Comparable<Literal> {
    private final char variable;
    private final boolean negated;

    public Literal(char variable, boolean negated) {
        this.variable = variable;
        this.negated = negated;
    }

    public static Literal positive(char variable) {
        return new Literal(variable, false);
    }

    public static Literal negative(char variable) {
        return new Literal(variable, true);
    }

    public char variable() {
        return variable;
    }

    public boolean isNegated() {
        return negated;
    }

    public Literal negate() {
        return new Literal(variable, !negated);
    }

    @Override
    public int compareTo(Literal other) {
        int variableComparison = Character.compare(variable, other.variable);
        return variableComparison != 0 ? variableComparison : Boolean.compare(negated, other.negated);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Literal)) {
            return false;
        }
        Literal that = (Literal) object;
        return variable == that.variable && negated == that.negated;
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, negated);
    }

    @Override
    public String toString() {
        return negated ? "~" + variable : String.valueOf(variable);
    }
}
