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

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * A disjunction of literals.
 */
public final class Clause {
    private final Set<Literal> literals;

    public Clause(Collection<Literal> literals) {
        Util.checkArgument(!literals.isEmpty(), "Empty clause");
        this.literals = Collections.unmodifiableSet(new TreeSet<>(literals));
    }

    /** The distinct literals in variable order. */
    public Set<Literal> literals() {
        return literals;
    }

    /** Whether some variable occurs both positive and negated in this clause. */
    public boolean isTautology() {
        for (Literal literal : literals) {
            if (!literal.isNegated() && literals.contains(literal.negate())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Clause)) {
            return false;
        }
        return literals.equals(((Clause) object).literals);
    }

    @Override
    public int hashCode() {
        return literals.hashCode();
    }

    @Override
    public String toString() {
        return literals.stream().map(Literal::toString).collect(Collectors.joining("+", "(", ")"));
    }
}
