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
 * Clause counts of a CNF formula. The formula is called valid if every clause is a tautology.
 */
public final class ValidityReport {
    private final int clauseCount;
    private final int tautologicalClauseCount;

    private ValidityReport(int clauseCount, int tautologicalClauseCount) {
        this.clauseCount = clauseCount;
        this.tautologicalClauseCount = tautologicalClauseCount;
    }

    public static ValidityReport of(int clauseCount, int tautologicalClauseCount) {
        Util.checkArgument(0 <= tautologicalClauseCount && tautologicalClauseCount <= clauseCount,
                "Invalid counts %d of %d", tautologicalClauseCount, clauseCount);
        return new ValidityReport(clauseCount, tautologicalClauseCount);
    }

    public int clauseCount() {
        return clauseCount;
    }

    public int tautologicalClauseCount() {
        return tautologicalClauseCount;
    }

    public int nonTautologicalClauseCount() {
        return clauseCount - tautologicalClauseCount;
    }

    public boolean isValid() {
        return tautologicalClauseCount == clauseCount;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof ValidityReport)) {
            return false;
        }
        ValidityReport that = (ValidityReport) object;
        return clauseCount == that.clauseCount && tautologicalClauseCount == that.tautologicalClauseCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(clauseCount, tautologicalClauseCount);
    }

    @Override
    public String toString() {
        return String.format("%s (%d of %d clauses tautological)",
                isValid() ? "valid" : "not valid", tautologicalClauseCount, clauseCount);
    }
}
