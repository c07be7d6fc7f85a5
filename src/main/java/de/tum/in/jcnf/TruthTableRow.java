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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row of a truth table: an assignment of all variables of a formula and the resulting value.
 */
public final class TruthTableRow {
    private final Map<Character, Boolean> assignment;
    private final boolean value;

    TruthTableRow(Map<Character, Boolean> assignment, boolean value) {
        this.assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
        this.value = value;
    }

    /** The assignment, iterating variables in sorted order. */
    public Map<Character, Boolean> assignment() {
        return assignment;
    }

    /** The assignment as a string of {@code 0} and {@code 1}, one digit per sorted variable. */
    public String bits() {
        StringBuilder builder = new StringBuilder(assignment.size());
        assignment.values().forEach(bit -> builder.append(bit ? '1' : '0'));
        return builder.toString();
    }

    public boolean value() {
        return value;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof TruthTableRow)) {
            return false;
        }
        TruthTableRow that = (TruthTableRow) object;
        return value == that.value && assignment.equals(that.assignment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(assignment, value);
    }

    @Override
    public String toString() {
        return bits() + " " + (value ? 1 : 0);
    }
}
