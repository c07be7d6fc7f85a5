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

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public abstract class CnfConfiguration {
    public static final int DEFAULT_MAXIMUM_NODE_COUNT = 1 << 20;
    public static final int DEFAULT_MAXIMUM_RECURSION_DEPTH = 4096;

    /** Upper bound on the nodes the distribution pass may allocate for one formula. */
    @Value.Default
    public int maximumNodeCount() {
        return DEFAULT_MAXIMUM_NODE_COUNT;
    }

    @Value.Default
    public int maximumRecursionDepth() {
        return DEFAULT_MAXIMUM_RECURSION_DEPTH;
    }

    @Value.Check
    protected void check() {
        Util.checkState(maximumNodeCount() > 0, "Node count limit must be positive");
        Util.checkState(maximumRecursionDepth() > 0, "Recursion depth limit must be positive");
    }
}
