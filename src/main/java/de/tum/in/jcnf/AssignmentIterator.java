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

import java.util.BitSet;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterates all subsets of {@code {0, ..., size - 1}} in binary counting order, with index 0 as
 * the most significant bit. The returned bit set is reused between calls.
 */
final class AssignmentIterator implements Iterator<BitSet> {
    private final int size;
    private final BitSet iteration;
    private int numSetBits = -1;

    AssignmentIterator(int size) {
        Util.checkArgument(size >= 0, "Negative size %d", size);
        this.size = size;
        this.iteration = new BitSet(size);
    }

    @Override
    public boolean hasNext() {
        return numSetBits < size;
    }

    @Override
    public BitSet next() {
        if (numSetBits == -1) {
            numSetBits = 0;
            return iteration;
        }

        if (numSetBits == size) {
            throw new NoSuchElementException("No next element");
        }

        for (int index = size - 1; index >= 0; index--) {
            if (iteration.get(index)) {
                iteration.clear(index);
                numSetBits -= 1;
            } else {
                iteration.set(index);
                numSetBits += 1;
                break;
            }
        }

        return iteration;
    }
}
