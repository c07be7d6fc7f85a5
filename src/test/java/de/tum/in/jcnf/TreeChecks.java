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
import de.tum.in.jcnf.ExpressionTree.Node;
import de.tum.in.jcnf.ExpressionTree.Not;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;

final class TreeChecks {
    private TreeChecks() {}

    /** Whether no node instance is reachable twice from the root. */
    static boolean isProperTree(ExpressionTree tree) {
        return isProperTree(tree.root());
    }

    static boolean isProperTree(Node root) {
        Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Node> work = new ArrayDeque<>();
        work.push(root);
        while (!work.isEmpty()) {
            Node node = work.pop();
            if (!visited.add(node)) {
                return false;
            }
            if (node instanceof Not) {
                work.push(((Not) node).operand());
            } else if (node instanceof BinaryOperation) {
                work.push(((BinaryOperation) node).left());
                work.push(((BinaryOperation) node).right());
            }
        }
        return true;
    }

    /** Whether the two trees have no node instance in common. */
    static boolean isDisjoint(ExpressionTree first, ExpressionTree second) {
        Set<Node> nodes = Collections.newSetFromMap(new IdentityHashMap<>());
        collect(first.root(), nodes);
        Set<Node> others = Collections.newSetFromMap(new IdentityHashMap<>());
        collect(second.root(), others);
        nodes.retainAll(others);
        return nodes.isEmpty();
    }

    private static void collect(Node node, Set<Node> set) {
        set.add(node);
        if (node instanceof Not) {
            collect(((Not) node).operand(), set);
        } else if (node instanceof BinaryOperation) {
            collect(((BinaryOperation) node).left(), set);
            collect(((BinaryOperation) node).right(), set);
        }
    }
}
