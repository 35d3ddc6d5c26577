/*
 * This file is part of ROBDD.
 * Copyright (c) 2024 The ROBDD authors.
 *
 * ROBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * ROBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with ROBDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.robdd;

import com.google.common.collect.ImmutableSet;
import java.util.BitSet;
import java.util.Set;

/**
 * Read-only view of the nodes of a decision diagram store, sufficient to export or inspect a
 * diagram. Nodes are referred to by {@code int} handles; two handles of the same store are equal
 * iff they represent the same boolean function.
 */
public interface DecisionDiagram {
    /**
     * A special reserved placeholder distinct from any possible node value. Needs to stay constant
     * throughout the life of the diagram.
     *
     * @return A placeholder value
     */
    int placeholder();

    int trueNode();

    int falseNode();

    /**
     * Determines whether the given {@code node} represents a constant.
     *
     * @param node The node to be checked.
     * @return If the {@code node} represents a constant.
     */
    boolean isLeaf(int node);

    /**
     * Gets the variable index of the given {@code node} or {@code -1} for a leaf.
     */
    int variableOf(int node);

    int low(int node);

    int high(int node);

    VariableOrdering ordering();

    default int numberOfVariables() {
        return ordering().size();
    }

    /**
     * Returns the number of internal nodes currently held by the store.
     */
    int nodeCount();

    /**
     * Returns the number of internal nodes reachable from {@code node}, the node itself included.
     */
    default int nodeCount(int node) {
        int[] count = {0};
        forEachNode(node, (current, variable, low, high) -> count[0] += 1);
        return count[0];
    }

    /**
     * Calls {@code visitor} exactly once for each internal node reachable from {@code node}, parents
     * before children.
     */
    void forEachNode(int node, NodeVisitor visitor);

    /**
     * Computes the <b>support</b> of the function represented by the given {@code node}, i.e. all
     * variables which occur in the diagram.
     *
     * @param node The node whose support should be computed.
     * @return A bit set with bit {@code i} is set iff the {@code i}-th variable is in the support.
     */
    default BitSet support(int node) {
        BitSet support = new BitSet(numberOfVariables());
        forEachNode(node, (current, variable, low, high) -> support.set(variable));
        return support;
    }

    default Set<String> supportNames(int node) {
        VariableOrdering ordering = ordering();
        ImmutableSet.Builder<String> names = ImmutableSet.builder();
        support(node).stream().forEach(variable -> names.add(ordering.name(variable)));
        return names.build();
    }

    /**
     * Generates a listing of all nodes reachable from {@code node}.
     */
    String treeToString(int node);

    /**
     * Returns a string containing some statistics about the store. The content and formatting of
     * this string may change and are only intended as human-readable output.
     */
    String statistics();

    @FunctionalInterface
    interface NodeVisitor {
        void visit(int node, int variable, int low, int high);
    }
}
