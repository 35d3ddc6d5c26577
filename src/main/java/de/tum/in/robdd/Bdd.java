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

import java.util.Map;

/**
 * A store of reduced ordered binary decision diagrams over one fixed {@link VariableOrdering},
 * together with the operations creating diagrams in it.
 *
 * <p>Every node is created through {@link #makeNode(int, int, int)}, which never materializes a
 * node with equal children and never creates a second node with the same variable and children.
 * Hence, each boolean function has exactly one node per store and equivalence checks are handle
 * comparisons. Nodes are never removed.</p>
 *
 * <p>Implementations are not thread-safe unless stated otherwise, see {@link
 * BddFactory#synchronizedBdd(Bdd)}.</p>
 */
public interface Bdd extends DecisionDiagram {
    /**
     * Returns the unique leaf for {@code value}.
     */
    int makeTerminal(boolean value);

    /**
     * Returns the node testing {@code variable} with the given children. If both children are equal
     * the child itself is returned and if such a node already exists, it is returned instead of a
     * new one.
     *
     * @throws OrderingViolationError
     *     if {@code variable} is not smaller than the variables of both (non-leaf) children.
     * @throws NodeLimitExceededException
     *     if a new node would exceed the configured limit.
     */
    int makeNode(int variable, int low, int high);

    /**
     * Returns the node representing the variable with given index in the ordering.
     */
    int variableNode(int variable);

    /**
     * Returns the node representing the variable with given name.
     *
     * @throws UndefinedVariableException if there is no such variable.
     */
    default int variableNode(String name) {
        return variableNode(ordering().indexOf(name));
    }

    /**
     * Combines the two diagrams with the given operation.
     */
    int apply(BinaryOperation operation, int node1, int node2);

    int not(int node);

    default int and(int node1, int node2) {
        return apply(BinaryOperation.AND, node1, node2);
    }

    default int or(int node1, int node2) {
        return apply(BinaryOperation.OR, node1, node2);
    }

    default int xor(int node1, int node2) {
        return apply(BinaryOperation.XOR, node1, node2);
    }

    default int implication(int node1, int node2) {
        return apply(BinaryOperation.IMPLIES, node1, node2);
    }

    default int equivalence(int node1, int node2) {
        return apply(BinaryOperation.IFF, node1, node2);
    }

    default int conjunction(int... nodes) {
        int result = trueNode();
        for (int node : nodes) {
            result = and(result, node);
        }
        return result;
    }

    default int disjunction(int... nodes) {
        int result = falseNode();
        for (int node : nodes) {
            result = or(result, node);
        }
        return result;
    }

    /**
     * Builds the diagram of {@code expression} with the configured default strategy.
     *
     * @throws UndefinedVariableException if the expression mentions a variable outside the ordering.
     */
    int build(Expression expression);

    int build(Expression expression, BuildStrategy strategy);

    /**
     * Checks whether the given {@code node} evaluates to {@code true} under the assignment, indexed
     * by the position of the variables in the ordering.
     *
     * @throws MissingAssignmentException if a variable of the node lies outside of the array.
     */
    boolean evaluate(int node, boolean[] assignment);

    /**
     * Checks whether the given {@code node} evaluates to {@code true} under the given assignment.
     * Entries for variables outside the support of {@code node} are ignored.
     *
     * @throws MissingAssignmentException if a variable of the node's support has no value.
     */
    boolean evaluate(int node, Map<String, Boolean> assignment);

    default boolean isTautology(int node) {
        return node == trueNode();
    }

    default boolean isContradiction(int node) {
        return node == falseNode();
    }

    /**
     * Performs the integrity checks of all store invariants (ordering, reducedness, uniqueness).
     *
     * @return True. This way, check can easily be called by an {@code assert} statement.
     * @throws IllegalStateException if an invariant is violated.
     */
    boolean check();
}
