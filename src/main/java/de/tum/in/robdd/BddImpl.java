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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.IntConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/* Implementation notes:
 * - Variable numbers strictly increase while descending the tree of a particular node. Leaves
 *   behave as if they had variable numberOfVariables() (see rank).
 * - Each apply / negation run owns a fresh ApplyCache, results are not shared between runs.
 */
@SuppressWarnings({
    "PMD.AvoidReassigningParameters",
    "ReassignedVariable",
    "AssignmentToMethodParameter"
})
final class BddImpl extends NodeTable implements Bdd {
    private static final Logger logger = Logger.getLogger(BddImpl.class.getName());

    private static final int TRUE_NODE = -1;
    private static final int FALSE_NODE = -2;

    private final VariableOrdering ordering;
    private final BuildStrategy defaultStrategy;
    private final boolean shortCircuit;

    /* Low and high successors of each node */
    private int[] tree;

    private int hashLookupLow = NOT_A_NODE;
    private int hashLookupHigh = NOT_A_NODE;

    // Statistics
    private long applyCount = 0;
    private long negationCount = 0;
    private long cacheLookups = 0;
    private long cacheHits = 0;
    private long cacheEntries = 0;

    BddImpl(VariableOrdering ordering, BddConfiguration configuration) {
        super(configuration.initialSize(), configuration.growthFactor(), configuration.maximumNodeCount());
        this.ordering = checkNotNull(ordering);
        this.defaultStrategy = configuration.buildStrategy();
        this.shortCircuit = configuration.shortCircuit();
        tree = new int[2 * tableSize()];
    }

    // Nodes

    @Override
    protected boolean checkLookupChildrenMatch(int lookup) {
        int[] tree = this.tree;
        return tree[lookup * 2] == hashLookupLow && tree[lookup * 2 + 1] == hashLookupHigh;
    }

    @Override
    public int makeNode(int variable, int low, int high) {
        checkNode(low);
        checkNode(high);
        if (variable < 0 || variable >= numberOfVariables()) {
            throw new OrderingViolationError(
                    String.format("Variable %d outside of ordering %s", variable, ordering));
        }
        if (variable >= rank(low) || variable >= rank(high)) {
            throw new OrderingViolationError(String.format(
                    "Node on variable %d cannot have children on variables %d and %d",
                    variable, variableOf(low), variableOf(high)));
        }
        return makeNodeUnchecked(variable, low, high);
    }

    private int makeNodeUnchecked(int variable, int low, int high) {
        assert 0 <= variable && variable < numberOfVariables();
        assert variable < rank(low) && variable < rank(high);

        if (low == high) {
            return low;
        }

        hashLookupLow = low;
        hashLookupHigh = high;
        int node = findOrCreateNode(variable, hashCode(variable, low, high));

        this.tree[2 * node] = low;
        this.tree[2 * node + 1] = high;
        assert hashCode(variable, low, high) == hashCode(node, variable);
        return node;
    }

    @Override
    public int makeTerminal(boolean value) {
        return value ? TRUE_NODE : FALSE_NODE;
    }

    @Override
    public int low(int node) {
        checkInternal(node);
        return tree[2 * node];
    }

    @Override
    public int high(int node) {
        checkInternal(node);
        return tree[2 * node + 1];
    }

    private void checkInternal(int node) {
        if (!isNodeValid(node)) {
            throw new IllegalArgumentException("Node " + node + " is not an internal node of " + this);
        }
    }

    @Override
    public boolean isLeaf(int node) {
        return node == TRUE_NODE || node == FALSE_NODE;
    }

    /* Position of the node's variable in the ordering, leaves are below every variable. */
    private int rank(int node) {
        return isLeaf(node) ? numberOfVariables() : variableUnsafe(node);
    }

    // Variables and base nodes

    @Override
    public int trueNode() {
        return TRUE_NODE;
    }

    @Override
    public int falseNode() {
        return FALSE_NODE;
    }

    @Override
    public VariableOrdering ordering() {
        return ordering;
    }

    @Override
    public int numberOfVariables() {
        return ordering.size();
    }

    @Override
    public int variableNode(int variable) {
        if (variable < 0 || variable >= numberOfVariables()) {
            throw new IllegalArgumentException(
                    String.format("Variable %d outside of ordering %s", variable, ordering));
        }
        return makeNodeUnchecked(variable, FALSE_NODE, TRUE_NODE);
    }

    // Reading

    @Override
    public boolean evaluate(int node, boolean[] assignment) {
        BitSet support = support(node);
        if (support.length() > assignment.length) {
            Set<String> missing = support.stream()
                    .filter(variable -> variable >= assignment.length)
                    .mapToObj(ordering::name)
                    .collect(ImmutableSet.toImmutableSet());
            throw new MissingAssignmentException(node, missing);
        }
        int current = node;
        while (!isLeaf(current)) {
            current = assignment[variableUnsafe(current)] ? tree[2 * current + 1] : tree[2 * current];
        }
        return current == TRUE_NODE;
    }

    @Override
    public boolean evaluate(int node, Map<String, Boolean> assignment) {
        Set<String> missing = Sets.difference(supportNames(node), Sets.filter(assignment.keySet(),
                variable -> assignment.get(variable) != null));
        if (!missing.isEmpty()) {
            throw new MissingAssignmentException(node, missing);
        }
        int current = node;
        while (!isLeaf(current)) {
            boolean value = assignment.get(ordering.name(variableUnsafe(current)));
            current = value ? tree[2 * current + 1] : tree[2 * current];
        }
        return current == TRUE_NODE;
    }

    @Override
    public void forEachNode(int node, NodeVisitor visitor) {
        forEachNodeBelowOnce(node, (current, variable) ->
                visitor.visit(current, variable, tree[2 * current], tree[2 * current + 1]));
    }

    // Building

    @Override
    public int build(Expression expression) {
        return build(expression, defaultStrategy);
    }

    @Override
    public int build(Expression expression, BuildStrategy strategy) {
        return new ExpressionBuilder(this).build(checkNotNull(expression), checkNotNull(strategy));
    }

    // Apply

    @Override
    public int apply(BinaryOperation operation, int node1, int node2) {
        checkNotNull(operation);
        checkNode(node1);
        checkNode(node2);
        ApplyCache cache = new ApplyCache();
        int result = applyRecursive(operation, ApplyCache.operationId(operation), node1, node2, cache);
        applyCount += 1;
        recordCacheStatistics(cache);
        logger.log(Level.FINER, "{0}({1}, {2}) = {3}, {4}", new Object[] {operation, node1, node2, result, cache});
        return result;
    }

    private int applyRecursive(BinaryOperation operation, byte operationId, int node1, int node2, ApplyCache cache) {
        if (isLeaf(node1) && isLeaf(node2)) {
            return makeTerminal(operation.apply(node1 == TRUE_NODE, node2 == TRUE_NODE));
        }
        if (shortCircuit) {
            int result = terminalCase(operation, node1, node2);
            if (result != NOT_A_NODE) {
                return result;
            }
        }
        if (operation.isCommutative() && node2 < node1) {
            int nodeSwap = node1;
            node1 = node2;
            node2 = nodeSwap;
        }

        if (cache.lookup(operationId, node1, node2)) {
            return cache.lookupResult();
        }

        int node1var = rank(node1);
        int node2var = rank(node2);
        int variable = Math.min(node1var, node2var);

        int low1 = node1var == variable ? tree[2 * node1] : node1;
        int high1 = node1var == variable ? tree[2 * node1 + 1] : node1;
        int low2 = node2var == variable ? tree[2 * node2] : node2;
        int high2 = node2var == variable ? tree[2 * node2 + 1] : node2;

        int lowNode = applyRecursive(operation, operationId, low1, low2, cache);
        int highNode = applyRecursive(operation, operationId, high1, high2, cache);
        int resultNode = makeNodeUnchecked(variable, lowNode, highNode);
        cache.put(operationId, node1, node2, resultNode);
        return resultNode;
    }

    /* Results determined by a terminal operand alone, or NOT_A_NODE. */
    private static int terminalCase(BinaryOperation operation, int node1, int node2) {
        switch (operation) {
            case AND:
                if (node1 == FALSE_NODE || node2 == FALSE_NODE) {
                    return FALSE_NODE;
                }
                if (node1 == TRUE_NODE || node1 == node2) {
                    return node2;
                }
                return node2 == TRUE_NODE ? node1 : NOT_A_NODE;
            case OR:
                if (node1 == TRUE_NODE || node2 == TRUE_NODE) {
                    return TRUE_NODE;
                }
                if (node1 == FALSE_NODE || node1 == node2) {
                    return node2;
                }
                return node2 == FALSE_NODE ? node1 : NOT_A_NODE;
            case XOR:
                if (node1 == node2) {
                    return FALSE_NODE;
                }
                if (node1 == FALSE_NODE) {
                    return node2;
                }
                return node2 == FALSE_NODE ? node1 : NOT_A_NODE;
            case IMPLIES:
                if (node1 == FALSE_NODE || node2 == TRUE_NODE || node1 == node2) {
                    return TRUE_NODE;
                }
                return node1 == TRUE_NODE ? node2 : NOT_A_NODE;
            case IFF:
                if (node1 == node2) {
                    return TRUE_NODE;
                }
                if (node1 == TRUE_NODE) {
                    return node2;
                }
                return node2 == TRUE_NODE ? node1 : NOT_A_NODE;
            default:
                throw new AssertionError(operation);
        }
    }

    @Override
    public int not(int node) {
        checkNode(node);
        ApplyCache cache = new ApplyCache();
        int result = notRecursive(node, cache);
        negationCount += 1;
        recordCacheStatistics(cache);
        return result;
    }

    private int notRecursive(int node, ApplyCache cache) {
        if (node == FALSE_NODE) {
            return TRUE_NODE;
        }
        if (node == TRUE_NODE) {
            return FALSE_NODE;
        }
        if (cache.lookupNot(node)) {
            return cache.lookupResult();
        }

        int lowNode = notRecursive(tree[2 * node], cache);
        int highNode = notRecursive(tree[2 * node + 1], cache);
        int resultNode = makeNodeUnchecked(variableUnsafe(node), lowNode, highNode);
        cache.putNot(node, resultNode);
        return resultNode;
    }

    private void recordCacheStatistics(ApplyCache cache) {
        cacheLookups += cache.lookups();
        cacheHits += cache.hits();
        cacheEntries += cache.size();
    }

    // Statistics and Formatting

    @Override
    public boolean check() {
        return super.check();
    }

    @Override
    public String toString() {
        return String.format("BDD@%d(%d)", numberOfVariables(), System.identityHashCode(this));
    }

    @Override
    public String statistics() {
        return getStatistics() + '\n' + String.format(
                "Apply statistics:%n"
                        + "%1$d apply runs, %2$d negation runs%n"
                        + "Memo: %3$d lookups, %4$d hits (%5$.2f), %6$d entries",
                applyCount,
                negationCount,
                cacheLookups,
                cacheHits,
                cacheLookups == 0 ? 0.0d : cacheHits * 1.0 / cacheLookups,
                cacheEntries);
    }

    @Override
    protected void onTableResize(int newSize) {
        tree = Arrays.copyOf(tree, newSize * 2);
    }

    @Override
    protected int hashCode(int node, int variable) {
        return hashCode(variable, tree[2 * node], tree[2 * node + 1]);
    }

    private static int hashCode(int variable, int low, int high) {
        return HashUtil.hash(variable, low, high);
    }

    @Override
    protected void forEachChild(int node, IntConsumer action) {
        action.accept(tree[2 * node]);
        action.accept(tree[2 * node + 1]);
    }

    @Override
    protected Node node(int node) {
        return new BinaryNode(variableUnsafe(node), tree[2 * node], tree[2 * node + 1]);
    }

    private static final class BinaryNode implements NodeTable.Node {
        final int var;
        final int low;
        final int high;

        BinaryNode(int var, int low, int high) {
            this.var = var;
            this.low = low;
            this.high = high;
        }

        @Override
        public boolean equals(@Nullable Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof BinaryNode)) {
                return false;
            }
            BinaryNode node = (BinaryNode) o;
            return var == node.var && low == node.low && high == node.high;
        }

        @Override
        public int hashCode() {
            return Objects.hash(var, low, high);
        }

        @Override
        public String childrenString() {
            return String.format("%5d %5d", low, high);
        }

        @Override
        public String toString() {
            return String.format("%d: %d %d", var, low, high);
        }
    }
}
