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

import static de.tum.in.robdd.Util.checkState;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.function.IntConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Arena of internal nodes together with the unique table guaranteeing that no two nodes share the
 * same variable and children. Nodes are allocated sequentially and never freed, hence the valid
 * nodes are exactly {@code FIRST_NODE} to {@code biggestValidNode}.
 */
public abstract class NodeTable implements DecisionDiagram {
    private static final Logger logger = Logger.getLogger(NodeTable.class.getName());

    // Use 0 as "not a node" so that freshly allocated chain arrays are empty
    protected static final int NOT_A_NODE = 0;
    protected static final int FIRST_NODE = 1;

    private static final int MINIMUM_NODE_TABLE_SIZE = MathUtil.nextPrime(1_000);
    private static final int MAXIMAL_NODE_COUNT = Integer.MAX_VALUE / 2 - 8;

    private final double growthFactor;
    private final int maximumNodeCount;

    /* Keep track of the last used node. The invariant is that a node is valid iff its index is
     * between FIRST_NODE and biggestValidNode. */
    private int biggestValidNode;

    /* Variable number of each node. */
    private int[] variables;

    /* Hash map for existing nodes. When a node with a certain hash is created, it is prepended to
     * the chain starting at hashToChainStart[hash]; hashChain[node] points to the next node with the
     * same bucket or NOT_A_NODE. */
    private int[] hashToChainStart;
    private int[] hashChain;

    // Statistics
    private long createdNodes = 0;
    private long hashChainLookups = 0;
    private long hashChainLookupLength = 0;
    private long hashChainLookupHit = 0;
    private long growCount = 0;

    protected NodeTable(int initialSize, double growthFactor, int maximumNodeCount) {
        this.growthFactor = growthFactor;
        this.maximumNodeCount = maximumNodeCount;
        int tableSize = Math.max(MathUtil.nextPrime(initialSize), MINIMUM_NODE_TABLE_SIZE);

        variables = new int[tableSize];
        hashToChainStart = new int[tableSize];
        hashChain = new int[tableSize];
        biggestValidNode = NOT_A_NODE;

        // Just to ensure a fail-fast
        Arrays.fill(variables, 0, FIRST_NODE, Integer.MIN_VALUE);
    }

    @Override
    public final int placeholder() {
        return NOT_A_NODE;
    }

    @Override
    public int variableOf(int node) {
        checkNode(node);
        return isLeaf(node) ? -1 : variables[node];
    }

    /* Variable of an internal node, without checks. */
    final int variableUnsafe(int node) {
        assert isNodeValid(node);
        return variables[node];
    }

    @Override
    public int nodeCount() {
        return biggestValidNode;
    }

    final int tableSize() {
        return variables.length;
    }

    public boolean isNodeValid(int node) {
        return FIRST_NODE <= node && node <= biggestValidNode;
    }

    /**
     * Determines if the given {@code node} is either a leaf or valid. For most operations it is
     * required that this is the case.
     *
     * @param node The node to be checked.
     * @return If {@code} is valid or a leaf.
     * @see #isLeaf(int)
     */
    public boolean isNodeValidOrLeaf(int node) {
        return isLeaf(node) || isNodeValid(node);
    }

    protected final void checkNode(int node) {
        if (!isNodeValidOrLeaf(node)) {
            throw new IllegalArgumentException("Unknown node " + node + " in " + this);
        }
    }

    // Node creation

    protected abstract boolean checkLookupChildrenMatch(int lookup);

    /**
     * Returns the existing node with the given {@code variable} whose children match the current
     * lookup (see {@link #checkLookupChildrenMatch(int)}), or allocates a fresh node. In both cases
     * the caller has to write the looked-up children to the returned node.
     *
     * @throws NodeLimitExceededException if a new node would exceed the node limit.
     */
    protected int findOrCreateNode(int variable, int hashCode) {
        int[] variables = this.variables;
        int[] hashChain = this.hashChain;

        // Search for the node in the hash chain
        int currentLookupNode = hashToChainStart[hashToTable(hashCode)];
        int chainLookups = 1;
        this.hashChainLookups += 1;
        while (currentLookupNode != NOT_A_NODE) {
            if (variables[currentLookupNode] == variable && checkLookupChildrenMatch(currentLookupNode)) {
                this.hashChainLookupLength += chainLookups;
                this.hashChainLookupHit += 1;
                return currentLookupNode;
            }
            int next = hashChain[currentLookupNode];
            assert next != currentLookupNode;
            currentLookupNode = next;
            chainLookups += 1;
        }
        this.hashChainLookupLength += chainLookups;

        int nodeCount = biggestValidNode;
        if (maximumNodeCount > 0 && nodeCount >= maximumNodeCount) {
            throw new NodeLimitExceededException(maximumNodeCount);
        }
        if (nodeCount >= MAXIMAL_NODE_COUNT) {
            throw new NodeLimitExceededException(MAXIMAL_NODE_COUNT);
        }
        if (biggestValidNode + 1 == tableSize()) {
            grow();
        }

        int freeNode = biggestValidNode + 1;
        this.variables[freeNode] = variable;
        biggestValidNode = freeNode;
        createdNodes += 1;
        connectHashList(freeNode, hashCode);
        return freeNode;
    }

    private void connectHashList(int node, int hashCode) {
        int lookup = hashToTable(hashCode);
        hashChain[node] = hashToChainStart[lookup];
        hashToChainStart[lookup] = node;
    }

    private int hashToTable(int hashCode) {
        return Math.floorMod(hashCode, hashToChainStart.length);
    }

    private void grow() {
        int oldSize = tableSize();
        int newSize = Math.min(MAXIMAL_NODE_COUNT, MathUtil.nextPrime((int) Math.ceil(oldSize * growthFactor)));
        logger.log(Level.FINE, "Growing the table of {0} from {1} to {2}", new Object[] {this, oldSize, newSize});

        growCount += 1;
        variables = Arrays.copyOf(variables, newSize);
        hashChain = new int[newSize];
        hashToChainStart = new int[newSize];
        onTableResize(newSize);

        for (int node = FIRST_NODE; node <= biggestValidNode; node++) {
            connectHashList(node, hashCode(node, variables[node]));
        }
        logger.log(Level.FINE, "Finished growing the table");
    }

    protected abstract void onTableResize(int newSize);

    protected abstract int hashCode(int node, int variable);

    // Traversal

    /**
     * Visits each internal node reachable from {@code node} exactly once, in depth-first pre-order.
     */
    protected final void forEachNodeBelowOnce(int node, NodeTableVisitor visitor) {
        checkNode(node);
        if (isLeaf(node)) {
            return;
        }
        BitSet visited = new BitSet(biggestValidNode + 1);
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(node);
        visited.set(node);
        while (!stack.isEmpty()) {
            int current = stack.pop();
            visitor.visit(current, variables[current]);
            forEachChildReversed(current, child -> {
                if (!isLeaf(child) && !visited.get(child)) {
                    visited.set(child);
                    stack.push(child);
                }
            });
        }
    }

    /* Children in reverse order, such that the stack-based traversal descends into the first child
     * first. */
    private void forEachChildReversed(int node, IntConsumer action) {
        int[] children = children(node);
        for (int i = children.length - 1; i >= 0; i--) {
            action.accept(children[i]);
        }
    }

    private int[] children(int node) {
        int[] children = new int[2];
        int[] index = {0};
        forEachChild(node, child -> children[index[0]++] = child);
        return children;
    }

    // Integrity checks and utility

    /**
     * Performs the integrity / invariant checks of the table.
     *
     * @return True. This way, check can easily be called by an {@code assert} statement.
     */
    boolean check() {
        logger.log(Level.FINER, "Running integrity check");
        checkState(biggestValidNode < tableSize(), "Biggest node %d exceeds table", biggestValidNode);

        // Check each node's children
        for (int node = FIRST_NODE; node <= biggestValidNode; node++) {
            int current = node;
            int variable = variables[node];
            checkState(0 <= variable && variable < numberOfVariables(), "Invalid variable of (%s)", string(node));
            int[] children = children(node);
            checkState(children[0] != children[1], "Redundant node (%s)", string(node));
            for (int child : children) {
                checkState(isNodeValidOrLeaf(child), "Invalid child entry (%s) -> %d", string(current), child);
                if (!isLeaf(child)) {
                    checkState(
                            variable < variables[child],
                            "(%s) -> (%s) does not descend tree",
                            string(current),
                            string(child));
                }
            }
        }

        logger.log(Level.FINER, "Checking duplicate nodes");
        Set<Node> nodes = new HashSet<>();
        for (int node = FIRST_NODE; node <= biggestValidNode; node++) {
            Node nodeObject = node(node);
            checkState(nodes.add(nodeObject), "Duplicate entry (%s)", nodeObject);
        }

        // Check the integrity of the hash chain
        for (int node = FIRST_NODE; node <= biggestValidNode; node++) {
            int chainNode = hashToChainStart[hashToTable(hashCode(node, variables[node]))];
            while (chainNode != NOT_A_NODE && chainNode != node) {
                chainNode = hashChain[chainNode];
            }
            checkState(chainNode == node, "Node (%s) not contained in its hash chain", string(node));
        }
        return true;
    }

    public String getStatistics() {
        return String.format(
                "Node table statistics:%n"
                        + "Table Size: %1$d, %2$d valid nodes, %3$d created nodes%n"
                        + "Hash table: %4$d lookups, %5$.2f avg. len, %6$d hits; %7$d grows",
                tableSize(),
                biggestValidNode,
                createdNodes,
                hashChainLookups,
                hashChainLookups == 0 ? 0.0d : hashChainLookupLength * 1.0 / hashChainLookups,
                hashChainLookupHit,
                growCount);
    }

    public String nodeToString(int node) {
        int variable = variables[node];
        return String.format(
                "%5d|%3d %s|%s", node, variable, ordering().name(variable), node(node).childrenString());
    }

    @Override
    public String treeToString(int node) {
        checkNode(node);
        if (isLeaf(node)) {
            return String.format("Node %d%n", node);
        }
        StringBuilder builder = new StringBuilder(50).append("Node ").append(node).append('\n')
                .append("Ordering ").append(String.join(" ", ordering().variables())).append('\n')
                .append("  NODE|VAR|DATA\n");
        forEachNodeBelowOnce(node, (child, var) -> builder.append(' ').append(nodeToString(child)).append('\n'));
        return builder.toString();
    }

    private Object string(int node) {
        return new Object() {
            @Override
            public String toString() {
                return node(node).toString();
            }
        };
    }

    protected abstract Node node(int node);

    public interface Node {
        String childrenString();
    }

    @FunctionalInterface
    protected interface NodeTableVisitor {
        void visit(int node, int variable);
    }

    // Tree structure abstraction

    protected abstract void forEachChild(int node, IntConsumer action);
}
