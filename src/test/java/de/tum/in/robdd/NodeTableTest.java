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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import org.junit.jupiter.api.Test;

public class NodeTableTest {
    private static final BddConfiguration config = ImmutableBddConfiguration.builder().build();

    @Test
    public void testTerminalsAreUnique() {
        BddImpl bdd = new BddImpl(VariableOrdering.of("a", "b"), config);
        assertThat(bdd.makeTerminal(true), is(bdd.makeTerminal(true)));
        assertThat(bdd.makeTerminal(false), is(bdd.makeTerminal(false)));
        assertThat(bdd.makeTerminal(true), is(bdd.trueNode()));
        assertThat(bdd.makeTerminal(false), is(bdd.falseNode()));
        assertThat(bdd.trueNode(), is(not(bdd.falseNode())));
        assertThat(bdd.isLeaf(bdd.trueNode()), is(true));
        assertThat(bdd.variableOf(bdd.falseNode()), is(-1));
        assertThat(bdd.nodeCount(), is(0));
    }

    @Test
    public void testRedundantNodeIsNotCreated() {
        BddImpl bdd = new BddImpl(VariableOrdering.of("a", "b"), config);
        int b = bdd.variableNode(1);
        assertThat(bdd.makeNode(0, b, b), is(b));
        assertThat(bdd.makeNode(0, bdd.trueNode(), bdd.trueNode()), is(bdd.trueNode()));
        assertThat(bdd.nodeCount(), is(1));
    }

    @Test
    public void testNodesAreUnique() {
        BddImpl bdd = new BddImpl(VariableOrdering.of("a", "b"), config);
        int b = bdd.variableNode(1);
        int node = bdd.makeNode(0, bdd.falseNode(), b);
        assertThat(bdd.makeNode(0, bdd.falseNode(), b), is(node));
        assertThat(bdd.and(bdd.variableNode(0), b), is(node));
        assertThat(bdd.makeNode(0, b, bdd.falseNode()), is(not(node)));
        assertThat(bdd.variableNode(1), is(b));
        assertThat(bdd.nodeCount(), is(4));
        assertThat(bdd.check(), is(true));
    }

    @Test
    public void testChildren() {
        BddImpl bdd = new BddImpl(VariableOrdering.of("a", "b"), config);
        int b = bdd.variableNode("b");
        int node = bdd.makeNode(0, b, bdd.trueNode());
        assertThat(bdd.variableOf(node), is(0));
        assertThat(bdd.low(node), is(b));
        assertThat(bdd.high(node), is(bdd.trueNode()));
        assertThrows(IllegalArgumentException.class, () -> bdd.low(bdd.trueNode()));
        assertThrows(IllegalArgumentException.class, () -> bdd.high(node + 1));
    }

    @Test
    public void testOrderingViolation() {
        BddImpl bdd = new BddImpl(VariableOrdering.of("a", "b", "c"), config);
        int b = bdd.variableNode(1);
        assertThrows(OrderingViolationError.class, () -> bdd.makeNode(1, b, bdd.trueNode()));
        assertThrows(OrderingViolationError.class, () -> bdd.makeNode(2, bdd.falseNode(), b));
        assertThrows(OrderingViolationError.class, () -> bdd.makeNode(3, bdd.falseNode(), bdd.trueNode()));
        assertThrows(OrderingViolationError.class, () -> bdd.makeNode(-1, bdd.falseNode(), bdd.trueNode()));
        assertThat(bdd.nodeCount(), is(1));
        assertThat(bdd.check(), is(true));
    }

    @Test
    public void testUnknownNode() {
        BddImpl bdd = new BddImpl(VariableOrdering.of("a", "b"), config);
        assertThrows(IllegalArgumentException.class, () -> bdd.makeNode(0, 17, bdd.trueNode()));
        assertThrows(IllegalArgumentException.class, () -> bdd.and(bdd.placeholder(), bdd.trueNode()));
        assertThrows(IllegalArgumentException.class, () -> bdd.not(-3));
        assertThrows(IllegalArgumentException.class, () -> bdd.variableNode(2));
        assertThrows(UndefinedVariableException.class, () -> bdd.variableNode("c"));
    }

    @Test
    public void testNodeLimit() {
        BddImpl bdd = new BddImpl(VariableOrdering.numbered("x", 8), ImmutableBddConfiguration.builder()
                .maximumNodeCount(10)
                .build());
        int parity = bdd.falseNode();
        for (int i = 0; i < 3; i++) {
            parity = bdd.xor(parity, bdd.variableNode(i));
        }
        int smallParity = parity;
        int nodesBefore = bdd.nodeCount();

        NodeLimitExceededException exception = assertThrows(NodeLimitExceededException.class, () -> {
            int node = smallParity;
            for (int i = 3; i < 8; i++) {
                node = bdd.xor(node, bdd.variableNode(i));
            }
        });
        assertThat(exception.limit(), is(10));
        assertThat(bdd.nodeCount(), is(10));
        assertThat(nodesBefore, is(lessThan(10)));
        assertThat(bdd.check(), is(true));

        // Previously built diagrams stay usable
        for (boolean[] valuation : Valuations.of(8)) {
            boolean expected = valuation[0] ^ valuation[1] ^ valuation[2];
            assertThat(bdd.evaluate(smallParity, valuation), is(expected));
        }
        assertThat(bdd.xor(bdd.variableNode(0), bdd.variableNode(1)), is(bdd.xor(bdd.variableNode(1),
                bdd.variableNode(0))));
    }

    @Test
    public void testGrowth() {
        int variableCount = 20;
        BddImpl bdd = new BddImpl(VariableOrdering.numbered("x", variableCount), ImmutableBddConfiguration.builder()
                .initialSize(1)
                .growthFactor(1.2d)
                .build());
        int initialTableSize = bdd.tableSize();

        List<int[]> triples = new ArrayList<>();
        List<Integer> nodes = new ArrayList<>();
        List<Integer> pool = new ArrayList<>(List.of(bdd.falseNode(), bdd.trueNode()));
        for (int variable = variableCount - 1; variable >= 0; variable--) {
            List<Integer> created = new ArrayList<>();
            outer:
            for (int low : pool) {
                for (int high : pool) {
                    if (low == high) {
                        continue;
                    }
                    created.add(bdd.makeNode(variable, low, high));
                    triples.add(new int[] {variable, low, high});
                    if (created.size() == 100) {
                        break outer;
                    }
                }
            }
            nodes.addAll(created);
            pool.addAll(created);
        }

        assertThat(bdd.tableSize(), is(greaterThan(initialTableSize)));
        assertThat(bdd.nodeCount(), is(nodes.size()));
        for (int i = 0; i < triples.size(); i++) {
            int[] triple = triples.get(i);
            assertThat(bdd.makeNode(triple[0], triple[1], triple[2]), is(nodes.get(i)));
        }
        assertThat(bdd.nodeCount(), is(nodes.size()));
        assertThat(bdd.check(), is(true));
    }

    @Test
    public void testForEachNode() {
        BddImpl bdd = new BddImpl(VariableOrdering.of("a", "b", "c"), config);
        int node = bdd.or(bdd.and(bdd.variableNode(0), bdd.variableNode(1)), bdd.variableNode(2));
        BitSet visited = new BitSet();
        bdd.forEachNode(node, (current, variable, low, high) -> {
            assertThat(visited.get(current), is(false));
            if (current != node) {
                assertThat(visited.isEmpty(), is(false));
            }
            visited.set(current);
            assertThat(variable, is(bdd.variableOf(current)));
            assertThat(low, is(bdd.low(current)));
            assertThat(high, is(bdd.high(current)));
        });
        assertThat(visited.cardinality(), is(3));
        assertThat(bdd.nodeCount(node), is(3));
        assertThat(bdd.nodeCount(bdd.trueNode()), is(0));
        assertThat(bdd.supportNames(node).size(), is(3));
    }

    @Test
    public void testTreeToString() {
        BddImpl bdd = new BddImpl(VariableOrdering.of("a", "b"), config);
        int node = bdd.and(bdd.variableNode(0), bdd.variableNode(1));
        String tree = bdd.treeToString(node);
        assertThat(tree, containsString("Node " + node));
        assertThat(tree, containsString("Ordering a b"));
        assertThat(tree, containsString("|  0 a|"));
        assertThat(tree, containsString("|  1 b|"));
        assertThat(tree.lines().count(), is(5L));
        assertThat(bdd.treeToString(bdd.trueNode()).trim(), is("Node " + bdd.trueNode()));
        assertThat(bdd.statistics(), containsString("Node table statistics"));
        assertThat(bdd.statistics(), containsString("1 apply runs"));
    }
}
