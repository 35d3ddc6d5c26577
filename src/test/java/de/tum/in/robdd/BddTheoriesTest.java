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
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.in;
import static org.hamcrest.Matchers.is;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Tests the logical operations on randomly generated formulas against direct evaluation and checks
 * the store invariants afterwards.
 */
@SuppressWarnings({"checkstyle:javadoc", "StaticCollection", "NewClassNamingConvention"})
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class BddTheoriesTest {
    private static final Logger logger = Logger.getLogger(BddTheoriesTest.class.getName());

    private static final int variableCount = 5;
    private static final int treeDepth = 6;
    private static final int treeWidth = 40;
    private static final int unaryCount = 300;
    private static final int binaryCount = 600;

    private static final List<Bdd> bdds;
    private static final Collection<Generator.UnaryDataPoint> unary = new ArrayList<>();
    private static final Collection<Generator.BinaryDataPoint> binary = new ArrayList<>();

    static {
        VariableOrdering ordering = VariableOrdering.numbered("x", variableCount);
        bdds = List.of(
                BddFactory.buildBdd(ordering),
                BddFactory.buildBdd(ordering, ImmutableBddConfiguration.builder()
                        .shortCircuit(false)
                        .initialSize(16)
                        .build()));

        for (Bdd bdd : bdds) {
            Generator.Info info = Generator.fill(bdd, 0L, treeDepth, treeWidth, unaryCount, binaryCount);
            unary.addAll(info.unaryDataPoints);
            binary.addAll(info.binaryDataPoints);
            logger.log(Level.INFO, "Filled {0}: {1} nodes, {2} formulas",
                    new Object[] {bdd, bdd.nodeCount(), info.treeToNodeMap.size()});
        }
    }

    public static Stream<Generator.UnaryDataPoint> unary() {
        return unary.stream();
    }

    public static Stream<Generator.BinaryDataPoint> binary() {
        return binary.stream();
    }

    @AfterAll
    public static void check() {
        for (Bdd bdd : bdds) {
            assertThat(bdd.check(), is(true));
            logger.log(Level.FINE, bdd.statistics());
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("binary")
    public void testApply(Generator.BinaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        for (BinaryOperation operation : BinaryOperation.values()) {
            int result = bdd.apply(operation, dataPoint.left, dataPoint.right);
            Expression tree = Expression.binary(operation, dataPoint.leftTree, dataPoint.rightTree);

            for (boolean[] valuation : Valuations.of(variableCount)) {
                boolean left = bdd.evaluate(dataPoint.left, valuation);
                boolean right = bdd.evaluate(dataPoint.right, valuation);
                assertThat(bdd.evaluate(result, valuation), is(operation.apply(left, right)));
                assertThat(bdd.evaluate(result, valuation),
                        is(tree.evaluate(Valuations.asMap(bdd.ordering(), valuation))));
            }
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("binary")
    public void testAnd(Generator.BinaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int node1 = dataPoint.left;
        int node2 = dataPoint.right;
        int and = bdd.and(node1, node2);

        assertThat(bdd.and(node2, node1), is(and));
        assertThat(bdd.not(bdd.or(bdd.not(node1), bdd.not(node2))), is(and));
        assertThat(bdd.and(and, node1), is(and));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("binary")
    public void testOr(Generator.BinaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int node1 = dataPoint.left;
        int node2 = dataPoint.right;
        int or = bdd.or(node1, node2);

        assertThat(bdd.or(node2, node1), is(or));
        assertThat(bdd.not(bdd.and(bdd.not(node1), bdd.not(node2))), is(or));
        assertThat(bdd.implication(bdd.not(node1), node2), is(or));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("binary")
    public void testXor(Generator.BinaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int node1 = dataPoint.left;
        int node2 = dataPoint.right;
        int xor = bdd.xor(node1, node2);

        assertThat(bdd.xor(node2, node1), is(xor));
        assertThat(bdd.or(bdd.and(node1, bdd.not(node2)), bdd.and(bdd.not(node1), node2)), is(xor));
        assertThat(bdd.not(bdd.equivalence(node1, node2)), is(xor));
        assertThat(bdd.xor(xor, node2), is(node1));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("binary")
    public void testImplication(Generator.BinaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int node1 = dataPoint.left;
        int node2 = dataPoint.right;
        int implication = bdd.implication(node1, node2);

        assertThat(bdd.or(bdd.not(node1), node2), is(implication));
        assertThat(bdd.implication(bdd.not(node2), bdd.not(node1)), is(implication));
        assertThat(bdd.isTautology(bdd.implication(bdd.and(node1, implication), node2)), is(true));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("binary")
    public void testEquivalence(Generator.BinaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int node1 = dataPoint.left;
        int node2 = dataPoint.right;
        int equivalence = bdd.equivalence(node1, node2);

        assertThat(bdd.equivalence(node2, node1), is(equivalence));
        assertThat(bdd.and(bdd.implication(node1, node2), bdd.implication(node2, node1)), is(equivalence));
        assertThat(bdd.isTautology(equivalence), is(node1 == node2));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testNot(Generator.UnaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int node = dataPoint.node;
        int not = bdd.not(node);

        assertThat(bdd.not(not), is(node));
        assertThat(bdd.xor(node, bdd.trueNode()), is(not));
        assertThat(bdd.nodeCount(not), is(bdd.nodeCount(node)));
        assertThat(bdd.support(not), is(bdd.support(node)));
        for (boolean[] valuation : Valuations.of(variableCount)) {
            assertThat(bdd.evaluate(not, valuation), is(!bdd.evaluate(node, valuation)));
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testBuild(Generator.UnaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        assertThat(bdd.build(dataPoint.tree, BuildStrategy.APPLY), is(dataPoint.node));
        assertThat(bdd.build(dataPoint.tree, BuildStrategy.SHANNON), is(dataPoint.node));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testEvaluate(Generator.UnaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        for (boolean[] valuation : Valuations.of(variableCount)) {
            Map<String, Boolean> assignment = Valuations.asMap(bdd.ordering(), valuation);
            assertThat(bdd.evaluate(dataPoint.node, assignment), is(dataPoint.tree.evaluate(assignment)));
            assertThat(bdd.evaluate(dataPoint.node, valuation), is(dataPoint.tree.evaluate(assignment)));
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testSupport(Generator.UnaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        assertThat(bdd.supportNames(dataPoint.node), everyItem(is(in(dataPoint.tree.variables()))));
        bdd.forEachNode(dataPoint.node, (node, variable, low, high) -> {
            assertThat(low == high, is(false));
            assertThat(bdd.isLeaf(low) || bdd.variableOf(low) > variable, is(true));
            assertThat(bdd.isLeaf(high) || bdd.variableOf(high) > variable, is(true));
        });
    }
}
