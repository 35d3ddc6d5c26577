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

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;
import java.util.Map;

/**
 * Translates an {@link Expression} into a node of a {@link Bdd}. A builder is used for a single
 * expression.
 */
final class ExpressionBuilder {
    private final Bdd bdd;
    private final VariableOrdering ordering;

    ExpressionBuilder(Bdd bdd) {
        this.bdd = bdd;
        this.ordering = bdd.ordering();
    }

    int build(Expression expression, BuildStrategy strategy) {
        // Fail before any node is created
        for (String variable : expression.variables()) {
            ordering.indexOf(variable);
        }
        switch (strategy) {
            case APPLY:
                return expression.accept(new ApplyVisitor());
            case SHANNON:
                return new ShannonExpansion().expand(expression, 0);
            default:
                throw new AssertionError(strategy);
        }
    }

    /* Post-order combination of the sub-diagrams. */
    private final class ApplyVisitor implements Expression.Visitor<Integer> {
        @Override
        public Integer visitConstant(boolean value) {
            return bdd.makeTerminal(value);
        }

        @Override
        public Integer visitVariable(String name) {
            return bdd.variableNode(name);
        }

        @Override
        public Integer visitNot(Expression operand) {
            return bdd.not(operand.accept(this));
        }

        @Override
        public Integer visitBinary(BinaryOperation operation, Expression left, Expression right) {
            int leftNode = left.accept(this);
            int rightNode = right.accept(this);
            return bdd.apply(operation, leftNode, rightNode);
        }
    }

    /* Cofactors the expression along the ordering, memoizing (cofactor, level) pairs. */
    private final class ShannonExpansion {
        private final Table<Integer, Expression, Integer> expanded = HashBasedTable.create();

        int expand(Expression expression, int level) {
            // Cofactors like (1 & 0) or ~1 need not be folded, but are variable-free once the ordering is consumed
            if (expression.isConstant() || level == ordering.size()) {
                return bdd.makeTerminal(expression.evaluate(Map.of()));
            }
            Integer cached = expanded.get(level, expression);
            if (cached != null) {
                return cached;
            }

            String variable = ordering.name(level);
            Expression lowCofactor = expression.restrict(variable, false);
            int result;
            if (lowCofactor == expression) {
                result = expand(expression, level + 1);
            } else {
                Expression highCofactor = expression.restrict(variable, true);
                int low = expand(lowCofactor, level + 1);
                int high = expand(highCofactor, level + 1);
                result = bdd.makeNode(level, low, high);
            }
            expanded.put(level, expression, result);
            return result;
        }
    }
}
