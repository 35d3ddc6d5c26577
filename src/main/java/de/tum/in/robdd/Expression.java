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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Immutable propositional formula over named variables, the input of {@link Bdd#build(Expression)}.
 * Equality is structural.
 */
@SuppressWarnings("AccessingNonPublicFieldOfAnotherObject")
public abstract class Expression {
    private static final Expression TRUE = new Constant(true);
    private static final Expression FALSE = new Constant(false);

    Expression() {}

    public static Expression constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Expression variable(String name) {
        checkArgument(name != null && !name.isEmpty(), "Invalid variable name");
        return new Variable(name);
    }

    public static Expression not(Expression operand) {
        return new Not(checkNotNull(operand));
    }

    public static Expression binary(BinaryOperation operation, Expression left, Expression right) {
        return new Binary(checkNotNull(operation), checkNotNull(left), checkNotNull(right));
    }

    public static Expression and(Expression left, Expression right) {
        return binary(BinaryOperation.AND, left, right);
    }

    public static Expression or(Expression left, Expression right) {
        return binary(BinaryOperation.OR, left, right);
    }

    public static Expression xor(Expression left, Expression right) {
        return binary(BinaryOperation.XOR, left, right);
    }

    public static Expression implies(Expression left, Expression right) {
        return binary(BinaryOperation.IMPLIES, left, right);
    }

    public static Expression iff(Expression left, Expression right) {
        return binary(BinaryOperation.IFF, left, right);
    }

    /**
     * Left-folds the operands with {@code &}. The empty conjunction is {@code true}.
     */
    public static Expression conjunction(Expression... operands) {
        return fold(BinaryOperation.AND, TRUE, operands);
    }

    /**
     * Left-folds the operands with {@code |}. The empty disjunction is {@code false}.
     */
    public static Expression disjunction(Expression... operands) {
        return fold(BinaryOperation.OR, FALSE, operands);
    }

    private static Expression fold(BinaryOperation operation, Expression neutral, Expression[] operands) {
        if (operands.length == 0) {
            return neutral;
        }
        return Arrays.stream(operands)
                .reduce((left, right) -> binary(operation, left, right))
                .orElseThrow();
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Evaluates this formula directly, without building a diagram.
     *
     * @throws IllegalArgumentException if a contained variable has no value in {@code assignment}.
     */
    public abstract boolean evaluate(Map<String, Boolean> assignment);

    /**
     * Replaces every occurrence of {@code variable} by {@code value} and folds the constants this
     * produces. Returns this instance if the variable does not occur.
     */
    public abstract Expression restrict(String variable, boolean value);

    abstract void gatherVariables(ImmutableSet.Builder<String> variables);

    public boolean isConstant() {
        return false;
    }

    /**
     * Returns the variables of this formula in order of their first occurrence.
     */
    public Set<String> variables() {
        ImmutableSet.Builder<String> builder = ImmutableSet.builder();
        gatherVariables(builder);
        return builder.build();
    }

    /**
     * Pattern-matching interface over the formula structure.
     */
    public interface Visitor<R> {
        R visitConstant(boolean value);

        R visitVariable(String name);

        R visitNot(Expression operand);

        R visitBinary(BinaryOperation operation, Expression left, Expression right);
    }

    static final class Constant extends Expression {
        private final boolean value;

        Constant(boolean value) {
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConstant(value);
        }

        @Override
        public boolean evaluate(Map<String, Boolean> assignment) {
            return value;
        }

        @Override
        public Expression restrict(String variable, boolean value) {
            return this;
        }

        @Override
        void gatherVariables(ImmutableSet.Builder<String> variables) {
            // No variables in this leaf
        }

        @Override
        public boolean isConstant() {
            return true;
        }

        @Override
        public boolean equals(@Nullable Object object) {
            return this == object || (object instanceof Constant && value == ((Constant) object).value);
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return value ? "1" : "0";
        }
    }

    static final class Variable extends Expression {
        private final String name;

        Variable(String name) {
            this.name = name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariable(name);
        }

        @Override
        public boolean evaluate(Map<String, Boolean> assignment) {
            Boolean value = assignment.get(name);
            if (value == null) {
                throw new IllegalArgumentException("No value for variable " + name);
            }
            return value;
        }

        @Override
        public Expression restrict(String variable, boolean value) {
            return name.equals(variable) ? constant(value) : this;
        }

        @Override
        void gatherVariables(ImmutableSet.Builder<String> variables) {
            variables.add(name);
        }

        @Override
        public boolean equals(@Nullable Object object) {
            return this == object || (object instanceof Variable && name.equals(((Variable) object).name));
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }
    }

    static final class Not extends Expression {
        private final Expression operand;
        private final int hashCode;

        Not(Expression operand) {
            this.operand = operand;
            this.hashCode = ~operand.hashCode();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNot(operand);
        }

        @Override
        public boolean evaluate(Map<String, Boolean> assignment) {
            return !operand.evaluate(assignment);
        }

        @Override
        public Expression restrict(String variable, boolean value) {
            Expression restricted = operand.restrict(variable, value);
            if (restricted == operand) {
                return this;
            }
            if (restricted.isConstant()) {
                return constant(!((Constant) restricted).value);
            }
            return new Not(restricted);
        }

        @Override
        void gatherVariables(ImmutableSet.Builder<String> variables) {
            operand.gatherVariables(variables);
        }

        @Override
        public boolean equals(@Nullable Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Not)) {
                return false;
            }
            Not that = (Not) object;
            return hashCode == that.hashCode && operand.equals(that.operand);
        }

        @Override
        public int hashCode() {
            return hashCode;
        }

        @Override
        public String toString() {
            return "~" + operand;
        }
    }

    static final class Binary extends Expression {
        private final BinaryOperation operation;
        private final Expression left;
        private final Expression right;
        private final int hashCode;

        Binary(BinaryOperation operation, Expression left, Expression right) {
            this.operation = operation;
            this.left = left;
            this.right = right;
            this.hashCode = Objects.hash(operation, left, right);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(operation, left, right);
        }

        @Override
        public boolean evaluate(Map<String, Boolean> assignment) {
            return operation.apply(left.evaluate(assignment), right.evaluate(assignment));
        }

        @Override
        public Expression restrict(String variable, boolean value) {
            Expression restrictedLeft = left.restrict(variable, value);
            Expression restrictedRight = right.restrict(variable, value);
            if (restrictedLeft == left && restrictedRight == right) {
                return this;
            }
            return simplify(operation, restrictedLeft, restrictedRight);
        }

        private static Expression simplify(BinaryOperation operation, Expression left, Expression right) {
            if (left.isConstant() && right.isConstant()) {
                return constant(operation.apply(((Constant) left).value, ((Constant) right).value));
            }
            if (left.isConstant()) {
                boolean value = ((Constant) left).value;
                switch (operation) {
                    case AND:
                        return value ? right : FALSE;
                    case OR:
                        return value ? TRUE : right;
                    case XOR:
                        return value ? new Not(right) : right;
                    case IMPLIES:
                        return value ? right : TRUE;
                    case IFF:
                        return value ? right : new Not(right);
                    default:
                        throw new AssertionError(operation);
                }
            }
            if (right.isConstant()) {
                boolean value = ((Constant) right).value;
                switch (operation) {
                    case AND:
                        return value ? left : FALSE;
                    case OR:
                        return value ? TRUE : left;
                    case XOR:
                        return value ? new Not(left) : left;
                    case IMPLIES:
                        return value ? TRUE : new Not(left);
                    case IFF:
                        return value ? left : new Not(left);
                    default:
                        throw new AssertionError(operation);
                }
            }
            return new Binary(operation, left, right);
        }

        @Override
        void gatherVariables(ImmutableSet.Builder<String> variables) {
            left.gatherVariables(variables);
            right.gatherVariables(variables);
        }

        @Override
        public boolean equals(@Nullable Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Binary)) {
                return false;
            }
            Binary that = (Binary) object;
            return hashCode == that.hashCode
                    && operation == that.operation
                    && left.equals(that.left)
                    && right.equals(that.right);
        }

        @Override
        public int hashCode() {
            return hashCode;
        }

        @Override
        public String toString() {
            return "(" + left + ' ' + operation.symbol() + ' ' + right + ')';
        }
    }
}
