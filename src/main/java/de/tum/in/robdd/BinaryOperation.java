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

/**
 * The binary boolean connectives supported by {@link Bdd#apply(BinaryOperation, int, int)} and
 * {@link Expression}.
 */
public enum BinaryOperation {
    AND("&", true) {
        @Override
        public boolean apply(boolean left, boolean right) {
            return left && right;
        }
    },
    OR("|", true) {
        @Override
        public boolean apply(boolean left, boolean right) {
            return left || right;
        }
    },
    XOR("^", true) {
        @Override
        public boolean apply(boolean left, boolean right) {
            return left ^ right;
        }
    },
    IMPLIES("->", false) {
        @Override
        public boolean apply(boolean left, boolean right) {
            return !left || right;
        }
    },
    IFF("<->", true) {
        @Override
        public boolean apply(boolean left, boolean right) {
            return left == right;
        }
    };

    private final String symbol;
    private final boolean commutative;

    BinaryOperation(String symbol, boolean commutative) {
        this.symbol = symbol;
        this.commutative = commutative;
    }

    public abstract boolean apply(boolean left, boolean right);

    public boolean isCommutative() {
        return commutative;
    }

    public String symbol() {
        return symbol;
    }
}
