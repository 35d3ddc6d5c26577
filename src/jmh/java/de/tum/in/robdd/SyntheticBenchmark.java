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

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.infra.Blackhole;

public class SyntheticBenchmark extends BaseBddBenchmark {
    private static final int COMPARATOR_BITS = 12;

    @Benchmark
    public static void nQueens(BddState state, Blackhole bh) {
        bh.consume(BddBuilder.makeQueens(state.bdd(), 8));
    }

    @Benchmark
    public static void binaryAdder(BddState state, Blackhole bh) {
        bh.consume(BddBuilder.makeAdder(state.bdd(), BddState.VARIABLES / 2));
    }

    /* a > b over interleaved bits, built from a formula */
    @Benchmark
    public static void comparatorFormula(BddState state, Blackhole bh) {
        Expression greater = Expression.constant(false);
        for (int i = 0; i < COMPARATOR_BITS; i++) {
            Expression a = Expression.variable("x" + (2 * i + 1));
            Expression b = Expression.variable("x" + (2 * i + 2));
            greater = Expression.or(Expression.and(a, Expression.not(b)),
                    Expression.and(Expression.iff(a, b), greater));
        }
        bh.consume(state.bdd().build(greater));
    }
}
