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

import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

@State(Scope.Benchmark)
public class BddState {
    static final int VARIABLES = 128;

    @Param({"APPLY", "SHANNON"})
    private BuildStrategy buildStrategy;

    @Param({"true", "false"})
    private boolean shortCircuit;

    private Bdd bdd;

    @Setup(Level.Iteration)
    public void setUpBdd() {
        bdd = BddFactory.buildBdd(
                VariableOrdering.numbered("x", VARIABLES),
                ImmutableBddConfiguration.builder()
                        .buildStrategy(buildStrategy)
                        .shortCircuit(shortCircuit)
                        .build());
    }

    public Bdd bdd() {
        return bdd;
    }
}
