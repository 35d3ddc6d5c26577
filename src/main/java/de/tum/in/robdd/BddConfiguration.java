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

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class BddConfiguration {
    public static final int DEFAULT_INITIAL_SIZE = 1024;
    public static final double DEFAULT_NODE_TABLE_GROWTH_FACTOR = 1.5d;
    public static final int UNBOUNDED = 0;

    @Value.Default
    public int initialSize() {
        return DEFAULT_INITIAL_SIZE;
    }

    @Value.Default
    public double growthFactor() {
        return DEFAULT_NODE_TABLE_GROWTH_FACTOR;
    }

    /**
     * Maximal number of internal nodes the store may hold, or {@link #UNBOUNDED}.
     */
    @Value.Default
    public int maximumNodeCount() {
        return UNBOUNDED;
    }

    @Value.Default
    public BuildStrategy buildStrategy() {
        return BuildStrategy.APPLY;
    }

    /**
     * Whether apply resolves operands like {@code false & x} without descending into {@code x}.
     */
    @Value.Default
    public boolean shortCircuit() {
        return true;
    }

    @Value.Default
    public boolean threadSafetyCheck() {
        return false;
    }

    @Value.Check
    protected void check() {
        if (initialSize() <= 0) {
            throw new IllegalArgumentException("Initial size must be positive");
        }
        if (growthFactor() <= 1.0d) {
            throw new IllegalArgumentException("Growth factor must be larger than 1");
        }
        if (maximumNodeCount() < 0) {
            throw new IllegalArgumentException("Maximum node count must not be negative");
        }
    }
}
