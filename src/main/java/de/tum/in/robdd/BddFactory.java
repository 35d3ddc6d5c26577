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

public final class BddFactory {
    private BddFactory() {}

    public static Bdd buildBdd(VariableOrdering ordering) {
        return buildBdd(ordering, ImmutableBddConfiguration.builder().build());
    }

    public static Bdd buildBdd(String... variables) {
        return buildBdd(VariableOrdering.of(variables));
    }

    public static Bdd buildBdd(VariableOrdering ordering, BddConfiguration configuration) {
        BddImpl bdd = new BddImpl(ordering, configuration);
        return configuration.threadSafetyCheck() ? new CheckedBdd(bdd) : bdd;
    }

    /**
     * Returns a view of {@code bdd} which may be shared between threads.
     */
    public static Bdd synchronizedBdd(Bdd bdd) {
        return SynchronizedBdd.create(bdd);
    }
}
