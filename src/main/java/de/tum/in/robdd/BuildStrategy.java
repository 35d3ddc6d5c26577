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
 * How {@link Bdd#build(Expression, BuildStrategy)} turns an expression into a diagram. Both
 * strategies yield the identical node for the same expression.
 */
public enum BuildStrategy {
    /** Combine the diagrams of the sub-expressions bottom-up with the apply algorithm. */
    APPLY,
    /** Expand the expression variable by variable along the ordering (Shannon expansion). */
    SHANNON
}
