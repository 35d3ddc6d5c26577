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

import com.google.common.collect.ImmutableSortedSet;
import java.util.Set;

/**
 * Thrown when an assignment passed for evaluation does not cover every variable the evaluated
 * diagram depends on.
 */
public final class MissingAssignmentException extends BddException {
    private static final long serialVersionUID = 2739036218771140855L;

    private final ImmutableSortedSet<String> missingVariables;

    public MissingAssignmentException(int node, Set<String> missingVariables) {
        super(String.format("Assignment for node %d lacks values for %s", node,
                ImmutableSortedSet.copyOf(missingVariables)));
        this.missingVariables = ImmutableSortedSet.copyOf(missingVariables);
    }

    public Set<String> missingVariables() {
        return missingVariables;
    }
}
