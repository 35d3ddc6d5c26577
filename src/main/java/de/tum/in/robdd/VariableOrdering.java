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
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import javax.annotation.Nullable;

/**
 * The fixed, ordered list of variables of a {@link Bdd}. Variables earlier in the list appear
 * closer to the root of every diagram, i.e. the variable at index {@code 0} is tested first.
 */
public final class VariableOrdering implements Iterable<String> {
    private final ImmutableList<String> variables;
    private final ImmutableMap<String, Integer> indices;

    private VariableOrdering(ImmutableList<String> variables) {
        ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builderWithExpectedSize(variables.size());
        for (int i = 0; i < variables.size(); i++) {
            builder.put(variables.get(i), i);
        }
        this.variables = variables;
        try {
            this.indices = builder.buildOrThrow();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Duplicate variable in ordering " + variables, e);
        }
    }

    public static VariableOrdering of(String... variables) {
        return of(Arrays.asList(variables));
    }

    public static VariableOrdering of(List<String> variables) {
        checkNotNull(variables);
        for (String variable : variables) {
            checkArgument(variable != null && !variable.isEmpty(), "Invalid variable name in %s", variables);
        }
        return new VariableOrdering(ImmutableList.copyOf(variables));
    }

    /**
     * Creates the ordering {@code prefix1, prefix2, ..., prefixN}.
     */
    public static VariableOrdering numbered(String prefix, int count) {
        checkArgument(count >= 0, "Negative variable count %s", count);
        ImmutableList.Builder<String> builder = ImmutableList.builderWithExpectedSize(count);
        for (int i = 1; i <= count; i++) {
            builder.add(prefix + i);
        }
        return new VariableOrdering(builder.build());
    }

    public int size() {
        return variables.size();
    }

    public boolean contains(String variable) {
        return indices.containsKey(variable);
    }

    /**
     * Returns the position of {@code variable} in this ordering.
     *
     * @throws UndefinedVariableException if the variable is not part of this ordering.
     */
    public int indexOf(String variable) {
        Integer index = indices.get(variable);
        if (index == null) {
            throw new UndefinedVariableException(variable, this);
        }
        return index;
    }

    public String name(int index) {
        checkElementIndex(index, variables.size());
        return variables.get(index);
    }

    public List<String> variables() {
        return variables;
    }

    @Override
    public Iterator<String> iterator() {
        return variables.iterator();
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VariableOrdering)) {
            return false;
        }
        return variables.equals(((VariableOrdering) o).variables);
    }

    @Override
    public int hashCode() {
        return variables.hashCode();
    }

    @Override
    public String toString() {
        return variables.toString();
    }
}
