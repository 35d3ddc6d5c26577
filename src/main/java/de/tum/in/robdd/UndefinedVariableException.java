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
 * Thrown when a variable name is not part of the {@link VariableOrdering} of a diagram.
 */
public final class UndefinedVariableException extends BddException {
    private static final long serialVersionUID = -6094817263251470219L;

    private final String variable;

    public UndefinedVariableException(String variable, VariableOrdering ordering) {
        super(String.format("Unknown variable %s, valid variables are %s", variable, ordering));
        this.variable = variable;
    }

    public String variable() {
        return variable;
    }
}
