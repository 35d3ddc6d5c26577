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
 * Thrown when creating a node would exceed the configured {@link
 * BddConfiguration#maximumNodeCount() node limit}. The running operation is aborted; the store
 * itself stays consistent.
 */
public final class NodeLimitExceededException extends BddException {
    private static final long serialVersionUID = -1150960262637001894L;

    private final int limit;

    public NodeLimitExceededException(int limit) {
        super(String.format("Node limit of %d nodes exceeded", limit));
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
