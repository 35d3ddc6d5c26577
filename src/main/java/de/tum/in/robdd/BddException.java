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
 * Base class of all recoverable failures raised by a {@link Bdd}. Failures never leave a partial
 * diagram behind; nodes created before the failure stay valid.
 */
public class BddException extends RuntimeException {
    private static final long serialVersionUID = 4181357409266032148L;

    public BddException(String message) {
        super(message);
    }
}
