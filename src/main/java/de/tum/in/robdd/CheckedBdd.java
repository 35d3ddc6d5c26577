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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fails fast with an {@link IllegalStateException} when two threads use the delegate at the same
 * time.
 */
public final class CheckedBdd extends DelegatingBdd {
    private final AtomicBoolean access;

    public CheckedBdd(Bdd delegate) {
        super(delegate);
        access = new AtomicBoolean(false);
    }

    @Override
    protected void onEnter(String name) {
        if (!access.compareAndSet(false, true)) {
            throw new IllegalStateException("Concurrent access to " + name);
        }
    }

    @Override
    protected void onExit() {
        if (!access.getAndSet(false)) {
            throw new IllegalStateException("Concurrently accessed");
        }
    }
}
