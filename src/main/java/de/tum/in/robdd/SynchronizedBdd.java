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

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes all operations on the delegate with a single lock, which makes the lookup-or-create
 * step of node creation atomic. Compound operations like {@link #conjunction(int...)} are
 * serialized step by step.
 */
public final class SynchronizedBdd extends DelegatingBdd {
    private final Lock lock;

    private SynchronizedBdd(Bdd delegate, Lock lock) {
        super(delegate);
        this.lock = lock;
    }

    public static SynchronizedBdd create(Bdd bdd) {
        if (bdd instanceof SynchronizedBdd) {
            return (SynchronizedBdd) bdd;
        }
        return new SynchronizedBdd(bdd, new ReentrantLock());
    }

    @Override
    protected void onEnter(String name) {
        lock.lock();
    }

    @Override
    protected void onExit() {
        lock.unlock();
    }
}
