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

final class HashUtil {
    private static final int FNV_OFFSET_BASIS = 0x811C9DC5;
    private static final int FNV_PRIME = 0x1000193;

    private HashUtil() {}

    static int hash(int firstKey, int secondKey, int thirdKey) {
        int hash = FNV_OFFSET_BASIS;
        hash = (hash ^ firstKey) * FNV_PRIME;
        hash = (hash ^ secondKey) * FNV_PRIME;
        hash = (hash ^ thirdKey) * FNV_PRIME;
        return hash ^ (hash >>> 16);
    }

    static int hash(byte operation, int firstKey, int secondKey) {
        return hash((int) operation, firstKey, secondKey);
    }
}
