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
 * Memoization table of a single apply or negation run, mapping {@code (operation, node1, node2)}
 * to the result node. The table is exact: it grows instead of overwriting entries, so that every
 * pair of operand nodes is expanded at most once per run.
 */
final class ApplyCache {
    private static final byte NOT_AN_OPERATION = 0;
    static final byte UNARY_OPERATION_NOT = 1;
    private static final byte BINARY_OPERATION_OFFSET = 2;

    private static final int INITIAL_CAPACITY = 64;
    private static final double MAXIMAL_LOAD = 0.5d;

    private byte[] operations;
    private int[] firstArguments;
    private int[] secondArguments;
    private int[] results;
    private int size = 0;

    private int lookupResult;

    // Statistics
    private long lookups = 0;
    private long hits = 0;

    ApplyCache() {
        this(INITIAL_CAPACITY);
    }

    ApplyCache(int capacity) {
        int tableSize = Integer.highestOneBit(Math.max(capacity, 2) * 2 - 1);
        operations = new byte[tableSize];
        firstArguments = new int[tableSize];
        secondArguments = new int[tableSize];
        results = new int[tableSize];
    }

    static byte operationId(BinaryOperation operation) {
        return (byte) (BINARY_OPERATION_OFFSET + operation.ordinal());
    }

    boolean lookupNot(int node) {
        return lookup(UNARY_OPERATION_NOT, node, NodeTable.NOT_A_NODE);
    }

    void putNot(int node, int result) {
        put(UNARY_OPERATION_NOT, node, NodeTable.NOT_A_NODE, result);
    }

    /**
     * Searches the entry for the given key. If found, the result is available through {@link
     * #lookupResult()}.
     */
    boolean lookup(byte operation, int node1, int node2) {
        assert operation != NOT_AN_OPERATION;
        lookups += 1;
        int slot = findSlot(operation, node1, node2);
        if (operations[slot] == NOT_AN_OPERATION) {
            return false;
        }
        hits += 1;
        lookupResult = results[slot];
        return true;
    }

    int lookupResult() {
        return lookupResult;
    }

    void put(byte operation, int node1, int node2, int result) {
        assert operation != NOT_AN_OPERATION;
        if (size + 1 > operations.length * MAXIMAL_LOAD) {
            grow();
        }
        int slot = findSlot(operation, node1, node2);
        if (operations[slot] == NOT_AN_OPERATION) {
            size += 1;
        } else {
            assert results[slot] == result : "Conflicting results for the same key";
        }
        operations[slot] = operation;
        firstArguments[slot] = node1;
        secondArguments[slot] = node2;
        results[slot] = result;
    }

    /* Linear probing; returns the slot holding the key or the first free slot. */
    private int findSlot(byte operation, int node1, int node2) {
        int mask = operations.length - 1;
        int slot = HashUtil.hash(operation, node1, node2) & mask;
        while (operations[slot] != NOT_AN_OPERATION
                && (operations[slot] != operation
                        || firstArguments[slot] != node1
                        || secondArguments[slot] != node2)) {
            slot = (slot + 1) & mask;
        }
        return slot;
    }

    private void grow() {
        byte[] oldOperations = operations;
        int[] oldFirstArguments = firstArguments;
        int[] oldSecondArguments = secondArguments;
        int[] oldResults = results;

        int newSize = oldOperations.length * 2;
        operations = new byte[newSize];
        firstArguments = new int[newSize];
        secondArguments = new int[newSize];
        results = new int[newSize];

        for (int i = 0; i < oldOperations.length; i++) {
            if (oldOperations[i] != NOT_AN_OPERATION) {
                int slot = findSlot(oldOperations[i], oldFirstArguments[i], oldSecondArguments[i]);
                operations[slot] = oldOperations[i];
                firstArguments[slot] = oldFirstArguments[i];
                secondArguments[slot] = oldSecondArguments[i];
                results[slot] = oldResults[i];
            }
        }
    }

    int size() {
        return size;
    }

    long lookups() {
        return lookups;
    }

    long hits() {
        return hits;
    }

    @Override
    public String toString() {
        return String.format("ApplyCache(%d entries, %d lookups, %d hits)", size, lookups, hits);
    }
}
