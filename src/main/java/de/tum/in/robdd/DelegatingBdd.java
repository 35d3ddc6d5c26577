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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Map;

/**
 * Forwards every operation to a delegate, calling {@link #onEnter(String)} before and {@link
 * #onExit()} after each call, also if the call fails.
 */
public abstract class DelegatingBdd implements Bdd {
    protected final Bdd delegate;

    protected DelegatingBdd(Bdd delegate) {
        this.delegate = checkNotNull(delegate);
    }

    protected void onEnter(String name) {
        // Empty
    }

    protected void onExit() {
        // Empty
    }

    @Override
    public int placeholder() {
        onEnter("placeholder");
        try {
            return delegate.placeholder();
        } finally {
            onExit();
        }
    }

    @Override
    public int trueNode() {
        onEnter("trueNode");
        try {
            return delegate.trueNode();
        } finally {
            onExit();
        }
    }

    @Override
    public int falseNode() {
        onEnter("falseNode");
        try {
            return delegate.falseNode();
        } finally {
            onExit();
        }
    }

    @Override
    public boolean isLeaf(int node) {
        onEnter("isLeaf");
        try {
            return delegate.isLeaf(node);
        } finally {
            onExit();
        }
    }

    @Override
    public int variableOf(int node) {
        onEnter("variableOf");
        try {
            return delegate.variableOf(node);
        } finally {
            onExit();
        }
    }

    @Override
    public int low(int node) {
        onEnter("low");
        try {
            return delegate.low(node);
        } finally {
            onExit();
        }
    }

    @Override
    public int high(int node) {
        onEnter("high");
        try {
            return delegate.high(node);
        } finally {
            onExit();
        }
    }

    @Override
    public VariableOrdering ordering() {
        onEnter("ordering");
        try {
            return delegate.ordering();
        } finally {
            onExit();
        }
    }

    @Override
    public int nodeCount() {
        onEnter("nodeCount");
        try {
            return delegate.nodeCount();
        } finally {
            onExit();
        }
    }

    @Override
    public void forEachNode(int node, NodeVisitor visitor) {
        onEnter("forEachNode");
        try {
            delegate.forEachNode(node, visitor);
        } finally {
            onExit();
        }
    }

    @Override
    public String treeToString(int node) {
        onEnter("treeToString");
        try {
            return delegate.treeToString(node);
        } finally {
            onExit();
        }
    }

    @Override
    public String statistics() {
        onEnter("statistics");
        try {
            return delegate.statistics();
        } finally {
            onExit();
        }
    }

    @Override
    public int makeTerminal(boolean value) {
        onEnter("makeTerminal");
        try {
            return delegate.makeTerminal(value);
        } finally {
            onExit();
        }
    }

    @Override
    public int makeNode(int variable, int low, int high) {
        onEnter("makeNode");
        try {
            return delegate.makeNode(variable, low, high);
        } finally {
            onExit();
        }
    }

    @Override
    public int variableNode(int variable) {
        onEnter("variableNode");
        try {
            return delegate.variableNode(variable);
        } finally {
            onExit();
        }
    }

    @Override
    public int apply(BinaryOperation operation, int node1, int node2) {
        onEnter("apply");
        try {
            return delegate.apply(operation, node1, node2);
        } finally {
            onExit();
        }
    }

    @Override
    public int not(int node) {
        onEnter("not");
        try {
            return delegate.not(node);
        } finally {
            onExit();
        }
    }

    @Override
    public int build(Expression expression) {
        onEnter("build");
        try {
            return delegate.build(expression);
        } finally {
            onExit();
        }
    }

    @Override
    public int build(Expression expression, BuildStrategy strategy) {
        onEnter("build");
        try {
            return delegate.build(expression, strategy);
        } finally {
            onExit();
        }
    }

    @Override
    public boolean evaluate(int node, boolean[] assignment) {
        onEnter("evaluate");
        try {
            return delegate.evaluate(node, assignment);
        } finally {
            onExit();
        }
    }

    @Override
    public boolean evaluate(int node, Map<String, Boolean> assignment) {
        onEnter("evaluate");
        try {
            return delegate.evaluate(node, assignment);
        } finally {
            onExit();
        }
    }

    @Override
    public boolean check() {
        onEnter("check");
        try {
            return delegate.check();
        } finally {
            onExit();
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + '(' + delegate + ')';
    }
}
