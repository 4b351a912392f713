/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

/**
 * A node with no semantics of its own. Evaluation proceeds to every one of its successors regardless of edge index,
 * which expresses an unconditional fan-out. Empty nodes never cost anything.
 */
public final class EmptyNode<O, A> extends Node<O, A> {
    private EmptyNode(String name) {
        super(name, NodeKind.EMPTY, 0.0);
    }

    public static <O, A> EmptyNode<O, A> named(String name) {
        return new EmptyNode<>(name);
    }

    @Override
    public EmptyNode<O, A> withName(String name) {
        return new EmptyNode<>(name);
    }

    @Override
    public <R> R accept(Visitor<O, A, R> visitor) {
        return visitor.visitEmpty(this);
    }
}
