/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

import java.util.Objects;

/** An edge in a {@link BehaviorGraph}: a connection from a predecessor node to a successor node with an index. */
public class Edge<O, A> implements IndexedEdge<Node<O, A>> {
    private final Node<O, A> from;
    private final Node<O, A> to;
    private final int index;

    public Edge(Node<O, A> from, Node<O, A> to, int index) {
        this.from = Objects.requireNonNull(from);
        this.to = Objects.requireNonNull(to);
        this.index = index;
    }

    @Override
    public Node<O, A> getFrom() {
        return from;
    }

    @Override
    public Node<O, A> getTo() {
        return to;
    }

    @Override
    public int getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object object) {
        if (!(object instanceof Edge)) {
            return false;
        }

        Edge<?, ?> other = (Edge<?, ?>) object;
        return Objects.equals(this.from, other.from) && Objects.equals(this.to, other.to) && this.index == other.index;
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, index);
    }

    @Override
    public String toString() {
        return "{" + from + "}-" + index + "->{" + to + "}";
    }
}
