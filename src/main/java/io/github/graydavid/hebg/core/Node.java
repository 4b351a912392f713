/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * A node in a {@link BehaviorGraph}. There are exactly four kinds of nodes: {@link Action}, {@link FeatureCondition},
 * {@link Behavior}, and {@link EmptyNode}. The constructor is package private, so no other kinds can exist, and
 * {@link Visitor} forces every consumer to say what it does for each of them.
 * 
 * Identity is the name alone. Two nodes with the same name are equal, regardless of their kind, complexity, or what
 * they do. This is intentional: it lets graphs de-duplicate nodes added through different instances, lets a
 * {@link BehaviorRegistry} resolve a name-only {@link Behavior} reference, and lets the same node be shared across
 * several graphs.
 * 
 * @param <O> the type of observation that the node is evaluated against.
 * @param <A> the type of action that the graph containing this node ultimately produces.
 */
public abstract class Node<O, A> {
    /** The complexity used when a caller doesn't specify one for an action, feature condition, or behavior. */
    public static final double DEFAULT_COMPLEXITY = 1.0;

    private final String name;
    private final NodeKind kind;
    private final double complexity;

    Node(String name, NodeKind kind, double complexity) {
        this.name = requireValidName(name);
        this.kind = Objects.requireNonNull(kind);
        this.complexity = requireValidComplexity(name, complexity);
    }

    private static String requireValidName(String name) {
        if (name.isBlank()) {
            StringJoiner codePoints = name.codePoints()
                    .collect(() -> new StringJoiner(", ", "[", "]"),
                            (joiner, point) -> joiner.add(String.valueOf(point)), StringJoiner::merge);
            throw new IllegalArgumentException(
                    "Node names must not be blank but found only whitespace code points: " + codePoints);
        }
        return name;
    }

    private static double requireValidComplexity(String name, double complexity) {
        if (Double.isNaN(complexity) || complexity < 0) {
            String message = String.format("Node '%s' must have a non-negative complexity but found '%s'", name,
                    complexity);
            throw new IllegalArgumentException(message);
        }
        return complexity;
    }

    public String getName() {
        return name;
    }

    public NodeKind getKind() {
        return kind;
    }

    /**
     * The declared cost of using this node. Used to order the frontier during evaluation and to sum the complexity of
     * a behavior in the metrics package.
     */
    public double getComplexity() {
        return complexity;
    }

    /**
     * Creates a copy of this node with the given name. The copy has the same kind, complexity, and semantics as this
     * node. Since identity is by name, the copy is a different node unless the name is the same.
     */
    public abstract Node<O, A> withName(String name);

    /** Dispatches to the visitor method matching this node's kind. */
    public abstract <R> R accept(Visitor<O, A, R> visitor);

    @Override
    public final boolean equals(Object object) {
        if (this == object) {
            return true;
        }

        if (!(object instanceof Node)) {
            return false;
        }

        Node<?, ?> other = (Node<?, ?>) object;
        return name.equals(other.name);
    }

    @Override
    public final int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }

    /**
     * Exhaustive dispatch over the node kinds. Adding a kind means adding a method here, which breaks every existing
     * visitor at compile time rather than silently falling through.
     */
    public interface Visitor<O, A, R> {
        R visitAction(Action<O, A> action);

        R visitFeatureCondition(FeatureCondition<O, A> featureCondition);

        R visitBehavior(Behavior<O, A> behavior);

        R visitEmpty(EmptyNode<O, A> empty);
    }
}
