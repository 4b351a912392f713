/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

import java.util.Objects;

/** A terminal node: evaluating it always yields the action it carries. */
public final class Action<O, A> extends Node<O, A> {
    private final A action;

    private Action(String name, A action, double complexity) {
        super(name, NodeKind.ACTION, complexity);
        this.action = Objects.requireNonNull(action);
    }

    /** Creates an action named "Action(action)" with {@link Node#DEFAULT_COMPLEXITY}. */
    public static <O, A> Action<O, A> of(A action) {
        return of(action, DEFAULT_COMPLEXITY);
    }

    /** Creates an action named "Action(action)" with the given complexity. */
    public static <O, A> Action<O, A> of(A action, double complexity) {
        return new Action<>(defaultName(action), action, complexity);
    }

    public static <O, A> Action<O, A> named(String name, A action, double complexity) {
        return new Action<>(name, action, complexity);
    }

    public static String defaultName(Object action) {
        return "Action(" + action + ")";
    }

    public A getAction() {
        return action;
    }

    /** Returns the carried action. The observation is ignored. */
    public A evaluate(O observation) {
        return action;
    }

    @Override
    public Action<O, A> withName(String name) {
        return new Action<>(name, action, getComplexity());
    }

    @Override
    public <R> R accept(Visitor<O, A, R> visitor) {
        return visitor.visitAction(this);
    }
}
