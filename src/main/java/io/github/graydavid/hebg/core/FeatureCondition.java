/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * A branching node. Evaluating it against an observation yields a branch index, and evaluation continues with the
 * successors whose edges carry that index.
 */
public final class FeatureCondition<O, A> extends Node<O, A> {
    private final Condition<O> condition;

    private FeatureCondition(String name, double complexity, Condition<O> condition) {
        super(name, NodeKind.FEATURE_CONDITION, complexity);
        this.condition = Objects.requireNonNull(condition);
    }

    public static <O, A> FeatureCondition<O, A> of(String name, Condition<O> condition) {
        return of(name, DEFAULT_COMPLEXITY, condition);
    }

    public static <O, A> FeatureCondition<O, A> of(String name, double complexity, Condition<O> condition) {
        return new FeatureCondition<>(name, complexity, condition);
    }

    /** Creates a feature condition whose branch index is 1 when predicate holds and 0 otherwise. */
    public static <O, A> FeatureCondition<O, A> ofPredicate(String name, Predicate<? super O> predicate) {
        return ofPredicate(name, DEFAULT_COMPLEXITY, predicate);
    }

    public static <O, A> FeatureCondition<O, A> ofPredicate(String name, double complexity,
            Predicate<? super O> predicate) {
        Objects.requireNonNull(predicate);
        return new FeatureCondition<>(name, complexity, observation -> predicate.test(observation) ? 1 : 0);
    }

    /**
     * Runs the condition against the observation.
     * 
     * @throws MisbehaviorException if the condition returns a negative index.
     */
    public int evaluate(O observation) {
        int index = condition.branch(observation);
        if (index < 0) {
            String message = String.format("Feature condition '%s' returned negative branch index '%s'", getName(),
                    index);
            throw new MisbehaviorException(message);
        }
        return index;
    }

    @Override
    public FeatureCondition<O, A> withName(String name) {
        return new FeatureCondition<>(name, getComplexity(), condition);
    }

    @Override
    public <R> R accept(Visitor<O, A, R> visitor) {
        return visitor.visitFeatureCondition(this);
    }

    /** The user-supplied test behind a feature condition. */
    @FunctionalInterface
    public interface Condition<O> {
        /** Returns the non-negative index of the branch to follow for the given observation. */
        int branch(O observation);
    }
}
