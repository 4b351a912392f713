/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.requirements;

import java.util.Objects;

import io.github.graydavid.hebg.core.Behavior;
import io.github.graydavid.hebg.core.IndexedEdge;

/**
 * An edge from a required behavior to a behavior that depends on it. The index numbers the requirement's dependents,
 * starting at 1, in the order they were found.
 */
public class RequirementEdge<O, A> implements IndexedEdge<Behavior<O, A>> {
    private final Behavior<O, A> requirement;
    private final Behavior<O, A> dependent;
    private final int index;

    RequirementEdge(Behavior<O, A> requirement, Behavior<O, A> dependent, int index) {
        this.requirement = Objects.requireNonNull(requirement);
        this.dependent = Objects.requireNonNull(dependent);
        this.index = index;
    }

    /** The required behavior. */
    @Override
    public Behavior<O, A> getFrom() {
        return requirement;
    }

    /** The dependent behavior. */
    @Override
    public Behavior<O, A> getTo() {
        return dependent;
    }

    @Override
    public int getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object object) {
        if (!(object instanceof RequirementEdge)) {
            return false;
        }

        RequirementEdge<?, ?> other = (RequirementEdge<?, ?>) object;
        return requirement.equals(other.requirement) && dependent.equals(other.dependent) && index == other.index;
    }

    @Override
    public int hashCode() {
        return Objects.hash(requirement, dependent, index);
    }

    @Override
    public String toString() {
        return "{" + requirement + "}-" + index + "->{" + dependent + "}";
    }
}
