/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

/**
 * Thrown when a {@link Behavior} has no graph of its own and no buildable Behavior is registered under its name. This
 * points to missing configuration rather than a structural dead end in a graph, so it's never retried.
 */
public class UnresolvedBehaviorException extends RuntimeException {
    private static final long serialVersionUID = 1;

    private final String behaviorName;

    public UnresolvedBehaviorException(String behaviorName) {
        super("Behavior '" + behaviorName
                + "' can't build its own graph and no buildable behavior is registered under that name");
        this.behaviorName = behaviorName;
    }

    public UnresolvedBehaviorException(String behaviorName, String message) {
        super(message);
        this.behaviorName = behaviorName;
    }

    public String getBehaviorName() {
        return behaviorName;
    }
}
