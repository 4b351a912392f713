/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

/** Thrown when a {@link Behavior}'s graph factory failed. The factory's own exception is the cause. */
public class GraphBuildException extends RuntimeException {
    private static final long serialVersionUID = 1;

    private final String behaviorName;

    public GraphBuildException(String behaviorName, Throwable cause) {
        super("Failed to build graph for behavior '" + behaviorName + "'", cause);
        this.behaviorName = behaviorName;
    }

    public String getBehaviorName() {
        return behaviorName;
    }
}
