/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

import java.util.Objects;

/**
 * An exception thrown when evaluating a graph fails fatally. The cause is the specific failure (e.g.
 * {@link NoViablePathException} or {@link UnresolvedBehaviorException}, or whatever a user-supplied condition threw),
 * while this exception adds what the evaluation had explored by the time it failed.
 */
public class CallException extends RuntimeException {
    private static final long serialVersionUID = 1;

    private final transient Behavior<?, ?> behavior;
    private final transient CallGraph<?, ?> callGraph;

    public CallException(Behavior<?, ?> behavior, CallGraph<?, ?> callGraph, Throwable cause) {
        super("Error calling behavior: " + behavior.getName(), cause);
        this.behavior = Objects.requireNonNull(behavior);
        this.callGraph = Objects.requireNonNull(callGraph);
    }

    /** Returns the subject of the graph whose evaluation failed. */
    public Behavior<?, ?> getBehavior() {
        return behavior;
    }

    /** Returns the partially-explored trace of the failed evaluation. */
    public CallGraph<?, ?> getCallGraph() {
        return callGraph;
    }
}
