/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

/** The outcome recorded on the edge leading to a trace node in a {@link CallGraph}. */
public enum CallEdgeStatus {
    /** Registered as a candidate but not (yet) popped from the frontier. */
    UNEXPLORED,
    /** Popped and resolved: an action was returned, or the node's successors were added to the frontier. */
    CALLED,
    /** A dead end: a cyclic behavior, a branch without successors, or a node all of whose candidates failed. */
    FAILURE
}
