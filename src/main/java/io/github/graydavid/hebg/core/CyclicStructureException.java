/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

/**
 * Thrown when a computation that requires an acyclic structure (leveling, topological ordering, bottom-up metrics)
 * finds a cycle among nodes.
 */
public class CyclicStructureException extends IllegalArgumentException {
    private static final long serialVersionUID = 1;

    public CyclicStructureException(String message) {
        super(message);
    }
}
