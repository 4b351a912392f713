/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

/**
 * The closed set of kinds a {@link Node} can have. Kind is purely descriptive (e.g. for drawing a graph or filtering
 * nodes); engines dispatch through {@link Node#accept(Node.Visitor)} so that every kind must be handled explicitly.
 */
public enum NodeKind {
    ACTION,
    FEATURE_CONDITION,
    BEHAVIOR,
    EMPTY;
}
