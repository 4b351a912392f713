/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

/**
 * A directed edge carrying an integer index. Edges out of the same node that share an index form an "OR group": each
 * of them is an acceptable alternative for the same outcome.
 */
public interface IndexedEdge<N> {
    N getFrom();

    N getTo();

    int getIndex();
}
