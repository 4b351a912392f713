/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

import java.util.List;
import java.util.Set;

/** The read-only view of a directed, edge-indexed graph that {@link Levels} needs. */
public interface IndexedGraph<N> {
    /** Returns all nodes, in insertion order. */
    Set<N> getNodes();

    /**
     * Returns the edges ending at node, in insertion order.
     * 
     * @throws IllegalArgumentException if node is not part of this graph.
     */
    List<? extends IndexedEdge<N>> getIncomingEdges(N node);

    /**
     * Returns the edges starting at node, in insertion order.
     * 
     * @throws IllegalArgumentException if node is not part of this graph.
     */
    List<? extends IndexedEdge<N>> getOutgoingEdges(N node);
}
