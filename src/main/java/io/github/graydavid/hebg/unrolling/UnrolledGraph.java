/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.unrolling;

import java.util.Objects;

import io.github.graydavid.hebg.core.BehaviorGraph;

/** The result of unrolling: the flattened graph, plus whether unrolling ran into a behavior that loops. */
public class UnrolledGraph<O, A> {
    private final BehaviorGraph<O, A> graph;
    private final boolean looping;

    UnrolledGraph(BehaviorGraph<O, A> graph, boolean looping) {
        this.graph = Objects.requireNonNull(graph);
        this.looping = looping;
    }

    public BehaviorGraph<O, A> getGraph() {
        return graph;
    }

    /**
     * Answers whether some behavior couldn't be inlined because it refers back to a behavior that was being unrolled
     * at the time. Depending on {@link UnrollOptions#isCutLoopingAlternatives()}, such a behavior is either still in
     * the graph as a leaf or has been cut.
     */
    public boolean isLooping() {
        return looping;
    }

    @Override
    public String toString() {
        return "UnrolledGraph[looping=" + looping + ", graph=" + graph + "]";
    }
}
