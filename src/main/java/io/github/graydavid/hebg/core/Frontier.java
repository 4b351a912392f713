/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

import java.util.Comparator;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * The cost-ordered collection of trace nodes waiting to be resolved during one evaluation. Entries come out by
 * ascending node complexity, with ties going to the entry pushed first. Each entry remembers the graph its node was
 * found in, since that's the graph whose edges and registry apply when the node is resolved.
 */
class Frontier<O, A> {
    private final PriorityQueue<Entry<O, A>> queue;
    private long pushCount;

    Frontier() {
        Comparator<Entry<O, A>> byComplexity = Comparator.comparingDouble(entry -> entry.getNode().getComplexity());
        this.queue = new PriorityQueue<>(byComplexity.thenComparingLong(Entry::getSequence));
        this.pushCount = 0;
    }

    void push(CallNode callNode, Node<O, A> node, BehaviorGraph<O, A> graph) {
        queue.add(new Entry<>(callNode, node, graph, pushCount++));
    }

    Optional<Entry<O, A>> pop() {
        return Optional.ofNullable(queue.poll());
    }

    int size() {
        return queue.size();
    }

    static class Entry<O, A> {
        private final CallNode callNode;
        private final Node<O, A> node;
        private final BehaviorGraph<O, A> graph;
        private final long sequence;

        private Entry(CallNode callNode, Node<O, A> node, BehaviorGraph<O, A> graph, long sequence) {
            this.callNode = callNode;
            this.node = node;
            this.graph = graph;
            this.sequence = sequence;
        }

        CallNode getCallNode() {
            return callNode;
        }

        Node<O, A> getNode() {
            return node;
        }

        BehaviorGraph<O, A> getGraph() {
            return graph;
        }

        long getSequence() {
            return sequence;
        }
    }
}
