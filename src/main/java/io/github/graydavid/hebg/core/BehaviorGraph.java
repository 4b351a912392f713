/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The decision graph owned by a {@link Behavior} (its "subject"). Nodes are {@link Node}s de-duplicated by name and
 * edges are {@link Edge}s: directed, indexed, and at most one per ordered pair of nodes. Nodes without predecessors are
 * roots. Evaluation starts from the roots and ends at the first {@link Action} reached through the cheapest path (see
 * {@link GraphCall}).
 * 
 * BehaviorGraphs are immutable. Use {@link #builder(Behavior)} to create one and {@link #toBuilder()} to derive a
 * modified copy. Every graph also carries a {@link BehaviorRegistry}, which it uses to resolve {@link Behavior} nodes
 * that are pure references.
 */
public class BehaviorGraph<O, A> implements IndexedGraph<Node<O, A>> {
    private final Behavior<O, A> behavior;
    private final BehaviorRegistry<O, A> registry;
    private final GraphStructure<O, A> structure;

    private BehaviorGraph(Behavior<O, A> behavior, BehaviorRegistry<O, A> registry, GraphStructure<O, A> structure) {
        this.behavior = behavior;
        this.registry = registry;
        this.structure = structure;
    }

    /** Starts building a graph for behavior that resolves references against a new, empty registry. */
    public static <O, A> Builder<O, A> builder(Behavior<O, A> behavior) {
        return builder(behavior, new BehaviorRegistry<>());
    }

    public static <O, A> Builder<O, A> builder(Behavior<O, A> behavior, BehaviorRegistry<O, A> registry) {
        return new Builder<>(behavior, registry, new GraphStructure<>());
    }

    /** Starts building a modified copy of this graph. This graph is left unchanged. */
    public Builder<O, A> toBuilder() {
        return new Builder<>(behavior, registry, structure.copy());
    }

    /** The subject of this graph: the Behavior whose decisions the graph describes. */
    public Behavior<O, A> getBehavior() {
        return behavior;
    }

    public BehaviorRegistry<O, A> getRegistry() {
        return registry;
    }

    @Override
    public Set<Node<O, A>> getNodes() {
        return structure.getNodes();
    }

    public boolean contains(Node<O, A> node) {
        return structure.contains(node);
    }

    /** Returns the instance of node stored in this graph (the first one added under its name). */
    public Optional<Node<O, A>> findNode(String name) {
        return structure.findNode(name);
    }

    /** Returns all edges, grouped by source node in node insertion order. */
    public List<Edge<O, A>> getEdges() {
        return structure.getEdges();
    }

    public Optional<Edge<O, A>> getEdge(Node<O, A> from, Node<O, A> to) {
        return structure.findEdge(from, to);
    }

    @Override
    public List<Edge<O, A>> getOutgoingEdges(Node<O, A> node) {
        return structure.getOutgoingEdges(node);
    }

    @Override
    public List<Edge<O, A>> getIncomingEdges(Node<O, A> node) {
        return structure.getIncomingEdges(node);
    }

    public List<Node<O, A>> getSuccessors(Node<O, A> node) {
        return getOutgoingEdges(node).stream().map(Edge::getTo).collect(Collectors.toUnmodifiableList());
    }

    public List<Node<O, A>> getPredecessors(Node<O, A> node) {
        return getIncomingEdges(node).stream().map(Edge::getFrom).collect(Collectors.toUnmodifiableList());
    }

    /** Returns the nodes without predecessors, in insertion order. */
    public List<Node<O, A>> getRoots() {
        return structure.getRoots();
    }

    /**
     * Finds the graph that evaluating a Behavior node inside this graph would descend into: the behavior's own graph if
     * it's buildable; otherwise, the graph of the buildable behavior registered under its reference name in this
     * graph's registry.
     * 
     * @return an empty Optional if the behavior can't be resolved either way.
     * @throws GraphBuildException if a graph factory fails.
     */
    public Optional<BehaviorGraph<O, A>> resolveGraphOf(Behavior<O, A> nodeBehavior) {
        Optional<BehaviorGraph<O, A>> own = nodeBehavior.findGraph();
        if (own.isPresent()) {
            return own;
        }
        return registry.find(nodeBehavior.getReferenceName())
                .filter(Behavior::isBuildable)
                .flatMap(Behavior::findGraph);
    }

    /**
     * Returns a copy of this graph in which every node has been renamed to prefix + its old name. The copy keeps the
     * same subject and registry.
     */
    public BehaviorGraph<O, A> withNodeNamePrefix(String prefix) {
        Objects.requireNonNull(prefix);
        GraphStructure<O, A> renamed = new GraphStructure<>();
        structure.getNodes().forEach(node -> renamed.addNode(node.withName(prefix + node.getName())));
        structure.getEdges().forEach(edge -> {
            Node<O, A> from = renamed.findNode(prefix + edge.getFrom().getName()).get();
            Node<O, A> to = renamed.findNode(prefix + edge.getTo().getName()).get();
            renamed.putEdge(new Edge<>(from, to, edge.getIndex()));
        });
        return new BehaviorGraph<>(behavior, registry, renamed);
    }

    /** Evaluates this graph against observation. Shorthand for {@link GraphCall#evaluate(BehaviorGraph, Object)}. */
    public A call(O observation) {
        return GraphCall.evaluate(this, observation).getAction();
    }

    @Override
    public String toString() {
        return "BehaviorGraph[" + behavior + "]" + getEdges();
    }

    /** A mutable builder for BehaviorGraphs. Not thread-safe. */
    public static class Builder<O, A> {
        private final Behavior<O, A> behavior;
        private final BehaviorRegistry<O, A> registry;
        private final GraphStructure<O, A> structure;

        private Builder(Behavior<O, A> behavior, BehaviorRegistry<O, A> registry, GraphStructure<O, A> structure) {
            this.behavior = Objects.requireNonNull(behavior);
            this.registry = Objects.requireNonNull(registry);
            this.structure = structure;
        }

        public Behavior<O, A> getBehavior() {
            return behavior;
        }

        public BehaviorRegistry<O, A> getRegistry() {
            return registry;
        }

        /** Adds node, unless a node with the same name is already present, in which case this is a no-op. */
        public Builder<O, A> addNode(Node<O, A> node) {
            structure.addNode(Objects.requireNonNull(node));
            return this;
        }

        /**
         * Adds an edge from -> to with the given index, adding either node if not already present.
         * 
         * @throws IllegalArgumentException if there's already an edge from -> to (whatever its index).
         */
        public Builder<O, A> addEdge(Node<O, A> from, Node<O, A> to, int index) {
            Optional<Edge<O, A>> existing = structure.findEdge(from, to);
            if (existing.isPresent()) {
                String message = String.format("Cannot add edge '%s'->'%s' with index '%s': already connected by '%s'",
                        from, to, index, existing.get());
                throw new IllegalArgumentException(message);
            }
            structure.putEdge(new Edge<>(from, to, index));
            return this;
        }

        /** Same as {@link #addEdge(Node, Node, int)}, except does nothing if from and to are already connected. */
        public Builder<O, A> addEdgeIfAbsent(Node<O, A> from, Node<O, A> to, int index) {
            if (structure.findEdge(from, to).isEmpty()) {
                structure.putEdge(new Edge<>(from, to, index));
            }
            return this;
        }

        /** @throws IllegalArgumentException if there's no edge from -> to. */
        public Builder<O, A> removeEdge(Node<O, A> from, Node<O, A> to) {
            structure.removeEdge(from, to);
            return this;
        }

        /**
         * Removes node and every edge touching it.
         * 
         * @throws IllegalArgumentException if node isn't present.
         */
        public Builder<O, A> removeNode(Node<O, A> node) {
            structure.removeNode(node);
            return this;
        }

        /**
         * Adds all nodes and edges of other to this builder. Nodes already present by name are kept as they are, and
         * edges already present (whatever their index) are left untouched.
         */
        public Builder<O, A> addGraph(BehaviorGraph<O, A> other) {
            other.getNodes().forEach(structure::addNode);
            other.getEdges().forEach(edge -> addEdgeIfAbsent(edge.getFrom(), edge.getTo(), edge.getIndex()));
            return this;
        }

        public boolean contains(Node<O, A> node) {
            return structure.contains(node);
        }

        public Set<Node<O, A>> getNodes() {
            return structure.getNodes();
        }

        public List<Edge<O, A>> getOutgoingEdges(Node<O, A> node) {
            return structure.getOutgoingEdges(node);
        }

        public List<Edge<O, A>> getIncomingEdges(Node<O, A> node) {
            return structure.getIncomingEdges(node);
        }

        public List<Node<O, A>> getRoots() {
            return structure.getRoots();
        }

        public BehaviorGraph<O, A> build() {
            return new BehaviorGraph<>(behavior, registry, structure.copy());
        }
    }
}
