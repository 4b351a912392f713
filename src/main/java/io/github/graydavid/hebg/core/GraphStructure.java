/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The node and edge bookkeeping shared by {@link BehaviorGraph} and its Builder. Nodes are canonicalized by name: the
 * first instance added under a name is the one stored, and edges always point at stored instances. All iteration
 * orders are insertion orders.
 */
class GraphStructure<O, A> {
    private final Map<Node<O, A>, Node<O, A>> nodes;
    private final Map<Node<O, A>, Map<Node<O, A>, Edge<O, A>>> outgoing;
    private final Map<Node<O, A>, Map<Node<O, A>, Edge<O, A>>> incoming;

    GraphStructure() {
        this.nodes = new LinkedHashMap<>();
        this.outgoing = new LinkedHashMap<>();
        this.incoming = new LinkedHashMap<>();
    }

    GraphStructure<O, A> copy() {
        GraphStructure<O, A> copy = new GraphStructure<>();
        nodes.keySet().forEach(copy::addNode);
        getEdges().forEach(copy::putEdge);
        return copy;
    }

    Node<O, A> addNode(Node<O, A> node) {
        Node<O, A> existing = nodes.get(node);
        if (existing != null) {
            return existing;
        }
        nodes.put(node, node);
        outgoing.put(node, new LinkedHashMap<>());
        incoming.put(node, new LinkedHashMap<>());
        return node;
    }

    boolean contains(Node<O, A> node) {
        return nodes.containsKey(node);
    }

    Optional<Node<O, A>> findNode(String name) {
        return nodes.keySet().stream().filter(node -> node.getName().equals(name)).findFirst();
    }

    Set<Node<O, A>> getNodes() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(nodes.keySet()));
    }

    Optional<Edge<O, A>> findEdge(Node<O, A> from, Node<O, A> to) {
        Map<Node<O, A>, Edge<O, A>> fromEdges = outgoing.get(from);
        return fromEdges == null ? Optional.empty() : Optional.ofNullable(fromEdges.get(to));
    }

    /** Adds an edge between the stored versions of from and to (adding them if needed), replacing any existing one. */
    Edge<O, A> putEdge(Edge<O, A> edge) {
        Node<O, A> from = addNode(edge.getFrom());
        Node<O, A> to = addNode(edge.getTo());
        Edge<O, A> canonical = new Edge<>(from, to, edge.getIndex());
        outgoing.get(from).put(to, canonical);
        incoming.get(to).put(from, canonical);
        return canonical;
    }

    void removeEdge(Node<O, A> from, Node<O, A> to) {
        Map<Node<O, A>, Edge<O, A>> fromEdges = outgoing.get(from);
        if (fromEdges == null || fromEdges.remove(to) == null) {
            throw new IllegalArgumentException(String.format("Edge '%s'->'%s' is not part of this graph", from, to));
        }
        incoming.get(to).remove(from);
    }

    void removeNode(Node<O, A> node) {
        requireContains(node);
        new ArrayList<>(incoming.get(node).keySet()).forEach(from -> removeEdge(from, node));
        new ArrayList<>(outgoing.get(node).keySet()).forEach(to -> removeEdge(node, to));
        nodes.remove(node);
        outgoing.remove(node);
        incoming.remove(node);
    }

    List<Edge<O, A>> getEdges() {
        return outgoing.values()
                .stream()
                .flatMap(edges -> edges.values().stream())
                .collect(Collectors.toUnmodifiableList());
    }

    List<Edge<O, A>> getOutgoingEdges(Node<O, A> node) {
        requireContains(node);
        return List.copyOf(outgoing.get(node).values());
    }

    List<Edge<O, A>> getIncomingEdges(Node<O, A> node) {
        requireContains(node);
        return List.copyOf(incoming.get(node).values());
    }

    List<Node<O, A>> getRoots() {
        return nodes.keySet()
                .stream()
                .filter(node -> incoming.get(node).isEmpty())
                .collect(Collectors.toUnmodifiableList());
    }

    private void requireContains(Node<O, A> node) {
        if (!nodes.containsKey(node)) {
            String message = String.format("Node '%s' is not part of this graph", node);
            throw new IllegalArgumentException(message);
        }
    }
}
