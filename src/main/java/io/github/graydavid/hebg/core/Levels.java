/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * The levels of an {@link IndexedGraph}, where predecessors sharing an edge index are alternatives for each other. A
 * node without predecessors has level 0. Any other node has level 1 + the maximum, over its incoming edge index groups,
 * of the minimum level inside the group. In other words, a node sits just above the cheapest way of satisfying each of
 * the groups that it depends on.
 */
public class Levels<N> {
    private final Map<N, Integer> levels;

    private Levels(Map<N, Integer> levels) {
        this.levels = Collections.unmodifiableMap(levels);
    }

    /**
     * Computes the levels of every node in graph.
     * 
     * @throws CyclicStructureException if some node can never be assigned a level (i.e. the graph contains a cycle).
     */
    public static <N> Levels<N> compute(IndexedGraph<N> graph) {
        return compute(graph, true);
    }

    /**
     * Same as {@link #compute(IndexedGraph)}, except every predecessor is required and none is an alternative for
     * another: a node with predecessors has level 1 + the maximum level among them, whatever their edge indexes.
     * 
     * @throws CyclicStructureException if the graph contains a cycle.
     */
    public static <N> Levels<N> computeAllRequired(IndexedGraph<N> graph) {
        return compute(graph, false);
    }

    private static <N> Levels<N> compute(IndexedGraph<N> graph, boolean groupByIndex) {
        Map<N, Integer> levels = new LinkedHashMap<>();
        List<N> remaining = new ArrayList<>(graph.getNodes());
        while (!remaining.isEmpty()) {
            List<N> stillRemaining = new ArrayList<>();
            Map<N, Integer> assigned = new LinkedHashMap<>();
            for (N node : remaining) {
                List<? extends IndexedEdge<N>> incoming = graph.getIncomingEdges(node);
                if (incoming.stream().allMatch(edge -> levels.containsKey(edge.getFrom()))) {
                    assigned.put(node, calculateLevel(incoming, levels, groupByIndex));
                } else {
                    stillRemaining.add(node);
                }
            }
            if (assigned.isEmpty()) {
                throw new CyclicStructureException("Cannot compute levels for nodes in a cycle: " + stillRemaining);
            }
            levels.putAll(assigned);
            remaining = stillRemaining;
        }
        return new Levels<>(levels);
    }

    private static <N> int calculateLevel(List<? extends IndexedEdge<N>> incoming, Map<N, Integer> levels,
            boolean groupByIndex) {
        if (incoming.isEmpty()) {
            return 0;
        }
        if (!groupByIndex) {
            return 1 + incoming.stream().mapToInt(edge -> levels.get(edge.getFrom())).max().getAsInt();
        }
        Map<Integer, Integer> minLevelByIndex = new HashMap<>();
        for (IndexedEdge<N> edge : incoming) {
            minLevelByIndex.merge(edge.getIndex(), levels.get(edge.getFrom()), Math::min);
        }
        return 1 + Collections.max(minLevelByIndex.values());
    }

    /**
     * Orders graph's nodes so that every node comes after all of its predecessors. Among nodes whose predecessors have
     * all been placed, insertion order wins.
     * 
     * @throws CyclicStructureException if the graph contains a cycle.
     */
    public static <N> List<N> topologicalOrder(IndexedGraph<N> graph) {
        Map<N, Integer> unplacedPredecessors = new HashMap<>();
        Deque<N> ready = new ArrayDeque<>();
        for (N node : graph.getNodes()) {
            int count = graph.getIncomingEdges(node).size();
            unplacedPredecessors.put(node, count);
            if (count == 0) {
                ready.add(node);
            }
        }
        List<N> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            N node = ready.poll();
            order.add(node);
            for (IndexedEdge<N> edge : graph.getOutgoingEdges(node)) {
                int count = unplacedPredecessors.merge(edge.getTo(), -1, Integer::sum);
                if (count == 0) {
                    ready.add(edge.getTo());
                }
            }
        }
        if (order.size() != unplacedPredecessors.size()) {
            List<N> cyclic = graph.getNodes()
                    .stream()
                    .filter(node -> !order.contains(node))
                    .collect(Collectors.toList());
            throw new CyclicStructureException("Cannot order nodes in a cycle: " + cyclic);
        }
        return Collections.unmodifiableList(order);
    }

    /** @throws IllegalArgumentException if node isn't part of the graph these levels were computed for. */
    public int getLevel(N node) {
        Integer level = levels.get(Objects.requireNonNull(node));
        if (level == null) {
            throw new IllegalArgumentException("Unknown node: " + node);
        }
        return level;
    }

    /**
     * Returns the nodes grouped by level, in ascending level order. Within a level, nodes keep the order they were
     * assigned.
     */
    public Map<Integer, List<N>> getNodesByLevel() {
        return levels.entrySet()
                .stream()
                .collect(Collectors.groupingBy(Map.Entry::getValue, TreeMap::new,
                        Collectors.mapping(Map.Entry::getKey, Collectors.toList())));
    }

    /** One more than the highest level, or 0 for an empty graph. */
    public int getDepth() {
        return levels.values().stream().mapToInt(level -> level + 1).max().orElse(0);
    }

    public Map<N, Integer> asMap() {
        return levels;
    }

    @Override
    public String toString() {
        return levels.toString();
    }
}
