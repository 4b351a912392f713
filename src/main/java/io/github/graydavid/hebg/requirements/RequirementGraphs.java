/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.requirements;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import io.github.graydavid.hebg.core.Behavior;
import io.github.graydavid.hebg.core.BehaviorGraph;
import io.github.graydavid.hebg.core.Edge;
import io.github.graydavid.hebg.core.Node;
import io.github.graydavid.hebg.core.NodeKind;
import io.github.graydavid.hebg.core.UnresolvedBehaviorException;

/** Builds {@link RequirementGraph}s. */
public class RequirementGraphs {
    private RequirementGraphs() {}

    /**
     * Builds the requirement graph of behaviors. A behavior requires every behavior in its own graph, except for those
     * that are only reachable through an alternative to an empty node: since an empty node (doing nothing) is always an
     * option there, whatever the alternatives use isn't strictly needed. Each such alternative path cancels out one
     * occurrence of each behavior it reaches.
     * 
     * @throws UnresolvedBehaviorException if one of behaviors can't build its own graph.
     */
    public static <O, A> RequirementGraph<O, A> build(List<Behavior<O, A>> behaviors) {
        Map<Behavior<O, A>, BehaviorGraph<O, A>> graphs = new LinkedHashMap<>();
        for (Behavior<O, A> behavior : behaviors) {
            if (!behavior.isBuildable()) {
                throw new UnresolvedBehaviorException(behavior.getReferenceName(),
                        "All behaviors in a requirement graph must be able to build their own graph, but '"
                                + behavior + "' can't");
            }
            graphs.put(behavior, behavior.getGraph());
        }

        Set<Behavior<O, A>> nodes = new LinkedHashSet<>(behaviors);
        List<RequirementEdge<O, A>> edges = new ArrayList<>();
        Map<Behavior<O, A>, Integer> dependentCounts = new LinkedHashMap<>();
        for (Map.Entry<Behavior<O, A>, BehaviorGraph<O, A>> entry : graphs.entrySet()) {
            Map<Behavior<O, A>, Integer> degrees = calculateRequirementDegrees(entry.getValue());
            for (Map.Entry<Behavior<O, A>, Integer> degree : degrees.entrySet()) {
                if (degree.getValue() <= 0) {
                    continue;
                }
                Behavior<O, A> requirement = canonical(nodes, degree.getKey());
                nodes.add(requirement);
                int index = dependentCounts.merge(requirement, 1, Integer::sum);
                edges.add(new RequirementEdge<>(requirement, entry.getKey(), index));
            }
        }
        return new RequirementGraph<>(nodes, edges);
    }

    private static <O, A> Behavior<O, A> canonical(Set<Behavior<O, A>> nodes, Behavior<O, A> behavior) {
        return nodes.stream().filter(behavior::equals).findFirst().orElse(behavior);
    }

    /** Counts each behavior's occurrences in graph, less the alternative paths to empty nodes that reach it. */
    private static <O, A> Map<Behavior<O, A>, Integer> calculateRequirementDegrees(BehaviorGraph<O, A> graph) {
        Map<Behavior<O, A>, Integer> degrees = new LinkedHashMap<>();
        for (Node<O, A> node : graph.getNodes()) {
            if (node.getKind() == NodeKind.BEHAVIOR) {
                degrees.merge((Behavior<O, A>) node, 1, Integer::sum);
            }
        }
        for (Node<O, A> node : graph.getNodes()) {
            if (node.getKind() == NodeKind.EMPTY) {
                subtractAlternativesToEmpty(graph, node, degrees);
            }
        }
        return degrees;
    }

    private static <O, A> void subtractAlternativesToEmpty(BehaviorGraph<O, A> graph, Node<O, A> empty,
            Map<Behavior<O, A>, Integer> degrees) {
        List<Edge<O, A>> emptyEdges = graph.getOutgoingEdges(empty);
        if (emptyEdges.isEmpty()) {
            return;
        }
        Node<O, A> successor = emptyEdges.get(0).getTo();
        int index = emptyEdges.get(0).getIndex();
        List<Node<O, A>> alternatives = graph.getIncomingEdges(successor)
                .stream()
                .filter(edge -> edge.getIndex() == index)
                .map(Edge::getFrom)
                .collect(Collectors.toList());

        BehaviorGraph.Builder<O, A> cut = graph.toBuilder();
        alternatives.forEach(alternative -> cut.removeEdge(alternative, successor));
        BehaviorGraph<O, A> cutGraph = cut.build();
        for (Node<O, A> alternative : alternatives) {
            for (Node<O, A> descendant : descendants(cutGraph, alternative)) {
                if (descendant.getKind() == NodeKind.BEHAVIOR) {
                    degrees.merge((Behavior<O, A>) descendant, -1, Integer::sum);
                }
            }
        }
    }

    /** Returns every node reachable from start, not including start itself (unless it's on a cycle). */
    private static <O, A> Set<Node<O, A>> descendants(BehaviorGraph<O, A> graph, Node<O, A> start) {
        Set<Node<O, A>> visited = new HashSet<>();
        Deque<Node<O, A>> toVisit = new ArrayDeque<>(graph.getSuccessors(start));
        while (!toVisit.isEmpty()) {
            Node<O, A> node = toVisit.poll();
            if (visited.add(node)) {
                toVisit.addAll(graph.getSuccessors(node));
            }
        }
        return visited;
    }
}
