/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.metrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.graydavid.hebg.core.Action;
import io.github.graydavid.hebg.core.Behavior;
import io.github.graydavid.hebg.core.BehaviorGraph;
import io.github.graydavid.hebg.core.Edge;
import io.github.graydavid.hebg.core.EmptyNode;
import io.github.graydavid.hebg.core.FeatureCondition;
import io.github.graydavid.hebg.core.Levels;
import io.github.graydavid.hebg.core.Node;
import io.github.graydavid.hebg.core.NodeKind;

/** Computes node usage histograms for behavior graphs. */
public class Histograms {
    private static final Logger LOGGER = LoggerFactory.getLogger(Histograms.class);

    private Histograms() {}

    /**
     * Computes which nodes graph uses, assuming that whenever several successors share an edge index, the least complex
     * one is taken. Each node's usage is the sum of its chosen successors' usages plus its own contribution:
     * <ul>
     * <li>Actions, feature conditions, and behaviors count once and add their complexity.
     * <li>Empty nodes count nothing and add nothing.
     * <li>Behaviors that are currently being searched (including graph's own subject) count nothing and add infinite
     * complexity, so that they're never chosen over an alternative.
     * </ul>
     * The result is the usage of the first root, without the graph's subject.
     * 
     * @throws io.github.graydavid.hebg.core.CyclicStructureException if graph has a cycle.
     */
    public static <O, A> UsageAndComplexity<O, A> usageAndComplexity(BehaviorGraph<O, A> graph) {
        return usageAndComplexity(graph, Set.of());
    }

    /**
     * Same as {@link #usageAndComplexity(BehaviorGraph)}, except that the behaviors with the given reference names are
     * also considered to be currently searched.
     */
    public static <O, A> UsageAndComplexity<O, A> usageAndComplexity(BehaviorGraph<O, A> graph,
            Set<String> behaviorsInSearch) {
        Set<String> inSearch = new HashSet<>(behaviorsInSearch);
        inSearch.add(graph.getBehavior().getReferenceName());
        OwnContribution<O, A> ownContribution = new OwnContribution<>(inSearch);

        List<Node<O, A>> order = new ArrayList<>(Levels.topologicalOrder(graph));
        Collections.reverse(order);
        Map<Node<O, A>, UsageAndComplexity<O, A>> results = new HashMap<>();
        for (Node<O, A> node : order) {
            Histogram<O, A> histogram = Histogram.empty();
            double complexity = 0;
            for (Node<O, A> chosen : chooseCheapestSuccessors(graph, node, results)) {
                UsageAndComplexity<O, A> chosenResult = results.get(chosen);
                histogram = histogram.plus(chosenResult.getHistogram());
                complexity += chosenResult.getComplexity();
            }
            UsageAndComplexity<O, A> own = node.accept(ownContribution);
            results.put(node, new UsageAndComplexity<>(histogram.plus(own.getHistogram()),
                    complexity + own.getComplexity()));
        }

        List<Node<O, A>> roots = graph.getRoots();
        if (roots.isEmpty()) {
            return new UsageAndComplexity<>(Histogram.empty(), 0);
        }
        if (roots.size() > 1) {
            LOGGER.warn("Graph for '{}' has {} roots. Only the first, '{}', is used: {}", graph.getBehavior(),
                    roots.size(), roots.get(0), roots);
        }
        UsageAndComplexity<O, A> rootResult = results.get(roots.get(0));
        return new UsageAndComplexity<>(rootResult.getHistogram().without(graph.getBehavior()),
                rootResult.getComplexity());
    }

    /** Picks the least complex successor of each edge index group, the first one winning ties. */
    private static <O, A> List<Node<O, A>> chooseCheapestSuccessors(BehaviorGraph<O, A> graph, Node<O, A> node,
            Map<Node<O, A>, UsageAndComplexity<O, A>> results) {
        Map<Integer, Node<O, A>> cheapestByIndex = new LinkedHashMap<>();
        for (Edge<O, A> edge : graph.getOutgoingEdges(node)) {
            Node<O, A> cheapest = cheapestByIndex.get(edge.getIndex());
            if (cheapest == null
                    || results.get(edge.getTo()).getComplexity() < results.get(cheapest).getComplexity()) {
                cheapestByIndex.put(edge.getIndex(), edge.getTo());
            }
        }
        return new ArrayList<>(cheapestByIndex.values());
    }

    private static class OwnContribution<O, A> implements Node.Visitor<O, A, UsageAndComplexity<O, A>> {
        private final Set<String> inSearch;

        private OwnContribution(Set<String> inSearch) {
            this.inSearch = inSearch;
        }

        @Override
        public UsageAndComplexity<O, A> visitAction(Action<O, A> action) {
            return countOnce(action);
        }

        @Override
        public UsageAndComplexity<O, A> visitFeatureCondition(FeatureCondition<O, A> featureCondition) {
            return countOnce(featureCondition);
        }

        @Override
        public UsageAndComplexity<O, A> visitBehavior(Behavior<O, A> behavior) {
            if (inSearch.contains(behavior.getReferenceName())) {
                return new UsageAndComplexity<>(Histogram.empty(), Double.POSITIVE_INFINITY);
            }
            return countOnce(behavior);
        }

        @Override
        public UsageAndComplexity<O, A> visitEmpty(EmptyNode<O, A> empty) {
            return new UsageAndComplexity<>(Histogram.empty(), 0);
        }

        private UsageAndComplexity<O, A> countOnce(Node<O, A> node) {
            return new UsageAndComplexity<>(Histogram.of(node, 1), node.getComplexity());
        }
    }

    /** Computes the histogram of each behavior's own graph. The result iterates in the order of behaviors. */
    public static <O, A> Map<Behavior<O, A>, Histogram<O, A>> ofBehaviors(List<Behavior<O, A>> behaviors) {
        Map<Behavior<O, A>, Histogram<O, A>> histograms = new LinkedHashMap<>();
        for (Behavior<O, A> behavior : behaviors) {
            histograms.put(behavior, usageAndComplexity(behavior.getGraph()).getHistogram());
        }
        return Collections.unmodifiableMap(histograms);
    }

    /**
     * Computes graph's histogram across behavior boundaries: every behavior in the histogram is expanded into its own
     * histogram, once per use, and so on until each behavior's count matches the number of times it was expanded.
     * Behaviors are resolved through graph (see {@link BehaviorGraph#resolveGraphOf(Behavior)}). Those that can't be
     * resolved are left in the histogram unexpanded.
     * 
     * Each behavior's histogram is computed once, treating every behavior expanded so far as being searched. That
     * keeps mutually recursive behaviors from expanding each other forever.
     */
    public static <O, A> Histogram<O, A> cumulative(BehaviorGraph<O, A> graph) {
        Set<String> inSearch = new HashSet<>();
        inSearch.add(graph.getBehavior().getReferenceName());
        Map<String, Optional<Histogram<O, A>>> behaviorHistograms = new HashMap<>();
        Map<String, Integer> expandedCounts = new HashMap<>();

        Histogram<O, A> cumulative = usageAndComplexity(graph).getHistogram();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Node<O, A> node : new ArrayList<>(cumulative.getNodes())) {
                if (node.getKind() != NodeKind.BEHAVIOR) {
                    continue;
                }
                Behavior<O, A> behavior = (Behavior<O, A>) node;
                String name = behavior.getReferenceName();
                int unexpanded = cumulative.getCount(behavior) - expandedCounts.getOrDefault(name, 0);
                if (unexpanded <= 0) {
                    continue;
                }
                Optional<Histogram<O, A>> expansion = behaviorHistograms.get(name);
                if (expansion == null) {
                    inSearch.add(name);
                    expansion = graph.resolveGraphOf(behavior)
                            .map(behaviorGraph -> usageAndComplexity(behaviorGraph, inSearch).getHistogram());
                    behaviorHistograms.put(name, expansion);
                }
                if (expansion.isPresent()) {
                    LOGGER.debug("Expanding '{}' {} more times into {}", behavior, unexpanded, expansion.get());
                    cumulative = cumulative.plus(expansion.get().times(unexpanded));
                    expandedCounts.merge(name, unexpanded, Integer::sum);
                    changed = true;
                }
            }
        }
        return cumulative;
    }
}
