/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.metrics;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import io.github.graydavid.hebg.core.Behavior;
import io.github.graydavid.hebg.core.Node;
import io.github.graydavid.hebg.core.NodeKind;

/**
 * Complexity measures over behavior histograms (see {@link Histograms#ofBehaviors(List)}). The idea is that a
 * behavior's complexity is the complexity of all the nodes it uses, less what's saved by reusing nodes (and whole
 * behaviors) that were already used before.
 */
public class Complexities {
    private Complexities() {}

    /** How much of a node's complexity is accumulated when it's used a number of times. */
    @FunctionalInterface
    public interface AccumulatedComplexity {
        double accumulated(Node<?, ?> node, int used);
    }

    /**
     * How many uses of a node are saved, given the number of times it's used now and the number of times it was used
     * previously.
     */
    @FunctionalInterface
    public interface SavedComplexity {
        double saved(Node<?, ?> node, int used, int previouslyUsed);
    }

    /**
     * Computes the complexity of behavior, walking its histogram in order. For every node used k times:
     * <ul>
     * <li>its complexity times accumulated(node, k) is added to the total. If the node is a behavior with its own entry
     * in histograms, its complexity is its own (recursively computed) net complexity, and what it saved is carried over
     * as accumulated(node, k) times its saved complexity.
     * <li>for actions and behaviors, its complexity times saved(node, k, p) is added to the saved complexity, where p is
     * the number of times it was used previously.
     * </ul>
     * Nodes used earlier in the histogram count as previously used for the nodes after them.
     * 
     * @param histograms the histogram of every behavior whose complexity should be computed recursively.
     * @param previouslyUsed the uses that happened before behavior.
     * @throws IllegalArgumentException if histograms has no entry for behavior.
     */
    public static <O, A> ComplexityResult generalComplexity(Behavior<O, A> behavior,
            Map<Behavior<O, A>, Histogram<O, A>> histograms, SavedComplexity saved,
            AccumulatedComplexity accumulated, Histogram<O, A> previouslyUsed) {
        Objects.requireNonNull(saved);
        Objects.requireNonNull(accumulated);
        return new GeneralComplexity<>(histograms, saved, accumulated).compute(behavior, previouslyUsed);
    }

    private static class GeneralComplexity<O, A> {
        private final Map<Behavior<O, A>, Histogram<O, A>> histograms;
        private final SavedComplexity savedComplexity;
        private final AccumulatedComplexity accumulatedComplexity;
        private final Set<String> inProgress;

        private GeneralComplexity(Map<Behavior<O, A>, Histogram<O, A>> histograms, SavedComplexity savedComplexity,
                AccumulatedComplexity accumulatedComplexity) {
            this.histograms = Objects.requireNonNull(histograms);
            this.savedComplexity = savedComplexity;
            this.accumulatedComplexity = accumulatedComplexity;
            this.inProgress = new HashSet<>();
        }

        private ComplexityResult compute(Behavior<O, A> behavior, Histogram<O, A> previouslyUsed) {
            Histogram<O, A> histogram = histograms.get(behavior);
            if (histogram == null) {
                throw new IllegalArgumentException("No histogram found for behavior: " + behavior);
            }
            inProgress.add(behavior.getReferenceName());

            double total = 0;
            double saved = 0;
            Histogram<O, A> previous = previouslyUsed;
            for (Map.Entry<Node<O, A>, Integer> entry : histogram.asMap().entrySet()) {
                Node<O, A> node = entry.getKey();
                int used = entry.getValue();
                int previousCount = previous.getCount(node);
                double accumulated = accumulatedComplexity.accumulated(node, used);

                double nodeComplexity;
                if (isExpandable(node)) {
                    ComplexityResult nested = compute((Behavior<O, A>) node, previous);
                    previous = previous.plus(histograms.get(node));
                    total += nested.getSaved() * accumulated;
                    saved += nested.getSaved() * accumulated;
                    nodeComplexity = nested.getComplexity();
                } else {
                    nodeComplexity = node.getComplexity();
                }

                total += nodeComplexity * accumulated;
                if (node.getKind() == NodeKind.BEHAVIOR || node.getKind() == NodeKind.ACTION) {
                    saved += nodeComplexity * savedComplexity.saved(node, used, previousCount);
                }
                previous = previous.plus(node, used);
            }

            inProgress.remove(behavior.getReferenceName());
            return new ComplexityResult(total - saved, saved);
        }

        private boolean isExpandable(Node<O, A> node) {
            return node.getKind() == NodeKind.BEHAVIOR && histograms.containsKey(node)
                    && !inProgress.contains(((Behavior<O, A>) node).getReferenceName());
        }
    }

    /**
     * The general complexity where each use accumulates the node's full complexity, and where every use but the very
     * first one (across previous and current uses) is saved: saved(k, p) = max(0, min(k, p + k - 1)).
     */
    public static <O, A> ComplexityResult learningComplexity(Behavior<O, A> behavior,
            Map<Behavior<O, A>, Histogram<O, A>> histograms) {
        return learningComplexity(behavior, histograms, Histogram.empty());
    }

    public static <O, A> ComplexityResult learningComplexity(Behavior<O, A> behavior,
            Map<Behavior<O, A>, Histogram<O, A>> histograms, Histogram<O, A> previouslyUsed) {
        return generalComplexity(behavior, histograms, Complexities::learningSaved, (node, used) -> used,
                previouslyUsed);
    }

    private static double learningSaved(Node<?, ?> node, int used, int previouslyUsed) {
        return Math.max(0, Math.min(used, previouslyUsed + used - 1));
    }

    /**
     * Computes the learning complexity of each behavior in order, as if they were learned one after the other: every
     * behavior counts the uses of all the behaviors before it (and those behaviors themselves) as previously used.
     */
    public static <O, A> Map<Behavior<O, A>, ComplexityResult> learningComplexities(
            List<Behavior<O, A>> orderedBehaviors, Map<Behavior<O, A>, Histogram<O, A>> histograms) {
        Map<Behavior<O, A>, ComplexityResult> results = new LinkedHashMap<>();
        Histogram<O, A> previouslyUsed = Histogram.empty();
        for (Behavior<O, A> behavior : orderedBehaviors) {
            results.put(behavior, learningComplexity(behavior, histograms, previouslyUsed));
            previouslyUsed = previouslyUsed.plus(histograms.get(behavior)).plus(behavior, 1);
        }
        return Collections.unmodifiableMap(results);
    }
}
