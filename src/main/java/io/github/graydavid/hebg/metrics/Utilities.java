/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.metrics;

import java.util.Collection;
import java.util.Map;

import io.github.graydavid.hebg.core.Behavior;

/** Measures of how useful a behavior is for solving a task. */
public class Utilities {
    private Utilities() {}

    /**
     * Answers whether behavior helps any of the behaviors that solve a task: it's one of them, appears in one of their
     * graphs, or is used according to their histograms. Solving behaviors that can't build a graph only count through
     * the first and last checks.
     */
    public static <O, A> boolean isUsefulFor(Behavior<O, A> behavior, Collection<Behavior<O, A>> solvingBehaviors,
            Map<Behavior<O, A>, Histogram<O, A>> histograms) {
        for (Behavior<O, A> solving : solvingBehaviors) {
            if (behavior.equals(solving)) {
                return true;
            }
            if (solving.findGraph().map(graph -> graph.contains(behavior)).orElse(false)) {
                return true;
            }
            Histogram<O, A> histogram = histograms.get(solving);
            if (histogram != null && histogram.getCount(behavior) > 0) {
                return true;
            }
        }
        return false;
    }
}
