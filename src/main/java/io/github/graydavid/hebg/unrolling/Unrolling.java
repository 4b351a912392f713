/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.unrolling;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.graydavid.hebg.core.Behavior;
import io.github.graydavid.hebg.core.BehaviorGraph;
import io.github.graydavid.hebg.core.Edge;
import io.github.graydavid.hebg.core.Node;
import io.github.graydavid.hebg.core.NodeKind;

/**
 * Flattens behavior graphs by recursively replacing every {@link Behavior} node with the (already flattened) graph it
 * resolves to. Incoming edges of a replaced behavior are redirected to each root of its graph. Behaviors that can't be
 * resolved stay in place as leaves. Unrolling never modifies its input: every step works on a builder copy.
 */
public class Unrolling {
    private static final Logger LOGGER = LoggerFactory.getLogger(Unrolling.class);

    private Unrolling() {}

    /** Unrolls graph with {@link UnrollOptions#defaults()}. */
    public static <O, A> UnrolledGraph<O, A> unroll(BehaviorGraph<O, A> graph) {
        return unroll(graph, UnrollOptions.defaults());
    }

    public static <O, A> UnrolledGraph<O, A> unroll(BehaviorGraph<O, A> graph, UnrollOptions options) {
        return new Session<O, A>(Objects.requireNonNull(options)).unroll(graph);
    }

    /**
     * The state of a single top-level unroll. Behaviors currently being unrolled are tracked by reference name to
     * detect loops, and completed non-looping results are reused when the same behavior shows up again.
     */
    private static class Session<O, A> {
        private final UnrollOptions options;
        private final Set<String> inProgress;
        private final Map<String, UnrolledGraph<O, A>> finished;

        private Session(UnrollOptions options) {
            this.options = options;
            this.inProgress = new HashSet<>();
            this.finished = new HashMap<>();
        }

        private UnrolledGraph<O, A> unroll(BehaviorGraph<O, A> graph) {
            String name = graph.getBehavior().getReferenceName();
            inProgress.add(name);
            BehaviorGraph.Builder<O, A> builder = graph.toBuilder();
            boolean looping = false;
            for (Node<O, A> node : graph.getNodes()) {
                if (node.getKind() == NodeKind.BEHAVIOR && builder.contains(node)) {
                    looping |= inline(graph, builder, (Behavior<O, A>) node);
                }
            }
            inProgress.remove(name);
            UnrolledGraph<O, A> result = new UnrolledGraph<>(builder.build(), looping);
            if (!looping) {
                finished.put(name, result);
            }
            return result;
        }

        /** Replaces behavior in builder with its unrolled graph where possible. Returns whether a loop was found. */
        private boolean inline(BehaviorGraph<O, A> host, BehaviorGraph.Builder<O, A> builder,
                Behavior<O, A> behavior) {
            String referenceName = behavior.getReferenceName();
            if (inProgress.contains(referenceName)) {
                LOGGER.debug("Behavior '{}' loops back to '{}' in {}", behavior, referenceName, host.getBehavior());
                if (options.isCutLoopingAlternatives()) {
                    cut(builder, behavior);
                }
                return true;
            }

            UnrolledGraph<O, A> unrolled = finished.get(referenceName);
            if (unrolled == null) {
                Optional<BehaviorGraph<O, A>> resolved = host.resolveGraphOf(behavior);
                if (resolved.isEmpty()) {
                    LOGGER.debug("Behavior '{}' can't be resolved, so it stays a leaf", behavior);
                    return false;
                }
                unrolled = unroll(resolved.get());
            }

            BehaviorGraph<O, A> inlined = unrolled.getGraph();
            if (inlined.getNodes().isEmpty()) {
                if (options.isCutLoopingAlternatives()) {
                    cut(builder, behavior);
                }
                return unrolled.isLooping();
            }
            if (options.isAddPrefix() && inlined.getNodes().size() > 1) {
                inlined = inlined.withNodeNamePrefix(behavior.getName() + options.getSeparator());
            }
            if (inlined.contains(behavior)) {
                return true;
            }

            splice(builder, behavior, inlined);
            LOGGER.debug("Inlined behavior '{}' with {} nodes", behavior, inlined.getNodes().size());
            return unrolled.isLooping();
        }

        private void splice(BehaviorGraph.Builder<O, A> builder, Behavior<O, A> behavior,
                BehaviorGraph<O, A> inlined) {
            List<Edge<O, A>> incoming = builder.getIncomingEdges(behavior);
            List<Node<O, A>> roots = inlined.getRoots();
            builder.addGraph(inlined);
            for (Edge<O, A> edge : incoming) {
                for (Node<O, A> root : roots) {
                    builder.addEdgeIfAbsent(edge.getFrom(), root, edge.getIndex());
                }
            }
            builder.removeNode(behavior);
        }

        /**
         * Removes node along with every branch that depends on it. A feature condition's branch is dead once no edge
         * with its index remains, and any other node is dead once it has no successors left. Nodes orphaned by the
         * removal are pruned as well.
         */
        private void cut(BehaviorGraph.Builder<O, A> builder, Node<O, A> node) {
            Set<Node<O, A>> rootsBefore = new HashSet<>(builder.getRoots());
            cutWithDeadBranches(builder, node);
            List<Node<O, A>> orphans = findOrphans(builder, rootsBefore);
            while (!orphans.isEmpty()) {
                orphans.forEach(builder::removeNode);
                orphans = findOrphans(builder, rootsBefore);
            }
        }

        private void cutWithDeadBranches(BehaviorGraph.Builder<O, A> builder, Node<O, A> node) {
            if (!builder.contains(node)) {
                return;
            }
            List<Edge<O, A>> incoming = builder.getIncomingEdges(node);
            builder.removeNode(node);
            LOGGER.debug("Cut '{}' from {}", node, builder.getBehavior());
            for (Edge<O, A> edge : incoming) {
                Node<O, A> predecessor = edge.getFrom();
                if (builder.contains(predecessor) && isDead(builder, predecessor, edge.getIndex())) {
                    cutWithDeadBranches(builder, predecessor);
                }
            }
        }

        private boolean isDead(BehaviorGraph.Builder<O, A> builder, Node<O, A> node, int removedIndex) {
            List<Edge<O, A>> remaining = builder.getOutgoingEdges(node);
            if (node.getKind() == NodeKind.FEATURE_CONDITION) {
                return remaining.stream().noneMatch(edge -> edge.getIndex() == removedIndex);
            }
            return remaining.isEmpty();
        }

        private List<Node<O, A>> findOrphans(BehaviorGraph.Builder<O, A> builder, Set<Node<O, A>> rootsBefore) {
            return builder.getRoots()
                    .stream()
                    .filter(root -> !rootsBefore.contains(root))
                    .collect(Collectors.toList());
        }
    }
}
