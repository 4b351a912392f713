/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

import java.util.Objects;
import java.util.Optional;

import io.github.graydavid.onemoretry.Try;

/**
 * A node that owns a nested decision graph. The graph is built lazily by a {@link GraphFactory} the first time it's
 * needed and then cached for the lifetime of the Behavior. A Behavior may also be a pure reference: a name with no
 * factory, meant to be resolved through the {@link BehaviorRegistry} of the graph that contains it.
 * 
 * Copies created through {@link #withName(String)} share the original's build-once cell and keep the original's
 * {@link #getReferenceName()}, so that an inlined, renamed copy still builds at most once and still resolves (and
 * detects cycles) under the name it's registered with.
 */
public final class Behavior<O, A> extends Node<O, A> {
    private final String referenceName;
    private final GraphCell<O, A> cell;

    private Behavior(String name, double complexity, String referenceName, GraphCell<O, A> cell) {
        super(name, NodeKind.BEHAVIOR, complexity);
        this.referenceName = Objects.requireNonNull(referenceName);
        this.cell = cell;
    }

    /** Creates a buildable Behavior with {@link Node#DEFAULT_COMPLEXITY}. */
    public static <O, A> Behavior<O, A> of(String name, GraphFactory<O, A> factory) {
        return of(name, DEFAULT_COMPLEXITY, factory);
    }

    public static <O, A> Behavior<O, A> of(String name, double complexity, GraphFactory<O, A> factory) {
        return new Behavior<>(name, complexity, name, new GraphCell<>(Objects.requireNonNull(factory)));
    }

    /** Creates a name-only reference with {@link Node#DEFAULT_COMPLEXITY}. */
    public static <O, A> Behavior<O, A> reference(String name) {
        return reference(name, DEFAULT_COMPLEXITY);
    }

    public static <O, A> Behavior<O, A> reference(String name, double complexity) {
        return new Behavior<>(name, complexity, name, null);
    }

    /** The name under which this Behavior is looked up in registries. Equal to the name unless this is a copy. */
    public String getReferenceName() {
        return referenceName;
    }

    /** Answers whether this Behavior can build its own graph (i.e. isn't a pure reference). */
    public boolean isBuildable() {
        return cell != null;
    }

    /**
     * Returns this Behavior's own graph, building it on the first call.
     * 
     * @throws UnresolvedBehaviorException if this Behavior is a pure reference.
     * @throws GraphBuildException if the factory failed (now or on the first call).
     */
    public BehaviorGraph<O, A> getGraph() {
        return findGraph().orElseThrow(() -> new UnresolvedBehaviorException(referenceName));
    }

    /**
     * Same as {@link #getGraph()}, except returns an empty Optional for pure references.
     * 
     * @throws GraphBuildException if the factory failed (now or on the first call).
     */
    public Optional<BehaviorGraph<O, A>> findGraph() {
        if (cell == null) {
            return Optional.empty();
        }
        return Optional.of(cell.get(this));
    }

    /** Evaluates this Behavior's own graph. See {@link GraphCall#evaluate(BehaviorGraph, Object)}. */
    public A call(O observation) {
        return GraphCall.evaluate(getGraph(), observation).getAction();
    }

    @Override
    public Behavior<O, A> withName(String name) {
        return new Behavior<>(name, getComplexity(), referenceName, cell);
    }

    @Override
    public <R> R accept(Visitor<O, A, R> visitor) {
        return visitor.visitBehavior(this);
    }

    /** Builds the graph that a Behavior owns. */
    @FunctionalInterface
    public interface GraphFactory<O, A> {
        /**
         * @param behavior the Behavior requesting its graph. The returned graph must have this Behavior as its
         *        subject.
         */
        BehaviorGraph<O, A> build(Behavior<O, A> behavior);
    }

    /**
     * A build-once cell for a graph. Uses double-checked locking so that concurrent first accesses are serialized and
     * the factory runs exactly once, successful or not.
     */
    private static class GraphCell<O, A> {
        private final GraphFactory<O, A> factory;
        private volatile Try<BehaviorGraph<O, A>> built;

        private GraphCell(GraphFactory<O, A> factory) {
            this.factory = factory;
        }

        BehaviorGraph<O, A> get(Behavior<O, A> requester) {
            Try<BehaviorGraph<O, A>> result = built;
            if (result == null) {
                synchronized (this) {
                    result = built;
                    if (result == null) {
                        result = Try.callCatchRuntime(() -> buildFor(requester));
                        built = result;
                    }
                }
            }
            Optional<Throwable> failure = result.getFailure();
            if (failure.isPresent()) {
                throw new GraphBuildException(requester.getReferenceName(), failure.get());
            }
            return result.getSuccess().get();
        }

        private BehaviorGraph<O, A> buildFor(Behavior<O, A> requester) {
            BehaviorGraph<O, A> graph = factory.build(requester);
            if (graph == null) {
                throw new MisbehaviorException(
                        "Graph factory for behavior '" + requester.getReferenceName() + "' returned null");
            }
            if (!graph.getBehavior().getReferenceName().equals(requester.getReferenceName())) {
                String message = String.format(
                        "Graph factory for behavior '%s' built a graph for a different behavior: '%s'",
                        requester.getReferenceName(), graph.getBehavior());
                throw new MisbehaviorException(message);
            }
            return graph;
        }
    }
}
