/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One evaluation of a {@link BehaviorGraph} against an observation: a global best-first search for an {@link Action}.
 * 
 * The search starts by pushing the graph's roots onto a {@link Frontier} and then repeatedly pops the cheapest entry.
 * Popping an action ends the search. Popping a feature condition pushes the successors on the branch it selects.
 * Popping an empty node pushes all of its successors. Popping a behavior pushes the roots of the behavior's resolved
 * graph, unless the behavior is already being evaluated further up the same path, in which case that path is a dead
 * end. The same goes for a feature condition or empty node that already appears further up the path within the same
 * graph. Since nested graphs share the one frontier, an alternative deep inside a nested behavior competes directly with
 * alternatives at the top level. Everything the search touches is recorded in a {@link CallGraph}.
 * 
 * A GraphCall is confined to the thread that creates it. Different calls (even against the same graph) share nothing
 * but the graphs themselves.
 */
public class GraphCall<O, A> {
    private static final Logger LOGGER = LoggerFactory.getLogger(GraphCall.class);

    private final BehaviorGraph<O, A> graph;
    private final O observation;
    private final CallOptions options;
    private final CallGraph<O, A> callGraph;
    private final Frontier<O, A> frontier;
    private final Map<FeatureCondition<O, A>, Integer> featureConditionResults;
    private long popCount;
    private A action;

    private GraphCall(BehaviorGraph<O, A> graph, O observation, CallOptions options) {
        this.graph = Objects.requireNonNull(graph);
        this.observation = observation;
        this.options = Objects.requireNonNull(options);
        this.callGraph = new CallGraph<>(graph.getBehavior());
        this.frontier = new Frontier<>();
        this.featureConditionResults = new HashMap<>();
        this.popCount = 0;
    }

    /** Evaluates graph against observation with {@link CallOptions#defaults()}. */
    public static <O, A> GraphCall<O, A> evaluate(BehaviorGraph<O, A> graph, O observation) {
        return evaluate(graph, observation, CallOptions.defaults());
    }

    /**
     * Evaluates graph against observation, returning the completed call.
     * 
     * @throws CallException if the evaluation fails. The cause describes the failure: {@link NoViablePathException},
     *         {@link UnresolvedBehaviorException}, {@link InvalidBranchIndexException},
     *         {@link FrontierBudgetExceededException}, {@link GraphBuildException}, {@link MisbehaviorException}, or
     *         anything thrown by a user-supplied condition.
     */
    public static <O, A> GraphCall<O, A> evaluate(BehaviorGraph<O, A> graph, O observation, CallOptions options) {
        GraphCall<O, A> call = new GraphCall<>(graph, observation, options);
        try {
            call.action = call.search();
        } catch (RuntimeException e) {
            throw new CallException(graph.getBehavior(), call.callGraph, e);
        }
        return call;
    }

    private A search() {
        pushCandidates(callGraph.getRoot(), graph.getRoots(), graph);
        Resolver resolver = new Resolver();
        while (true) {
            checkBudget();
            Optional<Frontier.Entry<O, A>> next = frontier.pop();
            if (next.isEmpty()) {
                String message = String.format("No viable path for behavior '%s' after %s frontier pops",
                        graph.getBehavior(), popCount);
                throw new NoViablePathException(message);
            }
            popCount++;
            Frontier.Entry<O, A> entry = next.get();
            LOGGER.debug("Popped '{}' at {} with complexity {} ({} entries left)", entry.getNode(),
                    entry.getCallNode(), entry.getNode().getComplexity(), frontier.size());
            resolver.current = entry;
            Optional<A> resolved = entry.getNode().accept(resolver);
            if (resolved.isPresent()) {
                return resolved.get();
            }
        }
    }

    private void checkBudget() {
        if (options.getFrontierPopBudget().isPresent()) {
            long budget = options.getFrontierPopBudget().getAsLong();
            if (popCount >= budget) {
                throw new FrontierBudgetExceededException(budget);
            }
        }
    }

    private void pushCandidates(CallNode parent, List<Node<O, A>> candidates, BehaviorGraph<O, A> context) {
        List<CallNode> added = callGraph.addCandidates(parent, candidates);
        for (int i = 0; i < added.size(); ++i) {
            frontier.push(added.get(i), candidates.get(i), context);
        }
    }

    /** Resolves the current frontier entry, returning the action if the search is over. */
    private class Resolver implements Node.Visitor<O, A, Optional<A>> {
        private Frontier.Entry<O, A> current;

        @Override
        public Optional<A> visitAction(Action<O, A> actionNode) {
            callGraph.markCalled(current.getCallNode());
            return Optional.of(actionNode.evaluate(observation));
        }

        @Override
        public Optional<A> visitFeatureCondition(FeatureCondition<O, A> featureCondition) {
            if (failIfRevisited(featureCondition)) {
                return Optional.empty();
            }
            Integer index = featureConditionResults.get(featureCondition);
            if (index == null) {
                index = featureCondition.evaluate(observation);
                featureConditionResults.put(featureCondition, index);
            }
            int branch = index;
            List<Node<O, A>> successors = current.getGraph()
                    .getOutgoingEdges(featureCondition)
                    .stream()
                    .filter(edge -> edge.getIndex() == branch)
                    .map(Edge::getTo)
                    .collect(Collectors.toList());
            if (successors.isEmpty()) {
                throw new InvalidBranchIndexException(featureCondition, branch);
            }
            callGraph.markCalled(current.getCallNode());
            pushCandidates(current.getCallNode(), successors, current.getGraph());
            return Optional.empty();
        }

        @Override
        public Optional<A> visitBehavior(Behavior<O, A> behavior) {
            CallNode callNode = current.getCallNode();
            if (callGraph.hasAncestorBehavior(callNode, behavior.getReferenceName())) {
                LOGGER.debug("Behavior '{}' at {} loops back on itself", behavior, callNode);
                callGraph.markFailure(callNode);
                return Optional.empty();
            }
            BehaviorGraph<O, A> nested = current.getGraph()
                    .resolveGraphOf(behavior)
                    .orElseThrow(() -> new UnresolvedBehaviorException(behavior.getReferenceName()));
            List<Node<O, A>> roots = nested.getRoots();
            if (roots.isEmpty()) {
                callGraph.markFailure(callNode);
                return Optional.empty();
            }
            callGraph.markCalled(callNode);
            pushCandidates(callNode, roots, nested);
            return Optional.empty();
        }

        @Override
        public Optional<A> visitEmpty(EmptyNode<O, A> empty) {
            if (failIfRevisited(empty)) {
                return Optional.empty();
            }
            List<Node<O, A>> successors = current.getGraph().getSuccessors(empty);
            if (successors.isEmpty()) {
                callGraph.markFailure(current.getCallNode());
                return Optional.empty();
            }
            callGraph.markCalled(current.getCallNode());
            pushCandidates(current.getCallNode(), successors, current.getGraph());
            return Optional.empty();
        }

        /** Fails the current entry if its node already appears further up the path within the same graph. */
        private boolean failIfRevisited(Node<O, A> node) {
            CallNode callNode = current.getCallNode();
            if (!callGraph.hasAncestorInSameGraph(callNode)) {
                return false;
            }
            LOGGER.debug("Node '{}' at {} loops back on itself", node, callNode);
            callGraph.markFailure(callNode);
            return true;
        }
    }

    public BehaviorGraph<O, A> getGraph() {
        return graph;
    }

    public O getObservation() {
        return observation;
    }

    /** The action the evaluation resolved to. */
    public A getAction() {
        return action;
    }

    /** The complete trace of the evaluation. */
    public CallGraph<O, A> getCallGraph() {
        return callGraph;
    }

    /** The number of entries popped from the frontier before the action was found. */
    public long getPopCount() {
        return popCount;
    }
}
