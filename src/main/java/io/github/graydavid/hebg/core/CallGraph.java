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
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The trace of one evaluation: a tree of {@link CallNode}s, rooted at the subject behavior of the evaluated graph, where
 * each trace node points back at the {@link Node} it was created for and carries a {@link CallEdgeStatus}. A CallGraph
 * belongs to exactly one {@link GraphCall}. It's only modified while that call runs, after which it's a read-only
 * record of everything the call explored, including the dead ends.
 */
public class CallGraph<O, A> {
    private final Map<CallNode, Node<O, A>> nodes;
    private final Map<CallNode, CallNode> parents;
    private final Map<CallNode, List<CallNode>> children;
    private final Map<CallNode, CallEdgeStatus> statuses;
    private final CallNode root;
    private int branchCount;

    CallGraph(Behavior<O, A> subject) {
        this.nodes = new LinkedHashMap<>();
        this.parents = new LinkedHashMap<>();
        this.children = new LinkedHashMap<>();
        this.statuses = new LinkedHashMap<>();
        this.root = new CallNode(0, 0);
        this.branchCount = 0;
        nodes.put(root, Objects.requireNonNull(subject));
        children.put(root, new ArrayList<>());
        statuses.put(root, CallEdgeStatus.CALLED);
    }

    /**
     * Registers candidates as UNEXPLORED children of parent. The first candidate continues parent's branch and every
     * other candidate starts a new one.
     */
    List<CallNode> addCandidates(CallNode parent, List<Node<O, A>> candidates) {
        requireContains(parent);
        List<CallNode> added = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); ++i) {
            int branch = (i == 0) ? parent.getBranch() : ++branchCount;
            CallNode child = new CallNode(branch, parent.getRank() + 1);
            nodes.put(child, candidates.get(i));
            parents.put(child, parent);
            children.put(child, new ArrayList<>());
            children.get(parent).add(child);
            statuses.put(child, CallEdgeStatus.UNEXPLORED);
            added.add(child);
        }
        return added;
    }

    void markCalled(CallNode node) {
        requireContains(node);
        statuses.put(node, CallEdgeStatus.CALLED);
    }

    /** Marks node as failed, then does the same for every ancestor all of whose children have now failed. */
    void markFailure(CallNode node) {
        requireContains(node);
        CallNode current = node;
        while (current != null) {
            statuses.put(current, CallEdgeStatus.FAILURE);
            CallNode parent = parents.get(current);
            if (parent == null || !allChildrenFailed(parent)) {
                return;
            }
            current = parent;
        }
    }

    private boolean allChildrenFailed(CallNode parent) {
        return children.get(parent).stream().allMatch(child -> statuses.get(child) == CallEdgeStatus.FAILURE);
    }

    /** Answers whether a proper ancestor of node was created for a behavior with the given reference name. */
    boolean hasAncestorBehavior(CallNode node, String referenceName) {
        requireContains(node);
        for (CallNode ancestor = parents.get(node); ancestor != null; ancestor = parents.get(ancestor)) {
            Node<O, A> ancestorNode = nodes.get(ancestor);
            if (ancestorNode instanceof Behavior
                    && ((Behavior<O, A>) ancestorNode).getReferenceName().equals(referenceName)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Answers whether a proper ancestor of node was created for the same graph node within the same graph, that is,
     * below the nearest behavior ancestor, which is the one whose graph node belongs to.
     */
    boolean hasAncestorInSameGraph(CallNode node) {
        requireContains(node);
        Node<O, A> graphNode = nodes.get(node);
        for (CallNode ancestor = parents.get(node); ancestor != null; ancestor = parents.get(ancestor)) {
            Node<O, A> ancestorNode = nodes.get(ancestor);
            if (ancestorNode instanceof Behavior) {
                return false;
            }
            if (ancestorNode.equals(graphNode)) {
                return true;
            }
        }
        return false;
    }

    public CallNode getRoot() {
        return root;
    }

    /** Returns all trace nodes in the order they were registered. */
    public List<CallNode> getNodes() {
        return List.copyOf(nodes.keySet());
    }

    /** Returns the graph node that trace node was created for. */
    public Node<O, A> getNode(CallNode node) {
        requireContains(node);
        return nodes.get(node);
    }

    /** The display label of node: the name of the graph node it was created for. */
    public String getLabel(CallNode node) {
        return getNode(node).getName();
    }

    /** Returns node's parent, or an empty Optional for the root. */
    public Optional<CallNode> getParent(CallNode node) {
        requireContains(node);
        return Optional.ofNullable(parents.get(node));
    }

    public List<CallNode> getChildren(CallNode node) {
        requireContains(node);
        return Collections.unmodifiableList(new ArrayList<>(children.get(node)));
    }

    public CallEdgeStatus getStatus(CallNode node) {
        requireContains(node);
        return statuses.get(node);
    }

    /** Returns every parent -> child edge in the order the children were registered. */
    public List<CallEdge> getEdges() {
        return parents.entrySet()
                .stream()
                .map(entry -> new CallEdge(entry.getValue(), entry.getKey(), statuses.get(entry.getKey())))
                .collect(Collectors.toUnmodifiableList());
    }

    /** Returns the (parent label, child label) pairs of every edge, in edge order. */
    public Set<Map.Entry<String, String>> getEdgeLabels() {
        Set<Map.Entry<String, String>> labels = new LinkedHashSet<>();
        parents.forEach((child, parent) -> labels.add(Map.entry(getLabel(parent), getLabel(child))));
        return Collections.unmodifiableSet(labels);
    }

    private void requireContains(CallNode node) {
        if (!nodes.containsKey(node)) {
            throw new IllegalArgumentException("Trace node " + node + " is not part of this call graph");
        }
    }

    @Override
    public String toString() {
        return nodes.keySet()
                .stream()
                .map(node -> node + " " + getLabel(node) + " " + statuses.get(node))
                .collect(Collectors.joining(", ", "CallGraph[", "]"));
    }
}
