/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.requirements;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import io.github.graydavid.hebg.core.Behavior;
import io.github.graydavid.hebg.core.IndexedGraph;
import io.github.graydavid.hebg.core.Levels;

/**
 * An immutable, acyclic graph of which behaviors require which others. Each behavior has a level: 0 if it requires
 * nothing, and otherwise one more than the highest level among its requirements, since a behavior needs all of them
 * (see {@link Levels#computeAllRequired}).
 */
public class RequirementGraph<O, A> implements IndexedGraph<Behavior<O, A>> {
    private final Map<Behavior<O, A>, List<RequirementEdge<O, A>>> outgoing;
    private final Map<Behavior<O, A>, List<RequirementEdge<O, A>>> incoming;
    private final Levels<Behavior<O, A>> levels;

    /** @throws io.github.graydavid.hebg.core.CyclicStructureException if the requirements form a cycle. */
    RequirementGraph(Set<Behavior<O, A>> behaviors, List<RequirementEdge<O, A>> edges) {
        this.outgoing = new LinkedHashMap<>();
        this.incoming = new LinkedHashMap<>();
        for (Behavior<O, A> behavior : behaviors) {
            outgoing.put(behavior, new ArrayList<>());
            incoming.put(behavior, new ArrayList<>());
        }
        for (RequirementEdge<O, A> edge : edges) {
            outgoing.get(edge.getFrom()).add(edge);
            incoming.get(edge.getTo()).add(edge);
        }
        this.levels = Levels.computeAllRequired(this);
    }

    @Override
    public Set<Behavior<O, A>> getNodes() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(outgoing.keySet()));
    }

    public List<RequirementEdge<O, A>> getEdges() {
        return outgoing.values().stream().flatMap(List::stream).collect(Collectors.toUnmodifiableList());
    }

    @Override
    public List<RequirementEdge<O, A>> getOutgoingEdges(Behavior<O, A> behavior) {
        return List.copyOf(require(outgoing, behavior));
    }

    @Override
    public List<RequirementEdge<O, A>> getIncomingEdges(Behavior<O, A> behavior) {
        return List.copyOf(require(incoming, behavior));
    }

    /** Returns whether dependent directly requires requirement. */
    public boolean hasEdge(Behavior<O, A> requirement, Behavior<O, A> dependent) {
        List<RequirementEdge<O, A>> edges = outgoing.get(requirement);
        return edges != null && edges.stream().anyMatch(edge -> edge.getTo().equals(dependent));
    }

    /** Returns the behaviors that behavior directly requires. */
    public List<Behavior<O, A>> getRequirementsOf(Behavior<O, A> behavior) {
        return getIncomingEdges(behavior).stream()
                .map(RequirementEdge::getFrom)
                .collect(Collectors.toUnmodifiableList());
    }

    /** Returns the behaviors that directly require behavior. */
    public List<Behavior<O, A>> getDependentsOf(Behavior<O, A> behavior) {
        return getOutgoingEdges(behavior).stream()
                .map(RequirementEdge::getTo)
                .collect(Collectors.toUnmodifiableList());
    }

    public int getLevel(Behavior<O, A> behavior) {
        return levels.getLevel(behavior);
    }

    public Levels<Behavior<O, A>> getLevels() {
        return levels;
    }

    private static <O, A> List<RequirementEdge<O, A>> require(
            Map<Behavior<O, A>, List<RequirementEdge<O, A>>> edges, Behavior<O, A> behavior) {
        List<RequirementEdge<O, A>> found = edges.get(behavior);
        if (found == null) {
            throw new IllegalArgumentException("Behavior '" + behavior + "' is not part of this requirement graph");
        }
        return found;
    }

    @Override
    public String toString() {
        return "RequirementGraph" + getEdges();
    }
}
