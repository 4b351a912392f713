/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A thread-safe mapping from behavior name to {@link Behavior}, used to resolve name-only references. Registries are
 * typically shared by every graph of a library of behaviors, which makes it possible for behaviors to refer to each
 * other (even circularly) without building each other's graphs at construction time. Since graphs only hold a
 * reference to the registry, behaviors can be registered after the graphs that need them are built.
 */
public class BehaviorRegistry<O, A> {
    private final ConcurrentHashMap<String, Behavior<O, A>> behaviors;

    public BehaviorRegistry() {
        this.behaviors = new ConcurrentHashMap<>();
    }

    /** Creates a registry holding all of the given behaviors, under their reference names. */
    public static <O, A> BehaviorRegistry<O, A> of(Collection<Behavior<O, A>> behaviors) {
        BehaviorRegistry<O, A> registry = new BehaviorRegistry<>();
        behaviors.forEach(registry::register);
        return registry;
    }

    /** Registers behavior under its reference name, replacing any behavior already registered under that name. */
    public BehaviorRegistry<O, A> register(Behavior<O, A> behavior) {
        behaviors.put(behavior.getReferenceName(), behavior);
        return this;
    }

    public Optional<Behavior<O, A>> find(String name) {
        return Optional.ofNullable(behaviors.get(Objects.requireNonNull(name)));
    }

    public boolean contains(String name) {
        return behaviors.containsKey(name);
    }

    public Collection<Behavior<O, A>> getAll() {
        return List.copyOf(behaviors.values());
    }

    @Override
    public String toString() {
        return "BehaviorRegistry" + behaviors.keySet();
    }
}
