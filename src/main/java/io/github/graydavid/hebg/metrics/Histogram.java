/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.metrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import io.github.graydavid.hebg.core.Node;

/**
 * An immutable count of how many times each node is used. Nodes are kept in the order they were first counted, and
 * nodes with a zero count are never stored. Equality depends on the counts alone, not the order.
 */
public final class Histogram<O, A> {
    private static final Histogram<?, ?> EMPTY = new Histogram<>(new LinkedHashMap<>());

    private final Map<Node<O, A>, Integer> counts;

    private Histogram(LinkedHashMap<Node<O, A>, Integer> counts) {
        this.counts = Collections.unmodifiableMap(counts);
    }

    @SuppressWarnings("unchecked")
    public static <O, A> Histogram<O, A> empty() {
        return (Histogram<O, A>) EMPTY;
    }

    /** @throws IllegalArgumentException if count is negative. */
    public static <O, A> Histogram<O, A> of(Node<O, A> node, int count) {
        return Histogram.<O, A>empty().plus(node, count);
    }

    /**
     * Creates a histogram from counts, iterated in its own order.
     * 
     * @throws IllegalArgumentException if any count is negative.
     */
    public static <O, A> Histogram<O, A> of(Map<? extends Node<O, A>, Integer> counts) {
        Histogram<O, A> histogram = empty();
        for (Map.Entry<? extends Node<O, A>, Integer> entry : counts.entrySet()) {
            histogram = histogram.plus(entry.getKey(), entry.getValue());
        }
        return histogram;
    }

    /** Returns node's count, or 0 if node isn't present. */
    public int getCount(Node<O, A> node) {
        return counts.getOrDefault(node, 0);
    }

    public boolean contains(Node<O, A> node) {
        return counts.containsKey(node);
    }

    public Set<Node<O, A>> getNodes() {
        return counts.keySet();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /** The sum of all counts. */
    public int getTotal() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Map<Node<O, A>, Integer> asMap() {
        return counts;
    }

    /** Returns a histogram with other's counts added to this one's. Nodes new to this histogram go at the end. */
    public Histogram<O, A> plus(Histogram<O, A> other) {
        if (other.isEmpty()) {
            return this;
        }
        LinkedHashMap<Node<O, A>, Integer> sum = new LinkedHashMap<>(counts);
        other.counts.forEach((node, count) -> sum.merge(node, count, Integer::sum));
        return new Histogram<>(sum);
    }

    /** @throws IllegalArgumentException if count is negative. */
    public Histogram<O, A> plus(Node<O, A> node, int count) {
        Objects.requireNonNull(node);
        requireNonNegative(count);
        if (count == 0) {
            return this;
        }
        LinkedHashMap<Node<O, A>, Integer> sum = new LinkedHashMap<>(counts);
        sum.merge(node, count, Integer::sum);
        return new Histogram<>(sum);
    }

    /**
     * Returns a histogram with every count multiplied by factor.
     * 
     * @throws IllegalArgumentException if factor is negative.
     */
    public Histogram<O, A> times(int factor) {
        requireNonNegative(factor);
        if (factor == 0) {
            return empty();
        }
        LinkedHashMap<Node<O, A>, Integer> product = new LinkedHashMap<>();
        counts.forEach((node, count) -> product.put(node, count * factor));
        return new Histogram<>(product);
    }

    /** Returns a histogram without node. */
    public Histogram<O, A> without(Node<O, A> node) {
        if (!counts.containsKey(node)) {
            return this;
        }
        LinkedHashMap<Node<O, A>, Integer> remaining = new LinkedHashMap<>(counts);
        remaining.remove(node);
        return new Histogram<>(remaining);
    }

    private static void requireNonNegative(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Histogram counts must be non-negative but found: " + count);
        }
    }

    @Override
    public boolean equals(Object object) {
        if (!(object instanceof Histogram)) {
            return false;
        }

        Histogram<?, ?> other = (Histogram<?, ?>) object;
        return counts.equals(other.counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}
