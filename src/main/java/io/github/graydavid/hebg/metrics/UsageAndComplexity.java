/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.metrics;

import java.util.Objects;

/** A histogram of the nodes a graph (or part of one) uses, along with the total complexity of using them. */
public class UsageAndComplexity<O, A> {
    private final Histogram<O, A> histogram;
    private final double complexity;

    public UsageAndComplexity(Histogram<O, A> histogram, double complexity) {
        this.histogram = Objects.requireNonNull(histogram);
        this.complexity = complexity;
    }

    public Histogram<O, A> getHistogram() {
        return histogram;
    }

    /** The summed complexity. Infinite if the only way through loops back to a behavior being searched. */
    public double getComplexity() {
        return complexity;
    }

    @Override
    public boolean equals(Object object) {
        if (!(object instanceof UsageAndComplexity)) {
            return false;
        }

        UsageAndComplexity<?, ?> other = (UsageAndComplexity<?, ?>) object;
        return histogram.equals(other.histogram) && Double.compare(complexity, other.complexity) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(histogram, complexity);
    }

    @Override
    public String toString() {
        return "UsageAndComplexity[histogram=" + histogram + ", complexity=" + complexity + "]";
    }
}
