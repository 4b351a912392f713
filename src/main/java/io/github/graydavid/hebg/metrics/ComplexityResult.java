/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.metrics;

/** The net complexity of a behavior, along with how much complexity reuse saved to get there. */
public class ComplexityResult {
    private final double complexity;
    private final double saved;

    public ComplexityResult(double complexity, double saved) {
        this.complexity = complexity;
        this.saved = saved;
    }

    /** The raw summed complexity minus {@link #getSaved()}. */
    public double getComplexity() {
        return complexity;
    }

    public double getSaved() {
        return saved;
    }

    @Override
    public boolean equals(Object object) {
        if (!(object instanceof ComplexityResult)) {
            return false;
        }

        ComplexityResult other = (ComplexityResult) object;
        return Double.compare(complexity, other.complexity) == 0 && Double.compare(saved, other.saved) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(complexity) + Double.hashCode(saved);
    }

    @Override
    public String toString() {
        return "ComplexityResult[complexity=" + complexity + ", saved=" + saved + "]";
    }
}
