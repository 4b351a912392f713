/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

import java.util.OptionalLong;

/** Settings for a single {@link GraphCall}. */
public class CallOptions {
    private static final CallOptions DEFAULTS = builder().build();

    private final OptionalLong frontierPopBudget;

    private CallOptions(Builder builder) {
        this.frontierPopBudget = builder.frontierPopBudget;
    }

    /** No frontier pop budget. */
    public static CallOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The maximum number of entries an evaluation may pop from its frontier before giving up with a
     * {@link FrontierBudgetExceededException}. Empty means unbounded.
     */
    public OptionalLong getFrontierPopBudget() {
        return frontierPopBudget;
    }

    @Override
    public String toString() {
        return "CallOptions[frontierPopBudget=" + frontierPopBudget + "]";
    }

    public static class Builder {
        private OptionalLong frontierPopBudget = OptionalLong.empty();

        private Builder() {}

        /** @throws IllegalArgumentException if budget is negative. */
        public Builder frontierPopBudget(long budget) {
            if (budget < 0) {
                throw new IllegalArgumentException("Frontier pop budget must be non-negative but found: " + budget);
            }
            this.frontierPopBudget = OptionalLong.of(budget);
            return this;
        }

        public CallOptions build() {
            return new CallOptions(this);
        }
    }
}
