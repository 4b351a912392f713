/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.unrolling;

import java.util.Objects;

/** Settings for {@link Unrolling#unroll(io.github.graydavid.hebg.core.BehaviorGraph, UnrollOptions)}. */
public class UnrollOptions {
    public static final String DEFAULT_SEPARATOR = ">";

    private static final UnrollOptions DEFAULTS = builder().build();

    private final boolean addPrefix;
    private final boolean cutLoopingAlternatives;
    private final String separator;

    private UnrollOptions(Builder builder) {
        this.addPrefix = builder.addPrefix;
        this.cutLoopingAlternatives = builder.cutLoopingAlternatives;
        this.separator = builder.separator;
    }

    /** Prefixes inlined nodes, keeps looping behaviors as leaves, and uses {@link #DEFAULT_SEPARATOR}. */
    public static UnrollOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Whether to rename the nodes of an inlined graph (with more than one node) to "behavior name" + separator + "node
     * name". This keeps several inlined copies of the same behavior apart.
     */
    public boolean isAddPrefix() {
        return addPrefix;
    }

    /**
     * Whether to drop behaviors found to loop back on a behavior that's being unrolled, along with any branch that
     * becomes impossible without them. If false, such behaviors are kept as leaves.
     */
    public boolean isCutLoopingAlternatives() {
        return cutLoopingAlternatives;
    }

    public String getSeparator() {
        return separator;
    }

    @Override
    public String toString() {
        return "UnrollOptions[addPrefix=" + addPrefix + ", cutLoopingAlternatives=" + cutLoopingAlternatives
                + ", separator=" + separator + "]";
    }

    public static class Builder {
        private boolean addPrefix = true;
        private boolean cutLoopingAlternatives = false;
        private String separator = DEFAULT_SEPARATOR;

        private Builder() {}

        public Builder addPrefix(boolean addPrefix) {
            this.addPrefix = addPrefix;
            return this;
        }

        public Builder cutLoopingAlternatives(boolean cutLoopingAlternatives) {
            this.cutLoopingAlternatives = cutLoopingAlternatives;
            return this;
        }

        public Builder separator(String separator) {
            this.separator = Objects.requireNonNull(separator);
            return this;
        }

        public UnrollOptions build() {
            return new UnrollOptions(this);
        }
    }
}
