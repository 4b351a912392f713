/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

/** Thrown when a feature condition returns a branch index that none of its outgoing edges carries. */
public class InvalidBranchIndexException extends RuntimeException {
    private static final long serialVersionUID = 1;

    private final int index;

    public InvalidBranchIndexException(FeatureCondition<?, ?> featureCondition, int index) {
        super(String.format("Feature condition '%s' returned index '%s' but no outgoing edge has that index",
                featureCondition, index));
        this.index = index;
    }

    public int getIndex() {
        return index;
    }
}
