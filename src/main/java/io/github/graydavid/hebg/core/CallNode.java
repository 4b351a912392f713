/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

/**
 * A position in the call tree unfolded by one evaluation. The branch distinguishes sibling alternatives (every
 * candidate after the first starts a new branch) and the rank is the depth below the root. Together they are unique
 * within a {@link CallGraph}.
 */
public final class CallNode {
    private final int branch;
    private final int rank;

    public CallNode(int branch, int rank) {
        this.branch = branch;
        this.rank = rank;
    }

    public int getBranch() {
        return branch;
    }

    public int getRank() {
        return rank;
    }

    @Override
    public boolean equals(Object object) {
        if (!(object instanceof CallNode)) {
            return false;
        }

        CallNode other = (CallNode) object;
        return this.branch == other.branch && this.rank == other.rank;
    }

    @Override
    public int hashCode() {
        return 31 * branch + rank;
    }

    @Override
    public String toString() {
        return "(" + branch + ", " + rank + ")";
    }
}
