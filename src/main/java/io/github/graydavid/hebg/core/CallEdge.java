/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

import java.util.Objects;

/** A parent -> child connection in a {@link CallGraph}, with the status of the child at the time it was read. */
public final class CallEdge {
    private final CallNode parent;
    private final CallNode child;
    private final CallEdgeStatus status;

    CallEdge(CallNode parent, CallNode child, CallEdgeStatus status) {
        this.parent = Objects.requireNonNull(parent);
        this.child = Objects.requireNonNull(child);
        this.status = Objects.requireNonNull(status);
    }

    public CallNode getParent() {
        return parent;
    }

    public CallNode getChild() {
        return child;
    }

    public CallEdgeStatus getStatus() {
        return status;
    }

    @Override
    public boolean equals(Object object) {
        if (!(object instanceof CallEdge)) {
            return false;
        }

        CallEdge other = (CallEdge) object;
        return parent.equals(other.parent) && child.equals(other.child) && status == other.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(parent, child, status);
    }

    @Override
    public String toString() {
        return parent + "-[" + status + "]->" + child;
    }
}
