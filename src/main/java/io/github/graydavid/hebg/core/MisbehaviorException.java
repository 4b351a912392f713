/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

/**
 * Indicates that some user-provided implementation (a feature condition, a graph factory) is not meeting its contract.
 * The presence of this exception should be treated seriously, since graphs can't be evaluated or analyzed faithfully
 * while the faulty implementations exist.
 */
public class MisbehaviorException extends RuntimeException {
    private static final long serialVersionUID = 1;

    public MisbehaviorException(String message) {
        super(message);
    }
}
