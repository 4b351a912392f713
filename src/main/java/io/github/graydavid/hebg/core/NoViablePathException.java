/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

/** Thrown when the frontier of an evaluation empties before any candidate resolved to an action. */
public class NoViablePathException extends RuntimeException {
    private static final long serialVersionUID = 1;

    public NoViablePathException(String message) {
        super(message);
    }
}
