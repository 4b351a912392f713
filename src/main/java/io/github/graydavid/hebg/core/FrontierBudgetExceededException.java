/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.hebg.core;

/** Thrown when an evaluation pops more frontier entries than {@link CallOptions#getFrontierPopBudget()} allows. */
public class FrontierBudgetExceededException extends RuntimeException {
    private static final long serialVersionUID = 1;

    public FrontierBudgetExceededException(long budget) {
        super("Exceeded the frontier pop budget of " + budget + " without resolving an action");
    }
}
