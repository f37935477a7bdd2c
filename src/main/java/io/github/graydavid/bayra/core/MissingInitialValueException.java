/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

/** Indicates that a Stochastic has no initial value (or missing entries in it) and no way to draw one. */
public class MissingInitialValueException extends ModelException {
    private static final long serialVersionUID = 1;

    public MissingInitialValueException(String message) {
        super(message);
    }
}
