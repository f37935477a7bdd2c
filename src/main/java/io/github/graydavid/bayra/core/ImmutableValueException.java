/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

/** Indicates an attempt to set the value of a Node whose value is derived, like a Deterministic. */
public class ImmutableValueException extends ModelException {
    private static final long serialVersionUID = 1;

    public ImmutableValueException(String message) {
        super(message);
    }
}
