/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

/** Indicates that a Stochastic was asked to draw a value but was never given a way to do so. */
public class NoRandomCapabilityException extends ModelException {
    private static final long serialVersionUID = 1;

    public NoRandomCapabilityException(String message) {
        super(message);
    }
}
