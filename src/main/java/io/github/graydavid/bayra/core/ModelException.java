/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

/**
 * The base class for all failures that Bayra raises while building, mutating, or reading a model. Every subclass
 * describes one specific way that a model's current state or a caller's request violates a Node's contract.
 */
public class ModelException extends RuntimeException {
    private static final long serialVersionUID = 1;

    public ModelException(String message) {
        super(message);
    }

    public ModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
