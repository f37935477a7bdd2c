/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

/** Indicates an attempt to overwrite the observed portion of a Stochastic flagged as data. */
public class DataIsFixedException extends ModelException {
    private static final long serialVersionUID = 1;

    public DataIsFixedException(String message) {
        super(message);
    }
}
