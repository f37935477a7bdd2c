/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

/** Indicates that a computed log-probability is not a number (or positive infinity): a modeling or numerical bug. */
public class NumericValidityException extends ModelException {
    private static final long serialVersionUID = 1;

    public NumericValidityException(String message) {
        super(message);
    }
}
